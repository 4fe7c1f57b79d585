package jobstream.broker.server;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.WriteBufferWaterMark;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import jobstream.broker.config.BrokerConfig;
import jobstream.broker.config.Dependencies;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Process-wide HTTP server: one broker instance per JVM.
 */
public final class BrokerNettyServer {

    private static final Logger log = LoggerFactory.getLogger(BrokerNettyServer.class);

    private static volatile boolean running = false;
    private static Channel serverChannel;
    private static EventLoopGroup bossGroup;
    private static EventLoopGroup workerGroup;
    private static Dependencies dependencies;

    private BrokerNettyServer() {
    }

    /** HTTP pipeline; no idle timeout, streams stay open between heartbeats */
    public static ChannelHandler pipelineInitializer(RouterHandler router) {
        return new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                ChannelPipeline p = ch.pipeline();
                p.addLast(new HttpServerCodec());
                p.addLast(new HttpObjectAggregator(1024 * 1024));
                p.addLast(router);
            }
        };
    }

    public static synchronized boolean start(int port, BrokerConfig config) {
        if (running) {
            return true;
        }
        try {
            dependencies = Dependencies.create(config);
            bossGroup = new NioEventLoopGroup(1);
            workerGroup = new NioEventLoopGroup();

            ServerBootstrap b = new ServerBootstrap()
                    .group(bossGroup, workerGroup)
                    .channel(NioServerSocketChannel.class)
                    .childOption(ChannelOption.TCP_NODELAY, true)
                    .childOption(ChannelOption.WRITE_BUFFER_WATER_MARK, new WriteBufferWaterMark(
                            config.writeBufferLowWaterMark(), config.writeBufferHighWaterMark()))
                    .childHandler(pipelineInitializer(dependencies.routerHandler()));

            serverChannel = b.bind(config.serverHost(), port).syncUninterruptibly().channel();
            dependencies.startScheduler();
            running = true;
            log.info("Broker started on {}:{}", config.serverHost(), port);
            return true;
        } catch (Throwable t) {
            log.error("Start error: {}", t.getMessage(), t);
            shutdown();
            return false;
        }
    }

    public static synchronized boolean start(BrokerConfig config) {
        return start(config.serverPort(), config);
    }

    public static synchronized void stop() {
        if (!running) {
            return;
        }
        shutdown();
        log.info("Broker stopped");
    }

    private static void shutdown() {
        try {
            if (serverChannel != null) {
                serverChannel.close().syncUninterruptibly();
                serverChannel = null;
            }
            if (dependencies != null) {
                dependencies.close();
            }
        } finally {
            if (workerGroup != null) {
                workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
                workerGroup = null;
            }
            if (bossGroup != null) {
                bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
                bossGroup = null;
            }
            dependencies = null;
            running = false;
        }
    }

    public static boolean isRunning() {
        return running;
    }

    /** Wiring of the running instance, or null when stopped. */
    public static Dependencies dependencies() {
        return dependencies;
    }
}
