package jobstream;

import jobstream.broker.config.BrokerConfig;
import jobstream.broker.server.BrokerNettyServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CountDownLatch;

/**
 * Broker entry point.
 *
 * Reads JOBSTREAM_* settings from the environment, starts the HTTP server
 * and blocks until the JVM is asked to shut down.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) throws InterruptedException {
        BrokerConfig config = BrokerConfig.fromEnv();
        int port = args.length > 0 ? Integer.parseInt(args[0]) : config.serverPort();

        log.info("Starting job stream broker on port {}...", port);
        if (!BrokerNettyServer.start(port, config)) {
            log.error("Broker did not start");
            System.exit(1);
        }

        CountDownLatch stopped = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested, stopping broker...");
            BrokerNettyServer.stop();
            stopped.countDown();
        }, "jobstream-shutdown"));

        stopped.await();
    }
}
