package jobstream.broker.server;

import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.handler.codec.http.DefaultHttpContent;
import io.netty.handler.codec.http.DefaultHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.LastHttpContent;
import io.netty.util.AttributeKey;
import jobstream.broker.model.JobEvent;
import jobstream.broker.model.JobStatus;
import jobstream.broker.stream.EventSink;
import jobstream.broker.stream.StreamSession;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicBoolean;

import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Chunked {@code text/event-stream} response on one Netty channel.
 * The channel's event loop is the session's serial executor, so writes
 * keep the order in which the session makes them.
 */
public final class SseEventSink implements EventSink {

    /** Session streaming on a channel, for writability and close callbacks. */
    public static final AttributeKey<StreamSession> SESSION = AttributeKey.valueOf("jobstream.session");

    private final Channel channel;
    private final SseFrames frames;
    private final AtomicBoolean closed = new AtomicBoolean();

    public SseEventSink(Channel channel, SseFrames frames) {
        this.channel = channel;
        this.frames = frames;
    }

    /** Write the response head and the reconnect hint. */
    public void begin(long retryMillis) {
        HttpResponse response = new DefaultHttpResponse(HTTP_1_1, HttpResponseStatus.OK);
        response.headers().set(HttpHeaderNames.CONTENT_TYPE, "text/event-stream; charset=utf-8");
        response.headers().set(HttpHeaderNames.CACHE_CONTROL, "no-cache");
        response.headers().set(HttpHeaderNames.TRANSFER_ENCODING, HttpHeaderValues.CHUNKED);
        response.headers().set("X-Accel-Buffering", "no");
        channel.write(response);
        write(frames.retry(retryMillis));
    }

    /** Route the channel's writability and close events to the session. */
    public void bind(StreamSession session) {
        channel.attr(SESSION).set(session);
        channel.closeFuture().addListener(f -> session.onDisconnect());
    }

    @Override
    public boolean isWritable() {
        return channel.isActive() && channel.isWritable();
    }

    @Override
    public void send(JobEvent event) {
        write(frames.event(event));
    }

    @Override
    public void sendHeartbeat(String jobId, long cursor) {
        write(frames.heartbeat(jobId, cursor));
    }

    @Override
    public void sendDone(String jobId, long cursor, JobStatus status) {
        write(frames.done(jobId, cursor, status));
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (channel.isActive()) {
            channel.writeAndFlush(LastHttpContent.EMPTY_LAST_CONTENT).addListener(ChannelFutureListener.CLOSE);
        } else {
            channel.close();
        }
    }

    @Override
    public void execute(Runnable task) {
        channel.eventLoop().execute(task);
    }

    private void write(String text) {
        if (closed.get() || !channel.isActive()) {
            return;
        }
        channel.writeAndFlush(new DefaultHttpContent(Unpooled.copiedBuffer(text, StandardCharsets.UTF_8)));
    }
}
