package jobstream.broker.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.QueryStringDecoder;
import jobstream.broker.api.Controller.ControllerResponse;
import jobstream.broker.api.StreamController;
import jobstream.broker.config.BrokerConfig;
import jobstream.broker.model.Job;
import jobstream.broker.repository.StoreUnavailableException;
import jobstream.broker.server.RouterHandler;
import jobstream.broker.server.SseEventSink;
import jobstream.broker.server.SseFrames;
import jobstream.broker.service.JobLifecycleTracker;
import jobstream.broker.stream.StreamSession;
import jobstream.broker.stream.StreamSessions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Server-Sent Events stream of one job.
 * GET /api/v1/jobs/{jobId}/stream
 *
 * The resume cursor comes from the {@code Last-Event-ID} header, else the
 * {@code after} query parameter, else 0 (full replay).
 */
public class StreamEndpointController implements StreamController {

    private static final Logger log = LoggerFactory.getLogger(StreamEndpointController.class);

    private static final Pattern STREAM_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/stream$");
    static final String LAST_EVENT_ID = "Last-Event-ID";

    private final JobLifecycleTracker tracker;
    private final StreamSessions sessions;
    private final SseFrames frames;
    private final long retryMillis;

    public StreamEndpointController(JobLifecycleTracker tracker, StreamSessions sessions, BrokerConfig config) {
        this.tracker = tracker;
        this.sessions = sessions;
        this.frames = new SseFrames(config.ssePaddingBytes());
        this.retryMillis = config.sseRetry().toMillis();
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && STREAM_PATTERN.matcher(path).matches();
    }

    @Override
    public Optional<ControllerResponse> attach(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Matcher matcher = STREAM_PATTERN.matcher(path);
        if (!matcher.matches()) {
            return Optional.of(ControllerResponse.notFound("unknown stream endpoint"));
        }
        String jobId = RouterHandler.decodePathSegment(matcher.group(1));

        long cursor;
        try {
            cursor = resolveCursor(req);
        } catch (IllegalArgumentException e) {
            return Optional.of(ControllerResponse.badRequest(e.getMessage()));
        }

        Optional<Job> job;
        try {
            job = tracker.find(jobId);
        } catch (StoreUnavailableException e) {
            log.warn("Cannot open stream for job {}: {}", jobId, e.getMessage());
            return Optional.of(ControllerResponse.unavailable("event store unavailable"));
        }
        if (job.isEmpty()) {
            return Optional.of(ControllerResponse.notFound("job not found"));
        }

        SseEventSink sink = new SseEventSink(ctx.channel(), frames);
        sink.begin(retryMillis);
        StreamSession session = sessions.open(jobId, cursor, sink);
        sink.bind(session);
        log.debug("Stream attached for job {} after seq {} from {}", jobId, cursor, ctx.channel().remoteAddress());
        return Optional.empty();
    }

    /**
     * Last-Event-ID wins over {@code after}; both must be non-negative integers.
     */
    static long resolveCursor(FullHttpRequest req) {
        String header = req.headers().get(LAST_EVENT_ID);
        if (header != null && !header.isBlank()) {
            return parseCursor(header, LAST_EVENT_ID);
        }
        String after = RouterHandler.queryParam(new QueryStringDecoder(req.uri()), "after");
        if (after != null && !after.isBlank()) {
            return parseCursor(after, "after");
        }
        return 0;
    }

    private static long parseCursor(String value, String name) {
        long cursor;
        try {
            cursor = Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + value);
        }
        if (cursor < 0) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
        return cursor;
    }
}
