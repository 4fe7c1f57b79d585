package jobstream.broker.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelHandler.Sharable;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.*;
import jobstream.broker.api.Controller;
import jobstream.broker.api.Controller.ControllerResponse;
import jobstream.broker.api.StreamController;
import jobstream.broker.config.BrokerConfig;
import jobstream.broker.repository.StoreUnavailableException;
import jobstream.broker.service.JobClosedException;
import jobstream.broker.service.UnknownJobException;
import jobstream.broker.stream.StreamSession;
import jobstream.broker.util.Json;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static io.netty.handler.codec.http.HttpHeaderNames.CONTENT_TYPE;
import static io.netty.handler.codec.http.HttpResponseStatus.*;
import static io.netty.handler.codec.http.HttpVersion.HTTP_1_1;

/**
 * Central router that dispatches HTTP requests to registered controllers.
 *
 * Only handles versioned API endpoints:
 * - /api/v1/* (public API)
 * - /internal/v1/* (producer API, guarded by X-Jobstream-Key when a key is configured)
 *
 * All other endpoints return 404. Stream controllers take over the channel
 * for a chunked response; their sessions are kept in a channel attribute,
 * so this handler stays @Sharable.
 */
@Sharable
public class RouterHandler extends SimpleChannelInboundHandler<FullHttpRequest> {

    private static final Logger log = LoggerFactory.getLogger(RouterHandler.class);

    static final String KEY_HEADER = "X-Jobstream-Key";

    private final List<Controller> controllers = new ArrayList<>();
    private final List<StreamController> streamControllers = new ArrayList<>();
    private final BrokerConfig config;

    public RouterHandler(BrokerConfig config) {
        this.config = config;
    }

    /**
     * Register a controller to handle requests.
     * Controllers are checked in order of registration.
     */
    public RouterHandler registerController(Controller controller) {
        controllers.add(controller);
        log.debug("Registered controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    public RouterHandler registerStreamController(StreamController controller) {
        streamControllers.add(controller);
        log.debug("Registered stream controller: {}", controller.getClass().getSimpleName());
        return this;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest req) {
        String uri = req.uri();
        HttpMethod method = req.method();

        // Extract path without query string
        String path = uri.contains("?") ? uri.substring(0, uri.indexOf("?")) : uri;

        try {
            if (!checkAuth(req, path)) {
                log.warn("Auth failed for {} {}", method, path);
                writeSafe(ctx, FORBIDDEN, "application/json", "{\"error\":\"forbidden\"}");
                return;
            }

            for (StreamController controller : streamControllers) {
                if (controller.matches(method, path)) {
                    Optional<ControllerResponse> refused = controller.attach(ctx, req, path);
                    refused.ifPresent(r -> writeSafe(ctx, r.status(), r.contentType(), r.body()));
                    return;
                }
            }

            for (Controller controller : controllers) {
                if (controller.matches(method, path)) {
                    ControllerResponse response = controller.handle(ctx, req, path);
                    writeSafe(ctx, response.status(), response.contentType(), response.body());
                    return;
                }
            }

            log.debug("No handler for: {} {}", method, path);
            writeSafe(ctx, NOT_FOUND, "application/json", "{\"error\":\"not found\"}");

        } catch (UnknownJobException e) {
            writeError(ctx, NOT_FOUND, e.getMessage());
        } catch (JobClosedException e) {
            writeError(ctx, CONFLICT, e.getMessage());
        } catch (StoreUnavailableException e) {
            log.warn("Store unavailable for {} {}: {}", method, path, e.getMessage());
            writeError(ctx, SERVICE_UNAVAILABLE, "event store unavailable");
        } catch (IllegalArgumentException e) {
            log.warn("Validation error: {}", e.getMessage());
            writeError(ctx, BAD_REQUEST, e.getMessage());
        } catch (Throwable t) {
            log.error("Handler error: {} {} - {}", method, path, t.toString(), t);

            StringBuilder errorChain = new StringBuilder(t.toString());
            Throwable cause = t.getCause();
            while (cause != null) {
                errorChain.append(" <- ").append(cause);
                cause = cause.getCause();
            }
            writeError(ctx, INTERNAL_SERVER_ERROR, errorChain.toString());
        }
    }

    @Override
    public void channelWritabilityChanged(ChannelHandlerContext ctx) throws Exception {
        StreamSession session = ctx.channel().attr(SseEventSink.SESSION).get();
        if (session != null && ctx.channel().isWritable()) {
            session.onWritable();
        }
        super.channelWritabilityChanged(ctx);
    }

    /**
     * Check if request requires and passes auth.
     */
    private boolean checkAuth(FullHttpRequest req, String path) {
        if (!config.hasProducerKey()) {
            return true;
        }

        // Only internal endpoints require auth
        if (!path.startsWith("/internal/")) {
            return true;
        }

        String providedKey = req.headers().get(KEY_HEADER);
        return config.producerKey().equals(providedKey);
    }

    private void writeError(ChannelHandlerContext ctx, HttpResponseStatus status, String message) {
        writeSafe(ctx, status, "application/json", "{\"error\":\"" + ControllerResponse.escapeJson(message) + "\"}");
    }

    /**
     * Safe write that catches any exceptions during response writing.
     * Ensures we never silently close the connection.
     */
    private void writeSafe(ChannelHandlerContext ctx, HttpResponseStatus status, String contentType, String body) {
        try {
            if (body == null) {
                body = "";
            }
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            FullHttpResponse response = new DefaultFullHttpResponse(HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
            response.headers().set(CONTENT_TYPE, contentType + "; charset=utf-8");
            response.headers().setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
            ctx.writeAndFlush(response);
        } catch (Throwable t) {
            log.error("Failed to write response: {}", t.getMessage(), t);
            ctx.close();
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        if (ctx.channel().attr(SseEventSink.SESSION).get() != null) {
            // mid-stream: the response head is already out
            log.debug("Stream channel error: {}", cause.getMessage());
            ctx.close();
            return;
        }
        log.error("Unhandled exception in channel: {}", cause.getMessage(), cause);
        try {
            writeError(ctx, INTERNAL_SERVER_ERROR, "channel error: " + cause.getMessage());
        } finally {
            ctx.close();
        }
    }

    /**
     * Get the shared ObjectMapper for JSON serialization.
     */
    public static ObjectMapper mapper() {
        return Json.mapper();
    }

    public static String decodePathSegment(String segment) {
        return URLDecoder.decode(segment, StandardCharsets.UTF_8);
    }

    /** First value of a query parameter, or null. */
    public static String queryParam(QueryStringDecoder query, String name) {
        List<String> values = query.parameters().get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    public static long longParam(QueryStringDecoder query, String name, long defaultValue) {
        String value = queryParam(query, name);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + value);
        }
    }

    /** Integer parameter clamped to [min, max]. */
    public static int intParam(QueryStringDecoder query, String name, int defaultValue, int min, int max) {
        long value = longParam(query, name, defaultValue);
        return (int) Math.max(min, Math.min(max, value));
    }
}
