package jobstream.broker.api.v1;

import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import jobstream.broker.api.Controller;
import jobstream.broker.api.v1.dto.HealthResponse;
import jobstream.broker.config.BrokerConfig;
import jobstream.broker.server.RouterHandler;
import jobstream.broker.store.Database;
import jobstream.broker.stream.StreamManager;
import jobstream.broker.stream.StreamSessions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.Locale;

/**
 * Health check controller.
 * GET /api/v1/health
 */
public class HealthController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(HealthController.class);
    private static final String VERSION = "1.0.0";

    private final Database database;
    private final StreamManager streams;
    private final StreamSessions sessions;
    private final BrokerConfig config;

    public HealthController(Database database, StreamManager streams, StreamSessions sessions, BrokerConfig config) {
        this.database = database;
        this.streams = streams;
        this.sessions = sessions;
        this.config = config;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.GET) && "/api/v1/health".equals(path);
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            boolean dbOk = database.isHealthy();

            if (!dbOk) {
                HealthResponse response = HealthResponse.unhealthy("connection failed");
                return ControllerResponse.json(
                        HttpResponseStatus.SERVICE_UNAVAILABLE,
                        RouterHandler.mapper().writeValueAsString(response));
            }

            HealthResponse response = HealthResponse.healthy(
                    formatUptime(),
                    VERSION,
                    config.eventLogBackend().name().toLowerCase(Locale.ROOT),
                    sessions.openCount(),
                    streams.totalSubscribers(),
                    streams.cache().jobCount());

            return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));

        } catch (Exception e) {
            log.error("Health check failed", e);
            return ControllerResponse.json(
                    HttpResponseStatus.SERVICE_UNAVAILABLE,
                    RouterHandler.mapper().valueToTree(HealthResponse.unhealthy(e.getMessage())).toString());
        }
    }

    private String formatUptime() {
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        Duration duration = Duration.ofMillis(uptimeMs);
        long hours = duration.toHours();
        long minutes = duration.toMinutesPart();
        return hours + "h " + minutes + "m";
    }
}
