package jobstream.broker.api.internal.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import jobstream.broker.api.Controller;
import jobstream.broker.api.internal.v1.dto.EmitEventRequest;
import jobstream.broker.api.internal.v1.dto.EmitEventResponse;
import jobstream.broker.model.JobEvent;
import jobstream.broker.repository.StoreUnavailableException;
import jobstream.broker.server.RouterHandler;
import jobstream.broker.service.JobClosedException;
import jobstream.broker.service.UnknownJobException;
import jobstream.broker.stream.StreamManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for producers publishing job events (internal API).
 * POST /internal/v1/jobs/{jobId}/events - Append one event and fan it out
 */
public class EventController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(EventController.class);

    private static final Pattern EVENTS_PATTERN = Pattern.compile("^/internal/v1/jobs/([^/]+)/events$");

    private final StreamManager streams;

    public EventController(StreamManager streams) {
        this.streams = streams;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        return method.equals(HttpMethod.POST) && EVENTS_PATTERN.matcher(path).matches();
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        Matcher matcher = EVENTS_PATTERN.matcher(path);
        if (!matcher.matches()) {
            return ControllerResponse.notFound("unknown event endpoint");
        }
        String jobId = RouterHandler.decodePathSegment(matcher.group(1));

        try {
            String body = req.content().toString(StandardCharsets.UTF_8);
            if (body.isBlank()) {
                throw new IllegalArgumentException("request body is required");
            }
            EmitEventRequest request = RouterHandler.mapper().readValue(body, EmitEventRequest.class);

            request.validate();

            JobEvent event = streams.emit(jobId, request.eventType(), request.payload());

            return ControllerResponse.json(
                    HttpResponseStatus.CREATED,
                    RouterHandler.mapper().writeValueAsString(EmitEventResponse.from(event)));

        } catch (UnknownJobException e) {
            return ControllerResponse.notFound("job not found");
        } catch (JobClosedException e) {
            log.warn("Rejected {} for job {}: job is {}", e.rejected().wireName(), jobId, e.status().wireName());
            return ControllerResponse.conflict(e.getMessage());
        } catch (StoreUnavailableException e) {
            log.warn("Append for job {} failed: {}", jobId, e.getMessage());
            return ControllerResponse.unavailable("event store unavailable");
        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON body: " + e.getOriginalMessage());
        } catch (Exception e) {
            log.error("Event controller error", e);
            return ControllerResponse.error("internal error");
        }
    }
}
