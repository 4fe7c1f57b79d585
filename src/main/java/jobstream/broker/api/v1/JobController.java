package jobstream.broker.api.v1;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.netty.channel.ChannelHandlerContext;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.QueryStringDecoder;
import jobstream.broker.api.Controller;
import jobstream.broker.api.v1.dto.CreateJobRequest;
import jobstream.broker.api.v1.dto.JobResponse;
import jobstream.broker.api.v1.dto.SnapshotResponse;
import jobstream.broker.model.Job;
import jobstream.broker.model.JobEvent;
import jobstream.broker.repository.StoreUnavailableException;
import jobstream.broker.server.RouterHandler;
import jobstream.broker.service.JobLifecycleTracker;
import jobstream.broker.stream.StreamManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Controller for job registration and status (public API).
 *
 * POST /api/v1/jobs - Register a job
 * GET /api/v1/jobs?clientId=..&limit=.. - List a client's recent jobs
 * GET /api/v1/jobs/{jobId} - Get job status
 * GET /api/v1/jobs/{jobId}/snapshot?after=N&limit=M - Status plus a page of events
 */
public class JobController implements Controller {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    private static final Pattern JOBS_PATTERN = Pattern.compile("^/api/v1/jobs$");
    private static final Pattern JOB_BY_ID_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)$");
    private static final Pattern JOB_SNAPSHOT_PATTERN = Pattern.compile("^/api/v1/jobs/([^/]+)/snapshot$");

    static final int DEFAULT_LIST_LIMIT = 20;
    static final int MAX_LIST_LIMIT = 200;
    static final int DEFAULT_SNAPSHOT_LIMIT = 500;
    static final int MAX_SNAPSHOT_LIMIT = 5000;

    private final JobLifecycleTracker tracker;
    private final StreamManager streams;

    public JobController(JobLifecycleTracker tracker, StreamManager streams) {
        this.tracker = tracker;
        this.streams = streams;
    }

    @Override
    public boolean matches(HttpMethod method, String path) {
        if (JOBS_PATTERN.matcher(path).matches()) {
            return method.equals(HttpMethod.POST) || method.equals(HttpMethod.GET);
        }
        if (method.equals(HttpMethod.GET)) {
            return JOB_BY_ID_PATTERN.matcher(path).matches() ||
                    JOB_SNAPSHOT_PATTERN.matcher(path).matches();
        }
        return false;
    }

    @Override
    public ControllerResponse handle(ChannelHandlerContext ctx, FullHttpRequest req, String path) {
        try {
            if (JOBS_PATTERN.matcher(path).matches()) {
                return req.method().equals(HttpMethod.POST) ? handleCreateJob(req) : handleListJobs(req);
            }

            Matcher snapshotMatcher = JOB_SNAPSHOT_PATTERN.matcher(path);
            if (snapshotMatcher.matches()) {
                return handleSnapshot(req, RouterHandler.decodePathSegment(snapshotMatcher.group(1)));
            }

            Matcher jobMatcher = JOB_BY_ID_PATTERN.matcher(path);
            if (jobMatcher.matches()) {
                return handleGetJob(RouterHandler.decodePathSegment(jobMatcher.group(1)));
            }

            return ControllerResponse.notFound("unknown job endpoint");

        } catch (IllegalArgumentException e) {
            return ControllerResponse.badRequest(e.getMessage());
        } catch (IllegalStateException e) {
            return ControllerResponse.conflict(e.getMessage());
        } catch (StoreUnavailableException e) {
            log.warn("Job endpoint {} failed: {}", path, e.getMessage());
            return ControllerResponse.unavailable("event store unavailable");
        } catch (JsonProcessingException e) {
            return ControllerResponse.badRequest("invalid JSON body: " + e.getOriginalMessage());
        } catch (Exception e) {
            log.error("Job controller error", e);
            return ControllerResponse.error("internal error");
        }
    }

    /**
     * POST /api/v1/jobs - Register a job
     */
    private ControllerResponse handleCreateJob(FullHttpRequest req) throws Exception {
        String body = req.content().toString(StandardCharsets.UTF_8);
        CreateJobRequest request = body.isBlank()
                ? CreateJobRequest.empty()
                : RouterHandler.mapper().readValue(body, CreateJobRequest.class);

        request.validate();

        Job job = tracker.register(request.jobId(), request.clientId());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("success", true);
        response.put("jobId", job.id());
        response.put("status", job.status().wireName());
        response.put("streamUrl", "/api/v1/jobs/" + job.id() + "/stream");
        response.put("snapshotUrl", "/api/v1/jobs/" + job.id() + "/snapshot");

        return ControllerResponse.json(
                HttpResponseStatus.CREATED,
                RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/jobs?clientId=..&limit=.. - List a client's recent jobs
     */
    private ControllerResponse handleListJobs(FullHttpRequest req) throws Exception {
        QueryStringDecoder query = new QueryStringDecoder(req.uri());
        String clientId = RouterHandler.queryParam(query, "clientId");
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("clientId is required");
        }
        int limit = RouterHandler.intParam(query, "limit", DEFAULT_LIST_LIMIT, 1, MAX_LIST_LIMIT);

        List<JobResponse> jobs = tracker.listByClient(clientId, limit).stream()
                .map(JobResponse::from)
                .toList();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("clientId", clientId);
        response.put("count", tracker.countByClient(clientId));
        response.put("jobs", jobs);

        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/jobs/{jobId} - Get job status
     */
    private ControllerResponse handleGetJob(String jobId) throws Exception {
        Optional<Job> jobOpt = tracker.find(jobId);

        if (jobOpt.isEmpty()) {
            return ControllerResponse.notFound("job not found");
        }

        JobResponse response = JobResponse.from(jobOpt.get());
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }

    /**
     * GET /api/v1/jobs/{jobId}/snapshot - Status plus events after a cursor
     */
    private ControllerResponse handleSnapshot(FullHttpRequest req, String jobId) throws Exception {
        QueryStringDecoder query = new QueryStringDecoder(req.uri());
        long after = RouterHandler.longParam(query, "after", 0);
        if (after < 0) {
            throw new IllegalArgumentException("after must not be negative");
        }
        int limit = RouterHandler.intParam(query, "limit", DEFAULT_SNAPSHOT_LIMIT, 1, MAX_SNAPSHOT_LIMIT);

        Optional<Job> jobOpt = tracker.find(jobId);
        if (jobOpt.isEmpty()) {
            return ControllerResponse.notFound("job not found");
        }

        List<JobEvent> events = streams.readWindow(jobId, after, limit);
        SnapshotResponse response = SnapshotResponse.of(jobOpt.get(), events);
        return ControllerResponse.json(RouterHandler.mapper().writeValueAsString(response));
    }
}
