package jobstream.broker.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("database") String database,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("eventLog") String eventLog,
        @JsonProperty("openStreams") Integer openStreams,
        @JsonProperty("liveSubscribers") Integer liveSubscribers,
        @JsonProperty("cachedJobs") Integer cachedJobs) {

    public static HealthResponse healthy(String uptime, String version, String eventLog, int openStreams,
            int liveSubscribers, int cachedJobs) {
        return new HealthResponse("healthy", "ok", uptime, version, eventLog, openStreams, liveSubscribers,
                cachedJobs);
    }

    public static HealthResponse unhealthy(String database) {
        return new HealthResponse("unhealthy", database, null, null, null, null, null, null);
    }
}
