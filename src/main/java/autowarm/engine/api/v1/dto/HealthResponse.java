package autowarm.engine.api.v1.dto;

import autowarm.engine.store.EndpointHealth;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Response DTO for health check.
 * GET /api/v1/health
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(
        @JsonProperty("status") String status,
        @JsonProperty("writable") boolean writable,
        @JsonProperty("uptime") String uptime,
        @JsonProperty("version") String version,
        @JsonProperty("endpoints") List<EndpointHealth> endpoints,
        @JsonProperty("queuedTasks") Integer queuedTasks,
        @JsonProperty("runningTasks") Integer runningTasks) {

    public static HealthResponse of(boolean writable, boolean degraded, String uptime, String version,
            List<EndpointHealth> endpoints, int queuedTasks, int runningTasks) {
        String status = !writable ? "unhealthy" : degraded ? "degraded" : "healthy";
        return new HealthResponse(status, writable, uptime, version, endpoints, queuedTasks, runningTasks);
    }
}
