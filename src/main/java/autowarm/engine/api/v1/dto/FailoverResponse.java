package autowarm.engine.api.v1.dto;

import autowarm.engine.store.EndpointHealth;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * POST /api/v1/storage/failover
 */
public record FailoverResponse(
        @JsonProperty("promoted") EndpointHealth promoted,
        @JsonProperty("message") String message) {
}
