package autowarm.engine.store;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Point-in-time snapshot of an endpoint's cached health.
 */
public record EndpointHealth(
        @JsonProperty("name") String name,
        @JsonProperty("address") String address,
        @JsonProperty("role") EndpointRole role,
        @JsonProperty("state") EndpointState state,
        @JsonProperty("lastCheckedAt") Instant lastCheckedAt) {

    public boolean healthy() {
        return state == EndpointState.HEALTHY;
    }
}
