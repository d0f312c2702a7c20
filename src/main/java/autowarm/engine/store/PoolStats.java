package autowarm.engine.store;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Connection pool utilization of one endpoint.
 */
public record PoolStats(
        @JsonProperty("name") String name,
        @JsonProperty("role") EndpointRole role,
        @JsonProperty("state") EndpointState state,
        @JsonProperty("active") int active,
        @JsonProperty("idle") int idle,
        @JsonProperty("total") int total,
        @JsonProperty("awaiting") int awaiting,
        @JsonProperty("maxConnections") int maxConnections) {
}
