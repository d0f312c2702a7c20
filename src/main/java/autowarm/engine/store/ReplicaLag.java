package autowarm.engine.store;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Replication lag of one streaming replica, as reported by the primary.
 */
public record ReplicaLag(
        @JsonProperty("clientAddress") String clientAddress,
        @JsonProperty("applicationName") String applicationName,
        @JsonProperty("state") String state,
        @JsonProperty("sendLagBytes") long sendLagBytes,
        @JsonProperty("flushLagBytes") long flushLagBytes,
        @JsonProperty("replayLagBytes") long replayLagBytes) {
}
