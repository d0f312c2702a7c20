package autowarm.engine.store;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Replication overview of the storage topology.
 *
 * @param supported       false when the primary's database cannot report replication
 * @param primaryHealthy  cached health of the primary
 * @param replicaCount    replicas in the routing set
 * @param healthyReplicas replicas currently HEALTHY
 * @param replicas        per-replica lag as seen by the primary
 * @param error           why the report is missing, if it is
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReplicationStatus(
        @JsonProperty("supported") boolean supported,
        @JsonProperty("primaryHealthy") boolean primaryHealthy,
        @JsonProperty("replicaCount") int replicaCount,
        @JsonProperty("healthyReplicas") int healthyReplicas,
        @JsonProperty("replicas") List<ReplicaLag> replicas,
        @JsonProperty("error") String error) {

    static ReplicationStatus failed(boolean primaryHealthy, int replicaCount, int healthyReplicas, String error) {
        return new ReplicationStatus(true, primaryHealthy, replicaCount, healthyReplicas, List.of(), error);
    }
}
