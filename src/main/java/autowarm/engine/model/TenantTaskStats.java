package autowarm.engine.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Per-tenant task and resource counters.
 */
public record TenantTaskStats(
        @JsonProperty("ownerId") long ownerId,
        @JsonProperty("pending") int pending,
        @JsonProperty("running") int running,
        @JsonProperty("completed") int completed,
        @JsonProperty("failed") int failed,
        @JsonProperty("resources") int resources,
        @JsonProperty("activeResources") int activeResources) {

    public int totalTasks() {
        return pending + running + completed + failed;
    }
}
