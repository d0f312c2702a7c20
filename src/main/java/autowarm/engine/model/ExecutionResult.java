package autowarm.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Outcome of one executor session, stored as progress.last_session_results.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionResult(
        @JsonProperty("actions_performed") Map<String, Integer> actionsPerformed,
        @JsonProperty("errors") List<String> errors,
        @JsonProperty("session_metadata") Map<String, Object> sessionMetadata) {

    /** Metadata key an executor may set to move the task to another phase */
    public static final String CURRENT_PHASE = "current_phase";

    public ExecutionResult {
        actionsPerformed = actionsPerformed == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(actionsPerformed));
        errors = errors == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(errors));
        sessionMetadata = sessionMetadata == null ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(sessionMetadata));
    }

    public static ExecutionResult empty() {
        return new ExecutionResult(Map.of(), List.of(), Map.of());
    }

    /** Phase reported by the executor, or null if it did not report one */
    public String reportedPhase() {
        Object phase = sessionMetadata.get(CURRENT_PHASE);
        return phase instanceof String s && !s.isBlank() ? s : null;
    }

    public int totalActions() {
        return actionsPerformed.values().stream().filter(Objects::nonNull).mapToInt(Integer::intValue).sum();
    }
}
