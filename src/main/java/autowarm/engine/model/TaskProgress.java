package autowarm.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Progress of a task across sessions, persisted as the progress JSON column.
 *
 * {@code next_attempt_at} is present only while a failed task is backing off.
 * New fields must be optional; unknown keys from newer writers are ignored.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TaskProgress {

    private final int sessionsCount;
    private final String currentPhase;
    private final Instant lastSessionAt;
    private final ExecutionResult lastSessionResults;
    private final Instant nextAttemptAt;

    @JsonCreator
    public TaskProgress(
            @JsonProperty("sessions_count") int sessionsCount,
            @JsonProperty("current_phase") String currentPhase,
            @JsonProperty("last_session_at") Instant lastSessionAt,
            @JsonProperty("last_session_results") ExecutionResult lastSessionResults,
            @JsonProperty("next_attempt_at") Instant nextAttemptAt) {
        this.sessionsCount = sessionsCount;
        this.currentPhase = currentPhase;
        this.lastSessionAt = lastSessionAt;
        this.lastSessionResults = lastSessionResults;
        this.nextAttemptAt = nextAttemptAt;
    }

    public static TaskProgress initial() {
        return new TaskProgress(0, null, null, null, null);
    }

    @JsonProperty("sessions_count")
    public int sessionsCount() {
        return sessionsCount;
    }

    @JsonProperty("current_phase")
    public String currentPhase() {
        return currentPhase;
    }

    @JsonProperty("last_session_at")
    public Instant lastSessionAt() {
        return lastSessionAt;
    }

    @JsonProperty("last_session_results")
    public ExecutionResult lastSessionResults() {
        return lastSessionResults;
    }

    @JsonProperty("next_attempt_at")
    public Instant nextAttemptAt() {
        return nextAttemptAt;
    }

    /** True while backing off, i.e. next_attempt_at is set and later than {@code now}. */
    public boolean isBackingOff(Instant now) {
        return nextAttemptAt != null && nextAttemptAt.isAfter(now);
    }

    /**
     * Progress after a successful session: count incremented, phase taken from
     * the result when reported, backoff cleared.
     */
    public TaskProgress afterSession(ExecutionResult result, Instant finishedAt) {
        String phase = result.reportedPhase() != null ? result.reportedPhase() : currentPhase;
        return new TaskProgress(sessionsCount + 1, phase, finishedAt, result, null);
    }

    public TaskProgress withNextAttemptAt(Instant nextAttemptAt) {
        return new TaskProgress(sessionsCount, currentPhase, lastSessionAt, lastSessionResults, nextAttemptAt);
    }

    public TaskProgress withCurrentPhase(String currentPhase) {
        return new TaskProgress(sessionsCount, currentPhase, lastSessionAt, lastSessionResults, nextAttemptAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskProgress that))
            return false;
        return sessionsCount == that.sessionsCount
                && Objects.equals(currentPhase, that.currentPhase)
                && Objects.equals(lastSessionAt, that.lastSessionAt)
                && Objects.equals(lastSessionResults, that.lastSessionResults)
                && Objects.equals(nextAttemptAt, that.nextAttemptAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessionsCount, currentPhase, lastSessionAt, lastSessionResults, nextAttemptAt);
    }

    @Override
    public String toString() {
        return "TaskProgress{sessions=" + sessionsCount + ", phase='" + currentPhase + "', nextAttemptAt="
                + nextAttemptAt + '}';
    }
}
