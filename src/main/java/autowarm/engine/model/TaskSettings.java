package autowarm.engine.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Executor settings of a task, persisted as the settings JSON column.
 *
 * The scheduler only interprets {@code force_passive}. Keys it does not know
 * are kept in {@link #extras()} and written back unchanged, so producers can
 * add fields without a schema change here.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TaskSettings {

    @JsonProperty("force_passive")
    private Boolean forcePassive;

    @JsonProperty("warmup_speed")
    private String speed;

    // Informational; the owner of record is Task.ownerId
    @JsonProperty("user_id")
    private Long userId;

    private final Map<String, Object> extras = new LinkedHashMap<>();

    private TaskSettings() {
    }

    public static TaskSettings empty() {
        return new TaskSettings();
    }

    public static TaskSettings of(String speed) {
        TaskSettings settings = new TaskSettings();
        settings.speed = speed;
        return settings;
    }

    public boolean forcePassive() {
        return Boolean.TRUE.equals(forcePassive);
    }

    public String speed() {
        return speed;
    }

    public Long userId() {
        return userId;
    }

    @JsonAnyGetter
    public Map<String, Object> extras() {
        return Collections.unmodifiableMap(extras);
    }

    @JsonAnySetter
    private void putExtra(String key, Object value) {
        extras.put(key, value);
    }

    /** Copy with the passive-mode flag set. */
    public TaskSettings withForcePassive(boolean passive) {
        TaskSettings copy = copy();
        copy.forcePassive = passive;
        return copy;
    }

    public TaskSettings withSpeed(String speed) {
        TaskSettings copy = copy();
        copy.speed = speed;
        return copy;
    }

    public TaskSettings withUserId(Long userId) {
        TaskSettings copy = copy();
        copy.userId = userId;
        return copy;
    }

    public TaskSettings withExtra(String key, Object value) {
        TaskSettings copy = copy();
        copy.extras.put(key, value);
        return copy;
    }

    private TaskSettings copy() {
        TaskSettings copy = new TaskSettings();
        copy.forcePassive = forcePassive;
        copy.speed = speed;
        copy.userId = userId;
        copy.extras.putAll(extras);
        return copy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskSettings that))
            return false;
        return Objects.equals(forcePassive, that.forcePassive)
                && Objects.equals(speed, that.speed)
                && Objects.equals(userId, that.userId)
                && extras.equals(that.extras);
    }

    @Override
    public int hashCode() {
        return Objects.hash(forcePassive, speed, userId, extras);
    }

    @Override
    public String toString() {
        return "TaskSettings{forcePassive=" + forcePassive + ", speed='" + speed + "', userId=" + userId + ", extras=" + extras.keySet() + '}';
    }
}
