package autowarm.engine.executor;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Executors by task kind.
 */
public final class ExecutorRegistry {
    private final Map<String, TaskExecutor> executors = new ConcurrentHashMap<>();

    public ExecutorRegistry register(TaskExecutor executor) {
        TaskExecutor previous = executors.putIfAbsent(executor.kind(), executor);
        if (previous != null && previous != executor) {
            throw new IllegalStateException("Executor already registered for kind: " + executor.kind());
        }
        return this;
    }

    public Optional<TaskExecutor> findByKind(String kind) {
        return Optional.ofNullable(executors.get(kind));
    }

    public Collection<String> kinds() {
        return executors.keySet();
    }
}
