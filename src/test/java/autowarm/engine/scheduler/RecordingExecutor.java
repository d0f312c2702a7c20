package autowarm.engine.scheduler;

import autowarm.engine.executor.TaskExecutionException;
import autowarm.engine.executor.TaskExecutor;
import autowarm.engine.model.ExecutionResult;
import autowarm.engine.model.Task;
import autowarm.engine.model.TaskSettings;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executor that records its calls and can be held at a gate.
 */
final class RecordingExecutor implements TaskExecutor {

    final List<Long> invocations = new CopyOnWriteArrayList<>();
    final List<TaskSettings> settingsSeen = new CopyOnWriteArrayList<>();
    final AtomicInteger maxRunning = new AtomicInteger();
    final AtomicBoolean resourceOverlap = new AtomicBoolean();
    final AtomicBoolean interrupted = new AtomicBoolean();

    private final AtomicInteger running = new AtomicInteger();
    private final Set<Long> activeResources = ConcurrentHashMap.newKeySet();
    private volatile CountDownLatch gate = new CountDownLatch(0);
    private volatile String failure;
    private volatile Runnable onExecute = () -> {
    };

    @Override
    public String kind() {
        return Task.DEFAULT_KIND;
    }

    /** Hold every execution until {@link #release()}. */
    void block() {
        gate = new CountDownLatch(1);
    }

    void release() {
        gate.countDown();
    }

    void failWith(String message) {
        failure = message;
    }

    void succeed() {
        failure = null;
    }

    void onExecute(Runnable hook) {
        onExecute = hook;
    }

    int running() {
        return running.get();
    }

    @Override
    public ExecutionResult execute(long resourceId, TaskSettings settings) throws TaskExecutionException {
        invocations.add(resourceId);
        settingsSeen.add(settings);
        if (!activeResources.add(resourceId)) {
            resourceOverlap.set(true);
        }
        maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);

        CountDownLatch current = gate;
        try {
            onExecute.run();
            if (!current.await(10, TimeUnit.SECONDS)) {
                throw new TaskExecutionException("gate never opened");
            }
            String message = failure;
            if (message != null) {
                throw new TaskExecutionException(message);
            }
            return new ExecutionResult(Map.of("views", 1), List.of(), Map.of());
        } catch (InterruptedException e) {
            interrupted.set(true);
            Thread.currentThread().interrupt();
            throw new TaskExecutionException("interrupted", e);
        } finally {
            running.decrementAndGet();
            activeResources.remove(resourceId);
        }
    }
}
