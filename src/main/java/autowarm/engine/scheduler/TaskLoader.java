package autowarm.engine.scheduler;

import autowarm.engine.model.Task;
import autowarm.engine.repository.TaskRepository;
import autowarm.engine.store.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;

/**
 * Background job that feeds stored work into the scheduler.
 *
 * Picks up:
 * - PENDING tasks created by other components
 * - RUNNING tasks left over from a previous process
 * - FAILED tasks whose backoff has elapsed
 *
 * Tasks the scheduler already tracks are skipped.
 */
public class TaskLoader implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(TaskLoader.class);

    private final TaskRepository taskRepository;
    private final Scheduler scheduler;
    private final Clock clock;
    private final int batchSize;

    public TaskLoader(TaskRepository taskRepository, Scheduler scheduler, Clock clock, int batchSize) {
        this.taskRepository = taskRepository;
        this.scheduler = scheduler;
        this.clock = clock;
        this.batchSize = batchSize;
    }

    @Override
    public void run() {
        try {
            loadTasks();
        } catch (StoreException e) {
            log.warn("Task loader skipped this round: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Task loader error", e);
        }
    }

    /**
     * Load dispatchable tasks from storage and submit the untracked ones.
     *
     * @return number of tasks submitted
     */
    public int loadTasks() {
        List<Task> candidates = taskRepository.findDispatchable(clock.instant(), batchSize);

        if (candidates.isEmpty()) {
            log.debug("No dispatchable tasks in storage");
            return 0;
        }

        int submitted = 0;
        for (Task task : candidates) {
            if (scheduler.isTracked(task.id())) {
                continue;
            }
            if (scheduler.submit(task)) {
                submitted++;
            }
        }

        if (submitted > 0) {
            log.info("Task loader: {} submitted, {} candidates", submitted, candidates.size());
        }
        return submitted;
    }
}
