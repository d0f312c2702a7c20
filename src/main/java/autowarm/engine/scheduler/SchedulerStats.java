package autowarm.engine.scheduler;

import java.util.Map;

/**
 * Point-in-time scheduler counters.
 */
public record SchedulerStats(
        boolean running,
        int queued,
        int inFlight,
        int maxWorkers,
        int activeResources,
        Map<Long, Integer> activeByOwner,
        long completed,
        long failed,
        long requeued) {
}
