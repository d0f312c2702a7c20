package autowarm.engine.health;

/**
 * Estimates the overall health (0-100, higher is better) of a resource.
 * Read-only.
 */
@FunctionalInterface
public interface HealthScorer {

    double score(long resourceId) throws Exception;
}
