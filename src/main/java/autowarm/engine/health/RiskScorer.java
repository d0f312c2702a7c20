package autowarm.engine.health;

/**
 * Estimates the risk (0-100, higher is worse) that acting on a resource gets it restricted.
 * Read-only.
 */
@FunctionalInterface
public interface RiskScorer {

    double score(long resourceId) throws Exception;
}
