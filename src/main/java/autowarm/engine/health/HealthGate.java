package autowarm.engine.health;

import autowarm.engine.model.TaskSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Switches a task to passive mode when its resource looks risky or unhealthy.
 *
 * Passive when {@code risk >= riskThreshold} or {@code health < healthThreshold}.
 * A scorer that fails also yields passive mode; the gate itself never throws
 * because of a scorer.
 */
public class HealthGate {

    private static final Logger log = LoggerFactory.getLogger(HealthGate.class);

    private final RiskScorer riskScorer;
    private final HealthScorer healthScorer;
    private final double riskThreshold;
    private final double healthThreshold;

    public HealthGate(RiskScorer riskScorer, HealthScorer healthScorer, double riskThreshold,
            double healthThreshold) {
        this.riskScorer = Objects.requireNonNull(riskScorer, "riskScorer");
        this.healthScorer = Objects.requireNonNull(healthScorer, "healthScorer");
        this.riskThreshold = riskThreshold;
        this.healthThreshold = healthThreshold;
    }

    /**
     * @return settings with force_passive set, or the given settings unchanged
     */
    public TaskSettings decide(long resourceId, TaskSettings settings) {
        double risk;
        double health;
        try {
            risk = riskScorer.score(resourceId);
            health = healthScorer.score(resourceId);
        } catch (Exception e) {
            log.warn("Scoring failed for resource {}, using passive mode: {}", resourceId, e.toString());
            return settings.withForcePassive(true);
        }

        if (Double.isNaN(risk) || Double.isNaN(health)) {
            log.warn("Scorer returned NaN for resource {}, using passive mode", resourceId);
            return settings.withForcePassive(true);
        }

        if (risk >= riskThreshold || health < healthThreshold) {
            log.info("High risk / low health for resource {} (risk={}, health={}), passive mode",
                    resourceId, risk, health);
            return settings.withForcePassive(true);
        }

        return settings;
    }

    public double riskThreshold() {
        return riskThreshold;
    }

    public double healthThreshold() {
        return healthThreshold;
    }
}
