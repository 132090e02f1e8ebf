package uk.gegc.recall.features.scheduling.application;

import uk.gegc.recall.features.scheduling.config.SchedulingProperties;
import uk.gegc.recall.features.scheduling.domain.model.MemoryUpdate;

/**
 * Computes the next (stability, difficulty) pair after a review.
 *
 * <p>Correct answer:
 * <pre>
 *   D' = D - correctDelta * (D - minD) / (maxD - minD)
 *   S' = S * (1 + growthRate * (maxD + 1 - D) * S^-decay * exp(retrievabilityWeight * (1 - R)))
 * </pre>
 * Incorrect answer:
 * <pre>
 *   D' = D + incorrectDelta * (maxD - D) / (maxD - minD)
 *   S' = min(S, S * lapseRetention * (maxD + 1 - D) / maxD)
 * </pre>
 * Stability growth uses the difficulty held before this review. Both outputs
 * are clamped to their configured ranges.
 */
public class MemoryStateUpdater {

    private final double minStability;
    private final double maxStability;
    private final double minDifficulty;
    private final double maxDifficulty;
    private final double growthRate;
    private final double decay;
    private final double retrievabilityWeight;
    private final double lapseRetention;
    private final double correctDelta;
    private final double incorrectDelta;

    public MemoryStateUpdater(SchedulingProperties properties) {
        SchedulingProperties.Stability stability = properties.getStability();
        SchedulingProperties.Difficulty difficulty = properties.getDifficulty();
        this.minStability = stability.getMin();
        this.maxStability = stability.getMax();
        this.growthRate = stability.getGrowthRate();
        this.decay = stability.getDecay();
        this.retrievabilityWeight = stability.getRetrievabilityWeight();
        this.lapseRetention = stability.getLapseRetention();
        this.minDifficulty = difficulty.getMin();
        this.maxDifficulty = difficulty.getMax();
        this.correctDelta = difficulty.getCorrectDelta();
        this.incorrectDelta = difficulty.getIncorrectDelta();
    }

    public MemoryUpdate update(double stability, double difficulty, double retrievability, boolean correct) {
        double s = clampStability(stability);
        double d = clampDifficulty(difficulty);
        double r = clampRetrievability(retrievability);

        return correct
                ? new MemoryUpdate(clampStability(stabilityAfterRecall(s, d, r)), clampDifficulty(easier(d)))
                : new MemoryUpdate(clampStability(stabilityAfterLapse(s, d)), clampDifficulty(harder(d)));
    }

    double stabilityAfterRecall(double s, double d, double r) {
        double growth = growthRate
                * (maxDifficulty + 1 - d)
                * Math.pow(s, -decay)
                * Math.exp(retrievabilityWeight * (1 - r));
        return s * (1 + growth);
    }

    double stabilityAfterLapse(double s, double d) {
        double retained = s * lapseRetention * (maxDifficulty + 1 - d) / maxDifficulty;
        return Math.min(s, retained);
    }

    private double easier(double d) {
        return d - correctDelta * (d - minDifficulty) / (maxDifficulty - minDifficulty);
    }

    private double harder(double d) {
        return d + incorrectDelta * (maxDifficulty - d) / (maxDifficulty - minDifficulty);
    }

    public double clampStability(double s) {
        if (Double.isNaN(s)) {
            return minStability;
        }
        return Math.min(maxStability, Math.max(minStability, s));
    }

    public double clampDifficulty(double d) {
        if (Double.isNaN(d)) {
            return maxDifficulty;
        }
        return Math.min(maxDifficulty, Math.max(minDifficulty, d));
    }

    public boolean isStabilityInRange(double s) {
        return s >= minStability && s <= maxStability;
    }

    public boolean isDifficultyInRange(double d) {
        return d >= minDifficulty && d <= maxDifficulty;
    }

    private static double clampRetrievability(double r) {
        if (Double.isNaN(r)) {
            return 1.0;
        }
        return Math.min(1.0, Math.max(0.0, r));
    }
}
