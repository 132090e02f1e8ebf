package uk.gegc.recall.features.scheduling.application;

import uk.gegc.recall.features.scheduling.config.SchedulingProperties;

import java.time.Duration;
import java.time.Instant;

/**
 * Converts stability into a review delay by inverting the forgetting curve:
 * the interval after which retrievability decays to exactly the target.
 *
 * <pre>
 *   scheduledDays = stability * log2(1 / targetRetention)
 * </pre>
 */
public class IntervalCalculator {

    private static final double LN_2 = Math.log(2);
    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final double targetRetention;
    private final double graduationDays;
    private final double minimumReviewDays;
    private final double maximumDays;
    private final Duration learningStep;
    private final Duration learningRetryStep;
    private final Duration relearningStep;

    public IntervalCalculator(SchedulingProperties properties) {
        SchedulingProperties.Intervals intervals = properties.getIntervals();
        this.targetRetention = properties.getTargetRetention();
        this.graduationDays = intervals.getGraduationDays();
        this.minimumReviewDays = intervals.getMinimumReviewDays();
        this.maximumDays = intervals.getMaximumDays();
        this.learningStep = intervals.getLearningStep();
        this.learningRetryStep = intervals.getLearningRetryStep();
        this.relearningStep = intervals.getRelearningStep();
    }

    public static double scheduledDays(double stability, double targetRetention) {
        if (!(targetRetention > 0 && targetRetention < 1)) {
            throw new IllegalArgumentException("targetRetention must be in (0, 1), was " + targetRetention);
        }
        if (!(stability > 0)) {
            return 0.0;
        }
        return stability * (Math.log(1 / targetRetention) / LN_2);
    }

    /** Unbounded interval at the configured target retention. */
    public double candidateDays(double stability) {
        return scheduledDays(stability, targetRetention);
    }

    /** Interval for a card in review, floored and capped. */
    public double reviewDays(double stability) {
        double days = candidateDays(stability);
        return Math.min(maximumDays, Math.max(minimumReviewDays, days));
    }

    public boolean graduates(double candidateDays) {
        return candidateDays >= graduationDays;
    }

    public double learningStepDays() {
        return toDays(learningStep);
    }

    public double learningRetryDays() {
        return toDays(learningRetryStep);
    }

    public double relearningStepDays() {
        return toDays(relearningStep);
    }

    public static Instant nextReviewAt(Instant answeredAt, double scheduledDays) {
        long millis = Math.round(scheduledDays * MILLIS_PER_DAY);
        return answeredAt.plusMillis(Math.max(0L, millis));
    }

    private static double toDays(Duration step) {
        return step.toMillis() / MILLIS_PER_DAY;
    }
}
