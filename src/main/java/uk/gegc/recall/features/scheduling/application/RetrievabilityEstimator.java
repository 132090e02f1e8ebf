package uk.gegc.recall.features.scheduling.application;

import uk.gegc.recall.features.scheduling.domain.model.Card;
import uk.gegc.recall.features.scheduling.domain.model.CardState;

import java.time.Duration;
import java.time.Instant;
import java.util.OptionalDouble;

/**
 * Exponential forgetting curve: retrievability halves every {@code stability} days.
 *
 * <pre>
 *   R = exp(-elapsedDays / stability * ln 2)
 * </pre>
 *
 * The result always lies in {@code (0, 1]}.
 */
public class RetrievabilityEstimator {

    private static final double LN_2 = Math.log(2);
    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final double minStability;

    public RetrievabilityEstimator(double minStability) {
        if (!(minStability > 0)) {
            throw new IllegalArgumentException("minStability must be positive, was " + minStability);
        }
        this.minStability = minStability;
    }

    public double retrievability(double stability, double elapsedDays) {
        double s = stability >= minStability ? stability : minStability;
        double t = elapsedDays > 0 ? elapsedDays : 0.0;
        if (Double.isInfinite(s)) {
            return 1.0;
        }
        double r = Math.exp(-t / s * LN_2);
        if (r > 1.0) {
            return 1.0;
        }
        return Math.max(r, Double.MIN_VALUE);
    }

    /**
     * Current retrievability of a reviewed card, or empty for cards that have
     * never left the new state.
     */
    public OptionalDouble retrievability(Card card, Instant now) {
        if (card.state() == CardState.NEW || card.lastReviewAt() == null || card.stability() == null) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(retrievability(card.stability(), elapsedDays(card.lastReviewAt(), now)));
    }

    /**
     * Fractional days between two instants, clamped to zero when {@code to}
     * precedes {@code from} (clock skew, out-of-order writes).
     */
    public double elapsedDays(Instant from, Instant to) {
        if (from == null || to == null) {
            return 0.0;
        }
        long millis = Duration.between(from, to).toMillis();
        return millis > 0 ? millis / MILLIS_PER_DAY : 0.0;
    }

    public double getMinStability() {
        return minStability;
    }
}
