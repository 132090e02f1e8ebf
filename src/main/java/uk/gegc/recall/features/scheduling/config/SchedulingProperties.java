package uk.gegc.recall.features.scheduling.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Tunable constants of the forgetting-curve scheduler.
 *
 * <p>Coefficients are calibration values, not correctness requirements. Any
 * positive values keep the updater monotonic: stability grows more for lower
 * retrievability and less for higher difficulty.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.scheduling")
public class SchedulingProperties {

    /** Retrievability at which the next review is placed. */
    @DecimalMin(value = "0.0", inclusive = false)
    @DecimalMax(value = "1.0", inclusive = false)
    private double targetRetention = 0.9;

    /** Throw on corrupt stored state instead of clamping and logging. */
    private boolean strictInvariants = false;

    @Valid
    private Stability stability = new Stability();

    @Valid
    private Difficulty difficulty = new Difficulty();

    @Valid
    private Intervals intervals = new Intervals();

    @Data
    public static class Stability {
        @Positive
        private double min = 0.1;
        @Positive
        private double max = 36500.0;
        /** Seed stability after a correct first review. */
        @Positive
        private double initialCorrect = 2.3;
        /** Seed stability after an incorrect first review. */
        @Positive
        private double initialIncorrect = 0.4;
        @Positive
        private double growthRate = 0.4;
        @Positive
        private double decay = 0.2;
        @Positive
        private double retrievabilityWeight = 1.5;
        /** Fraction of stability kept on a lapse, scaled down further for harder cards. */
        @Positive
        @DecimalMax("1.0")
        private double lapseRetention = 0.5;

        @AssertTrue(message = "stability bounds must satisfy min <= initial values <= max")
        public boolean isOrdered() {
            return min <= initialIncorrect && min <= initialCorrect
                    && initialCorrect <= max && initialIncorrect <= max;
        }
    }

    @Data
    public static class Difficulty {
        @Positive
        private double min = 1.0;
        @Positive
        private double max = 10.0;
        /** Difficulty assigned when a card leaves the new state. */
        @Positive
        private double initial = 5.0;
        @Positive
        private double correctDelta = 0.6;
        @Positive
        private double incorrectDelta = 2.0;

        @AssertTrue(message = "difficulty bounds must satisfy min < max and min <= initial <= max")
        public boolean isOrdered() {
            return min < max && initial >= min && initial <= max;
        }
    }

    @Data
    public static class Intervals {
        /** Candidate interval a short-term card must reach to move to review. */
        @Positive
        private double graduationDays = 1.0;
        @Positive
        private double minimumReviewDays = 0.25;
        @Positive
        private double maximumDays = 365.0;
        private Duration learningStep = Duration.ofMinutes(10);
        private Duration learningRetryStep = Duration.ofMinutes(1);
        private Duration relearningStep = Duration.ofMinutes(10);

        @AssertTrue(message = "interval bounds must satisfy minimumReviewDays <= maximumDays")
        public boolean isOrdered() {
            return minimumReviewDays <= maximumDays;
        }

        @AssertTrue(message = "learning and relearning steps must be positive")
        public boolean isStepsPositive() {
            return isPositive(learningStep) && isPositive(learningRetryStep) && isPositive(relearningStep);
        }

        private static boolean isPositive(Duration step) {
            return step != null && !step.isNegative() && !step.isZero();
        }
    }
}
