package uk.gegc.recall.features.scheduling.application;

import uk.gegc.recall.features.scheduling.domain.model.CardState;

/**
 * One step of the card lifecycle:
 *
 * <pre>
 *   NEW        --any-------------------------> LEARNING
 *   LEARNING   --correct, interval >= grad---> REVIEW
 *   LEARNING   --correct, interval <  grad---> LEARNING   (learning step)
 *   LEARNING   --incorrect-------------------> LEARNING   (retry step)
 *   REVIEW     --correct---------------------> REVIEW
 *   REVIEW     --incorrect-------------------> RELEARNING (lapse)
 *   RELEARNING --correct, interval >= grad---> REVIEW
 *   RELEARNING --otherwise-------------------> RELEARNING (relearning step)
 * </pre>
 */
public class CardStateMachine {

    private final IntervalCalculator intervals;

    public CardStateMachine(IntervalCalculator intervals) {
        this.intervals = intervals;
    }

    /**
     * @param stability stability after this review's update
     */
    public Transition next(CardState current, boolean correct, double stability) {
        if (current == null) {
            throw new IllegalArgumentException("current state must not be null");
        }
        return switch (current) {
            case NEW -> new Transition(
                    CardState.LEARNING,
                    correct ? intervals.learningStepDays() : intervals.learningRetryDays(),
                    false);
            case LEARNING -> fromLearning(correct, stability);
            case REVIEW -> correct
                    ? new Transition(CardState.REVIEW, intervals.reviewDays(stability), false)
                    : new Transition(CardState.RELEARNING, intervals.relearningStepDays(), true);
            case RELEARNING -> fromRelearning(correct, stability);
        };
    }

    private Transition fromLearning(boolean correct, double stability) {
        if (!correct) {
            return new Transition(CardState.LEARNING, intervals.learningRetryDays(), false);
        }
        double candidate = intervals.candidateDays(stability);
        if (intervals.graduates(candidate)) {
            return new Transition(CardState.REVIEW, intervals.reviewDays(stability), false);
        }
        return new Transition(CardState.LEARNING, intervals.learningStepDays(), false);
    }

    private Transition fromRelearning(boolean correct, double stability) {
        if (correct) {
            double candidate = intervals.candidateDays(stability);
            if (intervals.graduates(candidate)) {
                return new Transition(CardState.REVIEW, intervals.reviewDays(stability), false);
            }
        }
        return new Transition(CardState.RELEARNING, intervals.relearningStepDays(), false);
    }

    /**
     * @param lapse true only on the review to relearning edge
     */
    public record Transition(CardState state, double scheduledDays, boolean lapse) {
    }
}
