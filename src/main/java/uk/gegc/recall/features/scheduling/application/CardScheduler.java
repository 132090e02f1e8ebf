package uk.gegc.recall.features.scheduling.application;

import uk.gegc.recall.features.scheduling.domain.model.Card;
import uk.gegc.recall.features.scheduling.domain.model.CardState;
import uk.gegc.recall.features.scheduling.domain.model.ReviewOutcome;

import java.time.Instant;
import java.util.OptionalDouble;
import java.util.UUID;

public interface CardScheduler {

    Card initializeCard(UUID id, UUID ownerId);

    SchedulingResult review(Card card, ReviewOutcome outcome);

    default Card reviewCard(Card card, ReviewOutcome outcome) {
        return review(card, outcome).card();
    }

    double retrievability(double stability, double elapsedDays);

    OptionalDouble retrievability(Card card, Instant now);

    /**
     * @param retrievability memory strength measured at review time; {@code null} for a first review
     */
    record SchedulingResult(
            Card card,
            CardState previousState,
            Double retrievability
    ) {
        public boolean isLapse() {
            return previousState == CardState.REVIEW && card.state() == CardState.RELEARNING;
        }
    }
}
