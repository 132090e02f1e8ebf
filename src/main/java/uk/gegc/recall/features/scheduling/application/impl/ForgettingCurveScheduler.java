package uk.gegc.recall.features.scheduling.application.impl;

import lombok.extern.slf4j.Slf4j;
import uk.gegc.recall.features.scheduling.application.CardScheduler;
import uk.gegc.recall.features.scheduling.application.CardStateMachine;
import uk.gegc.recall.features.scheduling.application.IntervalCalculator;
import uk.gegc.recall.features.scheduling.application.MemoryStateUpdater;
import uk.gegc.recall.features.scheduling.application.RetrievabilityEstimator;
import uk.gegc.recall.features.scheduling.application.exception.CorruptCardStateException;
import uk.gegc.recall.features.scheduling.application.exception.DeletedCardReviewException;
import uk.gegc.recall.features.scheduling.config.SchedulingProperties;
import uk.gegc.recall.features.scheduling.domain.model.Card;
import uk.gegc.recall.features.scheduling.domain.model.CardState;
import uk.gegc.recall.features.scheduling.domain.model.MemoryUpdate;
import uk.gegc.recall.features.scheduling.domain.model.ReviewOutcome;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.UUID;

@Slf4j
public class ForgettingCurveScheduler implements CardScheduler {

    private final RetrievabilityEstimator retrievabilityEstimator;
    private final MemoryStateUpdater memoryStateUpdater;
    private final CardStateMachine stateMachine;
    private final boolean strictInvariants;
    private final double initialDifficulty;
    private final double initialStabilityCorrect;
    private final double initialStabilityIncorrect;

    public ForgettingCurveScheduler(SchedulingProperties properties,
                                    RetrievabilityEstimator retrievabilityEstimator,
                                    MemoryStateUpdater memoryStateUpdater,
                                    CardStateMachine stateMachine) {
        this.retrievabilityEstimator = retrievabilityEstimator;
        this.memoryStateUpdater = memoryStateUpdater;
        this.stateMachine = stateMachine;
        this.strictInvariants = properties.isStrictInvariants();
        this.initialDifficulty = properties.getDifficulty().getInitial();
        this.initialStabilityCorrect = properties.getStability().getInitialCorrect();
        this.initialStabilityIncorrect = properties.getStability().getInitialIncorrect();
    }

    @Override
    public Card initializeCard(UUID id, UUID ownerId) {
        return Card.builder()
                .id(id)
                .ownerId(ownerId)
                .state(CardState.NEW)
                .reps(0)
                .lapses(0)
                .scheduledDays(0.0)
                .build();
    }

    @Override
    public SchedulingResult review(Card card, ReviewOutcome outcome) {
        Objects.requireNonNull(card, "card");
        Objects.requireNonNull(outcome, "outcome");
        if (card.isDeleted()) {
            throw new DeletedCardReviewException(card.id());
        }

        CardState previous = card.state() == null ? corruptState(card) : card.state();
        Instant answeredAt = outcome.answeredAt();
        boolean correct = outcome.isCorrect();

        MemoryUpdate memory;
        Double retrievability;
        if (previous == CardState.NEW) {
            memory = new MemoryUpdate(
                    correct ? initialStabilityCorrect : initialStabilityIncorrect,
                    initialDifficulty);
            retrievability = null;
        } else {
            double stability = storedStability(card);
            double difficulty = storedDifficulty(card);
            double elapsed = elapsedDays(card, answeredAt);
            double r = retrievabilityEstimator.retrievability(stability, elapsed);
            memory = memoryStateUpdater.update(stability, difficulty, r, correct);
            retrievability = r;
        }

        CardStateMachine.Transition transition = stateMachine.next(previous, correct, memory.stability());

        Card updated = card.toBuilder()
                .state(transition.state())
                .stability(memory.stability())
                .difficulty(memory.difficulty())
                .reps(Math.max(0, card.reps()) + 1)
                .lapses(Math.max(0, card.lapses()) + (transition.lapse() ? 1 : 0))
                .lastReviewAt(answeredAt)
                .scheduledDays(transition.scheduledDays())
                .nextReviewAt(IntervalCalculator.nextReviewAt(answeredAt, transition.scheduledDays()))
                .build();

        log.debug("Card scheduled: cardId={}, from={}, to={}, correct={}, stability={}, difficulty={}, scheduledDays={}",
                card.id(), previous, updated.state(), correct, updated.stability(), updated.difficulty(),
                updated.scheduledDays());

        return new SchedulingResult(updated, previous, retrievability);
    }

    @Override
    public double retrievability(double stability, double elapsedDays) {
        return retrievabilityEstimator.retrievability(stability, elapsedDays);
    }

    @Override
    public OptionalDouble retrievability(Card card, Instant now) {
        return retrievabilityEstimator.retrievability(card, now);
    }

    private double elapsedDays(Card card, Instant answeredAt) {
        if (card.lastReviewAt() == null) {
            violation(card, "lastReviewAt is missing for a reviewed card");
            return 0.0;
        }
        return retrievabilityEstimator.elapsedDays(card.lastReviewAt(), answeredAt);
    }

    private double storedStability(Card card) {
        Double stability = card.stability();
        if (stability == null) {
            violation(card, "stability is missing");
            return initialStabilityIncorrect;
        }
        if (!memoryStateUpdater.isStabilityInRange(stability)) {
            violation(card, "stability " + stability + " is out of range");
            return memoryStateUpdater.clampStability(stability);
        }
        return stability;
    }

    private double storedDifficulty(Card card) {
        Double difficulty = card.difficulty();
        if (difficulty == null) {
            violation(card, "difficulty is missing");
            return initialDifficulty;
        }
        if (!memoryStateUpdater.isDifficultyInRange(difficulty)) {
            violation(card, "difficulty " + difficulty + " is out of range");
            return memoryStateUpdater.clampDifficulty(difficulty);
        }
        return difficulty;
    }

    private CardState corruptState(Card card) {
        violation(card, "state is missing");
        return CardState.NEW;
    }

    private void violation(Card card, String detail) {
        String message = "Corrupt card state: cardId=" + card.id() + ", " + detail;
        if (strictInvariants) {
            throw new CorruptCardStateException(message);
        }
        log.warn("{}; clamping and continuing", message);
    }
}
