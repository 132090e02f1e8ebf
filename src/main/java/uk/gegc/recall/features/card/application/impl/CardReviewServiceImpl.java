package uk.gegc.recall.features.card.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.recall.features.card.api.dto.ReviewAnswerRequest;
import uk.gegc.recall.features.card.application.CardReviewService;
import uk.gegc.recall.features.card.application.dto.ReviewResultDto;
import uk.gegc.recall.features.card.application.exception.CardDeletedException;
import uk.gegc.recall.features.card.application.exception.ReviewAlreadyRecordedException;
import uk.gegc.recall.features.card.domain.model.CardEntry;
import uk.gegc.recall.features.card.domain.model.ReviewInteraction;
import uk.gegc.recall.features.card.domain.repository.CardEntryRepository;
import uk.gegc.recall.features.card.domain.repository.ReviewInteractionRepository;
import uk.gegc.recall.features.card.infra.mapping.CardEntryMapper;
import uk.gegc.recall.features.scheduling.application.CardScheduler;
import uk.gegc.recall.features.scheduling.domain.model.Card;
import uk.gegc.recall.features.scheduling.domain.model.ReviewOutcome;
import uk.gegc.recall.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.function.Supplier;

@Slf4j
@Service
@RequiredArgsConstructor
public class CardReviewServiceImpl implements CardReviewService {

    static final int MAX_ATTEMPTS = 3;

    private final Clock clock;
    private final CardEntryRepository cardEntryRepository;
    private final ReviewInteractionRepository reviewInteractionRepository;
    private final CardScheduler cardScheduler;
    private final CardEntryMapper cardEntryMapper;

    @Lazy
    private final CardReviewService self;

    @Override
    public ReviewResultDto recordAnswer(UUID ownerId, UUID cardId, ReviewAnswerRequest request) {
        return withRetry(() -> self.recordAnswerTx(ownerId, cardId, request));
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ReviewResultDto recordAnswerTx(UUID ownerId, UUID cardId, ReviewAnswerRequest request) {
        CardEntry entry = cardEntryRepository.findByIdAndOwnerId(cardId, ownerId)
                .orElseThrow(() -> new ResourceNotFoundException("Card " + cardId + " not found"));
        if (entry.getDeletedAt() != null) {
            throw new CardDeletedException(cardId);
        }

        UUID idempotencyKey = request.idempotencyKey();
        if (idempotencyKey != null && reviewInteractionRepository.existsByIdempotencyKey(idempotencyKey)) {
            throw new ReviewAlreadyRecordedException("Answer already recorded for key " + idempotencyKey);
        }

        boolean correct = Boolean.TRUE.equals(request.correct());
        Instant answeredAt = Instant.now(clock);

        CardScheduler.SchedulingResult result = cardScheduler.review(
                cardEntryMapper.toCard(entry),
                ReviewOutcome.of(correct, answeredAt)
        );

        cardEntryMapper.applyScheduling(entry, result.card());
        updateAttemptStats(entry, correct, answeredAt);
        cardEntryRepository.save(entry);

        ReviewInteraction interaction = buildInteraction(entry, request, correct, answeredAt, result);
        try {
            reviewInteractionRepository.saveAndFlush(interaction);
        } catch (DataIntegrityViolationException e) {
            if (idempotencyKey != null && isDuplicateKey(e)) {
                throw new ReviewAlreadyRecordedException("Answer already recorded for key " + idempotencyKey);
            }
            throw e;
        }

        if (result.isLapse()) {
            log.info("Card lapsed cardId={} ownerId={} lapses={}", cardId, ownerId, result.card().lapses());
        }
        return cardEntryMapper.toResultDto(result, correct);
    }

    private <T> T withRetry(Supplier<T> action) {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            try {
                return action.get();
            } catch (OptimisticLockingFailureException e) {
                if (attempt == MAX_ATTEMPTS - 1) {
                    log.warn("Review gave up after {} attempts: {}", MAX_ATTEMPTS, e.getMessage());
                    throw e;
                }
                log.debug("Optimistic lock conflict on attempt {}, retrying", attempt + 1);
                sleepBackoff(attempt + 1);
            }
        }
        throw new IllegalStateException("Retry loop exhausted unexpectedly");
    }

    private void sleepBackoff(int attempt) {
        try {
            Thread.sleep(50L * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private boolean isDuplicateKey(DataIntegrityViolationException e) {
        String message = e.getMostSpecificCause().getMessage();
        return message != null
                && (message.contains("Duplicate") || message.contains("Unique index or primary key violation"));
    }

    private void updateAttemptStats(CardEntry entry, boolean correct, Instant answeredAt) {
        entry.setAttemptCount(zeroIfNull(entry.getAttemptCount()) + 1);
        if (correct) {
            entry.setCorrectCount(zeroIfNull(entry.getCorrectCount()) + 1);
        }
        entry.setLastAttemptedAt(answeredAt);
    }

    private ReviewInteraction buildInteraction(CardEntry entry,
                                               ReviewAnswerRequest request,
                                               boolean correct,
                                               Instant answeredAt,
                                               CardScheduler.SchedulingResult result) {
        Card card = result.card();
        ReviewInteraction interaction = new ReviewInteraction();
        interaction.setOwnerId(entry.getOwnerId());
        interaction.setCard(entry);
        interaction.setUserAnswer(request.userAnswer());
        interaction.setIsCorrect(correct);
        interaction.setAnsweredAt(answeredAt);
        interaction.setTimeSpentMs(request.timeSpentMs());
        interaction.setSessionId(request.sessionId());
        interaction.setIdempotencyKey(request.idempotencyKey());
        interaction.setStateBefore(result.previousState());
        interaction.setStateAfter(card.state());
        interaction.setRetrievability(result.retrievability());
        interaction.setStability(card.stability());
        interaction.setDifficulty(card.difficulty());
        interaction.setScheduledDays(card.scheduledDays());
        interaction.setNextReviewAt(card.nextReviewAt());
        return interaction;
    }

    private static int zeroIfNull(Integer value) {
        return value == null ? 0 : value;
    }
}
