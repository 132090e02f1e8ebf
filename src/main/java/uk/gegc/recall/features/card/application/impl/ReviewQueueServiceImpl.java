package uk.gegc.recall.features.card.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.recall.features.card.application.ReviewQueueService;
import uk.gegc.recall.features.card.application.dto.*;
import uk.gegc.recall.features.card.domain.model.CardEntry;
import uk.gegc.recall.features.card.domain.model.ReviewInteraction;
import uk.gegc.recall.features.card.domain.repository.CardEntryRepository;
import uk.gegc.recall.features.card.domain.repository.ReviewInteractionRepository;
import uk.gegc.recall.features.card.infra.mapping.CardEntryMapper;
import uk.gegc.recall.features.scheduling.application.CardScheduler;
import uk.gegc.recall.features.scheduling.application.DueSetSelector;
import uk.gegc.recall.features.scheduling.domain.model.Card;
import uk.gegc.recall.features.scheduling.domain.model.CardState;
import uk.gegc.recall.features.scheduling.domain.model.DueSet;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class ReviewQueueServiceImpl implements ReviewQueueService {

    private static final Set<CardState> LEARNING_STATES = EnumSet.of(CardState.LEARNING, CardState.RELEARNING);

    private final Clock clock;
    private final CardEntryRepository cardEntryRepository;
    private final ReviewInteractionRepository reviewInteractionRepository;
    private final CardScheduler cardScheduler;
    private final DueSetSelector dueSetSelector;
    private final CardEntryMapper cardEntryMapper;

    @Override
    public Optional<NextReviewDto> getNextReview(UUID ownerId) {
        Instant now = Instant.now(clock);
        List<CardEntry> entries =
                cardEntryRepository.findByOwnerIdAndDeletedAtIsNullAndArchivedAtIsNullOrderByCreatedAtAsc(ownerId);
        Map<UUID, CardEntry> byId = entries.stream()
                .collect(Collectors.toMap(CardEntry::getId, Function.identity()));

        DueSet dueSet = dueSetSelector.dueCards(entries.stream().map(cardEntryMapper::toCard).toList(), now);
        if (dueSet.isEmpty()) {
            return Optional.empty();
        }

        Card next = dueSet.due().get(0);
        CardEntry entry = byId.get(next.id());
        OptionalDouble r = cardScheduler.retrievability(next, now);
        CardDto card = cardEntryMapper.toDto(entry, r.isPresent() ? r.getAsDouble() : null);

        List<ReviewInteractionDto> recent = reviewInteractionRepository
                .findTop10ByOwnerIdAndCard_IdOrderByAnsweredAtDesc(ownerId, next.id())
                .stream()
                .map(cardEntryMapper::toInteractionDto)
                .toList();

        return Optional.of(new NextReviewDto(card, recent, successRate(entry), dueSet.totalReviewable()));
    }

    @Override
    public DueCountDto getDueCount(UUID ownerId) {
        List<Card> cards = cardEntryRepository.findByOwnerIdAndDeletedAtIsNullAndArchivedAtIsNullOrderByCreatedAtAsc(ownerId)
                .stream()
                .map(cardEntryMapper::toCard)
                .toList();
        DueSet dueSet = dueSetSelector.dueCards(cards, Instant.now(clock));
        return new DueCountDto(dueSet.dueCount(), dueSet.newCount(), dueSet.totalReviewable());
    }

    @Override
    public ReviewStatsDto getStats(UUID ownerId) {
        Instant now = Instant.now(clock);
        long total = cardEntryRepository.countByOwnerIdAndDeletedAtIsNullAndArchivedAtIsNull(ownerId);
        long newCount = countInStates(ownerId, Set.of(CardState.NEW));
        long learning = countInStates(ownerId, LEARNING_STATES);
        long mature = countInStates(ownerId, Set.of(CardState.REVIEW));
        Instant nextReviewAt = cardEntryRepository
                .findFirstByOwnerIdAndDeletedAtIsNullAndArchivedAtIsNullAndNextReviewAtAfterOrderByNextReviewAtAsc(ownerId, now)
                .map(CardEntry::getNextReviewAt)
                .orElse(null);
        return new ReviewStatsDto(total, newCount, learning, mature, nextReviewAt);
    }

    @Override
    public Page<ReviewInteractionDto> getHistory(UUID ownerId, Pageable pageable) {
        Page<ReviewInteraction> page = reviewInteractionRepository.findByOwnerIdOrderByAnsweredAtDesc(ownerId, pageable);
        return page.map(cardEntryMapper::toInteractionDto);
    }

    private long countInStates(UUID ownerId, Set<CardState> states) {
        return cardEntryRepository.countByOwnerIdAndDeletedAtIsNullAndArchivedAtIsNullAndStateIn(ownerId, states);
    }

    private Integer successRate(CardEntry entry) {
        int attempts = entry.getAttemptCount() == null ? 0 : entry.getAttemptCount();
        if (attempts == 0) {
            return null;
        }
        int correct = entry.getCorrectCount() == null ? 0 : entry.getCorrectCount();
        return (int) Math.round(correct * 100.0 / attempts);
    }
}
