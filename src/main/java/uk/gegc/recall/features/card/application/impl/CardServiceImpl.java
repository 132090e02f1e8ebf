package uk.gegc.recall.features.card.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.recall.features.card.api.dto.CreateCardRequest;
import uk.gegc.recall.features.card.api.dto.UpdateCardRequest;
import uk.gegc.recall.features.card.application.CardService;
import uk.gegc.recall.features.card.application.dto.BulkCardResultDto;
import uk.gegc.recall.features.card.application.dto.CardDto;
import uk.gegc.recall.features.card.application.exception.CardDeletedException;
import uk.gegc.recall.features.card.domain.model.CardEntry;
import uk.gegc.recall.features.card.domain.repository.CardEntryRepository;
import uk.gegc.recall.features.card.infra.mapping.CardEntryMapper;
import uk.gegc.recall.features.scheduling.application.CardScheduler;
import uk.gegc.recall.features.scheduling.domain.model.Card;
import uk.gegc.recall.shared.exception.ResourceNotFoundException;
import uk.gegc.recall.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

@Slf4j
@Service
@RequiredArgsConstructor
public class CardServiceImpl implements CardService {

    private final Clock clock;
    private final CardEntryRepository cardEntryRepository;
    private final CardScheduler cardScheduler;
    private final CardEntryMapper cardEntryMapper;

    @Override
    @Transactional
    public CardDto createCard(UUID ownerId, CreateCardRequest request) {
        Card card = cardScheduler.initializeCard(UUID.randomUUID(), ownerId);

        CardEntry entry = new CardEntry();
        entry.setId(card.id());
        entry.setOwnerId(ownerId);
        entry.setQuestionText(request.questionText().trim());
        entry.setCorrectAnswer(request.correctAnswer());
        cardEntryMapper.applyScheduling(entry, card);

        CardEntry saved = cardEntryRepository.save(entry);
        log.info("Card created cardId={} ownerId={}", saved.getId(), ownerId);
        return cardEntryMapper.toDto(saved, null);
    }

    @Override
    @Transactional(readOnly = true)
    public CardDto getCard(UUID ownerId, UUID cardId) {
        CardEntry entry = findOwned(ownerId, cardId);
        Double retrievability = currentRetrievability(entry, Instant.now(clock));
        return cardEntryMapper.toDto(entry, retrievability);
    }

    @Override
    @Transactional(readOnly = true)
    public List<CardDto> listCards(UUID ownerId, boolean includeDeleted) {
        List<CardEntry> entries = includeDeleted
                ? cardEntryRepository.findByOwnerIdOrderByCreatedAtAsc(ownerId)
                : cardEntryRepository.findByOwnerIdAndDeletedAtIsNullOrderByCreatedAtAsc(ownerId);
        Instant now = Instant.now(clock);
        return entries.stream()
                .map(entry -> cardEntryMapper.toDto(entry, currentRetrievability(entry, now)))
                .toList();
    }

    @Override
    @Transactional
    public CardDto updateCard(UUID ownerId, UUID cardId, UpdateCardRequest request) {
        CardEntry entry = findOwned(ownerId, cardId);
        if (entry.getDeletedAt() != null) {
            throw new CardDeletedException(cardId, "edited");
        }
        if (request.questionText() == null && request.correctAnswer() == null) {
            throw new ValidationException("At least one of questionText or correctAnswer must be provided");
        }
        if (request.questionText() != null && request.questionText().isBlank()) {
            throw new ValidationException("Question text must not be blank");
        }
        if (request.correctAnswer() != null && request.correctAnswer().isBlank()) {
            throw new ValidationException("Correct answer must not be blank");
        }

        cardEntryMapper.updateContent(entry, request);
        CardEntry saved = cardEntryRepository.save(entry);
        log.info("Card content updated cardId={} ownerId={}", cardId, ownerId);
        return cardEntryMapper.toDto(saved, currentRetrievability(saved, Instant.now(clock)));
    }

    @Override
    @Transactional
    public CardDto softDeleteCard(UUID ownerId, UUID cardId) {
        CardEntry entry = findOwned(ownerId, cardId);
        if (entry.getDeletedAt() != null) {
            throw new ValidationException("Card " + cardId + " is already deleted");
        }
        Card deleted = cardEntryMapper.toCard(entry).softDelete(Instant.now(clock));
        cardEntryMapper.applyScheduling(entry, deleted);
        log.info("Card soft-deleted cardId={} ownerId={}", cardId, ownerId);
        return cardEntryMapper.toDto(cardEntryRepository.save(entry), null);
    }

    @Override
    @Transactional
    public CardDto restoreCard(UUID ownerId, UUID cardId) {
        CardEntry entry = findOwned(ownerId, cardId);
        if (entry.getDeletedAt() == null) {
            throw new ValidationException("Card " + cardId + " is not deleted");
        }
        Card restored = cardEntryMapper.toCard(entry).restore();
        cardEntryMapper.applyScheduling(entry, restored);
        log.info("Card restored cardId={} ownerId={}", cardId, ownerId);
        CardEntry saved = cardEntryRepository.save(entry);
        return cardEntryMapper.toDto(saved, currentRetrievability(saved, Instant.now(clock)));
    }

    @Override
    @Transactional
    public BulkCardResultDto bulkDelete(UUID ownerId, List<UUID> cardIds) {
        Instant now = Instant.now(clock);
        return bulkApply(ownerId, cardIds, "delete", card -> !card.isDeleted(), card -> card.softDelete(now));
    }

    @Override
    @Transactional
    public BulkCardResultDto bulkRestore(UUID ownerId, List<UUID> cardIds) {
        return bulkApply(ownerId, cardIds, "restore", Card::isDeleted, Card::restore);
    }

    @Override
    @Transactional
    public BulkCardResultDto bulkArchive(UUID ownerId, List<UUID> cardIds) {
        Instant now = Instant.now(clock);
        return bulkApply(ownerId, cardIds, "archive", Card::isReviewable, card -> card.archive(now));
    }

    @Override
    @Transactional
    public BulkCardResultDto bulkUnarchive(UUID ownerId, List<UUID> cardIds) {
        return bulkApply(ownerId, cardIds, "unarchive", Card::isArchived, Card::unarchive);
    }

    /**
     * Applies {@code change} to every requested card the owner holds and for
     * which {@code applicable} holds. Anything else is reported as skipped.
     */
    private BulkCardResultDto bulkApply(UUID ownerId,
                                        List<UUID> cardIds,
                                        String action,
                                        Predicate<Card> applicable,
                                        UnaryOperator<Card> change) {
        Set<UUID> requested = new LinkedHashSet<>(cardIds);
        Map<UUID, CardEntry> owned = new HashMap<>();
        for (CardEntry entry : cardEntryRepository.findByIdInAndOwnerId(requested, ownerId)) {
            owned.put(entry.getId(), entry);
        }

        List<UUID> processed = new ArrayList<>();
        List<UUID> skipped = new ArrayList<>();
        List<CardEntry> changed = new ArrayList<>();
        for (UUID id : requested) {
            CardEntry entry = owned.get(id);
            Card card = entry == null ? null : cardEntryMapper.toCard(entry);
            if (card == null || !applicable.test(card)) {
                skipped.add(id);
                continue;
            }
            cardEntryMapper.applyScheduling(entry, change.apply(card));
            changed.add(entry);
            processed.add(id);
        }
        cardEntryRepository.saveAll(changed);

        log.info("Bulk {} ownerId={} processed={} skipped={}", action, ownerId, processed.size(), skipped.size());
        return new BulkCardResultDto(processed, skipped);
    }

    private CardEntry findOwned(UUID ownerId, UUID cardId) {
        return cardEntryRepository.findByIdAndOwnerId(cardId, ownerId)
                .orElseThrow(() -> new ResourceNotFoundException("Card " + cardId + " not found"));
    }

    private Double currentRetrievability(CardEntry entry, Instant now) {
        OptionalDouble r = cardScheduler.retrievability(cardEntryMapper.toCard(entry), now);
        return r.isPresent() ? r.getAsDouble() : null;
    }
}
