package uk.gegc.recall.features.card.application;

import uk.gegc.recall.features.card.api.dto.CreateCardRequest;
import uk.gegc.recall.features.card.api.dto.UpdateCardRequest;
import uk.gegc.recall.features.card.application.dto.BulkCardResultDto;
import uk.gegc.recall.features.card.application.dto.CardDto;

import java.util.List;
import java.util.UUID;

public interface CardService {

    CardDto createCard(UUID ownerId, CreateCardRequest request);

    CardDto getCard(UUID ownerId, UUID cardId);

    List<CardDto> listCards(UUID ownerId, boolean includeDeleted);

    /**
     * Replaces the card's content. Scheduling state, attempt counters and
     * the delete/archive markers are never touched.
     */
    CardDto updateCard(UUID ownerId, UUID cardId, UpdateCardRequest request);

    CardDto softDeleteCard(UUID ownerId, UUID cardId);

    CardDto restoreCard(UUID ownerId, UUID cardId);

    BulkCardResultDto bulkDelete(UUID ownerId, List<UUID> cardIds);

    BulkCardResultDto bulkRestore(UUID ownerId, List<UUID> cardIds);

    BulkCardResultDto bulkArchive(UUID ownerId, List<UUID> cardIds);

    BulkCardResultDto bulkUnarchive(UUID ownerId, List<UUID> cardIds);
}
