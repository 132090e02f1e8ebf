package uk.gegc.recall.features.card.application;

import uk.gegc.recall.features.card.api.dto.ReviewAnswerRequest;
import uk.gegc.recall.features.card.application.dto.ReviewResultDto;

import java.util.UUID;

public interface CardReviewService {

    /**
     * Records an answer and reschedules the card, retrying on concurrent modification.
     */
    ReviewResultDto recordAnswer(UUID ownerId, UUID cardId, ReviewAnswerRequest request);

    ReviewResultDto recordAnswerTx(UUID ownerId, UUID cardId, ReviewAnswerRequest request);
}
