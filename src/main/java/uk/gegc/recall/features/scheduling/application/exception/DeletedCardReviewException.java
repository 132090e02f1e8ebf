package uk.gegc.recall.features.scheduling.application.exception;

import java.util.UUID;

/**
 * A soft-deleted card reached the scheduler. Callers must filter deleted
 * cards before reviewing.
 */
public class DeletedCardReviewException extends IllegalStateException {

    public DeletedCardReviewException(UUID cardId) {
        super("Card " + cardId + " is soft-deleted and cannot be scheduled");
    }
}
