package uk.gegc.recall.features.card.application.exception;

import java.util.UUID;

public class CardDeletedException extends RuntimeException {
    public CardDeletedException(UUID cardId) {
        this(cardId, "reviewed");
    }

    public CardDeletedException(UUID cardId, String action) {
        super("Card " + cardId + " is deleted and cannot be " + action);
    }
}
