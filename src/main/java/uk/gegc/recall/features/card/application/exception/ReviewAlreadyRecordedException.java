package uk.gegc.recall.features.card.application.exception;

public class ReviewAlreadyRecordedException extends RuntimeException {
    public ReviewAlreadyRecordedException(String message) {
        super(message);
    }
}
