package uk.gegc.recall.features.scheduling.application.exception;

public class CorruptCardStateException extends IllegalStateException {

    public CorruptCardStateException(String message) {
        super(message);
    }
}
