package uk.gegc.recall.features.scheduling.domain.model;

/**
 * Lifecycle state of a card. Every card starts in {@link #NEW}; only the
 * scheduler moves it between states.
 */
public enum CardState {
    NEW,
    LEARNING,
    REVIEW,
    RELEARNING;

    public boolean isShortTerm() {
        return this == LEARNING || this == RELEARNING;
    }
}
