package uk.gegc.recall.features.scheduling.domain.model;

import java.util.List;

/**
 * Eligible cards in presentation order, with scheduled-due cards ahead of
 * never-scheduled ones.
 */
public record DueSet(List<Card> due, int newCount, int dueCount) {

    public DueSet {
        due = List.copyOf(due);
    }

    public int totalReviewable() {
        return newCount + dueCount;
    }

    public boolean isEmpty() {
        return due.isEmpty();
    }
}
