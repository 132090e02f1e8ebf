package uk.gegc.recall.features.scheduling.application;

import uk.gegc.recall.features.scheduling.domain.model.Card;
import uk.gegc.recall.features.scheduling.domain.model.DueSet;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Picks the cards eligible for review from a caller-supplied snapshot.
 *
 * <p>Scheduled cards whose {@code nextReviewAt} has passed come first, oldest
 * overdue first; never-scheduled cards follow. Ties are broken by id.
 * Soft-deleted and archived cards are never returned or counted.
 */
public class DueSetSelector {

    private static final Comparator<Card> BY_ID =
            Comparator.comparing(Card::id, Comparator.nullsLast(Comparator.naturalOrder()));

    private static final Comparator<Card> BY_NEXT_REVIEW =
            Comparator.comparing(Card::nextReviewAt).thenComparing(BY_ID);

    public DueSet dueCards(Collection<Card> cards, Instant now) {
        if (cards == null || cards.isEmpty()) {
            return new DueSet(List.of(), 0, 0);
        }

        List<Card> scheduled = cards.stream()
                .filter(card -> card != null && card.isReviewable())
                .filter(card -> !card.isNeverScheduled() && card.isDueAt(now))
                .sorted(BY_NEXT_REVIEW)
                .collect(Collectors.toList());

        List<Card> unscheduled = cards.stream()
                .filter(card -> card != null && card.isReviewable())
                .filter(Card::isNeverScheduled)
                .sorted(BY_ID)
                .collect(Collectors.toList());

        List<Card> due = Stream.concat(scheduled.stream(), unscheduled.stream()).collect(Collectors.toList());
        return new DueSet(due, unscheduled.size(), scheduled.size());
    }

    public Optional<Card> nextCard(Collection<Card> cards, Instant now) {
        return dueCards(cards, now).due().stream().findFirst();
    }
}
