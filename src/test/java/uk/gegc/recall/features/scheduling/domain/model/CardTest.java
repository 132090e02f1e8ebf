package uk.gegc.recall.features.scheduling.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.recall.BaseUnitTest;

import java.time.Instant;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Card")
class CardTest extends BaseUnitTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    @Test
    @DisplayName("soft delete then restore returns an identical card")
    void softDeleteRoundTrip() {
        Card card = Card.builder()
                .id(UUID.randomUUID())
                .ownerId(UUID.randomUUID())
                .state(CardState.RELEARNING)
                .stability(3.14159)
                .difficulty(6.2)
                .reps(9)
                .lapses(2)
                .lastReviewAt(T0)
                .nextReviewAt(T0.plusSeconds(600))
                .scheduledDays(600.0 / 86400.0)
                .build();

        Card deleted = card.softDelete(T0.plusSeconds(5));

        assertTrue(deleted.isDeleted());
        assertEquals(card.stability(), deleted.stability());
        assertEquals(card.nextReviewAt(), deleted.nextReviewAt());
        assertEquals(card, deleted.restore());
    }

    @Test
    @DisplayName("archive then unarchive leaves scheduling state untouched")
    void archiveRoundTrip() {
        Card card = Card.builder()
                .id(UUID.randomUUID())
                .ownerId(UUID.randomUUID())
                .state(CardState.REVIEW)
                .stability(12.5)
                .difficulty(4.4)
                .reps(6)
                .lapses(1)
                .lastReviewAt(T0)
                .nextReviewAt(T0.plusSeconds(86400 * 12))
                .scheduledDays(12.0)
                .build();

        Card archived = card.archive(T0.plusSeconds(30));

        assertTrue(archived.isArchived());
        assertFalse(archived.isDeleted());
        assertFalse(archived.isReviewable());
        assertEquals(card.toBuilder().archivedAt(T0.plusSeconds(30)).build(), archived);
        assertEquals(card, archived.unarchive());
        assertTrue(archived.unarchive().isReviewable());
    }

    @Test
    @DisplayName("unscheduled cards are due immediately")
    void isDueAt() {
        Card fresh = Card.builder().id(UUID.randomUUID()).state(CardState.NEW).build();
        Card later = fresh.toBuilder().nextReviewAt(T0.plusSeconds(1)).build();

        assertTrue(fresh.isNeverScheduled());
        assertTrue(fresh.isDueAt(T0));
        assertFalse(later.isDueAt(T0));
        assertTrue(later.isDueAt(T0.plusSeconds(1)));
    }

    @Test
    @DisplayName("review outcome requires a timestamp and maps correctness to a grade")
    void reviewOutcome() {
        assertEquals(ReviewGrade.GOOD, ReviewOutcome.correct(T0).grade());
        assertFalse(ReviewOutcome.of(false, T0).isCorrect());
        assertThrows(NullPointerException.class, () -> ReviewOutcome.of(true, null));
    }
}
