package uk.gegc.recall.features.scheduling.domain.model;

import lombok.Builder;

import java.time.Instant;
import java.util.UUID;

/**
 * Memory state of one schedulable question. Immutable; the scheduler returns
 * a new instance for every review.
 *
 * @param stability     days until retrievability halves; {@code null} only while {@link CardState#NEW}
 * @param difficulty    intrinsic hardness on the configured scale; {@code null} only while {@link CardState#NEW}
 * @param nextReviewAt  {@code null} means due immediately
 * @param deletedAt     soft-delete marker, orthogonal to scheduling
 * @param archivedAt    parks the card outside the review queue; orthogonal to scheduling
 */
@Builder(toBuilder = true)
public record Card(
        UUID id,
        UUID ownerId,
        CardState state,
        Double stability,
        Double difficulty,
        int reps,
        int lapses,
        Instant lastReviewAt,
        Instant nextReviewAt,
        double scheduledDays,
        Instant deletedAt,
        Instant archivedAt
) {

    public boolean isDeleted() {
        return deletedAt != null;
    }

    public boolean isArchived() {
        return archivedAt != null;
    }

    /**
     * Whether the card may appear in the review queue at all.
     */
    public boolean isReviewable() {
        return !isDeleted() && !isArchived();
    }

    public boolean isNeverScheduled() {
        return nextReviewAt == null;
    }

    public boolean isDueAt(Instant now) {
        return nextReviewAt == null || !nextReviewAt.isAfter(now);
    }

    public Card softDelete(Instant at) {
        return toBuilder().deletedAt(at).build();
    }

    public Card restore() {
        return toBuilder().deletedAt(null).build();
    }

    public Card archive(Instant at) {
        return toBuilder().archivedAt(at).build();
    }

    public Card unarchive() {
        return toBuilder().archivedAt(null).build();
    }
}
