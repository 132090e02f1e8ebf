package uk.gegc.recall.features.card.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;
import uk.gegc.recall.features.scheduling.domain.model.CardState;

import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@Setter
@Table(
        name = "card_entry",
        indexes = {
                @Index(name = "idx_card_owner_next_review", columnList = "owner_id, next_review_at"),
                @Index(name = "idx_card_owner_deleted", columnList = "owner_id, deleted_at")
        }
)
public class CardEntry {

    @Id
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @Column(name = "question_text", nullable = false, length = 2000)
    private String questionText;

    @Column(name = "correct_answer", length = 1000)
    private String correctAnswer;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 16)
    private CardState state = CardState.NEW;

    @Column(name = "stability")
    private Double stability;

    @Column(name = "difficulty")
    private Double difficulty;

    @Column(name = "reps", nullable = false)
    private Integer reps = 0;

    @Column(name = "lapses", nullable = false)
    private Integer lapses = 0;

    @Column(name = "last_review_at")
    private Instant lastReviewAt;

    @Column(name = "next_review_at")
    private Instant nextReviewAt;

    @Column(name = "scheduled_days", nullable = false)
    private Double scheduledDays = 0.0;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @Column(name = "archived_at")
    private Instant archivedAt;

    @Column(name = "attempt_count", nullable = false)
    private Integer attemptCount = 0;

    @Column(name = "correct_count", nullable = false)
    private Integer correctCount = 0;

    @Column(name = "last_attempted_at")
    private Instant lastAttemptedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
