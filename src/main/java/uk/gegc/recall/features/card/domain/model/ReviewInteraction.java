package uk.gegc.recall.features.card.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import uk.gegc.recall.features.scheduling.domain.model.CardState;

import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "review_interaction",
        uniqueConstraints = @UniqueConstraint(
                name = "uk_review_interaction_idempotency",
                columnNames = {"idempotency_key"}
        ),
        indexes = {
                @Index(name = "idx_interaction_owner_answered", columnList = "owner_id, answered_at"),
                @Index(name = "idx_interaction_card_answered", columnList = "card_id, answered_at")
        }
)
public class ReviewInteraction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "card_id", referencedColumnName = "id", nullable = false)
    private CardEntry card;

    @Column(name = "user_answer", length = 1000)
    private String userAnswer;

    @Column(name = "is_correct", nullable = false)
    private Boolean isCorrect;

    @Column(name = "answered_at", nullable = false, updatable = false)
    private Instant answeredAt;

    @Column(name = "time_spent_ms")
    private Long timeSpentMs;

    @Column(name = "session_id", length = 100)
    private String sessionId;

    @Column(name = "idempotency_key")
    private UUID idempotencyKey;

    @Enumerated(EnumType.STRING)
    @Column(name = "state_before", nullable = false, length = 16)
    private CardState stateBefore;

    @Enumerated(EnumType.STRING)
    @Column(name = "state_after", nullable = false, length = 16)
    private CardState stateAfter;

    @Column(name = "retrievability")
    private Double retrievability;

    @Column(name = "stability", nullable = false)
    private Double stability;

    @Column(name = "difficulty", nullable = false)
    private Double difficulty;

    @Column(name = "scheduled_days", nullable = false)
    private Double scheduledDays;

    @Column(name = "next_review_at", nullable = false)
    private Instant nextReviewAt;

    @PrePersist
    private void prePersist() {
        if (answeredAt == null) {
            answeredAt = Instant.now();
        }
    }
}
