package uk.gegc.recall.features.card.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.recall.features.scheduling.domain.model.CardState;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "CardDto", description = "A card with its scheduling state")
public record CardDto(
        @Schema(description = "Card ID")
        UUID id,
        @Schema(description = "Prompt text")
        String questionText,
        @Schema(description = "Expected answer")
        String correctAnswer,
        @Schema(description = "Scheduling state")
        CardState state,
        @Schema(description = "Days until recall probability halves; null for new cards")
        Double stability,
        @Schema(description = "Intrinsic difficulty; null for new cards")
        Double difficulty,
        @Schema(description = "Number of reviews")
        int reps,
        @Schema(description = "Number of lapses from the review state")
        int lapses,
        @Schema(description = "Last review time (UTC)")
        Instant lastReviewAt,
        @Schema(description = "Next scheduled review time (UTC); null means due now")
        Instant nextReviewAt,
        @Schema(description = "Length of the current interval in days")
        double scheduledDays,
        @Schema(description = "Current estimated recall probability; null for new cards")
        Double retrievability,
        @Schema(description = "Total answers recorded")
        int attemptCount,
        @Schema(description = "Correct answers recorded")
        int correctCount,
        @Schema(description = "Soft-delete time; null when active")
        Instant deletedAt,
        @Schema(description = "Archive time; null when in the review queue")
        Instant archivedAt,
        @Schema(description = "Creation time (UTC)")
        Instant createdAt,
        @Schema(description = "Last modification time (UTC)")
        Instant updatedAt
) {
}
