package uk.gegc.recall.features.card.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.recall.features.scheduling.domain.model.CardState;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "ReviewResultDto", description = "Scheduling outcome of a recorded answer")
public record ReviewResultDto(
        @Schema(description = "Card ID")
        UUID cardId,
        @Schema(description = "Whether the answer was correct")
        boolean correct,
        @Schema(description = "State before the answer")
        CardState previousState,
        @Schema(description = "State after the answer")
        CardState state,
        @Schema(description = "Recall probability at answer time; null on first review")
        Double retrievability,
        @Schema(description = "Stability after the answer")
        double stability,
        @Schema(description = "Difficulty after the answer")
        double difficulty,
        @Schema(description = "Interval in days")
        double scheduledDays,
        @Schema(description = "Next review time (UTC)")
        Instant nextReviewAt,
        @Schema(description = "Total reviews")
        int reps,
        @Schema(description = "Total lapses")
        int lapses,
        @Schema(description = "True when this answer was a lapse")
        boolean lapse
) {
}
