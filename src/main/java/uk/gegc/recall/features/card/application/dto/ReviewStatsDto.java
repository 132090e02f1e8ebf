package uk.gegc.recall.features.card.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(name = "ReviewStatsDto", description = "Per-owner card statistics")
public record ReviewStatsDto(
        @Schema(description = "Active cards")
        long totalCards,
        @Schema(description = "Cards in NEW")
        long newCount,
        @Schema(description = "Cards in LEARNING or RELEARNING")
        long learningCount,
        @Schema(description = "Cards in REVIEW")
        long matureCount,
        @Schema(description = "Earliest future review time; null when nothing is scheduled ahead")
        Instant nextReviewAt
) {
}
