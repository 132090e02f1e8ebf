package uk.gegc.recall.features.card.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "DueCountDto", description = "Counts of reviewable cards")
public record DueCountDto(
        @Schema(description = "Scheduled cards past their review time")
        int dueCount,
        @Schema(description = "Cards never scheduled")
        int newCount,
        @Schema(description = "dueCount + newCount")
        int totalReviewable
) {
}
