package uk.gegc.recall.features.card.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "NextReviewDto", description = "The next card to review with recent context")
public record NextReviewDto(
        @Schema(description = "Card to review")
        CardDto card,
        @Schema(description = "Up to 10 most recent answers for this card, newest first")
        List<ReviewInteractionDto> recentInteractions,
        @Schema(description = "Percentage of correct answers; null when never answered")
        Integer successRate,
        @Schema(description = "Overdue plus never-reviewed cards, including this one")
        int totalReviewable
) {
}
