package uk.gegc.recall.features.card.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.recall.features.scheduling.domain.model.CardState;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "ReviewInteractionDto", description = "One recorded answer")
public record ReviewInteractionDto(
        UUID id,
        UUID cardId,
        String userAnswer,
        boolean correct,
        Instant answeredAt,
        Long timeSpentMs,
        String sessionId,
        CardState stateBefore,
        CardState stateAfter,
        Double retrievability,
        double stability,
        double difficulty,
        double scheduledDays,
        Instant nextReviewAt
) {
}
