package uk.gegc.recall.features.card.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.UUID;

@Schema(name = "ReviewAnswerRequest", description = "A single answer to a card")
public record ReviewAnswerRequest(
        @Schema(description = "Whether the answer was correct", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull(message = "Correctness must be provided")
        Boolean correct,

        @Schema(description = "The answer as given by the learner")
        @Size(max = 1000, message = "User answer must be at most 1000 characters")
        String userAnswer,

        @Schema(description = "Time spent answering, in milliseconds")
        @PositiveOrZero(message = "Time spent must not be negative")
        Long timeSpentMs,

        @Schema(description = "Client session identifier")
        @Size(max = 100, message = "Session id must be at most 100 characters")
        String sessionId,

        @Schema(description = "Optional idempotency key to avoid double-processing")
        UUID idempotencyKey
) {
}
