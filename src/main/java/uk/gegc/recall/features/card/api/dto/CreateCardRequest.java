package uk.gegc.recall.features.card.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "CreateCardRequest", description = "Payload for creating a reviewable card")
public record CreateCardRequest(
        @Schema(description = "Prompt shown to the learner", example = "What is the capital of Peru?",
                requiredMode = Schema.RequiredMode.REQUIRED)
        @NotBlank(message = "Question text must not be blank")
        @Size(max = 2000, message = "Question text must be at most 2000 characters")
        String questionText,

        @Schema(description = "Expected answer", example = "Lima")
        @Size(max = 1000, message = "Correct answer must be at most 1000 characters")
        String correctAnswer
) {
}
