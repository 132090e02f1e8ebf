package uk.gegc.recall.features.card.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;

@Schema(name = "UpdateCardRequest", description = "Partial update of a card's content; omitted fields are kept")
public record UpdateCardRequest(
        @Schema(description = "New prompt text", example = "What is the capital of Chile?", maxLength = 2000)
        @Size(max = 2000, message = "Question text must be at most 2000 characters")
        String questionText,

        @Schema(description = "New expected answer", example = "Santiago", maxLength = 1000)
        @Size(max = 1000, message = "Correct answer must be at most 1000 characters")
        String correctAnswer
) {
}
