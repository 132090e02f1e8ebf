package uk.gegc.recall.features.card.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;
import java.util.UUID;

@Schema(name = "BulkCardRequest", description = "Card ids for a bulk delete, restore, archive or unarchive")
public record BulkCardRequest(
        @Schema(description = "Ids of the cards to process", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotEmpty(message = "At least one card id is required")
        @Size(max = 500, message = "At most 500 cards can be processed at once")
        List<@NotNull UUID> cardIds
) {
}
