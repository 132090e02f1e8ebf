package uk.gegc.recall.features.card.application.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;
import java.util.UUID;

@Schema(name = "BulkCardResultDto", description = "Result of a bulk delete or restore")
public record BulkCardResultDto(
        @Schema(description = "Cards whose state changed")
        List<UUID> processed,
        @Schema(description = "Cards already in the requested state or not owned by the caller")
        List<UUID> skipped
) {
}
