package uk.gegc.recall.features.card.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.ArraySchema;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.recall.features.card.api.dto.BulkCardRequest;
import uk.gegc.recall.features.card.api.dto.CreateCardRequest;
import uk.gegc.recall.features.card.api.dto.UpdateCardRequest;
import uk.gegc.recall.features.card.application.CardService;
import uk.gegc.recall.features.card.application.dto.BulkCardResultDto;
import uk.gegc.recall.features.card.application.dto.CardDto;

import java.util.List;
import java.util.UUID;

@Tag(name = "Cards", description = "Card lifecycle: create, edit, archive, soft delete and restore")
@RestController
@RequestMapping("/api/v1/cards")
@RequiredArgsConstructor
@Validated
public class CardController {

    public static final String OWNER_HEADER = "X-Owner-Id";

    private final CardService cardService;

    @PostMapping
    @Operation(summary = "Create a card", description = "Creates a card in the NEW state, due immediately.")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Card created",
                    content = @Content(schema = @Schema(implementation = CardDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<CardDto> createCard(
            @Parameter(description = "Owner ID", required = true) @RequestHeader(OWNER_HEADER) UUID ownerId,
            @RequestBody @Valid CreateCardRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(cardService.createCard(ownerId, request));
    }

    @GetMapping("/{cardId}")
    @Operation(summary = "Get a card", description = "Returns the card with its current retrievability.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Card found",
                    content = @Content(schema = @Schema(implementation = CardDto.class))),
            @ApiResponse(responseCode = "404", description = "Card not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<CardDto> getCard(
            @Parameter(description = "Owner ID", required = true) @RequestHeader(OWNER_HEADER) UUID ownerId,
            @Parameter(description = "Card ID", required = true) @PathVariable UUID cardId
    ) {
        return ResponseEntity.ok(cardService.getCard(ownerId, cardId));
    }

    @GetMapping
    @Operation(summary = "List cards", description = "Lists the owner's cards, oldest first.")
    @ApiResponse(responseCode = "200", description = "Cards",
            content = @Content(array = @ArraySchema(schema = @Schema(implementation = CardDto.class))))
    public ResponseEntity<List<CardDto>> listCards(
            @Parameter(description = "Owner ID", required = true) @RequestHeader(OWNER_HEADER) UUID ownerId,
            @Parameter(description = "Include soft-deleted cards")
            @RequestParam(defaultValue = "false") boolean includeDeleted
    ) {
        return ResponseEntity.ok(cardService.listCards(ownerId, includeDeleted));
    }

    @PatchMapping("/{cardId}")
    @Operation(summary = "Edit card content", description = "Updates the prompt and/or answer. Scheduling state is kept.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Card updated",
                    content = @Content(schema = @Schema(implementation = CardDto.class))),
            @ApiResponse(responseCode = "400", description = "Blank or missing content",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Card not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Card is deleted",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<CardDto> updateCard(
            @Parameter(description = "Owner ID", required = true) @RequestHeader(OWNER_HEADER) UUID ownerId,
            @Parameter(description = "Card ID", required = true) @PathVariable UUID cardId,
            @RequestBody @Valid UpdateCardRequest request
    ) {
        return ResponseEntity.ok(cardService.updateCard(ownerId, cardId, request));
    }

    @DeleteMapping("/{cardId}")
    @Operation(summary = "Soft delete a card", description = "Hides the card from review. Scheduling state is kept.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Card deleted",
                    content = @Content(schema = @Schema(implementation = CardDto.class))),
            @ApiResponse(responseCode = "400", description = "Card already deleted",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Card not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<CardDto> deleteCard(
            @Parameter(description = "Owner ID", required = true) @RequestHeader(OWNER_HEADER) UUID ownerId,
            @Parameter(description = "Card ID", required = true) @PathVariable UUID cardId
    ) {
        return ResponseEntity.ok(cardService.softDeleteCard(ownerId, cardId));
    }

    @PostMapping("/{cardId}/restore")
    @Operation(summary = "Restore a card", description = "Returns a soft-deleted card to review with its scheduling state intact.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Card restored",
                    content = @Content(schema = @Schema(implementation = CardDto.class))),
            @ApiResponse(responseCode = "400", description = "Card is not deleted",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Card not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<CardDto> restoreCard(
            @Parameter(description = "Owner ID", required = true) @RequestHeader(OWNER_HEADER) UUID ownerId,
            @Parameter(description = "Card ID", required = true) @PathVariable UUID cardId
    ) {
        return ResponseEntity.ok(cardService.restoreCard(ownerId, cardId));
    }

    @PostMapping("/bulk-delete")
    @Operation(summary = "Bulk soft delete", description = "Soft deletes every listed card the owner holds; others are skipped.")
    @ApiResponse(responseCode = "200", description = "Bulk result",
            content = @Content(schema = @Schema(implementation = BulkCardResultDto.class)))
    public ResponseEntity<BulkCardResultDto> bulkDelete(
            @Parameter(description = "Owner ID", required = true) @RequestHeader(OWNER_HEADER) UUID ownerId,
            @RequestBody @Valid BulkCardRequest request
    ) {
        return ResponseEntity.ok(cardService.bulkDelete(ownerId, request.cardIds()));
    }

    @PostMapping("/bulk-restore")
    @Operation(summary = "Bulk restore", description = "Restores every listed soft-deleted card the owner holds.")
    @ApiResponse(responseCode = "200", description = "Bulk result",
            content = @Content(schema = @Schema(implementation = BulkCardResultDto.class)))
    public ResponseEntity<BulkCardResultDto> bulkRestore(
            @Parameter(description = "Owner ID", required = true) @RequestHeader(OWNER_HEADER) UUID ownerId,
            @RequestBody @Valid BulkCardRequest request
    ) {
        return ResponseEntity.ok(cardService.bulkRestore(ownerId, request.cardIds()));
    }

    @PostMapping("/bulk-archive")
    @Operation(summary = "Bulk archive", description = "Parks active cards outside the review queue. Scheduling state is kept.")
    @ApiResponse(responseCode = "200", description = "Bulk result",
            content = @Content(schema = @Schema(implementation = BulkCardResultDto.class)))
    public ResponseEntity<BulkCardResultDto> bulkArchive(
            @Parameter(description = "Owner ID", required = true) @RequestHeader(OWNER_HEADER) UUID ownerId,
            @RequestBody @Valid BulkCardRequest request
    ) {
        return ResponseEntity.ok(cardService.bulkArchive(ownerId, request.cardIds()));
    }

    @PostMapping("/bulk-unarchive")
    @Operation(summary = "Bulk unarchive", description = "Returns archived cards to the review queue.")
    @ApiResponse(responseCode = "200", description = "Bulk result",
            content = @Content(schema = @Schema(implementation = BulkCardResultDto.class)))
    public ResponseEntity<BulkCardResultDto> bulkUnarchive(
            @Parameter(description = "Owner ID", required = true) @RequestHeader(OWNER_HEADER) UUID ownerId,
            @RequestBody @Valid BulkCardRequest request
    ) {
        return ResponseEntity.ok(cardService.bulkUnarchive(ownerId, request.cardIds()));
    }
}
