package uk.gegc.recall.features.card.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springdoc.core.annotations.ParameterObject;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.web.PageableDefault;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.recall.features.card.api.dto.ReviewAnswerRequest;
import uk.gegc.recall.features.card.application.CardReviewService;
import uk.gegc.recall.features.card.application.ReviewQueueService;
import uk.gegc.recall.features.card.application.dto.*;

import java.util.UUID;

import static uk.gegc.recall.features.card.api.CardController.OWNER_HEADER;

@Tag(name = "Review", description = "Review queue, answers, statistics and history")
@RestController
@RequestMapping("/api/v1/review")
@RequiredArgsConstructor
@Validated
public class ReviewController {

    private final CardReviewService cardReviewService;
    private final ReviewQueueService reviewQueueService;

    @PostMapping("/cards/{cardId}/answers")
    @Operation(
            summary = "Record an answer",
            description = "Updates stability and difficulty, moves the card through its states and schedules the next review. "
                    + "An idempotency key prevents double-processing."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Answer recorded",
                    content = @Content(schema = @Schema(implementation = ReviewResultDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Card not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "409", description = "Card deleted, duplicate key or concurrent modification",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<ReviewResultDto> recordAnswer(
            @Parameter(description = "Owner ID", required = true) @RequestHeader(OWNER_HEADER) UUID ownerId,
            @Parameter(description = "Card ID", required = true) @PathVariable UUID cardId,
            @RequestBody @Valid ReviewAnswerRequest request
    ) {
        return ResponseEntity.ok(cardReviewService.recordAnswer(ownerId, cardId, request));
    }

    @GetMapping("/next")
    @Operation(summary = "Get next card", description = "Most overdue card first, then new cards. 204 when nothing is due.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Next card",
                    content = @Content(schema = @Schema(implementation = NextReviewDto.class))),
            @ApiResponse(responseCode = "204", description = "Nothing due")
    })
    public ResponseEntity<NextReviewDto> getNext(
            @Parameter(description = "Owner ID", required = true) @RequestHeader(OWNER_HEADER) UUID ownerId
    ) {
        return reviewQueueService.getNextReview(ownerId)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/due-count")
    @Operation(summary = "Count due cards")
    @ApiResponse(responseCode = "200", description = "Due counts",
            content = @Content(schema = @Schema(implementation = DueCountDto.class)))
    public ResponseEntity<DueCountDto> getDueCount(
            @Parameter(description = "Owner ID", required = true) @RequestHeader(OWNER_HEADER) UUID ownerId
    ) {
        return ResponseEntity.ok(reviewQueueService.getDueCount(ownerId));
    }

    @GetMapping("/stats")
    @Operation(summary = "Get review statistics")
    @ApiResponse(responseCode = "200", description = "Statistics",
            content = @Content(schema = @Schema(implementation = ReviewStatsDto.class)))
    public ResponseEntity<ReviewStatsDto> getStats(
            @Parameter(description = "Owner ID", required = true) @RequestHeader(OWNER_HEADER) UUID ownerId
    ) {
        return ResponseEntity.ok(reviewQueueService.getStats(ownerId));
    }

    @GetMapping("/history")
    @Operation(summary = "Get answer history", description = "Recorded answers ordered by answeredAt DESC.")
    @ApiResponse(responseCode = "200", description = "Page of answers",
            content = @Content(schema = @Schema(implementation = ReviewInteractionDto.class)))
    public ResponseEntity<Page<ReviewInteractionDto>> getHistory(
            @Parameter(description = "Owner ID", required = true) @RequestHeader(OWNER_HEADER) UUID ownerId,
            @ParameterObject @PageableDefault(page = 0, size = 20) Pageable pageable
    ) {
        return ResponseEntity.ok(reviewQueueService.getHistory(ownerId, pageable));
    }
}
