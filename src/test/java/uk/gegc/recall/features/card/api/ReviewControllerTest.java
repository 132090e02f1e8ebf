package uk.gegc.recall.features.card.api;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import uk.gegc.recall.features.card.api.dto.ReviewAnswerRequest;
import uk.gegc.recall.features.card.application.CardReviewService;
import uk.gegc.recall.features.card.application.ReviewQueueService;
import uk.gegc.recall.features.card.application.dto.*;
import uk.gegc.recall.features.card.application.exception.CardDeletedException;
import uk.gegc.recall.features.card.application.exception.ReviewAlreadyRecordedException;
import uk.gegc.recall.features.scheduling.domain.model.CardState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ReviewController.class)
@DisplayName("ReviewController Tests")
class ReviewControllerTest {

    private static final UUID OWNER_ID = UUID.fromString("10000000-0000-0000-0000-000000000001");
    private static final UUID CARD_ID = UUID.fromString("20000000-0000-0000-0000-000000000002");
    private static final Instant NOW = Instant.parse("2025-02-01T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private CardReviewService cardReviewService;

    @MockitoBean
    private ReviewQueueService reviewQueueService;

    @Test
    @DisplayName("POST /api/v1/review/cards/{id}/answers: valid answer returns 200")
    void recordAnswer_returns200() throws Exception {
        ReviewResultDto result = new ReviewResultDto(CARD_ID, true, CardState.NEW, CardState.LEARNING, null,
                2.3, 5.0, 10.0 / 1440.0, NOW.plusSeconds(600), 1, 0, false);
        when(cardReviewService.recordAnswer(eq(OWNER_ID), eq(CARD_ID), any(ReviewAnswerRequest.class)))
                .thenReturn(result);

        mockMvc.perform(post("/api/v1/review/cards/{id}/answers", CARD_ID)
                        .header(CardController.OWNER_HEADER, OWNER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"correct\":true,\"userAnswer\":\"Lima\",\"timeSpentMs\":900}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("LEARNING"))
                .andExpect(jsonPath("$.previousState").value("NEW"))
                .andExpect(jsonPath("$.reps").value(1));
    }

    @Test
    @DisplayName("POST answers: missing correctness returns 400")
    void recordAnswer_missingCorrect_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/review/cards/{id}/answers", CARD_ID)
                        .header(CardController.OWNER_HEADER, OWNER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"userAnswer\":\"Lima\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(cardReviewService);
    }

    @Test
    @DisplayName("POST answers: malformed JSON returns 400 problem detail")
    void recordAnswer_malformedJson_returns400() throws Exception {
        mockMvc.perform(post("/api/v1/review/cards/{id}/answers", CARD_ID)
                        .header(CardController.OWNER_HEADER, OWNER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"correct\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.title").value("Malformed JSON"));
    }

    @Test
    @DisplayName("POST answers: deleted card returns 409")
    void recordAnswer_deletedCard_returns409() throws Exception {
        when(cardReviewService.recordAnswer(eq(OWNER_ID), eq(CARD_ID), any()))
                .thenThrow(new CardDeletedException(CARD_ID));

        mockMvc.perform(post("/api/v1/review/cards/{id}/answers", CARD_ID)
                        .header(CardController.OWNER_HEADER, OWNER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"correct\":false}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.title").value("Card Deleted"));
    }

    @Test
    @DisplayName("POST answers: duplicate idempotency key returns 409")
    void recordAnswer_duplicate_returns409() throws Exception {
        UUID key = UUID.randomUUID();
        when(cardReviewService.recordAnswer(eq(OWNER_ID), eq(CARD_ID), any()))
                .thenThrow(new ReviewAlreadyRecordedException("Answer already recorded for key " + key));

        mockMvc.perform(post("/api/v1/review/cards/{id}/answers", CARD_ID)
                        .header(CardController.OWNER_HEADER, OWNER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"correct\":true,\"idempotencyKey\":\"" + key + "\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.title").value("Review Already Recorded"));
    }

    @Test
    @DisplayName("POST answers: exhausted optimistic lock retries return 409 with error code")
    void recordAnswer_lockConflict_returns409() throws Exception {
        when(cardReviewService.recordAnswer(eq(OWNER_ID), eq(CARD_ID), any()))
                .thenThrow(new OptimisticLockingFailureException("stale"));

        mockMvc.perform(post("/api/v1/review/cards/{id}/answers", CARD_ID)
                        .header(CardController.OWNER_HEADER, OWNER_ID)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"correct\":true}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorCode").value("CARD_VERSION_CONFLICT"));
    }

    @Test
    @DisplayName("GET /api/v1/review/next: nothing due returns 204")
    void next_nothingDue_returns204() throws Exception {
        when(reviewQueueService.getNextReview(OWNER_ID)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/review/next").header(CardController.OWNER_HEADER, OWNER_ID))
                .andExpect(status().isNoContent());
    }

    @Test
    @DisplayName("GET /api/v1/review/next: returns card with context")
    void next_returnsCard() throws Exception {
        CardDto card = new CardDto(CARD_ID, "Q", "A", CardState.REVIEW, 4.0, 5.0, 3, 0,
                NOW.minusSeconds(86400), NOW.minusSeconds(60), 1.0, 0.84, 3, 2, null, null, NOW.minusSeconds(864000), NOW.minusSeconds(60));
        when(reviewQueueService.getNextReview(OWNER_ID))
                .thenReturn(Optional.of(new NextReviewDto(card, List.of(), 67, 5)));

        mockMvc.perform(get("/api/v1/review/next").header(CardController.OWNER_HEADER, OWNER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.card.id").value(CARD_ID.toString()))
                .andExpect(jsonPath("$.successRate").value(67))
                .andExpect(jsonPath("$.totalReviewable").value(5));
    }

    @Test
    @DisplayName("GET /api/v1/review/due-count: returns counts")
    void dueCount() throws Exception {
        when(reviewQueueService.getDueCount(OWNER_ID)).thenReturn(new DueCountDto(3, 2, 5));

        mockMvc.perform(get("/api/v1/review/due-count").header(CardController.OWNER_HEADER, OWNER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.dueCount").value(3))
                .andExpect(jsonPath("$.newCount").value(2))
                .andExpect(jsonPath("$.totalReviewable").value(5));
    }

    @Test
    @DisplayName("GET /api/v1/review/stats: returns statistics")
    void stats() throws Exception {
        when(reviewQueueService.getStats(OWNER_ID)).thenReturn(new ReviewStatsDto(10, 4, 3, 3, null));

        mockMvc.perform(get("/api/v1/review/stats").header(CardController.OWNER_HEADER, OWNER_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCards").value(10))
                .andExpect(jsonPath("$.matureCount").value(3));
    }

    @Test
    @DisplayName("GET /api/v1/review/history: returns a page")
    void history() throws Exception {
        when(reviewQueueService.getHistory(eq(OWNER_ID), any(Pageable.class)))
                .thenReturn(new PageImpl<>(List.of()));

        mockMvc.perform(get("/api/v1/review/history").header(CardController.OWNER_HEADER, OWNER_ID)
                        .param("page", "0").param("size", "5"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content").isArray());
    }
}
