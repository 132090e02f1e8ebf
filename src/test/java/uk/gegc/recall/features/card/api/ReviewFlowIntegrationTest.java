package uk.gegc.recall.features.card.api;

import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import uk.gegc.recall.BaseIntegrationTest;

import java.util.UUID;

import static org.hamcrest.Matchers.nullValue;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("Review flow integration tests")
class ReviewFlowIntegrationTest extends BaseIntegrationTest {

    private String createCard(UUID ownerId, String question) throws Exception {
        String body = mockMvc.perform(post("/api/v1/cards")
                        .header(CardController.OWNER_HEADER, ownerId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"questionText\":\"" + question + "\",\"correctAnswer\":\"x\"}"))
                .andExpect(status().isCreated())
                .andReturn().getResponse().getContentAsString();
        return JsonPath.read(body, "$.id");
    }

    private String answer(boolean correct, UUID key) {
        return "{\"correct\":" + correct + (key == null ? "" : ",\"idempotencyKey\":\"" + key + "\"") + "}";
    }

    @Test
    @DisplayName("new card is served, answered, counted and logged")
    void newCardLifecycle() throws Exception {
        UUID owner = UUID.randomUUID();
        String cardId = createCard(owner, "Capital of Peru?");

        mockMvc.perform(get("/api/v1/review/due-count").header(CardController.OWNER_HEADER, owner))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.newCount").value(1))
                .andExpect(jsonPath("$.dueCount").value(0));

        mockMvc.perform(get("/api/v1/review/next").header(CardController.OWNER_HEADER, owner))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.card.id").value(cardId))
                .andExpect(jsonPath("$.successRate").value(nullValue()));

        mockMvc.perform(post("/api/v1/review/cards/{id}/answers", cardId)
                        .header(CardController.OWNER_HEADER, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(answer(true, null)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.previousState").value("NEW"))
                .andExpect(jsonPath("$.state").value("LEARNING"))
                .andExpect(jsonPath("$.reps").value(1))
                .andExpect(jsonPath("$.stability").value(2.3));

        mockMvc.perform(get("/api/v1/review/next").header(CardController.OWNER_HEADER, owner))
                .andExpect(status().isNoContent());

        mockMvc.perform(get("/api/v1/review/stats").header(CardController.OWNER_HEADER, owner))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalCards").value(1))
                .andExpect(jsonPath("$.learningCount").value(1))
                .andExpect(jsonPath("$.newCount").value(0));

        mockMvc.perform(get("/api/v1/review/history").header(CardController.OWNER_HEADER, owner))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.content[0].cardId").value(cardId))
                .andExpect(jsonPath("$.content[0].stateAfter").value("LEARNING"));

        mockMvc.perform(get("/api/v1/cards/{id}", cardId).header(CardController.OWNER_HEADER, owner))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.attemptCount").value(1))
                .andExpect(jsonPath("$.correctCount").value(1));
    }

    @Test
    @DisplayName("repeating an idempotency key is rejected and does not reschedule twice")
    void idempotentAnswer() throws Exception {
        UUID owner = UUID.randomUUID();
        String cardId = createCard(owner, "2 + 2?");
        UUID key = UUID.randomUUID();

        mockMvc.perform(post("/api/v1/review/cards/{id}/answers", cardId)
                        .header(CardController.OWNER_HEADER, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(answer(false, key)))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/v1/review/cards/{id}/answers", cardId)
                        .header(CardController.OWNER_HEADER, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(answer(false, key)))
                .andExpect(status().isConflict());

        mockMvc.perform(get("/api/v1/cards/{id}", cardId).header(CardController.OWNER_HEADER, owner))
                .andExpect(jsonPath("$.reps").value(1));
    }

    @Test
    @DisplayName("deleted cards cannot be answered and come back unchanged on restore")
    void deleteAndRestore() throws Exception {
        UUID owner = UUID.randomUUID();
        String cardId = createCard(owner, "Boiling point of water?");

        mockMvc.perform(post("/api/v1/review/cards/{id}/answers", cardId)
                        .header(CardController.OWNER_HEADER, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(answer(true, null)))
                .andExpect(status().isOk());

        mockMvc.perform(delete("/api/v1/cards/{id}", cardId).header(CardController.OWNER_HEADER, owner))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.deletedAt").isNotEmpty());

        mockMvc.perform(post("/api/v1/review/cards/{id}/answers", cardId)
                        .header(CardController.OWNER_HEADER, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(answer(true, null)))
                .andExpect(status().isConflict());

        mockMvc.perform(get("/api/v1/review/due-count").header(CardController.OWNER_HEADER, owner))
                .andExpect(jsonPath("$.totalReviewable").value(0));

        mockMvc.perform(post("/api/v1/cards/{id}/restore", cardId).header(CardController.OWNER_HEADER, owner))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.state").value("LEARNING"))
                .andExpect(jsonPath("$.reps").value(1))
                .andExpect(jsonPath("$.stability").value(2.3))
                .andExpect(jsonPath("$.deletedAt").value(nullValue()));
    }

    @Test
    @DisplayName("archived cards leave the queue, keep their schedule and come back on unarchive")
    void archiveEditAndUnarchive() throws Exception {
        UUID owner = UUID.randomUUID();
        String cardId = createCard(owner, "Speed of light?");

        mockMvc.perform(post("/api/v1/review/cards/{id}/answers", cardId)
                        .header(CardController.OWNER_HEADER, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(answer(false, null)))
                .andExpect(status().isOk());

        mockMvc.perform(post("/api/v1/cards/bulk-archive")
                        .header(CardController.OWNER_HEADER, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cardIds\":[\"" + cardId + "\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.processed[0]").value(cardId));

        mockMvc.perform(get("/api/v1/review/next").header(CardController.OWNER_HEADER, owner))
                .andExpect(status().isNoContent());
        mockMvc.perform(get("/api/v1/review/stats").header(CardController.OWNER_HEADER, owner))
                .andExpect(jsonPath("$.totalCards").value(0));

        mockMvc.perform(patch("/api/v1/cards/{id}", cardId)
                        .header(CardController.OWNER_HEADER, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"questionText\":\"Speed of light in vacuum?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.questionText").value("Speed of light in vacuum?"))
                .andExpect(jsonPath("$.state").value("LEARNING"))
                .andExpect(jsonPath("$.reps").value(1))
                .andExpect(jsonPath("$.stability").value(0.4))
                .andExpect(jsonPath("$.archivedAt").isNotEmpty());

        mockMvc.perform(post("/api/v1/cards/bulk-unarchive")
                        .header(CardController.OWNER_HEADER, owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cardIds\":[\"" + cardId + "\"]}"))
                .andExpect(status().isOk());

        mockMvc.perform(get("/api/v1/cards/{id}", cardId).header(CardController.OWNER_HEADER, owner))
                .andExpect(jsonPath("$.archivedAt").value(nullValue()))
                .andExpect(jsonPath("$.stability").value(0.4))
                .andExpect(jsonPath("$.attemptCount").value(1));
        mockMvc.perform(get("/api/v1/review/stats").header(CardController.OWNER_HEADER, owner))
                .andExpect(jsonPath("$.totalCards").value(1))
                .andExpect(jsonPath("$.learningCount").value(1));
    }

    @Test
    @DisplayName("cards of another owner are invisible")
    void ownerIsolation() throws Exception {
        UUID owner = UUID.randomUUID();
        String cardId = createCard(owner, "Owned?");

        mockMvc.perform(get("/api/v1/cards/{id}", cardId).header(CardController.OWNER_HEADER, UUID.randomUUID()))
                .andExpect(status().isNotFound());
    }
}
