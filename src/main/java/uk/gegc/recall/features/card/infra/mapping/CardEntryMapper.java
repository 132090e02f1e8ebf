package uk.gegc.recall.features.card.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.recall.features.card.api.dto.UpdateCardRequest;
import uk.gegc.recall.features.card.application.dto.CardDto;
import uk.gegc.recall.features.card.application.dto.ReviewInteractionDto;
import uk.gegc.recall.features.card.application.dto.ReviewResultDto;
import uk.gegc.recall.features.card.domain.model.CardEntry;
import uk.gegc.recall.features.card.domain.model.ReviewInteraction;
import uk.gegc.recall.features.scheduling.application.CardScheduler;
import uk.gegc.recall.features.scheduling.domain.model.Card;

@Component
public class CardEntryMapper {

    public Card toCard(CardEntry entry) {
        return Card.builder()
                .id(entry.getId())
                .ownerId(entry.getOwnerId())
                .state(entry.getState())
                .stability(entry.getStability())
                .difficulty(entry.getDifficulty())
                .reps(nullToZero(entry.getReps()))
                .lapses(nullToZero(entry.getLapses()))
                .lastReviewAt(entry.getLastReviewAt())
                .nextReviewAt(entry.getNextReviewAt())
                .scheduledDays(entry.getScheduledDays() == null ? 0.0 : entry.getScheduledDays())
                .deletedAt(entry.getDeletedAt())
                .archivedAt(entry.getArchivedAt())
                .build();
    }

    /**
     * Copies the scheduling fields and the delete/archive markers of
     * {@code card} onto the entity. Content, attempt counters and audit
     * columns are left untouched.
     */
    public void applyScheduling(CardEntry entry, Card card) {
        entry.setState(card.state());
        entry.setStability(card.stability());
        entry.setDifficulty(card.difficulty());
        entry.setReps(card.reps());
        entry.setLapses(card.lapses());
        entry.setLastReviewAt(card.lastReviewAt());
        entry.setNextReviewAt(card.nextReviewAt());
        entry.setScheduledDays(card.scheduledDays());
        entry.setDeletedAt(card.deletedAt());
        entry.setArchivedAt(card.archivedAt());
    }

    public void updateContent(CardEntry entry, UpdateCardRequest request) {
        if (request.questionText() != null) {
            entry.setQuestionText(request.questionText().trim());
        }
        if (request.correctAnswer() != null) {
            entry.setCorrectAnswer(request.correctAnswer().trim());
        }
    }

    public CardDto toDto(CardEntry entry, Double retrievability) {
        return new CardDto(
                entry.getId(),
                entry.getQuestionText(),
                entry.getCorrectAnswer(),
                entry.getState(),
                entry.getStability(),
                entry.getDifficulty(),
                nullToZero(entry.getReps()),
                nullToZero(entry.getLapses()),
                entry.getLastReviewAt(),
                entry.getNextReviewAt(),
                entry.getScheduledDays() == null ? 0.0 : entry.getScheduledDays(),
                retrievability,
                nullToZero(entry.getAttemptCount()),
                nullToZero(entry.getCorrectCount()),
                entry.getDeletedAt(),
                entry.getArchivedAt(),
                entry.getCreatedAt(),
                entry.getUpdatedAt()
        );
    }

    public ReviewResultDto toResultDto(CardScheduler.SchedulingResult result, boolean correct) {
        Card card = result.card();
        return new ReviewResultDto(
                card.id(),
                correct,
                result.previousState(),
                card.state(),
                result.retrievability(),
                card.stability(),
                card.difficulty(),
                card.scheduledDays(),
                card.nextReviewAt(),
                card.reps(),
                card.lapses(),
                result.isLapse()
        );
    }

    public ReviewInteractionDto toInteractionDto(ReviewInteraction interaction) {
        return new ReviewInteractionDto(
                interaction.getId(),
                interaction.getCard().getId(),
                interaction.getUserAnswer(),
                Boolean.TRUE.equals(interaction.getIsCorrect()),
                interaction.getAnsweredAt(),
                interaction.getTimeSpentMs(),
                interaction.getSessionId(),
                interaction.getStateBefore(),
                interaction.getStateAfter(),
                interaction.getRetrievability(),
                interaction.getStability(),
                interaction.getDifficulty(),
                interaction.getScheduledDays(),
                interaction.getNextReviewAt()
        );
    }

    private static int nullToZero(Integer value) {
        return value == null ? 0 : value;
    }
}
