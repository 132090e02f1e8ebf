package uk.gegc.recall.features.card.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.recall.features.card.application.dto.DueCountDto;
import uk.gegc.recall.features.card.application.dto.NextReviewDto;
import uk.gegc.recall.features.card.application.dto.ReviewInteractionDto;
import uk.gegc.recall.features.card.application.dto.ReviewStatsDto;

import java.util.Optional;
import java.util.UUID;

public interface ReviewQueueService {

    Optional<NextReviewDto> getNextReview(UUID ownerId);

    DueCountDto getDueCount(UUID ownerId);

    ReviewStatsDto getStats(UUID ownerId);

    Page<ReviewInteractionDto> getHistory(UUID ownerId, Pageable pageable);
}
