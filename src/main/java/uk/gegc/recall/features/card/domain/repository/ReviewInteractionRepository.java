package uk.gegc.recall.features.card.domain.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.recall.features.card.domain.model.ReviewInteraction;

import java.util.List;
import java.util.UUID;

public interface ReviewInteractionRepository extends JpaRepository<ReviewInteraction, UUID> {

    Page<ReviewInteraction> findByOwnerIdOrderByAnsweredAtDesc(UUID ownerId, Pageable pageable);

    List<ReviewInteraction> findTop10ByOwnerIdAndCard_IdOrderByAnsweredAtDesc(UUID ownerId, UUID cardId);

    boolean existsByIdempotencyKey(UUID idempotencyKey);
}
