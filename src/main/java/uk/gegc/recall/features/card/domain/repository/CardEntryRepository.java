package uk.gegc.recall.features.card.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import uk.gegc.recall.features.card.domain.model.CardEntry;
import uk.gegc.recall.features.scheduling.domain.model.CardState;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface CardEntryRepository extends JpaRepository<CardEntry, UUID> {

    Optional<CardEntry> findByIdAndOwnerId(UUID id, UUID ownerId);

    List<CardEntry> findByOwnerIdOrderByCreatedAtAsc(UUID ownerId);

    List<CardEntry> findByOwnerIdAndDeletedAtIsNullOrderByCreatedAtAsc(UUID ownerId);

    List<CardEntry> findByIdInAndOwnerId(Collection<UUID> ids, UUID ownerId);

    // Review queue: neither deleted nor archived
    List<CardEntry> findByOwnerIdAndDeletedAtIsNullAndArchivedAtIsNullOrderByCreatedAtAsc(UUID ownerId);

    long countByOwnerIdAndDeletedAtIsNullAndArchivedAtIsNull(UUID ownerId);

    long countByOwnerIdAndDeletedAtIsNullAndArchivedAtIsNullAndStateIn(UUID ownerId, Collection<CardState> states);

    Optional<CardEntry> findFirstByOwnerIdAndDeletedAtIsNullAndArchivedAtIsNullAndNextReviewAtAfterOrderByNextReviewAtAsc(
            UUID ownerId, Instant after);
}
