package uk.gegc.recall.features.review.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.recall.features.review.domain.model.Interaction;

import java.util.List;
import java.util.UUID;

@Repository
public interface InteractionRepository extends JpaRepository<Interaction, UUID> {

    /**
     * Most recent answers to one phrasing, newest first
     */
    List<Interaction> findByUserIdAndPhrasingIdOrderByAttemptedAtDesc(UUID userId, UUID phrasingId, Pageable pageable);

    long countByUserIdAndConceptId(UUID userId, UUID conceptId);
}
