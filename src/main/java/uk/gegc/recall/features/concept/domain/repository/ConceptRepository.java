package uk.gegc.recall.features.concept.domain.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.recall.features.concept.domain.model.Concept;
import uk.gegc.recall.features.scheduling.domain.model.CardState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ConceptRepository extends JpaRepository<Concept, UUID> {

    Optional<Concept> findByIdAndUserId(UUID id, UUID userId);

    /**
     * Active, reviewable concepts whose next review is at or before {@code now}, earliest first
     */
    @Query("""
        SELECT c FROM Concept c
        WHERE c.userId = :userId
          AND c.deletedAt IS NULL AND c.archivedAt IS NULL
          AND c.phrasingCount > 0
          AND c.fsrs.nextReview <= :now
        ORDER BY c.fsrs.nextReview ASC
    """)
    List<Concept> findDueCandidates(@Param("userId") UUID userId, @Param("now") Instant now, Pageable pageable);

    /**
     * Active, reviewable concepts in the given memory state regardless of due date
     */
    @Query("""
        SELECT c FROM Concept c
        WHERE c.userId = :userId
          AND c.deletedAt IS NULL AND c.archivedAt IS NULL
          AND c.phrasingCount > 0
          AND c.fsrs.state = :state
        ORDER BY c.createdAt ASC
    """)
    List<Concept> findCandidatesInState(@Param("userId") UUID userId, @Param("state") CardState state, Pageable pageable);

    /**
     * Most recent titles of the user's non-deleted concepts, used for duplicate detection
     */
    @Query("SELECT c.title FROM Concept c WHERE c.userId = :userId AND c.deletedAt IS NULL ORDER BY c.createdAt DESC")
    List<String> findRecentTitles(@Param("userId") UUID userId, Pageable pageable);

    @Query("SELECT c FROM Concept c WHERE c.userId = :userId AND c.deletedAt IS NULL AND c.archivedAt IS NULL")
    Page<Concept> findActive(@Param("userId") UUID userId, Pageable pageable);

    @Query("""
        SELECT c FROM Concept c
        WHERE c.userId = :userId AND c.deletedAt IS NULL AND c.archivedAt IS NULL
          AND c.fsrs.nextReview <= :now
    """)
    Page<Concept> findActiveDue(@Param("userId") UUID userId, @Param("now") Instant now, Pageable pageable);

    @Query("""
        SELECT c FROM Concept c
        WHERE c.userId = :userId AND c.deletedAt IS NULL AND c.archivedAt IS NULL
          AND c.thinScore IS NOT NULL AND c.thinScore > 0
    """)
    Page<Concept> findActiveThin(@Param("userId") UUID userId, Pageable pageable);

    @Query("""
        SELECT c FROM Concept c
        WHERE c.userId = :userId AND c.deletedAt IS NULL AND c.archivedAt IS NULL
          AND c.conflictScore IS NOT NULL AND c.conflictScore > 0
    """)
    Page<Concept> findActiveInTension(@Param("userId") UUID userId, Pageable pageable);

    @Query("SELECT c FROM Concept c WHERE c.userId = :userId AND c.deletedAt IS NULL AND c.archivedAt IS NOT NULL")
    Page<Concept> findArchived(@Param("userId") UUID userId, Pageable pageable);

    @Query("SELECT c FROM Concept c WHERE c.userId = :userId AND c.deletedAt IS NOT NULL")
    Page<Concept> findDeleted(@Param("userId") UUID userId, Pageable pageable);

    /**
     * Page through every active concept of a user in id order, for stats reconciliation
     */
    @Query("SELECT c FROM Concept c WHERE c.userId = :userId AND c.deletedAt IS NULL AND c.archivedAt IS NULL ORDER BY c.id")
    Slice<Concept> findActiveForScan(@Param("userId") UUID userId, Pageable pageable);
}
