package uk.gegc.recall.features.concept.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.recall.features.concept.domain.model.Phrasing;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PhrasingRepository extends JpaRepository<Phrasing, UUID> {

    Optional<Phrasing> findByIdAndUserId(UUID id, UUID userId);

    @Query("""
        SELECT p FROM Phrasing p
        WHERE p.userId = :userId AND p.conceptId = :conceptId
          AND p.archivedAt IS NULL AND p.deletedAt IS NULL
        ORDER BY p.createdAt ASC
    """)
    List<Phrasing> findActiveByConcept(@Param("userId") UUID userId,
                                       @Param("conceptId") UUID conceptId,
                                       Pageable pageable);

    @Query("""
        SELECT p FROM Phrasing p
        WHERE p.userId = :userId AND p.conceptId = :conceptId
          AND p.archivedAt IS NOT NULL AND p.deletedAt IS NULL
        ORDER BY p.createdAt ASC
    """)
    List<Phrasing> findArchivedByConcept(@Param("userId") UUID userId,
                                         @Param("conceptId") UUID conceptId,
                                         Pageable pageable);

    @Query("SELECT COUNT(p) FROM Phrasing p WHERE p.conceptId = :conceptId AND p.archivedAt IS NULL AND p.deletedAt IS NULL")
    long countActiveByConcept(@Param("conceptId") UUID conceptId);

    @Query("""
        SELECT p.question FROM Phrasing p
        WHERE p.conceptId = :conceptId AND p.archivedAt IS NULL AND p.deletedAt IS NULL
        ORDER BY p.createdAt ASC
    """)
    List<String> findActiveQuestions(@Param("conceptId") UUID conceptId, Pageable pageable);

    // Batch selectors: each filters on the field its patch changes so patched rows drop out.

    @Query("""
        SELECT p FROM Phrasing p
        WHERE p.userId = :userId AND p.conceptId = :conceptId AND p.archivedAt IS NULL
        ORDER BY p.id
    """)
    List<Phrasing> findNotArchivedBatch(@Param("userId") UUID userId,
                                        @Param("conceptId") UUID conceptId,
                                        Pageable pageable);

    @Query("""
        SELECT p FROM Phrasing p
        WHERE p.userId = :userId AND p.conceptId = :conceptId AND p.archivedAt IS NOT NULL
        ORDER BY p.id
    """)
    List<Phrasing> findArchivedBatch(@Param("userId") UUID userId,
                                     @Param("conceptId") UUID conceptId,
                                     Pageable pageable);

    @Query("""
        SELECT p FROM Phrasing p
        WHERE p.userId = :userId AND p.conceptId = :conceptId AND p.deletedAt IS NULL
        ORDER BY p.id
    """)
    List<Phrasing> findNotDeletedBatch(@Param("userId") UUID userId,
                                       @Param("conceptId") UUID conceptId,
                                       Pageable pageable);

    @Query("""
        SELECT p FROM Phrasing p
        WHERE p.userId = :userId AND p.conceptId = :conceptId AND p.deletedAt IS NOT NULL
        ORDER BY p.id
    """)
    List<Phrasing> findDeletedBatch(@Param("userId") UUID userId,
                                    @Param("conceptId") UUID conceptId,
                                    Pageable pageable);
}
