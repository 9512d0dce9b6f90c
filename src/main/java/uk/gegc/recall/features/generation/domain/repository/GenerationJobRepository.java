package uk.gegc.recall.features.generation.domain.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.recall.features.generation.domain.model.GenerationJob;
import uk.gegc.recall.features.generation.domain.model.JobStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface GenerationJobRepository extends JpaRepository<GenerationJob, UUID> {

    List<JobStatus> ACTIVE_STATUSES = List.of(JobStatus.PENDING, JobStatus.PROCESSING);

    Optional<GenerationJob> findByIdAndUserId(UUID id, UUID userId);

    /**
     * Find all jobs for a user with pagination, newest first
     */
    Page<GenerationJob> findByUserIdOrderByCreatedAtDesc(UUID userId, Pageable pageable);

    long countByUserIdAndStatusIn(UUID userId, Collection<JobStatus> statuses);

    /**
     * Count jobs in the given statuses that created the concept or still have it pending
     */
    @Query("""
        SELECT COUNT(j) FROM GenerationJob j
        WHERE j.userId = :userId
          AND j.status IN :statuses
          AND (:conceptId MEMBER OF j.pendingConceptIds OR :conceptId MEMBER OF j.conceptIds)
    """)
    long countCoveringConcept(@Param("userId") UUID userId,
                                     @Param("conceptId") UUID conceptId,
                                     @Param("statuses") Collection<JobStatus> statuses);

    /**
     * Find a job by ID with pessimistic write lock for atomic step processing
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT j FROM GenerationJob j WHERE j.id = :id")
    Optional<GenerationJob> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Find jobs in the given statuses whose last start (or creation) is before the cutoff
     */
    @Query("""
        SELECT j FROM GenerationJob j
        WHERE j.status IN :statuses
          AND COALESCE(j.startedAt, j.createdAt) < :cutoffTime
    """)
    List<GenerationJob> findStuckJobs(@Param("statuses") Collection<JobStatus> statuses,
                                      @Param("cutoffTime") Instant cutoffTime);

    /**
     * Find terminal jobs in the given statuses completed before the cutoff
     */
    List<GenerationJob> findByStatusInAndCompletedAtBefore(Collection<JobStatus> statuses, Instant cutoffTime);
}
