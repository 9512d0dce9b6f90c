package uk.gegc.recall.features.stats.domain.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.recall.features.stats.domain.model.UserStats;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserStatsRepository extends JpaRepository<UserStats, UUID> {

    Optional<UserStats> findByUserId(UUID userId);

    /**
     * Page through users that have a stats row, for scheduled reconciliation
     */
    @Query("SELECT s.userId FROM UserStats s ORDER BY s.userId")
    Page<UUID> findUserIds(Pageable pageable);

    /**
     * Atomically add signed deltas to every counter, clamping each result at zero.
     * <p>
     * This method performs a single UPDATE without loading the entity, so concurrent
     * reviews of the same user never lose an increment.
     *
     * @return number of rows updated, 0 when the user has no stats row yet
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE UserStats s
        SET s.totalCards = CASE WHEN s.totalCards + :totalCards < 0 THEN 0 ELSE s.totalCards + :totalCards END,
            s.newCount = CASE WHEN s.newCount + :newCount < 0 THEN 0 ELSE s.newCount + :newCount END,
            s.learningCount = CASE WHEN s.learningCount + :learningCount < 0 THEN 0 ELSE s.learningCount + :learningCount END,
            s.matureCount = CASE WHEN s.matureCount + :matureCount < 0 THEN 0 ELSE s.matureCount + :matureCount END,
            s.dueNowCount = CASE WHEN s.dueNowCount + :dueNowCount < 0 THEN 0 ELSE s.dueNowCount + :dueNowCount END,
            s.lastCalculated = :now
        WHERE s.userId = :userId
    """)
    int applyDelta(@Param("userId") UUID userId,
                   @Param("totalCards") long totalCards,
                   @Param("newCount") long newCount,
                   @Param("learningCount") long learningCount,
                   @Param("matureCount") long matureCount,
                   @Param("dueNowCount") long dueNowCount,
                   @Param("now") Instant now);

    /**
     * Move the cached earliest review time back to {@code candidate} when it is earlier
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE UserStats s
        SET s.nextReviewTime = :candidate
        WHERE s.userId = :userId
          AND (s.nextReviewTime IS NULL OR s.nextReviewTime > :candidate)
    """)
    int lowerNextReviewTime(@Param("userId") UUID userId, @Param("candidate") Instant candidate);
}
