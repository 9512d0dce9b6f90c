package uk.gegc.recall.features.stats.application;

import uk.gegc.recall.features.stats.api.dto.DueCountDto;
import uk.gegc.recall.features.stats.api.dto.UserCardStatsDto;
import uk.gegc.recall.features.stats.domain.model.StatsDelta;

import java.util.UUID;

public interface UserStatsService {

    /**
     * Apply a delta inside the caller's transaction, creating the user's row if needed.
     * Null or empty deltas are ignored.
     */
    void applyDelta(UUID userId, StatsDelta delta);

    /**
     * Insert a zeroed stats row for the user in its own transaction; no-op when it exists.
     * Throws {@code DataIntegrityViolationException} when a concurrent insert wins.
     */
    void ensureStatsRow(UUID userId);

    DueCountDto getDueCount(UUID userId);

    UserCardStatsDto getUserCardStats(UUID userId);

    /**
     * Recompute every counter from the concept table and overwrite the cached row.
     */
    UserCardStatsDto reconcile(UUID userId);

    /**
     * Reconcile every user that has a stats row.
     *
     * @return number of users reconciled
     */
    int reconcileAll();
}
