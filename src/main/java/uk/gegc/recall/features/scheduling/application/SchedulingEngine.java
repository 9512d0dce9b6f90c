package uk.gegc.recall.features.scheduling.application;

import uk.gegc.recall.features.scheduling.domain.model.FsrsMemoryState;
import uk.gegc.recall.features.scheduling.domain.model.Rating;

import java.time.Instant;

/**
 * Pure scheduling functions over a concept's memory state. No I/O and no shared state.
 */
public interface SchedulingEngine {

    /**
     * Returned by {@link #getRetrievability} for material that has never been reviewed.
     * Callers treat any negative value as the highest priority, never as a probability.
     */
    double UNSEEN_RETRIEVABILITY = -1;

    ScheduleResult schedule(FsrsMemoryState state, boolean isCorrect, Instant now);

    double getRetrievability(FsrsMemoryState state, Instant now);

    FsrsMemoryState initializeState(Instant now);

    boolean isDue(FsrsMemoryState state, Instant now);

    MemoryModel.Card toCard(FsrsMemoryState state);

    FsrsMemoryState fromCard(MemoryModel.Card card);

    record ScheduleResult(FsrsMemoryState state, Rating rating) {}
}
