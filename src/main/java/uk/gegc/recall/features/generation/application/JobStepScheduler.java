package uk.gegc.recall.features.generation.application;

import java.util.UUID;

/**
 * Defers the next unit of job work. Called inside a transaction, the step runs only once that
 * transaction has committed.
 */
public interface JobStepScheduler {

    void scheduleConceptSynthesis(UUID jobId);

    void schedulePhrasingGeneration(UUID jobId, UUID conceptId);
}
