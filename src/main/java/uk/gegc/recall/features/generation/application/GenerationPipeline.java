package uk.gegc.recall.features.generation.application;

import java.util.UUID;

/**
 * Executes one bounded step of a generation job. Steps never throw: failures are classified
 * and persisted on the job.
 */
public interface GenerationPipeline {

    /**
     * Stage A: synthesise and persist concepts, then schedule one phrasing step per concept.
     */
    void runConceptSynthesis(UUID jobId);

    /**
     * Stage B: generate and persist phrasings for one pending concept of the job.
     */
    void runPhrasingGeneration(UUID jobId, UUID conceptId);
}
