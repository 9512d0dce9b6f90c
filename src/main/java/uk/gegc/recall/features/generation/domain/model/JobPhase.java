package uk.gegc.recall.features.generation.domain.model;

/**
 * Progress marker within a processing job. Phases only move forward.
 */
public enum JobPhase {
    CLARIFYING,
    CONCEPT_SYNTHESIS,
    GENERATING,
    PHRASING_GENERATION,
    FINALIZING;

    public boolean isBefore(JobPhase other) {
        return ordinal() < other.ordinal();
    }
}
