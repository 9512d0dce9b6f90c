package uk.gegc.recall.features.generation.domain.model;

/**
 * Classified failure of a job step, persisted on the job.
 */
public enum GenerationErrorCode {
    SCHEMA_VALIDATION,
    RATE_LIMIT,
    API_KEY,
    NETWORK,
    UNKNOWN
}
