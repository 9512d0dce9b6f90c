package uk.gegc.recall.features.generation.application.dto;

/**
 * Job counters after a concept has left the pending set.
 */
public record JobProgress(int pendingCount, int phrasingGenerated, int phrasingSaved, boolean completed) {
}
