package uk.gegc.recall.features.generation.application.dto;

import java.util.UUID;

/**
 * What a concept synthesis step needs once the job has been claimed.
 */
public record ConceptSynthesisWork(UUID jobId, UUID userId, String prompt) {
}
