package uk.gegc.recall.features.generation.application.dto;

import java.util.UUID;

public record PhrasingWork(UUID jobId, UUID userId, UUID conceptId, PhrasingGenerationRequest request) {
}
