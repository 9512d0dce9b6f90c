package uk.gegc.recall.features.generation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;

/**
 * Length limits are enforced by the service after trimming, so only presence is checked here.
 */
@Schema(name = "CreateGenerationJobRequest", description = "Request to generate concepts and phrasings from a prompt")
public record CreateGenerationJobRequest(
        @Schema(description = "What the learner wants to study", example = "Key events of the French Revolution, 1789-1799")
        @NotNull(message = "Prompt must not be null")
        String prompt
) {
}
