package uk.gegc.recall.features.concept.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "BulkActionResultDto", description = "Outcome of a bulk lifecycle action")
public record BulkActionResultDto(
        @Schema(description = "Distinct concept IDs requested", example = "12") int requested,
        @Schema(description = "Concepts whose state changed", example = "10") int processed,
        @Schema(description = "Concepts missing, foreign or already in the target state", example = "2") int skipped
) {
}
