package uk.gegc.recall.features.concept.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import uk.gegc.recall.features.concept.application.ConceptBulkAction;

import java.util.List;
import java.util.UUID;

@Schema(name = "BulkActionRequest", description = "Apply one lifecycle action to several concepts")
public record BulkActionRequest(
        @Schema(description = "Action to apply", example = "ARCHIVE")
        @NotNull(message = "Action must not be null")
        ConceptBulkAction action,

        @Schema(description = "Concepts to act on; duplicates are ignored")
        @NotEmpty(message = "At least one concept ID is required")
        @Size(max = 100, message = "At most 100 concepts can be processed at once")
        List<@NotNull UUID> conceptIds
) {
}
