package uk.gegc.recall.features.concept.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

@Schema(name = "UpdateConceptRequest", description = "Edit a concept's title and description")
public record UpdateConceptRequest(
        @Schema(description = "New title", example = "Storming of the Bastille")
        @NotBlank(message = "Title cannot be empty")
        @Size(max = 500, message = "Title must not exceed 500 characters")
        String title,

        @Schema(description = "New description; omit to keep the current one")
        @Size(max = 4000, message = "Description must not exceed 4000 characters")
        String description
) {
}
