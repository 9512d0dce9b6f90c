package uk.gegc.recall.features.concept.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.List;

@Schema(name = "ConceptDetailDto", description = "A concept with its phrasings")
public record ConceptDetailDto(
        ConceptDto concept,
        @Schema(description = "Active phrasings, oldest first") List<PhrasingDto> phrasings,
        @Schema(description = "Archived phrasings, oldest first") List<PhrasingDto> archivedPhrasings,
        @Schema(description = "Whether a generation job is currently producing phrasings for this concept")
        boolean generationInProgress
) {
}
