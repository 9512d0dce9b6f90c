package uk.gegc.recall.features.concept.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.recall.features.concept.domain.model.ContentType;
import uk.gegc.recall.features.scheduling.domain.model.CardState;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "ConceptDto", description = "A concept with its scheduling state")
public record ConceptDto(
        @Schema(description = "Concept ID") UUID id,
        @Schema(description = "Concept title", example = "Photosynthesis light reactions") String title,
        @Schema(description = "Short description") String description,
        @Schema(description = "How the material is best tested") ContentType contentType,
        @Schema(description = "Memory state") CardState state,
        @Schema(description = "Next review time (UTC)") Instant nextReview,
        @Schema(description = "Last review time (UTC)") Instant lastReview,
        @Schema(description = "Days until next review at scheduling time") int scheduledDays,
        @Schema(description = "Successful and failed reviews so far") int reps,
        @Schema(description = "Times forgotten after graduating") int lapses,
        @Schema(description = "Memory stability in days") double stability,
        @Schema(description = "Memory difficulty (1-10)") double difficulty,
        @Schema(description = "Active phrasings") int phrasingCount,
        @Schema(description = "Number of near-duplicate phrasings, if any") Integer conflictScore,
        @Schema(description = "How many phrasings short of the target, if any") Integer thinScore,
        @Schema(description = "Pinned phrasing, if any") UUID canonicalPhrasingId,
        @Schema(description = "Job that created this concept, if any") UUID generationJobId,
        Instant createdAt,
        Instant updatedAt,
        Instant archivedAt,
        Instant deletedAt
) {
}
