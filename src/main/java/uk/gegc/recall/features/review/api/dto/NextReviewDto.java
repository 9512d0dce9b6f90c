package uk.gegc.recall.features.review.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.recall.features.concept.api.dto.ConceptDto;
import uk.gegc.recall.features.concept.api.dto.PhrasingDto;
import uk.gegc.recall.features.review.domain.model.SelectionReason;

import java.time.Instant;
import java.util.List;

@Schema(name = "NextReviewDto", description = "The most urgent concept and the phrasing to present for it")
public record NextReviewDto(
        ConceptDto concept,
        PhrasingDto phrasing,
        @Schema(description = "1-based position of the phrasing among active phrasings", example = "2")
        int phrasingIndex,
        @Schema(description = "Active phrasings of the concept", example = "4")
        int totalPhrasings,
        @Schema(description = "Why this phrasing was chosen", example = "least-seen")
        SelectionReason selectionReason,
        @Schema(description = "Recall probability used for ordering; negative for never-reviewed material")
        double retrievability,
        @Schema(description = "Recent answers to this phrasing, newest first")
        List<InteractionDto> interactions,
        Instant serverTime
) {
}
