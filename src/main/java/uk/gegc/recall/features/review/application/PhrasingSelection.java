package uk.gegc.recall.features.review.application;

import uk.gegc.recall.features.concept.domain.model.Phrasing;
import uk.gegc.recall.features.review.domain.model.SelectionReason;

/**
 * @param phrasingIndex 1-based position of {@code phrasing} among the concept's active phrasings
 */
public record PhrasingSelection(
        Phrasing phrasing,
        int totalPhrasings,
        int phrasingIndex,
        SelectionReason selectionReason
) {
}
