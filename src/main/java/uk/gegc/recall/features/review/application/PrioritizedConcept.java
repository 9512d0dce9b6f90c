package uk.gegc.recall.features.review.application;

import uk.gegc.recall.features.concept.domain.model.Concept;

/**
 * A queue entry. Lower retrievability is more urgent; values below zero mark unseen material.
 */
public record PrioritizedConcept(Concept concept, double retrievability) {
}
