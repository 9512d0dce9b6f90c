package uk.gegc.recall.features.generation.application.dto;

import uk.gegc.recall.features.concept.domain.model.ContentType;

/**
 * A candidate concept proposed by the model. Fields are raw model output and may be blank.
 */
public record ConceptIdea(
        String title,
        String description,
        String whyItMatters,
        ContentType contentType,
        String originIntent
) {
}
