package uk.gegc.recall.features.generation.application.dto;

import uk.gegc.recall.features.concept.domain.model.ContentType;

public record PreparedConcept(
        String title,
        String description,
        ContentType contentType,
        String originIntent
) {
}
