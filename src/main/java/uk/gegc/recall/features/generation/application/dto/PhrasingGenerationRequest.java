package uk.gegc.recall.features.generation.application.dto;

import uk.gegc.recall.features.concept.domain.model.ContentType;

import java.util.List;

public record PhrasingGenerationRequest(
        String conceptTitle,
        String conceptDescription,
        ContentType contentType,
        String originIntent,
        int targetCount,
        List<String> existingQuestions
) {
}
