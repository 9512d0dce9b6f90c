package uk.gegc.recall.features.generation.application.dto;

import uk.gegc.recall.features.concept.domain.model.PhrasingType;

import java.util.List;

/**
 * A validated phrasing ready to persist. {@code correctAnswer} is always one of {@code options}.
 */
public record PreparedPhrasing(
        String question,
        String explanation,
        PhrasingType type,
        List<String> options,
        String correctAnswer
) {
}
