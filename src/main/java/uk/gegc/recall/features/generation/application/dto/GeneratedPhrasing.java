package uk.gegc.recall.features.generation.application.dto;

import java.util.List;

/**
 * A phrasing as returned by the model, before validation.
 *
 * @param type wire value such as {@code multiple-choice} or {@code true-false}
 */
public record GeneratedPhrasing(
        String question,
        String explanation,
        String type,
        List<String> options,
        String correctAnswer
) {
}
