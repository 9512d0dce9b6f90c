package uk.gegc.recall.features.concept.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Attempt counters are never touched by an edit.
 */
@Schema(name = "UpdatePhrasingRequest", description = "Edit a phrasing's question, answer, explanation and options")
public record UpdatePhrasingRequest(
        @NotBlank(message = "Question cannot be empty")
        @Size(max = 1000, message = "Question must not exceed 1000 characters")
        String question,

        @NotBlank(message = "Correct answer cannot be empty")
        @Size(max = 500, message = "Correct answer must not exceed 500 characters")
        String correctAnswer,

        @Schema(description = "Omit to keep the current explanation")
        @Size(max = 4000, message = "Explanation must not exceed 4000 characters")
        String explanation,

        @Schema(description = "Omit to keep the current options; when given, must contain the correct answer")
        @Size(max = 10, message = "At most 10 options are allowed")
        List<@NotBlank @Size(max = 500) String> options
) {
}
