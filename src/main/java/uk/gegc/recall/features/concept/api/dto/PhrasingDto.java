package uk.gegc.recall.features.concept.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.recall.features.concept.domain.model.PhrasingType;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "PhrasingDto", description = "One question rendering of a concept")
public record PhrasingDto(
        @Schema(description = "Phrasing ID") UUID id,
        @Schema(description = "Owning concept ID") UUID conceptId,
        @Schema(description = "Question text") String question,
        @Schema(description = "Explanation shown after answering") String explanation,
        @Schema(description = "Question format", example = "multiple-choice") PhrasingType type,
        @Schema(description = "Answer options in display order") List<String> options,
        @Schema(description = "Correct answer, one of the options for choice formats") String correctAnswer,
        int attemptCount,
        int correctCount,
        Instant lastAttemptedAt,
        Instant createdAt,
        Instant archivedAt
) {
}
