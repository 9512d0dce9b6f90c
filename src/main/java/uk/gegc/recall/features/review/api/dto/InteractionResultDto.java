package uk.gegc.recall.features.review.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.recall.features.scheduling.domain.model.CardState;
import uk.gegc.recall.features.scheduling.domain.model.Rating;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "InteractionResultDto", description = "Updated schedule after an answer")
public record InteractionResultDto(
        UUID conceptId,
        UUID phrasingId,
        UUID interactionId,
        @Schema(description = "Next review time (UTC)") Instant nextReview,
        @Schema(description = "Scheduled interval in days") int scheduledDays,
        @Schema(description = "Memory state after the answer") CardState newState,
        @Schema(description = "Rating derived from correctness") Rating rating,
        @Schema(description = "Attempts on this phrasing") int totalAttempts,
        @Schema(description = "Correct attempts on this phrasing") int totalCorrect
) {
}
