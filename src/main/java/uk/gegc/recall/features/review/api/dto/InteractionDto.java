package uk.gegc.recall.features.review.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.recall.features.scheduling.domain.model.CardState;

import java.time.Instant;
import java.util.UUID;

@Schema(name = "InteractionDto", description = "A past answer to a phrasing")
public record InteractionDto(
        UUID id,
        UUID conceptId,
        UUID phrasingId,
        String userAnswer,
        boolean correct,
        Instant attemptedAt,
        Long timeSpentMs,
        @Schema(description = "Scheduled interval produced by this answer") Integer scheduledDays,
        @Schema(description = "Next review produced by this answer") Instant nextReview,
        @Schema(description = "Memory state produced by this answer") CardState fsrsState
) {
}
