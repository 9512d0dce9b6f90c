package uk.gegc.recall.features.stats.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;

@Schema(name = "UserCardStatsDto", description = "Cached counters over the user's active concepts")
public record UserCardStatsDto(
        @Schema(example = "120") long totalCards,
        @Schema(example = "10") long newCount,
        @Schema(example = "30") long learningCount,
        @Schema(example = "80") long matureCount,
        @Schema(description = "Earliest upcoming review, if any") Instant nextReviewTime,
        @Schema(description = "When the counters were last written") Instant lastCalculated
) {
    public static UserCardStatsDto empty() {
        return new UserCardStatsDto(0, 0, 0, 0, null, null);
    }
}
