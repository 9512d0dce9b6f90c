package uk.gegc.recall.features.stats.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

@Schema(name = "DueCountDto", description = "How many concepts are waiting for review")
public record DueCountDto(
        @Schema(description = "Due concepts that have been reviewed before", example = "12")
        long dueCount,

        @Schema(description = "Concepts never reviewed", example = "5")
        long newCount,

        @Schema(description = "All concepts reviewable now, new ones included", example = "17")
        long totalReviewable
) {
    public static DueCountDto empty() {
        return new DueCountDto(0, 0, 0);
    }
}
