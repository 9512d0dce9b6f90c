package uk.gegc.recall.features.review.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.UUID;

@Schema(name = "RecordInteractionRequest", description = "An answer to a presented phrasing")
public record RecordInteractionRequest(
        @Schema(requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        UUID conceptId,

        @Schema(requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        UUID phrasingId,

        @Schema(description = "The answer the user gave", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        @Size(max = 2000)
        String userAnswer,

        @Schema(description = "Whether the answer was judged correct", requiredMode = Schema.RequiredMode.REQUIRED)
        @NotNull
        Boolean isCorrect,

        @Schema(description = "Time spent answering in milliseconds")
        @PositiveOrZero
        Long timeSpentMs,

        @Schema(description = "Client review session identifier")
        @Size(max = 100)
        String sessionId
) {
}
