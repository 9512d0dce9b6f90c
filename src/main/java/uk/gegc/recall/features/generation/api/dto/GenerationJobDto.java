package uk.gegc.recall.features.generation.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.recall.features.generation.domain.model.GenerationErrorCode;
import uk.gegc.recall.features.generation.domain.model.GenerationJob;
import uk.gegc.recall.features.generation.domain.model.JobPhase;
import uk.gegc.recall.features.generation.domain.model.JobStatus;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Schema(name = "GenerationJobDto", description = "Current state of a generation job")
public record GenerationJobDto(
        @Schema(description = "Job identifier", example = "d290f1ee-6c54-4b01-90e6-d701748f0851")
        UUID id,

        @Schema(description = "Prompt the job was created from", example = "The causes of the French Revolution")
        String prompt,

        @Schema(description = "Lifecycle status", example = "PROCESSING")
        JobStatus status,

        @Schema(description = "Pipeline phase", example = "PHRASING_GENERATION")
        JobPhase phase,

        @Schema(description = "Phrasings returned by the model so far", example = "12")
        int phrasingGenerated,

        @Schema(description = "Phrasings that passed validation and were saved", example = "10")
        int phrasingSaved,

        @Schema(description = "Expected number of phrasings once every concept is processed", example = "20")
        Integer estimatedTotal,

        @Schema(description = "Topic label, set on completion")
        String topic,

        @Schema(description = "Concepts created by this job")
        List<UUID> conceptIds,

        @Schema(description = "Concepts still waiting for phrasings")
        List<UUID> pendingConceptIds,

        @Schema(description = "Wall-clock duration in milliseconds, set on completion", example = "42000")
        Long durationMs,

        @Schema(description = "User-facing error message when the job failed")
        String errorMessage,

        @Schema(description = "Failure category", example = "RATE_LIMIT")
        GenerationErrorCode errorCode,

        @Schema(description = "Whether retrying the same prompt may succeed")
        Boolean retryable,

        Instant createdAt,
        Instant startedAt,
        Instant completedAt
) {

    public static GenerationJobDto fromEntity(GenerationJob job) {
        return new GenerationJobDto(
                job.getId(),
                job.getPrompt(),
                job.getStatus(),
                job.getPhase(),
                job.getPhrasingGenerated(),
                job.getPhrasingSaved(),
                job.getEstimatedTotal(),
                job.getTopic(),
                List.copyOf(job.getConceptIds()),
                List.copyOf(job.getPendingConceptIds()),
                job.getDurationMs(),
                job.getErrorMessage(),
                job.getErrorCode(),
                job.getRetryable(),
                job.getCreatedAt(),
                job.getStartedAt(),
                job.getCompletedAt()
        );
    }
}
