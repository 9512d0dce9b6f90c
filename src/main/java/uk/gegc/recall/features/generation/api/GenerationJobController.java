package uk.gegc.recall.features.generation.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import uk.gegc.recall.features.generation.api.dto.CreateGenerationJobRequest;
import uk.gegc.recall.features.generation.api.dto.GenerationJobDto;
import uk.gegc.recall.features.generation.application.GenerationJobService;
import uk.gegc.recall.shared.api.ApiHeaders;

import java.util.UUID;

@Tag(name = "Generation Jobs", description = "Turn a prompt into concepts and phrasings in the background")
@RestController
@RequestMapping("/api/v1/generation/jobs")
@RequiredArgsConstructor
@Validated
public class GenerationJobController {

    private final GenerationJobService generationJobService;

    @PostMapping
    @Operation(
            summary = "Start a generation job",
            description = "Creates the job and returns immediately. Poll the job to follow progress."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "202", description = "Job accepted",
                    content = @Content(schema = @Schema(implementation = GenerationJobDto.class))),
            @ApiResponse(responseCode = "400", description = "Prompt too short or too long",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "429", description = "Too many active jobs",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<GenerationJobDto> createJob(
            @Parameter(description = "Caller user ID", required = true)
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @Valid @RequestBody CreateGenerationJobRequest request
    ) {
        GenerationJobDto job = generationJobService.createJob(userId, request.prompt());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(job);
    }

    @GetMapping
    @Operation(summary = "List generation jobs", description = "Newest first.")
    public ResponseEntity<Page<GenerationJobDto>> listJobs(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int size
    ) {
        return ResponseEntity.ok(generationJobService.listJobs(userId, PageRequest.of(page, size)));
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get a generation job")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Job found",
                    content = @Content(schema = @Schema(implementation = GenerationJobDto.class))),
            @ApiResponse(responseCode = "404", description = "Job not found or owned by another user",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    public ResponseEntity<GenerationJobDto> getJob(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable UUID jobId
    ) {
        return ResponseEntity.ok(generationJobService.getJobById(userId, jobId));
    }

    @PostMapping("/{jobId}/cancel")
    @Operation(
            summary = "Cancel a generation job",
            description = "Steps already running finish their model call but persist nothing further. Cancelling a finished job is a no-op."
    )
    public ResponseEntity<GenerationJobDto> cancelJob(
            @RequestHeader(ApiHeaders.USER_ID) UUID userId,
            @PathVariable UUID jobId
    ) {
        return ResponseEntity.ok(generationJobService.cancelJob(userId, jobId));
    }
}
