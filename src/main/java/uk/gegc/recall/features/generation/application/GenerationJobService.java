package uk.gegc.recall.features.generation.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.recall.features.generation.api.dto.GenerationJobDto;

import java.util.UUID;

public interface GenerationJobService {

    /**
     * Create a job for the prompt and schedule concept synthesis once the job row is committed.
     *
     * @throws uk.gegc.recall.shared.exception.ValidationException when the trimmed prompt is too short or too long
     * @throws uk.gegc.recall.shared.exception.RateLimitExceededException when the user already has the maximum number of active jobs
     */
    GenerationJobDto createJob(UUID userId, String prompt);

    /**
     * Create a single-concept job that only generates more phrasings for an existing concept.
     *
     * @throws IllegalStateException when an active job already covers the concept
     */
    GenerationJobDto createPhrasingJob(UUID userId, UUID conceptId);

    /**
     * Cancel an active job. Cancelling a finished job changes nothing.
     */
    GenerationJobDto cancelJob(UUID userId, UUID jobId);

    GenerationJobDto getJobById(UUID userId, UUID jobId);

    Page<GenerationJobDto> listJobs(UUID userId, Pageable pageable);

    boolean hasActiveJobForConcept(UUID userId, UUID conceptId);

    /**
     * Delete completed jobs past their retention and failed or cancelled jobs past theirs.
     *
     * @return number of jobs deleted
     */
    int cleanupOldJobs();

    /**
     * Fail jobs that have been pending or processing for too long.
     *
     * @return number of jobs failed
     */
    int failStuckJobs();
}
