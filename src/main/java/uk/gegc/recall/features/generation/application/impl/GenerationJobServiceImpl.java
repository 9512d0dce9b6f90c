package uk.gegc.recall.features.generation.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.recall.features.concept.domain.model.Concept;
import uk.gegc.recall.features.concept.domain.repository.ConceptRepository;
import uk.gegc.recall.features.generation.api.dto.GenerationJobDto;
import uk.gegc.recall.features.generation.application.GenerationJobService;
import uk.gegc.recall.features.generation.application.GenerationJobStateService;
import uk.gegc.recall.features.generation.application.JobStepScheduler;
import uk.gegc.recall.features.generation.domain.model.GenerationErrorCode;
import uk.gegc.recall.features.generation.domain.model.GenerationJob;
import uk.gegc.recall.features.generation.domain.model.JobPhase;
import uk.gegc.recall.features.generation.domain.model.JobStatus;
import uk.gegc.recall.features.generation.domain.repository.GenerationJobRepository;
import uk.gegc.recall.features.generation.infra.metrics.GenerationMetrics;
import uk.gegc.recall.shared.config.GenerationJobProperties;
import uk.gegc.recall.shared.exception.RateLimitExceededException;
import uk.gegc.recall.shared.exception.ResourceNotFoundException;
import uk.gegc.recall.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationJobServiceImpl implements GenerationJobService {

    static final String JOB_NOT_FOUND_MESSAGE = "Job not found or access denied";
    static final String STUCK_JOB_MESSAGE = "Generation timed out before finishing. Please try again.";

    private final GenerationJobRepository jobRepository;
    private final ConceptRepository conceptRepository;
    private final GenerationJobStateService stateService;
    private final JobStepScheduler jobStepScheduler;
    private final GenerationJobProperties properties;
    private final GenerationMetrics metrics;
    private final Clock clock;

    @Override
    @Transactional
    public GenerationJobDto createJob(UUID userId, String prompt) {
        String trimmed = prompt == null ? "" : prompt.trim();
        if (trimmed.length() < properties.getMinPromptLength()) {
            throw new ValidationException(
                    "Prompt too short. Minimum " + properties.getMinPromptLength() + " characters required.");
        }
        if (trimmed.length() > properties.getMaxPromptLength()) {
            throw new ValidationException(
                    "Prompt too long. Maximum " + properties.getMaxPromptLength() + " characters allowed.");
        }

        long activeJobs = jobRepository.countByUserIdAndStatusIn(userId, GenerationJobRepository.ACTIVE_STATUSES);
        if (activeJobs >= properties.getMaxConcurrentPerUser()) {
            log.warn("User {} hit the concurrent job limit ({} active)", userId, activeJobs);
            throw new RateLimitExceededException(
                    "Too many concurrent jobs. Maximum " + properties.getMaxConcurrentPerUser() + " jobs allowed.");
        }

        GenerationJob job = new GenerationJob();
        job.setUserId(userId);
        job.setPrompt(trimmed);
        job.setStatus(JobStatus.PENDING);
        job.setPhase(JobPhase.CLARIFYING);
        job.setCreatedAt(Instant.now(clock));
        GenerationJob saved = jobRepository.save(job);

        jobStepScheduler.scheduleConceptSynthesis(saved.getId());
        metrics.jobCreated("prompt");
        log.info("Created generation job {} for user {}", saved.getId(), userId);
        return GenerationJobDto.fromEntity(saved);
    }

    @Override
    @Transactional
    public GenerationJobDto createPhrasingJob(UUID userId, UUID conceptId) {
        Concept concept = conceptRepository.findByIdAndUserId(conceptId, userId)
                .filter(c -> !c.isDeleted())
                .orElseThrow(() -> new ResourceNotFoundException("Concept " + conceptId + " not found"));

        if (hasActiveJobForConcept(userId, conceptId)) {
            throw new IllegalStateException("Generation already in progress for this concept");
        }

        GenerationJob job = new GenerationJob();
        job.setUserId(userId);
        job.setPrompt("Manual concept phrasing request: " + concept.getTitle());
        job.setTopic(concept.getTitle());
        job.setStatus(JobStatus.PENDING);
        job.setPhase(JobPhase.PHRASING_GENERATION);
        job.setEstimatedTotal(properties.getTargetPhrasingsPerConcept());
        job.setConceptIds(new ArrayList<>(List.of(conceptId)));
        job.setPendingConceptIds(new ArrayList<>(List.of(conceptId)));
        job.setCreatedAt(Instant.now(clock));
        GenerationJob saved = jobRepository.save(job);

        jobStepScheduler.schedulePhrasingGeneration(saved.getId(), conceptId);
        metrics.jobCreated("phrasing");
        log.info("Created phrasing job {} for concept {} (user {})", saved.getId(), conceptId, userId);
        return GenerationJobDto.fromEntity(saved);
    }

    @Override
    @Transactional
    public GenerationJobDto cancelJob(UUID userId, UUID jobId) {
        GenerationJob job = jobRepository.findByIdForUpdate(jobId)
                .filter(j -> j.getUserId().equals(userId))
                .orElseThrow(() -> new ResourceNotFoundException(JOB_NOT_FOUND_MESSAGE));

        if (job.isTerminal()) {
            log.debug("Job {} already {}, cancel ignored", jobId, job.getStatus());
            return GenerationJobDto.fromEntity(job);
        }

        job.markCancelled(Instant.now(clock));
        GenerationJob saved = jobRepository.save(job);
        metrics.jobCancelled();
        log.info("Cancelled generation job {} for user {}", jobId, userId);
        return GenerationJobDto.fromEntity(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public GenerationJobDto getJobById(UUID userId, UUID jobId) {
        return jobRepository.findByIdAndUserId(jobId, userId)
                .map(GenerationJobDto::fromEntity)
                .orElseThrow(() -> new ResourceNotFoundException(JOB_NOT_FOUND_MESSAGE));
    }

    @Override
    @Transactional(readOnly = true)
    public Page<GenerationJobDto> listJobs(UUID userId, Pageable pageable) {
        return jobRepository.findByUserIdOrderByCreatedAtDesc(userId, pageable)
                .map(GenerationJobDto::fromEntity);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean hasActiveJobForConcept(UUID userId, UUID conceptId) {
        return jobRepository.countCoveringConcept(userId, conceptId, GenerationJobRepository.ACTIVE_STATUSES) > 0;
    }

    @Override
    @Transactional
    public int cleanupOldJobs() {
        Instant now = Instant.now(clock);
        List<GenerationJob> completed = jobRepository.findByStatusInAndCompletedAtBefore(
                List.of(JobStatus.COMPLETED),
                now.minus(Duration.ofDays(properties.getCompletedRetentionDays())));
        List<GenerationJob> failed = jobRepository.findByStatusInAndCompletedAtBefore(
                List.of(JobStatus.FAILED, JobStatus.CANCELLED),
                now.minus(Duration.ofDays(properties.getFailedRetentionDays())));

        jobRepository.deleteAll(completed);
        jobRepository.deleteAll(failed);

        int deleted = completed.size() + failed.size();
        if (deleted > 0) {
            log.info("Deleted {} old generation jobs ({} completed, {} failed or cancelled)",
                    deleted, completed.size(), failed.size());
        }
        return deleted;
    }

    @Override
    public int failStuckJobs() {
        Instant cutoff = Instant.now(clock).minus(Duration.ofMinutes(properties.getStuckAfterMinutes()));
        List<GenerationJob> stuck = jobRepository.findStuckJobs(GenerationJobRepository.ACTIVE_STATUSES, cutoff);

        int failed = 0;
        for (GenerationJob job : stuck) {
            if (stateService.failJob(job.getId(), GenerationErrorCode.NETWORK, STUCK_JOB_MESSAGE, true)) {
                failed++;
                metrics.jobFailed("timeout", GenerationErrorCode.NETWORK);
                log.warn("Failed stuck generation job {} (created {}, started {})",
                        job.getId(), job.getCreatedAt(), job.getStartedAt());
            }
        }
        return failed;
    }
}
