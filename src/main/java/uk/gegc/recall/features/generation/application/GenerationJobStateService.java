package uk.gegc.recall.features.generation.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.recall.features.concept.application.ConceptQualityCalculator;
import uk.gegc.recall.features.concept.domain.model.Concept;
import uk.gegc.recall.features.concept.domain.model.Phrasing;
import uk.gegc.recall.features.concept.domain.repository.ConceptRepository;
import uk.gegc.recall.features.concept.domain.repository.PhrasingRepository;
import uk.gegc.recall.features.generation.application.dto.ConceptSynthesisWork;
import uk.gegc.recall.features.generation.application.dto.JobProgress;
import uk.gegc.recall.features.generation.application.dto.PhrasingGenerationRequest;
import uk.gegc.recall.features.generation.application.dto.PhrasingWork;
import uk.gegc.recall.features.generation.application.dto.PreparedConcept;
import uk.gegc.recall.features.generation.application.dto.PreparedPhrasing;
import uk.gegc.recall.features.generation.domain.model.GenerationErrorCode;
import uk.gegc.recall.features.generation.domain.model.GenerationJob;
import uk.gegc.recall.features.generation.domain.model.JobPhase;
import uk.gegc.recall.features.generation.domain.model.JobStatus;
import uk.gegc.recall.features.generation.domain.repository.GenerationJobRepository;
import uk.gegc.recall.features.scheduling.application.SchedulingEngine;
import uk.gegc.recall.features.scheduling.domain.model.FsrsMemoryState;
import uk.gegc.recall.features.stats.application.StatsDeltaCalculator;
import uk.gegc.recall.features.stats.application.UserStatsService;
import uk.gegc.recall.features.stats.domain.model.StatsDelta;
import uk.gegc.recall.shared.config.GenerationJobProperties;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Short transactions around each generation step. Model calls happen between these methods,
 * never inside them, so no database transaction is held open while waiting on the model.
 * <p>
 * Every method re-reads the job under a pessimistic lock; a job that has reached a terminal
 * state (most often through cancellation) is left untouched.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationJobStateService {

    static final int EXISTING_QUESTION_LIMIT = 20;
    static final int QUESTION_SCAN_LIMIT = 200;

    static final String ALL_CONCEPTS_EXIST_MESSAGE =
            "All generated concepts already exist in your library. Try prompting for different material.";

    private final GenerationJobRepository jobRepository;
    private final ConceptRepository conceptRepository;
    private final PhrasingRepository phrasingRepository;
    private final SchedulingEngine schedulingEngine;
    private final StatsDeltaCalculator statsDeltaCalculator;
    private final UserStatsService userStatsService;
    private final ConceptQualityCalculator qualityCalculator;
    private final GenerationJobProperties properties;
    private final Clock clock;

    /**
     * Claim a job for concept synthesis: PENDING becomes PROCESSING and the phase moves to
     * CONCEPT_SYNTHESIS.
     *
     * @return the work to do, or empty when the job is missing or already finished
     */
    @Transactional
    public Optional<ConceptSynthesisWork> beginConceptSynthesis(UUID jobId) {
        GenerationJob job = jobRepository.findByIdForUpdate(jobId).orElse(null);
        if (job == null) {
            log.error("Job {} not found for concept synthesis", jobId);
            return Optional.empty();
        }
        if (job.isTerminal()) {
            log.info("Job {} is {} before concept synthesis started, skipping", jobId, job.getStatus());
            return Optional.empty();
        }

        job.markProcessing(Instant.now(clock));
        job.advancePhase(JobPhase.CONCEPT_SYNTHESIS);
        jobRepository.save(job);
        return Optional.of(new ConceptSynthesisWork(job.getId(), job.getUserId(), job.getPrompt()));
    }

    @Transactional(readOnly = true)
    public boolean isStopped(UUID jobId) {
        return jobRepository.findById(jobId)
                .map(GenerationJob::isTerminal)
                .orElse(true);
    }

    /**
     * Persist synthesised concepts, skipping short titles and titles the user already has.
     *
     * @return ids of the created concepts, or empty when the job stopped in the meantime
     * @throws GenerationPipelineException when every concept was skipped
     */
    @Transactional
    public Optional<List<UUID>> persistConcepts(UUID jobId, List<PreparedConcept> concepts) {
        GenerationJob job = jobRepository.findByIdForUpdate(jobId).orElse(null);
        if (job == null || job.isTerminal()) {
            log.info("Job {} stopped before concept creation", jobId);
            return Optional.empty();
        }

        Instant now = Instant.now(clock);
        UUID userId = job.getUserId();
        Set<String> seenTitles = new HashSet<>();
        for (String title : conceptRepository.findRecentTitles(
                userId, PageRequest.of(0, properties.getExistingTitleScanLimit()))) {
            seenTitles.add(normalizeTitle(title));
        }

        List<Concept> toCreate = new ArrayList<>();
        StatsDelta statsDelta = StatsDelta.EMPTY;
        int skipped = 0;
        for (PreparedConcept prepared : concepts) {
            String title = prepared.title() == null ? "" : prepared.title().trim();
            if (title.length() < properties.getMinConceptTitleLength()) {
                skipped++;
                continue;
            }
            if (!seenTitles.add(normalizeTitle(title))) {
                skipped++;
                continue;
            }

            FsrsMemoryState fsrs = schedulingEngine.initializeState(now);
            Concept concept = new Concept();
            concept.setUserId(userId);
            concept.setTitle(title);
            concept.setDescription(prepared.description());
            concept.setContentType(prepared.contentType());
            concept.setOriginIntent(prepared.originIntent());
            concept.setFsrs(fsrs);
            concept.setPhrasingCount(0);
            concept.setThinScore(qualityCalculator.thinScore(0));
            concept.setGenerationJobId(job.getId());
            concept.setCreatedAt(now);
            concept.setUpdatedAt(now);
            toCreate.add(concept);

            statsDelta = statsDelta.plus(statsDeltaCalculator.lifecycleDelta(
                    fsrs.stateOrNew(), fsrs.getNextReview(), now, 1));
        }

        if (toCreate.isEmpty()) {
            throw new GenerationPipelineException(ALL_CONCEPTS_EXIST_MESSAGE, GenerationErrorCode.SCHEMA_VALIDATION, false);
        }

        List<UUID> conceptIds = conceptRepository.saveAll(toCreate).stream()
                .map(Concept::getId)
                .toList();
        if (!statsDelta.isEmpty()) {
            userStatsService.applyDelta(userId, statsDelta);
        }

        job.setConceptIds(new ArrayList<>(conceptIds));
        job.setPendingConceptIds(new ArrayList<>(conceptIds));
        job.advancePhase(JobPhase.PHRASING_GENERATION);
        job.setEstimatedTotal(conceptIds.size() * properties.getTargetPhrasingsPerConcept());
        jobRepository.save(job);

        log.info("Job {} created {} concepts ({} skipped as short or duplicate)", jobId, conceptIds.size(), skipped);
        return Optional.of(conceptIds);
    }

    /**
     * Claim one pending concept for phrasing generation. A concept that no longer exists or
     * belongs to someone else is dropped from the pending set without counting anything.
     *
     * @return the work to do, or empty when there is nothing to generate
     */
    @Transactional
    public Optional<PhrasingWork> beginPhrasingGeneration(UUID jobId, UUID conceptId) {
        GenerationJob job = jobRepository.findByIdForUpdate(jobId).orElse(null);
        if (job == null) {
            log.error("Job {} not found for phrasing generation", jobId);
            return Optional.empty();
        }
        if (job.isTerminal()) {
            log.info("Job {} is {} before phrasing generation for concept {}, skipping",
                    jobId, job.getStatus(), conceptId);
            return Optional.empty();
        }

        Concept concept = conceptRepository.findById(conceptId)
                .filter(c -> c.getUserId().equals(job.getUserId()))
                .orElse(null);
        if (concept == null) {
            log.warn("Concept {} missing or foreign for job {}, skipping", conceptId, jobId);
            if (job.getPendingConceptIds().contains(conceptId)) {
                advancePendingConcept(job, conceptId, 0, 0);
            }
            return Optional.empty();
        }
        if (!job.getPendingConceptIds().contains(conceptId)) {
            log.info("Concept {} already processed for job {}, skipping", conceptId, jobId);
            return Optional.empty();
        }

        job.markProcessing(Instant.now(clock));
        jobRepository.save(job);

        List<String> existingQuestions = phrasingRepository.findActiveQuestions(
                conceptId, PageRequest.of(0, EXISTING_QUESTION_LIMIT));
        PhrasingGenerationRequest request = new PhrasingGenerationRequest(
                concept.getTitle(),
                concept.getDescription() == null ? "" : concept.getDescription(),
                concept.getContentType(),
                concept.getOriginIntent(),
                properties.getTargetPhrasingsPerConcept(),
                List.copyOf(existingQuestions)
        );
        return Optional.of(new PhrasingWork(job.getId(), job.getUserId(), conceptId, request));
    }

    /**
     * Insert validated phrasings, refresh the concept's quality signals and advance the job.
     * <p>
     * A step that was already running when the job was cancelled still keeps its phrasings, but
     * the job itself is left untouched.
     *
     * @param generatedCount number of phrasings the model returned before validation
     * @return progress after the concept left the pending set, or empty when the job stopped
     */
    @Transactional
    public Optional<JobProgress> savePhrasings(PhrasingWork work, int generatedCount, List<PreparedPhrasing> phrasings) {
        GenerationJob job = jobRepository.findByIdForUpdate(work.jobId()).orElse(null);
        if (job == null) {
            log.info("Job {} no longer exists, dropping phrasings for concept {}", work.jobId(), work.conceptId());
            return Optional.empty();
        }
        Concept concept = conceptRepository.findByIdAndUserId(work.conceptId(), work.userId()).orElse(null);
        if (concept == null) {
            log.warn("Concept {} disappeared while generating phrasings for job {}", work.conceptId(), work.jobId());
            return job.isTerminal()
                    ? Optional.empty()
                    : Optional.of(advancePendingConcept(job, work.conceptId(), generatedCount, 0));
        }

        int saved = insertPhrasings(concept, phrasings);

        if (job.isTerminal()) {
            log.info("Job {} is {}; kept {} phrasings for concept {} without advancing it",
                    job.getId(), job.getStatus(), saved, concept.getId());
            return Optional.empty();
        }
        return Optional.of(advancePendingConcept(job, concept.getId(), generatedCount, saved));
    }

    private int insertPhrasings(Concept concept, List<PreparedPhrasing> phrasings) {
        Instant now = Instant.now(clock);
        List<Phrasing> toInsert = new ArrayList<>(phrasings.size());
        for (PreparedPhrasing prepared : phrasings) {
            Phrasing phrasing = new Phrasing();
            phrasing.setUserId(concept.getUserId());
            phrasing.setConceptId(concept.getId());
            phrasing.setQuestion(prepared.question());
            phrasing.setExplanation(prepared.explanation());
            phrasing.setType(prepared.type());
            phrasing.setOptions(new ArrayList<>(prepared.options()));
            phrasing.setCorrectAnswer(prepared.correctAnswer());
            phrasing.setCreatedAt(now);
            phrasing.setUpdatedAt(now);
            toInsert.add(phrasing);
        }
        int saved = phrasingRepository.saveAll(toInsert).size();

        int activeCount = (int) phrasingRepository.countActiveByConcept(concept.getId());
        List<String> activeQuestions = phrasingRepository.findActiveQuestions(
                concept.getId(), PageRequest.of(0, QUESTION_SCAN_LIMIT));
        qualityCalculator.applyScores(concept, activeCount, activeQuestions);
        concept.setUpdatedAt(now);
        conceptRepository.save(concept);
        return saved;
    }

    /**
     * Fail the job unless it already reached a terminal state. Concepts created by earlier steps stay.
     *
     * @return whether the job was marked failed
     */
    @Transactional
    public boolean failJob(UUID jobId, GenerationErrorCode code, String message, boolean retryable) {
        GenerationJob job = jobRepository.findByIdForUpdate(jobId).orElse(null);
        if (job == null || job.isTerminal()) {
            return false;
        }
        job.markFailed(code, message, retryable, Instant.now(clock));
        jobRepository.save(job);
        return true;
    }

    private JobProgress advancePendingConcept(GenerationJob job, UUID conceptId, int generatedDelta, int savedDelta) {
        job.getPendingConceptIds().remove(conceptId);
        job.setPhrasingGenerated(job.getPhrasingGenerated() + generatedDelta);
        job.setPhrasingSaved(job.getPhrasingSaved() + savedDelta);

        int pending = job.getPendingConceptIds().size();
        boolean completed = false;
        if (pending == 0) {
            job.advancePhase(JobPhase.FINALIZING);
            if (job.getStatus() != JobStatus.COMPLETED) {
                job.markCompleted(Instant.now(clock));
                completed = true;
            }
        }
        jobRepository.save(job);
        return new JobProgress(pending, job.getPhrasingGenerated(), job.getPhrasingSaved(), completed);
    }

    static String normalizeTitle(String title) {
        return title.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }
}
