package uk.gegc.recall.features.generation.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.recall.features.generation.application.ContentGenerationClient;
import uk.gegc.recall.features.generation.application.GeneratedContentPreparer;
import uk.gegc.recall.features.generation.application.GenerationErrorClassifier;
import uk.gegc.recall.features.generation.application.GenerationErrorClassifier.Classification;
import uk.gegc.recall.features.generation.application.GenerationErrorClassifier.Stage;
import uk.gegc.recall.features.generation.application.GenerationJobStateService;
import uk.gegc.recall.features.generation.application.GenerationPipeline;
import uk.gegc.recall.features.generation.application.GenerationPipelineException;
import uk.gegc.recall.features.generation.application.JobStepScheduler;
import uk.gegc.recall.features.generation.application.dto.ConceptIdea;
import uk.gegc.recall.features.generation.application.dto.ConceptSynthesisWork;
import uk.gegc.recall.features.generation.application.dto.GeneratedPhrasing;
import uk.gegc.recall.features.generation.application.dto.JobProgress;
import uk.gegc.recall.features.generation.application.dto.PhrasingWork;
import uk.gegc.recall.features.generation.application.dto.PreparedConcept;
import uk.gegc.recall.features.generation.application.dto.PreparedPhrasing;
import uk.gegc.recall.features.generation.domain.model.GenerationErrorCode;
import uk.gegc.recall.features.generation.infra.metrics.GenerationMetrics;
import uk.gegc.recall.shared.config.GenerationJobProperties;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class GenerationPipelineImpl implements GenerationPipeline {

    static final String NO_CONCEPTS_MESSAGE =
            "The AI proposed concepts that were too broad or redundant. Try giving a narrower prompt.";
    static final String NO_PHRASINGS_MESSAGE =
            "The AI could not produce review-ready phrasings. Try rerunning in a few moments.";

    private final GenerationJobStateService stateService;
    private final ContentGenerationClient contentGenerationClient;
    private final GeneratedContentPreparer contentPreparer;
    private final GenerationErrorClassifier errorClassifier;
    private final JobStepScheduler jobStepScheduler;
    private final GenerationJobProperties properties;
    private final GenerationMetrics metrics;

    @Override
    public void runConceptSynthesis(UUID jobId) {
        try {
            Optional<ConceptSynthesisWork> claimed = stateService.beginConceptSynthesis(jobId);
            if (claimed.isEmpty()) {
                return;
            }
            ConceptSynthesisWork work = claimed.get();
            log.info("Concept synthesis started for job {} (user {})", jobId, work.userId());

            List<ConceptIdea> ideas = contentGenerationClient.synthesizeConcepts(work.prompt());
            List<PreparedConcept> prepared = contentPreparer.prepareConceptIdeas(ideas, work.prompt());
            if (prepared.size() > properties.getMaxConceptsPerGeneration()) {
                prepared = prepared.subList(0, properties.getMaxConceptsPerGeneration());
            }
            if (prepared.isEmpty()) {
                throw new GenerationPipelineException(NO_CONCEPTS_MESSAGE, GenerationErrorCode.SCHEMA_VALIDATION, false);
            }
            log.info("Job {}: {} of {} suggested concepts accepted", jobId, prepared.size(), ideas.size());

            if (stateService.isStopped(jobId)) {
                log.info("Job {} cancelled before concept creation", jobId);
                return;
            }

            Optional<List<UUID>> created = stateService.persistConcepts(jobId, prepared);
            if (created.isEmpty()) {
                return;
            }
            List<UUID> conceptIds = created.get();
            metrics.conceptsCreated(conceptIds.size());
            for (UUID conceptId : conceptIds) {
                jobStepScheduler.schedulePhrasingGeneration(jobId, conceptId);
            }
            log.info("Concept synthesis completed for job {}: {} concepts pending phrasing generation",
                    jobId, conceptIds.size());
        } catch (Exception e) {
            handleFailure(jobId, e, Stage.CONCEPT_SYNTHESIS);
        }
    }

    @Override
    public void runPhrasingGeneration(UUID jobId, UUID conceptId) {
        try {
            Optional<PhrasingWork> claimed = stateService.beginPhrasingGeneration(jobId, conceptId);
            if (claimed.isEmpty()) {
                return;
            }
            PhrasingWork work = claimed.get();
            log.info("Phrasing generation started for job {} concept {}", jobId, conceptId);

            List<GeneratedPhrasing> generated = contentGenerationClient.generatePhrasings(work.request());
            List<PreparedPhrasing> prepared = contentPreparer.prepareGeneratedPhrasings(
                    generated, work.request().existingQuestions(), work.request().targetCount());
            if (prepared.isEmpty()) {
                throw new GenerationPipelineException(NO_PHRASINGS_MESSAGE, GenerationErrorCode.SCHEMA_VALIDATION, true);
            }

            Optional<JobProgress> progress = stateService.savePhrasings(work, generated.size(), prepared);
            if (progress.isEmpty()) {
                return;
            }
            metrics.phrasingsSaved(prepared.size());
            if (progress.get().completed()) {
                metrics.jobCompleted();
                log.info("Job {} completed: {} phrasings saved of {} generated",
                        jobId, progress.get().phrasingSaved(), progress.get().phrasingGenerated());
            } else {
                log.info("Phrasing generation completed for job {} concept {}; {} concepts remaining",
                        jobId, conceptId, progress.get().pendingCount());
            }
        } catch (Exception e) {
            handleFailure(jobId, e, Stage.PHRASING_GENERATION);
        }
    }

    private void handleFailure(UUID jobId, Exception error, Stage stage) {
        Classification classification = errorClassifier.classify(error, stage);
        log.error("Job {} failed during {} with code {} (retryable={}): {}",
                jobId, stage, classification.code(), classification.retryable(), error.getMessage(), error);
        try {
            boolean failed = stateService.failJob(
                    jobId, classification.code(), classification.userMessage(), classification.retryable());
            if (failed) {
                metrics.jobFailed(stage.name().toLowerCase(Locale.ROOT), classification.code());
            }
        } catch (Exception persistError) {
            log.error("Could not record failure for job {}: {}", jobId, persistError.getMessage(), persistError);
        }
    }
}
