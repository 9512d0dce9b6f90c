package uk.gegc.recall.features.concept.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.recall.features.concept.api.dto.BulkActionResultDto;
import uk.gegc.recall.features.concept.api.dto.ConceptDetailDto;
import uk.gegc.recall.features.concept.api.dto.ConceptDto;
import uk.gegc.recall.features.concept.api.dto.PhrasingDto;
import uk.gegc.recall.features.concept.api.dto.UpdateConceptRequest;
import uk.gegc.recall.features.concept.api.dto.UpdatePhrasingRequest;
import uk.gegc.recall.features.concept.application.ConceptBulkAction;
import uk.gegc.recall.features.concept.application.ConceptLibraryView;
import uk.gegc.recall.features.concept.application.ConceptQualityCalculator;
import uk.gegc.recall.features.concept.application.ConceptService;
import uk.gegc.recall.features.concept.domain.model.Concept;
import uk.gegc.recall.features.concept.domain.model.Phrasing;
import uk.gegc.recall.features.concept.domain.repository.ConceptRepository;
import uk.gegc.recall.features.concept.domain.repository.PhrasingRepository;
import uk.gegc.recall.features.concept.infra.mapping.ConceptDtoMapper;
import uk.gegc.recall.features.generation.api.dto.GenerationJobDto;
import uk.gegc.recall.features.generation.application.GenerationJobService;
import uk.gegc.recall.features.scheduling.domain.model.FsrsMemoryState;
import uk.gegc.recall.features.stats.application.StatsDeltaCalculator;
import uk.gegc.recall.features.stats.application.UserStatsService;
import uk.gegc.recall.shared.batch.BatchedMutator;
import uk.gegc.recall.shared.exception.ResourceNotFoundException;
import uk.gegc.recall.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class ConceptServiceImpl implements ConceptService {

    static final int MAX_BULK_IDS = 100;
    static final int MIN_PAGE_SIZE = 10;
    static final int MAX_PAGE_SIZE = 100;
    static final int DETAIL_PHRASING_LIMIT = 100;
    static final int QUESTION_SCAN_LIMIT = 200;

    private final ConceptRepository conceptRepository;
    private final PhrasingRepository phrasingRepository;
    private final BatchedMutator batchedMutator;
    private final StatsDeltaCalculator statsDeltaCalculator;
    private final UserStatsService userStatsService;
    private final ConceptQualityCalculator qualityCalculator;
    private final GenerationJobService generationJobService;
    private final ConceptDtoMapper mapper;
    private final Clock clock;

    @Override
    @Transactional
    public boolean archiveConcept(UUID userId, UUID conceptId) {
        return archive(userId, loadOwnedConcept(userId, conceptId));
    }

    @Override
    @Transactional
    public boolean unarchiveConcept(UUID userId, UUID conceptId) {
        return unarchive(userId, loadOwnedConcept(userId, conceptId));
    }

    @Override
    @Transactional
    public boolean softDeleteConcept(UUID userId, UUID conceptId) {
        return softDelete(userId, loadOwnedConcept(userId, conceptId));
    }

    @Override
    @Transactional
    public boolean restoreConcept(UUID userId, UUID conceptId) {
        return restore(userId, loadOwnedConcept(userId, conceptId));
    }

    @Override
    @Transactional
    public BulkActionResultDto runBulkAction(UUID userId, ConceptBulkAction action, List<UUID> conceptIds) {
        if (action == null) {
            throw new ValidationException("Bulk action is required");
        }
        if (conceptIds == null || conceptIds.isEmpty()) {
            return new BulkActionResultDto(0, 0, 0);
        }
        Set<UUID> uniqueIds = new LinkedHashSet<>(conceptIds);
        if (uniqueIds.size() > MAX_BULK_IDS) {
            throw new ValidationException("At most " + MAX_BULK_IDS + " concepts can be processed at once");
        }

        int processed = 0;
        int skipped = 0;
        for (UUID conceptId : uniqueIds) {
            Concept concept = conceptRepository.findByIdAndUserId(conceptId, userId).orElse(null);
            if (concept == null) {
                skipped++;
                continue;
            }
            boolean applied = switch (action) {
                case ARCHIVE -> archive(userId, concept);
                case UNARCHIVE -> unarchive(userId, concept);
                case DELETE -> softDelete(userId, concept);
                case RESTORE -> restore(userId, concept);
            };
            if (applied) {
                processed++;
            } else {
                skipped++;
            }
        }

        log.info("Bulk {} for user {}: {} processed, {} skipped", action, userId, processed, skipped);
        return new BulkActionResultDto(uniqueIds.size(), processed, skipped);
    }

    @Override
    @Transactional
    public ConceptDto updateConcept(UUID userId, UUID conceptId, UpdateConceptRequest request) {
        Concept concept = loadOwnedConcept(userId, conceptId);
        String title = request.title() == null ? "" : request.title().trim();
        if (title.isEmpty()) {
            throw new ValidationException("Title cannot be empty");
        }
        concept.setTitle(title);
        if (request.description() != null) {
            concept.setDescription(request.description().trim());
        }
        concept.setUpdatedAt(Instant.now(clock));
        return mapper.toConceptDto(conceptRepository.save(concept));
    }

    @Override
    @Transactional
    public ConceptDto setCanonicalPhrasing(UUID userId, UUID conceptId, UUID phrasingId) {
        Concept concept = loadOwnedConcept(userId, conceptId);
        if (phrasingId != null) {
            Phrasing phrasing = phrasingRepository.findByIdAndUserId(phrasingId, userId)
                    .filter(p -> p.getConceptId().equals(concept.getId()))
                    .filter(Phrasing::isActive)
                    .orElseThrow(() -> new ResourceNotFoundException("Phrasing not found or unavailable"));
            concept.setCanonicalPhrasingId(phrasing.getId());
        } else {
            concept.setCanonicalPhrasingId(null);
        }
        concept.setUpdatedAt(Instant.now(clock));
        return mapper.toConceptDto(conceptRepository.save(concept));
    }

    @Override
    @Transactional
    public PhrasingDto updatePhrasing(UUID userId, UUID phrasingId, UpdatePhrasingRequest request) {
        Phrasing phrasing = loadOwnedPhrasing(userId, phrasingId);

        String question = request.question() == null ? "" : request.question().trim();
        String correctAnswer = request.correctAnswer() == null ? "" : request.correctAnswer().trim();
        if (question.isEmpty()) {
            throw new ValidationException("Question cannot be empty");
        }
        if (correctAnswer.isEmpty()) {
            throw new ValidationException("Correct answer cannot be empty");
        }
        if (request.options() != null && !request.options().isEmpty()
                && !request.options().contains(correctAnswer)) {
            throw new ValidationException("Correct answer must be one of the provided options");
        }

        Instant now = Instant.now(clock);
        phrasing.setQuestion(question);
        phrasing.setCorrectAnswer(correctAnswer);
        if (request.explanation() != null) {
            phrasing.setExplanation(request.explanation().trim());
        }
        if (request.options() != null) {
            phrasing.setOptions(new ArrayList<>(request.options()));
        }
        phrasing.setUpdatedAt(now);
        Phrasing saved = phrasingRepository.save(phrasing);

        // An edited question can create or resolve a duplicate
        conceptRepository.findByIdAndUserId(phrasing.getConceptId(), userId)
                .ifPresent(concept -> refreshQuality(concept, now));
        return mapper.toPhrasingDto(saved);
    }

    @Override
    @Transactional
    public PhrasingDto archivePhrasing(UUID userId, UUID phrasingId) {
        Phrasing phrasing = loadOwnedPhrasing(userId, phrasingId);
        Concept concept = loadOwnedConcept(userId, phrasing.getConceptId());
        if (phrasing.getArchivedAt() != null) {
            return mapper.toPhrasingDto(phrasing);
        }
        if (phrasingRepository.countActiveByConcept(concept.getId()) <= 1) {
            throw new IllegalStateException("Cannot archive the last active phrasing of a concept");
        }

        Instant now = Instant.now(clock);
        phrasing.setArchivedAt(now);
        phrasing.setUpdatedAt(now);
        Phrasing saved = phrasingRepository.save(phrasing);

        if (phrasing.getId().equals(concept.getCanonicalPhrasingId())) {
            concept.setCanonicalPhrasingId(null);
        }
        refreshQuality(concept, now);
        return mapper.toPhrasingDto(saved);
    }

    @Override
    @Transactional
    public PhrasingDto unarchivePhrasing(UUID userId, UUID phrasingId) {
        Phrasing phrasing = loadOwnedPhrasing(userId, phrasingId);
        Concept concept = loadOwnedConcept(userId, phrasing.getConceptId());
        if (phrasing.getArchivedAt() == null) {
            return mapper.toPhrasingDto(phrasing);
        }
        if (!concept.isActive()) {
            throw new IllegalStateException("Restore the concept before unarchiving its phrasings");
        }

        Instant now = Instant.now(clock);
        phrasing.setArchivedAt(null);
        phrasing.setUpdatedAt(now);
        Phrasing saved = phrasingRepository.save(phrasing);
        refreshQuality(concept, now);
        return mapper.toPhrasingDto(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<ConceptDto> listForLibrary(UUID userId, ConceptLibraryView view, int page, int size) {
        ConceptLibraryView effectiveView = view == null ? ConceptLibraryView.ALL : view;
        int pageSize = Math.max(MIN_PAGE_SIZE, Math.min(MAX_PAGE_SIZE, size));
        int pageNumber = Math.max(0, page);
        Sort byNextReview = Sort.by(Sort.Direction.ASC, "fsrs.nextReview").and(Sort.by("id"));
        Pageable pageable = switch (effectiveView) {
            case ARCHIVED -> PageRequest.of(pageNumber, pageSize, Sort.by(Sort.Direction.DESC, "archivedAt"));
            case DELETED -> PageRequest.of(pageNumber, pageSize, Sort.by(Sort.Direction.DESC, "deletedAt"));
            default -> PageRequest.of(pageNumber, pageSize, byNextReview);
        };

        Page<Concept> concepts = switch (effectiveView) {
            case ALL -> conceptRepository.findActive(userId, pageable);
            case DUE -> conceptRepository.findActiveDue(userId, Instant.now(clock), pageable);
            case THIN -> conceptRepository.findActiveThin(userId, pageable);
            case TENSION -> conceptRepository.findActiveInTension(userId, pageable);
            case ARCHIVED -> conceptRepository.findArchived(userId, pageable);
            case DELETED -> conceptRepository.findDeleted(userId, pageable);
        };
        return concepts.map(mapper::toConceptDto);
    }

    @Override
    @Transactional(readOnly = true)
    public ConceptDetailDto getConcept(UUID userId, UUID conceptId) {
        Concept concept = loadOwnedConcept(userId, conceptId);
        PageRequest limit = PageRequest.of(0, DETAIL_PHRASING_LIMIT);
        List<PhrasingDto> active = phrasingRepository.findActiveByConcept(userId, conceptId, limit).stream()
                .map(mapper::toPhrasingDto)
                .toList();
        List<PhrasingDto> archived = phrasingRepository.findArchivedByConcept(userId, conceptId, limit).stream()
                .map(mapper::toPhrasingDto)
                .toList();
        boolean generating = generationJobService.hasActiveJobForConcept(userId, conceptId);
        return new ConceptDetailDto(mapper.toConceptDto(concept), active, archived, generating);
    }

    @Override
    @Transactional
    public GenerationJobDto requestPhrasingGeneration(UUID userId, UUID conceptId) {
        return generationJobService.createPhrasingJob(userId, conceptId);
    }

    private boolean archive(UUID userId, Concept concept) {
        if (concept.getArchivedAt() != null || concept.isDeleted()) {
            return false;
        }
        Instant now = Instant.now(clock);
        concept.setArchivedAt(now);
        concept.setUpdatedAt(now);
        conceptRepository.save(concept);

        int phrasings = batchedMutator.applyBatched(
                limit -> phrasingRepository.findNotArchivedBatch(userId, concept.getId(), PageRequest.of(0, limit)),
                phrasing -> {
                    phrasing.setArchivedAt(now);
                    phrasing.setUpdatedAt(now);
                });
        applyLifecycleDelta(userId, concept, now, -1);
        log.debug("Archived concept {} with {} phrasings", concept.getId(), phrasings);
        return true;
    }

    private boolean unarchive(UUID userId, Concept concept) {
        if (concept.getArchivedAt() == null || concept.isDeleted()) {
            return false;
        }
        Instant now = Instant.now(clock);
        concept.setArchivedAt(null);
        concept.setUpdatedAt(now);
        conceptRepository.save(concept);

        batchedMutator.applyBatched(
                limit -> phrasingRepository.findArchivedBatch(userId, concept.getId(), PageRequest.of(0, limit)),
                phrasing -> {
                    phrasing.setArchivedAt(null);
                    phrasing.setUpdatedAt(now);
                });
        applyLifecycleDelta(userId, concept, now, 1);
        return true;
    }

    private boolean softDelete(UUID userId, Concept concept) {
        if (concept.isDeleted()) {
            return false;
        }
        boolean wasActive = concept.isActive();
        Instant now = Instant.now(clock);
        concept.setDeletedAt(now);
        concept.setUpdatedAt(now);
        conceptRepository.save(concept);

        batchedMutator.applyBatched(
                limit -> phrasingRepository.findNotDeletedBatch(userId, concept.getId(), PageRequest.of(0, limit)),
                phrasing -> {
                    phrasing.setDeletedAt(now);
                    phrasing.setUpdatedAt(now);
                });
        if (wasActive) {
            applyLifecycleDelta(userId, concept, now, -1);
        }
        return true;
    }

    private boolean restore(UUID userId, Concept concept) {
        if (!concept.isDeleted()) {
            return false;
        }
        Instant now = Instant.now(clock);
        concept.setDeletedAt(null);
        concept.setUpdatedAt(now);
        conceptRepository.save(concept);

        batchedMutator.applyBatched(
                limit -> phrasingRepository.findDeletedBatch(userId, concept.getId(), PageRequest.of(0, limit)),
                phrasing -> {
                    phrasing.setDeletedAt(null);
                    phrasing.setUpdatedAt(now);
                });
        // A concept archived before deletion comes back archived and stays out of the counters
        if (concept.isActive()) {
            applyLifecycleDelta(userId, concept, now, 1);
        }
        return true;
    }

    private void applyLifecycleDelta(UUID userId, Concept concept, Instant now, int sign) {
        FsrsMemoryState fsrs = concept.getFsrs();
        userStatsService.applyDelta(userId, statsDeltaCalculator.lifecycleDelta(
                fsrs == null ? null : fsrs.getState(),
                fsrs == null ? null : fsrs.getNextReview(),
                now,
                sign));
    }

    private void refreshQuality(Concept concept, Instant now) {
        int activeCount = (int) phrasingRepository.countActiveByConcept(concept.getId());
        List<String> questions = phrasingRepository.findActiveQuestions(
                concept.getId(), PageRequest.of(0, QUESTION_SCAN_LIMIT));
        qualityCalculator.applyScores(concept, activeCount, questions);
        concept.setUpdatedAt(now);
        conceptRepository.save(concept);
    }

    private Concept loadOwnedConcept(UUID userId, UUID conceptId) {
        return conceptRepository.findByIdAndUserId(conceptId, userId)
                .orElseThrow(() -> new ResourceNotFoundException("Concept " + conceptId + " not found"));
    }

    private Phrasing loadOwnedPhrasing(UUID userId, UUID phrasingId) {
        return phrasingRepository.findByIdAndUserId(phrasingId, userId)
                .filter(p -> p.getDeletedAt() == null)
                .orElseThrow(() -> new ResourceNotFoundException("Phrasing " + phrasingId + " not found"));
    }
}
