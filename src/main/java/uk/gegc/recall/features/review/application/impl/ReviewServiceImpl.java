package uk.gegc.recall.features.review.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Lazy;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.recall.features.concept.domain.model.Concept;
import uk.gegc.recall.features.concept.domain.model.Phrasing;
import uk.gegc.recall.features.concept.domain.repository.ConceptRepository;
import uk.gegc.recall.features.concept.domain.repository.PhrasingRepository;
import uk.gegc.recall.features.concept.infra.mapping.ConceptDtoMapper;
import uk.gegc.recall.features.review.api.dto.InteractionDto;
import uk.gegc.recall.features.review.api.dto.InteractionResultDto;
import uk.gegc.recall.features.review.api.dto.NextReviewDto;
import uk.gegc.recall.features.review.api.dto.RecordInteractionRequest;
import uk.gegc.recall.features.review.application.PhrasingSelection;
import uk.gegc.recall.features.review.application.PhrasingSelector;
import uk.gegc.recall.features.review.application.PrioritizedConcept;
import uk.gegc.recall.features.review.application.QueuePrioritizer;
import uk.gegc.recall.features.review.application.ReviewService;
import uk.gegc.recall.features.review.domain.model.Interaction;
import uk.gegc.recall.features.review.domain.repository.InteractionRepository;
import uk.gegc.recall.features.scheduling.application.SchedulingEngine;
import uk.gegc.recall.features.scheduling.domain.model.CardState;
import uk.gegc.recall.features.scheduling.domain.model.FsrsMemoryState;
import uk.gegc.recall.features.stats.application.StatsDeltaCalculator;
import uk.gegc.recall.features.stats.application.UserStatsService;
import uk.gegc.recall.features.stats.domain.model.StatsDelta;
import uk.gegc.recall.shared.config.ReviewSchedulingProperties;
import uk.gegc.recall.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

@Slf4j
@Service
@RequiredArgsConstructor
public class ReviewServiceImpl implements ReviewService {

    static final int MAX_PHRASINGS = 50;

    private final Clock clock;
    private final ConceptRepository conceptRepository;
    private final PhrasingRepository phrasingRepository;
    private final InteractionRepository interactionRepository;
    private final SchedulingEngine schedulingEngine;
    private final QueuePrioritizer queuePrioritizer;
    private final PhrasingSelector phrasingSelector;
    private final StatsDeltaCalculator statsDeltaCalculator;
    private final UserStatsService userStatsService;
    private final ConceptDtoMapper mapper;
    private final ReviewSchedulingProperties properties;

    @Lazy
    private final ReviewService self;

    @Override
    @Transactional(readOnly = true)
    public Optional<NextReviewDto> getNextReview(UUID userId) {
        Instant now = Instant.now(clock);
        PageRequest candidatePage = PageRequest.of(0, properties.getDueCandidateLimit());

        List<Concept> candidates = conceptRepository.findDueCandidates(userId, now, candidatePage);
        if (candidates.isEmpty()) {
            candidates = conceptRepository.findCandidatesInState(userId, CardState.NEW, candidatePage);
            if (candidates.isEmpty()) {
                // Future-scheduled concepts are never served early
                return Optional.empty();
            }
        }

        List<PrioritizedConcept> prioritized = queuePrioritizer.prioritize(
                candidates, now, schedulingEngine::getRetrievability, ThreadLocalRandom.current());

        for (PrioritizedConcept candidate : prioritized) {
            Concept concept = candidate.concept();
            List<Phrasing> phrasings = phrasingRepository.findActiveByConcept(
                    userId, concept.getId(), PageRequest.of(0, MAX_PHRASINGS));
            PhrasingSelection selection = phrasingSelector.selectActivePhrasing(concept, phrasings);
            if (selection == null) {
                log.debug("Concept {} has no presentable phrasing despite phrasingCount={}",
                        concept.getId(), concept.getPhrasingCount());
                continue;
            }

            List<InteractionDto> interactions = interactionRepository
                    .findByUserIdAndPhrasingIdOrderByAttemptedAtDesc(
                            userId, selection.phrasing().getId(),
                            PageRequest.of(0, properties.getRecentInteractionLimit()))
                    .stream()
                    .map(mapper::toInteractionDto)
                    .toList();

            return Optional.of(new NextReviewDto(
                    mapper.toConceptDto(concept),
                    mapper.toPhrasingDto(selection.phrasing()),
                    selection.phrasingIndex(),
                    selection.totalPhrasings(),
                    selection.selectionReason(),
                    candidate.retrievability(),
                    interactions,
                    now
            ));
        }

        return Optional.empty();
    }

    @Override
    public InteractionResultDto recordInteraction(UUID userId, RecordInteractionRequest request) {
        return withRetry(() -> self.recordInteractionTx(userId, request));
    }

    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public InteractionResultDto recordInteractionTx(UUID userId, RecordInteractionRequest request) {
        Concept concept = conceptRepository.findByIdAndUserId(request.conceptId(), userId)
                .orElseThrow(() -> new ResourceNotFoundException("Concept " + request.conceptId() + " not found"));
        Phrasing phrasing = phrasingRepository.findByIdAndUserId(request.phrasingId(), userId)
                .filter(p -> p.getConceptId().equals(concept.getId()))
                .orElseThrow(() -> new ResourceNotFoundException("Phrasing " + request.phrasingId() + " not found"));

        Instant now = Instant.now(clock);
        boolean isCorrect = Boolean.TRUE.equals(request.isCorrect());

        FsrsMemoryState before = concept.getFsrs();
        CardState oldState = before == null ? CardState.NEW : before.stateOrNew();
        Instant oldNextReview = before == null ? null : before.getNextReview();

        SchedulingEngine.ScheduleResult result = schedulingEngine.schedule(before, isCorrect, now);
        FsrsMemoryState after = result.state();

        Interaction interaction = interactionRepository.save(Interaction.builder()
                .userId(userId)
                .conceptId(concept.getId())
                .phrasingId(phrasing.getId())
                .userAnswer(request.userAnswer())
                .correct(isCorrect)
                .attemptedAt(now)
                .timeSpentMs(request.timeSpentMs())
                .sessionId(request.sessionId())
                .scheduledDays(after.getScheduledDays())
                .nextReview(after.getNextReview())
                .fsrsState(after.getState())
                .build());

        phrasing.recordAttempt(isCorrect, now);
        phrasingRepository.save(phrasing);

        concept.setFsrs(after);
        concept.setUpdatedAt(now);
        conceptRepository.saveAndFlush(concept);

        if (concept.isActive()) {
            StatsDelta delta = statsDeltaCalculator.computeDelta(
                    oldState, after.getState(), oldNextReview, after.getNextReview(), now);
            if (delta != null) {
                Instant candidate = after.getNextReview().isAfter(now) ? after.getNextReview() : null;
                userStatsService.applyDelta(userId, delta.withNextReviewCandidate(candidate));
            }
        }

        return new InteractionResultDto(
                concept.getId(),
                phrasing.getId(),
                interaction.getId(),
                after.getNextReview(),
                after.getScheduledDays(),
                after.getState(),
                result.rating(),
                phrasing.getAttemptCount(),
                phrasing.getCorrectCount()
        );
    }

    private <T> T withRetry(Supplier<T> action) {
        int maxRetries = 3;
        for (int attempt = 0; attempt < maxRetries; attempt++) {
            try {
                return action.get();
            } catch (OptimisticLockingFailureException e) {
                if (attempt == maxRetries - 1) throw e;
                log.debug("Concurrent review update, retrying (attempt {})", attempt + 1);
                sleepBackoff(attempt + 1);
            }
        }
        throw new IllegalStateException("Retry loop exhausted unexpectedly");
    }

    private void sleepBackoff(int attempt) {
        try {
            Thread.sleep(50L * attempt);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
