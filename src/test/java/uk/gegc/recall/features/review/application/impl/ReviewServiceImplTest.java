package uk.gegc.recall.features.review.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.dao.OptimisticLockingFailureException;
import uk.gegc.recall.BaseUnitTest;
import uk.gegc.recall.features.concept.domain.model.Concept;
import uk.gegc.recall.features.concept.domain.model.Phrasing;
import uk.gegc.recall.features.concept.domain.repository.ConceptRepository;
import uk.gegc.recall.features.concept.domain.repository.PhrasingRepository;
import uk.gegc.recall.features.concept.infra.mapping.ConceptDtoMapper;
import uk.gegc.recall.features.review.api.dto.InteractionResultDto;
import uk.gegc.recall.features.review.api.dto.NextReviewDto;
import uk.gegc.recall.features.review.api.dto.RecordInteractionRequest;
import uk.gegc.recall.features.review.application.PhrasingSelector;
import uk.gegc.recall.features.review.application.QueuePrioritizer;
import uk.gegc.recall.features.review.application.ReviewService;
import uk.gegc.recall.features.review.domain.model.Interaction;
import uk.gegc.recall.features.review.domain.model.SelectionReason;
import uk.gegc.recall.features.review.domain.repository.InteractionRepository;
import uk.gegc.recall.features.scheduling.application.impl.FsrsAlgorithm;
import uk.gegc.recall.features.scheduling.application.impl.FsrsSchedulingEngine;
import uk.gegc.recall.features.scheduling.domain.model.CardState;
import uk.gegc.recall.features.scheduling.domain.model.FsrsMemoryState;
import uk.gegc.recall.features.scheduling.domain.model.Rating;
import uk.gegc.recall.features.stats.application.StatsDeltaCalculator;
import uk.gegc.recall.features.stats.application.UserStatsService;
import uk.gegc.recall.features.stats.domain.model.StatsDelta;
import uk.gegc.recall.shared.config.ReviewSchedulingProperties;
import uk.gegc.recall.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("ReviewServiceImpl Tests")
class ReviewServiceImplTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");
    private static final UUID USER_ID = UUID.randomUUID();

    @Mock
    private ConceptRepository conceptRepository;
    @Mock
    private PhrasingRepository phrasingRepository;
    @Mock
    private InteractionRepository interactionRepository;
    @Mock
    private UserStatsService userStatsService;
    @Mock
    private ReviewService self;

    private ReviewServiceImpl service;

    @BeforeEach
    void setUp() {
        ReviewSchedulingProperties properties = new ReviewSchedulingProperties();
        service = new ReviewServiceImpl(
                Clock.fixed(NOW, ZoneOffset.UTC),
                conceptRepository,
                phrasingRepository,
                interactionRepository,
                new FsrsSchedulingEngine(new FsrsAlgorithm()),
                new QueuePrioritizer(properties),
                new PhrasingSelector(),
                new StatsDeltaCalculator(),
                userStatsService,
                new ConceptDtoMapper(),
                properties,
                self);
    }

    @Nested
    @DisplayName("getNextReview")
    class NextReview {

        @Test
        @DisplayName("serves the most urgent due concept with its least-seen phrasing")
        void servesMostUrgent() {
            // Given
            Concept weak = reviewedConcept(0.3);
            Concept strong = reviewedConcept(0.85);
            when(conceptRepository.findDueCandidates(eq(USER_ID), eq(NOW), any())).thenReturn(List.of(strong, weak));
            Phrasing seen = phrasing(weak, 4);
            Phrasing fresh = phrasing(weak, 1);
            when(phrasingRepository.findActiveByConcept(eq(USER_ID), eq(weak.getId()), any()))
                    .thenReturn(List.of(seen, fresh));
            when(interactionRepository.findByUserIdAndPhrasingIdOrderByAttemptedAtDesc(eq(USER_ID), eq(fresh.getId()), any()))
                    .thenReturn(List.of());

            // When
            Optional<NextReviewDto> next = service.getNextReview(USER_ID);

            // Then
            assertThat(next).isPresent();
            assertThat(next.get().concept().id()).isEqualTo(weak.getId());
            assertThat(next.get().phrasing().id()).isEqualTo(fresh.getId());
            assertThat(next.get().phrasingIndex()).isEqualTo(2);
            assertThat(next.get().totalPhrasings()).isEqualTo(2);
            assertThat(next.get().selectionReason()).isEqualTo(SelectionReason.LEAST_SEEN);
            assertThat(next.get().retrievability()).isEqualTo(0.3);
            assertThat(next.get().serverTime()).isEqualTo(NOW);
        }

        @Test
        @DisplayName("skips a candidate whose phrasings are all gone")
        void skipsConceptWithoutPhrasings() {
            Concept broken = reviewedConcept(0.1);
            Concept ok = reviewedConcept(0.6);
            when(conceptRepository.findDueCandidates(eq(USER_ID), eq(NOW), any())).thenReturn(List.of(broken, ok));
            when(phrasingRepository.findActiveByConcept(eq(USER_ID), eq(broken.getId()), any())).thenReturn(List.of());
            Phrasing phrasing = phrasing(ok, 0);
            when(phrasingRepository.findActiveByConcept(eq(USER_ID), eq(ok.getId()), any())).thenReturn(List.of(phrasing));
            when(interactionRepository.findByUserIdAndPhrasingIdOrderByAttemptedAtDesc(eq(USER_ID), eq(phrasing.getId()), any()))
                    .thenReturn(List.of());

            Optional<NextReviewDto> next = service.getNextReview(USER_ID);

            assertThat(next).map(dto -> dto.concept().id()).contains(ok.getId());
        }

        @Test
        @DisplayName("falls back to new concepts, and returns nothing when there are none")
        void emptyQueue() {
            when(conceptRepository.findDueCandidates(eq(USER_ID), eq(NOW), any())).thenReturn(List.of());
            when(conceptRepository.findCandidatesInState(eq(USER_ID), eq(CardState.NEW), any())).thenReturn(List.of());

            assertThat(service.getNextReview(USER_ID)).isEmpty();
            verify(phrasingRepository, never()).findActiveByConcept(any(), any(), any());
        }
    }

    @Nested
    @DisplayName("recordInteraction")
    class RecordInteraction {

        @Test
        @DisplayName("a correct first answer moves a new concept into learning and updates stats")
        void firstCorrectAnswer() {
            // Given
            Concept concept = newConcept();
            Phrasing phrasing = phrasing(concept, 0);
            when(conceptRepository.findByIdAndUserId(concept.getId(), USER_ID)).thenReturn(Optional.of(concept));
            when(phrasingRepository.findByIdAndUserId(phrasing.getId(), USER_ID)).thenReturn(Optional.of(phrasing));
            ArgumentCaptor<Interaction> saved = ArgumentCaptor.forClass(Interaction.class);
            when(interactionRepository.save(saved.capture())).thenAnswer(inv -> inv.getArgument(0));

            // When
            InteractionResultDto result = service.recordInteractionTx(USER_ID, request(concept, phrasing, true));

            // Then
            assertThat(result.newState()).isEqualTo(CardState.LEARNING);
            assertThat(result.rating()).isEqualTo(Rating.GOOD);
            assertThat(result.nextReview()).isEqualTo(NOW.plus(Duration.ofMinutes(10)));
            assertThat(result.totalAttempts()).isEqualTo(1);
            assertThat(result.totalCorrect()).isEqualTo(1);
            assertThat(saved.getValue().getFsrsState()).isEqualTo(CardState.LEARNING);
            assertThat(concept.getFsrs().getReps()).isEqualTo(1);
            verify(conceptRepository).saveAndFlush(concept);
            verify(userStatsService).applyDelta(USER_ID,
                    new StatsDelta(0, -1, 1, 0, -1, NOW.plus(Duration.ofMinutes(10))));
        }

        @Test
        @DisplayName("answers on an archived concept are recorded without touching stats")
        void archivedConceptNoStats() {
            Concept concept = newConcept();
            concept.setArchivedAt(NOW.minusSeconds(1));
            Phrasing phrasing = phrasing(concept, 0);
            when(conceptRepository.findByIdAndUserId(concept.getId(), USER_ID)).thenReturn(Optional.of(concept));
            when(phrasingRepository.findByIdAndUserId(phrasing.getId(), USER_ID)).thenReturn(Optional.of(phrasing));
            when(interactionRepository.save(any(Interaction.class))).thenAnswer(inv -> inv.getArgument(0));

            service.recordInteractionTx(USER_ID, request(concept, phrasing, false));

            verify(userStatsService, never()).applyDelta(any(), any());
        }

        @Test
        @DisplayName("a phrasing from another concept is not found")
        void phrasingMismatch() {
            Concept concept = newConcept();
            Phrasing other = phrasing(newConcept(), 0);
            when(conceptRepository.findByIdAndUserId(concept.getId(), USER_ID)).thenReturn(Optional.of(concept));
            when(phrasingRepository.findByIdAndUserId(other.getId(), USER_ID)).thenReturn(Optional.of(other));

            assertThatThrownBy(() -> service.recordInteractionTx(USER_ID, request(concept, other, true)))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("optimistic lock conflicts are retried in a fresh transaction")
        void retriesOnConflict() {
            RecordInteractionRequest request = new RecordInteractionRequest(
                    UUID.randomUUID(), UUID.randomUUID(), "A", true, 1200L, null);
            InteractionResultDto expected = new InteractionResultDto(request.conceptId(), request.phrasingId(),
                    UUID.randomUUID(), NOW, 0, CardState.LEARNING, Rating.GOOD, 1, 1);
            when(self.recordInteractionTx(USER_ID, request))
                    .thenThrow(new OptimisticLockingFailureException("stale"))
                    .thenReturn(expected);

            assertThat(service.recordInteraction(USER_ID, request)).isEqualTo(expected);
            verify(self, times(2)).recordInteractionTx(USER_ID, request);
        }

        @Test
        @DisplayName("gives up after three conflicts")
        void givesUpAfterThreeConflicts() {
            RecordInteractionRequest request = new RecordInteractionRequest(
                    UUID.randomUUID(), UUID.randomUUID(), "A", false, null, null);
            when(self.recordInteractionTx(USER_ID, request)).thenThrow(new OptimisticLockingFailureException("stale"));

            assertThatThrownBy(() -> service.recordInteraction(USER_ID, request))
                    .isInstanceOf(OptimisticLockingFailureException.class);
            verify(self, times(3)).recordInteractionTx(USER_ID, request);
        }
    }

    private static RecordInteractionRequest request(Concept concept, Phrasing phrasing, boolean correct) {
        return new RecordInteractionRequest(concept.getId(), phrasing.getId(), "A", correct, 3000L, "session-1");
    }

    private static Concept newConcept() {
        Concept concept = new Concept();
        concept.setId(UUID.randomUUID());
        concept.setUserId(USER_ID);
        concept.setTitle("Osmosis");
        concept.setPhrasingCount(1);
        concept.setCreatedAt(NOW.minus(Duration.ofHours(1)));
        concept.setFsrs(FsrsMemoryState.builder()
                .state(CardState.NEW)
                .nextReview(NOW.minus(Duration.ofHours(1)))
                .build());
        return concept;
    }

    private static Concept reviewedConcept(double retrievability) {
        Concept concept = newConcept();
        concept.setPhrasingCount(2);
        concept.setFsrs(FsrsMemoryState.builder()
                .state(CardState.REVIEW)
                .reps(3)
                .stability(4)
                .difficulty(5)
                .lastReview(NOW.minus(Duration.ofDays(6)))
                .nextReview(NOW.minus(Duration.ofDays(1)))
                .retrievability(retrievability)
                .build());
        return concept;
    }

    private static Phrasing phrasing(Concept concept, int attempts) {
        Phrasing phrasing = new Phrasing();
        phrasing.setId(UUID.randomUUID());
        phrasing.setUserId(USER_ID);
        phrasing.setConceptId(concept.getId());
        phrasing.setQuestion("Question " + attempts);
        phrasing.setOptions(new ArrayList<>(List.of("A", "B")));
        phrasing.setCorrectAnswer("A");
        phrasing.setAttemptCount(attempts);
        phrasing.setCreatedAt(NOW.minus(Duration.ofDays(2)));
        return phrasing;
    }
}
