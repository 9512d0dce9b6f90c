package uk.gegc.recall.features.concept.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import uk.gegc.recall.BaseUnitTest;
import uk.gegc.recall.features.concept.api.dto.BulkActionResultDto;
import uk.gegc.recall.features.concept.api.dto.ConceptDetailDto;
import uk.gegc.recall.features.concept.api.dto.ConceptDto;
import uk.gegc.recall.features.concept.api.dto.UpdateConceptRequest;
import uk.gegc.recall.features.concept.api.dto.UpdatePhrasingRequest;
import uk.gegc.recall.features.concept.application.ConceptBulkAction;
import uk.gegc.recall.features.concept.application.ConceptLibraryView;
import uk.gegc.recall.features.concept.application.ConceptQualityCalculator;
import uk.gegc.recall.features.concept.domain.model.Concept;
import uk.gegc.recall.features.concept.domain.model.Phrasing;
import uk.gegc.recall.features.concept.domain.repository.ConceptRepository;
import uk.gegc.recall.features.concept.domain.repository.PhrasingRepository;
import uk.gegc.recall.features.concept.infra.mapping.ConceptDtoMapper;
import uk.gegc.recall.features.generation.application.GenerationJobService;
import uk.gegc.recall.features.scheduling.domain.model.CardState;
import uk.gegc.recall.features.scheduling.domain.model.FsrsMemoryState;
import uk.gegc.recall.features.stats.application.StatsDeltaCalculator;
import uk.gegc.recall.features.stats.application.UserStatsService;
import uk.gegc.recall.features.stats.domain.model.StatsDelta;
import uk.gegc.recall.shared.batch.BatchedMutator;
import uk.gegc.recall.shared.config.GenerationJobProperties;
import uk.gegc.recall.shared.exception.ResourceNotFoundException;
import uk.gegc.recall.shared.exception.ValidationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@DisplayName("ConceptServiceImpl Tests")
class ConceptServiceImplTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2025-05-01T09:00:00Z");
    private static final UUID USER_ID = UUID.randomUUID();

    @Mock
    private ConceptRepository conceptRepository;
    @Mock
    private PhrasingRepository phrasingRepository;
    @Mock
    private UserStatsService userStatsService;
    @Mock
    private GenerationJobService generationJobService;

    private ConceptServiceImpl service;

    @BeforeEach
    void setUp() {
        service = new ConceptServiceImpl(
                conceptRepository,
                phrasingRepository,
                new BatchedMutator(),
                new StatsDeltaCalculator(),
                userStatsService,
                new ConceptQualityCalculator(new GenerationJobProperties()),
                generationJobService,
                new ConceptDtoMapper(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("archive cascades to phrasings and removes the concept from the counters")
        void archiveCascades() {
            // Given
            Concept concept = activeConcept(CardState.REVIEW, NOW.plus(Duration.ofDays(3)));
            when(conceptRepository.findByIdAndUserId(concept.getId(), USER_ID)).thenReturn(Optional.of(concept));
            List<Phrasing> phrasings = List.of(phrasing(concept), phrasing(concept));
            when(phrasingRepository.findNotArchivedBatch(eq(USER_ID), eq(concept.getId()), any()))
                    .thenReturn(phrasings, List.of());

            // When
            boolean changed = service.archiveConcept(USER_ID, concept.getId());

            // Then
            assertThat(changed).isTrue();
            assertThat(concept.getArchivedAt()).isEqualTo(NOW);
            assertThat(phrasings).allSatisfy(p -> assertThat(p.getArchivedAt()).isEqualTo(NOW));
            ArgumentCaptor<StatsDelta> delta = ArgumentCaptor.forClass(StatsDelta.class);
            verify(userStatsService).applyDelta(eq(USER_ID), delta.capture());
            assertThat(delta.getValue()).isEqualTo(new StatsDelta(-1, 0, 0, -1, 0, null));
        }

        @Test
        @DisplayName("archiving twice is a no-op")
        void archiveIdempotent() {
            Concept concept = activeConcept(CardState.NEW, NOW);
            concept.setArchivedAt(NOW.minusSeconds(5));
            when(conceptRepository.findByIdAndUserId(concept.getId(), USER_ID)).thenReturn(Optional.of(concept));

            assertThat(service.archiveConcept(USER_ID, concept.getId())).isFalse();
            verify(userStatsService, never()).applyDelta(any(), any());
        }

        @Test
        @DisplayName("unarchive brings the concept back into the counters")
        void unarchive() {
            Concept concept = activeConcept(CardState.NEW, NOW.minusSeconds(60));
            concept.setArchivedAt(NOW.minusSeconds(5));
            when(conceptRepository.findByIdAndUserId(concept.getId(), USER_ID)).thenReturn(Optional.of(concept));
            when(phrasingRepository.findArchivedBatch(eq(USER_ID), eq(concept.getId()), any())).thenReturn(List.of());

            assertThat(service.unarchiveConcept(USER_ID, concept.getId())).isTrue();
            assertThat(concept.getArchivedAt()).isNull();
            verify(userStatsService).applyDelta(USER_ID, new StatsDelta(1, 1, 0, 0, 1, null));
        }

        @Test
        @DisplayName("deleting an archived concept leaves the counters alone")
        void deleteArchived() {
            Concept concept = activeConcept(CardState.REVIEW, NOW);
            concept.setArchivedAt(NOW.minusSeconds(5));
            when(conceptRepository.findByIdAndUserId(concept.getId(), USER_ID)).thenReturn(Optional.of(concept));
            when(phrasingRepository.findNotDeletedBatch(eq(USER_ID), eq(concept.getId()), any())).thenReturn(List.of());

            assertThat(service.softDeleteConcept(USER_ID, concept.getId())).isTrue();
            assertThat(concept.getDeletedAt()).isEqualTo(NOW);
            verify(userStatsService, never()).applyDelta(any(), any());
        }

        @Test
        @DisplayName("restore of a concept that was active re-counts it")
        void restoreActive() {
            Concept concept = activeConcept(CardState.LEARNING, NOW.plusSeconds(600));
            concept.setDeletedAt(NOW.minusSeconds(5));
            when(conceptRepository.findByIdAndUserId(concept.getId(), USER_ID)).thenReturn(Optional.of(concept));
            Phrasing phrasing = phrasing(concept);
            phrasing.setDeletedAt(NOW.minusSeconds(5));
            when(phrasingRepository.findDeletedBatch(eq(USER_ID), eq(concept.getId()), any()))
                    .thenReturn(List.of(phrasing), List.of());

            assertThat(service.restoreConcept(USER_ID, concept.getId())).isTrue();
            assertThat(phrasing.getDeletedAt()).isNull();
            verify(userStatsService).applyDelta(USER_ID, new StatsDelta(1, 0, 1, 0, 0, NOW.plusSeconds(600)));
        }

        @Test
        @DisplayName("unknown concept is not found")
        void notFound() {
            UUID conceptId = UUID.randomUUID();
            when(conceptRepository.findByIdAndUserId(conceptId, USER_ID)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.archiveConcept(USER_ID, conceptId))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("runBulkAction")
    class Bulk {

        @Test
        @DisplayName("de-duplicates ids and reports processed and skipped")
        void countsOutcomes() {
            Concept active = activeConcept(CardState.NEW, NOW);
            Concept alreadyArchived = activeConcept(CardState.NEW, NOW);
            alreadyArchived.setArchivedAt(NOW.minusSeconds(1));
            UUID missing = UUID.randomUUID();
            when(conceptRepository.findByIdAndUserId(active.getId(), USER_ID)).thenReturn(Optional.of(active));
            when(conceptRepository.findByIdAndUserId(alreadyArchived.getId(), USER_ID))
                    .thenReturn(Optional.of(alreadyArchived));
            when(conceptRepository.findByIdAndUserId(missing, USER_ID)).thenReturn(Optional.empty());
            when(phrasingRepository.findNotArchivedBatch(eq(USER_ID), eq(active.getId()), any())).thenReturn(List.of());

            BulkActionResultDto result = service.runBulkAction(USER_ID, ConceptBulkAction.ARCHIVE,
                    List.of(active.getId(), alreadyArchived.getId(), missing, active.getId()));

            assertThat(result).isEqualTo(new BulkActionResultDto(3, 1, 2));
        }

        @Test
        @DisplayName("rejects more than 100 distinct ids")
        void rejectsTooMany() {
            List<UUID> ids = IntStream.range(0, 101).mapToObj(i -> UUID.randomUUID()).toList();

            assertThatThrownBy(() -> service.runBulkAction(USER_ID, ConceptBulkAction.DELETE, ids))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("empty id list does nothing")
        void emptyIds() {
            assertThat(service.runBulkAction(USER_ID, ConceptBulkAction.RESTORE, List.of()))
                    .isEqualTo(new BulkActionResultDto(0, 0, 0));
        }
    }

    @Nested
    @DisplayName("editing")
    class Editing {

        @Test
        @DisplayName("updateConcept trims and rejects a blank title")
        void updateConcept() {
            Concept concept = activeConcept(CardState.NEW, NOW);
            when(conceptRepository.findByIdAndUserId(concept.getId(), USER_ID)).thenReturn(Optional.of(concept));
            when(conceptRepository.save(concept)).thenReturn(concept);

            ConceptDto dto = service.updateConcept(USER_ID, concept.getId(),
                    new UpdateConceptRequest("  Krebs cycle ", " Citric acid cycle "));

            assertThat(dto.title()).isEqualTo("Krebs cycle");
            assertThat(concept.getDescription()).isEqualTo("Citric acid cycle");
            assertThatThrownBy(() -> service.updateConcept(USER_ID, concept.getId(), new UpdateConceptRequest("   ", null)))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Title cannot be empty");
        }

        @Test
        @DisplayName("setCanonicalPhrasing rejects a phrasing from another concept")
        void canonicalForeignPhrasing() {
            Concept concept = activeConcept(CardState.NEW, NOW);
            Phrasing other = phrasing(activeConcept(CardState.NEW, NOW));
            when(conceptRepository.findByIdAndUserId(concept.getId(), USER_ID)).thenReturn(Optional.of(concept));
            when(phrasingRepository.findByIdAndUserId(other.getId(), USER_ID)).thenReturn(Optional.of(other));

            assertThatThrownBy(() -> service.setCanonicalPhrasing(USER_ID, concept.getId(), other.getId()))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasMessage("Phrasing not found or unavailable");
        }

        @Test
        @DisplayName("setCanonicalPhrasing with null clears the choice")
        void canonicalCleared() {
            Concept concept = activeConcept(CardState.NEW, NOW);
            concept.setCanonicalPhrasingId(UUID.randomUUID());
            when(conceptRepository.findByIdAndUserId(concept.getId(), USER_ID)).thenReturn(Optional.of(concept));
            when(conceptRepository.save(concept)).thenReturn(concept);

            assertThat(service.setCanonicalPhrasing(USER_ID, concept.getId(), null).canonicalPhrasingId()).isNull();
        }

        @Test
        @DisplayName("updatePhrasing requires the answer among the options and refreshes conflicts")
        void updatePhrasing() {
            Concept concept = activeConcept(CardState.NEW, NOW);
            Phrasing phrasing = phrasing(concept);
            when(phrasingRepository.findByIdAndUserId(phrasing.getId(), USER_ID)).thenReturn(Optional.of(phrasing));

            assertThatThrownBy(() -> service.updatePhrasing(USER_ID, phrasing.getId(),
                    new UpdatePhrasingRequest("Q?", "D", null, List.of("A", "B", "C"))))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Correct answer must be one of the provided options");

            when(phrasingRepository.save(phrasing)).thenReturn(phrasing);
            when(conceptRepository.findByIdAndUserId(concept.getId(), USER_ID)).thenReturn(Optional.of(concept));
            when(phrasingRepository.countActiveByConcept(concept.getId())).thenReturn(2L);
            when(phrasingRepository.findActiveQuestions(eq(concept.getId()), any()))
                    .thenReturn(List.of("Same question?", "same question?"));

            service.updatePhrasing(USER_ID, phrasing.getId(),
                    new UpdatePhrasingRequest(" Same question? ", "B", null, List.of("A", "B", "C")));

            assertThat(phrasing.getQuestion()).isEqualTo("Same question?");
            assertThat(phrasing.getAttemptCount()).isEqualTo(3);
            assertThat(concept.getConflictScore()).isEqualTo(1);
        }

        @Test
        @DisplayName("archivePhrasing refuses to archive the last active phrasing")
        void archiveLastPhrasing() {
            Concept concept = activeConcept(CardState.NEW, NOW);
            Phrasing phrasing = phrasing(concept);
            when(phrasingRepository.findByIdAndUserId(phrasing.getId(), USER_ID)).thenReturn(Optional.of(phrasing));
            when(conceptRepository.findByIdAndUserId(concept.getId(), USER_ID)).thenReturn(Optional.of(concept));
            when(phrasingRepository.countActiveByConcept(concept.getId())).thenReturn(1L);

            assertThatThrownBy(() -> service.archivePhrasing(USER_ID, phrasing.getId()))
                    .isInstanceOf(IllegalStateException.class);
        }

        @Test
        @DisplayName("archivePhrasing clears a canonical pointer to it")
        void archiveCanonicalPhrasing() {
            Concept concept = activeConcept(CardState.NEW, NOW);
            Phrasing phrasing = phrasing(concept);
            concept.setCanonicalPhrasingId(phrasing.getId());
            when(phrasingRepository.findByIdAndUserId(phrasing.getId(), USER_ID)).thenReturn(Optional.of(phrasing));
            when(conceptRepository.findByIdAndUserId(concept.getId(), USER_ID)).thenReturn(Optional.of(concept));
            when(phrasingRepository.countActiveByConcept(concept.getId())).thenReturn(3L, 2L);
            when(phrasingRepository.save(phrasing)).thenReturn(phrasing);
            when(phrasingRepository.findActiveQuestions(eq(concept.getId()), any())).thenReturn(List.of("A?", "B?"));

            service.archivePhrasing(USER_ID, phrasing.getId());

            assertThat(phrasing.getArchivedAt()).isEqualTo(NOW);
            assertThat(concept.getCanonicalPhrasingId()).isNull();
            assertThat(concept.getPhrasingCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("unarchivePhrasing requires an active concept")
        void unarchiveNeedsActiveConcept() {
            Concept concept = activeConcept(CardState.NEW, NOW);
            concept.setArchivedAt(NOW);
            Phrasing phrasing = phrasing(concept);
            phrasing.setArchivedAt(NOW);
            when(phrasingRepository.findByIdAndUserId(phrasing.getId(), USER_ID)).thenReturn(Optional.of(phrasing));
            when(conceptRepository.findByIdAndUserId(concept.getId(), USER_ID)).thenReturn(Optional.of(concept));

            assertThatThrownBy(() -> service.unarchivePhrasing(USER_ID, phrasing.getId()))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("reading")
    class Reading {

        @Test
        @DisplayName("library views clamp the page size and sort by next review")
        void libraryDueView() {
            ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
            Page<Concept> page = new PageImpl<>(List.of(activeConcept(CardState.REVIEW, NOW)));
            when(conceptRepository.findActiveDue(eq(USER_ID), eq(NOW), pageable.capture())).thenReturn(page);

            Page<ConceptDto> result = service.listForLibrary(USER_ID, ConceptLibraryView.DUE, -1, 500);

            assertThat(result.getContent()).hasSize(1);
            assertThat(pageable.getValue().getPageNumber()).isZero();
            assertThat(pageable.getValue().getPageSize()).isEqualTo(100);
            assertThat(pageable.getValue().getSort().getOrderFor("fsrs.nextReview").getDirection())
                    .isEqualTo(Sort.Direction.ASC);
        }

        @Test
        @DisplayName("archived view sorts by archive time, newest first")
        void libraryArchivedView() {
            ArgumentCaptor<Pageable> pageable = ArgumentCaptor.forClass(Pageable.class);
            when(conceptRepository.findArchived(eq(USER_ID), pageable.capture())).thenReturn(Page.empty());

            service.listForLibrary(USER_ID, ConceptLibraryView.ARCHIVED, 0, 5);

            assertThat(pageable.getValue().getPageSize()).isEqualTo(10);
            assertThat(pageable.getValue().getSort().getOrderFor("archivedAt").getDirection())
                    .isEqualTo(Sort.Direction.DESC);
        }

        @Test
        @DisplayName("getConcept reports a running generation job")
        void detailReportsGeneration() {
            Concept concept = activeConcept(CardState.NEW, NOW);
            when(conceptRepository.findByIdAndUserId(concept.getId(), USER_ID)).thenReturn(Optional.of(concept));
            when(phrasingRepository.findActiveByConcept(eq(USER_ID), eq(concept.getId()), any()))
                    .thenReturn(List.of(phrasing(concept)));
            when(phrasingRepository.findArchivedByConcept(eq(USER_ID), eq(concept.getId()), any())).thenReturn(List.of());
            when(generationJobService.hasActiveJobForConcept(USER_ID, concept.getId())).thenReturn(true);

            ConceptDetailDto detail = service.getConcept(USER_ID, concept.getId());

            assertThat(detail.phrasings()).hasSize(1);
            assertThat(detail.archivedPhrasings()).isEmpty();
            assertThat(detail.generationInProgress()).isTrue();
        }
    }

    private static Concept activeConcept(CardState state, Instant nextReview) {
        Concept concept = new Concept();
        concept.setId(UUID.randomUUID());
        concept.setUserId(USER_ID);
        concept.setTitle("Concept " + UUID.randomUUID());
        concept.setCreatedAt(NOW.minus(Duration.ofDays(10)));
        concept.setFsrs(FsrsMemoryState.builder()
                .state(state)
                .reps(state == CardState.NEW ? 0 : 2)
                .nextReview(nextReview)
                .build());
        return concept;
    }

    private static Phrasing phrasing(Concept concept) {
        Phrasing phrasing = new Phrasing();
        phrasing.setId(UUID.randomUUID());
        phrasing.setUserId(USER_ID);
        phrasing.setConceptId(concept.getId());
        phrasing.setQuestion("Original question?");
        phrasing.setOptions(new ArrayList<>(List.of("A", "B", "C")));
        phrasing.setCorrectAnswer("A");
        phrasing.setAttemptCount(3);
        phrasing.setCreatedAt(NOW.minus(Duration.ofDays(1)));
        return phrasing;
    }
}
