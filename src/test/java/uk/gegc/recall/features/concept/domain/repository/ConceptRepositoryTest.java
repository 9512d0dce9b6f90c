package uk.gegc.recall.features.concept.domain.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Slice;
import org.springframework.test.context.ActiveProfiles;
import uk.gegc.recall.features.concept.domain.model.Concept;
import uk.gegc.recall.features.scheduling.domain.model.CardState;
import uk.gegc.recall.features.scheduling.domain.model.FsrsMemoryState;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@DisplayName("ConceptRepository Tests")
class ConceptRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private ConceptRepository conceptRepository;

    private final UUID userId = UUID.randomUUID();

    @Test
    @DisplayName("findDueCandidates returns active concepts with phrasings that are due, earliest first")
    void findDueCandidates() {
        // Given
        Concept dueLater = persist("Due later", NOW.minusSeconds(60), CardState.REVIEW, 2);
        Concept dueEarlier = persist("Due earlier", NOW.minusSeconds(3600), CardState.LEARNING, 1);
        Concept dueNow = persist("Due exactly now", NOW, CardState.NEW, 1);
        persist("Not yet due", NOW.plusSeconds(60), CardState.REVIEW, 1);
        persist("No phrasings", NOW.minusSeconds(60), CardState.NEW, 0);
        Concept archived = persist("Archived", NOW.minusSeconds(60), CardState.REVIEW, 1);
        archived.setArchivedAt(NOW);
        Concept deleted = persist("Deleted", NOW.minusSeconds(60), CardState.REVIEW, 1);
        deleted.setDeletedAt(NOW);
        persistFor(UUID.randomUUID(), "Someone else's", NOW.minusSeconds(60));
        entityManager.flush();

        // When
        List<Concept> result = conceptRepository.findDueCandidates(userId, NOW, PageRequest.of(0, 10));

        // Then
        assertThat(result).extracting(Concept::getId)
                .containsExactly(dueEarlier.getId(), dueLater.getId(), dueNow.getId());
    }

    @Test
    @DisplayName("findCandidatesInState ignores due dates")
    void findCandidatesInState() {
        Concept fresh = persist("Brand new concept", NOW.plusSeconds(86400), CardState.NEW, 1);
        persist("Reviewed concept", NOW.plusSeconds(86400), CardState.REVIEW, 1);
        entityManager.flush();

        assertThat(conceptRepository.findCandidatesInState(userId, CardState.NEW, PageRequest.of(0, 10)))
                .extracting(Concept::getId)
                .containsExactly(fresh.getId());
    }

    @Test
    @DisplayName("findActiveForScan slices active concepts in id order")
    void findActiveForScan() {
        for (int i = 0; i < 3; i++) {
            persist("Scan concept " + i, NOW, CardState.NEW, 1);
        }
        Concept archived = persist("Archived concept", NOW, CardState.NEW, 1);
        archived.setArchivedAt(NOW);
        entityManager.flush();

        Slice<Concept> first = conceptRepository.findActiveForScan(userId, PageRequest.of(0, 2));
        Slice<Concept> second = conceptRepository.findActiveForScan(userId, first.nextPageable());

        assertThat(first.getContent()).hasSize(2);
        assertThat(first.hasNext()).isTrue();
        assertThat(second.getContent()).hasSize(1);
        assertThat(second.hasNext()).isFalse();
    }

    @Test
    @DisplayName("findRecentTitles skips deleted concepts")
    void findRecentTitles() {
        persist("Kept title", NOW, CardState.NEW, 1);
        Concept deleted = persist("Deleted title", NOW, CardState.NEW, 1);
        deleted.setDeletedAt(NOW);
        entityManager.flush();

        assertThat(conceptRepository.findRecentTitles(userId, PageRequest.of(0, 10)))
                .containsExactly("Kept title");
    }

    private Concept persist(String title, Instant nextReview, CardState state, int phrasingCount) {
        Concept concept = new Concept();
        concept.setUserId(userId);
        concept.setTitle(title);
        concept.setPhrasingCount(phrasingCount);
        concept.setFsrs(FsrsMemoryState.builder()
                .stability(0)
                .difficulty(0)
                .nextReview(nextReview)
                .state(state)
                .build());
        concept.setCreatedAt(NOW.minusSeconds(86400));
        return entityManager.persist(concept);
    }

    private void persistFor(UUID owner, String title, Instant nextReview) {
        Concept concept = new Concept();
        concept.setUserId(owner);
        concept.setTitle(title);
        concept.setPhrasingCount(1);
        concept.setFsrs(FsrsMemoryState.builder().nextReview(nextReview).state(CardState.REVIEW).build());
        entityManager.persist(concept);
    }
}
