package uk.gegc.recall.features.review.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.recall.BaseUnitTest;
import uk.gegc.recall.features.concept.domain.model.Concept;
import uk.gegc.recall.features.concept.domain.model.Phrasing;
import uk.gegc.recall.features.review.domain.model.SelectionReason;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("PhrasingSelector Tests")
class PhrasingSelectorTest extends BaseUnitTest {

    private static final Instant T0 = Instant.parse("2025-01-01T00:00:00Z");

    private final PhrasingSelector selector = new PhrasingSelector();

    @Test
    @DisplayName("canonical phrasing wins when it is active")
    void canonicalWins() {
        Phrasing first = phrasing(0, null, T0);
        Phrasing canonical = phrasing(9, T0.plusSeconds(5), T0.plusSeconds(1));
        Concept concept = concept(canonical.getId());

        PhrasingSelection selection = selector.selectActivePhrasing(concept, List.of(first, canonical));

        assertThat(selection.phrasing()).isSameAs(canonical);
        assertThat(selection.selectionReason()).isEqualTo(SelectionReason.CANONICAL);
        assertThat(selection.phrasingIndex()).isEqualTo(2);
        assertThat(selection.totalPhrasings()).isEqualTo(2);
    }

    @Test
    @DisplayName("archived canonical falls back to least seen")
    void archivedCanonicalIgnored() {
        Phrasing canonical = phrasing(0, null, T0);
        canonical.setArchivedAt(T0.plusSeconds(10));
        Phrasing other = phrasing(2, T0, T0.plusSeconds(1));

        PhrasingSelection selection = selector.selectActivePhrasing(
                concept(canonical.getId()), List.of(canonical, other));

        assertThat(selection.phrasing()).isSameAs(other);
        assertThat(selection.selectionReason()).isEqualTo(SelectionReason.LEAST_SEEN);
        assertThat(selection.totalPhrasings()).isEqualTo(1);
        assertThat(selection.phrasingIndex()).isEqualTo(1);
    }

    @Test
    @DisplayName("least seen: fewest attempts, then never attempted, then oldest")
    void leastSeenOrdering() {
        Phrasing busy = phrasing(3, T0.minusSeconds(100), T0);
        Phrasing attempted = phrasing(1, T0.plusSeconds(50), T0.plusSeconds(1));
        Phrasing untouchedNewer = phrasing(1, null, T0.plusSeconds(3));
        Phrasing untouchedOlder = phrasing(1, null, T0.plusSeconds(2));

        PhrasingSelection selection = selector.selectActivePhrasing(
                concept(null), List.of(busy, attempted, untouchedNewer, untouchedOlder));

        assertThat(selection.phrasing()).isSameAs(untouchedOlder);
        assertThat(selection.phrasingIndex()).isEqualTo(4);
    }

    @Test
    @DisplayName("excluded phrasing is skipped, including when it is canonical")
    void excludeSkipsPhrasing() {
        Phrasing canonical = phrasing(0, null, T0);
        Phrasing other = phrasing(5, T0, T0.plusSeconds(1));

        PhrasingSelection selection = selector.selectActivePhrasing(
                concept(canonical.getId()), List.of(canonical, other), canonical.getId());

        assertThat(selection.phrasing()).isSameAs(other);
        assertThat(selection.totalPhrasings()).isEqualTo(2);
    }

    @Test
    @DisplayName("returns null when nothing is eligible")
    void nothingEligible() {
        Phrasing only = phrasing(0, null, T0);
        Phrasing deleted = phrasing(0, null, T0);
        deleted.setDeletedAt(T0);

        assertThat(selector.selectActivePhrasing(concept(null), List.of())).isNull();
        assertThat(selector.selectActivePhrasing(concept(null), List.of(deleted))).isNull();
        assertThat(selector.selectActivePhrasing(concept(null), List.of(only), only.getId())).isNull();
    }

    private static Concept concept(UUID canonicalId) {
        Concept concept = new Concept();
        concept.setId(UUID.randomUUID());
        concept.setCanonicalPhrasingId(canonicalId);
        return concept;
    }

    private static Phrasing phrasing(int attempts, Instant lastAttemptedAt, Instant createdAt) {
        Phrasing phrasing = new Phrasing();
        phrasing.setId(UUID.randomUUID());
        phrasing.setQuestion("Q" + attempts);
        phrasing.setAttemptCount(attempts);
        phrasing.setLastAttemptedAt(lastAttemptedAt);
        phrasing.setCreatedAt(createdAt);
        return phrasing;
    }
}
