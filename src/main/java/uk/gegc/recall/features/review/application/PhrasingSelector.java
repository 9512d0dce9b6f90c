package uk.gegc.recall.features.review.application;

import org.springframework.stereotype.Component;
import uk.gegc.recall.features.concept.domain.model.Concept;
import uk.gegc.recall.features.concept.domain.model.Phrasing;
import uk.gegc.recall.features.review.domain.model.SelectionReason;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Picks which phrasing of a concept to show next.
 */
@Component
public class PhrasingSelector {

    private static final Comparator<Phrasing> LEAST_SEEN_FIRST = Comparator
            .comparingInt(Phrasing::getAttemptCount)
            .thenComparing(Phrasing::getLastAttemptedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparing(Phrasing::getCreatedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()));

    public PhrasingSelection selectActivePhrasing(Concept concept, List<Phrasing> phrasings) {
        return selectActivePhrasing(concept, phrasings, null);
    }

    /**
     * @param excludePhrasingId phrasing to skip, typically the one just answered; may be null
     * @return the selection, or null when the concept has no presentable phrasing
     */
    public PhrasingSelection selectActivePhrasing(Concept concept, List<Phrasing> phrasings, UUID excludePhrasingId) {
        List<Phrasing> active = phrasings.stream()
                .filter(Phrasing::isActive)
                .toList();

        List<Phrasing> eligible = excludePhrasingId == null
                ? active
                : active.stream().filter(p -> !excludePhrasingId.equals(p.getId())).toList();
        if (eligible.isEmpty()) {
            return null;
        }

        UUID canonicalId = concept.getCanonicalPhrasingId();
        if (canonicalId != null) {
            for (Phrasing phrasing : eligible) {
                if (canonicalId.equals(phrasing.getId())) {
                    return selection(phrasing, active, SelectionReason.CANONICAL);
                }
            }
        }

        Phrasing leastSeen = eligible.stream().min(LEAST_SEEN_FIRST).orElseThrow();
        return selection(leastSeen, active, SelectionReason.LEAST_SEEN);
    }

    private PhrasingSelection selection(Phrasing chosen, List<Phrasing> active, SelectionReason reason) {
        int index = active.indexOf(chosen);
        return new PhrasingSelection(chosen, active.size(), index < 0 ? 1 : index + 1, reason);
    }
}
