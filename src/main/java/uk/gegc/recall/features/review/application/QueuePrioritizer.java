package uk.gegc.recall.features.review.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.recall.features.concept.domain.model.Concept;
import uk.gegc.recall.features.scheduling.domain.model.CardState;
import uk.gegc.recall.features.scheduling.domain.model.FsrsMemoryState;
import uk.gegc.recall.shared.config.ReviewSchedulingProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.function.ToDoubleBiFunction;

/**
 * Orders review candidates by urgency.
 * <p>
 * Candidates are sorted by ascending retrievability. The leading run of candidates within
 * {@code review.urgency-epsilon} of the most urgent one is shuffled so that near-ties do not
 * always resolve to the same concept across repeated reads.
 */
@Component
@RequiredArgsConstructor
public class QueuePrioritizer {

    private static final double LN2 = Math.log(2);

    private final ReviewSchedulingProperties properties;

    public List<PrioritizedConcept> prioritize(Collection<Concept> concepts,
                                               Instant now,
                                               ToDoubleBiFunction<FsrsMemoryState, Instant> retrievabilityFn,
                                               Random rng) {
        List<PrioritizedConcept> scored = new ArrayList<>(concepts.size());
        for (Concept concept : concepts) {
            if (concept.getPhrasingCount() <= 0) {
                continue;
            }
            scored.add(new PrioritizedConcept(concept, score(concept, now, retrievabilityFn)));
        }

        scored.sort(Comparator.comparingDouble(PrioritizedConcept::retrievability));
        shuffleUrgentTier(scored, rng);
        return scored;
    }

    /**
     * Boost for never-reviewed material inside the freshness window: {@code -2} at creation,
     * halving its distance below {@code -1} every half-life, and exactly {@code -1} once the
     * window has passed.
     */
    public double freshnessScore(Instant createdAt, Instant now) {
        if (createdAt == null) {
            return -1;
        }
        double ageHours = Math.max(0, Duration.between(createdAt, now).toMillis() / 3_600_000.0);
        ReviewSchedulingProperties.Freshness freshness = properties.getFreshness();
        if (ageHours >= freshness.getWindowHours()) {
            return -1;
        }
        return -1 - Math.exp(-LN2 * ageHours / freshness.getHalfLifeHours());
    }

    private double score(Concept concept, Instant now, ToDoubleBiFunction<FsrsMemoryState, Instant> retrievabilityFn) {
        FsrsMemoryState fsrs = concept.getFsrs();
        if (isUnseen(fsrs)) {
            return freshnessScore(concept.getCreatedAt(), now);
        }
        if (fsrs.getRetrievability() != null) {
            return fsrs.getRetrievability();
        }
        return retrievabilityFn.applyAsDouble(fsrs, now);
    }

    private boolean isUnseen(FsrsMemoryState fsrs) {
        return fsrs == null || (fsrs.stateOrNew() == CardState.NEW && fsrs.getReps() == 0);
    }

    private void shuffleUrgentTier(List<PrioritizedConcept> sorted, Random rng) {
        if (sorted.size() < 2) {
            return;
        }
        double threshold = sorted.get(0).retrievability() + properties.getUrgencyEpsilon();
        int tierSize = 0;
        while (tierSize < sorted.size() && sorted.get(tierSize).retrievability() <= threshold) {
            tierSize++;
        }
        // Fisher-Yates over the prefix only
        for (int i = tierSize - 1; i > 0; i--) {
            int j = rng.nextInt(i + 1);
            PrioritizedConcept tmp = sorted.get(i);
            sorted.set(i, sorted.get(j));
            sorted.set(j, tmp);
        }
    }
}
