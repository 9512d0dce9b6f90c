package uk.gegc.recall.features.scheduling.application;

import uk.gegc.recall.features.scheduling.domain.model.CardState;
import uk.gegc.recall.features.scheduling.domain.model.Rating;

import java.time.Instant;

public interface MemoryModel {

    Card newCard(Instant now);

    Card review(Card card, Rating rating, Instant now);

    /**
     * Probability of recall at {@code now}; only meaningful for cards that have been reviewed.
     */
    double retrievability(Card card, Instant now);

    record Card(
            Instant due,
            double stability,
            double difficulty,
            int elapsedDays,
            int scheduledDays,
            int reps,
            int lapses,
            CardState state,
            Instant lastReview
    ) {}
}
