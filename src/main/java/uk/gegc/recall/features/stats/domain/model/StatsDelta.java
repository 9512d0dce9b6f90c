package uk.gegc.recall.features.stats.domain.model;

import java.time.Instant;

/**
 * Signed counter changes for one user's {@link UserStats} row.
 *
 * @param nextReviewCandidate optional due time that may become the new earliest review time
 */
public record StatsDelta(
        long totalCards,
        long newCount,
        long learningCount,
        long matureCount,
        long dueNowCount,
        Instant nextReviewCandidate
) {

    public static final StatsDelta EMPTY = new StatsDelta(0, 0, 0, 0, 0, null);

    public boolean isEmpty() {
        return totalCards == 0 && newCount == 0 && learningCount == 0 && matureCount == 0
                && dueNowCount == 0 && nextReviewCandidate == null;
    }

    public StatsDelta plus(StatsDelta other) {
        Instant candidate = nextReviewCandidate;
        if (other.nextReviewCandidate != null
                && (candidate == null || other.nextReviewCandidate.isBefore(candidate))) {
            candidate = other.nextReviewCandidate;
        }
        return new StatsDelta(
                totalCards + other.totalCards,
                newCount + other.newCount,
                learningCount + other.learningCount,
                matureCount + other.matureCount,
                dueNowCount + other.dueNowCount,
                candidate
        );
    }

    public StatsDelta negate() {
        return new StatsDelta(-totalCards, -newCount, -learningCount, -matureCount, -dueNowCount, null);
    }

    public StatsDelta withNextReviewCandidate(Instant candidate) {
        return new StatsDelta(totalCards, newCount, learningCount, matureCount, dueNowCount, candidate);
    }
}
