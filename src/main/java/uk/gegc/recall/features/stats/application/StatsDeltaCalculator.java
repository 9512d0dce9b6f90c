package uk.gegc.recall.features.stats.application;

import org.springframework.stereotype.Component;
import uk.gegc.recall.features.scheduling.domain.model.CardState;
import uk.gegc.recall.features.stats.domain.model.StatsCategory;
import uk.gegc.recall.features.stats.domain.model.StatsDelta;

import java.time.Instant;

/**
 * Computes counter changes for a single concept. Pure; persistence is the caller's job.
 */
@Component
public class StatsDeltaCalculator {

    /**
     * Delta for a concept moving between memory states and due times.
     * <p>
     * A null {@code newState} means the state is unchanged. Due-ness is only compared when both
     * review times are known; the boundary is inclusive, so a review time equal to {@code now} is due.
     *
     * @return the delta, or null when no counter changes
     */
    public StatsDelta computeDelta(CardState oldState,
                                   CardState newState,
                                   Instant oldNextReview,
                                   Instant newNextReview,
                                   Instant now) {
        long newCount = 0;
        long learningCount = 0;
        long matureCount = 0;
        long dueNowCount = 0;

        if (newState != null) {
            StatsCategory from = StatsCategory.of(oldState);
            StatsCategory to = StatsCategory.of(newState);
            if (from != to) {
                switch (from) {
                    case NEW -> newCount--;
                    case LEARNING -> learningCount--;
                    case MATURE -> matureCount--;
                }
                switch (to) {
                    case NEW -> newCount++;
                    case LEARNING -> learningCount++;
                    case MATURE -> matureCount++;
                }
            }
        }

        if (oldNextReview != null && newNextReview != null) {
            boolean wasDue = !oldNextReview.isAfter(now);
            boolean isDueNow = !newNextReview.isAfter(now);
            if (wasDue && !isDueNow) {
                dueNowCount--;
            } else if (!wasDue && isDueNow) {
                dueNowCount++;
            }
        }

        StatsDelta delta = new StatsDelta(0, newCount, learningCount, matureCount, dueNowCount, null);
        return delta.isEmpty() ? null : delta;
    }

    /**
     * Delta for a concept entering ({@code sign = 1}) or leaving ({@code sign = -1}) the active set,
     * as happens on create, archive, unarchive, delete and restore.
     */
    public StatsDelta lifecycleDelta(CardState state, Instant nextReview, Instant now, int sign) {
        if (sign != 1 && sign != -1) {
            throw new IllegalArgumentException("sign must be 1 or -1");
        }
        StatsCategory category = StatsCategory.of(state);
        boolean due = nextReview == null || !nextReview.isAfter(now);
        Instant candidate = sign > 0 && nextReview != null && nextReview.isAfter(now) ? nextReview : null;
        return new StatsDelta(
                sign,
                category == StatsCategory.NEW ? sign : 0,
                category == StatsCategory.LEARNING ? sign : 0,
                category == StatsCategory.MATURE ? sign : 0,
                due ? sign : 0,
                candidate
        );
    }
}
