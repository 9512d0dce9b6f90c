package uk.gegc.recall.features.stats.domain.model;

import uk.gegc.recall.features.scheduling.domain.model.CardState;

/**
 * Counter a memory state is tallied under. Learning and relearning share a counter, so
 * review to relearning is a mature to learning crossing.
 */
public enum StatsCategory {
    NEW,
    LEARNING,
    MATURE;

    public static StatsCategory of(CardState state) {
        if (state == null) {
            return NEW;
        }
        return switch (state) {
            case NEW -> NEW;
            case LEARNING, RELEARNING -> LEARNING;
            case REVIEW -> MATURE;
        };
    }
}
