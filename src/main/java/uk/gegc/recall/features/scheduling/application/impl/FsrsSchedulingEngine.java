package uk.gegc.recall.features.scheduling.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.recall.features.scheduling.application.MemoryModel;
import uk.gegc.recall.features.scheduling.application.SchedulingEngine;
import uk.gegc.recall.features.scheduling.domain.model.CardState;
import uk.gegc.recall.features.scheduling.domain.model.FsrsMemoryState;
import uk.gegc.recall.features.scheduling.domain.model.Rating;

import java.time.Instant;

@Component
@RequiredArgsConstructor
public class FsrsSchedulingEngine implements SchedulingEngine {

    private final MemoryModel memoryModel;

    @Override
    public ScheduleResult schedule(FsrsMemoryState state, boolean isCorrect, Instant now) {
        Rating rating = Rating.fromCorrectness(isCorrect);
        MemoryModel.Card card;
        if (state == null) {
            card = memoryModel.newCard(now);
        } else if (isCorrupt(state)) {
            card = restartFrom(state, now);
        } else {
            card = toCard(state);
        }

        MemoryModel.Card next = memoryModel.review(card, rating, now);
        return new ScheduleResult(fromCard(next), rating);
    }

    @Override
    public double getRetrievability(FsrsMemoryState state, Instant now) {
        if (state == null || state.stateOrNew() == CardState.NEW) {
            return UNSEEN_RETRIEVABILITY;
        }
        if (!(state.getStability() > 0)) {
            return 0.0;
        }
        return memoryModel.retrievability(toCard(state), now);
    }

    // Reviewed cards need positive stability and difficulty.
    private static boolean isCorrupt(FsrsMemoryState state) {
        return state.stateOrNew() != CardState.NEW
                && (!(state.getStability() > 0) || !(state.getDifficulty() > 0));
    }

    // First-review card that keeps the stored reps and lapses.
    private MemoryModel.Card restartFrom(FsrsMemoryState state, Instant now) {
        MemoryModel.Card fresh = memoryModel.newCard(now);
        return new MemoryModel.Card(
                fresh.due(),
                fresh.stability(),
                fresh.difficulty(),
                fresh.elapsedDays(),
                fresh.scheduledDays(),
                Math.max(0, state.getReps()),
                Math.max(0, state.getLapses()),
                fresh.state(),
                fresh.lastReview()
        );
    }

    @Override
    public FsrsMemoryState initializeState(Instant now) {
        return fromCard(memoryModel.newCard(now));
    }

    @Override
    public boolean isDue(FsrsMemoryState state, Instant now) {
        if (state == null || state.getNextReview() == null) {
            return true;
        }
        return !state.getNextReview().isAfter(now);
    }

    @Override
    public MemoryModel.Card toCard(FsrsMemoryState state) {
        return new MemoryModel.Card(
                state.getNextReview(),
                state.getStability(),
                state.getDifficulty(),
                Math.max(0, state.getElapsedDays()),
                Math.max(0, state.getScheduledDays()),
                Math.max(0, state.getReps()),
                Math.max(0, state.getLapses()),
                state.stateOrNew(),
                state.getLastReview()
        );
    }

    @Override
    public FsrsMemoryState fromCard(MemoryModel.Card card) {
        return FsrsMemoryState.builder()
                .nextReview(card.due())
                .stability(card.stability())
                .difficulty(card.difficulty())
                .elapsedDays(card.elapsedDays())
                .scheduledDays(card.scheduledDays())
                .reps(card.reps())
                .lapses(card.lapses())
                .state(card.state() == null ? CardState.NEW : card.state())
                .lastReview(card.lastReview())
                .build();
    }
}
