package uk.gegc.recall.features.scheduling.application.impl;

import uk.gegc.recall.features.scheduling.application.MemoryModel;
import uk.gegc.recall.features.scheduling.domain.model.CardState;
import uk.gegc.recall.features.scheduling.domain.model.Rating;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;

/**
 * FSRS-5 memory model with short-term learning steps and no interval fuzz.
 */
public class FsrsAlgorithm implements MemoryModel {

    public static final double[] DEFAULT_WEIGHTS = {
            0.40255, 1.18385, 3.173, 15.69105, 7.1949, 0.5345, 1.4604, 0.0046, 1.54575, 0.1192,
            1.01925, 1.9395, 0.11, 0.29605, 2.2698, 0.2315, 2.9898, 0.51655, 0.6621
    };

    static final double DECAY = -0.5;
    static final double FACTOR = 19.0 / 81.0;

    private static final double MIN_STABILITY = 0.01;
    private static final double MIN_DIFFICULTY = 1.0;
    private static final double MAX_DIFFICULTY = 10.0;
    private static final double MILLIS_PER_DAY = 86_400_000.0;

    private static final Duration AGAIN_NEW_STEP = Duration.ofMinutes(1);
    private static final Duration HARD_NEW_STEP = Duration.ofMinutes(5);
    private static final Duration GOOD_NEW_STEP = Duration.ofMinutes(10);
    private static final Duration AGAIN_LEARNING_STEP = Duration.ofMinutes(5);
    private static final Duration HARD_LEARNING_STEP = Duration.ofMinutes(10);
    private static final Duration RELEARNING_STEP = Duration.ofMinutes(10);

    private final double[] w;
    private final int maximumInterval;
    private final double intervalModifier;

    public FsrsAlgorithm() {
        this(DEFAULT_WEIGHTS, 0.9, 36500);
    }

    public FsrsAlgorithm(double[] weights, double requestRetention, int maximumInterval) {
        if (weights == null || weights.length != DEFAULT_WEIGHTS.length) {
            throw new IllegalArgumentException("FSRS-5 requires " + DEFAULT_WEIGHTS.length + " weights");
        }
        if (requestRetention <= 0 || requestRetention >= 1) {
            throw new IllegalArgumentException("requestRetention must be in (0, 1)");
        }
        if (maximumInterval < 1) {
            throw new IllegalArgumentException("maximumInterval must be at least 1 day");
        }
        this.w = weights.clone();
        this.maximumInterval = maximumInterval;
        this.intervalModifier = (Math.pow(requestRetention, 1 / DECAY) - 1) / FACTOR;
    }

    @Override
    public Card newCard(Instant now) {
        return new Card(now, 0, 0, 0, 0, 0, 0, CardState.NEW, null);
    }

    @Override
    public Card review(Card card, Rating rating, Instant now) {
        CardState state = card.state() == null ? CardState.NEW : card.state();
        int elapsedDays = state == CardState.NEW || card.lastReview() == null
                ? 0
                : (int) Math.max(0, ChronoUnit.DAYS.between(card.lastReview(), now));

        return switch (state) {
            case NEW -> reviewNew(card, rating, now);
            case LEARNING, RELEARNING -> reviewLearning(card, state, rating, now, elapsedDays);
            case REVIEW -> reviewMature(card, rating, now, elapsedDays);
        };
    }

    @Override
    public double retrievability(Card card, Instant now) {
        if (card.state() == null || card.state() == CardState.NEW || card.stability() <= 0) {
            return 0;
        }
        double elapsed = card.lastReview() == null
                ? card.elapsedDays()
                : Math.max(0, Duration.between(card.lastReview(), now).toMillis() / MILLIS_PER_DAY);
        return clamp(forgettingCurve(elapsed, card.stability()), 0, 1);
    }

    private Card reviewNew(Card card, Rating rating, Instant now) {
        double difficulty = constrainDifficulty(initDifficulty(rating));
        double stability = initStability(rating);

        return switch (rating) {
            case AGAIN -> step(card, now, difficulty, stability, 0, CardState.LEARNING, AGAIN_NEW_STEP, card.lapses());
            case HARD -> step(card, now, difficulty, stability, 0, CardState.LEARNING, HARD_NEW_STEP, card.lapses());
            case GOOD -> step(card, now, difficulty, stability, 0, CardState.LEARNING, GOOD_NEW_STEP, card.lapses());
            case EASY -> graduate(card, now, difficulty, stability, 0, nextInterval(stability), card.lapses());
        };
    }

    private Card reviewLearning(Card card, CardState state, Rating rating, Instant now, int elapsedDays) {
        double difficulty = nextDifficulty(card.difficulty(), rating);
        double stability = shortTermStability(card.stability(), rating);

        return switch (rating) {
            case AGAIN -> step(card, now, difficulty, stability, elapsedDays, state, AGAIN_LEARNING_STEP, card.lapses());
            case HARD -> step(card, now, difficulty, stability, elapsedDays, state, HARD_LEARNING_STEP, card.lapses());
            case GOOD -> graduate(card, now, difficulty, stability, elapsedDays, nextInterval(stability), card.lapses());
            case EASY -> {
                int goodInterval = nextInterval(shortTermStability(card.stability(), Rating.GOOD));
                int easyInterval = Math.max(nextInterval(stability), goodInterval + 1);
                yield graduate(card, now, difficulty, stability, elapsedDays, easyInterval, card.lapses());
            }
        };
    }

    private Card reviewMature(Card card, Rating rating, Instant now, int elapsedDays) {
        double d = card.difficulty();
        double s = card.stability();
        double r = forgettingCurve(elapsedDays, s);
        double difficulty = nextDifficulty(d, rating);

        if (rating == Rating.AGAIN) {
            double forgetStability = Math.min(forgetStability(d, s, r), s / Math.exp(w[17] * w[18]));
            return step(card, now, difficulty, clampStability(forgetStability), elapsedDays,
                    CardState.RELEARNING, RELEARNING_STEP, card.lapses() + 1);
        }

        double hardStability = recallStability(d, s, r, Rating.HARD);
        double goodStability = recallStability(d, s, r, Rating.GOOD);
        double easyStability = recallStability(d, s, r, Rating.EASY);

        int hardInterval = nextInterval(hardStability);
        int goodInterval = nextInterval(goodStability);
        hardInterval = Math.min(hardInterval, goodInterval);
        goodInterval = Math.max(goodInterval, hardInterval + 1);
        int easyInterval = Math.max(nextInterval(easyStability), goodInterval + 1);

        return switch (rating) {
            case HARD -> graduate(card, now, difficulty, hardStability, elapsedDays, hardInterval, card.lapses());
            case GOOD -> graduate(card, now, difficulty, goodStability, elapsedDays, goodInterval, card.lapses());
            case EASY -> graduate(card, now, difficulty, easyStability, elapsedDays, easyInterval, card.lapses());
            case AGAIN -> throw new IllegalStateException("unreachable");
        };
    }

    private Card step(Card card, Instant now, double difficulty, double stability, int elapsedDays,
                      CardState state, Duration delay, int lapses) {
        return new Card(now.plus(delay), stability, difficulty, elapsedDays, 0,
                card.reps() + 1, lapses, state, now);
    }

    private Card graduate(Card card, Instant now, double difficulty, double stability, int elapsedDays,
                          int intervalDays, int lapses) {
        return new Card(now.plus(intervalDays, ChronoUnit.DAYS), stability, difficulty, elapsedDays,
                intervalDays, card.reps() + 1, lapses, CardState.REVIEW, now);
    }

    double forgettingCurve(double elapsedDays, double stability) {
        return Math.pow(1 + FACTOR * elapsedDays / stability, DECAY);
    }

    int nextInterval(double stability) {
        long interval = Math.round(stability * intervalModifier);
        return (int) Math.min(Math.max(interval, 1), maximumInterval);
    }

    double initStability(Rating rating) {
        return Math.max(w[rating.getValue() - 1], 0.1);
    }

    double initDifficulty(Rating rating) {
        return w[4] - Math.exp((rating.getValue() - 1) * w[5]) + 1;
    }

    double nextDifficulty(double difficulty, Rating rating) {
        double delta = -w[6] * (rating.getValue() - 3);
        double damped = difficulty + delta * (10 - difficulty) / 9;
        double reverted = w[7] * initDifficulty(Rating.EASY) + (1 - w[7]) * damped;
        return constrainDifficulty(reverted);
    }

    double recallStability(double d, double s, double r, Rating rating) {
        double hardPenalty = rating == Rating.HARD ? w[15] : 1;
        double easyBonus = rating == Rating.EASY ? w[16] : 1;
        double next = s * (1 + Math.exp(w[8]) * (11 - d) * Math.pow(s, -w[9])
                * (Math.exp((1 - r) * w[10]) - 1) * hardPenalty * easyBonus);
        return clampStability(next);
    }

    double forgetStability(double d, double s, double r) {
        return w[11] * Math.pow(d, -w[12]) * (Math.pow(s + 1, w[13]) - 1) * Math.exp((1 - r) * w[14]);
    }

    double shortTermStability(double s, Rating rating) {
        return clampStability(s * Math.exp(w[17] * (rating.getValue() - 3 + w[18])));
    }

    private double constrainDifficulty(double difficulty) {
        return clamp(difficulty, MIN_DIFFICULTY, MAX_DIFFICULTY);
    }

    private double clampStability(double stability) {
        return clamp(stability, MIN_STABILITY, maximumInterval);
    }

    private static double clamp(double value, double min, double max) {
        return Math.min(Math.max(value, min), max);
    }
}
