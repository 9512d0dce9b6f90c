package uk.gegc.recall.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tunables for the review queue and the memory model.
 *
 * <p>The urgency band and the freshness curve were tuned empirically and are expected to be
 * revisited per deployment, so they live in configuration rather than in code.
 */
@Component
@ConfigurationProperties(prefix = "review")
@Data
public class ReviewSchedulingProperties {

    /**
     * Retrievability distance from the most urgent item within which queue order is shuffled.
     */
    private double urgencyEpsilon = 0.05;

    /**
     * Number of due concepts read when building the next review item.
     */
    private int dueCandidateLimit = 25;

    /**
     * Number of past interactions returned alongside the next review item.
     */
    private int recentInteractionLimit = 10;

    private Freshness freshness = new Freshness();

    private Fsrs fsrs = new Fsrs();

    @Data
    public static class Freshness {

        /**
         * Never-reviewed concepts younger than this get a boost below every reviewed score.
         */
        private double windowHours = 72;

        /**
         * Half-life of the boost; the score moves from -2 toward -1 with this half-life.
         */
        private double halfLifeHours = 24;
    }

    @Data
    public static class Fsrs {

        private double requestRetention = 0.9;

        private int maximumIntervalDays = 36500;

        /**
         * Model weights; empty means the FSRS-5 defaults.
         */
        private double[] weights = new double[0];
    }
}
