package uk.gegc.recall.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Retry, backoff and timeout settings for content-generation calls
 */
@Component
@ConfigurationProperties(prefix = "ai.rate-limit")
@Data
public class AiRateLimitConfig {

    /**
     * Maximum number of attempts for one generation call
     */
    private int maxRetries = 3;

    /**
     * Base delay in milliseconds for exponential backoff
     */
    private long baseDelayMs = 1000;

    /**
     * Cap for exponential backoff in milliseconds
     */
    private long maxDelayMs = 60000;

    /**
     * Jitter factor for backoff calculation (0.0 = no jitter, 0.5 = ±50% variation)
     */
    private double jitterFactor = 0.25;

    /**
     * Hard wall-clock limit for a single model call in seconds
     */
    private long callTimeoutSeconds = 120;
}
