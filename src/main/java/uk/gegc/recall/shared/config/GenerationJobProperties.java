package uk.gegc.recall.shared.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Limits and retention rules for generation jobs
 */
@Component
@ConfigurationProperties(prefix = "generation.jobs")
@Data
public class GenerationJobProperties {

    private int minPromptLength = 10;

    private int maxPromptLength = 5000;

    /**
     * Pending or processing jobs a single user may have at once
     */
    private int maxConcurrentPerUser = 3;

    private int maxConceptsPerGeneration = 50;

    private int targetPhrasingsPerConcept = 4;

    /**
     * Synthesised concept titles shorter than this are skipped
     */
    private int minConceptTitleLength = 5;

    /**
     * How many of the user's most recent concept titles are checked for duplicates
     */
    private int existingTitleScanLimit = 250;

    private int completedRetentionDays = 7;

    private int failedRetentionDays = 30;

    /**
     * Jobs still pending or processing after this many minutes are failed by the cleanup scheduler
     */
    private int stuckAfterMinutes = 60;
}
