package uk.gegc.recall.features.generation.domain.model;

/**
 * Status of generation jobs
 */
public enum JobStatus {

    /**
     * Job is accepted and waiting for its first step
     */
    PENDING("Pending"),

    /**
     * At least one step has started
     */
    PROCESSING("Processing"),

    COMPLETED("Completed"),

    FAILED("Failed"),

    CANCELLED("Cancelled");

    private final String displayName;

    JobStatus(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Check if the status is a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Check if the status indicates the job is active
     */
    public boolean isActive() {
        return this == PENDING || this == PROCESSING;
    }
}
