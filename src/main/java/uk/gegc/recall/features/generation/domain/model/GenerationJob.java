package uk.gegc.recall.features.generation.domain.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Entity
@Table(
        name = "generation_jobs",
        indexes = {
                @Index(name = "idx_generation_jobs_user_created", columnList = "user_id, created_at"),
                @Index(name = "idx_generation_jobs_status_completed", columnList = "status, completed_at")
        }
)
@Data
@NoArgsConstructor
public class GenerationJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "prompt", nullable = false, columnDefinition = "TEXT")
    private String prompt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private JobStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "phase", nullable = false, length = 30)
    private JobPhase phase;

    /**
     * Every phrasing the model returned, valid or not
     */
    @Column(name = "phrasing_generated", nullable = false)
    private int phrasingGenerated;

    /**
     * Phrasings that passed validation and were persisted
     */
    @Column(name = "phrasing_saved", nullable = false)
    private int phrasingSaved;

    @Column(name = "estimated_total")
    private Integer estimatedTotal;

    @Column(name = "topic", length = 500)
    private String topic;

    @ElementCollection
    @CollectionTable(name = "generation_job_concepts", joinColumns = @JoinColumn(name = "job_id"))
    @OrderColumn(name = "position")
    @Column(name = "concept_id", nullable = false)
    private List<UUID> conceptIds = new ArrayList<>();

    @ElementCollection
    @CollectionTable(name = "generation_job_pending_concepts", joinColumns = @JoinColumn(name = "job_id"))
    @OrderColumn(name = "position")
    @Column(name = "concept_id", nullable = false)
    private List<UUID> pendingConceptIds = new ArrayList<>();

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_code", length = 30)
    private GenerationErrorCode errorCode;

    @Column(name = "retryable")
    private Boolean retryable;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Version
    @Column(name = "version")
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (status == null) {
            status = JobStatus.PENDING;
        }
        if (phase == null) {
            phase = JobPhase.CLARIFYING;
        }
    }

    /**
     * Move forward to {@code next}; never moves backwards.
     */
    public void advancePhase(JobPhase next) {
        if (phase == null || phase.isBefore(next)) {
            phase = next;
        }
    }

    /**
     * Record that a step has started; the first call moves the job off PENDING.
     */
    public void markProcessing(Instant now) {
        if (status == JobStatus.PENDING) {
            status = JobStatus.PROCESSING;
        }
        if (startedAt == null) {
            startedAt = now;
        }
    }

    /**
     * Mark the job as completed successfully
     */
    public void markCompleted(Instant now) {
        this.status = JobStatus.COMPLETED;
        this.completedAt = now;
        Instant start = startedAt != null ? startedAt : createdAt;
        this.durationMs = start == null ? 0L : Math.max(0, Duration.between(start, now).toMillis());
        if (this.topic == null) {
            this.topic = prompt;
        }
    }

    /**
     * Mark the job as failed. Concepts created by earlier steps are kept.
     */
    public void markFailed(GenerationErrorCode code, String message, boolean retryable, Instant now) {
        this.status = JobStatus.FAILED;
        this.errorCode = code;
        this.errorMessage = message;
        this.retryable = retryable;
        this.completedAt = now;
    }

    public void markCancelled(Instant now) {
        this.status = JobStatus.CANCELLED;
        this.completedAt = now;
    }

    /**
     * Check if the job is in a terminal state
     */
    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }
}
