package uk.gegc.recall.features.concept.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import uk.gegc.recall.features.scheduling.domain.model.FsrsMemoryState;

import java.time.Instant;
import java.util.UUID;

/**
 * Atomic knowledge unit subject to spaced-repetition scheduling. Never hard-deleted.
 */
@Entity
@Getter
@Setter
@Table(
        name = "concepts",
        indexes = {
                @Index(name = "idx_concepts_user_next_review", columnList = "user_id, deleted_at, archived_at, fsrs_next_review"),
                @Index(name = "idx_concepts_user_created", columnList = "user_id, created_at")
        }
)
public class Concept {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "title", nullable = false, length = 500)
    private String title;

    @Column(name = "description", length = 4000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "content_type", length = 20)
    private ContentType contentType;

    /**
     * Serialized learner intent the concept was synthesised from, passed back when generating phrasings
     */
    @Column(name = "origin_intent", columnDefinition = "TEXT")
    private String originIntent;

    @Embedded
    private FsrsMemoryState fsrs;

    @Column(name = "phrasing_count", nullable = false)
    private int phrasingCount;

    @Column(name = "conflict_score")
    private Integer conflictScore;

    @Column(name = "thin_score")
    private Integer thinScore;

    @Column(name = "quality_score")
    private Double qualityScore;

    @Column(name = "canonical_phrasing_id")
    private UUID canonicalPhrasingId;

    @Column(name = "generation_job_id")
    private UUID generationJobId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "archived_at")
    private Instant archivedAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }

    /**
     * Active concepts take part in scheduling and count toward user stats.
     */
    public boolean isActive() {
        return archivedAt == null && deletedAt == null;
    }

    public boolean isArchived() {
        return archivedAt != null && deletedAt == null;
    }

    public boolean isDeleted() {
        return deletedAt != null;
    }
}
