package uk.gegc.recall.features.concept.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One testable rendering of a {@link Concept}. Attempt counters here are local analytics;
 * scheduling state lives on the concept.
 */
@Entity
@Getter
@Setter
@Table(
        name = "phrasings",
        indexes = {
                @Index(name = "idx_phrasings_user_concept", columnList = "user_id, concept_id, created_at"),
                @Index(name = "idx_phrasings_concept_active", columnList = "concept_id, deleted_at, archived_at")
        }
)
public class Phrasing {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "concept_id", nullable = false, updatable = false)
    private UUID conceptId;

    @Column(name = "question", nullable = false, length = 1000)
    private String question;

    @Column(name = "explanation", length = 4000)
    private String explanation;

    @Convert(converter = PhrasingTypeConverter.class)
    @Column(name = "type", length = 20)
    private PhrasingType type;

    @ElementCollection
    @CollectionTable(name = "phrasing_options", joinColumns = @JoinColumn(name = "phrasing_id"))
    @OrderColumn(name = "option_index")
    @Column(name = "option_text", nullable = false, length = 500)
    private List<String> options = new ArrayList<>();

    @Column(name = "correct_answer", length = 500)
    private String correctAnswer;

    @Column(name = "attempt_count", nullable = false)
    private int attemptCount;

    @Column(name = "correct_count", nullable = false)
    private int correctCount;

    @Column(name = "last_attempted_at")
    private Instant lastAttemptedAt;

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

    public boolean isActive() {
        return archivedAt == null && deletedAt == null;
    }

    public void recordAttempt(boolean correct, Instant attemptedAt) {
        attemptCount++;
        if (correct) {
            correctCount++;
        }
        lastAttemptedAt = attemptedAt;
        updatedAt = attemptedAt;
    }
}
