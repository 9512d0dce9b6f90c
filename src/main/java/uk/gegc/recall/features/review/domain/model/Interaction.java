package uk.gegc.recall.features.review.domain.model;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import uk.gegc.recall.features.scheduling.domain.model.CardState;

import java.time.Instant;
import java.util.UUID;

/**
 * One answered review. Append-only: rows are never updated once written.
 */
@Entity
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Table(
        name = "interactions",
        indexes = {
                @Index(name = "idx_interactions_user_phrasing", columnList = "user_id, phrasing_id, attempted_at"),
                @Index(name = "idx_interactions_user_concept", columnList = "user_id, concept_id, attempted_at")
        }
)
public class Interaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "concept_id", nullable = false, updatable = false)
    private UUID conceptId;

    @Column(name = "phrasing_id", nullable = false, updatable = false)
    private UUID phrasingId;

    @Column(name = "user_answer", nullable = false, updatable = false, length = 2000)
    private String userAnswer;

    @Column(name = "is_correct", nullable = false, updatable = false)
    private boolean correct;

    @Column(name = "attempted_at", nullable = false, updatable = false)
    private Instant attemptedAt;

    @Column(name = "time_spent_ms", updatable = false)
    private Long timeSpentMs;

    @Column(name = "session_id", updatable = false, length = 100)
    private String sessionId;

    // Scheduling outcome at the time of the answer

    @Column(name = "ctx_scheduled_days", updatable = false)
    private Integer scheduledDays;

    @Column(name = "ctx_next_review", updatable = false)
    private Instant nextReview;

    @Enumerated(EnumType.STRING)
    @Column(name = "ctx_fsrs_state", updatable = false, length = 16)
    private CardState fsrsState;
}
