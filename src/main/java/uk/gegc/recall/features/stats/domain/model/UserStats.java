package uk.gegc.recall.features.stats.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Cached per-user aggregate of the concept set. Written through atomic delta updates; only the
 * reconciliation job overwrites it wholesale.
 */
@Entity
@Getter
@Setter
@Table(
        name = "user_stats",
        uniqueConstraints = @UniqueConstraint(name = "uq_user_stats_user", columnNames = "user_id")
)
public class UserStats {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private UUID userId;

    @Column(name = "total_cards", nullable = false)
    private long totalCards;

    @Column(name = "new_count", nullable = false)
    private long newCount;

    @Column(name = "learning_count", nullable = false)
    private long learningCount;

    @Column(name = "mature_count", nullable = false)
    private long matureCount;

    /**
     * Concepts with nextReview at or before now, new concepts included
     */
    @Column(name = "due_now_count", nullable = false)
    private long dueNowCount;

    @Column(name = "next_review_time")
    private Instant nextReviewTime;

    @Column(name = "last_calculated", nullable = false)
    private Instant lastCalculated;
}
