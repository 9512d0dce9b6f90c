package uk.gegc.recall.features.scheduling.domain.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * Per-concept memory state. The single source of truth for scheduling.
 */
@Embeddable
@Getter
@Setter
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FsrsMemoryState {

    @Column(name = "fsrs_stability", nullable = false)
    private double stability;

    @Column(name = "fsrs_difficulty", nullable = false)
    private double difficulty;

    @Column(name = "fsrs_last_review")
    private Instant lastReview;

    @Column(name = "fsrs_next_review", nullable = false)
    private Instant nextReview;

    @Column(name = "fsrs_elapsed_days", nullable = false)
    private int elapsedDays;

    /**
     * Optional cached snapshot; when null the queue computes retrievability at read time.
     */
    @Column(name = "fsrs_retrievability")
    private Double retrievability;

    @Column(name = "fsrs_scheduled_days", nullable = false)
    private int scheduledDays;

    @Column(name = "fsrs_reps", nullable = false)
    private int reps;

    @Column(name = "fsrs_lapses", nullable = false)
    private int lapses;

    @Enumerated(EnumType.STRING)
    @Column(name = "fsrs_state", nullable = false, length = 16)
    private CardState state;

    public CardState stateOrNew() {
        return state == null ? CardState.NEW : state;
    }
}
