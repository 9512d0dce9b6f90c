package uk.gegc.recall.features.stats.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.recall.BaseUnitTest;
import uk.gegc.recall.features.scheduling.domain.model.CardState;
import uk.gegc.recall.features.stats.domain.model.StatsDelta;

import java.time.Instant;
import java.time.temporal.ChronoUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("StatsDeltaCalculator Tests")
class StatsDeltaCalculatorTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2025-02-01T12:00:00Z");
    private static final Instant PAST = NOW.minus(1, ChronoUnit.HOURS);
    private static final Instant FUTURE = NOW.plus(3, ChronoUnit.DAYS);

    private final StatsDeltaCalculator calculator = new StatsDeltaCalculator();

    @Test
    @DisplayName("computeDelta: new to learning moves one card between counters and leaves due set")
    void newToLearning() {
        StatsDelta delta = calculator.computeDelta(CardState.NEW, CardState.LEARNING, PAST, FUTURE, NOW);

        assertThat(delta).isEqualTo(new StatsDelta(0, -1, 1, 0, -1, null));
    }

    @Test
    @DisplayName("computeDelta: review to relearning is a mature to learning crossing")
    void reviewToRelearning() {
        StatsDelta delta = calculator.computeDelta(CardState.REVIEW, CardState.RELEARNING, PAST, PAST.plusSeconds(600), NOW);

        assertThat(delta.matureCount()).isEqualTo(-1);
        assertThat(delta.learningCount()).isEqualTo(1);
        assertThat(delta.dueNowCount()).isEqualTo(-1);
    }

    @Test
    @DisplayName("computeDelta: learning to relearning shares a counter and returns null when nothing else moves")
    void learningToRelearningIsNoop() {
        assertThat(calculator.computeDelta(CardState.LEARNING, CardState.RELEARNING, FUTURE, FUTURE, NOW)).isNull();
    }

    @Test
    @DisplayName("computeDelta: null new state means unchanged; only due-ness is compared")
    void nullNewStateOnlyDue() {
        StatsDelta delta = calculator.computeDelta(CardState.REVIEW, null, FUTURE, PAST, NOW);

        assertThat(delta).isEqualTo(new StatsDelta(0, 0, 0, 0, 1, null));
    }

    @Test
    @DisplayName("computeDelta: a review time equal to now counts as due")
    void dueBoundaryIsInclusive() {
        StatsDelta delta = calculator.computeDelta(CardState.REVIEW, CardState.REVIEW, FUTURE, NOW, NOW);

        assertThat(delta.dueNowCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("computeDelta: review to review with both times already due is no change")
    void reviewStaysDue() {
        StatsDelta delta = calculator.computeDelta(CardState.REVIEW, CardState.REVIEW,
                Instant.ofEpochMilli(500), Instant.ofEpochMilli(800), Instant.ofEpochMilli(1000));

        assertThat(delta).isNull();
    }

    @Test
    @DisplayName("computeDelta: due-ness is skipped when either review time is unknown")
    void missingReviewTimeSkipsDue() {
        assertThat(calculator.computeDelta(CardState.REVIEW, CardState.REVIEW, null, FUTURE, NOW)).isNull();
        assertThat(calculator.computeDelta(CardState.REVIEW, CardState.REVIEW, PAST, null, NOW)).isNull();
    }

    @Test
    @DisplayName("lifecycleDelta: entering the active set counts the card and offers a future review time")
    void lifecycleEnter() {
        StatsDelta delta = calculator.lifecycleDelta(CardState.REVIEW, FUTURE, NOW, 1);

        assertThat(delta).isEqualTo(new StatsDelta(1, 0, 0, 1, 0, FUTURE));
    }

    @Test
    @DisplayName("lifecycleDelta: leaving the active set removes a due new card from every counter it sat in")
    void lifecycleLeave() {
        StatsDelta delta = calculator.lifecycleDelta(CardState.NEW, PAST, NOW, -1);

        assertThat(delta).isEqualTo(new StatsDelta(-1, -1, 0, 0, -1, null));
    }

    @Test
    @DisplayName("lifecycleDelta: missing state and review time count as new and due")
    void lifecycleDefaults() {
        StatsDelta delta = calculator.lifecycleDelta(null, null, NOW, 1);

        assertThat(delta).isEqualTo(new StatsDelta(1, 1, 0, 0, 1, null));
    }

    @Test
    @DisplayName("lifecycleDelta: sign other than +1 or -1 is rejected")
    void lifecycleRejectsBadSign() {
        assertThatThrownBy(() -> calculator.lifecycleDelta(CardState.NEW, NOW, NOW, 2))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("StatsDelta.plus keeps the earliest review candidate")
    void plusKeepsEarliestCandidate() {
        StatsDelta a = calculator.lifecycleDelta(CardState.REVIEW, FUTURE, NOW, 1);
        StatsDelta b = calculator.lifecycleDelta(CardState.REVIEW, FUTURE.minus(1, ChronoUnit.DAYS), NOW, 1);

        StatsDelta sum = a.plus(b);

        assertThat(sum.totalCards()).isEqualTo(2);
        assertThat(sum.matureCount()).isEqualTo(2);
        assertThat(sum.nextReviewCandidate()).isEqualTo(FUTURE.minus(1, ChronoUnit.DAYS));
    }
}
