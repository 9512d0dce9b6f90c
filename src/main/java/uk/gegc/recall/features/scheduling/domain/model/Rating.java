package uk.gegc.recall.features.scheduling.domain.model;

import lombok.Getter;

@Getter
public enum Rating {
    AGAIN(1),
    HARD(2),
    GOOD(3),
    EASY(4);

    private final int value;

    Rating(int value) {
        this.value = value;
    }

    /**
     * Binary answer formats carry no partial-credit signal, so only two ratings are reachable.
     */
    public static Rating fromCorrectness(boolean isCorrect) {
        return isCorrect ? GOOD : AGAIN;
    }
}
