package uk.gegc.recall.features.scheduling.domain.model;

import java.util.Locale;

public enum CardState {
    NEW,
    LEARNING,
    REVIEW,
    RELEARNING;

    /**
     * Lenient parse used when reading external or legacy state: anything unrecognised is NEW.
     */
    public static CardState fromValue(String value) {
        if (value == null || value.isBlank()) {
            return NEW;
        }
        try {
            return CardState.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return NEW;
        }
    }
}
