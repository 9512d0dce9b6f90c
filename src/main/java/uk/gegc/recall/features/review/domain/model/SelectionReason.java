package uk.gegc.recall.features.review.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SelectionReason {
    CANONICAL("canonical"),
    LEAST_SEEN("least-seen");

    private final String value;

    SelectionReason(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
