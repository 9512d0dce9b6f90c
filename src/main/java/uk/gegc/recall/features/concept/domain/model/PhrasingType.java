package uk.gegc.recall.features.concept.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

public enum PhrasingType {
    MULTIPLE_CHOICE("multiple-choice"),
    TRUE_FALSE("true-false"),
    CLOZE("cloze"),
    SHORT_ANSWER("short-answer");

    private final String value;

    PhrasingType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static PhrasingType fromValue(String value) {
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown phrasing type: " + value));
    }
}
