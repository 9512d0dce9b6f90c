package uk.gegc.recall.features.concept.domain.model;

public enum ContentType {
    VERBATIM,
    ENUMERABLE,
    CONCEPTUAL,
    MIXED
}
