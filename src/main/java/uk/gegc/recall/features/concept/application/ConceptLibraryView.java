package uk.gegc.recall.features.concept.application;

/**
 * Library filters. Every view except ARCHIVED and DELETED shows active concepts only.
 */
public enum ConceptLibraryView {
    ALL,
    DUE,
    THIN,
    TENSION,
    ARCHIVED,
    DELETED
}
