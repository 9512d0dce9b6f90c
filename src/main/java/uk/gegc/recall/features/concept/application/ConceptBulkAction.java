package uk.gegc.recall.features.concept.application;

public enum ConceptBulkAction {
    ARCHIVE,
    UNARCHIVE,
    DELETE,
    RESTORE
}
