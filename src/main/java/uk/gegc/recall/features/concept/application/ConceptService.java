package uk.gegc.recall.features.concept.application;

import org.springframework.data.domain.Page;
import uk.gegc.recall.features.concept.api.dto.BulkActionResultDto;
import uk.gegc.recall.features.concept.api.dto.ConceptDetailDto;
import uk.gegc.recall.features.concept.api.dto.ConceptDto;
import uk.gegc.recall.features.concept.api.dto.PhrasingDto;
import uk.gegc.recall.features.concept.api.dto.UpdateConceptRequest;
import uk.gegc.recall.features.concept.api.dto.UpdatePhrasingRequest;
import uk.gegc.recall.features.generation.api.dto.GenerationJobDto;

import java.util.List;
import java.util.UUID;

/**
 * Library management for concepts and their phrasings. Every method checks ownership and
 * throws {@link uk.gegc.recall.shared.exception.ResourceNotFoundException} for missing or
 * foreign records. Lifecycle changes keep the cached user stats in step within the same transaction.
 */
public interface ConceptService {

    /**
     * @return false when the concept is already archived or is deleted
     */
    boolean archiveConcept(UUID userId, UUID conceptId);

    /**
     * @return false when the concept is not archived or is deleted
     */
    boolean unarchiveConcept(UUID userId, UUID conceptId);

    /**
     * @return false when the concept is already deleted
     */
    boolean softDeleteConcept(UUID userId, UUID conceptId);

    /**
     * @return false when the concept is not deleted
     */
    boolean restoreConcept(UUID userId, UUID conceptId);

    BulkActionResultDto runBulkAction(UUID userId, ConceptBulkAction action, List<UUID> conceptIds);

    ConceptDto updateConcept(UUID userId, UUID conceptId, UpdateConceptRequest request);

    /**
     * Pin a phrasing as canonical, or clear the pin when {@code phrasingId} is null.
     */
    ConceptDto setCanonicalPhrasing(UUID userId, UUID conceptId, UUID phrasingId);

    PhrasingDto updatePhrasing(UUID userId, UUID phrasingId, UpdatePhrasingRequest request);

    PhrasingDto archivePhrasing(UUID userId, UUID phrasingId);

    PhrasingDto unarchivePhrasing(UUID userId, UUID phrasingId);

    Page<ConceptDto> listForLibrary(UUID userId, ConceptLibraryView view, int page, int size);

    ConceptDetailDto getConcept(UUID userId, UUID conceptId);

    GenerationJobDto requestPhrasingGeneration(UUID userId, UUID conceptId);
}
