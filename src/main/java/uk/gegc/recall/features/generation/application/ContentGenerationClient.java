package uk.gegc.recall.features.generation.application;

import uk.gegc.recall.features.generation.application.dto.ConceptIdea;
import uk.gegc.recall.features.generation.application.dto.GeneratedPhrasing;
import uk.gegc.recall.features.generation.application.dto.PhrasingGenerationRequest;

import java.util.List;

/**
 * Boundary to the language model. Implementations retry rate-limited calls, enforce a
 * wall-clock timeout and throw on malformed output; they never persist anything.
 */
public interface ContentGenerationClient {

    /**
     * Stage A: propose atomic concepts for a learner prompt.
     */
    List<ConceptIdea> synthesizeConcepts(String prompt);

    /**
     * Stage B: propose phrasings for one concept, avoiding the given existing questions.
     */
    List<GeneratedPhrasing> generatePhrasings(PhrasingGenerationRequest request);
}
