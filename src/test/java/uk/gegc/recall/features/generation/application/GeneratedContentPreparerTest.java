package uk.gegc.recall.features.generation.application;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.gegc.recall.BaseUnitTest;
import uk.gegc.recall.features.concept.domain.model.ContentType;
import uk.gegc.recall.features.concept.domain.model.PhrasingType;
import uk.gegc.recall.features.generation.application.dto.ConceptIdea;
import uk.gegc.recall.features.generation.application.dto.GeneratedPhrasing;
import uk.gegc.recall.features.generation.application.dto.PreparedConcept;
import uk.gegc.recall.features.generation.application.dto.PreparedPhrasing;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("GeneratedContentPreparer Tests")
class GeneratedContentPreparerTest extends BaseUnitTest {

    private final GeneratedContentPreparer preparer = new GeneratedContentPreparer();

    @Nested
    @DisplayName("prepareConceptIdeas")
    class ConceptIdeas {

        @Test
        @DisplayName("trims, drops blank titles or descriptions and case-insensitive duplicates")
        void filtersIdeas() {
            List<ConceptIdea> ideas = List.of(
                    new ConceptIdea("  Photosynthesis ", " Light to sugar ", null, ContentType.CONCEPTUAL, " intent "),
                    new ConceptIdea("   ", "No title", null, null, null),
                    new ConceptIdea("Chlorophyll", "  ", null, null, null),
                    new ConceptIdea("PHOTOSYNTHESIS", "Duplicate", null, null, null),
                    new ConceptIdea("Calvin cycle", "Carbon fixation", null, ContentType.ENUMERABLE, "")
            );

            List<PreparedConcept> prepared = preparer.prepareConceptIdeas(ideas, "plants");

            assertThat(prepared).containsExactly(
                    new PreparedConcept("Photosynthesis", "Light to sugar", ContentType.CONCEPTUAL, "intent"),
                    new PreparedConcept("Calvin cycle", "Carbon fixation", ContentType.ENUMERABLE, null));
        }

        @Test
        @DisplayName("falls back to one concept built from the prompt when nothing survives")
        void fallbackFromPrompt() {
            List<ConceptIdea> ideas = List.of(new ConceptIdea(" ", null, null, ContentType.MIXED, null));

            List<PreparedConcept> prepared = preparer.prepareConceptIdeas(ideas, "  Roman roads ");

            assertThat(prepared).containsExactly(new PreparedConcept(
                    "Roman roads", "Deepening understanding of \"Roman roads\".", ContentType.MIXED, null));
        }

        @Test
        @DisplayName("fallback prefers whyItMatters when the description is missing")
        void fallbackUsesWhyItMatters() {
            List<ConceptIdea> ideas = List.of(new ConceptIdea("Aqueducts", "", "Water supply", null, null));

            List<PreparedConcept> prepared = preparer.prepareConceptIdeas(ideas, "");

            assertThat(prepared).extracting(PreparedConcept::title, PreparedConcept::description)
                    .containsExactly(tuple("Aqueducts", "Water supply"));
        }

        @Test
        @DisplayName("no ideas yields nothing")
        void emptyInput() {
            assertThat(preparer.prepareConceptIdeas(List.of(), "anything")).isEmpty();
        }
    }

    @Nested
    @DisplayName("prepareGeneratedPhrasings")
    class Phrasings {

        @Test
        @DisplayName("keeps valid multiple choice and true/false phrasings with canonical option spelling")
        void keepsValid() {
            List<GeneratedPhrasing> generated = List.of(
                    new GeneratedPhrasing(" Which gas do plants absorb? ", "Plants take in CO2.", "multiple-choice",
                            List.of("Oxygen", "Carbon dioxide", "carbon DIOXIDE", "Nitrogen"), " carbon dioxide"),
                    new GeneratedPhrasing("Chlorophyll is green. True?", "It reflects green light.", "TRUE_FALSE",
                            List.of("True", "False"), "True"));

            List<PreparedPhrasing> prepared = preparer.prepareGeneratedPhrasings(generated, List.of(), 5);

            assertThat(prepared).hasSize(2);
            assertThat(prepared.get(0).question()).isEqualTo("Which gas do plants absorb?");
            assertThat(prepared.get(0).options()).containsExactly("Oxygen", "Carbon dioxide", "Nitrogen");
            assertThat(prepared.get(0).correctAnswer()).isEqualTo("Carbon dioxide");
            assertThat(prepared.get(1).type()).isEqualTo(PhrasingType.TRUE_FALSE);
        }

        @Test
        @DisplayName("rejects short text, unsupported types, bad option counts and unknown answers")
        void rejectsInvalid() {
            List<GeneratedPhrasing> generated = List.of(
                    new GeneratedPhrasing("Too short", "Long enough explanation", "multiple-choice",
                            List.of("a", "b", "c"), "a"),
                    new GeneratedPhrasing("Question long enough?", "short", "multiple-choice",
                            List.of("a", "b", "c"), "a"),
                    new GeneratedPhrasing("Question long enough?", "Long enough explanation", "cloze",
                            List.of("a", "b", "c"), "a"),
                    new GeneratedPhrasing("Question long enough?", "Long enough explanation", "essay",
                            List.of("a", "b", "c"), "a"),
                    new GeneratedPhrasing("Question long enough?", "Long enough explanation", "multiple-choice",
                            List.of("a", "b"), "a"),
                    new GeneratedPhrasing("Question long enough?", "Long enough explanation", "true-false",
                            List.of("True", "False", "Maybe"), "True"),
                    new GeneratedPhrasing("Question long enough?", "Long enough explanation", "multiple-choice",
                            List.of("a", "b", "c"), "d"),
                    new GeneratedPhrasing("Question long enough?", "Long enough explanation", null,
                            List.of("a", "b", "c"), "a"));

            assertThat(preparer.prepareGeneratedPhrasings(generated, List.of(), 10)).isEmpty();
        }

        @Test
        @DisplayName("skips questions that already exist or repeat within the batch")
        void skipsDuplicates() {
            List<GeneratedPhrasing> generated = List.of(
                    mc("What does ATP store?"),
                    mc("What is the Krebs cycle?"),
                    mc("what is the krebs cycle?"));

            List<PreparedPhrasing> prepared = preparer.prepareGeneratedPhrasings(
                    generated, List.of("  WHAT DOES ATP STORE? "), 10);

            assertThat(prepared).extracting(PreparedPhrasing::question).containsExactly("What is the Krebs cycle?");
        }

        @Test
        @DisplayName("stops at the target count")
        void stopsAtTarget() {
            List<GeneratedPhrasing> generated = List.of(
                    mc("First question here?"), mc("Second question here?"), mc("Third question here?"));

            assertThat(preparer.prepareGeneratedPhrasings(generated, List.of(), 2)).hasSize(2);
        }

        private GeneratedPhrasing mc(String question) {
            return new GeneratedPhrasing(question, "Explanation long enough", "multiple-choice",
                    List.of("One", "Two", "Three"), "Two");
        }
    }
}
