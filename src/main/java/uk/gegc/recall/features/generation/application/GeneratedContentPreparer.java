package uk.gegc.recall.features.generation.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.recall.features.concept.domain.model.PhrasingType;
import uk.gegc.recall.features.generation.application.dto.ConceptIdea;
import uk.gegc.recall.features.generation.application.dto.GeneratedPhrasing;
import uk.gegc.recall.features.generation.application.dto.PreparedConcept;
import uk.gegc.recall.features.generation.application.dto.PreparedPhrasing;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Normalises and filters raw model output before anything is persisted.
 */
@Slf4j
@Component
public class GeneratedContentPreparer {

    static final int MIN_QUESTION_LENGTH = 12;
    static final int MAX_QUESTION_LENGTH = 400;
    static final int MIN_EXPLANATION_LENGTH = 12;
    static final int MIN_CHOICE_OPTIONS = 3;
    static final int MAX_CHOICE_OPTIONS = 5;

    static final String FALLBACK_TITLE = "Learner Concept";
    static final String FALLBACK_DESCRIPTION = "User-specified topic.";

    /**
     * Trim ideas, drop those without a title or description and drop case-insensitive duplicate
     * titles. When nothing survives, a single concept is built from the first idea, falling back
     * to the learner prompt.
     */
    public List<PreparedConcept> prepareConceptIdeas(List<ConceptIdea> ideas, String fallbackPrompt) {
        List<PreparedConcept> prepared = new ArrayList<>();
        Set<String> seenTitles = new HashSet<>();
        int skippedEmptyTitle = 0;
        int skippedEmptyDescription = 0;
        int skippedDuplicate = 0;

        for (ConceptIdea idea : ideas) {
            String title = trim(idea.title());
            String description = trim(idea.description());

            if (title.isEmpty()) {
                skippedEmptyTitle++;
                continue;
            }
            if (description.isEmpty()) {
                skippedEmptyDescription++;
                continue;
            }
            if (!seenTitles.add(title.toLowerCase(Locale.ROOT))) {
                skippedDuplicate++;
                continue;
            }
            prepared.add(new PreparedConcept(title, description, idea.contentType(), blankToNull(idea.originIntent())));
        }

        boolean fallbackUsed = false;
        if (prepared.isEmpty() && !ideas.isEmpty()) {
            prepared.add(fallbackConcept(ideas.get(0), fallbackPrompt));
            fallbackUsed = true;
        }

        log.info("Prepared concept ideas: total={}, accepted={}, skippedEmptyTitle={}, skippedEmptyDescription={}, skippedDuplicate={}, fallbackUsed={}",
                ideas.size(), prepared.size(), skippedEmptyTitle, skippedEmptyDescription, skippedDuplicate, fallbackUsed);
        return prepared;
    }

    /**
     * Validate generated phrasings against length, option and answer rules, skipping questions
     * already present on the concept or earlier in the batch. Stops at {@code targetCount}.
     */
    public List<PreparedPhrasing> prepareGeneratedPhrasings(List<GeneratedPhrasing> generated,
                                                            Collection<String> existingQuestions,
                                                            int targetCount) {
        List<PreparedPhrasing> prepared = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String existing : existingQuestions) {
            seen.add(trim(existing).toLowerCase(Locale.ROOT));
        }

        for (GeneratedPhrasing phrasing : generated) {
            if (prepared.size() >= targetCount) {
                break;
            }

            String question = trim(phrasing.question());
            String explanation = trim(phrasing.explanation());
            if (question.length() < MIN_QUESTION_LENGTH || question.length() > MAX_QUESTION_LENGTH) {
                continue;
            }
            if (explanation.length() < MIN_EXPLANATION_LENGTH) {
                continue;
            }

            String questionKey = question.toLowerCase(Locale.ROOT);
            if (seen.contains(questionKey)) {
                continue;
            }

            PhrasingType type = parseType(phrasing.type());
            if (type == null) {
                continue;
            }

            List<String> options = new ArrayList<>();
            if (phrasing.options() != null) {
                for (String option : phrasing.options()) {
                    String trimmed = trim(option);
                    if (!trimmed.isEmpty()) {
                        options.add(trimmed);
                    }
                }
            }
            if (type == PhrasingType.MULTIPLE_CHOICE
                    && (options.size() < MIN_CHOICE_OPTIONS || options.size() > MAX_CHOICE_OPTIONS)) {
                continue;
            }
            if (type == PhrasingType.TRUE_FALSE && options.size() != 2) {
                continue;
            }

            String answerKey = trim(phrasing.correctAnswer()).toLowerCase(Locale.ROOT);
            // First spelling of each option wins
            Map<String, String> uniqueOptions = new LinkedHashMap<>();
            for (String option : options) {
                uniqueOptions.putIfAbsent(option.toLowerCase(Locale.ROOT), option);
            }
            String correctAnswer = uniqueOptions.get(answerKey);
            if (correctAnswer == null) {
                continue;
            }

            prepared.add(new PreparedPhrasing(
                    question, explanation, type, List.copyOf(uniqueOptions.values()), correctAnswer));
            seen.add(questionKey);
        }

        return prepared;
    }

    private PreparedConcept fallbackConcept(ConceptIdea idea, String fallbackPrompt) {
        String prompt = trim(fallbackPrompt);
        String title = firstNonBlank(idea.title(), prompt, FALLBACK_TITLE);
        String description = firstNonBlank(
                idea.description(),
                idea.whyItMatters(),
                prompt.isEmpty() ? FALLBACK_DESCRIPTION : "Deepening understanding of \"" + prompt + "\"."
        );
        return new PreparedConcept(title, description, idea.contentType(), blankToNull(idea.originIntent()));
    }

    private PhrasingType parseType(String value) {
        if (value == null) {
            return null;
        }
        try {
            PhrasingType type = PhrasingType.fromValue(value.trim().toLowerCase(Locale.ROOT));
            return type == PhrasingType.MULTIPLE_CHOICE || type == PhrasingType.TRUE_FALSE ? type : null;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            String trimmed = trim(value);
            if (!trimmed.isEmpty()) {
                return trimmed;
            }
        }
        return "";
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }

    private static String blankToNull(String value) {
        String trimmed = trim(value);
        return trimmed.isEmpty() ? null : trimmed;
    }
}
