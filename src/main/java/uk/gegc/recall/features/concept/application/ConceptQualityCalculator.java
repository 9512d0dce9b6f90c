package uk.gegc.recall.features.concept.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.recall.features.concept.domain.model.Concept;
import uk.gegc.recall.shared.config.GenerationJobProperties;

import java.util.Collection;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Library health signals derived from a concept's active phrasings.
 */
@Component
@RequiredArgsConstructor
public class ConceptQualityCalculator {

    private final GenerationJobProperties generationJobProperties;

    /**
     * Number of questions that repeat another one after trimming and lower-casing, or null when there are none.
     */
    public Integer conflictScore(Collection<String> questions) {
        if (questions == null || questions.size() < 2) {
            return null;
        }
        Set<String> unique = new HashSet<>();
        int total = 0;
        for (String question : questions) {
            if (question == null) {
                continue;
            }
            unique.add(question.trim().toLowerCase(Locale.ROOT));
            total++;
        }
        int conflicts = total - unique.size();
        return conflicts > 0 ? conflicts : null;
    }

    /**
     * How many phrasings are missing to reach the target, or null once the target is met.
     */
    public Integer thinScore(int activePhrasingCount) {
        int target = generationJobProperties.getTargetPhrasingsPerConcept();
        int missing = Math.max(0, target - Math.min(Math.max(0, activePhrasingCount), target));
        return missing > 0 ? missing : null;
    }

    public void applyScores(Concept concept, int activePhrasingCount, Collection<String> activeQuestions) {
        concept.setPhrasingCount(activePhrasingCount);
        concept.setThinScore(thinScore(activePhrasingCount));
        concept.setConflictScore(conflictScore(activeQuestions));
    }
}
