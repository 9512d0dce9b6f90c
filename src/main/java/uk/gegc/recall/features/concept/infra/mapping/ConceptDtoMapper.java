package uk.gegc.recall.features.concept.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.recall.features.concept.api.dto.ConceptDto;
import uk.gegc.recall.features.concept.api.dto.PhrasingDto;
import uk.gegc.recall.features.concept.domain.model.Concept;
import uk.gegc.recall.features.concept.domain.model.Phrasing;
import uk.gegc.recall.features.review.api.dto.InteractionDto;
import uk.gegc.recall.features.review.domain.model.Interaction;
import uk.gegc.recall.features.scheduling.domain.model.CardState;
import uk.gegc.recall.features.scheduling.domain.model.FsrsMemoryState;

import java.util.List;

@Component
public class ConceptDtoMapper {

    public ConceptDto toConceptDto(Concept concept) {
        FsrsMemoryState fsrs = concept.getFsrs() == null ? new FsrsMemoryState() : concept.getFsrs();
        return new ConceptDto(
                concept.getId(),
                concept.getTitle(),
                concept.getDescription(),
                concept.getContentType(),
                fsrs.getState() == null ? CardState.NEW : fsrs.getState(),
                fsrs.getNextReview(),
                fsrs.getLastReview(),
                fsrs.getScheduledDays(),
                fsrs.getReps(),
                fsrs.getLapses(),
                fsrs.getStability(),
                fsrs.getDifficulty(),
                concept.getPhrasingCount(),
                concept.getConflictScore(),
                concept.getThinScore(),
                concept.getCanonicalPhrasingId(),
                concept.getGenerationJobId(),
                concept.getCreatedAt(),
                concept.getUpdatedAt(),
                concept.getArchivedAt(),
                concept.getDeletedAt()
        );
    }

    public PhrasingDto toPhrasingDto(Phrasing phrasing) {
        return new PhrasingDto(
                phrasing.getId(),
                phrasing.getConceptId(),
                phrasing.getQuestion(),
                phrasing.getExplanation(),
                phrasing.getType(),
                List.copyOf(phrasing.getOptions()),
                phrasing.getCorrectAnswer(),
                phrasing.getAttemptCount(),
                phrasing.getCorrectCount(),
                phrasing.getLastAttemptedAt(),
                phrasing.getCreatedAt(),
                phrasing.getArchivedAt()
        );
    }

    public InteractionDto toInteractionDto(Interaction interaction) {
        return new InteractionDto(
                interaction.getId(),
                interaction.getConceptId(),
                interaction.getPhrasingId(),
                interaction.getUserAnswer(),
                interaction.isCorrect(),
                interaction.getAttemptedAt(),
                interaction.getTimeSpentMs(),
                interaction.getScheduledDays(),
                interaction.getNextReview(),
                interaction.getFsrsState()
        );
    }
}
