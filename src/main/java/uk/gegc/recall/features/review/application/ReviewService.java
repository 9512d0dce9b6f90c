package uk.gegc.recall.features.review.application;

import uk.gegc.recall.features.review.api.dto.InteractionResultDto;
import uk.gegc.recall.features.review.api.dto.NextReviewDto;
import uk.gegc.recall.features.review.api.dto.RecordInteractionRequest;

import java.util.Optional;
import java.util.UUID;

public interface ReviewService {

    /**
     * The most urgent due concept with the phrasing to show, falling back to new concepts when
     * nothing is due. Never returns a concept scheduled in the future.
     */
    Optional<NextReviewDto> getNextReview(UUID userId);

    /**
     * Record an answer, reschedule the concept and update cached stats. Retries on concurrent
     * modification of the concept.
     */
    InteractionResultDto recordInteraction(UUID userId, RecordInteractionRequest request);

    InteractionResultDto recordInteractionTx(UUID userId, RecordInteractionRequest request);
}
