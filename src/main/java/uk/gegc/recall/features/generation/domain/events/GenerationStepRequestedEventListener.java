package uk.gegc.recall.features.generation.domain.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.recall.features.generation.application.GenerationPipeline;

/**
 * Runs requested job steps on the generation executor. Steps requested outside a transaction
 * run immediately.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GenerationStepRequestedEventListener {

    private final GenerationPipeline generationPipeline;

    @Async("generationTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handleStepRequest(GenerationStepRequestedEvent event) {
        log.debug("Received GenerationStepRequestedEvent for job {} (concept {})", event.getJobId(), event.getConceptId());
        if (event.isConceptSynthesis()) {
            generationPipeline.runConceptSynthesis(event.getJobId());
        } else {
            generationPipeline.runPhrasingGeneration(event.getJobId(), event.getConceptId());
        }
    }
}
