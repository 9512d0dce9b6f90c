package uk.gegc.recall.features.generation.domain.events;

import org.springframework.context.ApplicationEvent;

import java.util.UUID;

/**
 * Published when a job step is ready to run. Handled after the surrounding transaction commits
 * so that the worker sees the state the step depends on.
 * <p>
 * A null {@code conceptId} requests concept synthesis; otherwise phrasing generation for that concept.
 */
public class GenerationStepRequestedEvent extends ApplicationEvent {

    private final UUID jobId;
    private final UUID conceptId;

    public GenerationStepRequestedEvent(Object source, UUID jobId, UUID conceptId) {
        super(source);
        this.jobId = jobId;
        this.conceptId = conceptId;
    }

    public UUID getJobId() {
        return jobId;
    }

    public UUID getConceptId() {
        return conceptId;
    }

    public boolean isConceptSynthesis() {
        return conceptId == null;
    }
}
