package uk.gegc.recall.features.generation.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import uk.gegc.recall.features.generation.application.JobStepScheduler;
import uk.gegc.recall.features.generation.domain.events.GenerationStepRequestedEvent;

import java.util.Objects;
import java.util.UUID;

@Component
@RequiredArgsConstructor
public class EventJobStepScheduler implements JobStepScheduler {

    private final ApplicationEventPublisher eventPublisher;

    @Override
    public void scheduleConceptSynthesis(UUID jobId) {
        eventPublisher.publishEvent(new GenerationStepRequestedEvent(this, Objects.requireNonNull(jobId), null));
    }

    @Override
    public void schedulePhrasingGeneration(UUID jobId, UUID conceptId) {
        eventPublisher.publishEvent(new GenerationStepRequestedEvent(
                this, Objects.requireNonNull(jobId), Objects.requireNonNull(conceptId)));
    }
}
