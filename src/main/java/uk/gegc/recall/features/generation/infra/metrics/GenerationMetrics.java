package uk.gegc.recall.features.generation.infra.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import uk.gegc.recall.features.generation.domain.model.GenerationErrorCode;

import java.util.Locale;

/**
 * Job outcome counters. Recording is a no-op when no registry is configured.
 */
@Component
public class GenerationMetrics {

    private final MeterRegistry meterRegistry;

    @Autowired
    public GenerationMetrics(ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this(meterRegistryProvider.getIfAvailable());
    }

    public GenerationMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void jobCreated(String kind) {
        if (meterRegistry != null) {
            meterRegistry.counter("generation.jobs.created", "kind", kind).increment();
        }
    }

    public void jobCompleted() {
        if (meterRegistry != null) {
            meterRegistry.counter("generation.jobs.completed").increment();
        }
    }

    public void jobFailed(String stage, GenerationErrorCode code) {
        if (meterRegistry != null) {
            String codeTag = code == null ? "unknown" : code.name().toLowerCase(Locale.ENGLISH);
            meterRegistry.counter("generation.jobs.failed", "stage", stage, "code", codeTag).increment();
        }
    }

    public void jobCancelled() {
        if (meterRegistry != null) {
            meterRegistry.counter("generation.jobs.cancelled").increment();
        }
    }

    public void conceptsCreated(int count) {
        if (meterRegistry != null && count > 0) {
            meterRegistry.counter("generation.concepts.created").increment(count);
        }
    }

    public void phrasingsSaved(int count) {
        if (meterRegistry != null && count > 0) {
            meterRegistry.counter("generation.phrasings.saved").increment(count);
        }
    }
}
