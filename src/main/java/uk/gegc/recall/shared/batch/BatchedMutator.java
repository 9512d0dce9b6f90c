package uk.gegc.recall.shared.batch;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Consumer;

/**
 * Applies a patch across an unbounded set of records in bounded batches.
 *
 * <p>Each round reads at most {@code maxPerBatch} records through the selector and patches them.
 * The loop stops on the first empty read. Reaching {@code maxIterations} first is not an error:
 * the partial count is returned, and a single warning is logged when the last read was still
 * full, since more records may remain.
 */
@Slf4j
@Component
public class BatchedMutator {

    public static final int DEFAULT_MAX_PER_BATCH = 50;
    public static final int DEFAULT_MAX_ITERATIONS = 100;

    public <T> int applyBatched(BatchSelector<T> selector, Consumer<T> patch) {
        return applyBatched(selector, patch, DEFAULT_MAX_PER_BATCH, DEFAULT_MAX_ITERATIONS);
    }

    public <T> int applyBatched(BatchSelector<T> selector, Consumer<T> patch, int maxPerBatch, int maxIterations) {
        if (maxPerBatch <= 0) {
            throw new IllegalArgumentException("maxPerBatch must be positive");
        }
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive");
        }

        int processed = 0;
        boolean lastBatchFull = false;
        for (int iteration = 0; iteration < maxIterations; iteration++) {
            List<T> batch = selector.nextBatch(maxPerBatch);
            if (batch == null || batch.isEmpty()) {
                return processed;
            }
            for (T record : batch) {
                patch.accept(record);
            }
            processed += batch.size();
            lastBatchFull = batch.size() >= maxPerBatch;
        }

        if (lastBatchFull) {
            log.warn("Batched mutation stopped at iteration ceiling: maxIterations={}, maxPerBatch={}, processed={}",
                    maxIterations, maxPerBatch, processed);
        }
        return processed;
    }
}
