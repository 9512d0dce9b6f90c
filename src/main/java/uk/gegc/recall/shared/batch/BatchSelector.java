package uk.gegc.recall.shared.batch;

import java.util.List;

/**
 * Reads the next page of records that still need patching.
 *
 * <p>Implementations must filter on the field the patch changes, so a record that has been
 * patched is never returned again. The mutator relies on this instead of an offset or cursor.
 */
@FunctionalInterface
public interface BatchSelector<T> {

    List<T> nextBatch(int limit);
}
