package com.cashcow.store;

import com.cashcow.domain.model.Entity;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Read-only source of entities for the forecast engine.
 *
 * <p>Implementations return entities in a stable order; the engine sums in that order, and
 * a stable order is what keeps floating-point totals identical between runs.
 */
public interface EntityStore {

    List<Entity> query(EntityFilter filter);

    /**
     * Asynchronous variant used by the async forecast path. Stores backed by real I/O
     * override this; the default completes immediately on the calling thread.
     */
    default CompletableFuture<List<Entity>> queryAsync(EntityFilter filter) {
        return CompletableFuture.completedFuture(query(filter));
    }

    default List<Entity> findAll() {
        return query(EntityFilter.all());
    }
}
