package com.cashcow.store;

import com.cashcow.domain.model.Entity;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entity store held in memory, in insertion order.
 *
 * <p>Backs scenario runs (a filtered, transformed copy of the base set) and tests. When
 * built with an executor, {@link #queryAsync} runs the scan on that executor.
 */
public class InMemoryEntityStore implements EntityStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEntityStore.class);

    private final List<Entity> entities = new CopyOnWriteArrayList<>();
    private final Executor executor;

    public InMemoryEntityStore() {
        this(null);
    }

    public InMemoryEntityStore(Executor executor) {
        this.executor = executor;
    }

    public static InMemoryEntityStore of(Collection<? extends Entity> entities) {
        InMemoryEntityStore store = new InMemoryEntityStore();
        store.addAll(entities);
        return store;
    }

    public void add(Entity entity) {
        entities.add(entity);
    }

    public void addAll(Collection<? extends Entity> toAdd) {
        entities.addAll(toAdd);
        log.debug("Entity store now holds {} entities", entities.size());
    }

    public void clear() {
        entities.clear();
    }

    public int size() {
        return entities.size();
    }

    @Override
    public List<Entity> query(EntityFilter filter) {
        return entities.stream().filter(filter::matches).toList();
    }

    @Override
    public CompletableFuture<List<Entity>> queryAsync(EntityFilter filter) {
        if (executor == null) {
            return EntityStore.super.queryAsync(filter);
        }
        return CompletableFuture.supplyAsync(() -> query(filter), executor);
    }
}
