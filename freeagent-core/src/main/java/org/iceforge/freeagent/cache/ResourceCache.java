package org.iceforge.freeagent.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Cache-aside accessor for one resource type (contacts, invoices, timeslips...).
 *
 * <p>Reads go through {@link #getOrFetch}: a fresh entry is returned without calling the fetch, otherwise the
 * fetch runs, its result is stored and returned. A failed fetch stores nothing.
 *
 * <p>Writes go through {@link #mutateAndInvalidate} or the {@code after*} helpers: the mutation runs first and
 * only when it succeeds are the affected keys removed. Every list key handed out by {@link #listKey} is
 * remembered in the store's {@link ListKeyRegistry}, so a mutation invalidates every list of the resource that
 * may have been populated, including lists read through another accessor on the same store.
 *
 * <p>Fetches and mutations run outside any lock. Two concurrent misses on the same key may both fetch; the
 * later {@code put} wins. A read that started before a mutation committed may repopulate a key the mutation
 * just removed. Both are accepted: the data is not safety critical and the ttl bounds the staleness.
 */
public class ResourceCache {
    private static final Logger logger = LoggerFactory.getLogger(ResourceCache.class);

    private final String resource;
    private final CacheStore store;
    private final Duration defaultTtl;
    private final CacheMetricsRegistry metrics;
    private final ListKeyRegistry listKeys;

    public ResourceCache(String resource, CacheStore store, Duration defaultTtl) {
        this(resource, store, defaultTtl, new CacheMetricsRegistry());
    }

    public ResourceCache(String resource, CacheStore store, Duration defaultTtl, CacheMetricsRegistry metrics) {
        this(resource, store, defaultTtl, metrics, Objects.requireNonNull(store, "store").listKeys());
    }

    public ResourceCache(String resource, CacheStore store, Duration defaultTtl, CacheMetricsRegistry metrics,
                         ListKeyRegistry listKeys) {
        CacheKeys.prefix(resource);
        this.resource = resource;
        this.store = Objects.requireNonNull(store, "store");
        this.defaultTtl = Objects.requireNonNull(defaultTtl, "defaultTtl");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.listKeys = Objects.requireNonNull(listKeys, "listKeys");
    }

    public String resource() {
        return resource;
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    public CacheMetrics metrics() {
        return metrics;
    }

    // ----------------------------------------------------------------------
    // Keys
    // ----------------------------------------------------------------------

    public String entityKey(String id) {
        return CacheKeys.entity(resource, id);
    }

    /** Computes the list key for {@code filter} and registers it for invalidation. */
    public String listKey(ListFilter filter) {
        String key = CacheKeys.list(resource, filter);
        listKeys.register(resource, key);
        return key;
    }

    public Set<String> listKeys() {
        return listKeys.keys(resource);
    }

    /**
     * Keys that may be stale after a mutation of entity {@code id}: its entity key and every registered list key.
     * Pass {@code null} for a create, which has no entity key yet.
     */
    public Set<String> invalidationKeys(String id) {
        Set<String> keys = new LinkedHashSet<>();
        if (id != null) {
            keys.add(entityKey(id));
        }
        keys.addAll(listKeys());
        return keys;
    }

    // ----------------------------------------------------------------------
    // Read path
    // ----------------------------------------------------------------------

    public <T> T getOrFetch(String key, Supplier<T> fetch) {
        return getOrFetch(key, defaultTtl, fetch);
    }

    @SuppressWarnings("unchecked")
    public <T> T getOrFetch(String key, Duration ttl, Supplier<T> fetch) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(fetch, "fetch");

        Optional<CacheEntry> cached = store.get(key);
        if (cached.isPresent()) {
            metrics.recordHit();
            logger.debug("Cache hit for {}", key);
            return (T) cached.get().value();
        }

        metrics.recordMiss();
        logger.debug("Cache miss for {}, fetching", key);

        T value;
        try {
            value = fetch.get();
        } catch (RuntimeException e) {
            metrics.recordFetchFailure();
            logger.debug("Fetch failed for {}, nothing cached: {}", key, e.toString());
            throw e;
        }

        store.put(key, value, ttl);
        return value;
    }

    // ----------------------------------------------------------------------
    // Write path
    // ----------------------------------------------------------------------

    /** Runs {@code mutation}; on success removes every key in {@code invalidationKeys}, on failure removes nothing. */
    public <T> T mutateAndInvalidate(Supplier<T> mutation, Collection<String> invalidationKeys) {
        Objects.requireNonNull(invalidationKeys, "invalidationKeys");
        List<String> keys = List.copyOf(invalidationKeys);
        return mutateThenInvalidate(mutation, () -> keys);
    }

    public void executeAndInvalidate(Runnable mutation, Collection<String> invalidationKeys) {
        Objects.requireNonNull(mutation, "mutation");
        mutateAndInvalidate(() -> {
            mutation.run();
            return null;
        }, invalidationKeys);
    }

    /** Create: every list of the resource may now miss the new member. */
    public <T> T afterCreate(Supplier<T> mutation) {
        return mutateThenInvalidate(mutation, () -> invalidationKeys(null));
    }

    public <T> T afterUpdate(String id, Supplier<T> mutation) {
        entityKey(id);
        return mutateThenInvalidate(mutation, () -> invalidationKeys(id));
    }

    public void afterDelete(String id, Runnable mutation) {
        Objects.requireNonNull(mutation, "mutation");
        entityKey(id);
        mutateThenInvalidate(() -> {
            mutation.run();
            return null;
        }, () -> invalidationKeys(id));
    }

    /** Drops every registered list key, e.g. after a change made through another resource. */
    public void invalidateLists() {
        invalidate(listKeys());
    }

    public void invalidate(Collection<String> keys) {
        int n = 0;
        for (String key : keys) {
            store.remove(key);
            n++;
        }
        metrics.recordInvalidations(n);
        if (n > 0) {
            logger.debug("Invalidated {} key(s) of {}: {}", n, resource, keys);
        }
    }

    // keys are resolved after the mutation so lists registered while it ran are included
    private <T> T mutateThenInvalidate(Supplier<T> mutation, Supplier<? extends Collection<String>> keys) {
        Objects.requireNonNull(mutation, "mutation");
        T result = mutation.get();
        invalidate(keys.get());
        return result;
    }

    @Override
    public String toString() {
        return "ResourceCache{" + resource + ", ttl=" + defaultTtl + ", lists=" + listKeys().size() + "}";
    }
}
