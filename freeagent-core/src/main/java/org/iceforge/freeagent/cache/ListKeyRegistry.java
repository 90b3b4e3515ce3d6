package org.iceforge.freeagent.cache;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * List keys populated per resource, shared by every {@link ResourceCache} that works on the same {@link CacheStore}.
 * <p>
 * Registrations are never dropped: the number of distinct filters a client uses is small.
 */
public final class ListKeyRegistry {

    private final ConcurrentHashMap<String, Set<String>> byResource = new ConcurrentHashMap<>();

    public void register(String resource, String key) {
        byResource.computeIfAbsent(resource, r -> ConcurrentHashMap.newKeySet()).add(key);
    }

    /** Snapshot of the keys registered for {@code resource}; empty when none. */
    public Set<String> keys(String resource) {
        Set<String> keys = byResource.get(resource);
        return keys == null ? Set.of() : Set.copyOf(keys);
    }

    public int size() {
        return byResource.values().stream().mapToInt(Set::size).sum();
    }
}
