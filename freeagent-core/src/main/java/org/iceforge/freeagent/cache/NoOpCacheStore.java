package org.iceforge.freeagent.cache;

import java.time.Duration;
import java.util.Optional;

/** Stores nothing. Every read through a {@link ResourceCache} on top of it goes to the network. */
public final class NoOpCacheStore implements CacheStore {

    private final ListKeyRegistry listKeys = new ListKeyRegistry();

    @Override
    public Optional<CacheEntry> get(String key) {
        return Optional.empty();
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
    }

    @Override
    public void remove(String key) {
    }

    @Override
    public int purgeExpired() {
        return 0;
    }

    @Override
    public int size() {
        return 0;
    }

    @Override
    public void clear() {
    }

    @Override
    public ListKeyRegistry listKeys() {
        return listKeys;
    }
}
