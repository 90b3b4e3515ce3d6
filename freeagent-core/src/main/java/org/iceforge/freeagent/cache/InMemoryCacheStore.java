package org.iceforge.freeagent.cache;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** {@link CacheStore} backed by a {@link ConcurrentHashMap}; expired entries are purged lazily on read. */
public final class InMemoryCacheStore implements CacheStore {

    private final ConcurrentHashMap<String, CacheEntry> map = new ConcurrentHashMap<>();
    private final Clock clock;
    private final ListKeyRegistry listKeys = new ListKeyRegistry();

    public InMemoryCacheStore() {
        this(Clock.systemUTC());
    }

    public InMemoryCacheStore(Clock clock) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public Optional<CacheEntry> get(String key) {
        if (key == null) return Optional.empty();
        CacheEntry e = map.get(key);
        if (e == null) return Optional.empty();
        if (e.isExpired(clock.instant())) {
            // only drop the entry we looked at; a concurrent overwrite stays
            map.remove(key, e);
            return Optional.empty();
        }
        return Optional.of(e);
    }

    @Override
    public void put(String key, Object value, Duration ttl) {
        if (key == null) throw new IllegalArgumentException("key must not be null");
        map.put(key, new CacheEntry(value, expiryFor(ttl)));
    }

    @Override
    public void remove(String key) {
        if (key == null) return;
        map.remove(key);
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (Map.Entry<String, CacheEntry> e : map.entrySet()) {
            if (e.getValue().isExpired(now) && map.remove(e.getKey(), e.getValue())) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int size() {
        return map.size();
    }

    @Override
    public void clear() {
        map.clear();
    }

    private Instant expiryFor(Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            return Instant.MAX;
        }
        return clock.instant().plus(ttl);
    }

    @Override
    public ListKeyRegistry listKeys() {
        return listKeys;
    }
}
