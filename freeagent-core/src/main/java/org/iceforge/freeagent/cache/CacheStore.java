package org.iceforge.freeagent.cache;

import java.time.Duration;
import java.util.Optional;

/**
 * Process-wide key/value container with per-entry expiry.
 * <p>
 * Knows nothing about HTTP or domain types. Implementations must be safe for concurrent
 * {@code get}/{@code put}/{@code remove} from many threads and must never block on I/O.
 */
public interface CacheStore extends AutoCloseable {

    /**
     * @return the entry for {@code key}, or empty when absent or expired. An expired entry is never a hit.
     */
    Optional<CacheEntry> get(String key);

    /**
     * Stores {@code value} under {@code key}, replacing any existing entry.
     * A {@code null}, zero or negative ttl stores an entry that never expires.
     */
    void put(String key, Object value, Duration ttl);

    /** No-op when the key is absent. */
    void remove(String key);

    /**
     * Drops every expired entry.
     *
     * @return how many entries were removed
     */
    int purgeExpired();

    /** Number of physically stored entries, expired ones included. */
    int size();

    void clear();

    /** List keys populated through this store, per resource. The same instance for the store's whole life. */
    ListKeyRegistry listKeys();

    @Override
    default void close() {
        // no-op
    }
}
