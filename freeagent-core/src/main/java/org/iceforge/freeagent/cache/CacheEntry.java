package org.iceforge.freeagent.cache;

import java.time.Instant;
import java.util.Objects;

/**
 * A cached value and the instant it stops being served.
 * <p>
 * {@code value} may be {@code null}: a fetch that succeeded with an empty result is still a hit.
 * An entry is expired from {@code expiresAt} on. {@link Instant#MAX} means the entry never expires.
 */
public record CacheEntry(Object value, Instant expiresAt) {

    public CacheEntry {
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
