package org.iceforge.freeagent.cache;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class NoOpCacheStoreTest {

    @Test
    void storesNothing() {
        NoOpCacheStore store = new NoOpCacheStore();
        store.put("k", "v", Duration.ofMinutes(5));

        assertTrue(store.get("k").isEmpty());
        assertEquals(0, store.size());
        assertEquals(0, store.purgeExpired());
    }

    @Test
    void resourceCache_onNoOpStore_fetchesEveryTime() {
        ResourceCache cache = new ResourceCache("contacts", new NoOpCacheStore(), Duration.ofMinutes(5));
        AtomicInteger calls = new AtomicInteger();

        cache.getOrFetch(cache.entityKey("1"), calls::incrementAndGet);
        cache.getOrFetch(cache.entityKey("1"), calls::incrementAndGet);

        assertEquals(2, calls.get());
        assertEquals(0, cache.metrics().hits());
        assertEquals(2, cache.metrics().misses());
    }
}
