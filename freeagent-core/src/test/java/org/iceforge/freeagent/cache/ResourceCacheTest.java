package org.iceforge.freeagent.cache;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;

class ResourceCacheTest {

    private static final Duration TTL = Duration.ofMinutes(5);

    private MutableClock clock;
    private InMemoryCacheStore store;
    private CacheMetricsRegistry metrics;
    private ResourceCache txns;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-06-01T09:00:00Z"));
        store = new InMemoryCacheStore(clock);
        metrics = new CacheMetricsRegistry();
        txns = new ResourceCache("txn", store, TTL, metrics);
    }

    private static <T> Supplier<T> counting(AtomicInteger calls, T value) {
        return () -> {
            calls.incrementAndGet();
            return value;
        };
    }

    // ----------------------------------------------------------------------
    // Read path
    // ----------------------------------------------------------------------

    @Test
    void getOrFetch_secondCallIsHit_fetchRunsOnce() {
        AtomicInteger calls = new AtomicInteger();

        String first = txns.getOrFetch("txn_123", TTL, counting(calls, "V1"));
        String second = txns.getOrFetch("txn_123", TTL, counting(calls, "V2"));

        assertEquals("V1", first);
        assertEquals("V1", second);
        assertEquals(1, calls.get());
        assertEquals(1, metrics.hits());
        assertEquals(1, metrics.misses());
    }

    @Test
    void getOrFetch_afterTtlElapses_fetchesAgain() {
        AtomicInteger calls = new AtomicInteger();

        assertEquals("V1", txns.getOrFetch("txn_123", TTL, counting(calls, "V1")));
        assertEquals("V1", txns.getOrFetch("txn_123", TTL, counting(calls, "V1")));
        assertEquals(1, calls.get());

        clock.advance(TTL);

        assertEquals("V1", txns.getOrFetch("txn_123", TTL, counting(calls, "V1")));
        assertEquals(2, calls.get());
        assertEquals(2, metrics.misses());
    }

    @Test
    void getOrFetch_usesDefaultTtlWhenNoneGiven() {
        AtomicInteger calls = new AtomicInteger();
        txns.getOrFetch("txn_1", counting(calls, 1));

        clock.advance(TTL.minusSeconds(1));
        txns.getOrFetch("txn_1", counting(calls, 1));
        assertEquals(1, calls.get());

        clock.advance(Duration.ofSeconds(2));
        txns.getOrFetch("txn_1", counting(calls, 1));
        assertEquals(2, calls.get());
    }

    @Test
    void getOrFetch_failedFetchIsPropagatedUnchangedAndNotCached() {
        IllegalStateException boom = new IllegalStateException("503 from upstream");
        AtomicInteger calls = new AtomicInteger();

        RuntimeException thrown = assertThrows(RuntimeException.class, () -> txns.getOrFetch("txn_9", TTL, () -> {
            calls.incrementAndGet();
            throw boom;
        }));
        assertSame(boom, thrown);
        assertTrue(store.get("txn_9").isEmpty());

        assertEquals("recovered", txns.getOrFetch("txn_9", TTL, counting(calls, "recovered")));
        assertEquals(2, calls.get());
        assertEquals(1, metrics.fetchFailures());
    }

    @Test
    void getOrFetch_emptyResultIsCachedLikeAnyOtherValue() {
        AtomicInteger calls = new AtomicInteger();

        assertEquals(List.of(), txns.getOrFetch("txn_all", TTL, counting(calls, List.of())));
        assertNull(txns.getOrFetch("txn_404", TTL, counting(calls, (String) null)));

        assertEquals(List.of(), txns.getOrFetch("txn_all", TTL, counting(calls, List.of("x"))));
        assertNull(txns.getOrFetch("txn_404", TTL, counting(calls, "late")));
        assertEquals(2, calls.get());
    }

    // ----------------------------------------------------------------------
    // Write path
    // ----------------------------------------------------------------------

    @Test
    void mutation_invalidatesSpecificEntry() {
        AtomicInteger calls = new AtomicInteger();
        String key = txns.entityKey("123");
        txns.getOrFetch(key, counting(calls, "before"));

        String result = txns.mutateAndInvalidate(() -> "updated", List.of(key));

        assertEquals("updated", result);
        assertEquals("after", txns.getOrFetch(key, counting(calls, "after")));
        assertEquals(2, calls.get());
    }

    @Test
    void create_invalidatesAllListKey() {
        AtomicInteger calls = new AtomicInteger();
        String all = txns.listKey(ListFilter.none());
        assertEquals("txn_all", all);
        txns.getOrFetch(all, counting(calls, List.of("a")));

        String created = txns.afterCreate(() -> "b");

        assertEquals("b", created);
        assertEquals(List.of("a", "b"), txns.getOrFetch(all, counting(calls, List.of("a", "b"))));
        assertEquals(2, calls.get());
    }

    @Test
    void failedMutation_invalidatesNothing() {
        AtomicInteger calls = new AtomicInteger();
        String entity = txns.entityKey("123");
        String list = txns.listKey(ListFilter.none());
        txns.getOrFetch(entity, counting(calls, "e"));
        txns.getOrFetch(list, counting(calls, List.of("e")));

        IllegalStateException boom = new IllegalStateException("422");
        assertSame(boom, assertThrows(IllegalStateException.class,
                () -> txns.mutateAndInvalidate(() -> { throw boom; }, txns.invalidationKeys("123"))));
        assertSame(boom, assertThrows(IllegalStateException.class,
                () -> txns.afterUpdate("123", () -> { throw boom; })));
        assertSame(boom, assertThrows(IllegalStateException.class,
                () -> txns.afterDelete("123", () -> { throw boom; })));

        assertEquals("e", txns.getOrFetch(entity, counting(calls, "x")));
        assertEquals(List.of("e"), txns.getOrFetch(list, counting(calls, List.of("x"))));
        assertEquals(2, calls.get());
        assertEquals(0, metrics.invalidations());
    }

    @Test
    void update_invalidatesEntityAndEveryRegisteredList() {
        AtomicInteger calls = new AtomicInteger();
        String entity = txns.entityKey("7");
        String all = txns.listKey(ListFilter.none());
        String unexplained = txns.listKey(ListFilter.of("view", "unexplained"));
        txns.getOrFetch(entity, counting(calls, "e"));
        txns.getOrFetch(all, counting(calls, "all"));
        txns.getOrFetch(unexplained, counting(calls, "unexplained"));
        assertEquals(3, calls.get());

        txns.afterUpdate("7", () -> "ok");

        assertTrue(store.get(entity).isEmpty());
        assertTrue(store.get(all).isEmpty());
        assertTrue(store.get(unexplained).isEmpty());
        assertEquals(3, metrics.invalidations());
    }

    @Test
    void delete_leavesOtherEntitiesCached() {
        AtomicInteger calls = new AtomicInteger();
        txns.getOrFetch(txns.entityKey("1"), counting(calls, "one"));
        txns.getOrFetch(txns.entityKey("2"), counting(calls, "two"));

        txns.afterDelete("1", () -> { });

        assertTrue(store.get("txn_1").isEmpty());
        assertEquals("two", store.get("txn_2").orElseThrow().value());
    }

    @Test
    void executeAndInvalidate_runsVoidMutation() {
        store.put("txn_5", "x", TTL);
        AtomicInteger ran = new AtomicInteger();

        txns.executeAndInvalidate(ran::incrementAndGet, Set.of("txn_5"));

        assertEquals(1, ran.get());
        assertTrue(store.get("txn_5").isEmpty());
    }

    @Test
    void invalidateLists_dropsListsButKeepsEntities() {
        store.put("txn_5", "x", TTL);
        String all = txns.listKey(ListFilter.none());
        store.put(all, List.of("x"), TTL);

        txns.invalidateLists();

        assertTrue(store.get(all).isEmpty());
        assertTrue(store.get("txn_5").isPresent());
    }

    // ----------------------------------------------------------------------
    // Keys
    // ----------------------------------------------------------------------

    @Test
    void identicalFilters_shareOneSlot_differentFiltersDoNot() {
        AtomicInteger calls = new AtomicInteger();
        ListFilter jan = ListFilter.builder().with("from_date", "2024-01-01").with("to_date", "2024-01-31").build();
        ListFilter janAgain = ListFilter.builder().with("to_date", "2024-01-31").with("from_date", "2024-01-01").build();
        ListFilter feb = ListFilter.builder().with("from_date", "2024-02-01").with("to_date", "2024-02-29").build();

        txns.getOrFetch(txns.listKey(jan), counting(calls, "jan"));
        assertEquals("jan", txns.getOrFetch(txns.listKey(janAgain), counting(calls, "jan?")));
        assertEquals(1, calls.get());

        assertEquals("feb", txns.getOrFetch(txns.listKey(feb), counting(calls, "feb")));
        assertEquals(2, calls.get());
        assertEquals(2, txns.listKeys().size());
    }

    @Test
    void invalidationKeys_forCreateHaveNoEntityKey() {
        txns.listKey(ListFilter.none());
        txns.listKey(ListFilter.of("view", "explained"));

        assertEquals(Set.of("txn_all", "txn_view=explained"), txns.invalidationKeys(null));
        assertEquals(Set.of("txn_9", "txn_all", "txn_view=explained"), txns.invalidationKeys("9"));
    }

    @Test
    void invalidIdIsRejectedBeforeMutationRuns() {
        AtomicInteger ran = new AtomicInteger();
        assertThrows(IllegalArgumentException.class, () -> txns.afterUpdate(" ", counting(ran, "x")));
        assertEquals(0, ran.get());
    }

    @Test
    void hitRatio_reflectsReads() {
        assertEquals(0.0, metrics.hitRatio());
        txns.getOrFetch("txn_1", () -> 1);
        txns.getOrFetch("txn_1", () -> 1);
        txns.getOrFetch("txn_1", () -> 1);
        txns.getOrFetch("txn_1", () -> 1);
        assertEquals(0.75, metrics.hitRatio(), 1e-9);
    }

    @Test
    void mutationThroughOneAccessor_invalidatesListsReadThroughAnother() {
        ResourceCache reader = new ResourceCache("contacts", store, TTL, metrics);
        ResourceCache writer = new ResourceCache("contacts", store, TTL, metrics);
        AtomicInteger fetches = new AtomicInteger();

        assertEquals(List.of("x"), reader.getOrFetch(reader.listKey(ListFilter.none()), counting(fetches, List.of("x"))));
        writer.afterCreate(() -> "y");

        assertEquals(List.of("x", "y"), reader.getOrFetch(reader.listKey(ListFilter.none()), counting(fetches, List.of("x", "y"))));
        assertEquals(2, fetches.get());
        assertEquals(Set.of("contacts_all"), writer.listKeys());
    }

    @Test
    void listKeysOfOtherResourcesOnTheSameStoreAreLeftAlone() {
        ResourceCache contacts = new ResourceCache("contacts", store, TTL, metrics);
        contacts.getOrFetch(contacts.listKey(ListFilter.none()), () -> List.of("c"));

        txns.afterCreate(() -> "t");

        assertTrue(store.get("contacts_all").isPresent());
        assertTrue(txns.listKeys().isEmpty());
    }
}
