package org.iceforge.freeagent.client;

import org.iceforge.freeagent.cache.CacheMetricsRegistry;
import org.iceforge.freeagent.cache.InMemoryCacheStore;
import org.iceforge.freeagent.cache.NoOpCacheStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class FreeAgentClientTest {

    private StubFreeAgentApi api;
    private InMemoryCacheStore store;
    private FreeAgentClient client;

    @BeforeEach
    void setUp() {
        api = new StubFreeAgentApi();
        store = new InMemoryCacheStore();
        client = new FreeAgentClient(api.http(), store, new CacheMetricsRegistry(), Duration.ofMinutes(5));
        api.ok(HttpMethod.GET, "/v2/contacts/1", "{\"contact\":{\"url\":\"https://api.test.freeagent.com/v2/contacts/1\"}}");
        api.ok(HttpMethod.GET, "/v2/projects/1", "{\"project\":{\"url\":\"https://api.test.freeagent.com/v2/projects/1\"}}");
    }

    @Test
    void resourcesShareStoreUnderTheirOwnPrefixes() {
        client.contacts().getById("1");
        client.projects().getById("1");

        assertThat(client.cachedEntries()).isEqualTo(2);
        assertThat(store.get("contacts_1")).isPresent();
        assertThat(store.get("projects_1")).isPresent();
    }

    @Test
    void mutationOfOneResourceLeavesOthersCached() {
        api.on(HttpMethod.DELETE, "/v2/contacts/1", 200, null);
        client.contacts().getById("1");
        client.projects().getById("1");

        client.contacts().delete("1");

        assertThat(store.get("contacts_1")).isEmpty();
        assertThat(store.get("projects_1")).isPresent();
    }

    @Test
    void metricsAreSharedAcrossResources() {
        client.contacts().getById("1");
        client.contacts().getById("1");
        client.projects().getById("1");

        assertThat(client.metrics().misses()).isEqualTo(2);
        assertThat(client.metrics().hits()).isEqualTo(1);
    }

    @Test
    void clearCacheForcesRefetch() {
        client.contacts().getById("1");
        client.clearCache();
        client.contacts().getById("1");

        assertThat(client.cachedEntries()).isEqualTo(1);
        assertThat(api.count(HttpMethod.GET, "/v2/contacts/1")).isEqualTo(2);
    }

    @Test
    void noOpStoreAlwaysCallsTheApi() {
        FreeAgentClient uncached = new FreeAgentClient(api.http(), new NoOpCacheStore(), new CacheMetricsRegistry(), Duration.ofMinutes(5));

        uncached.contacts().getById("1");
        uncached.contacts().getById("1");

        assertThat(api.count(HttpMethod.GET, "/v2/contacts/1")).isEqualTo(2);
        assertThat(uncached.cachedEntries()).isZero();
    }

    @Test
    void twoClientsOnOneStoreInvalidateEachOthersLists() {
        FreeAgentClient other = new FreeAgentClient(api.http(), store, new CacheMetricsRegistry(), Duration.ofMinutes(5));
        api.ok(HttpMethod.GET, "/v2/projects", "{\"projects\":[]}");
        api.on(HttpMethod.DELETE, "/v2/projects/1", 200, null);

        client.projects().getAll();
        other.projects().delete("1");
        client.projects().getAll();

        assertThat(api.count(HttpMethod.GET, "/v2/projects")).isEqualTo(2);
    }
}
