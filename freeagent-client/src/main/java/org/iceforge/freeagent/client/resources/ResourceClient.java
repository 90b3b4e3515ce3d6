package org.iceforge.freeagent.client.resources;

import org.iceforge.freeagent.cache.ListFilter;
import org.iceforge.freeagent.cache.ResourceCache;
import org.iceforge.freeagent.client.FreeAgentHttp;
import org.springframework.http.HttpMethod;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Shared read and write paths of a FreeAgent resource.
 * <p>
 * Reads are served from the resource's {@link ResourceCache}; list reads derive both the cache key and the
 * query string from the same {@link ListFilter}. Writes call the API first and invalidate the entity key and
 * every list key of the resource only when the call succeeded.
 *
 * @param <T> entity type
 */
public abstract class ResourceClient<T> {

    protected final FreeAgentHttp http;
    protected final ResourceCache cache;

    private final String endpoint;
    private final String singular;
    private final String plural;
    private final Class<T> type;

    protected ResourceClient(FreeAgentHttp http, ResourceCache cache, String endpoint,
                             String singular, String plural, Class<T> type) {
        this.http = Objects.requireNonNull(http, "http");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.endpoint = endpoint;
        this.singular = singular;
        this.plural = plural;
        this.type = type;
    }

    public T getById(String id) {
        String key = cache.entityKey(id);
        return cache.getOrFetch(key, () -> http.getOne(path(id), singular, type));
    }

    public T create(T entity) {
        Objects.requireNonNull(entity, "entity");
        return cache.afterCreate(() -> http.post(endpoint, Map.of(), singular, entity, type));
    }

    public T update(String id, T entity) {
        Objects.requireNonNull(entity, "entity");
        return cache.afterUpdate(id, () -> http.put(path(id), singular, entity, type));
    }

    public void delete(String id) {
        cache.afterDelete(id, () -> http.delete(path(id)));
    }

    /** Drops every cached list of this resource; entity entries stay. */
    public void refreshLists() {
        cache.invalidateLists();
    }

    public ResourceCache cache() {
        return cache;
    }

    protected List<T> list(ListFilter filter) {
        String key = cache.listKey(filter);
        return cache.getOrFetch(key, () -> fetchList(filter));
    }

    /** Straight to the API. Derived lookups compute from this so their result is never older than their own ttl. */
    protected List<T> fetchList(ListFilter filter) {
        return http.getList(endpoint, filter.params(), plural, type);
    }

    /** Trimmed, non-blank lookup value; a blank one would collapse the derived key onto a plain list key. */
    protected static String requireLookup(String value, String name) {
        Objects.requireNonNull(value, name);
        String trimmed = value.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return trimmed;
    }

    /** Creates through a parent-scoped endpoint, e.g. {@code POST /v2/tasks?project=...}. */
    protected T createWith(Map<String, String> params, T entity) {
        Objects.requireNonNull(entity, "entity");
        return cache.afterCreate(() -> http.post(endpoint, params, singular, entity, type));
    }

    protected List<T> createAll(List<T> entities) {
        Objects.requireNonNull(entities, "entities");
        return cache.afterCreate(() -> http.postList(endpoint, plural, entities, type));
    }

    /** A body-less state change of one entity, answered with the changed entity. */
    protected T transition(String id, HttpMethod method, String suffix) {
        return cache.afterUpdate(id, () -> http.action(method, path(id) + "/" + suffix, singular, type));
    }

    // same trimmed id as the entity key
    protected String path(String id) {
        return endpoint + "/" + id.trim();
    }

    protected String endpoint() {
        return endpoint;
    }
}
