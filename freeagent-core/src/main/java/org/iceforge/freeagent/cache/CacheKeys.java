package org.iceforge.freeagent.cache;

import java.util.Objects;

/**
 * Deterministic cache keys.
 * <ul>
 *   <li>entity: {@code <resource>_<id>}</li>
 *   <li>unfiltered list: {@code <resource>_all}</li>
 *   <li>filtered list: {@code <resource>_<filter-signature>}</li>
 * </ul>
 * Entity ids may not be {@code all} or contain {@code =}, so entity and list keys never collide.
 */
public final class CacheKeys {

    public static final String SEPARATOR = "_";
    public static final String ALL = "all";

    private CacheKeys() {}

    public static String entity(String resource, String id) {
        requireResource(resource);
        Objects.requireNonNull(id, "id");
        String trimmed = id.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("id must not be blank for resource " + resource);
        }
        if (ALL.equals(trimmed) || trimmed.contains("=")) {
            throw new IllegalArgumentException("id '" + id + "' is reserved for list keys of resource " + resource);
        }
        return prefix(resource) + trimmed;
    }

    public static String list(String resource, ListFilter filter) {
        requireResource(resource);
        ListFilter f = filter == null ? ListFilter.none() : filter;
        return prefix(resource) + (f.isEmpty() ? ALL : f.signature());
    }

    public static String prefix(String resource) {
        return requireResource(resource) + SEPARATOR;
    }

    private static String requireResource(String resource) {
        Objects.requireNonNull(resource, "resource");
        if (resource.isBlank() || resource.chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("invalid resource name: '" + resource + "'");
        }
        return resource;
    }
}
