package org.iceforge.freeagent.cache;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Canonical filter parameters of a list operation.
 * <p>
 * Parameters are ordered by name, {@code null}/blank values are dropped and a value equal to its declared
 * default is dropped too, so semantically equal filters always yield the same {@link #signature()}.
 * The same ordered map feeds both the cache key and the HTTP query string.
 */
public final class ListFilter {

    private static final ListFilter NONE = new ListFilter(new TreeMap<>());

    private final SortedMap<String, String> params;

    private ListFilter(SortedMap<String, String> params) {
        this.params = Collections.unmodifiableSortedMap(params);
    }

    public static ListFilter none() {
        return NONE;
    }

    public static ListFilter of(String name, Object value) {
        return builder().with(name, value).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isEmpty() {
        return params.isEmpty();
    }

    /** Ordered by parameter name. */
    public Map<String, String> params() {
        return params;
    }

    /** {@code name=value} pairs, values URL-encoded, joined with {@code &}; empty for {@link #none()}. */
    public String signature() {
        return params.entrySet().stream()
                .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
                .collect(Collectors.joining("&"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ListFilter other)) return false;
        return params.equals(other.params);
    }

    @Override
    public int hashCode() {
        return params.hashCode();
    }

    @Override
    public String toString() {
        return isEmpty() ? CacheKeys.ALL : signature();
    }

    static String normalize(Object value) {
        if (value == null) return null;
        String s = String.valueOf(value).trim();
        return s.isEmpty() ? null : s;
    }

    public static final class Builder {
        private final TreeMap<String, String> params = new TreeMap<>();

        private Builder() {}

        public Builder with(String name, Object value) {
            return withDefault(name, value, null);
        }

        /** Adds {@code name} unless {@code value} is absent or equal to {@code defaultValue}. */
        public Builder withDefault(String name, Object value, Object defaultValue) {
            Objects.requireNonNull(name, "name");
            if (name.isBlank()) throw new IllegalArgumentException("parameter name must not be blank");
            if (params.containsKey(name)) {
                throw new IllegalArgumentException("duplicate filter parameter: " + name);
            }
            String v = normalize(value);
            if (v == null || v.equals(normalize(defaultValue))) {
                return this;
            }
            params.put(name, v);
            return this;
        }

        public ListFilter build() {
            return params.isEmpty() ? NONE : new ListFilter(new TreeMap<>(params));
        }
    }
}
