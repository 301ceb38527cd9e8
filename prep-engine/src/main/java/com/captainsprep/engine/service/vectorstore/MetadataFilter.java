package com.captainsprep.engine.service.vectorstore;

import java.util.Set;

/**
 * Matches entries whose metadata value under {@code key} is one of {@code anyOf}.
 */
public record MetadataFilter(String key, Set<String> anyOf) {

    public MetadataFilter {
        anyOf = anyOf == null ? Set.of() : Set.copyOf(anyOf);
    }

    public static MetadataFilter anyOf(String key, Set<String> values) {
        return new MetadataFilter(key, values);
    }

    public boolean matches(Object value) {
        return value != null && anyOf.contains(value.toString());
    }
}
