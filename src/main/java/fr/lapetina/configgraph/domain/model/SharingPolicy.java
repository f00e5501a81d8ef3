package fr.lapetina.configgraph.domain.model;

import java.util.Locale;

/**
 * Rule governing whether a resolved instance is cached, reused, evicted, or
 * never shared.
 */
public enum SharingPolicy {
    /** Reuse the cached instance, creating it once */
    DEFAULT,

    /** Return the cached instance (building it if needed), then drop it from the cache */
    EVICT,

    /** Build an independent subgraph without touching the cache */
    DEEP;

    /**
     * Parses a {@code share} directive value, case-insensitive.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static SharingPolicy parse(String value) {
        if (value == null || value.isBlank()) {
            return DEFAULT;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown share type: " + value, e);
        }
    }
}
