package org.unchartedlands.simulation.api.model;

import java.util.Locale;

/**
 * The raw resources tracked in settlement storage.
 */
public enum ResourceType {
    FOOD,
    WATER,
    WOOD,
    STONE,
    ORE;

    /**
     * Returns the lower-case key used in configuration files and modifier names.
     *
     * @return the key, e.g. {@code "food"}
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Resolves a resource from its configuration key, ignoring case.
     *
     * @param key the key, e.g. {@code "Food"}
     * @return the resource type
     * @throws IllegalArgumentException if the key names no tracked resource
     */
    public static ResourceType fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Resource key must not be null");
        }
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
