package org.unchartedlands.simulation.api.model;

import java.util.Locale;

/**
 * A named numeric effect attached to a structure, e.g. {@code population_capacity = 5}.
 *
 * @param name  the modifier name as stored by the game data
 * @param value the modifier value
 */
public record StructureModifier(String name, double value) {

    /**
     * Returns the modifier name in canonical form: lower case, with spaces and dashes
     * replaced by underscores. {@code "Population Capacity"} becomes {@code "population_capacity"}.
     */
    public String canonicalName() {
        if (name == null) {
            return "";
        }
        return name.trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
    }
}
