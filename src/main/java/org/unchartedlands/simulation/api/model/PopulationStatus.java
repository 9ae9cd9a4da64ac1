package org.unchartedlands.simulation.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Direction a population is heading after an evaluation.
 */
public enum PopulationStatus {
    GROWING("Growing"),
    STABLE("Stable"),
    DECLINING("Declining");

    private final String label;

    PopulationStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
