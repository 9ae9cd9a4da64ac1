package org.unchartedlands.simulation.api.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reasons for a population warning.
 */
public enum PopulationWarningKind {
    LOW_HAPPINESS("low_happiness"),
    EMIGRATION_RISK("emigration_risk"),
    NO_HOUSING("no_housing");

    private final String wireName;

    PopulationWarningKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
