package org.unchartedlands.simulation.api.events;

import org.unchartedlands.simulation.api.model.PopulationWarningKind;

/**
 * Informational warning about the state of a population.
 */
public record PopulationWarningEvent(
        String settlementId,
        int population,
        int happiness,
        PopulationWarningKind warning,
        String message,
        long timestamp
) implements SimulationEvent {

    public static final String NAME = "population-warning";

    @Override
    public String eventName() {
        return NAME;
    }
}
