package org.unchartedlands.simulation.api.events;

import org.unchartedlands.simulation.api.model.PopulationStatus;

/**
 * Summary of a population after each evaluation.
 */
public record PopulationStateEvent(
        String settlementId,
        int current,
        int capacity,
        int happiness,
        String happinessDescription,
        double growthRate,
        PopulationStatus status,
        long timestamp
) implements SimulationEvent {

    public static final String NAME = "population-state";

    @Override
    public String eventName() {
        return NAME;
    }
}
