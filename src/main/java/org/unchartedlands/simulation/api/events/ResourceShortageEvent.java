package org.unchartedlands.simulation.api.events;

import org.unchartedlands.simulation.api.model.ResourceAmounts;

/**
 * Sent when stock cannot sustain the population for the lookahead buffer.
 */
public record ResourceShortageEvent(
        String settlementId,
        int population,
        ResourceAmounts resources,
        long timestamp
) implements SimulationEvent {

    public static final String NAME = "resource-shortage";

    @Override
    public String eventName() {
        return NAME;
    }
}
