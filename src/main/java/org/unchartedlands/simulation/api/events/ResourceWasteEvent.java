package org.unchartedlands.simulation.api.events;

import org.unchartedlands.simulation.api.model.ResourceAmounts;
import org.unchartedlands.simulation.api.model.StorageCapacity;

/**
 * Sent when part of this cycle's production did not fit into storage.
 */
public record ResourceWasteEvent(
        String settlementId,
        ResourceAmounts waste,
        StorageCapacity capacity,
        long timestamp
) implements SimulationEvent {

    public static final String NAME = "resource-waste";

    @Override
    public String eventName() {
        return NAME;
    }
}
