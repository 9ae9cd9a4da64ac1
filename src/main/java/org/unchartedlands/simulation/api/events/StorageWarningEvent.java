package org.unchartedlands.simulation.api.events;

import org.unchartedlands.simulation.api.model.NearCapacityStatus;
import org.unchartedlands.simulation.api.model.ResourceAmounts;
import org.unchartedlands.simulation.api.model.StorageCapacity;

/**
 * Sent when at least one resource is close to its storage ceiling.
 */
public record StorageWarningEvent(
        String settlementId,
        NearCapacityStatus nearCapacity,
        ResourceAmounts resources,
        StorageCapacity capacity,
        long timestamp
) implements SimulationEvent {

    public static final String NAME = "storage-warning";

    @Override
    public String eventName() {
        return NAME;
    }
}
