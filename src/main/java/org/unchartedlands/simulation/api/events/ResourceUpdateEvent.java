package org.unchartedlands.simulation.api.events;

import org.unchartedlands.simulation.api.model.ResourceAmounts;

/**
 * Sent after every successful resource cycle of a settlement.
 *
 * @param type          origin of the update, always {@code "auto-production"} for the simulation
 * @param settlementId  the settlement
 * @param resources     stock after clamping
 * @param production    produced in the window
 * @param consumption   consumed in the window
 * @param netProduction production minus consumption
 * @param population    population used for consumption
 * @param timestamp     epoch millis
 */
public record ResourceUpdateEvent(
        String type,
        String settlementId,
        ResourceAmounts resources,
        ResourceAmounts production,
        ResourceAmounts consumption,
        ResourceAmounts netProduction,
        int population,
        long timestamp
) implements SimulationEvent {

    public static final String NAME = "resource-update";
    public static final String AUTO_PRODUCTION = "auto-production";

    @Override
    public String eventName() {
        return NAME;
    }
}
