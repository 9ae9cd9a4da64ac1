package org.unchartedlands.simulation.api.events;

/**
 * Sent when an immigration trial succeeded.
 */
public record SettlerArrivedEvent(
        String settlementId,
        int population,
        int immigrantCount,
        int happiness,
        long timestamp
) implements SimulationEvent {

    public static final String NAME = "settler-arrived";

    @Override
    public String eventName() {
        return NAME;
    }
}
