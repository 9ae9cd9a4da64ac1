package org.unchartedlands.simulation.api.events;

/**
 * Common shape of all events pushed by the simulation.
 */
public interface SimulationEvent {

    /**
     * @return the wire name of the event, e.g. {@code "resource-update"}
     */
    String eventName();

    String settlementId();

    /**
     * @return emission time in epoch milliseconds
     */
    long timestamp();
}
