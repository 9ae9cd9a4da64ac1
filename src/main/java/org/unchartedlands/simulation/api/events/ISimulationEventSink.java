package org.unchartedlands.simulation.api.events;

/**
 * Broadcast channel towards connected clients. Events are scoped to a world; every client
 * that joined the world receives them.
 */
@FunctionalInterface
public interface ISimulationEventSink {

    /**
     * Broadcasts an event to all listeners of a world.
     *
     * @param worldId the world room
     * @param event   the event
     */
    void broadcast(String worldId, SimulationEvent event);
}
