package org.unchartedlands.simulation.api.services;

import org.unchartedlands.simulation.api.resources.OperationalError;

import java.util.List;

/**
 * Lifecycle contract of long-running simulation services.
 * <p>
 * Unlike one-shot jobs, simulation services are started and stopped by collaborators
 * (e.g. world join/leave handling) that cannot know the current state, so misuse of the
 * lifecycle is tolerated: starting a running service or stopping a stopped one is a no-op.
 */
public interface IService {

    /**
     * The operational state of a service.
     */
    enum State {
        /**
         * The service is not running and must be started to become active.
         */
        STOPPED,
        /**
         * The service is actively processing.
         */
        RUNNING,
        /**
         * The service thread died with an unexpected exception.
         */
        ERROR
    }

    /**
     * Starts the service. Has no effect if it is already running.
     */
    void start();

    /**
     * Stops the service. Has no effect if it is not running.
     */
    void stop();

    /**
     * Returns the current state of the service.
     *
     * @return The current {@link State}.
     */
    State getCurrentState();

    /**
     * Returns a list of operational errors that have occurred in the service.
     * @return A list of {@link OperationalError}s.
     */
    List<OperationalError> getErrors();

    /**
     * Clears the list of operational errors for the service.
     */
    void clearErrors();
}
