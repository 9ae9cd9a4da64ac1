package org.unchartedlands.simulation.api.resources;

import java.util.List;
import java.util.Map;

/**
 * Components that expose metrics and transient errors for monitoring.
 */
public interface IMonitorable {

    /**
     * @return metric names mapped to their current values
     */
    Map<String, Number> getMetrics();

    List<OperationalError> getErrors();

    void clearErrors();

    /**
     * @return {@code true} if the component is running without recorded errors
     */
    boolean isHealthy();
}
