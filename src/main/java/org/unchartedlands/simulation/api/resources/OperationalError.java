package org.unchartedlands.simulation.api.resources;

import java.time.Instant;

/**
 * A transient error that did not stop a service but may have affected the result of a cycle.
 *
 * @param timestamp When the error occurred.
 * @param errorType A category for the error (e.g., "SETTLEMENT_STEP_FAILED").
 * @param message   A human-readable description of the error.
 * @param details   Additional context, such as the settlement id and tick.
 */
public record OperationalError(
    Instant timestamp,
    String errorType,
    String message,
    String details
) {
}
