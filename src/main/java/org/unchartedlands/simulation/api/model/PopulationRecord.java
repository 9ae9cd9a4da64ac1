package org.unchartedlands.simulation.api.model;

import java.time.Instant;

/**
 * Persisted population of a settlement. Written only by the population dynamics step.
 *
 * @param current             number of settlers
 * @param happiness           satisfaction in [0, 100]
 * @param lastGrowthTimestamp when the population was last evaluated and changed
 */
public record PopulationRecord(int current, int happiness, Instant lastGrowthTimestamp) {
}
