package org.unchartedlands.simulation.api.events;

/**
 * Sent when a population evaluation changed the number of settlers.
 */
public record PopulationGrowthEvent(
        String settlementId,
        int oldPopulation,
        int newPopulation,
        int happiness,
        double growthRate,
        long timestamp
) implements SimulationEvent {

    public static final String NAME = "population-growth";

    @Override
    public String eventName() {
        return NAME;
    }
}
