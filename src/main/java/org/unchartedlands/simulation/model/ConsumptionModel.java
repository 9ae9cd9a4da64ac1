package org.unchartedlands.simulation.model;

import com.typesafe.config.Config;
import org.unchartedlands.simulation.api.model.ResourceAmounts;
import org.unchartedlands.simulation.api.model.Structure;

import java.util.List;
import java.util.Objects;

/**
 * Upkeep of a settlement: per-capita food and water, per-structure maintenance in wood,
 * stone and ore. Everything scales linearly with elapsed time.
 * <p>
 * Also derives the housing capacity and base morale of a settlement from structure
 * modifiers, since both feed the consumption-side population figure.
 */
public final class ConsumptionModel {

    public static final String POPULATION_CAPACITY_MODIFIER = "population_capacity";
    public static final String MORALE_BOOST_MODIFIER = "morale_boost";

    /**
     * Consumption rates per hour and related constants.
     *
     * @param foodPerCapita          food per settler per hour
     * @param waterPerCapita         water per settler per hour
     * @param woodPerStructure       wood maintenance per structure per hour
     * @param stonePerStructure      stone maintenance per structure per hour
     * @param orePerStructure        ore maintenance per structure per hour
     * @param worldMultiplier        world template multiplier applied to all consumption
     * @param bufferHours            lookahead used by the sufficiency check
     * @param basePopulationCapacity housing available without any structures
     * @param baseMorale             morale before structure modifiers
     */
    public record Rates(
            double foodPerCapita,
            double waterPerCapita,
            double woodPerStructure,
            double stonePerStructure,
            double orePerStructure,
            double worldMultiplier,
            double bufferHours,
            int basePopulationCapacity,
            int baseMorale
    ) {

        /** 0.005 food and 0.01 water per settler per tick at 60 Hz. */
        public static Rates defaults() {
            return new Rates(1080, 2160, 3.6, 1.8, 0.9, 1.0, 1.0, 10, 50);
        }

        public static Rates fromConfig(Config options) {
            Rates d = defaults();
            return new Rates(
                    options.hasPath("food-per-capita-per-hour") ? options.getDouble("food-per-capita-per-hour") : d.foodPerCapita,
                    options.hasPath("water-per-capita-per-hour") ? options.getDouble("water-per-capita-per-hour") : d.waterPerCapita,
                    options.hasPath("wood-per-structure-per-hour") ? options.getDouble("wood-per-structure-per-hour") : d.woodPerStructure,
                    options.hasPath("stone-per-structure-per-hour") ? options.getDouble("stone-per-structure-per-hour") : d.stonePerStructure,
                    options.hasPath("ore-per-structure-per-hour") ? options.getDouble("ore-per-structure-per-hour") : d.orePerStructure,
                    options.hasPath("world-multiplier") ? options.getDouble("world-multiplier") : d.worldMultiplier,
                    options.hasPath("buffer-hours") ? options.getDouble("buffer-hours") : d.bufferHours,
                    options.hasPath("base-population-capacity") ? options.getInt("base-population-capacity") : d.basePopulationCapacity,
                    options.hasPath("base-morale") ? options.getInt("base-morale") : d.baseMorale);
        }
    }

    private final Rates rates;
    private final double ticksPerHour;

    public ConsumptionModel(Rates rates, double ticksPerHour) {
        if (ticksPerHour <= 0) {
            throw new IllegalArgumentException("ticksPerHour must be > 0");
        }
        this.rates = Objects.requireNonNull(rates, "rates");
        this.ticksPerHour = ticksPerHour;
    }

    public Rates rates() {
        return rates;
    }

    /**
     * Resources consumed over a window of ticks.
     *
     * @return consumed amounts, all zero if {@code elapsedTicks <= 0}
     */
    public ResourceAmounts calculate(int population, int structureCount, long elapsedTicks) {
        if (elapsedTicks <= 0) {
            return ResourceAmounts.ZERO;
        }
        return forHours(population, structureCount, elapsedTicks / ticksPerHour);
    }

    /**
     * Checks whether stock covers the projected consumption of the lookahead buffer for every
     * resource. Using a buffer rather than the instantaneous balance keeps the shortage signal
     * from flapping on marginal deficits.
     */
    public boolean hasResourcesForPopulation(int population, int structureCount, ResourceAmounts resources) {
        ResourceAmounts required = forHours(population, structureCount, rates.bufferHours());
        return resources.covers(required);
    }

    /**
     * Housing capacity: the base capacity plus all {@value #POPULATION_CAPACITY_MODIFIER} modifiers,
     * floored to a whole number and never negative.
     */
    public int populationCapacity(List<Structure> structures) {
        double capacity = rates.basePopulationCapacity();
        for (Structure structure : structures) {
            capacity += structure.modifierTotal(POPULATION_CAPACITY_MODIFIER);
        }
        return (int) Math.max(0, Math.floor(capacity));
    }

    /**
     * Morale from structures: base morale plus all {@value #MORALE_BOOST_MODIFIER} modifiers, in [0, 100].
     */
    public int morale(List<Structure> structures) {
        double morale = rates.baseMorale();
        for (Structure structure : structures) {
            morale += structure.modifierTotal(MORALE_BOOST_MODIFIER);
        }
        return (int) Math.max(0, Math.min(100, Math.round(morale)));
    }

    private ResourceAmounts forHours(int population, int structureCount, double hours) {
        double factor = hours * rates.worldMultiplier();
        return new ResourceAmounts(
                population * rates.foodPerCapita() * factor,
                population * rates.waterPerCapita() * factor,
                structureCount * rates.woodPerStructure() * factor,
                structureCount * rates.stonePerStructure() * factor,
                structureCount * rates.orePerStructure() * factor);
    }
}
