package org.unchartedlands.simulation.model;

import org.unchartedlands.simulation.api.model.Biome;
import org.unchartedlands.simulation.api.model.Plot;
import org.unchartedlands.simulation.api.model.ResourceAmounts;
import org.unchartedlands.simulation.api.model.ResourceType;
import org.unchartedlands.simulation.api.model.Structure;

import java.util.List;
import java.util.Objects;

/**
 * Raw output of the extractors on a plot over a window of ticks.
 * <p>
 * Each extractor contributes {@code baseRate × levelMultiplier × biomeEfficiency} units per
 * hour for every resource it yields; the sum is scaled linearly by
 * {@code elapsedTicks / ticksPerHour}. Output is not clamped here, storage limits are applied
 * by {@link StorageCapacityModel}.
 */
public final class ProductionModel {

    private final GameBalance balance;
    private final double ticksPerHour;

    public ProductionModel(GameBalance balance, double ticksPerHour) {
        if (ticksPerHour <= 0) {
            throw new IllegalArgumentException("ticksPerHour must be > 0");
        }
        this.balance = Objects.requireNonNull(balance, "balance");
        this.ticksPerHour = ticksPerHour;
    }

    /**
     * Calculates what the extractors of a settlement produced in a window.
     *
     * @param plot         the plot the settlement stands on; rates come from the balance
     *                     tables, not from the plot's yield potential
     * @param structures   all structures of the settlement, buildings are ignored
     * @param elapsedTicks ticks since the last successful cycle
     * @param biome        the plot's biome, may be {@code null}
     * @return produced amounts, all zero if {@code elapsedTicks <= 0}
     */
    public ResourceAmounts calculate(Plot plot, List<Structure> structures, long elapsedTicks, Biome biome) {
        Objects.requireNonNull(plot, "plot");
        if (elapsedTicks <= 0) {
            return ResourceAmounts.ZERO;
        }
        ResourceAmounts perHour = hourlyRate(structures, biome == null ? null : biome.name());
        return perHour.scale(elapsedTicks / ticksPerHour);
    }

    /**
     * Combined hourly output of all extractors in the list.
     */
    public ResourceAmounts hourlyRate(List<Structure> structures, String biomeName) {
        ResourceAmounts total = ResourceAmounts.ZERO;
        for (Structure structure : structures) {
            if (!structure.isExtractor()) {
                continue;
            }
            double levelMultiplier = balance.levelMultiplier(structure.level());
            for (ResourceType resource : ResourceType.values()) {
                double baseRate = balance.baseRate(structure.extractorType(), resource);
                if (baseRate == 0) {
                    continue;
                }
                double rate = baseRate * levelMultiplier * balance.biomeEfficiency(biomeName, resource);
                total = total.with(resource, total.get(resource) + rate);
            }
        }
        return total;
    }
}
