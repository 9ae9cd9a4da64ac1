package org.unchartedlands.simulation.model;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.unchartedlands.simulation.config.SchedulerSettings;

import java.util.Objects;

/**
 * The four simulation models a scheduler runs per settlement, built for one tick rate.
 */
public record SimulationModels(
        ProductionModel production,
        ConsumptionModel consumption,
        StorageCapacityModel storage,
        PopulationDynamicsModel population
) {

    public SimulationModels {
        Objects.requireNonNull(production, "production");
        Objects.requireNonNull(consumption, "consumption");
        Objects.requireNonNull(storage, "storage");
        Objects.requireNonNull(population, "population");
    }

    /**
     * Models with the balance of {@code reference.conf} and default tunables.
     */
    public static SimulationModels defaults(SchedulerSettings settings) {
        return new SimulationModels(
                new ProductionModel(GameBalance.defaults(), settings.ticksPerHour()),
                new ConsumptionModel(ConsumptionModel.Rates.defaults(), settings.ticksPerHour()),
                new StorageCapacityModel(),
                new PopulationDynamicsModel(PopulationDynamicsModel.Settings.defaults()));
    }

    /**
     * Builds the models from a {@code simulation} block with the optional sub-blocks
     * {@code balance}, {@code consumption}, {@code storage} and {@code population}.
     */
    public static SimulationModels fromConfig(Config simulation, SchedulerSettings settings) {
        return new SimulationModels(
                new ProductionModel(GameBalance.fromConfig(block(simulation, "balance")), settings.ticksPerHour()),
                new ConsumptionModel(ConsumptionModel.Rates.fromConfig(block(simulation, "consumption")), settings.ticksPerHour()),
                StorageCapacityModel.fromConfig(block(simulation, "storage")),
                new PopulationDynamicsModel(PopulationDynamicsModel.Settings.fromConfig(block(simulation, "population"))));
    }

    private static Config block(Config config, String path) {
        return config.hasPath(path) ? config.getConfig(path) : ConfigFactory.empty();
    }
}
