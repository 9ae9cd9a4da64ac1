package org.unchartedlands.simulation.model;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.unchartedlands.simulation.api.model.ExtractorType;
import org.unchartedlands.simulation.api.model.ResourceAmounts;
import org.unchartedlands.simulation.api.model.ResourceType;
import org.unchartedlands.simulation.api.model.Structure;
import org.unchartedlands.simulation.api.model.StructureModifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Tag("unit")
class ConsumptionModelTest {

    private static final double TICKS_PER_HOUR = 60 * 3600.0;

    private final ConsumptionModel model = new ConsumptionModel(ConsumptionModel.Rates.defaults(), TICKS_PER_HOUR);

    @Test
    void oneSecondOfUpkeepForTenSettlersAndTwoStructures() {
        ResourceAmounts consumed = model.calculate(10, 2, 60);

        assertThat(consumed.food()).isCloseTo(3.0, within(1e-9));
        assertThat(consumed.water()).isCloseTo(6.0, within(1e-9));
        assertThat(consumed.wood()).isCloseTo(0.002, within(1e-9));
        assertThat(consumed.stone()).isCloseTo(0.001, within(1e-9));
        assertThat(consumed.ore()).isCloseTo(0.0005, within(1e-9));
    }

    @Test
    void perTickRatesMatchSixtyHertz() {
        ResourceAmounts consumed = model.calculate(1, 0, 1);

        assertThat(consumed.food()).isCloseTo(0.005, within(1e-12));
        assertThat(consumed.water()).isCloseTo(0.01, within(1e-12));
    }

    @Test
    void noElapsedTimeConsumesNothing() {
        assertEquals(ResourceAmounts.ZERO, model.calculate(50, 5, 0));
        assertEquals(ResourceAmounts.ZERO, model.calculate(50, 5, -60));
    }

    @Test
    void worldMultiplierScalesAllConsumption() {
        ConsumptionModel doubled = new ConsumptionModel(
                ConsumptionModel.Rates.fromConfig(ConfigFactory.parseMap(Map.of("world-multiplier", 2.0))),
                TICKS_PER_HOUR);

        ResourceAmounts base = model.calculate(4, 3, 600);
        ResourceAmounts scaled = doubled.calculate(4, 3, 600);

        assertThat(scaled.food()).isCloseTo(2 * base.food(), within(1e-9));
        assertThat(scaled.ore()).isCloseTo(2 * base.ore(), within(1e-9));
    }

    @Test
    void sufficiencyUsesOneHourBuffer() {
        ResourceAmounts exact = new ResourceAmounts(1080, 2160, 3.6, 1.8, 0.9);
        ResourceAmounts shortOfFood = exact.minus(ResourceAmounts.of(ResourceType.FOOD, 1));

        assertTrue(model.hasResourcesForPopulation(1, 1, exact));
        assertFalse(model.hasResourcesForPopulation(1, 1, shortOfFood));
        assertTrue(model.hasResourcesForPopulation(0, 0, ResourceAmounts.ZERO));
    }

    @Test
    void populationCapacitySumsModifiersAndFloors() {
        List<Structure> structures = List.of(
                Structure.building("h1", "House", List.of(new StructureModifier("Population Capacity", 5))),
                Structure.building("h2", "Hut", List.of(new StructureModifier("population-capacity", 2.5))),
                Structure.extractor("f", "Farm", ExtractorType.FARM, 1));

        assertEquals(17, model.populationCapacity(structures));
        assertEquals(10, model.populationCapacity(List.of()));
        assertEquals(0, model.populationCapacity(List.of(
                Structure.building("r", "Ruin", List.of(new StructureModifier("population_capacity", -50))))));
    }

    @Test
    void moraleIsClampedToPercentRange() {
        List<Structure> festive = List.of(
                Structure.building("t", "Tavern", List.of(new StructureModifier("Morale Boost", 40))),
                Structure.building("s", "Shrine", List.of(new StructureModifier("Morale Boost", 40))));
        List<Structure> grim = List.of(
                Structure.building("g", "Gallows", List.of(new StructureModifier("morale_boost", -80))));

        assertEquals(50, model.morale(List.of()));
        assertEquals(100, model.morale(festive));
        assertEquals(0, model.morale(grim));
    }

    @Test
    void ratesFallBackToDefaultsForMissingKeys() {
        ConsumptionModel.Rates rates = ConsumptionModel.Rates.fromConfig(
                ConfigFactory.parseMap(Map.of("food-per-capita-per-hour", 500, "base-morale", 60)));

        assertEquals(500, rates.foodPerCapita());
        assertEquals(60, rates.baseMorale());
        assertEquals(2160, rates.waterPerCapita());
        assertEquals(10, rates.basePopulationCapacity());
    }
}
