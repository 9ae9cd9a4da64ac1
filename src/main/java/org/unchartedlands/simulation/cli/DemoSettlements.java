package org.unchartedlands.simulation.cli;

import org.unchartedlands.simulation.api.model.Biome;
import org.unchartedlands.simulation.api.model.ExtractorType;
import org.unchartedlands.simulation.api.model.Plot;
import org.unchartedlands.simulation.api.model.PopulationRecord;
import org.unchartedlands.simulation.api.model.ResourceAmounts;
import org.unchartedlands.simulation.api.model.Settlement;
import org.unchartedlands.simulation.api.model.SettlementDetail;
import org.unchartedlands.simulation.api.model.SettlementStorage;
import org.unchartedlands.simulation.api.model.Structure;
import org.unchartedlands.simulation.api.model.StructureModifier;
import org.unchartedlands.simulation.store.InMemorySettlementStore;

import java.time.Instant;
import java.util.List;

/**
 * Seeds an in-memory store with a small set of settlements for the standalone node.
 */
final class DemoSettlements {

    static final String OWNER_ID = "demo-player";
    static final String WORLD_ID = "demo-world";

    private static final List<Biome> BIOMES = List.of(
            new Biome("biome-grassland", "Grassland"),
            new Biome("biome-rainforest", "Tropical Rainforest"),
            new Biome("biome-mountains", "Mountains"));

    private DemoSettlements() {
    }

    static void seed(InMemorySettlementStore store, int count) {
        for (int i = 1; i <= count; i++) {
            String id = "settlement-" + i;
            Biome biome = BIOMES.get((i - 1) % BIOMES.size());
            store.putSettlement(new SettlementDetail(
                    new Settlement(id, OWNER_ID, "Outpost " + i),
                    new SettlementStorage("storage-" + i, new ResourceAmounts(200, 200, 100, 50, 20)),
                    new Plot("plot-" + i, 100, ResourceAmounts.ZERO),
                    biome));
            store.putStructures(id, List.of(
                    Structure.extractor(id + "-farm", "Farm", ExtractorType.FARM, 1 + (i % 2)),
                    Structure.extractor(id + "-well", "Well", ExtractorType.WELL, 1),
                    Structure.extractor(id + "-mill", "Lumber Mill", ExtractorType.LUMBER_MILL, 1),
                    Structure.building(id + "-house", "House", List.of(
                            new StructureModifier("Population Capacity", 10),
                            new StructureModifier("Morale Boost", 5))),
                    Structure.building(id + "-warehouse", "Warehouse", List.of(
                            new StructureModifier("Storage Capacity", 500)))));
            store.putPopulation(id, new PopulationRecord(5, 50, Instant.now()));
        }
    }
}
