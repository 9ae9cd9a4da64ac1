package org.unchartedlands.simulation.store;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.unchartedlands.simulation.api.model.ExtractorType;
import org.unchartedlands.simulation.api.model.Plot;
import org.unchartedlands.simulation.api.model.PopulationRecord;
import org.unchartedlands.simulation.api.model.ResourceAmounts;
import org.unchartedlands.simulation.api.model.Settlement;
import org.unchartedlands.simulation.api.model.SettlementDetail;
import org.unchartedlands.simulation.api.model.SettlementStorage;
import org.unchartedlands.simulation.api.model.Structure;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class InMemorySettlementStoreTest {

    private InMemorySettlementStore store;

    @BeforeEach
    void setUp() {
        store = new InMemorySettlementStore();
        store.putSettlement(detail("s-2", "alice"));
        store.putSettlement(detail("s-1", "alice"));
        store.putSettlement(detail("s-3", "bob"));
    }

    private static SettlementDetail detail(String id, String owner) {
        return new SettlementDetail(new Settlement(id, owner, id),
                new SettlementStorage("storage-" + id, new ResourceAmounts(1, 2, 3, 4, 5)),
                new Plot("plot-" + id, 10, ResourceAmounts.ZERO), null);
    }

    @Test
    void listsSettlementsOfOwnerInIdOrder() {
        assertThat(store.listActiveSettlementIds("alice")).containsExactly("s-1", "s-2");
        assertThat(store.listActiveSettlementIds("carol")).isEmpty();
    }

    @Test
    void storageUpdatesAreVisibleInNextFetch() {
        ResourceAmounts updated = new ResourceAmounts(10, 20, 30, 40, 50);
        store.updateStorage("storage-s-1", updated);

        assertThat(store.fetchSettlementDetail("s-1"))
                .hasValueSatisfying(d -> assertThat(d.storage().amounts()).isEqualTo(updated));
        assertThat(store.storageAmounts("storage-s-1")).contains(updated);
    }

    @Test
    void updatingUnknownStorageFails() {
        assertThatThrownBy(() -> store.updateStorage("storage-missing", ResourceAmounts.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void incompleteDetailsAreReturnedAsStored() {
        store.putSettlement(new SettlementDetail(new Settlement("s-9", "bob", "Ghost"), null, null, null));

        assertThat(store.fetchSettlementDetail("s-9"))
                .hasValueSatisfying(d -> assertThat(d.isComplete()).isFalse());
        assertThat(store.fetchSettlementDetail("nope")).isEmpty();
    }

    @Test
    void structuresAndPopulationRoundTrip() {
        List<Structure> built = List.of(Structure.extractor("f", "Farm", ExtractorType.FARM, 2));
        PopulationRecord population = new PopulationRecord(12, 60, Instant.parse("2026-01-01T00:00:00Z"));
        store.putStructures("s-1", built);
        store.updatePopulation("s-1", population);

        assertThat(store.fetchSettlementStructures("s-1")).isEqualTo(built);
        assertThat(store.fetchSettlementStructures("s-2")).isEmpty();
        assertThat(store.fetchPopulation("s-1")).contains(population);
        assertThat(store.fetchPopulation("s-2")).isEmpty();
    }

    @Test
    void removingSettlementDropsAllRecords() {
        store.putPopulation("s-1", new PopulationRecord(3, 50, Instant.EPOCH));
        store.removeSettlement("s-1");

        assertThat(store.fetchSettlementDetail("s-1")).isEmpty();
        assertThat(store.fetchPopulation("s-1")).isEmpty();
        assertThat(store.storageAmounts("storage-s-1")).isEmpty();
        assertThat(store.listActiveSettlementIds("alice")).containsExactly("s-2");
    }
}
