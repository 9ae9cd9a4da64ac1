package org.unchartedlands.simulation.store;

import org.unchartedlands.simulation.api.model.PopulationRecord;
import org.unchartedlands.simulation.api.model.ResourceAmounts;
import org.unchartedlands.simulation.api.model.Settlement;
import org.unchartedlands.simulation.api.model.SettlementDetail;
import org.unchartedlands.simulation.api.model.SettlementStorage;
import org.unchartedlands.simulation.api.model.Structure;
import org.unchartedlands.simulation.api.store.ISettlementStore;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Thread-safe in-memory {@link ISettlementStore}. Used by the standalone node and in tests.
 * <p>
 * Storage amounts are kept per storage id and merged into the detail on every fetch, so
 * {@link #updateStorage} is visible to the next {@link #fetchSettlementDetail}.
 */
public class InMemorySettlementStore implements ISettlementStore {

    private final Map<String, SettlementDetail> settlements = new ConcurrentHashMap<>();
    private final Map<String, ResourceAmounts> storage = new ConcurrentHashMap<>();
    private final Map<String, List<Structure>> structures = new ConcurrentHashMap<>();
    private final Map<String, PopulationRecord> populations = new ConcurrentHashMap<>();

    /**
     * Adds or replaces a settlement. The storage amounts of the detail become the stored amounts.
     * Incomplete details are accepted so that missing data can be simulated.
     */
    public void putSettlement(SettlementDetail detail) {
        Objects.requireNonNull(detail, "detail");
        Objects.requireNonNull(detail.settlement(), "detail.settlement");
        settlements.put(detail.settlement().id(), detail);
        if (detail.storage() != null) {
            storage.put(detail.storage().id(), detail.storage().amounts());
        }
    }

    public void putStructures(String settlementId, List<Structure> built) {
        structures.put(settlementId, List.copyOf(built));
    }

    public void putPopulation(String settlementId, PopulationRecord population) {
        populations.put(settlementId, population);
    }

    /**
     * Removes a settlement with all its records.
     */
    public void removeSettlement(String settlementId) {
        SettlementDetail removed = settlements.remove(settlementId);
        if (removed != null && removed.storage() != null) {
            storage.remove(removed.storage().id());
        }
        structures.remove(settlementId);
        populations.remove(settlementId);
    }

    public Optional<ResourceAmounts> storageAmounts(String storageId) {
        return Optional.ofNullable(storage.get(storageId));
    }

    @Override
    public List<String> listActiveSettlementIds(String ownerId) {
        return settlements.values().stream()
                .map(SettlementDetail::settlement)
                .filter(settlement -> settlement.ownerId().equals(ownerId))
                .map(Settlement::id)
                .sorted()
                .toList();
    }

    @Override
    public Optional<SettlementDetail> fetchSettlementDetail(String settlementId) {
        SettlementDetail detail = settlements.get(settlementId);
        if (detail == null) {
            return Optional.empty();
        }
        if (detail.storage() == null) {
            return Optional.of(detail);
        }
        String storageId = detail.storage().id();
        ResourceAmounts amounts = storage.getOrDefault(storageId, detail.storage().amounts());
        return Optional.of(new SettlementDetail(detail.settlement(), new SettlementStorage(storageId, amounts),
                detail.plot(), detail.biome()));
    }

    @Override
    public List<Structure> fetchSettlementStructures(String settlementId) {
        return structures.getOrDefault(settlementId, List.of());
    }

    @Override
    public Optional<PopulationRecord> fetchPopulation(String settlementId) {
        return Optional.ofNullable(populations.get(settlementId));
    }

    @Override
    public void updatePopulation(String settlementId, PopulationRecord population) {
        populations.put(settlementId, Objects.requireNonNull(population, "population"));
    }

    @Override
    public void updateStorage(String storageId, ResourceAmounts amounts) {
        if (storage.replace(storageId, Objects.requireNonNull(amounts, "amounts")) == null) {
            throw new IllegalArgumentException("Unknown storage: " + storageId);
        }
    }
}
