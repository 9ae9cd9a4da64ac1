package org.unchartedlands.simulation.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.unchartedlands.simulation.api.events.ISimulationEventSink;
import org.unchartedlands.simulation.api.events.ResourceShortageEvent;
import org.unchartedlands.simulation.api.events.ResourceUpdateEvent;
import org.unchartedlands.simulation.api.events.ResourceWasteEvent;
import org.unchartedlands.simulation.api.events.StorageWarningEvent;
import org.unchartedlands.simulation.api.model.NearCapacityStatus;
import org.unchartedlands.simulation.api.model.PopulationRecord;
import org.unchartedlands.simulation.api.model.ResourceAmounts;
import org.unchartedlands.simulation.api.model.SettlementDetail;
import org.unchartedlands.simulation.api.model.StorageCapacity;
import org.unchartedlands.simulation.api.model.Structure;
import org.unchartedlands.simulation.api.store.ISettlementStore;
import org.unchartedlands.simulation.model.SimulationModels;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One simulation step of one settlement: production, consumption, storage clamping,
 * persistence, events and, on population cycles, the population step.
 * <p>
 * Store failures propagate to the caller. Nothing is advanced before the storage update
 * succeeded, so a failed step is retried over the same window on the next wave.
 */
public class SettlementProcessor {

    /**
     * Result of a step.
     */
    public enum Result {
        /** Storage was updated and the window advanced. */
        UPDATED,
        /** The settlement's data is missing or incomplete; it was removed from the registry. */
        DEREGISTERED
    }

    private static final Logger log = LoggerFactory.getLogger(SettlementProcessor.class);

    private final ISettlementStore store;
    private final ISimulationEventSink sink;
    private final SimulationModels models;
    private final PopulationProcessor populationProcessor;
    private final SettlementRegistry registry;
    private final Clock clock;

    public SettlementProcessor(ISettlementStore store, ISimulationEventSink sink, SimulationModels models,
                               PopulationProcessor populationProcessor, SettlementRegistry registry, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.models = Objects.requireNonNull(models, "models");
        this.populationProcessor = Objects.requireNonNull(populationProcessor, "populationProcessor");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Processes one settlement for the given tick.
     *
     * @param state           the settlement
     * @param tick            the scheduler tick the wave was started at
     * @param populationCycle whether the population step runs after the resource step
     * @return the result
     */
    public Result process(SettlementSimState state, long tick, boolean populationCycle) {
        String settlementId = state.getSettlementId();

        Optional<SettlementDetail> fetched = store.fetchSettlementDetail(settlementId);
        if (fetched.isEmpty() || !fetched.get().isComplete()) {
            log.warn("Settlement {} has missing or incomplete data, removing it from the simulation", settlementId);
            registry.unregister(state);
            populationProcessor.forget(settlementId);
            return Result.DEREGISTERED;
        }
        SettlementDetail detail = fetched.get();
        List<Structure> structures = store.fetchSettlementStructures(settlementId);
        long elapsedTicks = tick - state.getLastUpdateTick();

        ResourceAmounts production = models.production()
                .calculate(detail.plot(), structures, elapsedTicks, detail.biome());

        Optional<PopulationRecord> population = store.fetchPopulation(settlementId);
        int consumers = population.map(PopulationRecord::current)
                .filter(current -> current > 0)
                .orElseGet(() -> models.consumption().populationCapacity(structures));

        ResourceAmounts consumption = models.consumption().calculate(consumers, structures.size(), elapsedTicks);
        ResourceAmounts net = production.minus(consumption);

        ResourceAmounts current = detail.storage().amounts();
        StorageCapacity capacity = models.storage().capacity(structures);
        ResourceAmounts waste = models.storage().waste(current, net, capacity);
        ResourceAmounts updated = models.storage().clamp(current.plus(net), capacity);

        store.updateStorage(detail.storage().id(), updated);
        state.advanceTo(tick);

        emitResourceEvents(state, consumers, structures.size(), production, consumption, net, updated, capacity, waste);
        log.debug("Settlement {} updated at tick {} over {} ticks", settlementId, tick, elapsedTicks);

        if (populationCycle) {
            populationProcessor.process(state, structures, updated, population);
        }
        return Result.UPDATED;
    }

    private void emitResourceEvents(SettlementSimState state, int population, int structureCount,
                                    ResourceAmounts production, ResourceAmounts consumption, ResourceAmounts net,
                                    ResourceAmounts updated, StorageCapacity capacity, ResourceAmounts waste) {
        String worldId = state.getWorldId();
        String settlementId = state.getSettlementId();
        long timestamp = clock.millis();

        sink.broadcast(worldId, new ResourceUpdateEvent(ResourceUpdateEvent.AUTO_PRODUCTION, settlementId,
                updated, production, consumption, net, population, timestamp));

        if (waste.isAnyPositive()) {
            log.debug("Settlement {} wasted {} for lack of storage", settlementId, waste);
            sink.broadcast(worldId, new ResourceWasteEvent(settlementId, waste, capacity, timestamp));
        }

        NearCapacityStatus nearCapacity = models.storage().isNearCapacity(updated, capacity);
        if (nearCapacity.isAny()) {
            sink.broadcast(worldId, new StorageWarningEvent(settlementId, nearCapacity, updated, capacity, timestamp));
        }

        if (population > 0 && !models.consumption().hasResourcesForPopulation(population, structureCount, updated)) {
            sink.broadcast(worldId, new ResourceShortageEvent(settlementId, population, updated, timestamp));
        }
    }
}
