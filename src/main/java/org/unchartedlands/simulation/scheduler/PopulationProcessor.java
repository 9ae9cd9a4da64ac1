package org.unchartedlands.simulation.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.unchartedlands.simulation.api.events.ISimulationEventSink;
import org.unchartedlands.simulation.api.events.PopulationGrowthEvent;
import org.unchartedlands.simulation.api.events.PopulationStateEvent;
import org.unchartedlands.simulation.api.events.PopulationWarningEvent;
import org.unchartedlands.simulation.api.events.SettlerArrivedEvent;
import org.unchartedlands.simulation.api.model.PopulationRecord;
import org.unchartedlands.simulation.api.model.ResourceAmounts;
import org.unchartedlands.simulation.api.model.Structure;
import org.unchartedlands.simulation.api.store.ISettlementStore;
import org.unchartedlands.simulation.model.ConsumptionModel;
import org.unchartedlands.simulation.model.PopulationDynamicsModel;
import org.unchartedlands.simulation.random.IRandomProvider;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs the population dynamics step of one settlement: evaluates the model, persists the
 * record when it changed and emits the population events.
 * <p>
 * Each settlement draws from its own random stream derived from the root provider, so
 * outcomes do not depend on the order settlements are processed in.
 */
public class PopulationProcessor {

    static final String RANDOM_SCOPE = "population";

    private static final Logger log = LoggerFactory.getLogger(PopulationProcessor.class);

    private final ISettlementStore store;
    private final ISimulationEventSink sink;
    private final PopulationDynamicsModel model;
    private final ConsumptionModel consumption;
    private final IRandomProvider rootRandom;
    private final Clock clock;
    private final Map<String, IRandomProvider> streams = new ConcurrentHashMap<>();

    public PopulationProcessor(ISettlementStore store, ISimulationEventSink sink, PopulationDynamicsModel model,
                               ConsumptionModel consumption, IRandomProvider rootRandom, Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.model = Objects.requireNonNull(model, "model");
        this.consumption = Objects.requireNonNull(consumption, "consumption");
        this.rootRandom = Objects.requireNonNull(rootRandom, "rootRandom");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Evaluates the population of a settlement.
     *
     * @param state      the settlement
     * @param structures structures fetched for this wave
     * @param resources  stock after this wave's resource update
     * @param record     the stored population record
     * @return the outcome, empty if the step was skipped
     */
    public Optional<PopulationDynamicsModel.Outcome> process(SettlementSimState state, List<Structure> structures,
                                                             ResourceAmounts resources,
                                                             Optional<PopulationRecord> record) {
        String settlementId = state.getSettlementId();
        if (record.isEmpty() || record.get().current() <= 0) {
            log.debug("Skipping population step for settlement {}: population not initialized", settlementId);
            return Optional.empty();
        }
        PopulationRecord stored = record.get();
        Instant now = clock.instant();

        int capacity = consumption.populationCapacity(structures);
        boolean sufficient = consumption.hasResourcesForPopulation(stored.current(), structures.size(), resources);
        PopulationDynamicsModel.Input input = new PopulationDynamicsModel.Input(
                stored.current(),
                capacity,
                stored.happiness(),
                consumption.morale(structures),
                sufficient,
                elapsedHours(stored.lastGrowthTimestamp(), now));

        PopulationDynamicsModel.Outcome outcome = model.evaluate(input, streamFor(settlementId));

        if (outcome.changed()) {
            store.updatePopulation(settlementId,
                    new PopulationRecord(outcome.finalPopulation(), outcome.happiness(), now));
        }
        emit(state, outcome, now.toEpochMilli());

        log.debug("Population of settlement {}: {} -> {} (happiness {}, {})", settlementId,
                outcome.previousPopulation(), outcome.finalPopulation(), outcome.happiness(), outcome.status());
        return Optional.of(outcome);
    }

    /**
     * Drops the random stream of a settlement that left the simulation.
     */
    public void forget(String settlementId) {
        streams.remove(settlementId);
    }

    /**
     * Drops all random streams, so settlements registered afterwards start over from the root seed.
     */
    public void clear() {
        streams.clear();
    }

    private IRandomProvider streamFor(String settlementId) {
        return streams.computeIfAbsent(settlementId, id -> rootRandom.deriveFor(RANDOM_SCOPE, id));
    }

    private void emit(SettlementSimState state, PopulationDynamicsModel.Outcome outcome, long timestamp) {
        String worldId = state.getWorldId();
        String settlementId = state.getSettlementId();

        if (outcome.populationChanged()) {
            sink.broadcast(worldId, new PopulationGrowthEvent(settlementId, outcome.previousPopulation(),
                    outcome.finalPopulation(), outcome.happiness(), outcome.growthRate(), timestamp));
        }
        sink.broadcast(worldId, new PopulationStateEvent(settlementId, outcome.finalPopulation(), outcome.capacity(),
                outcome.happiness(), outcome.happinessDescription(), outcome.growthRate(), outcome.status(), timestamp));
        if (outcome.immigrationSucceeded()) {
            sink.broadcast(worldId, new SettlerArrivedEvent(settlementId, outcome.finalPopulation(),
                    outcome.immigrants(), outcome.happiness(), timestamp));
        }
        for (PopulationDynamicsModel.Warning warning : outcome.warnings()) {
            sink.broadcast(worldId, new PopulationWarningEvent(settlementId, outcome.finalPopulation(),
                    outcome.happiness(), warning.kind(), warning.message(), timestamp));
        }
    }

    private static double elapsedHours(Instant since, Instant now) {
        if (since == null || !now.isAfter(since)) {
            return 0;
        }
        return Duration.between(since, now).toMillis() / 3_600_000.0;
    }
}
