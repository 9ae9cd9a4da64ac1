package org.unchartedlands.simulation.scheduler;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.unchartedlands.simulation.api.events.ISimulationEventSink;
import org.unchartedlands.simulation.api.store.ISettlementStore;
import org.unchartedlands.simulation.config.SchedulerSettings;
import org.unchartedlands.simulation.model.SimulationModels;
import org.unchartedlands.simulation.random.IRandomProvider;
import org.unchartedlands.simulation.random.SeededRandomProvider;
import org.unchartedlands.simulation.services.AbstractSimulationService;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fixed-rate tick scheduler of the settlement simulation.
 * <p>
 * The service thread advances a tick counter at {@code tickRate} Hz. Every
 * {@code coarsePeriodTicks} ticks it hands a wave over all registered settlements to a wave
 * thread, which partitions the settlements into batches of {@code batchSize} and processes
 * each batch concurrently; batches run one after another. At most one wave is in flight: a
 * wave due while the previous one still runs is skipped, and the next wave covers the missed
 * time through the elapsed-tick window of each settlement.
 * <p>
 * A settlement whose step fails is logged and left untouched; the rest of its batch and wave
 * carry on. Ticks can also be driven manually through {@link #tick()} without starting the
 * timer.
 */
public class TickScheduler extends AbstractSimulationService implements AutoCloseable {

    private static final long EXECUTOR_TERMINATION_TIMEOUT_MS = 5000;

    private final SchedulerSettings settings;
    private final SettlementRegistry registry = new SettlementRegistry();
    private final ISettlementStore store;
    private final SettlementProcessor processor;
    private final PopulationProcessor populationProcessor;

    private final AtomicLong currentTick = new AtomicLong();
    private final AtomicBoolean waveInFlight = new AtomicBoolean(false);
    private final AtomicLong wavesProcessed = new AtomicLong();
    private final AtomicLong wavesSkipped = new AtomicLong();
    private final AtomicLong settlementsProcessed = new AtomicLong();
    private final AtomicLong settlementsFailed = new AtomicLong();

    private volatile ExecutorService waveExecutor;
    private volatile ExecutorService batchExecutor;

    /**
     * Creates a scheduler from a {@code simulation} configuration block.
     *
     * @param name    service name, also used for thread names
     * @param options the {@code simulation} block with {@code scheduler}, {@code balance},
     *                {@code consumption}, {@code storage} and {@code population} sub-blocks
     * @param store   the persistent store
     * @param sink    the event broadcast channel
     */
    public TickScheduler(String name, Config options, ISettlementStore store, ISimulationEventSink sink) {
        this(name, options, SchedulerSettings.fromConfig(block(options, "scheduler")), store, sink);
    }

    private TickScheduler(String name, Config options, SchedulerSettings settings,
                          ISettlementStore store, ISimulationEventSink sink) {
        this(name, options, settings, SimulationModels.fromConfig(options, settings), store, sink,
                new SeededRandomProvider(populationSeed(options)), Clock.systemUTC());
    }

    /**
     * Creates a scheduler with explicit collaborators.
     */
    public TickScheduler(String name, SchedulerSettings settings, SimulationModels models, ISettlementStore store,
                         ISimulationEventSink sink, IRandomProvider random, Clock clock) {
        this(name, ConfigFactory.empty(), settings, models, store, sink, random, clock);
    }

    private TickScheduler(String name, Config options, SchedulerSettings settings, SimulationModels models,
                          ISettlementStore store, ISimulationEventSink sink, IRandomProvider random, Clock clock) {
        super(name, options);
        this.settings = Objects.requireNonNull(settings, "settings");
        this.store = Objects.requireNonNull(store, "store");
        this.populationProcessor = new PopulationProcessor(store, sink, models.population(), models.consumption(),
                random, clock);
        this.processor = new SettlementProcessor(store, sink, models, populationProcessor, registry, clock);
        createExecutors();
    }

    @Override
    protected void logStarted() {
        log.info("{} started: tickRate={} Hz, coarsePeriod={} ticks, populationPeriod={} ticks, batchSize={}",
                serviceName, settings.tickRate(), settings.coarsePeriodTicks(),
                settings.populationPeriodTicks(), settings.batchSize());
    }

    @Override
    protected void onStart() {
        currentTick.set(0);
        if (waveExecutor.isShutdown() || batchExecutor.isShutdown()) {
            createExecutors();
        }
    }

    @Override
    protected void onStop() {
        registry.clear();
        currentTick.set(0);
        shutdownExecutors();
        populationProcessor.clear();
    }

    @Override
    protected void run() throws InterruptedException {
        long interval = settings.tickIntervalNanos();
        long maxLag = interval * settings.tickRate();
        long nextTick = System.nanoTime() + interval;

        while (!Thread.currentThread().isInterrupted() && isRunning()) {
            long wait = nextTick - System.nanoTime();
            if (wait > 0) {
                TimeUnit.NANOSECONDS.sleep(wait);
            }
            tick();
            nextTick += interval;
            long lag = System.nanoTime() - nextTick;
            if (lag > maxLag) {
                log.debug("Timer fell {} ms behind, resynchronizing", TimeUnit.NANOSECONDS.toMillis(lag));
                nextTick = System.nanoTime() + interval;
            }
        }
    }

    /**
     * Advances the tick counter by one and starts a wave if one is due.
     *
     * @return the new tick
     */
    public long tick() {
        long tick = currentTick.incrementAndGet();

        if (tick % settings.statusLogIntervalTicks() == 0) {
            logStatus();
        }
        if (tick % settings.coarsePeriodTicks() != 0 || registry.isEmpty()) {
            return tick;
        }
        if (!waveInFlight.compareAndSet(false, true)) {
            wavesSkipped.incrementAndGet();
            log.debug("Skipping wave at tick {}: previous wave still running", tick);
            return tick;
        }
        try {
            waveExecutor.execute(() -> {
                try {
                    runWave(tick);
                } finally {
                    waveInFlight.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            waveInFlight.set(false);
            log.debug("Wave at tick {} not started, scheduler is shutting down", tick);
        }
        return tick;
    }

    private void runWave(long tick) {
        List<SettlementSimState> settlements = registry.snapshot();
        boolean populationCycle = tick % settings.populationPeriodTicks() == 0;
        int batchSize = settings.batchSize();

        for (int from = 0; from < settlements.size(); from += batchSize) {
            List<SettlementSimState> batch = settlements.subList(from, Math.min(from + batchSize, settlements.size()));
            List<Callable<Void>> tasks = new ArrayList<>(batch.size());
            for (SettlementSimState state : batch) {
                tasks.add(() -> {
                    processSettlement(state, tick, populationCycle);
                    return null;
                });
            }
            try {
                batchExecutor.invokeAll(tasks);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Wave at tick {} interrupted", tick);
                return;
            } catch (RejectedExecutionException e) {
                log.debug("Wave at tick {} abandoned, scheduler is shutting down", tick);
                return;
            }
        }
        wavesProcessed.incrementAndGet();
    }

    private void processSettlement(SettlementSimState state, long tick, boolean populationCycle) {
        try {
            processor.process(state, tick, populationCycle);
            settlementsProcessed.incrementAndGet();
        } catch (Exception e) {
            settlementsFailed.incrementAndGet();
            log.warn("Failed to process settlement {} at tick {}: {}", state.getSettlementId(), tick, e.getMessage());
            log.debug("Exception details:", e);
            recordError("SETTLEMENT_STEP_FAILED", "Settlement step failed",
                    String.format("Settlement: %s, Tick: %d, Cause: %s",
                            state.getSettlementId(), tick, e.getClass().getSimpleName()));
        }
    }

    /**
     * Adds a settlement to the simulation. Its first window starts at the current tick.
     *
     * @return {@code true} if it was not registered yet
     */
    public boolean registerSettlement(String settlementId, String ownerId, String worldId) {
        boolean added = registry.register(settlementId, ownerId, worldId, currentTick.get());
        if (added) {
            log.info("Settlement {} registered (owner {}, world {}), {} active",
                    settlementId, ownerId, worldId, registry.size());
        } else {
            log.debug("Settlement {} is already registered", settlementId);
        }
        return added;
    }

    /**
     * Removes a settlement from the simulation. Has no effect if it is not registered.
     *
     * @return {@code true} if it was registered
     */
    public boolean unregisterSettlement(String settlementId) {
        boolean removed = registry.unregister(settlementId);
        if (removed) {
            populationProcessor.forget(settlementId);
            log.info("Settlement {} unregistered, {} active", settlementId, registry.size());
        }
        return removed;
    }

    /**
     * Registers all active settlements of a player, e.g. when the player joins a world.
     * A failing store lookup is logged and registers nothing.
     *
     * @return the number of newly registered settlements
     */
    public int registerOwner(String ownerId, String worldId) {
        List<String> settlementIds;
        try {
            settlementIds = store.listActiveSettlementIds(ownerId);
        } catch (RuntimeException e) {
            log.error("Failed to list settlements of owner {}: {}", ownerId, e.getMessage());
            log.debug("Exception details:", e);
            recordError("OWNER_REGISTRATION_FAILED", "Failed to list settlements of owner",
                    String.format("Owner: %s, World: %s", ownerId, worldId));
            return 0;
        }
        int added = 0;
        for (String settlementId : settlementIds) {
            if (registerSettlement(settlementId, ownerId, worldId)) {
                added++;
            }
        }
        log.info("Registered {} settlements of owner {}", added, ownerId);
        return added;
    }

    /**
     * Unregisters all settlements of a player, e.g. when the player disconnects.
     *
     * @return the number of removed settlements
     */
    public int unregisterOwner(String ownerId) {
        List<String> removed = registry.unregisterOwner(ownerId);
        removed.forEach(populationProcessor::forget);
        if (!removed.isEmpty()) {
            log.info("Unregistered {} settlements of owner {}, {} active", removed.size(), ownerId, registry.size());
        }
        return removed.size();
    }

    public boolean isRegistered(String settlementId) {
        return registry.contains(settlementId);
    }

    public SchedulerStatus status() {
        return new SchedulerStatus(isRunning(), currentTick.get(), registry.size(), settings.tickRate());
    }

    public SchedulerSettings getSettings() {
        return settings;
    }

    /**
     * @return whether a wave is currently being processed
     */
    public boolean isWaveInFlight() {
        return waveInFlight.get();
    }

    @Override
    protected void addCustomMetrics(Map<String, Number> metrics) {
        super.addCustomMetrics(metrics);
        metrics.put("current_tick", currentTick.get());
        metrics.put("active_settlements", registry.size());
        metrics.put("waves_processed", wavesProcessed.get());
        metrics.put("waves_skipped", wavesSkipped.get());
        metrics.put("settlements_processed", settlementsProcessed.get());
        metrics.put("settlements_failed", settlementsFailed.get());
    }

    /**
     * Stops the timer if it is running and releases the worker threads.
     */
    @Override
    public void close() {
        if (getCurrentState() != State.STOPPED) {
            stop();
        } else {
            shutdownExecutors();
        }
    }

    private void logStatus() {
        log.info("Scheduler status: tick={}, activeSettlements={}, waves={}, skipped={}, failed={}",
                currentTick.get(), registry.size(), wavesProcessed.get(), wavesSkipped.get(), settlementsFailed.get());
    }

    private void createExecutors() {
        waveExecutor = Executors.newSingleThreadExecutor(daemonThreads(serviceName + "-wave"));
        batchExecutor = Executors.newFixedThreadPool(settings.batchSize(), daemonThreads(serviceName + "-batch"));
    }

    private void shutdownExecutors() {
        waveExecutor.shutdown();
        batchExecutor.shutdown();
        try {
            if (!waveExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("{} wave did not finish within {} ms", serviceName, EXECUTOR_TERMINATION_TIMEOUT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("{} interrupted while waiting for the running wave", serviceName);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static Config block(Config config, String path) {
        return config.hasPath(path) ? config.getConfig(path) : ConfigFactory.empty();
    }

    private static long populationSeed(Config options) {
        return options.hasPath("population.seed") ? options.getLong("population.seed") : System.nanoTime();
    }
}
