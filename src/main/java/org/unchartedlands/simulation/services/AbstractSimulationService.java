package org.unchartedlands.simulation.services;

import com.typesafe.config.Config;
import org.unchartedlands.simulation.api.resources.IMonitorable;
import org.unchartedlands.simulation.api.resources.OperationalError;
import org.unchartedlands.simulation.api.services.IService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Base class for simulation services that run their main loop on a dedicated thread.
 * Provides lifecycle management, error tracking and base metrics. Subclasses implement
 * {@link #run()} and may hook into {@link #onStart()} and {@link #onStop()}.
 * <p>
 * Lifecycle misuse is tolerated: {@link #start()} on a running service and {@link #stop()}
 * on a stopped one log a warning and return.
 * <p>
 * Error Tracking: Services use {@link #recordError(String, String, String)} to track
 * transient errors that affect a cycle's result but don't require service termination.
 */
public abstract class AbstractSimulationService implements IService, IMonitorable {

    private static final long STOP_JOIN_TIMEOUT_MS = 5000;

    protected final Logger log = LoggerFactory.getLogger(this.getClass());
    protected final String serviceName;
    protected final Config options;
    private final AtomicReference<State> currentState = new AtomicReference<>(State.STOPPED);
    private Thread serviceThread;

    /**
     * Bounded to {@link #getMaxErrors()} entries; oldest entries are dropped first.
     * Private to enforce use of {@link #recordError(String, String, String)}.
     */
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    /**
     * Maximum number of errors to keep in memory. Subclasses can override this value if needed.
     */
    protected int getMaxErrors() {
        return 10000;
    }

    /**
     * @param name    The name of the service instance.
     * @param options The configuration for this service.
     */
    protected AbstractSimulationService(String name, Config options) {
        this.serviceName = name;
        this.options = options;
    }

    @Override
    public final synchronized void start() {
        State state = getCurrentState();
        if (state == State.RUNNING) {
            log.warn("Cannot start service '{}': it is already running", serviceName);
            return;
        }
        if (state == State.ERROR) {
            log.warn("Cannot start service '{}' from ERROR state, stop it first", serviceName);
            return;
        }
        currentState.set(State.RUNNING);
        onStart();
        serviceThread = new Thread(this::runService);
        serviceThread.setName(serviceName);
        serviceThread.setDaemon(true);
        serviceThread.start();
        logStarted();
    }

    /**
     * Template method for logging service startup. Services can override this to provide
     * detailed startup information.
     */
    protected void logStarted() {
        log.info("{} started", this.getClass().getSimpleName());
    }

    @Override
    public final synchronized void stop() {
        State state = getCurrentState();
        if (state == State.STOPPED) {
            log.warn("Cannot stop service '{}': it is not running", serviceName);
            return;
        }
        currentState.set(State.STOPPED);

        if (serviceThread != null && serviceThread != Thread.currentThread()) {
            serviceThread.interrupt();
            try {
                serviceThread.join(STOP_JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("{} interrupted while waiting for service thread to stop", serviceName);
            }
            if (serviceThread.isAlive()) {
                log.error("{} thread did not stop within {} ms", serviceName, STOP_JOIN_TIMEOUT_MS);
            }
        }
        serviceThread = null;
        onStop();
        log.info("{} stopped", this.getClass().getSimpleName());
    }

    /**
     * Called on the caller's thread after the state switched to RUNNING and before the service
     * thread is started. The default does nothing.
     */
    protected void onStart() {
    }

    /**
     * Called on the caller's thread after the service thread terminated. The default does nothing.
     */
    protected void onStop() {
    }

    @Override
    public State getCurrentState() {
        return currentState.get();
    }

    public boolean isRunning() {
        return getCurrentState() == State.RUNNING;
    }

    /**
     * Wraps {@link #run()} with state management.
     * <p>
     * <strong>Error Handling Strategy for Services:</strong>
     * <ul>
     *   <li><strong>Transient errors</strong>: Catch, log, {@link #recordError}, continue running</li>
     *   <li><strong>Fatal errors</strong>: Throw exception, the service transitions to ERROR state</li>
     * </ul>
     * Stack traces are logged at DEBUG level only.
     */
    private void runService() {
        try {
            run();
        } catch (InterruptedException e) {
            log.debug("Service thread interrupted, shutting down.");
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            log.error("{} stopped with ERROR due to {}",
                this.getClass().getSimpleName(),
                e.getClass().getSimpleName());
            log.debug("Exception details:", e);
            currentState.set(State.ERROR);
        } finally {
            log.debug("Service thread for {} has terminated.", this.getClass().getSimpleName());
        }
    }

    /**
     * The main loop of the service, executed on the dedicated service thread. It must return
     * or throw {@link InterruptedException} once the thread is interrupted.
     *
     * @throws InterruptedException if the service thread is interrupted.
     */
    protected abstract void run() throws InterruptedException;

    /**
     * Records a transient error. Use this only for errors the service survives; fatal errors
     * are thrown from {@link #run()} instead.
     *
     * @param code    Error code for categorization (e.g., "SETTLEMENT_STEP_FAILED")
     * @param message Human-readable error message
     * @param details Additional context about the error
     */
    protected void recordError(String code, String message, String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));

        int maxErrors = getMaxErrors();
        while (errors.size() > maxErrors) {
            errors.pollFirst();
        }
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    /**
     * ERROR state or any recorded error makes the service unhealthy.
     */
    @Override
    public boolean isHealthy() {
        if (getCurrentState() == State.ERROR) return false;
        return errors.isEmpty();
    }

    /**
     * Returns the base metrics ({@code error_count}) followed by those added in
     * {@link #addCustomMetrics(Map)}.
     */
    @Override
    public final Map<String, Number> getMetrics() {
        Map<String, Number> metrics = new LinkedHashMap<>();
        metrics.put("error_count", errors.size());
        addCustomMetrics(metrics);
        return metrics;
    }

    /**
     * Hook method for subclasses to add service-specific metrics. Overrides should call
     * {@code super.addCustomMetrics(metrics)} first.
     *
     * @param metrics Mutable map to add custom metrics to (already contains base metrics)
     */
    protected void addCustomMetrics(Map<String, Number> metrics) {
        // Default: no custom metrics
    }
}
