package org.unchartedlands.simulation.services;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.unchartedlands.simulation.api.resources.OperationalError;
import org.unchartedlands.simulation.api.services.IService;
import org.unchartedlands.simulation.junit.extensions.logging.ExpectLog;
import org.unchartedlands.simulation.junit.extensions.logging.LogLevel;
import org.unchartedlands.simulation.junit.extensions.logging.LogWatchExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class AbstractSimulationServiceTest {

    private final List<AbstractSimulationService> started = new ArrayList<>();

    private static class LoopingService extends AbstractSimulationService {
        final AtomicBoolean looping = new AtomicBoolean();
        final AtomicBoolean interrupted = new AtomicBoolean();
        final AtomicInteger starts = new AtomicInteger();
        final AtomicInteger stops = new AtomicInteger();

        LoopingService() {
            super("test-service", ConfigFactory.empty());
        }

        @Override
        protected void onStart() {
            starts.incrementAndGet();
        }

        @Override
        protected void onStop() {
            stops.incrementAndGet();
        }

        @Override
        protected void run() throws InterruptedException {
            looping.set(true);
            try {
                while (!Thread.currentThread().isInterrupted()) {
                    Thread.sleep(5);
                }
            } catch (InterruptedException e) {
                interrupted.set(true);
                throw e;
            } finally {
                looping.set(false);
            }
        }

        void fail(String code) {
            recordError(code, "failure", "details of " + code);
        }

        @Override
        protected void addCustomMetrics(Map<String, Number> metrics) {
            super.addCustomMetrics(metrics);
            metrics.put("starts", starts.get());
        }
    }

    private static class FailingService extends AbstractSimulationService {
        FailingService() {
            super("failing-service", ConfigFactory.empty());
        }

        @Override
        protected void run() {
            throw new IllegalStateException("timer broke");
        }
    }

    private static class SmallErrorBufferService extends LoopingService {
        @Override
        protected int getMaxErrors() {
            return 3;
        }
    }

    @AfterEach
    void tearDown() {
        for (AbstractSimulationService service : started) {
            if (service.getCurrentState() != IService.State.STOPPED) {
                service.stop();
            }
        }
    }

    private <T extends AbstractSimulationService> T track(T service) {
        started.add(service);
        return service;
    }

    @Test
    void startsAndStopsServiceThread() {
        LoopingService service = track(new LoopingService());
        assertEquals(IService.State.STOPPED, service.getCurrentState());

        service.start();
        await().atMost(2, TimeUnit.SECONDS).untilTrue(service.looping);
        assertEquals(IService.State.RUNNING, service.getCurrentState());
        assertTrue(service.isRunning());
        assertEquals(1, service.starts.get());

        service.stop();
        assertEquals(IService.State.STOPPED, service.getCurrentState());
        assertFalse(service.looping.get());
        assertTrue(service.interrupted.get());
        assertEquals(1, service.stops.get());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Cannot start service 'test-service': it is already running")
    void startWhileRunningOnlyWarns() {
        LoopingService service = track(new LoopingService());
        service.start();
        service.start();

        assertEquals(IService.State.RUNNING, service.getCurrentState());
        assertEquals(1, service.starts.get());
    }

    @Test
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Cannot stop service 'test-service': it is not running")
    void stopWhileStoppedOnlyWarns() {
        LoopingService service = new LoopingService();
        service.stop();

        assertEquals(IService.State.STOPPED, service.getCurrentState());
        assertEquals(0, service.stops.get());
    }

    @Test
    @ExpectLog(level = LogLevel.ERROR, messagePattern = "FailingService stopped with ERROR due to IllegalStateException")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Cannot start service 'failing-service' from ERROR state, stop it first")
    void failingRunLoopEntersErrorState() {
        FailingService service = track(new FailingService());
        service.start();

        await().atMost(2, TimeUnit.SECONDS).until(() -> service.getCurrentState() == IService.State.ERROR);
        assertFalse(service.isHealthy());

        service.start();
        assertEquals(IService.State.ERROR, service.getCurrentState());

        service.stop();
        assertEquals(IService.State.STOPPED, service.getCurrentState());
    }

    @Test
    void recordedErrorsMakeServiceUnhealthyUntilCleared() {
        LoopingService service = new LoopingService();
        assertTrue(service.isHealthy());

        service.fail("SETTLEMENT_STEP_FAILED");

        List<OperationalError> errors = service.getErrors();
        assertEquals(1, errors.size());
        assertEquals("SETTLEMENT_STEP_FAILED", errors.get(0).errorType());
        assertEquals("details of SETTLEMENT_STEP_FAILED", errors.get(0).details());
        assertNotNull(errors.get(0).timestamp());
        assertFalse(service.isHealthy());

        service.clearErrors();
        assertTrue(service.getErrors().isEmpty());
        assertTrue(service.isHealthy());
    }

    @Test
    void errorBufferDropsOldestEntries() {
        LoopingService service = new SmallErrorBufferService();
        for (int i = 1; i <= 5; i++) {
            service.fail("E" + i);
        }

        List<OperationalError> errors = service.getErrors();
        assertEquals(3, errors.size());
        assertEquals("E3", errors.get(0).errorType());
        assertEquals("E5", errors.get(2).errorType());
    }

    @Test
    void metricsStartWithErrorCountFollowedByCustomMetrics() {
        LoopingService service = new LoopingService();
        service.fail("E1");
        service.fail("E2");

        Map<String, Number> metrics = service.getMetrics();
        assertEquals(List.of("error_count", "starts"), new ArrayList<>(metrics.keySet()));
        assertEquals(2, metrics.get("error_count").intValue());
        assertEquals(0, metrics.get("starts").intValue());
    }
}
