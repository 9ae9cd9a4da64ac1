package org.unchartedlands.simulation.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.unchartedlands.simulation.api.events.ISimulationEventSink;
import org.unchartedlands.simulation.api.events.PopulationWarningEvent;
import org.unchartedlands.simulation.api.events.ResourceShortageEvent;
import org.unchartedlands.simulation.api.events.SimulationEvent;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Event sink of the standalone node: writes every event as one JSON line to the log.
 * Shortages and population warnings go to INFO, all other events to DEBUG.
 */
public class LoggingEventSink implements ISimulationEventSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingEventSink.class);

    private final EventJsonEncoder encoder;
    private final AtomicLong broadcastCount = new AtomicLong();

    public LoggingEventSink() {
        this(new EventJsonEncoder());
    }

    public LoggingEventSink(EventJsonEncoder encoder) {
        this.encoder = encoder;
    }

    @Override
    public void broadcast(String worldId, SimulationEvent event) {
        broadcastCount.incrementAndGet();
        if (event instanceof ResourceShortageEvent || event instanceof PopulationWarningEvent) {
            log.info("[world {}] {}", worldId, encoder.encode(event));
        } else if (log.isDebugEnabled()) {
            log.debug("[world {}] {}", worldId, encoder.encode(event));
        }
    }

    public long getBroadcastCount() {
        return broadcastCount.get();
    }
}
