package org.unchartedlands.simulation.events;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.unchartedlands.simulation.api.events.SimulationEvent;

import java.io.UncheckedIOException;

/**
 * Renders simulation events as {@code {"event": <name>, "data": {...}}} JSON objects, the
 * envelope clients receive on the broadcast channel.
 * <p>
 * Thread-safe; one instance can be shared by all sinks.
 */
public final class EventJsonEncoder {

    private final ObjectMapper mapper;

    public EventJsonEncoder() {
        this(new ObjectMapper());
    }

    public EventJsonEncoder(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectNode toTree(SimulationEvent event) {
        ObjectNode envelope = mapper.createObjectNode();
        envelope.put("event", event.eventName());
        envelope.set("data", mapper.valueToTree(event));
        return envelope;
    }

    public String encode(SimulationEvent event) {
        try {
            return mapper.writeValueAsString(toTree(event));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to encode event " + event.eventName(), e);
        }
    }
}
