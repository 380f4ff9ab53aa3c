package com.enterprise.orchestration.events;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable event emitted by a subsystem.
 * <p>
 * The subject id is the id of the task, message, state key or workflow the event is about.
 * Attributes carry the context a listener needs to react, such as retry counts or error kinds.
 */
public final class OrchestrationEvent {

    private final EventType type;
    private final String subjectId;
    private final Map<String, Object> attributes;
    private final Instant timestamp;

    public OrchestrationEvent(EventType type, String subjectId, Map<String, Object> attributes, Instant timestamp) {
        this.type = Objects.requireNonNull(type, "Event type cannot be null");
        this.subjectId = subjectId;
        this.attributes = attributes != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes))
            : Collections.emptyMap();
        this.timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public static OrchestrationEvent of(EventType type, String subjectId) {
        return new OrchestrationEvent(type, subjectId, null, Instant.now());
    }

    public static OrchestrationEvent of(EventType type, String subjectId, Map<String, Object> attributes) {
        return new OrchestrationEvent(type, subjectId, attributes, Instant.now());
    }

    public EventType getType() { return type; }

    public String getSubjectId() { return subjectId; }

    public Map<String, Object> getAttributes() { return attributes; }

    public Instant getTimestamp() { return timestamp; }

    public Object getAttribute(String name) {
        return attributes.get(name);
    }

    @Override
    public String toString() {
        return "OrchestrationEvent{" +
                "type=" + type +
                ", subjectId='" + subjectId + '\'' +
                ", attributes=" + attributes +
                '}';
    }
}
