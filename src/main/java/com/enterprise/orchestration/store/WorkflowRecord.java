package com.enterprise.orchestration.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Archived snapshot of a workflow, persisted as {@code {id, data, version, timestamp}}
 */
public final class WorkflowRecord {

    private final String id;
    private final Map<String, Object> data;
    private final long version;
    private final Instant timestamp;

    @JsonCreator
    public WorkflowRecord(@JsonProperty("id") String id,
                          @JsonProperty("data") Map<String, Object> data,
                          @JsonProperty("version") long version,
                          @JsonProperty("timestamp") Instant timestamp) {
        this.id = Objects.requireNonNull(id, "Workflow id cannot be null");
        this.data = data != null ? Collections.unmodifiableMap(new LinkedHashMap<>(data)) : Collections.emptyMap();
        this.version = version;
        this.timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public String getId() { return id; }

    public Map<String, Object> getData() { return data; }

    public long getVersion() { return version; }

    public Instant getTimestamp() { return timestamp; }
}
