package com.enterprise.orchestration.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Versioned shared key/value entry.
 * Persisted as {@code {id, state, version, writer, timestamp}}.
 */
public final class StateRecord {

    private final String key;
    private final Object value;
    private final long version;
    private final String lastWriter;
    private final Instant updatedAt;

    @JsonCreator
    public StateRecord(@JsonProperty("id") String key,
                       @JsonProperty("state") Object value,
                       @JsonProperty("version") long version,
                       @JsonProperty("writer") String lastWriter,
                       @JsonProperty("timestamp") Instant updatedAt) {
        this.key = Objects.requireNonNull(key, "State key cannot be null");
        this.value = value;
        this.version = version;
        this.lastWriter = lastWriter;
        this.updatedAt = updatedAt != null ? updatedAt : Instant.now();
    }

    @JsonProperty("id")
    public String getKey() { return key; }

    @JsonProperty("state")
    public Object getValue() { return value; }

    @JsonProperty("version")
    public long getVersion() { return version; }

    @JsonProperty("writer")
    public String getLastWriter() { return lastWriter; }

    @JsonProperty("timestamp")
    public Instant getUpdatedAt() { return updatedAt; }

    @Override
    public String toString() {
        return "StateRecord{" +
                "key='" + key + '\'' +
                ", version=" + version +
                ", lastWriter='" + lastWriter + '\'' +
                ", updatedAt=" + updatedAt +
                '}';
    }
}
