package com.enterprise.orchestration.sync;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * A pending manual conflict, handed to listeners of
 * {@link com.enterprise.orchestration.events.EventType#CONFLICT_MANUAL_REQUESTED}.
 * The first call to {@link #resolve(Object)} wins.
 */
public class ConflictResolutionRequest {

    private final String requestId;
    private final String key;
    private final Object localValue;
    private final Object remoteValue;
    private final Instant requestedAt;
    private final CompletableFuture<Object> resolution = new CompletableFuture<>();

    public ConflictResolutionRequest(String requestId, String key, Object localValue, Object remoteValue,
                                     Instant requestedAt) {
        this.requestId = requestId;
        this.key = key;
        this.localValue = localValue;
        this.remoteValue = remoteValue;
        this.requestedAt = requestedAt;
    }

    public String getRequestId() { return requestId; }

    public String getKey() { return key; }

    /**
     * The value the conflicting writer tried to store
     */
    public Object getLocalValue() { return localValue; }

    /**
     * The value currently stored
     */
    public Object getRemoteValue() { return remoteValue; }

    public Instant getRequestedAt() { return requestedAt; }

    /**
     * Supplies the final value.
     *
     * @return false if the request was already resolved or timed out
     */
    public boolean resolve(Object value) {
        return resolution.complete(value);
    }

    public boolean isResolved() {
        return resolution.isDone();
    }

    CompletableFuture<Object> getResolution() {
        return resolution;
    }

    /**
     * Marks the request abandoned so late resolvers are rejected
     */
    void abandon() {
        resolution.cancel(false);
    }
}
