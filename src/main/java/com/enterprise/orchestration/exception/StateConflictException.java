package com.enterprise.orchestration.exception;

/**
 * Exception thrown when a conditional state write was based on a stale version
 */
public class StateConflictException extends OrchestrationException {
    
    private final String key;
    private final long expectedVersion;
    private final long actualVersion;
    
    public StateConflictException(String key, long expectedVersion, long actualVersion) {
        super(String.format("Version conflict on %s: expected %d but found %d", key, expectedVersion, actualVersion));
        this.key = key;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }
    
    public String getKey() {
        return key;
    }
    
    public long getExpectedVersion() {
        return expectedVersion;
    }
    
    public long getActualVersion() {
        return actualVersion;
    }
}
