package com.enterprise.orchestration.exception;

import java.time.Duration;

/**
 * Exception thrown when the advisory lock on a state key cannot be acquired in time
 */
public class LockTimeoutException extends OrchestrationException {
    
    private final String key;
    private final Duration waited;
    
    public LockTimeoutException(String key, Duration waited) {
        super("Timed out after " + waited.toMillis() + "ms waiting for state lock: " + key);
        this.key = key;
        this.waited = waited;
    }
    
    public String getKey() {
        return key;
    }
    
    public Duration getWaited() {
        return waited;
    }
}
