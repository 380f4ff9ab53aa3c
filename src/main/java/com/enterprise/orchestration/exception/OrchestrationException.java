package com.enterprise.orchestration.exception;

/**
 * Base exception for orchestration errors a caller is expected to handle
 */
public class OrchestrationException extends Exception {
    
    public OrchestrationException(String message) {
        super(message);
    }
    
    public OrchestrationException(String message, Throwable cause) {
        super(message, cause);
    }
}
