package com.enterprise.orchestration.exception;

/**
 * Unchecked wrapper for failures of the persistence collaborator
 */
public class StateStoreException extends RuntimeException {
    
    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
