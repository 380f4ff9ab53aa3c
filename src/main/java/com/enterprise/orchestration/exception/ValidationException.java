package com.enterprise.orchestration.exception;

/**
 * Thrown synchronously for malformed tasks, workflows, messages or configuration.
 * Never retried.
 */
public class ValidationException extends IllegalArgumentException {
    
    public ValidationException(String message) {
        super(message);
    }
}
