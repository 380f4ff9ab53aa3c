package com.enterprise.orchestration.exception;

import com.enterprise.orchestration.core.ErrorKind;

/**
 * Base exception for delivery-time failures. These are retried by the bus
 * and never reach the publisher.
 */
public abstract class DeliveryException extends OrchestrationException {
    
    private final String messageId;
    
    protected DeliveryException(String message, String messageId) {
        super(message);
        this.messageId = messageId;
    }
    
    public String getMessageId() {
        return messageId;
    }
    
    public abstract ErrorKind getErrorKind();
}
