package com.enterprise.orchestration.exception;

import com.enterprise.orchestration.core.ErrorKind;

/**
 * Exception thrown when no subscriber is registered for a message recipient
 */
public class RecipientNotFoundException extends DeliveryException {
    
    private final String recipient;
    
    public RecipientNotFoundException(String messageId, String recipient) {
        super("No subscriber registered for recipient: " + recipient, messageId);
        this.recipient = recipient;
    }
    
    public String getRecipient() {
        return recipient;
    }
    
    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.RECIPIENT_NOT_FOUND;
    }
}
