package com.enterprise.orchestration.exception;

import com.enterprise.orchestration.core.ErrorKind;

/**
 * Exception thrown when the recipient's subscription filter excludes the message type
 */
public class TypeNotSubscribedException extends DeliveryException {
    
    private final String recipient;
    private final String messageType;
    
    public TypeNotSubscribedException(String messageId, String recipient, String messageType) {
        super("Recipient " + recipient + " is not subscribed to message type: " + messageType, messageId);
        this.recipient = recipient;
        this.messageType = messageType;
    }
    
    public String getRecipient() {
        return recipient;
    }
    
    public String getMessageType() {
        return messageType;
    }
    
    @Override
    public ErrorKind getErrorKind() {
        return ErrorKind.TYPE_NOT_SUBSCRIBED;
    }
}
