package com.enterprise.orchestration.dlq;

import com.enterprise.orchestration.bus.Message;
import com.enterprise.orchestration.core.ErrorKind;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * A dead-lettered message with the failure that ended its delivery
 */
public class DeadLetterEntry {

    private final String messageId;
    private final Message message;
    private final String reason;
    private final ErrorKind errorKind;
    private final int retryCount;
    private final Instant deadLetteredAt;

    @JsonCreator
    public DeadLetterEntry(@JsonProperty("messageId") String messageId,
                           @JsonProperty("message") Message message,
                           @JsonProperty("reason") String reason,
                           @JsonProperty("errorKind") ErrorKind errorKind,
                           @JsonProperty("retryCount") int retryCount,
                           @JsonProperty("deadLetteredAt") Instant deadLetteredAt) {
        this.messageId = Objects.requireNonNull(messageId, "Message ID cannot be null");
        this.message = Objects.requireNonNull(message, "Message cannot be null");
        this.reason = reason != null ? reason : "";
        this.errorKind = errorKind != null ? errorKind : ErrorKind.RETRY_EXHAUSTED;
        this.retryCount = retryCount;
        this.deadLetteredAt = Objects.requireNonNull(deadLetteredAt, "Dead-letter time cannot be null");
    }

    /**
     * Entry for a message the bus has just given up on. The error kind is the
     * message's last delivery failure.
     */
    public static DeadLetterEntry of(Message message, String reason, Instant deadLetteredAt) {
        return new DeadLetterEntry(message.getId(), message, reason, message.getLastFailure(),
                                   message.getRetryCount(), deadLetteredAt);
    }

    public String getMessageId() { return messageId; }

    public Message getMessage() { return message; }

    public String getReason() { return reason; }

    public ErrorKind getErrorKind() { return errorKind; }

    public int getRetryCount() { return retryCount; }

    public Instant getDeadLetteredAt() { return deadLetteredAt; }

    @JsonIgnore
    public String getRecipient() { return message.getTo(); }

    @JsonIgnore
    public String getMessageType() { return message.getType(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return messageId.equals(((DeadLetterEntry) o).messageId);
    }

    @Override
    public int hashCode() {
        return messageId.hashCode();
    }

    @Override
    public String toString() {
        return "DeadLetterEntry{" +
                "messageId='" + messageId + '\'' +
                ", type='" + message.getType() + '\'' +
                ", to='" + message.getTo() + '\'' +
                ", errorKind=" + errorKind +
                ", retryCount=" + retryCount +
                ", deadLetteredAt=" + deadLetteredAt +
                '}';
    }
}
