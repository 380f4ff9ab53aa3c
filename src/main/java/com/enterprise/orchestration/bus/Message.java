package com.enterprise.orchestration.bus;

import com.enterprise.orchestration.core.ErrorKind;
import com.enterprise.orchestration.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

/**
 * Typed message exchanged between workers and the orchestrator.
 * <p>
 * Identity, addressing and payload are fixed at construction. Delivery state
 * ({@code status}, {@code retryCount}, next attempt time) is only changed by the
 * {@link MessageBus} that owns the message.
 */
public class Message {

    public static final String SYSTEM = "system";
    public static final String BROADCAST = "broadcast";

    private final String id;
    private final String type;
    private final String from;
    private final String to;
    private final Object payload;
    private final Priority priority;
    private final Instant createdAt;

    private MessageStatus status;
    private int retryCount;
    private Instant deliveredAt;
    private Instant nextAttemptAt;
    private ErrorKind lastFailure;

    @JsonCreator
    public Message(@JsonProperty("id") String id,
                   @JsonProperty("type") String type,
                   @JsonProperty("from") String from,
                   @JsonProperty("to") String to,
                   @JsonProperty("payload") Object payload,
                   @JsonProperty("priority") Priority priority,
                   @JsonProperty("createdAt") Instant createdAt,
                   @JsonProperty("status") MessageStatus status,
                   @JsonProperty("retryCount") int retryCount,
                   @JsonProperty("deliveredAt") Instant deliveredAt,
                   @JsonProperty("lastFailure") ErrorKind lastFailure) {
        this.id = id;
        this.type = type;
        this.from = from;
        this.to = to;
        this.payload = payload;
        this.priority = priority != null ? priority : Priority.NORMAL;
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.status = status != null ? status : MessageStatus.PENDING;
        this.retryCount = retryCount;
        this.deliveredAt = deliveredAt;
        this.lastFailure = lastFailure;
    }

    public String getId() { return id; }

    public String getType() { return type; }

    public String getFrom() { return from; }

    public String getTo() { return to; }

    public Object getPayload() { return payload; }

    public Priority getPriority() { return priority; }

    public Instant getCreatedAt() { return createdAt; }

    public synchronized MessageStatus getStatus() { return status; }

    public synchronized int getRetryCount() { return retryCount; }

    public synchronized Instant getDeliveredAt() { return deliveredAt; }

    public synchronized ErrorKind getLastFailure() { return lastFailure; }

    synchronized Instant getNextAttemptAt() { return nextAttemptAt; }

    @JsonIgnore
    public boolean isBroadcast() {
        return BROADCAST.equals(to);
    }

    /**
     * Whether the given worker sent or receives this message
     */
    public boolean involves(String workerId) {
        return workerId.equals(from) || workerId.equals(to);
    }

    /**
     * Creates an individually addressed copy with a fresh id, keeping type, payload and priority.
     */
    public Message copyFor(String recipient, Instant now) {
        return new Message(UUID.randomUUID().toString(), type, from, recipient, payload, priority,
                           now, MessageStatus.PENDING, 0, null, null);
    }

    synchronized void markDelivered(Instant now) {
        status = MessageStatus.DELIVERED;
        deliveredAt = now;
        nextAttemptAt = null;
    }

    /**
     * Records a failed delivery attempt.
     *
     * @return the retry count after the failure
     */
    synchronized int recordFailure(ErrorKind kind) {
        lastFailure = kind;
        return ++retryCount;
    }

    synchronized void scheduleRetry(Instant at) {
        nextAttemptAt = at;
    }

    synchronized void markFailed() {
        status = MessageStatus.FAILED;
        nextAttemptAt = null;
    }

    synchronized boolean isDue(Instant now) {
        return nextAttemptAt == null || !nextAttemptAt.isAfter(now);
    }

    @Override
    public String toString() {
        return "Message{" +
                "id='" + id + '\'' +
                ", type='" + type + '\'' +
                ", from='" + from + '\'' +
                ", to='" + to + '\'' +
                ", status=" + getStatus() +
                ", retryCount=" + getRetryCount() +
                '}';
    }

    /**
     * Builder for creating Message instances
     */
    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String type;
        private String from = SYSTEM;
        private String to;
        private Object payload;
        private Priority priority = Priority.NORMAL;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder from(String from) {
            this.from = from;
            return this;
        }

        public Builder to(String to) {
            this.to = to;
            return this;
        }

        public Builder payload(Object payload) {
            this.payload = payload;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Message build() {
            if (id == null || id.isBlank()) {
                throw new ValidationException("Message id is required");
            }
            if (type == null || type.isBlank()) {
                throw new ValidationException("Message type is required");
            }
            if (from == null || from.isBlank()) {
                throw new ValidationException("Message sender is required");
            }
            if (to == null || to.isBlank()) {
                throw new ValidationException("Message recipient is required");
            }
            return new Message(id, type, from, to, payload, priority,
                               createdAt != null ? createdAt : Instant.now(),
                               MessageStatus.PENDING, 0, null, null);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
