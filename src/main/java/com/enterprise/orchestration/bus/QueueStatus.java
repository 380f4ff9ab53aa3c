package com.enterprise.orchestration.bus;

import java.time.Instant;

/**
 * Point-in-time view of the bus queues
 */
public class QueueStatus {

    private final int queueSize;
    private final int parkedCount;
    private final int subscriberCount;
    private final int totalMessages;
    private final int deadLetterCount;
    private final Instant timestamp;

    public QueueStatus(int queueSize, int parkedCount, int subscriberCount, int totalMessages,
                       int deadLetterCount, Instant timestamp) {
        this.queueSize = queueSize;
        this.parkedCount = parkedCount;
        this.subscriberCount = subscriberCount;
        this.totalMessages = totalMessages;
        this.deadLetterCount = deadLetterCount;
        this.timestamp = timestamp;
    }

    /**
     * Messages waiting in a recipient queue for delivery or retry
     */
    public int getQueueSize() { return queueSize; }

    /**
     * Broadcast copies held for workers that have not subscribed yet
     */
    public int getParkedCount() { return parkedCount; }

    public int getSubscriberCount() { return subscriberCount; }

    /**
     * Messages currently retained in history
     */
    public int getTotalMessages() { return totalMessages; }

    public int getDeadLetterCount() { return deadLetterCount; }

    public Instant getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return "QueueStatus{" +
                "queueSize=" + queueSize +
                ", parkedCount=" + parkedCount +
                ", subscriberCount=" + subscriberCount +
                ", totalMessages=" + totalMessages +
                ", deadLetterCount=" + deadLetterCount +
                '}';
    }
}
