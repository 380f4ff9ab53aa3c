package com.enterprise.orchestration.dlq;

import com.enterprise.orchestration.bus.Message;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Terminal store for messages that exhausted their delivery retries.
 * Entries are kept for inspection and are never redelivered.
 */
public interface DeadLetterQueue extends AutoCloseable {

    /**
     * Records a message whose last delivery attempt failed at {@code deadLetteredAt}
     *
     * @return false if the queue is full or the entry could not be stored
     */
    boolean add(Message message, String reason, Instant deadLetteredAt);

    Optional<DeadLetterEntry> get(String messageId);

    /**
     * All entries, oldest first
     */
    List<DeadLetterEntry> list();

    List<DeadLetterEntry> list(int offset, int limit);

    boolean remove(String messageId);

    /**
     * @return the number of entries removed
     */
    int clear();

    int size();

    boolean isFull();

    DeadLetterQueueStatistics getStatistics();

    /**
     * Drops entries older than the retention window, measured back from {@code now}.
     * Does nothing when retention is disabled.
     *
     * @return the number of entries removed
     */
    int purgeExpired(Instant now);

    @Override
    void close();
}
