package com.enterprise.orchestration.dlq;

import com.enterprise.orchestration.core.ErrorKind;

import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Point-in-time view of a dead-letter queue: occupancy, lifetime counters and
 * breakdowns by failure kind, message type and recipient.
 */
public class DeadLetterQueueStatistics {

    private final int size;
    private final int capacity;
    private final int totalDeadLettered;
    private final int totalRemoved;
    private final Instant oldest;
    private final Instant newest;
    private final Map<ErrorKind, Integer> byErrorKind;
    private final Map<String, Integer> byMessageType;
    private final Map<String, Integer> byRecipient;

    private DeadLetterQueueStatistics(int size, int capacity, int totalDeadLettered, int totalRemoved,
                                      Instant oldest, Instant newest, Map<ErrorKind, Integer> byErrorKind,
                                      Map<String, Integer> byMessageType, Map<String, Integer> byRecipient) {
        this.size = size;
        this.capacity = capacity;
        this.totalDeadLettered = totalDeadLettered;
        this.totalRemoved = totalRemoved;
        this.oldest = oldest;
        this.newest = newest;
        this.byErrorKind = Collections.unmodifiableMap(byErrorKind);
        this.byMessageType = Collections.unmodifiableMap(byMessageType);
        this.byRecipient = Collections.unmodifiableMap(byRecipient);
    }

    static DeadLetterQueueStatistics of(Collection<DeadLetterEntry> entries, int capacity,
                                        int totalDeadLettered, int totalRemoved) {
        Map<ErrorKind, Integer> byErrorKind = new EnumMap<>(ErrorKind.class);
        Map<String, Integer> byMessageType = new TreeMap<>();
        Map<String, Integer> byRecipient = new TreeMap<>();
        Instant oldest = null;
        Instant newest = null;

        for (DeadLetterEntry entry : entries) {
            byErrorKind.merge(entry.getErrorKind(), 1, Integer::sum);
            byMessageType.merge(entry.getMessageType(), 1, Integer::sum);
            byRecipient.merge(entry.getRecipient(), 1, Integer::sum);

            Instant at = entry.getDeadLetteredAt();
            if (oldest == null || at.isBefore(oldest)) {
                oldest = at;
            }
            if (newest == null || at.isAfter(newest)) {
                newest = at;
            }
        }
        return new DeadLetterQueueStatistics(entries.size(), capacity, totalDeadLettered, totalRemoved,
                                             oldest, newest, byErrorKind, byMessageType, byRecipient);
    }

    public int getSize() { return size; }

    public int getCapacity() { return capacity; }

    /**
     * Entries accepted since this queue instance was opened
     */
    public int getTotalDeadLettered() { return totalDeadLettered; }

    public int getTotalRemoved() { return totalRemoved; }

    /**
     * Occupancy as a percentage of capacity
     */
    public double getUtilization() {
        return capacity > 0 ? size * 100.0 / capacity : 0.0;
    }

    /** Null when the queue is empty */
    public Instant getOldest() { return oldest; }

    /** Null when the queue is empty */
    public Instant getNewest() { return newest; }

    public Map<ErrorKind, Integer> getByErrorKind() { return byErrorKind; }

    public Map<String, Integer> getByMessageType() { return byMessageType; }

    public Map<String, Integer> getByRecipient() { return byRecipient; }

    @Override
    public String toString() {
        return "DeadLetterQueueStatistics{" +
                "size=" + size +
                ", capacity=" + capacity +
                ", totalDeadLettered=" + totalDeadLettered +
                ", totalRemoved=" + totalRemoved +
                ", byErrorKind=" + byErrorKind +
                ", byMessageType=" + byMessageType +
                '}';
    }
}
