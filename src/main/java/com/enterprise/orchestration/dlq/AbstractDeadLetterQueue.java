package com.enterprise.orchestration.dlq;

import com.enterprise.orchestration.bus.Message;
import com.enterprise.orchestration.exception.StateStoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Capacity, retention, ordering and statistics shared by the dead-letter queue
 * implementations. Subclasses supply the storage; every storage call runs under
 * this class's read/write lock, and writes are followed by {@link #commit()} or,
 * on failure, {@link #rollback()}.
 */
public abstract class AbstractDeadLetterQueue implements DeadLetterQueue {

    private static final Logger logger = LoggerFactory.getLogger(AbstractDeadLetterQueue.class);

    private static final Comparator<DeadLetterEntry> OLDEST_FIRST =
        Comparator.comparing(DeadLetterEntry::getDeadLetteredAt).thenComparing(DeadLetterEntry::getMessageId);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final int maxCapacity;
    private final Duration retention;
    private final AtomicInteger totalDeadLettered = new AtomicInteger();
    private final AtomicInteger totalRemoved = new AtomicInteger();

    /**
     * @param retention how long entries are kept; ignored unless {@code retentionEnabled}
     */
    protected AbstractDeadLetterQueue(int maxCapacity, boolean retentionEnabled, Duration retention) {
        if (maxCapacity <= 0) {
            throw new IllegalArgumentException("Dead letter capacity must be positive: " + maxCapacity);
        }
        this.maxCapacity = maxCapacity;
        this.retention = retentionEnabled ? retention : null;
    }

    protected abstract int storedCount();

    protected abstract Optional<DeadLetterEntry> read(String messageId);

    protected abstract Collection<DeadLetterEntry> readAll();

    protected abstract void write(DeadLetterEntry entry);

    protected abstract boolean delete(String messageId);

    protected abstract void deleteAll();

    protected void commit() {
    }

    protected void rollback() {
    }

    @Override
    public boolean add(Message message, String reason, Instant deadLetteredAt) {
        DeadLetterEntry entry = DeadLetterEntry.of(message, reason, deadLetteredAt);
        Boolean stored = mutate("add " + message.getId(), Boolean.FALSE, () -> {
            if (storedCount() >= maxCapacity) {
                logger.warn("Dead letter queue full ({}), dropping message {} ({}) to {}",
                           maxCapacity, message.getId(), message.getType(), message.getTo());
                return Boolean.FALSE;
            }
            write(entry);
            return Boolean.TRUE;
        });
        if (stored) {
            totalDeadLettered.incrementAndGet();
            logger.info("Dead-lettered message {} ({}) to {} after {} attempts: {}",
                       message.getId(), message.getType(), message.getTo(), entry.getRetryCount(), reason);
        }
        return stored;
    }

    @Override
    public Optional<DeadLetterEntry> get(String messageId) {
        lock.readLock().lock();
        try {
            return read(messageId);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<DeadLetterEntry> list() {
        return snapshot();
    }

    @Override
    public List<DeadLetterEntry> list(int offset, int limit) {
        if (offset < 0 || limit < 0) {
            throw new IllegalArgumentException("Offset and limit cannot be negative");
        }
        return snapshot().stream().skip(offset).limit(limit).collect(Collectors.toList());
    }

    @Override
    public boolean remove(String messageId) {
        boolean removed = mutate("remove " + messageId, Boolean.FALSE, () -> delete(messageId));
        if (removed) {
            totalRemoved.incrementAndGet();
            logger.debug("Removed dead letter {}", messageId);
        }
        return removed;
    }

    @Override
    public int clear() {
        int cleared = mutate("clear", 0, () -> {
            int count = storedCount();
            deleteAll();
            return count;
        });
        totalRemoved.addAndGet(cleared);
        if (cleared > 0) {
            logger.info("Cleared {} dead letters", cleared);
        }
        return cleared;
    }

    @Override
    public int size() {
        lock.readLock().lock();
        try {
            return storedCount();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean isFull() {
        return size() >= maxCapacity;
    }

    @Override
    public DeadLetterQueueStatistics getStatistics() {
        return DeadLetterQueueStatistics.of(snapshot(), maxCapacity, totalDeadLettered.get(), totalRemoved.get());
    }

    @Override
    public int purgeExpired(Instant now) {
        if (retention == null) {
            return 0;
        }
        Instant cutoff = now.minus(retention);
        int purged = mutate("purge", 0, () -> {
            List<String> expired = readAll().stream()
                .filter(entry -> entry.getDeadLetteredAt().isBefore(cutoff))
                .map(DeadLetterEntry::getMessageId)
                .collect(Collectors.toList());
            expired.forEach(this::delete);
            return expired.size();
        });
        totalRemoved.addAndGet(purged);
        if (purged > 0) {
            logger.info("Purged {} dead letters older than {}", purged, retention);
        }
        return purged;
    }

    public int getMaxCapacity() {
        return maxCapacity;
    }

    private List<DeadLetterEntry> snapshot() {
        lock.readLock().lock();
        try {
            List<DeadLetterEntry> entries = new ArrayList<>(readAll());
            entries.sort(OLDEST_FIRST);
            return entries;
        } finally {
            lock.readLock().unlock();
        }
    }

    // Storage failures are logged and reported through the fallback value
    private <T> T mutate(String action, T fallback, Supplier<T> operation) {
        lock.writeLock().lock();
        try {
            T result = operation.get();
            commit();
            return result;
        } catch (StateStoreException e) {
            logger.error("Dead letter queue failed to {}", action, e);
            rollback();
            return fallback;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
