package com.enterprise.orchestration.sync;

import com.enterprise.orchestration.events.EventPublisher;
import com.enterprise.orchestration.events.EventType;
import com.enterprise.orchestration.events.OrchestrationEvent;
import com.enterprise.orchestration.exception.LockTimeoutException;
import com.enterprise.orchestration.exception.StateConflictException;
import com.enterprise.orchestration.exception.StateStoreException;
import com.enterprise.orchestration.exception.ValidationException;
import com.enterprise.orchestration.store.StateRecord;
import com.enterprise.orchestration.store.StateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Versioned key/value state shared between workers.
 * <p>
 * Every accepted write takes the per-key lock, assigns a version one above the highest version
 * seen locally or in the store, persists the record and only then updates the local view.
 * Writes based on a stale version are either rejected ({@link #compareAndSet}) or reconciled
 * with a {@link ConflictStrategy} and written back with a fresh version.
 */
public class StateSynchronizer {

    private static final Logger logger = LoggerFactory.getLogger(StateSynchronizer.class);

    private final StateStore store;
    private final EventPublisher events;
    private final Duration lockTimeout;
    private final Duration manualResolutionTimeout;
    private final ConflictStrategy defaultStrategy;
    private final Clock clock;

    private final Map<String, StateRecord> localStates = new ConcurrentHashMap<>();
    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    // Last version of deleted keys, so a recreated key keeps counting upwards
    private final Map<String, Long> tombstones = new ConcurrentHashMap<>();
    private final Map<String, ConflictResolutionRequest> pendingConflicts = new ConcurrentHashMap<>();

    public StateSynchronizer(StateStore store, EventPublisher events, Duration lockTimeout,
                             Duration manualResolutionTimeout, ConflictStrategy defaultStrategy) {
        this(store, events, lockTimeout, manualResolutionTimeout, defaultStrategy, Clock.systemUTC());
    }

    public StateSynchronizer(StateStore store, EventPublisher events, Duration lockTimeout,
                             Duration manualResolutionTimeout, ConflictStrategy defaultStrategy, Clock clock) {
        this.store = Objects.requireNonNull(store, "State store cannot be null");
        this.events = Objects.requireNonNull(events, "Event publisher cannot be null");
        this.lockTimeout = lockTimeout;
        this.manualResolutionTimeout = manualResolutionTimeout;
        this.defaultStrategy = defaultStrategy != null ? defaultStrategy : ConflictStrategy.MERGE;
        this.clock = clock;
    }

    /**
     * Unconditional write.
     *
     * @return the version assigned to the write
     * @throws LockTimeoutException if the key stays locked past the lock timeout
     */
    public long setState(String key, Object value, String writerId) throws LockTimeoutException {
        validateKey(key, writerId);
        ReentrantLock lock = acquire(key);
        try {
            return write(key, value, writerId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Write that only succeeds if the stored version still equals {@code baseVersion}.
     *
     * @throws StateConflictException if another write happened since {@code baseVersion}
     */
    public long compareAndSet(String key, Object value, String writerId, long baseVersion)
            throws LockTimeoutException, StateConflictException {
        validateKey(key, writerId);
        ReentrantLock lock = acquire(key);
        try {
            long current = currentVersion(key);
            if (current != baseVersion) {
                throw new StateConflictException(key, baseVersion, current);
            }
            return write(key, value, writerId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Write based on {@code baseVersion}. On a version mismatch the value is reconciled with the
     * stored one using the given strategy and the resolution is written with a fresh version.
     */
    public long setState(String key, Object value, String writerId, long baseVersion, ConflictStrategy strategy)
            throws LockTimeoutException {
        validateKey(key, writerId);
        StateRecord stored;
        ReentrantLock lock = acquire(key);
        try {
            long current = currentVersion(key);
            if (current == baseVersion) {
                return write(key, value, writerId);
            }
            stored = latestRecord(key);
            logger.info("Version conflict on {}: base {} but found {}, resolving with {}",
                       key, baseVersion, current, strategy);
        } finally {
            lock.unlock();
        }

        // Resolution may wait for a manual resolver, so it runs without the key lock
        Object remote = stored != null ? stored.getValue() : null;
        Object resolved = resolveConflict(key, value, remote, strategy != null ? strategy : defaultStrategy);
        return setState(key, resolved, writerId);
    }

    /**
     * Reconciles two divergent values.
     *
     * @param local  the value the caller is trying to write
     * @param remote the value currently stored
     */
    public Object resolveConflict(String key, Object local, Object remote, ConflictStrategy strategy) {
        Object resolved;
        ConflictStrategy applied = strategy;
        switch (strategy) {
            case MERGE:
                resolved = ConflictResolver.merge(local, remote, clock.instant());
                break;
            case LATEST:
                resolved = ConflictResolver.latest(local, remote);
                break;
            case MANUAL:
                Optional<Object> manual = awaitManualResolution(key, local, remote);
                if (manual.isPresent()) {
                    resolved = manual.get();
                } else {
                    resolved = ConflictResolver.latest(local, remote);
                    applied = ConflictStrategy.LATEST;
                }
                break;
            default:
                throw new IllegalStateException("Unsupported conflict strategy: " + strategy);
        }

        logger.debug("Conflict on {} resolved with {}", key, applied);
        events.publish(OrchestrationEvent.of(EventType.CONFLICT_RESOLVED, key,
            Map.of("strategy", strategy, "applied", applied)));
        return resolved;
    }

    /**
     * Completes a pending manual conflict.
     *
     * @return false if no such request is pending
     */
    public boolean resolveManualConflict(String requestId, Object value) {
        ConflictResolutionRequest request = pendingConflicts.get(requestId);
        return request != null && request.resolve(value);
    }

    public List<ConflictResolutionRequest> getPendingConflicts() {
        return new ArrayList<>(pendingConflicts.values());
    }

    /**
     * Most recently observed value; falls back to the store when the key is not known locally
     */
    public Optional<Object> getState(String key) {
        return getStateRecord(key).map(StateRecord::getValue);
    }

    public Optional<StateRecord> getStateRecord(String key) {
        StateRecord local = localStates.get(key);
        if (local != null) {
            return Optional.of(local);
        }
        Optional<StateRecord> stored = store.loadState(key);
        stored.ifPresent(record -> {
            if (adopt(record)) {
                logger.debug("State {} loaded from store at version {}", key, record.getVersion());
                events.publish(OrchestrationEvent.of(EventType.STATE_LOADED, key,
                    Map.of("version", record.getVersion(), "source", "load")));
            }
        });
        return stored.map(record -> localStates.getOrDefault(key, record));
    }

    /**
     * Removes a key locally and from the store
     *
     * @return true if the key existed
     */
    public boolean deleteState(String key) throws LockTimeoutException {
        ReentrantLock lock = acquire(key);
        try {
            long last = currentVersion(key);
            StateRecord removed = localStates.remove(key);
            boolean existed = store.deleteState(key) || removed != null;
            if (existed) {
                tombstones.put(key, last);
                logger.info("State {} deleted at version {}", key, last);
                events.publish(OrchestrationEvent.of(EventType.STATE_DELETED, key, Map.of("version", last)));
            }
            return existed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Re-reads every locally known key and adopts stored records with a strictly greater version.
     *
     * @return the number of keys that changed
     */
    public int reconcile() {
        int adopted = 0;
        for (String key : new ArrayList<>(localStates.keySet())) {
            try {
                Optional<StateRecord> stored = store.loadState(key);
                if (stored.isPresent() && adopt(stored.get())) {
                    adopted++;
                    events.publish(OrchestrationEvent.of(EventType.STATE_LOADED, key,
                        Map.of("version", stored.get().getVersion(), "source", "reconcile")));
                }
            } catch (StateStoreException e) {
                logger.warn("Failed to reconcile state {}: {}", key, e.getMessage());
            }
        }
        if (adopted > 0) {
            logger.info("Reconciliation adopted {} newer state records", adopted);
        }
        return adopted;
    }

    public List<StateSummary> getStateList() {
        return localStates.values().stream()
            .sorted(Comparator.comparing(StateRecord::getKey))
            .map(r -> new StateSummary(r.getKey(), r.getVersion(), r.getLastWriter(), r.getUpdatedAt()))
            .collect(Collectors.toList());
    }

    public StateStats getStateStats() {
        Collection<StateRecord> records = localStates.values();
        long totalVersions = records.stream().mapToLong(StateRecord::getVersion).sum();
        return new StateStats(records.size(), totalVersions);
    }

    public ConflictStrategy getDefaultStrategy() {
        return defaultStrategy;
    }

    private long write(String key, Object value, String writerId) {
        long version = currentVersion(key) + 1;
        StateRecord record = new StateRecord(key, value, version, writerId, clock.instant());
        store.saveState(record);
        localStates.put(key, record);
        tombstones.remove(key);

        logger.debug("State {} updated to version {} by {}", key, version, writerId);
        events.publish(OrchestrationEvent.of(EventType.STATE_UPDATED, key,
            Map.of("version", version, "writer", writerId)));
        return version;
    }

    private long currentVersion(String key) {
        StateRecord record = latestRecord(key);
        long version = record != null ? record.getVersion() : 0L;
        return Math.max(version, tombstones.getOrDefault(key, 0L));
    }

    private StateRecord latestRecord(String key) {
        StateRecord local = localStates.get(key);
        StateRecord stored = store.loadState(key).orElse(null);
        if (local == null) {
            return stored;
        }
        if (stored == null) {
            return local;
        }
        return stored.getVersion() > local.getVersion() ? stored : local;
    }

    /**
     * Replaces the local record if the candidate is strictly newer
     */
    private boolean adopt(StateRecord candidate) {
        boolean[] changed = new boolean[1];
        localStates.compute(candidate.getKey(), (k, existing) -> {
            if (existing == null || candidate.getVersion() > existing.getVersion()) {
                changed[0] = true;
                return candidate;
            }
            return existing;
        });
        return changed[0];
    }

    private Optional<Object> awaitManualResolution(String key, Object local, Object remote) {
        ConflictResolutionRequest request = new ConflictResolutionRequest(
            UUID.randomUUID().toString(), key, local, remote, clock.instant());
        pendingConflicts.put(request.getRequestId(), request);
        try {
            logger.info("Manual resolution {} requested for {}", request.getRequestId(), key);
            events.publish(OrchestrationEvent.of(EventType.CONFLICT_MANUAL_REQUESTED, key,
                Map.of("requestId", request.getRequestId(), "request", request)));

            Object value = request.getResolution().get(manualResolutionTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return Optional.ofNullable(value);
        } catch (TimeoutException e) {
            logger.warn("Manual resolution for {} timed out after {}, falling back to {}",
                       key, manualResolutionTimeout, ConflictStrategy.LATEST);
            events.publish(OrchestrationEvent.of(EventType.CONFLICT_MANUAL_TIMEOUT, key,
                Map.of("requestId", request.getRequestId(), "timeout", manualResolutionTimeout)));
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while waiting for manual resolution of {}", key);
            return Optional.empty();
        } catch (ExecutionException e) {
            logger.warn("Manual resolution for {} failed: {}", key, e.getMessage());
            return Optional.empty();
        } finally {
            request.abandon();
            pendingConflicts.remove(request.getRequestId());
        }
    }

    private ReentrantLock acquire(String key) throws LockTimeoutException {
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        boolean acquired;
        try {
            acquired = lock.tryLock(lockTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            acquired = false;
        }
        if (!acquired) {
            logger.warn("Timed out after {} waiting for lock on state {}", lockTimeout, key);
            events.publish(OrchestrationEvent.of(EventType.STATE_LOCK_TIMEOUT, key,
                Map.of("waitedMillis", lockTimeout.toMillis())));
            throw new LockTimeoutException(key, lockTimeout);
        }
        return lock;
    }

    private static void validateKey(String key, String writerId) {
        if (key == null || key.isBlank()) {
            throw new ValidationException("State key is required");
        }
        if (writerId == null || writerId.isBlank()) {
            throw new ValidationException("Writer id is required");
        }
    }
}
