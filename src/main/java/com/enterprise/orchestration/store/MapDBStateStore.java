package com.enterprise.orchestration.store;

import com.enterprise.orchestration.exception.StateStoreException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.mapdb.DB;
import org.mapdb.DBMaker;
import org.mapdb.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.*;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;

/**
 * MapDB-based persistent store.
 * Each record is kept as a JSON document in its own hash map and every write is committed individually.
 */
public class MapDBStateStore implements StateStore {
    
    private static final Logger logger = LoggerFactory.getLogger(MapDBStateStore.class);
    
    private final DB db;
    private final ObjectMapper objectMapper;
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    
    // MapDB collections
    private final Map<String, String> stateStorage;
    private final Map<String, String> workflowStorage;
    private final Map<String, String> resultStorage;
    
    public MapDBStateStore(String dbPath) {
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        
        // Initialize MapDB
        this.db = DBMaker.fileDB(new File(dbPath))
            .fileMmapEnableIfSupported()
            .allocateStartSize(4 * 1024 * 1024)  // 4MB
            .allocateIncrement(4 * 1024 * 1024)  // 4MB
            .transactionEnable()
            .closeOnJvmShutdown()
            .make();
        
        // Initialize collections
        this.stateStorage = db.hashMap("states", Serializer.STRING, Serializer.STRING).createOrOpen();
        this.workflowStorage = db.hashMap("workflows", Serializer.STRING, Serializer.STRING).createOrOpen();
        this.resultStorage = db.hashMap("results", Serializer.STRING, Serializer.STRING).createOrOpen();
        
        logger.info("MapDBStateStore initialized with database at: {} ({} states, {} workflows)",
                   dbPath, stateStorage.size(), workflowStorage.size());
    }
    
    @Override
    public void saveState(StateRecord record) {
        write("state " + record.getKey(), () -> {
            stateStorage.put(record.getKey(), objectMapper.writeValueAsString(record));
            return null;
        });
        logger.debug("State {} saved at version {}", record.getKey(), record.getVersion());
    }
    
    @Override
    public Optional<StateRecord> loadState(String key) {
        return read(stateStorage, key, StateRecord.class);
    }
    
    @Override
    public boolean deleteState(String key) {
        Boolean removed = write("state " + key, () -> stateStorage.remove(key) != null);
        return Boolean.TRUE.equals(removed);
    }
    
    @Override
    public List<String> listStateKeys() {
        lock.readLock().lock();
        try {
            return new ArrayList<>(stateStorage.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }
    
    @Override
    public void saveWorkflow(WorkflowRecord record) {
        write("workflow " + record.getId(), () -> {
            workflowStorage.put(record.getId(), objectMapper.writeValueAsString(record));
            return null;
        });
        logger.debug("Workflow {} saved at version {}", record.getId(), record.getVersion());
    }
    
    @Override
    public Optional<WorkflowRecord> loadWorkflow(String workflowId) {
        return read(workflowStorage, workflowId, WorkflowRecord.class);
    }
    
    @Override
    public void saveResult(ResultRecord record) {
        String resultKey = record.getWorkerId() + ":" + record.getTaskId();
        write("result " + resultKey, () -> {
            resultStorage.put(resultKey, objectMapper.writeValueAsString(record));
            return null;
        });
    }
    
    @Override
    public List<ResultRecord> loadResults(String workerId) {
        String prefix = workerId + ":";
        lock.readLock().lock();
        try {
            return resultStorage.entrySet().stream()
                .filter(entry -> entry.getKey().startsWith(prefix))
                .map(entry -> deserialize(entry.getValue(), ResultRecord.class))
                .filter(Optional::isPresent)
                .map(Optional::get)
                .sorted(Comparator.comparing(ResultRecord::getTimestamp))
                .collect(Collectors.toList());
        } finally {
            lock.readLock().unlock();
        }
    }
    
    /**
     * Close the store and database
     */
    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            if (!db.isClosed()) {
                db.close();
            }
            logger.info("MapDBStateStore closed");
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    private <T> T write(String description, StoreWrite<T> operation) {
        lock.writeLock().lock();
        try {
            T result = operation.apply();
            db.commit();
            return result;
        } catch (Exception e) {
            db.rollback();
            logger.error("Failed to write {}", description, e);
            throw new StateStoreException("Failed to write " + description, e);
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    private <T> Optional<T> read(Map<String, String> storage, String id, Class<T> type) {
        lock.readLock().lock();
        try {
            String json = storage.get(id);
            if (json == null) {
                return Optional.empty();
            }
            return deserialize(json, type);
        } finally {
            lock.readLock().unlock();
        }
    }
    
    private <T> Optional<T> deserialize(String json, Class<T> type) {
        try {
            return Optional.of(objectMapper.readValue(json, type));
        } catch (Exception e) {
            logger.error("Failed to deserialize {} record", type.getSimpleName(), e);
            return Optional.empty();
        }
    }
    
    @FunctionalInterface
    private interface StoreWrite<T> {
        T apply() throws Exception;
    }
}
