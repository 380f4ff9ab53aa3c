package com.enterprise.orchestration.dlq;

import com.enterprise.orchestration.exception.StateStoreException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.mapdb.DB;
import org.mapdb.DBMaker;
import org.mapdb.Serializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Dead-letter queue persisted in a MapDB file. Each entry is a JSON document
 * keyed by message id, so dead letters survive a restart of the orchestrator.
 */
public class MapDBDeadLetterQueue extends AbstractDeadLetterQueue {

    private static final Logger logger = LoggerFactory.getLogger(MapDBDeadLetterQueue.class);

    private final DB db;
    private final Map<String, String> deadLetters;
    private final ObjectMapper objectMapper = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    public MapDBDeadLetterQueue(String dbPath, int maxCapacity, boolean retentionEnabled, Duration retention) {
        super(maxCapacity, retentionEnabled, retention);
        this.db = DBMaker.fileDB(new File(dbPath))
            .fileMmapEnableIfSupported()
            .transactionEnable()
            .closeOnJvmShutdown()
            .make();
        this.deadLetters = db.hashMap("deadLetters", Serializer.STRING, Serializer.STRING).createOrOpen();

        logger.info("MapDB dead letter queue opened at {} with {} entries (capacity {})",
                   dbPath, deadLetters.size(), maxCapacity);
    }

    @Override
    protected int storedCount() {
        return deadLetters.size();
    }

    @Override
    protected Optional<DeadLetterEntry> read(String messageId) {
        String json = deadLetters.get(messageId);
        return json != null ? decode(messageId, json) : Optional.empty();
    }

    @Override
    protected Collection<DeadLetterEntry> readAll() {
        List<DeadLetterEntry> entries = new ArrayList<>(deadLetters.size());
        for (Map.Entry<String, String> stored : deadLetters.entrySet()) {
            decode(stored.getKey(), stored.getValue()).ifPresent(entries::add);
        }
        return entries;
    }

    @Override
    protected void write(DeadLetterEntry entry) {
        try {
            deadLetters.put(entry.getMessageId(), objectMapper.writeValueAsString(entry));
        } catch (JsonProcessingException e) {
            throw new StateStoreException("Cannot serialize dead letter " + entry.getMessageId(), e);
        }
    }

    @Override
    protected boolean delete(String messageId) {
        return deadLetters.remove(messageId) != null;
    }

    @Override
    protected void deleteAll() {
        deadLetters.clear();
    }

    @Override
    protected void commit() {
        db.commit();
    }

    @Override
    protected void rollback() {
        db.rollback();
    }

    @Override
    public void close() {
        if (db.isClosed()) {
            return;
        }
        db.close();
        logger.info("MapDB dead letter queue closed");
    }

    // Unreadable documents are skipped rather than failing the whole listing
    private Optional<DeadLetterEntry> decode(String messageId, String json) {
        try {
            return Optional.of(objectMapper.readValue(json, DeadLetterEntry.class));
        } catch (JsonProcessingException e) {
            logger.error("Skipping unreadable dead letter {}", messageId, e);
            return Optional.empty();
        }
    }
}
