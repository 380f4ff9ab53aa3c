package com.enterprise.orchestration.dlq;

import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Dead-letter queue held in process memory; entries are lost on restart
 */
public class InMemoryDeadLetterQueue extends AbstractDeadLetterQueue {

    private final Map<String, DeadLetterEntry> entries = new HashMap<>();

    public InMemoryDeadLetterQueue(int maxCapacity, boolean retentionEnabled, Duration retention) {
        super(maxCapacity, retentionEnabled, retention);
    }

    @Override
    protected int storedCount() {
        return entries.size();
    }

    @Override
    protected Optional<DeadLetterEntry> read(String messageId) {
        return Optional.ofNullable(entries.get(messageId));
    }

    @Override
    protected Collection<DeadLetterEntry> readAll() {
        return entries.values();
    }

    @Override
    protected void write(DeadLetterEntry entry) {
        entries.put(entry.getMessageId(), entry);
    }

    @Override
    protected boolean delete(String messageId) {
        return entries.remove(messageId) != null;
    }

    @Override
    protected void deleteAll() {
        entries.clear();
    }

    @Override
    public void close() {
        clear();
    }
}
