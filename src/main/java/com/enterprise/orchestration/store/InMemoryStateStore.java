package com.enterprise.orchestration.store;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Process-local store used when no database path is configured
 */
public class InMemoryStateStore implements StateStore {

    private final Map<String, StateRecord> states = new ConcurrentHashMap<>();
    private final Map<String, WorkflowRecord> workflows = new ConcurrentHashMap<>();
    private final List<ResultRecord> results = new CopyOnWriteArrayList<>();

    @Override
    public void saveState(StateRecord record) {
        states.put(record.getKey(), record);
    }

    @Override
    public Optional<StateRecord> loadState(String key) {
        return Optional.ofNullable(states.get(key));
    }

    @Override
    public boolean deleteState(String key) {
        return states.remove(key) != null;
    }

    @Override
    public List<String> listStateKeys() {
        return new ArrayList<>(states.keySet());
    }

    @Override
    public void saveWorkflow(WorkflowRecord record) {
        workflows.put(record.getId(), record);
    }

    @Override
    public Optional<WorkflowRecord> loadWorkflow(String workflowId) {
        return Optional.ofNullable(workflows.get(workflowId));
    }

    @Override
    public void saveResult(ResultRecord record) {
        results.add(record);
    }

    @Override
    public List<ResultRecord> loadResults(String workerId) {
        return results.stream()
            .filter(r -> workerId.equals(r.getWorkerId()))
            .sorted(Comparator.comparing(ResultRecord::getTimestamp))
            .collect(Collectors.toList());
    }

    @Override
    public void close() {
        // nothing to release
    }
}
