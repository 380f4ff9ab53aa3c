package com.enterprise.orchestration.core;

import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Source of worker snapshots, supplied by the team-management collaborator.
 * Consulted at scheduling and broadcast time, never cached by the core.
 */
@FunctionalInterface
public interface WorkerRoster {

    /**
     * Current snapshot of all known workers, in a stable order
     */
    List<WorkerDescriptor> snapshot();

    default List<String> workerIds() {
        return snapshot().stream().map(WorkerDescriptor::getId).collect(Collectors.toList());
    }

    static WorkerRoster empty() {
        return () -> List.of();
    }

    static WorkerRoster of(Collection<WorkerDescriptor> workers) {
        List<WorkerDescriptor> copy = List.copyOf(workers);
        return () -> copy;
    }
}
