package com.enterprise.orchestration.core;

/**
 * Represents the status of a task in the task graph
 */
public enum TaskStatus {
    PENDING,        // Waiting for its dependencies or for a worker
    IN_PROGRESS,    // Assigned to a worker and running
    COMPLETED,      // Finished successfully
    FAILED,         // Failed or cancelled, never retried by the scheduler
    BLOCKED;        // A dependency failed

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
