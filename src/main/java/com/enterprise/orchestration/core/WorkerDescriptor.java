package com.enterprise.orchestration.core;

import com.enterprise.orchestration.exception.ValidationException;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Snapshot of a worker as reported by the team-management collaborator.
 * Read-only to the orchestration core.
 */
public final class WorkerDescriptor {

    private final String id;
    private final String role;
    private final Set<String> capabilities;
    private final int currentLoad;
    private final WorkerStatus status;

    public WorkerDescriptor(String id, String role, Set<String> capabilities, int currentLoad, WorkerStatus status) {
        if (id == null || id.isBlank()) {
            throw new ValidationException("Worker id is required");
        }
        if (currentLoad < 0 || currentLoad > 100) {
            throw new ValidationException("Worker load must be between 0 and 100: " + currentLoad);
        }
        this.id = id;
        this.role = role;
        this.capabilities = capabilities != null
            ? Collections.unmodifiableSet(new LinkedHashSet<>(capabilities))
            : Collections.emptySet();
        this.currentLoad = currentLoad;
        this.status = status != null ? status : WorkerStatus.IDLE;
    }

    public static WorkerDescriptor idle(String id, String role, Set<String> capabilities) {
        return new WorkerDescriptor(id, role, capabilities, 0, WorkerStatus.IDLE);
    }

    public String getId() { return id; }

    public String getRole() { return role; }

    public Set<String> getCapabilities() { return capabilities; }

    public int getCurrentLoad() { return currentLoad; }

    public WorkerStatus getStatus() { return status; }

    public boolean isOffline() {
        return status == WorkerStatus.OFFLINE;
    }

    public WorkerDescriptor withLoad(int load) {
        return new WorkerDescriptor(id, role, capabilities, load, status);
    }

    public WorkerDescriptor withStatus(WorkerStatus newStatus) {
        return new WorkerDescriptor(id, role, capabilities, currentLoad, newStatus);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        WorkerDescriptor that = (WorkerDescriptor) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "WorkerDescriptor{" +
                "id='" + id + '\'' +
                ", role='" + role + '\'' +
                ", load=" + currentLoad +
                ", status=" + status +
                '}';
    }
}
