package com.enterprise.orchestration.core;

import com.enterprise.orchestration.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * A single unit of work in a workflow's task graph.
 * <p>
 * Tasks are created by the scheduler during decomposition and only mutated by it.
 * Status transitions follow {@code PENDING -> IN_PROGRESS -> COMPLETED|FAILED},
 * with {@code BLOCKED} entered when a dependency fails and left through {@link #reset()}.
 */
public class Task {

    public static final int MIN_PRIORITY = 1;
    public static final int MAX_PRIORITY = 5;

    private final String id;
    private final String type;
    private final String description;
    private final int priority;
    private final Complexity complexity;
    private final Set<String> dependencies;
    private final Instant createdAt;
    private final Duration estimatedDuration;
    private final Map<String, Object> metadata;

    private String assignedWorker;
    private TaskStatus status;
    private int progress;
    private Object result;
    private ErrorInfo error;
    private Instant startedAt;
    private Instant completedAt;

    public Task(String id,
                String type,
                String description,
                int priority,
                Complexity complexity,
                Set<String> dependencies,
                Instant createdAt,
                Duration estimatedDuration,
                Map<String, Object> metadata) {
        this.id = id;
        this.type = type;
        this.description = description;
        this.priority = priority;
        this.complexity = complexity != null ? complexity : Complexity.MEDIUM;
        this.dependencies = dependencies != null ? new LinkedHashSet<>(dependencies) : new LinkedHashSet<>();
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.estimatedDuration = estimatedDuration != null ? estimatedDuration : Duration.ZERO;
        this.metadata = metadata != null ? new HashMap<>(metadata) : new HashMap<>();
        this.status = TaskStatus.PENDING;
    }

    public String getId() { return id; }

    public String getType() { return type; }

    public String getDescription() { return description; }

    public int getPriority() { return priority; }

    public Complexity getComplexity() { return complexity; }

    public Set<String> getDependencies() { return Collections.unmodifiableSet(dependencies); }

    public Instant getCreatedAt() { return createdAt; }

    public Duration getEstimatedDuration() { return estimatedDuration; }

    public Map<String, Object> getMetadata() { return Collections.unmodifiableMap(metadata); }

    public synchronized String getAssignedWorker() { return assignedWorker; }

    public synchronized TaskStatus getStatus() { return status; }

    public synchronized int getProgress() { return progress; }

    public synchronized Object getResult() { return result; }

    public synchronized ErrorInfo getError() { return error; }

    public synchronized Instant getStartedAt() { return startedAt; }

    public synchronized Instant getCompletedAt() { return completedAt; }

    @JsonIgnore
    public String getWorkflowId() {
        Object workflowId = metadata.get(MetadataKeys.WORKFLOW_ID);
        return workflowId != null ? workflowId.toString() : null;
    }

    @JsonIgnore
    public String getPreferredRole() {
        Object role = metadata.get(MetadataKeys.PREFERRED_ROLE);
        return role != null ? role.toString() : null;
    }

    /**
     * Whether the task is pending and every dependency is in the given completed set
     */
    public synchronized boolean isReady(Set<String> completedTaskIds) {
        return status == TaskStatus.PENDING && completedTaskIds.containsAll(dependencies);
    }

    /**
     * Starts the task on the given worker
     */
    public synchronized void start(String workerId, Instant now) {
        if (status != TaskStatus.PENDING) {
            throw new IllegalStateException("Cannot start task " + id + " in status " + status);
        }
        this.assignedWorker = workerId;
        this.status = TaskStatus.IN_PROGRESS;
        this.startedAt = now;
        this.progress = Math.max(progress, 5);
    }

    /**
     * Records worker-reported progress. Progress is clamped to 0-100 and never decreases.
     *
     * @return true if the stored progress changed
     */
    public synchronized boolean updateProgress(int reported) {
        if (status != TaskStatus.IN_PROGRESS) {
            return false;
        }
        int clamped = Math.max(0, Math.min(100, reported));
        if (clamped <= progress) {
            return false;
        }
        progress = clamped;
        return true;
    }

    public synchronized void complete(Object result, Instant now) {
        if (status != TaskStatus.IN_PROGRESS) {
            throw new IllegalStateException("Cannot complete task " + id + " in status " + status);
        }
        this.status = TaskStatus.COMPLETED;
        this.result = result;
        this.progress = 100;
        this.completedAt = now;
    }

    public synchronized void fail(ErrorInfo error, Instant now) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Cannot fail task " + id + " in status " + status);
        }
        this.status = TaskStatus.FAILED;
        this.error = error;
        this.completedAt = now;
    }

    public synchronized void block(ErrorInfo reason) {
        if (status != TaskStatus.PENDING && status != TaskStatus.IN_PROGRESS) {
            throw new IllegalStateException("Cannot block task " + id + " in status " + status);
        }
        this.status = TaskStatus.BLOCKED;
        this.error = reason;
    }

    /**
     * Returns the task to PENDING with no worker so it can be scheduled again
     */
    public synchronized void reset() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Cannot reset task " + id + " in status " + status);
        }
        this.status = TaskStatus.PENDING;
        this.assignedWorker = null;
        this.progress = 0;
        this.startedAt = null;
        this.error = null;
    }

    @Override
    public String toString() {
        return "Task{" +
                "id='" + id + '\'' +
                ", type='" + type + '\'' +
                ", priority=" + priority +
                ", status=" + getStatus() +
                ", assignedWorker='" + getAssignedWorker() + '\'' +
                '}';
    }

    /**
     * Well-known metadata keys written during decomposition
     */
    public static final class MetadataKeys {
        public static final String WORKFLOW_ID = "workflowId";
        public static final String PHASE = "phase";
        public static final String PHASE_INDEX = "phaseIndex";
        public static final String PREFERRED_ROLE = "preferredRole";
        public static final String CATEGORY = "category";
        public static final String ESTIMATED_HOURS = "estimatedHours";

        private MetadataKeys() {
        }
    }

    /**
     * Builder for creating Task instances
     */
    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String type;
        private String description;
        private int priority = 3;
        private Complexity complexity = Complexity.MEDIUM;
        private Set<String> dependencies = new LinkedHashSet<>();
        private Instant createdAt = Instant.now();
        private Duration estimatedDuration = Duration.ZERO;
        private Map<String, Object> metadata = new HashMap<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder complexity(Complexity complexity) {
            this.complexity = complexity;
            return this;
        }

        public Builder dependencies(Set<String> dependencies) {
            this.dependencies = new LinkedHashSet<>(dependencies);
            return this;
        }

        public Builder dependsOn(String taskId) {
            this.dependencies.add(taskId);
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder estimatedDuration(Duration estimatedDuration) {
            this.estimatedDuration = estimatedDuration;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = new HashMap<>(metadata);
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(key, value);
            return this;
        }

        public Task build() {
            if (id == null || id.isBlank()) {
                throw new ValidationException("Task id is required");
            }
            if (type == null || type.isBlank()) {
                throw new ValidationException("Task type is required");
            }
            if (priority < MIN_PRIORITY || priority > MAX_PRIORITY) {
                throw new ValidationException("Task priority must be between " + MIN_PRIORITY
                        + " and " + MAX_PRIORITY + ": " + priority);
            }
            if (dependencies.contains(id)) {
                throw new ValidationException("Task " + id + " cannot depend on itself");
            }
            if (estimatedDuration != null && estimatedDuration.isNegative()) {
                throw new ValidationException("Estimated duration cannot be negative");
            }
            return new Task(id, type, description, priority, complexity, dependencies,
                            createdAt, estimatedDuration, metadata);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
