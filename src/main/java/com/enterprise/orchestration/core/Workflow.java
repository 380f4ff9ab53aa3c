package com.enterprise.orchestration.core;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Execution plan derived from one goal. Owns its tasks exclusively, in decomposition order.
 */
public class Workflow {

    private final String id;
    private final String description;
    private final String requesterId;
    private final String category;
    private final Complexity complexity;
    private final List<Task> tasks;
    private final Instant createdAt;

    private WorkflowStatus status;
    private Instant startedAt;
    private Instant completedAt;

    public Workflow(String id, String description, String requesterId, String category,
                    Complexity complexity, List<Task> tasks, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "Workflow id cannot be null");
        this.description = description;
        this.requesterId = requesterId;
        this.category = category;
        this.complexity = complexity != null ? complexity : Complexity.MEDIUM;
        this.tasks = new ArrayList<>(tasks);
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.status = WorkflowStatus.CREATED;
    }

    public String getId() { return id; }

    public String getDescription() { return description; }

    public String getRequesterId() { return requesterId; }

    public String getCategory() { return category; }

    public Complexity getComplexity() { return complexity; }

    public List<Task> getTasks() { return Collections.unmodifiableList(tasks); }

    public Instant getCreatedAt() { return createdAt; }

    public synchronized WorkflowStatus getStatus() { return status; }

    public synchronized Instant getStartedAt() { return startedAt; }

    public synchronized Instant getCompletedAt() { return completedAt; }

    /**
     * Moves a created workflow to IN_PROGRESS.
     *
     * @return true if the status changed
     */
    public synchronized boolean start(Instant now) {
        if (status != WorkflowStatus.CREATED) {
            return false;
        }
        status = WorkflowStatus.IN_PROGRESS;
        startedAt = now;
        return true;
    }

    /**
     * Completes the workflow once every task has completed.
     *
     * @return true if the status changed
     */
    public synchronized boolean completeIfFinished(Instant now) {
        if (status == WorkflowStatus.COMPLETED || !isFinished()) {
            return false;
        }
        if (startedAt == null) {
            startedAt = now;
        }
        status = WorkflowStatus.COMPLETED;
        completedAt = now;
        return true;
    }

    @JsonIgnore
    public boolean isFinished() {
        return !tasks.isEmpty() && tasks.stream().allMatch(t -> t.getStatus() == TaskStatus.COMPLETED);
    }

    /**
     * Percentage of completed tasks, rounded
     */
    @JsonIgnore
    public int getProgress() {
        if (tasks.isEmpty()) {
            return 0;
        }
        long completed = tasks.stream().filter(t -> t.getStatus() == TaskStatus.COMPLETED).count();
        return (int) Math.round(completed * 100.0 / tasks.size());
    }

    /**
     * The phase of the first task that has not completed yet, or null when all are done
     */
    @JsonIgnore
    public String getCurrentPhase() {
        return tasks.stream()
            .filter(t -> t.getStatus() != TaskStatus.COMPLETED)
            .map(t -> String.valueOf(t.getMetadata().getOrDefault(Task.MetadataKeys.PHASE, t.getType())))
            .findFirst()
            .orElse(null);
    }

    @Override
    public String toString() {
        return "Workflow{" +
                "id='" + id + '\'' +
                ", category='" + category + '\'' +
                ", tasks=" + tasks.size() +
                ", status=" + getStatus() +
                '}';
    }
}
