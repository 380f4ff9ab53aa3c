package com.enterprise.orchestration.scheduler;

import com.enterprise.orchestration.core.Task;
import com.enterprise.orchestration.core.TaskStatus;
import com.enterprise.orchestration.core.Workflow;
import com.enterprise.orchestration.core.WorkflowStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Point-in-time status of a single workflow
 */
public class WorkflowProgress {

    private final String workflowId;
    private final String description;
    private final String category;
    private final WorkflowStatus status;
    private final int totalTasks;
    private final int completedTasks;
    private final int pendingTasks;
    private final int failedTasks;
    private final int blockedTasks;
    private final int progress;
    private final String currentPhase;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;

    private WorkflowProgress(Workflow workflow) {
        this.workflowId = workflow.getId();
        this.description = workflow.getDescription();
        this.category = workflow.getCategory();
        this.status = workflow.getStatus();
        this.totalTasks = workflow.getTasks().size();
        this.completedTasks = count(workflow, TaskStatus.COMPLETED);
        this.pendingTasks = count(workflow, TaskStatus.PENDING);
        this.failedTasks = count(workflow, TaskStatus.FAILED);
        this.blockedTasks = count(workflow, TaskStatus.BLOCKED);
        this.progress = workflow.getProgress();
        this.currentPhase = workflow.getCurrentPhase();
        this.createdAt = workflow.getCreatedAt();
        this.startedAt = workflow.getStartedAt();
        this.completedAt = workflow.getCompletedAt();
    }

    public static WorkflowProgress of(Workflow workflow) {
        return new WorkflowProgress(workflow);
    }

    private static int count(Workflow workflow, TaskStatus status) {
        int count = 0;
        for (Task task : workflow.getTasks()) {
            if (task.getStatus() == status) {
                count++;
            }
        }
        return count;
    }

    public String getWorkflowId() { return workflowId; }

    public String getDescription() { return description; }

    public String getCategory() { return category; }

    public WorkflowStatus getStatus() { return status; }

    public int getTotalTasks() { return totalTasks; }

    public int getCompletedTasks() { return completedTasks; }

    public int getPendingTasks() { return pendingTasks; }

    public int getFailedTasks() { return failedTasks; }

    public int getBlockedTasks() { return blockedTasks; }

    public int getProgress() { return progress; }

    public String getCurrentPhase() { return currentPhase; }

    public Instant getCreatedAt() { return createdAt; }

    public Instant getStartedAt() { return startedAt; }

    public Instant getCompletedAt() { return completedAt; }

    /**
     * Shared-state form published under {@code workflow:<id>}
     */
    public Map<String, Object> toStateValue(Instant timestamp) {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("workflowId", workflowId);
        value.put("status", status.name());
        value.put("progress", progress);
        value.put("currentPhase", currentPhase);
        value.put("completedTasks", completedTasks);
        value.put("totalTasks", totalTasks);
        value.put("_timestamp", timestamp.toString());
        return value;
    }

    @Override
    public String toString() {
        return "WorkflowProgress{" +
                "workflowId='" + workflowId + '\'' +
                ", status=" + status +
                ", progress=" + progress +
                "%, currentPhase='" + currentPhase + '\'' +
                '}';
    }
}
