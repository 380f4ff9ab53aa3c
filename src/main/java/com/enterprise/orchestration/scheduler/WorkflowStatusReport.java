package com.enterprise.orchestration.scheduler;

import com.enterprise.orchestration.core.TaskStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate view over every task the scheduler currently tracks
 */
public class WorkflowStatusReport {

    private final Map<TaskStatus, Long> taskCountsByStatus;
    private final long totalTasks;
    private final int progress;
    private final List<String> activeWorkflows;
    private final Instant timestamp;

    public WorkflowStatusReport(Map<TaskStatus, Long> taskCountsByStatus, List<String> activeWorkflows,
                                Instant timestamp) {
        EnumMap<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, taskCountsByStatus.getOrDefault(status, 0L));
        }
        this.taskCountsByStatus = Collections.unmodifiableMap(counts);
        this.totalTasks = counts.values().stream().mapToLong(Long::longValue).sum();
        long completed = counts.get(TaskStatus.COMPLETED);
        this.progress = totalTasks > 0 ? (int) Math.round(completed * 100.0 / totalTasks) : 0;
        this.activeWorkflows = Collections.unmodifiableList(activeWorkflows);
        this.timestamp = timestamp;
    }

    public long getTotalTasks() { return totalTasks; }

    public long getCompletedTasks() { return taskCountsByStatus.get(TaskStatus.COMPLETED); }

    public long getPendingTasks() { return taskCountsByStatus.get(TaskStatus.PENDING); }

    public long getInProgressTasks() { return taskCountsByStatus.get(TaskStatus.IN_PROGRESS); }

    public long getFailedTasks() { return taskCountsByStatus.get(TaskStatus.FAILED); }

    public long getBlockedTasks() { return taskCountsByStatus.get(TaskStatus.BLOCKED); }

    public Map<TaskStatus, Long> getTaskCountsByStatus() { return taskCountsByStatus; }

    /**
     * Completed share of all tracked tasks, as a rounded percentage
     */
    public int getProgress() { return progress; }

    /**
     * Ids of workflows that have not completed yet
     */
    public List<String> getActiveWorkflows() { return activeWorkflows; }

    public Instant getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return "WorkflowStatusReport{" +
                "totalTasks=" + totalTasks +
                ", progress=" + progress +
                "%, activeWorkflows=" + activeWorkflows.size() +
                ", counts=" + taskCountsByStatus +
                '}';
    }
}
