package com.enterprise.orchestration.core;

import java.util.Optional;

/**
 * Outcome of scoring a task against the candidate workers
 */
public class Assignment {

    private final String taskId;
    private final String workerId;
    private final double score;
    private final String reasoning;

    public Assignment(String taskId, String workerId, double score, String reasoning) {
        this.taskId = taskId;
        this.workerId = workerId;
        this.score = score;
        this.reasoning = reasoning;
    }

    public static Assignment unassigned(String taskId) {
        return new Assignment(taskId, null, 0.0, "No suitable agent found");
    }

    public String getTaskId() { return taskId; }

    public Optional<String> getWorkerId() { return Optional.ofNullable(workerId); }

    public double getScore() { return score; }

    public String getReasoning() { return reasoning; }

    public boolean isAssigned() {
        return workerId != null;
    }

    @Override
    public String toString() {
        return "Assignment{" +
                "taskId='" + taskId + '\'' +
                ", workerId='" + workerId + '\'' +
                ", score=" + score +
                '}';
    }
}
