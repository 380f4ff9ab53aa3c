package com.enterprise.orchestration.exception;

/**
 * Exception thrown when a requested task is not part of the task graph
 */
public class TaskNotFoundException extends OrchestrationException {
    
    private final String taskId;
    
    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId);
        this.taskId = taskId;
    }
    
    public String getTaskId() {
        return taskId;
    }
}
