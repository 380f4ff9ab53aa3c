package com.enterprise.orchestration.core;

import com.enterprise.orchestration.exception.ValidationException;

import java.util.Map;

/**
 * Result reported by a worker for an assigned task.
 * Built from the payload of a {@code task_result} message.
 */
public class TaskOutcome {

    private final String taskId;
    private final String workerId;
    private final boolean success;
    private final Object output;
    private final String error;

    private TaskOutcome(String taskId, String workerId, boolean success, Object output, String error) {
        this.taskId = taskId;
        this.workerId = workerId;
        this.success = success;
        this.output = output;
        this.error = error;
    }

    public static TaskOutcome success(String taskId, String workerId, Object output) {
        return new TaskOutcome(taskId, workerId, true, output, null);
    }

    public static TaskOutcome failure(String taskId, String workerId, String error) {
        return new TaskOutcome(taskId, workerId, false, null, error);
    }

    /**
     * Reads an outcome from a message payload of the form
     * {@code {taskId, success|status, output|result, error}}.
     */
    public static TaskOutcome fromPayload(String workerId, Object payload) {
        if (!(payload instanceof Map)) {
            throw new ValidationException("Task result payload must be an object");
        }
        Map<?, ?> map = (Map<?, ?>) payload;
        Object taskId = map.get("taskId");
        if (taskId == null) {
            throw new ValidationException("Task result payload is missing taskId");
        }
        boolean success;
        if (map.containsKey("success")) {
            success = Boolean.parseBoolean(String.valueOf(map.get("success")));
        } else {
            success = "success".equalsIgnoreCase(String.valueOf(map.get("status")));
        }
        if (success) {
            Object output = map.containsKey("output") ? map.get("output") : map.get("result");
            return success(taskId.toString(), workerId, output);
        }
        Object error = map.get("error");
        return failure(taskId.toString(), workerId, error != null ? error.toString() : "Task failed");
    }

    public String getTaskId() { return taskId; }

    public String getWorkerId() { return workerId; }

    public boolean isSuccess() { return success; }

    public Object getOutput() { return output; }

    public String getError() { return error; }

    @Override
    public String toString() {
        return "TaskOutcome{" +
                "taskId='" + taskId + '\'' +
                ", workerId='" + workerId + '\'' +
                ", success=" + success +
                '}';
    }
}
