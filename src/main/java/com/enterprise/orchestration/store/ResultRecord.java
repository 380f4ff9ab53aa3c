package com.enterprise.orchestration.store;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Objects;

/**
 * Result a worker produced for a task, persisted as {@code {workerId, taskId, result, timestamp}}
 */
public final class ResultRecord {

    private final String workerId;
    private final String taskId;
    private final Object result;
    private final Instant timestamp;

    @JsonCreator
    public ResultRecord(@JsonProperty("workerId") String workerId,
                        @JsonProperty("taskId") String taskId,
                        @JsonProperty("result") Object result,
                        @JsonProperty("timestamp") Instant timestamp) {
        this.workerId = workerId;
        this.taskId = Objects.requireNonNull(taskId, "Task id cannot be null");
        this.result = result;
        this.timestamp = timestamp != null ? timestamp : Instant.now();
    }

    public String getWorkerId() { return workerId; }

    public String getTaskId() { return taskId; }

    public Object getResult() { return result; }

    public Instant getTimestamp() { return timestamp; }
}
