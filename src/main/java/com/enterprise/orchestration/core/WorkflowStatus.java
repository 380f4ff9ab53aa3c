package com.enterprise.orchestration.core;

public enum WorkflowStatus {
    CREATED,
    IN_PROGRESS,
    COMPLETED
}
