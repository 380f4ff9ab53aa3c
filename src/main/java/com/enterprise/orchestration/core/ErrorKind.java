package com.enterprise.orchestration.core;

/**
 * Classification of failures surfaced by the orchestration core
 */
public enum ErrorKind {
    VALIDATION,
    RECIPIENT_NOT_FOUND,
    TYPE_NOT_SUBSCRIBED,
    LOCK_TIMEOUT,
    DEPENDENCY_BLOCKED,
    CANCELLED,
    RETRY_EXHAUSTED,
    EXECUTION_FAILED,
    WORKER_OFFLINE
}
