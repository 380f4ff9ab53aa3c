package com.enterprise.orchestration.events;

/**
 * Kinds of lifecycle events reported by the orchestration subsystems
 */
public enum EventType {
    // Scheduler
    PLAN_CREATED,
    TASK_ADDED,
    TASK_READY,
    TASK_ASSIGNED,
    TASK_PROGRESS,
    TASK_COMPLETED,
    TASK_FAILED,
    TASK_BLOCKED,
    TASK_REASSIGNED,
    WORKFLOW_STARTED,
    WORKFLOW_COMPLETED,

    // Message bus
    MESSAGE_PUBLISHED,
    MESSAGE_DELIVERED,
    MESSAGE_RETRY_SCHEDULED,
    MESSAGE_DEAD_LETTERED,
    MESSAGE_BROADCAST,
    SUBSCRIBER_ADDED,
    SUBSCRIBER_REMOVED,
    HISTORY_CLEANED,

    // State synchronizer
    STATE_UPDATED,
    STATE_LOADED,
    STATE_DELETED,
    STATE_LOCK_TIMEOUT,
    CONFLICT_RESOLVED,
    CONFLICT_MANUAL_REQUESTED,
    CONFLICT_MANUAL_TIMEOUT
}
