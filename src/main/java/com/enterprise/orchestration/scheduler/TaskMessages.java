package com.enterprise.orchestration.scheduler;

/**
 * Message types exchanged between the scheduler and workers
 */
public final class TaskMessages {

    public static final String TASK_ASSIGNMENT = "task_assignment";
    public static final String TASK_RESULT = "task_result";
    public static final String TASK_PROGRESS = "task_progress";
    public static final String TASK_CANCELLED = "task_cancelled";

    public static final String WORKFLOW_STATE_PREFIX = "workflow:";

    private TaskMessages() {
    }
}
