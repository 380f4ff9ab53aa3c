package com.enterprise.orchestration.core;

import com.enterprise.orchestration.bus.Message;
import com.enterprise.orchestration.bus.MessageBus;
import com.enterprise.orchestration.bus.MessageSink;
import com.enterprise.orchestration.bus.MessageTypeStats;
import com.enterprise.orchestration.bus.QueueStatus;
import com.enterprise.orchestration.dlq.DeadLetterEntry;
import com.enterprise.orchestration.events.EventPublisher;
import com.enterprise.orchestration.exception.LockTimeoutException;
import com.enterprise.orchestration.exception.TaskNotFoundException;
import com.enterprise.orchestration.exception.WorkflowNotFoundException;
import com.enterprise.orchestration.scheduler.TaskGraphScheduler;
import com.enterprise.orchestration.scheduler.WorkflowProgress;
import com.enterprise.orchestration.scheduler.WorkflowStatusReport;
import com.enterprise.orchestration.sync.StateSummary;
import com.enterprise.orchestration.sync.StateSynchronizer;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Entry point of the orchestration core: one task graph scheduler, one message bus and one
 * state synchronizer, driven by periodic ticks while the orchestrator is running.
 */
public interface Orchestrator extends AutoCloseable {

    /**
     * Decomposes a goal into a workflow, choosing the project category with the configured classifier
     */
    Workflow createExecutionPlan(String requesterId, String goal);

    /**
     * Decomposes a goal into a workflow using the phases of the given category
     */
    Workflow createExecutionPlan(String requesterId, String goal, String category);

    /**
     * Registers the workflow's tasks for scheduling
     */
    List<Task> distributeTasks(Workflow workflow);

    /**
     * Highest-priority task whose dependencies have all completed
     */
    Optional<Task> getNextTask();

    boolean markTaskCompleted(String taskId, Object result) throws TaskNotFoundException;

    boolean markTaskFailed(String taskId, ErrorInfo error) throws TaskNotFoundException;

    default boolean markTaskFailed(String taskId, String error) throws TaskNotFoundException {
        return markTaskFailed(taskId, ErrorInfo.of(ErrorKind.EXECUTION_FAILED, error));
    }

    boolean cancelTask(String taskId, String reason) throws TaskNotFoundException;

    boolean reassign(String taskId) throws TaskNotFoundException;

    String publish(Message message);

    List<Message> broadcast(Message message);

    void subscribe(String workerId, Collection<String> messageTypes, MessageSink sink);

    boolean unsubscribe(String workerId);

    long setState(String key, Object value, String writerId) throws LockTimeoutException;

    Optional<Object> getState(String key);

    WorkflowStatusReport getWorkflowStatus();

    WorkflowProgress getWorkflowStatus(String workflowId) throws WorkflowNotFoundException;

    QueueStatus getQueueStatus();

    Map<String, MessageTypeStats> getMessageStats();

    List<StateSummary> getStateList();

    List<DeadLetterEntry> getDeadLetters();

    List<Message> getHistory(String workerId);

    TaskGraphScheduler getScheduler();

    MessageBus getMessageBus();

    StateSynchronizer getStateSynchronizer();

    EventPublisher getEvents();

    /**
     * Starts the scheduling, delivery and reconciliation ticks
     */
    void start();

    /**
     * Stops the ticks. The orchestrator can be started again until it is closed.
     */
    CompletableFuture<Void> stop();

    boolean isRunning();

    /**
     * Stops the ticks and releases the persistent store and dead letter queue
     */
    @Override
    void close();
}
