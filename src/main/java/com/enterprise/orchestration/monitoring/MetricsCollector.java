package com.enterprise.orchestration.monitoring;

import com.enterprise.orchestration.core.ErrorKind;
import com.enterprise.orchestration.events.EventPublisher;
import com.enterprise.orchestration.events.OrchestrationEvent;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Collects and exposes metrics for the orchestration core.
 * Counters are fed from orchestration events; gauges are refreshed by the orchestrator.
 */
public class MetricsCollector {

    private static final Logger logger = LoggerFactory.getLogger(MetricsCollector.class);

    private final MeterRegistry meterRegistry;
    private final ConcurrentHashMap<String, Counter> messageTypeCounters = new ConcurrentHashMap<>();

    // Scheduler
    private final Counter plansCreated;
    private final Counter tasksAdded;
    private final Counter tasksAssigned;
    private final Counter tasksCompleted;
    private final Counter tasksFailed;
    private final Counter tasksCancelled;
    private final Counter tasksBlocked;
    private final Counter tasksReassigned;
    private final Counter workflowsCompleted;
    private final Timer taskDuration;

    // Bus
    private final Counter messagesPublished;
    private final Counter messagesDelivered;
    private final Counter messagesRetried;
    private final Counter messagesDeadLettered;
    private final Counter broadcasts;

    // Sync
    private final Counter stateUpdates;
    private final Counter conflictsResolved;
    private final Counter manualResolutionTimeouts;
    private final Counter lockTimeouts;

    // Gauges
    private final AtomicLong pendingTasks = new AtomicLong(0);
    private final AtomicLong runningTasks = new AtomicLong(0);
    private final AtomicLong activeWorkflows = new AtomicLong(0);
    private final AtomicLong queueSize = new AtomicLong(0);
    private final AtomicLong dlqSize = new AtomicLong(0);

    public MetricsCollector(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.plansCreated = counter("orchestration.plans.created", "Total number of execution plans created");
        this.tasksAdded = counter("orchestration.tasks.added", "Total number of tasks added to the graph");
        this.tasksAssigned = counter("orchestration.tasks.assigned", "Total number of task assignments");
        this.tasksCompleted = counter("orchestration.tasks.completed", "Total number of tasks completed");
        this.tasksFailed = counter("orchestration.tasks.failed", "Total number of tasks that failed");
        this.tasksCancelled = counter("orchestration.tasks.cancelled", "Total number of tasks cancelled");
        this.tasksBlocked = counter("orchestration.tasks.blocked", "Total number of tasks blocked by a failed dependency");
        this.tasksReassigned = counter("orchestration.tasks.reassigned", "Total number of tasks returned to pending");
        this.workflowsCompleted = counter("orchestration.workflows.completed", "Total number of workflows completed");

        this.messagesPublished = counter("orchestration.messages.published", "Total number of messages published");
        this.messagesDelivered = counter("orchestration.messages.delivered", "Total number of messages delivered");
        this.messagesRetried = counter("orchestration.messages.retried", "Total number of delivery retries scheduled");
        this.messagesDeadLettered = counter("orchestration.messages.dead_lettered",
            "Total number of messages moved to the Dead Letter Queue");
        this.broadcasts = counter("orchestration.messages.broadcast", "Total number of broadcasts");

        this.stateUpdates = counter("orchestration.state.updates", "Total number of accepted state writes");
        this.conflictsResolved = counter("orchestration.state.conflicts.resolved", "Total number of conflicts resolved");
        this.manualResolutionTimeouts = counter("orchestration.state.conflicts.manual_timeouts",
            "Manual conflict resolutions that fell back to the latest value");
        this.lockTimeouts = counter("orchestration.state.lock.timeouts", "Total number of state lock timeouts");

        this.taskDuration = Timer.builder("orchestration.task.duration")
            .description("Time from task start to completion")
            .register(meterRegistry);

        Gauge.builder("orchestration.tasks.pending", pendingTasks, AtomicLong::get)
            .description("Number of pending tasks")
            .register(meterRegistry);

        Gauge.builder("orchestration.tasks.running", runningTasks, AtomicLong::get)
            .description("Number of tasks in progress")
            .register(meterRegistry);

        Gauge.builder("orchestration.workflows.active", activeWorkflows, AtomicLong::get)
            .description("Number of workflows not yet completed")
            .register(meterRegistry);

        Gauge.builder("orchestration.bus.queue.size", queueSize, AtomicLong::get)
            .description("Messages waiting for delivery")
            .register(meterRegistry);

        Gauge.builder("orchestration.dlq.size", dlqSize, AtomicLong::get)
            .description("Current Dead Letter Queue size")
            .register(meterRegistry);

        logger.info("MetricsCollector initialized");
    }

    private Counter counter(String name, String description) {
        return Counter.builder(name)
            .description(description)
            .register(meterRegistry);
    }

    /**
     * Starts counting the events of the given publisher
     */
    public EventPublisher.Subscription bindTo(EventPublisher events) {
        return events.subscribe(this::record);
    }

    /**
     * Records a single orchestration event
     */
    public void record(OrchestrationEvent event) {
        switch (event.getType()) {
            case PLAN_CREATED:
                plansCreated.increment();
                break;
            case TASK_ADDED:
                tasksAdded.increment();
                break;
            case TASK_ASSIGNED:
                tasksAssigned.increment();
                break;
            case TASK_COMPLETED:
                tasksCompleted.increment();
                Object duration = event.getAttribute("durationMs");
                if (duration instanceof Number) {
                    taskDuration.record(((Number) duration).longValue(), TimeUnit.MILLISECONDS);
                }
                break;
            case TASK_FAILED:
                if (event.getAttribute("errorKind") == ErrorKind.CANCELLED) {
                    tasksCancelled.increment();
                } else {
                    tasksFailed.increment();
                }
                break;
            case TASK_BLOCKED:
                tasksBlocked.increment();
                break;
            case TASK_REASSIGNED:
                tasksReassigned.increment();
                break;
            case WORKFLOW_COMPLETED:
                workflowsCompleted.increment();
                break;
            case MESSAGE_PUBLISHED:
                messagesPublished.increment();
                getMessageTypeCounter(event.getAttribute("type"), "published").increment();
                break;
            case MESSAGE_DELIVERED:
                messagesDelivered.increment();
                getMessageTypeCounter(event.getAttribute("type"), "delivered").increment();
                break;
            case MESSAGE_RETRY_SCHEDULED:
                messagesRetried.increment();
                break;
            case MESSAGE_DEAD_LETTERED:
                messagesDeadLettered.increment();
                getMessageTypeCounter(event.getAttribute("type"), "dead_lettered").increment();
                break;
            case MESSAGE_BROADCAST:
                broadcasts.increment();
                break;
            case STATE_UPDATED:
                stateUpdates.increment();
                break;
            case CONFLICT_RESOLVED:
                conflictsResolved.increment();
                break;
            case CONFLICT_MANUAL_TIMEOUT:
                manualResolutionTimeouts.increment();
                break;
            case STATE_LOCK_TIMEOUT:
                lockTimeouts.increment();
                break;
            default:
                break;
        }
    }

    public void updateTaskGauges(long pending, long running, long active) {
        pendingTasks.set(pending);
        runningTasks.set(running);
        activeWorkflows.set(active);
    }

    public void updateQueueSize(int size) {
        queueSize.set(size);
    }

    public void updateDlqSize(int size) {
        dlqSize.set(size);
    }

    private Counter getMessageTypeCounter(Object messageType, String status) {
        String type = messageType != null ? messageType.toString() : "unknown";
        String key = type + "." + status;
        return messageTypeCounters.computeIfAbsent(key, k ->
            Counter.builder("orchestration.message.type")
                .tag("type", type)
                .tag("status", status)
                .description("Message count by type and status")
                .register(meterRegistry)
        );
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    /**
     * Get all metrics as a map
     */
    public Map<String, Object> getMetrics() {
        Map<String, Object> metrics = new ConcurrentHashMap<>();

        metrics.put("plans.created", plansCreated.count());
        metrics.put("tasks.added", tasksAdded.count());
        metrics.put("tasks.assigned", tasksAssigned.count());
        metrics.put("tasks.completed", tasksCompleted.count());
        metrics.put("tasks.failed", tasksFailed.count());
        metrics.put("tasks.cancelled", tasksCancelled.count());
        metrics.put("tasks.blocked", tasksBlocked.count());
        metrics.put("tasks.reassigned", tasksReassigned.count());
        metrics.put("workflows.completed", workflowsCompleted.count());
        metrics.put("task.duration.mean", taskDuration.mean(TimeUnit.MILLISECONDS));
        metrics.put("task.duration.max", taskDuration.max(TimeUnit.MILLISECONDS));

        metrics.put("messages.published", messagesPublished.count());
        metrics.put("messages.delivered", messagesDelivered.count());
        metrics.put("messages.retried", messagesRetried.count());
        metrics.put("messages.dead_lettered", messagesDeadLettered.count());
        metrics.put("messages.broadcast", broadcasts.count());

        metrics.put("state.updates", stateUpdates.count());
        metrics.put("state.conflicts.resolved", conflictsResolved.count());
        metrics.put("state.conflicts.manual_timeouts", manualResolutionTimeouts.count());
        metrics.put("state.lock.timeouts", lockTimeouts.count());

        metrics.put("tasks.pending", pendingTasks.get());
        metrics.put("tasks.running", runningTasks.get());
        metrics.put("workflows.active", activeWorkflows.get());
        metrics.put("bus.queue.size", queueSize.get());
        metrics.put("dlq.size", dlqSize.get());

        return metrics;
    }
}
