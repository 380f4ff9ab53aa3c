package com.enterprise.orchestration.core;

import com.enterprise.orchestration.bus.Message;
import com.enterprise.orchestration.bus.MessageBus;
import com.enterprise.orchestration.bus.MessageSink;
import com.enterprise.orchestration.bus.MessageTypeStats;
import com.enterprise.orchestration.bus.QueueStatus;
import com.enterprise.orchestration.dlq.DeadLetterEntry;
import com.enterprise.orchestration.dlq.DeadLetterQueue;
import com.enterprise.orchestration.events.EventPublisher;
import com.enterprise.orchestration.exception.LockTimeoutException;
import com.enterprise.orchestration.exception.TaskNotFoundException;
import com.enterprise.orchestration.exception.WorkflowNotFoundException;
import com.enterprise.orchestration.monitoring.MetricsCollector;
import com.enterprise.orchestration.scheduler.HousekeepingScheduler;
import com.enterprise.orchestration.scheduler.TaskGraphScheduler;
import com.enterprise.orchestration.scheduler.WorkflowProgress;
import com.enterprise.orchestration.scheduler.WorkflowStatusReport;
import com.enterprise.orchestration.store.StateStore;
import com.enterprise.orchestration.sync.StateSummary;
import com.enterprise.orchestration.sync.StateSynchronizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires one scheduler, bus and synchronizer together and drives them with fixed-delay ticks
 */
public class DefaultOrchestrator implements Orchestrator {

    private static final Logger logger = LoggerFactory.getLogger(DefaultOrchestrator.class);

    private final TaskGraphScheduler scheduler;
    private final MessageBus bus;
    private final StateSynchronizer sync;
    private final StateStore store;
    private final DeadLetterQueue deadLetterQueue;
    private final EventPublisher events;
    private final HousekeepingScheduler housekeeping;
    private final MetricsCollector metricsCollector;
    private final Duration schedulingInterval;
    private final Duration deliveryInterval;
    private final Duration reconcileInterval;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private Instant startedAt;
    private ScheduledExecutorService executor;
    private final List<ScheduledFuture<?>> ticks = new ArrayList<>();

    public DefaultOrchestrator(TaskGraphScheduler scheduler, MessageBus bus, StateSynchronizer sync,
                               StateStore store, DeadLetterQueue deadLetterQueue, EventPublisher events,
                               HousekeepingScheduler housekeeping, MetricsCollector metricsCollector,
                               Duration schedulingInterval, Duration deliveryInterval, Duration reconcileInterval) {
        this.scheduler = Objects.requireNonNull(scheduler, "Scheduler cannot be null");
        this.bus = Objects.requireNonNull(bus, "Message bus cannot be null");
        this.sync = Objects.requireNonNull(sync, "State synchronizer cannot be null");
        this.store = Objects.requireNonNull(store, "State store cannot be null");
        this.deadLetterQueue = Objects.requireNonNull(deadLetterQueue, "Dead letter queue cannot be null");
        this.events = Objects.requireNonNull(events, "Event publisher cannot be null");
        this.housekeeping = housekeeping;
        this.metricsCollector = metricsCollector;
        this.schedulingInterval = schedulingInterval;
        this.deliveryInterval = deliveryInterval;
        this.reconcileInterval = reconcileInterval;

        scheduler.registerResultListener();
    }

    @Override
    public Workflow createExecutionPlan(String requesterId, String goal) {
        return scheduler.createExecutionPlan(requesterId, goal);
    }

    @Override
    public Workflow createExecutionPlan(String requesterId, String goal, String category) {
        return scheduler.createExecutionPlan(requesterId, goal, category);
    }

    @Override
    public List<Task> distributeTasks(Workflow workflow) {
        return scheduler.distributeTasks(workflow);
    }

    @Override
    public Optional<Task> getNextTask() {
        return scheduler.getNextTask();
    }

    @Override
    public boolean markTaskCompleted(String taskId, Object result) throws TaskNotFoundException {
        return scheduler.markTaskCompleted(taskId, result);
    }

    @Override
    public boolean markTaskFailed(String taskId, ErrorInfo error) throws TaskNotFoundException {
        return scheduler.markTaskFailed(taskId, error);
    }

    @Override
    public boolean cancelTask(String taskId, String reason) throws TaskNotFoundException {
        return scheduler.cancelTask(taskId, reason);
    }

    @Override
    public boolean reassign(String taskId) throws TaskNotFoundException {
        return scheduler.reassign(taskId);
    }

    @Override
    public String publish(Message message) {
        return bus.publish(message);
    }

    @Override
    public List<Message> broadcast(Message message) {
        return bus.broadcast(message);
    }

    @Override
    public void subscribe(String workerId, Collection<String> messageTypes, MessageSink sink) {
        bus.subscribe(workerId, messageTypes, sink);
    }

    @Override
    public boolean unsubscribe(String workerId) {
        return bus.unsubscribe(workerId);
    }

    @Override
    public long setState(String key, Object value, String writerId) throws LockTimeoutException {
        return sync.setState(key, value, writerId);
    }

    @Override
    public Optional<Object> getState(String key) {
        return sync.getState(key);
    }

    @Override
    public WorkflowStatusReport getWorkflowStatus() {
        return scheduler.getWorkflowStatus();
    }

    @Override
    public WorkflowProgress getWorkflowStatus(String workflowId) throws WorkflowNotFoundException {
        return scheduler.getWorkflowStatus(workflowId);
    }

    @Override
    public QueueStatus getQueueStatus() {
        return bus.getQueueStatus();
    }

    @Override
    public Map<String, MessageTypeStats> getMessageStats() {
        return bus.getStats();
    }

    @Override
    public List<StateSummary> getStateList() {
        return sync.getStateList();
    }

    @Override
    public List<DeadLetterEntry> getDeadLetters() {
        return bus.getDeadLetters();
    }

    @Override
    public List<Message> getHistory(String workerId) {
        return bus.getHistory(workerId);
    }

    @Override
    public TaskGraphScheduler getScheduler() {
        return scheduler;
    }

    @Override
    public MessageBus getMessageBus() {
        return bus;
    }

    @Override
    public StateSynchronizer getStateSynchronizer() {
        return sync;
    }

    @Override
    public EventPublisher getEvents() {
        return events;
    }

    public Optional<MetricsCollector> getMetricsCollector() {
        return Optional.ofNullable(metricsCollector);
    }

    public Optional<HousekeepingScheduler> getHousekeeping() {
        return Optional.ofNullable(housekeeping);
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    @Override
    public synchronized void start() {
        if (closed.get()) {
            throw new IllegalStateException("Orchestrator has been closed");
        }
        if (running.compareAndSet(false, true)) {
            logger.info("Starting orchestrator...");

            executor = Executors.newScheduledThreadPool(3, r -> {
                Thread t = new Thread(r, "orchestration-tick");
                t.setDaemon(true);
                return t;
            });

            ticks.add(executor.scheduleWithFixedDelay(
                this::schedulingTick, 0, schedulingInterval.toMillis(), TimeUnit.MILLISECONDS));
            ticks.add(executor.scheduleWithFixedDelay(
                this::deliveryTick, 0, deliveryInterval.toMillis(), TimeUnit.MILLISECONDS));
            ticks.add(executor.scheduleWithFixedDelay(
                this::reconcileTick, reconcileInterval.toMillis(), reconcileInterval.toMillis(),
                TimeUnit.MILLISECONDS));

            if (housekeeping != null) {
                housekeeping.start();
            }
            startedAt = Instant.now();
            logger.info("Orchestrator started successfully");
        }
    }

    @Override
    public CompletableFuture<Void> stop() {
        return CompletableFuture.runAsync(this::stopTicks);
    }

    private synchronized void stopTicks() {
        if (running.compareAndSet(true, false)) {
            logger.info("Stopping orchestrator...");

            ticks.forEach(tick -> tick.cancel(false));
            ticks.clear();

            executor.shutdown();
            try {
                if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                executor.shutdownNow();
                Thread.currentThread().interrupt();
            }
            executor = null;

            if (housekeeping != null) {
                housekeeping.stop();
            }
            logger.info("Orchestrator stopped successfully");
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            stopTicks();
            deadLetterQueue.close();
            store.close();
            logger.info("Orchestrator closed");
        }
    }

    private void schedulingTick() {
        try {
            scheduler.scheduleReadyTasks();
            refreshGauges();
        } catch (Exception e) {
            logger.error("Error in scheduling tick", e);
        }
    }

    private void deliveryTick() {
        try {
            bus.deliverPending();
        } catch (Exception e) {
            logger.error("Error in delivery tick", e);
        }
    }

    private void reconcileTick() {
        try {
            sync.reconcile();
        } catch (Exception e) {
            logger.error("Error in reconciliation tick", e);
        }
    }

    private void refreshGauges() {
        if (metricsCollector == null) {
            return;
        }
        WorkflowStatusReport report = scheduler.getWorkflowStatus();
        metricsCollector.updateTaskGauges(report.getPendingTasks(), report.getInProgressTasks(),
                                          report.getActiveWorkflows().size());
        QueueStatus queueStatus = bus.getQueueStatus();
        metricsCollector.updateQueueSize(queueStatus.getQueueSize());
        metricsCollector.updateDlqSize(queueStatus.getDeadLetterCount());
    }
}
