package com.enterprise.orchestration.scheduler;

import com.enterprise.orchestration.bus.Message;
import com.enterprise.orchestration.bus.MessageBus;
import com.enterprise.orchestration.bus.Priority;
import com.enterprise.orchestration.core.*;
import com.enterprise.orchestration.events.EventPublisher;
import com.enterprise.orchestration.events.EventType;
import com.enterprise.orchestration.events.OrchestrationEvent;
import com.enterprise.orchestration.exception.LockTimeoutException;
import com.enterprise.orchestration.exception.StateStoreException;
import com.enterprise.orchestration.exception.TaskNotFoundException;
import com.enterprise.orchestration.exception.ValidationException;
import com.enterprise.orchestration.exception.WorkflowNotFoundException;
import com.enterprise.orchestration.store.ResultRecord;
import com.enterprise.orchestration.store.StateStore;
import com.enterprise.orchestration.store.WorkflowRecord;
import com.enterprise.orchestration.sync.StateSynchronizer;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Decomposes goals into task graphs and drives them to completion.
 * <p>
 * Tasks become ready once every dependency has completed. Each scheduling tick assigns ready
 * tasks, highest priority first, to the best scoring worker of the roster and announces the
 * assignment on the message bus. Workers report back with {@code task_result} and
 * {@code task_progress} messages addressed to {@code system}. Aggregate workflow progress is
 * published through the state synchronizer under {@code workflow:<id>}.
 */
public class TaskGraphScheduler {

    private static final Logger logger = LoggerFactory.getLogger(TaskGraphScheduler.class);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final PhaseCatalog catalog;
    private final TaskClassificationTable classifications;
    private final WorkerScorer scorer;
    private final GoalClassifier goalClassifier;
    private final MessageBus bus;
    private final StateSynchronizer sync;
    private final StateStore store;
    private final EventPublisher events;
    private final WorkerRoster roster;
    private final int maxConcurrentTasks;
    private final Duration taskRetention;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    // Guards the graph tables below
    private final ReentrantLock graphLock = new ReentrantLock();
    // Serializes scheduling ticks
    private final ReentrantLock tickLock = new ReentrantLock();

    private final Map<String, Workflow> workflows = new LinkedHashMap<>();
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final Map<String, Set<String>> dependents = new HashMap<>();
    private final Set<String> completedTaskIds = new HashSet<>();
    private final Map<String, Long> workflowVersions = new HashMap<>();

    public TaskGraphScheduler(PhaseCatalog catalog, TaskClassificationTable classifications,
                              GoalClassifier goalClassifier, MessageBus bus, StateSynchronizer sync,
                              StateStore store, EventPublisher events, WorkerRoster roster,
                              int maxConcurrentTasks, Duration taskRetention) {
        this(catalog, classifications, goalClassifier, bus, sync, store, events, roster,
             maxConcurrentTasks, taskRetention, Clock.systemUTC());
    }

    public TaskGraphScheduler(PhaseCatalog catalog, TaskClassificationTable classifications,
                              GoalClassifier goalClassifier, MessageBus bus, StateSynchronizer sync,
                              StateStore store, EventPublisher events, WorkerRoster roster,
                              int maxConcurrentTasks, Duration taskRetention, Clock clock) {
        this.catalog = Objects.requireNonNull(catalog, "Phase catalog cannot be null");
        this.classifications = Objects.requireNonNull(classifications, "Classification table cannot be null");
        this.scorer = new WorkerScorer(classifications);
        this.goalClassifier = goalClassifier != null ? goalClassifier : GoalClassifier.fixed(null);
        this.bus = Objects.requireNonNull(bus, "Message bus cannot be null");
        this.sync = Objects.requireNonNull(sync, "State synchronizer cannot be null");
        this.store = Objects.requireNonNull(store, "State store cannot be null");
        this.events = Objects.requireNonNull(events, "Event publisher cannot be null");
        this.roster = roster != null ? roster : WorkerRoster.empty();
        this.maxConcurrentTasks = maxConcurrentTasks;
        this.taskRetention = taskRetention;
        this.clock = clock;
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    /**
     * Subscribes the scheduler to worker reports on the bus
     */
    public void registerResultListener() {
        bus.subscribe(Message.SYSTEM, List.of(TaskMessages.TASK_RESULT, TaskMessages.TASK_PROGRESS),
                      this::onWorkerMessage);
    }

    // ---------------------------------------------------------------- decomposition

    /**
     * Builds the execution plan for a goal, choosing the category with the goal classifier
     */
    public Workflow createExecutionPlan(String requesterId, String goal) {
        return createExecutionPlan(requesterId, goal, goalClassifier.classify(goal));
    }

    /**
     * Builds the execution plan for a goal from the phases of the given category.
     * Unknown categories use the catalog's default category. The plan is not scheduled
     * until it is passed to {@link #distributeTasks(Workflow)}.
     */
    public Workflow createExecutionPlan(String requesterId, String goal, String category) {
        if (requesterId == null || requesterId.isBlank()) {
            throw new ValidationException("Requester id is required");
        }
        if (goal == null || goal.isBlank()) {
            throw new ValidationException("Goal description is required");
        }

        Instant now = clock.instant();
        String resolvedCategory = catalog.resolveCategory(category);
        String workflowId = "workflow_" + now.toEpochMilli() + "_" + UUID.randomUUID().toString().substring(0, 8);
        List<PhaseTemplate> phases = catalog.phasesFor(resolvedCategory);

        Map<String, String> taskIdsByPhase = new HashMap<>();
        List<Task> planned = new ArrayList<>();
        String previousTaskId = null;
        for (int index = 0; index < phases.size(); index++) {
            PhaseTemplate phase = phases.get(index);
            String taskId = workflowId + "_" + phase.getPhaseName() + "_" + index;

            Set<String> dependencies = new LinkedHashSet<>();
            if (phase.hasExplicitDependencies()) {
                for (String dependency : phase.getDependsOn()) {
                    dependencies.add(taskIdsByPhase.get(dependency));
                }
            } else if (previousTaskId != null) {
                dependencies.add(previousTaskId);
            }

            planned.add(buildTask(taskId, phase, index, workflowId, resolvedCategory, goal, dependencies, now));
            taskIdsByPhase.put(phase.getPhaseName(), taskId);
            previousTaskId = taskId;
        }

        Workflow workflow = new Workflow(workflowId, goal, requesterId, resolvedCategory,
                                         catalog.complexityFor(resolvedCategory), planned, now);
        logger.info("Created execution plan {} ({}) with {} tasks for {}",
                   workflowId, resolvedCategory, planned.size(), requesterId);
        events.publish(OrchestrationEvent.of(EventType.PLAN_CREATED, workflowId,
            attributes("category", resolvedCategory, "requesterId", requesterId, "tasks", planned.size())));
        return workflow;
    }

    private Task buildTask(String taskId, PhaseTemplate phase, int index, String workflowId, String category,
                           String goal, Set<String> dependencies, Instant now) {
        Optional<TaskClassificationTable.Classification> classification =
            classifications.lookup(phase.getPhaseName());

        int priority = classification.map(TaskClassificationTable.Classification::getPriority)
            .orElse(phase.getPriority() != null ? phase.getPriority() : 3);
        Complexity complexity = classification.map(TaskClassificationTable.Classification::getComplexity)
            .orElse(phase.getComplexity() != null ? phase.getComplexity() : Complexity.MEDIUM);
        String role = phase.getPreferredRole();
        if (role == null) {
            role = classification.map(TaskClassificationTable.Classification::getRole).orElse("developer");
        }
        String description = phase.getDescription() != null
            ? phase.getDescription()
            : phase.getPhaseName() + ": " + goal;

        return Task.builder()
            .id(taskId)
            .type(phase.getPhaseName())
            .description(description)
            .priority(priority)
            .complexity(complexity)
            .dependencies(dependencies)
            .createdAt(now)
            .estimatedDuration(Duration.ofMinutes(Math.round(phase.getEstimatedHours() * 60)))
            .metadata(Task.MetadataKeys.WORKFLOW_ID, workflowId)
            .metadata(Task.MetadataKeys.PHASE, phase.getPhaseName())
            .metadata(Task.MetadataKeys.PHASE_INDEX, index)
            .metadata(Task.MetadataKeys.PREFERRED_ROLE, role)
            .metadata(Task.MetadataKeys.CATEGORY, category)
            .metadata(Task.MetadataKeys.ESTIMATED_HOURS, phase.getEstimatedHours())
            .build();
    }

    /**
     * Registers the workflow's tasks in the graph.
     *
     * @return the registered tasks, in workflow order
     * @throws ValidationException if a task id is already known, a dependency is unknown
     *                             or the dependencies form a cycle
     */
    public List<Task> distributeTasks(Workflow workflow) {
        Objects.requireNonNull(workflow, "Workflow cannot be null");
        List<Task> added = workflow.getTasks();
        List<String> ready = new ArrayList<>();

        graphLock.lock();
        try {
            if (workflows.containsKey(workflow.getId())) {
                throw new ValidationException("Workflow " + workflow.getId() + " is already distributed");
            }
            Set<String> newIds = new HashSet<>();
            for (Task task : added) {
                if (tasks.containsKey(task.getId()) || !newIds.add(task.getId())) {
                    throw new ValidationException("Duplicate task id " + task.getId());
                }
            }
            for (Task task : added) {
                for (String dependency : task.getDependencies()) {
                    if (!newIds.contains(dependency) && !tasks.containsKey(dependency)) {
                        throw new ValidationException("Task " + task.getId()
                                + " depends on unknown task " + dependency);
                    }
                }
            }
            checkAcyclic(added, newIds);

            workflows.put(workflow.getId(), workflow);
            for (Task task : added) {
                tasks.put(task.getId(), task);
                for (String dependency : task.getDependencies()) {
                    dependents.computeIfAbsent(dependency, k -> new LinkedHashSet<>()).add(task.getId());
                }
            }
            for (Task task : added) {
                if (task.isReady(completedTaskIds)) {
                    ready.add(task.getId());
                }
            }
        } finally {
            graphLock.unlock();
        }

        logger.info("Distributed {} tasks of workflow {}", added.size(), workflow.getId());
        for (Task task : added) {
            events.publish(OrchestrationEvent.of(EventType.TASK_ADDED, task.getId(),
                attributes("workflowId", workflow.getId(), "type", task.getType(), "priority", task.getPriority())));
        }
        for (String taskId : ready) {
            events.publish(OrchestrationEvent.of(EventType.TASK_READY, taskId,
                attributes("workflowId", workflow.getId())));
        }
        persistQuietly(workflow);
        return added;
    }

    // Kahn's algorithm restricted to the new tasks; edges to registered tasks cannot close a cycle
    private static void checkAcyclic(List<Task> added, Set<String> newIds) {
        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> edges = new HashMap<>();
        for (Task task : added) {
            inDegree.putIfAbsent(task.getId(), 0);
            for (String dependency : task.getDependencies()) {
                if (newIds.contains(dependency)) {
                    inDegree.merge(task.getId(), 1, Integer::sum);
                    edges.computeIfAbsent(dependency, k -> new ArrayList<>()).add(task.getId());
                }
            }
        }
        Deque<String> queue = inDegree.entrySet().stream()
            .filter(e -> e.getValue() == 0)
            .map(Map.Entry::getKey)
            .collect(Collectors.toCollection(ArrayDeque::new));
        int visited = 0;
        while (!queue.isEmpty()) {
            String id = queue.poll();
            visited++;
            for (String next : edges.getOrDefault(id, List.of())) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    queue.add(next);
                }
            }
        }
        if (visited != added.size()) {
            throw new ValidationException("Task dependencies form a cycle");
        }
    }

    // ---------------------------------------------------------------- readiness & assignment

    /**
     * Highest-priority ready task; ties go to the task registered first
     */
    public Optional<Task> getNextTask() {
        List<Task> ready = getReadyTasks();
        return ready.isEmpty() ? Optional.empty() : Optional.of(ready.get(0));
    }

    /**
     * Ready tasks in selection order
     */
    public List<Task> getReadyTasks() {
        graphLock.lock();
        try {
            List<Task> ready = new ArrayList<>();
            for (Task task : tasks.values()) {
                if (task.isReady(completedTaskIds)) {
                    ready.add(task);
                }
            }
            ready.sort(Comparator.comparingInt(Task::getPriority).reversed());
            return ready;
        } finally {
            graphLock.unlock();
        }
    }

    /**
     * Scores the candidates for the task without changing any state
     */
    public Assignment assign(Task task, Collection<WorkerDescriptor> candidates) {
        return scorer.select(task, candidates);
    }

    /**
     * One scheduling tick. Requeues the tasks of workers the roster reports offline, then
     * starts ready tasks on the best scoring workers until {@code maxConcurrentTasks} tasks
     * are in progress. Tasks nobody scores for stay pending for the next tick.
     *
     * @return the assignments made in this tick
     */
    public List<Assignment> scheduleReadyTasks() {
        tickLock.lock();
        try {
            List<WorkerDescriptor> workers = roster.snapshot();
            for (WorkerDescriptor worker : workers) {
                if (worker.isOffline()) {
                    handleWorkerOffline(worker.getId());
                }
            }

            int slots = maxConcurrentTasks - countInProgress();
            List<Assignment> made = new ArrayList<>();
            for (Task task : getReadyTasks()) {
                if (slots <= 0) {
                    break;
                }
                Assignment assignment = scorer.select(task, workers);
                if (!assignment.isAssigned()) {
                    logger.debug("No worker available for task {} ({})", task.getId(), task.getType());
                    continue;
                }
                if (startAssigned(task, assignment)) {
                    made.add(assignment);
                    slots--;
                }
            }
            return made;
        } finally {
            tickLock.unlock();
        }
    }

    private boolean startAssigned(Task task, Assignment assignment) {
        String workerId = assignment.getWorkerId().orElseThrow();
        Instant now = clock.instant();
        Workflow workflow;
        boolean workflowStarted;

        graphLock.lock();
        try {
            if (!task.isReady(completedTaskIds)) {
                return false;
            }
            task.start(workerId, now);
            workflow = workflows.get(task.getWorkflowId());
            workflowStarted = workflow != null && workflow.start(now);
        } finally {
            graphLock.unlock();
        }

        logger.info("Task {} assigned: {}", task.getId(), assignment.getReasoning());
        if (workflowStarted) {
            logger.info("Workflow {} started", workflow.getId());
            events.publish(OrchestrationEvent.of(EventType.WORKFLOW_STARTED, workflow.getId()));
        }
        events.publish(OrchestrationEvent.of(EventType.TASK_ASSIGNED, task.getId(),
            attributes("workerId", workerId, "score", assignment.getScore(),
                       "reasoning", assignment.getReasoning(), "workflowId", task.getWorkflowId())));

        bus.publish(Message.builder()
            .type(TaskMessages.TASK_ASSIGNMENT)
            .to(workerId)
            .priority(messagePriority(task))
            .payload(assignmentPayload(task, assignment))
            .createdAt(now)
            .build());

        if (workflow != null) {
            publishProgress(workflow);
        }
        return true;
    }

    private static Priority messagePriority(Task task) {
        if (task.getPriority() >= 4) {
            return Priority.HIGH;
        }
        return task.getPriority() == 3 ? Priority.NORMAL : Priority.LOW;
    }

    private static Map<String, Object> assignmentPayload(Task task, Assignment assignment) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("taskId", task.getId());
        payload.put("workflowId", task.getWorkflowId());
        payload.put("type", task.getType());
        payload.put("description", task.getDescription());
        payload.put("priority", task.getPriority());
        payload.put("complexity", task.getComplexity().name());
        payload.put("dependencies", new ArrayList<>(task.getDependencies()));
        payload.put("estimatedDurationMs", task.getEstimatedDuration().toMillis());
        payload.put("reasoning", assignment.getReasoning());
        return payload;
    }

    private int countInProgress() {
        graphLock.lock();
        try {
            return (int) tasks.values().stream().filter(t -> t.getStatus() == TaskStatus.IN_PROGRESS).count();
        } finally {
            graphLock.unlock();
        }
    }

    // ---------------------------------------------------------------- completion & failure

    /**
     * Records a successful result. A pending task whose dependencies have all completed is
     * started implicitly.
     *
     * @return false if the task had already completed
     * @throws IllegalStateException if the task has failed, is blocked, or still waits on a dependency
     */
    public boolean markTaskCompleted(String taskId, Object result) throws TaskNotFoundException {
        Instant now = clock.instant();
        Task task;
        Workflow workflow;
        boolean workflowCompleted;
        List<String> unblocked = new ArrayList<>();

        graphLock.lock();
        try {
            task = requireTask(taskId);
            switch (task.getStatus()) {
                case COMPLETED:
                    logger.debug("Task {} already completed, ignoring duplicate result", taskId);
                    return false;
                case FAILED:
                case BLOCKED:
                    throw new IllegalStateException("Cannot complete task " + taskId + " in status " + task.getStatus());
                case PENDING:
                    if (!task.isReady(completedTaskIds)) {
                        throw new IllegalStateException("Cannot complete task " + taskId
                            + " before its dependencies " + task.getDependencies());
                    }
                    task.start(task.getAssignedWorker(), now);
                    break;
                default:
                    break;
            }
            task.complete(result, now);
            completedTaskIds.add(taskId);

            for (String dependentId : dependents.getOrDefault(taskId, Set.of())) {
                Task dependent = tasks.get(dependentId);
                if (dependent != null && dependent.isReady(completedTaskIds)) {
                    unblocked.add(dependentId);
                }
            }
            workflow = workflows.get(task.getWorkflowId());
            workflowCompleted = workflow != null && workflow.completeIfFinished(now);
        } finally {
            graphLock.unlock();
        }

        logger.info("Task {} completed by {}", taskId, task.getAssignedWorker());
        events.publish(OrchestrationEvent.of(EventType.TASK_COMPLETED, taskId,
            attributes("workerId", task.getAssignedWorker(), "workflowId", task.getWorkflowId(),
                       "durationMs", durationMs(task))));
        for (String dependentId : unblocked) {
            events.publish(OrchestrationEvent.of(EventType.TASK_READY, dependentId,
                attributes("workflowId", task.getWorkflowId(), "unblockedBy", taskId)));
        }
        saveResult(task, result, now);

        if (workflow != null) {
            if (workflowCompleted) {
                logger.info("Workflow {} completed", workflow.getId());
                events.publish(OrchestrationEvent.of(EventType.WORKFLOW_COMPLETED, workflow.getId(),
                    attributes("tasks", workflow.getTasks().size())));
                persistQuietly(workflow);
            }
            publishProgress(workflow);
        }
        return true;
    }

    /**
     * Marks the task failed and blocks every non-terminal task that transitively depends on it.
     * The scheduler never retries a failed task.
     *
     * @return false if the task had already failed
     * @throws IllegalStateException if the task has completed
     */
    public boolean markTaskFailed(String taskId, ErrorInfo error) throws TaskNotFoundException {
        Objects.requireNonNull(error, "Error cannot be null");
        Task task;
        List<Task> blocked;

        graphLock.lock();
        try {
            task = requireTask(taskId);
            if (task.getStatus() == TaskStatus.FAILED) {
                return false;
            }
            if (task.getStatus() == TaskStatus.COMPLETED) {
                throw new IllegalStateException("Cannot fail completed task " + taskId);
            }
            task.fail(error, clock.instant());
            blocked = blockDependents(taskId);
        } finally {
            graphLock.unlock();
        }

        logger.warn("Task {} failed: {}", taskId, error);
        afterFailure(task, error, blocked);
        return true;
    }

    public boolean markTaskFailed(String taskId, String reason) throws TaskNotFoundException {
        return markTaskFailed(taskId, ErrorInfo.of(ErrorKind.EXECUTION_FAILED, reason));
    }

    /**
     * Cancels a non-terminal task. Its dependents are blocked and the assigned worker,
     * if any, receives a {@code task_cancelled} message.
     *
     * @return false if the task was already terminal
     */
    public boolean cancelTask(String taskId, String reason) throws TaskNotFoundException {
        ErrorInfo error = ErrorInfo.cancelled(reason);
        Task task;
        String worker;
        List<Task> blocked;

        graphLock.lock();
        try {
            task = requireTask(taskId);
            if (task.getStatus().isTerminal()) {
                return false;
            }
            worker = task.getAssignedWorker();
            task.fail(error, clock.instant());
            blocked = blockDependents(taskId);
        } finally {
            graphLock.unlock();
        }

        logger.info("Task {} cancelled: {}", taskId, error.getMessage());
        if (worker != null) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("taskId", taskId);
            payload.put("reason", error.getMessage());
            bus.publish(Message.builder()
                .type(TaskMessages.TASK_CANCELLED)
                .to(worker)
                .priority(Priority.HIGH)
                .payload(payload)
                .build());
        }
        afterFailure(task, error, blocked);
        return true;
    }

    private List<Task> blockDependents(String failedTaskId) {
        List<Task> blocked = new ArrayList<>();
        Deque<String> frontier = new ArrayDeque<>(dependents.getOrDefault(failedTaskId, Set.of()));
        Set<String> seen = new HashSet<>();
        ErrorInfo reason = ErrorInfo.of(ErrorKind.DEPENDENCY_BLOCKED, "Dependency " + failedTaskId + " failed");
        while (!frontier.isEmpty()) {
            String id = frontier.poll();
            if (!seen.add(id)) {
                continue;
            }
            Task dependent = tasks.get(id);
            if (dependent == null) {
                continue;
            }
            TaskStatus status = dependent.getStatus();
            if (status == TaskStatus.PENDING || status == TaskStatus.IN_PROGRESS) {
                dependent.block(reason);
                blocked.add(dependent);
            }
            frontier.addAll(dependents.getOrDefault(id, Set.of()));
        }
        return blocked;
    }

    private void afterFailure(Task task, ErrorInfo error, List<Task> blocked) {
        events.publish(OrchestrationEvent.of(EventType.TASK_FAILED, task.getId(),
            attributes("workerId", task.getAssignedWorker(), "workflowId", task.getWorkflowId(),
                       "errorKind", error.getKind(), "error", error.getMessage())));
        for (Task dependent : blocked) {
            logger.info("Task {} blocked by failure of {}", dependent.getId(), task.getId());
            events.publish(OrchestrationEvent.of(EventType.TASK_BLOCKED, dependent.getId(),
                attributes("workflowId", dependent.getWorkflowId(), "blockedBy", task.getId(),
                           "errorKind", ErrorKind.DEPENDENCY_BLOCKED)));
        }
        Workflow workflow = getWorkflow(task.getWorkflowId()).orElse(null);
        if (workflow != null) {
            publishProgress(workflow);
        }
    }

    /**
     * Returns a non-terminal task to pending with no worker
     *
     * @return false if the task is already terminal
     */
    public boolean reassign(String taskId) throws TaskNotFoundException {
        Task task;
        String previousWorker;
        TaskStatus previousStatus;
        graphLock.lock();
        try {
            task = requireTask(taskId);
            previousStatus = task.getStatus();
            if (previousStatus.isTerminal()) {
                return false;
            }
            previousWorker = task.getAssignedWorker();
            task.reset();
        } finally {
            graphLock.unlock();
        }

        logger.info("Task {} returned to pending (was {} on {})", taskId, previousStatus, previousWorker);
        events.publish(OrchestrationEvent.of(EventType.TASK_REASSIGNED, taskId,
            attributes("previousWorker", previousWorker, "previousStatus", previousStatus)));
        return true;
    }

    /**
     * Requeues every in-progress task of a worker that went offline
     *
     * @return the number of tasks requeued
     */
    public int handleWorkerOffline(String workerId) {
        List<Task> requeued = new ArrayList<>();
        graphLock.lock();
        try {
            for (Task task : tasks.values()) {
                if (task.getStatus() == TaskStatus.IN_PROGRESS && workerId.equals(task.getAssignedWorker())) {
                    task.reset();
                    requeued.add(task);
                }
            }
        } finally {
            graphLock.unlock();
        }

        if (!requeued.isEmpty()) {
            logger.warn("Worker {} is offline, requeued {} tasks", workerId, requeued.size());
        }
        for (Task task : requeued) {
            events.publish(OrchestrationEvent.of(EventType.TASK_REASSIGNED, task.getId(),
                attributes("previousWorker", workerId, "reason", ErrorKind.WORKER_OFFLINE)));
        }
        return requeued.size();
    }

    /**
     * Records worker-reported progress; progress never decreases
     */
    public boolean updateTaskProgress(String taskId, int progress) throws TaskNotFoundException {
        Task task;
        graphLock.lock();
        try {
            task = requireTask(taskId);
            if (!task.updateProgress(progress)) {
                return false;
            }
        } finally {
            graphLock.unlock();
        }
        events.publish(OrchestrationEvent.of(EventType.TASK_PROGRESS, taskId,
            attributes("progress", task.getProgress(), "workerId", task.getAssignedWorker())));
        return true;
    }

    private void onWorkerMessage(Message message) {
        try {
            if (TaskMessages.TASK_RESULT.equals(message.getType())) {
                TaskOutcome outcome = TaskOutcome.fromPayload(message.getFrom(), message.getPayload());
                requireAssignedTo(outcome.getTaskId(), message.getFrom());
                if (outcome.isSuccess()) {
                    markTaskCompleted(outcome.getTaskId(), outcome.getOutput());
                } else {
                    markTaskFailed(outcome.getTaskId(), outcome.getError());
                }
            } else if (TaskMessages.TASK_PROGRESS.equals(message.getType())) {
                Map<?, ?> payload = message.getPayload() instanceof Map ? (Map<?, ?>) message.getPayload() : Map.of();
                Object taskId = payload.get("taskId");
                Object progress = payload.get("progress");
                if (taskId == null || !(progress instanceof Number)) {
                    throw new ValidationException("Progress payload needs taskId and a numeric progress");
                }
                requireAssignedTo(taskId.toString(), message.getFrom());
                updateTaskProgress(taskId.toString(), ((Number) progress).intValue());
            }
        } catch (TaskNotFoundException e) {
            logger.warn("Report {} from {} refers to an unknown task: {}",
                       message.getId(), message.getFrom(), e.getMessage());
        } catch (ValidationException | IllegalStateException e) {
            logger.warn("Rejected {} message {} from {}: {}",
                       message.getType(), message.getId(), message.getFrom(), e.getMessage());
        }
    }

    // Workers may only report on tasks they hold
    private void requireAssignedTo(String taskId, String workerId) throws TaskNotFoundException {
        String assigned;
        graphLock.lock();
        try {
            assigned = requireTask(taskId).getAssignedWorker();
        } finally {
            graphLock.unlock();
        }
        if (!Objects.equals(assigned, workerId)) {
            throw new IllegalStateException("Task " + taskId + " is assigned to " + assigned + ", not " + workerId);
        }
    }

    // ---------------------------------------------------------------- introspection

    public WorkflowStatusReport getWorkflowStatus() {
        graphLock.lock();
        try {
            Map<TaskStatus, Long> counts = tasks.values().stream()
                .collect(Collectors.groupingBy(Task::getStatus, () -> new EnumMap<>(TaskStatus.class),
                                               Collectors.counting()));
            List<String> active = workflows.values().stream()
                .filter(w -> w.getStatus() != WorkflowStatus.COMPLETED)
                .map(Workflow::getId)
                .collect(Collectors.toList());
            return new WorkflowStatusReport(counts, active, clock.instant());
        } finally {
            graphLock.unlock();
        }
    }

    public WorkflowProgress getWorkflowStatus(String workflowId) throws WorkflowNotFoundException {
        return WorkflowProgress.of(requireWorkflow(workflowId));
    }

    public Optional<Workflow> getWorkflow(String workflowId) {
        if (workflowId == null) {
            return Optional.empty();
        }
        graphLock.lock();
        try {
            return Optional.ofNullable(workflows.get(workflowId));
        } finally {
            graphLock.unlock();
        }
    }

    public Optional<Task> getTask(String taskId) {
        graphLock.lock();
        try {
            return Optional.ofNullable(tasks.get(taskId));
        } finally {
            graphLock.unlock();
        }
    }

    /**
     * Dependencies of every task of the workflow, in workflow order
     */
    public Map<String, Set<String>> getTaskGraph(String workflowId) throws WorkflowNotFoundException {
        Map<String, Set<String>> graph = new LinkedHashMap<>();
        for (Task task : requireWorkflow(workflowId).getTasks()) {
            graph.put(task.getId(), task.getDependencies());
        }
        return graph;
    }

    /**
     * Tasks of the workflow grouped by the worker they are assigned to
     */
    public Map<String, List<Task>> getTaskAssignments(String workflowId) throws WorkflowNotFoundException {
        Map<String, List<Task>> assignments = new LinkedHashMap<>();
        for (Task task : requireWorkflow(workflowId).getTasks()) {
            String worker = task.getAssignedWorker();
            if (worker != null) {
                assignments.computeIfAbsent(worker, k -> new ArrayList<>()).add(task);
            }
        }
        return assignments;
    }

    // ---------------------------------------------------------------- persistence

    /**
     * Writes the workflow and its tasks to the state store as a new workflow record version
     *
     * @return the version written
     */
    public long persistWorkflow(String workflowId) throws WorkflowNotFoundException {
        return persist(requireWorkflow(workflowId));
    }

    public Optional<WorkflowRecord> loadWorkflow(String workflowId) {
        return store.loadWorkflow(workflowId);
    }

    private long persist(Workflow workflow) {
        long version;
        synchronized (workflowVersions) {
            version = workflowVersions.merge(workflow.getId(), 1L, Long::sum);
        }
        Map<String, Object> data = objectMapper.convertValue(workflow, MAP_TYPE);
        store.saveWorkflow(new WorkflowRecord(workflow.getId(), data, version, clock.instant()));
        logger.debug("Persisted workflow {} version {}", workflow.getId(), version);
        return version;
    }

    private void persistQuietly(Workflow workflow) {
        try {
            persist(workflow);
        } catch (StateStoreException | IllegalArgumentException e) {
            logger.warn("Failed to persist workflow {}", workflow.getId(), e);
        }
    }

    private void saveResult(Task task, Object result, Instant now) {
        String worker = task.getAssignedWorker() != null ? task.getAssignedWorker() : Message.SYSTEM;
        try {
            store.saveResult(new ResultRecord(worker, task.getId(), result, now));
        } catch (StateStoreException e) {
            logger.warn("Failed to save result of task {}", task.getId(), e);
        }
    }

    private void publishProgress(Workflow workflow) {
        WorkflowProgress progress = WorkflowProgress.of(workflow);
        String key = TaskMessages.WORKFLOW_STATE_PREFIX + workflow.getId();
        try {
            sync.setState(key, progress.toStateValue(clock.instant()), Message.SYSTEM);
        } catch (LockTimeoutException e) {
            logger.warn("Could not publish progress of workflow {}: {}", workflow.getId(), e.getMessage());
        } catch (StateStoreException e) {
            logger.warn("Could not persist progress of workflow {}", workflow.getId(), e);
        }
    }

    // ---------------------------------------------------------------- retention

    /**
     * Drops workflows that have settled for longer than the task retention window. A workflow
     * has settled once none of its tasks is pending or in progress. Each dropped workflow is
     * archived to the state store first.
     *
     * @return the number of tasks dropped
     */
    public int purgeExpired() {
        Instant cutoff = clock.instant().minus(taskRetention);
        List<Workflow> expired = new ArrayList<>();

        graphLock.lock();
        try {
            for (Workflow workflow : workflows.values()) {
                if (isSettledBefore(workflow, cutoff)) {
                    expired.add(workflow);
                }
            }
        } finally {
            graphLock.unlock();
        }

        int dropped = 0;
        for (Workflow workflow : expired) {
            persistQuietly(workflow);
            graphLock.lock();
            try {
                workflows.remove(workflow.getId());
                for (Task task : workflow.getTasks()) {
                    tasks.remove(task.getId());
                    dropped++;
                }
                for (Task task : workflow.getTasks()) {
                    Set<String> remaining = dependents.get(task.getId());
                    if (remaining != null) {
                        remaining.removeIf(id -> !tasks.containsKey(id));
                    }
                    if (remaining == null || remaining.isEmpty()) {
                        dependents.remove(task.getId());
                        completedTaskIds.remove(task.getId());
                    }
                }
            } finally {
                graphLock.unlock();
            }
            synchronized (workflowVersions) {
                workflowVersions.remove(workflow.getId());
            }
            logger.info("Purged workflow {} ({} tasks)", workflow.getId(), workflow.getTasks().size());
        }
        return dropped;
    }

    private static boolean isSettledBefore(Workflow workflow, Instant cutoff) {
        if (workflow.getStatus() == WorkflowStatus.COMPLETED) {
            return workflow.getCompletedAt() != null && workflow.getCompletedAt().isBefore(cutoff);
        }
        Instant lastActivity = null;
        for (Task task : workflow.getTasks()) {
            TaskStatus status = task.getStatus();
            if (status == TaskStatus.PENDING || status == TaskStatus.IN_PROGRESS) {
                return false;
            }
            Instant completedAt = task.getCompletedAt();
            if (completedAt != null && (lastActivity == null || completedAt.isAfter(lastActivity))) {
                lastActivity = completedAt;
            }
        }
        return lastActivity != null && lastActivity.isBefore(cutoff);
    }

    // ---------------------------------------------------------------- helpers

    private Task requireTask(String taskId) throws TaskNotFoundException {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new TaskNotFoundException(taskId);
        }
        return task;
    }

    private Workflow requireWorkflow(String workflowId) throws WorkflowNotFoundException {
        return getWorkflow(workflowId).orElseThrow(() -> new WorkflowNotFoundException(workflowId));
    }

    private static long durationMs(Task task) {
        if (task.getStartedAt() == null || task.getCompletedAt() == null) {
            return 0L;
        }
        return Duration.between(task.getStartedAt(), task.getCompletedAt()).toMillis();
    }

    private static Map<String, Object> attributes(Object... keysAndValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keysAndValues.length; i += 2) {
            if (keysAndValues[i + 1] != null) {
                map.put(String.valueOf(keysAndValues[i]), keysAndValues[i + 1]);
            }
        }
        return map;
    }
}
