package com.enterprise.orchestration.scheduler;

import com.enterprise.orchestration.MutableClock;
import com.enterprise.orchestration.bus.Message;
import com.enterprise.orchestration.bus.MessageBus;
import com.enterprise.orchestration.bus.Priority;
import com.enterprise.orchestration.bus.RetryPolicy;
import com.enterprise.orchestration.core.*;
import com.enterprise.orchestration.dlq.InMemoryDeadLetterQueue;
import com.enterprise.orchestration.events.EventPublisher;
import com.enterprise.orchestration.events.EventType;
import com.enterprise.orchestration.events.OrchestrationEvent;
import com.enterprise.orchestration.exception.TaskNotFoundException;
import com.enterprise.orchestration.exception.ValidationException;
import com.enterprise.orchestration.exception.WorkflowNotFoundException;
import com.enterprise.orchestration.store.InMemoryStateStore;
import com.enterprise.orchestration.sync.ConflictStrategy;
import com.enterprise.orchestration.sync.StateSynchronizer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for decomposition, readiness, assignment and failure propagation
 */
class TaskGraphSchedulerTest {

    private MutableClock clock;
    private EventPublisher events;
    private List<OrchestrationEvent> recorded;
    private InMemoryStateStore store;
    private MessageBus bus;
    private StateSynchronizer sync;
    private List<WorkerDescriptor> workers;
    private TaskGraphScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-04-01T09:00:00Z"));
        events = new EventPublisher();
        recorded = new CopyOnWriteArrayList<>();
        events.subscribe(recorded::add);
        store = new InMemoryStateStore();

        workers = new CopyOnWriteArrayList<>(List.of(
            WorkerDescriptor.idle("leader-1", "leader", Set.of("planning", "coordination")),
            WorkerDescriptor.idle("researcher-1", "researcher", Set.of("research", "analysis")),
            WorkerDescriptor.idle("dev-1", "developer", Set.of("coding", "testing")),
            WorkerDescriptor.idle("senior-1", "senior_developer", Set.of("deployment", "devops"))));
        WorkerRoster roster = () -> List.copyOf(workers);

        bus = new MessageBus(RetryPolicy.Predefined.immediate(3), Duration.ofHours(1),
                             new InMemoryDeadLetterQueue(100, false, Duration.ofDays(1)), events, roster, clock);
        sync = new StateSynchronizer(store, events, Duration.ofSeconds(1), Duration.ofSeconds(1),
                                     ConflictStrategy.MERGE, clock);
        scheduler = newScheduler(PhaseCatalog.defaults(), 10);
        scheduler.registerResultListener();
    }

    private TaskGraphScheduler newScheduler(PhaseCatalog catalog, int maxConcurrentTasks) {
        return new TaskGraphScheduler(catalog, TaskClassificationTable.defaults(), GoalClassifier.fixed(null),
                                      bus, sync, store, events, () -> List.copyOf(workers),
                                      maxConcurrentTasks, Duration.ofHours(1), clock);
    }

    private Workflow distributeBasicPlan() {
        Workflow workflow = scheduler.createExecutionPlan("leader-1", "Ship the release");
        scheduler.distributeTasks(workflow);
        return workflow;
    }

    private static String taskOf(Workflow workflow, String phase) {
        return workflow.getTasks().stream()
            .filter(t -> t.getType().equals(phase))
            .findFirst()
            .orElseThrow()
            .getId();
    }

    private long count(EventType type) {
        return recorded.stream().filter(e -> e.getType() == type).count();
    }

    @Test
    void testCreateExecutionPlanBuildsLinearChain() {
        Workflow workflow = scheduler.createExecutionPlan("leader-1", "Build a web shop", "web_application");

        assertTrue(workflow.getId().matches("workflow_\\d+_[0-9a-f]{8}"));
        assertEquals("web_application", workflow.getCategory());
        assertEquals(WorkflowStatus.CREATED, workflow.getStatus());
        assertEquals(7, workflow.getTasks().size());

        List<Task> tasks = workflow.getTasks();
        assertEquals(workflow.getId() + "_requirements_analysis_0", tasks.get(0).getId());
        assertTrue(tasks.get(0).getDependencies().isEmpty());
        for (int i = 1; i < tasks.size(); i++) {
            assertEquals(Set.of(tasks.get(i - 1).getId()), tasks.get(i).getDependencies());
        }

        Task backend = tasks.get(2);
        assertEquals("backend_development", backend.getType());
        assertEquals("senior_developer", backend.getPreferredRole());
        assertEquals(Duration.ofHours(16), backend.getEstimatedDuration());
        assertEquals(workflow.getId(), backend.getWorkflowId());
        assertEquals(1, count(EventType.PLAN_CREATED));

        // Not scheduled until distributed
        assertFalse(scheduler.getWorkflow(workflow.getId()).isPresent());
    }

    @Test
    void testClassificationTableDrivesPriorityAndRole() {
        Workflow workflow = scheduler.createExecutionPlan("leader-1", "Ship the release", "basic");

        Task planning = workflow.getTasks().get(0);
        assertEquals("planning", planning.getType());
        assertEquals(5, planning.getPriority());
        assertEquals(Complexity.HIGH, planning.getComplexity());
        assertEquals("leader", planning.getPreferredRole());

        Task testing = workflow.getTasks().get(3);
        assertEquals(3, testing.getPriority());
        assertEquals(Complexity.LOW, testing.getComplexity());
    }

    @Test
    void testUnknownCategoryFallsBackToBasic() {
        Workflow workflow = scheduler.createExecutionPlan("leader-1", "Something new", "space_program");

        assertEquals(PhaseCatalog.BASIC, workflow.getCategory());
        assertEquals(List.of("planning", "research", "implementation", "testing", "deployment"),
            workflow.getTasks().stream().map(Task::getType).collect(Collectors.toList()));
    }

    @Test
    void testGoalClassifierPicksCategory() {
        TaskGraphScheduler classifying = new TaskGraphScheduler(PhaseCatalog.defaults(),
            TaskClassificationTable.defaults(),
            goal -> goal.contains("model") ? "machine_learning" : null,
            bus, sync, store, events, WorkerRoster.empty(), 10, Duration.ofHours(1), clock);

        assertEquals("machine_learning", classifying.createExecutionPlan("leader-1", "Train a model").getCategory());
        assertEquals(PhaseCatalog.BASIC, classifying.createExecutionPlan("leader-1", "Write docs").getCategory());
    }

    @Test
    void testCreateExecutionPlanValidation() {
        assertThrows(ValidationException.class, () -> scheduler.createExecutionPlan("", "goal"));
        assertThrows(ValidationException.class, () -> scheduler.createExecutionPlan("leader-1", " "));
    }

    @Test
    void testDependentBecomesReadyOnlyAfterAllPredecessors() throws Exception {
        PhaseCatalog catalog = PhaseCatalog.builder()
            .category("research_project", Complexity.MEDIUM,
                PhaseTemplate.builder("planning").independent().build(),
                PhaseTemplate.builder("research").independent().build(),
                PhaseTemplate.builder("implementation").dependsOn("planning", "research").build())
            .build();
        TaskGraphScheduler graph = newScheduler(catalog, 10);
        Workflow workflow = graph.createExecutionPlan("leader-1", "Prototype", "research_project");
        graph.distributeTasks(workflow);

        String planning = taskOf(workflow, "planning");
        String research = taskOf(workflow, "research");
        String implementation = taskOf(workflow, "implementation");

        // Planning outranks research, implementation is not ready
        assertEquals(planning, graph.getNextTask().orElseThrow().getId());
        assertEquals(List.of(planning, research),
            graph.getReadyTasks().stream().map(Task::getId).collect(Collectors.toList()));

        graph.markTaskCompleted(planning, "plan");
        assertEquals(research, graph.getNextTask().orElseThrow().getId());
        assertFalse(graph.getReadyTasks().stream().anyMatch(t -> t.getId().equals(implementation)));

        graph.markTaskCompleted(research, "findings");
        assertEquals(implementation, graph.getNextTask().orElseThrow().getId());
    }

    @Test
    void testDistributeRejectsDuplicates() {
        Workflow workflow = distributeBasicPlan();

        assertThrows(ValidationException.class, () -> scheduler.distributeTasks(workflow));
    }

    @Test
    void testDistributeRejectsUnknownDependency() {
        Task orphan = Task.builder().id("orphan").type("implementation").dependsOn("missing").build();
        Workflow workflow = new Workflow("wf-orphan", "Orphan", "leader-1", "basic", Complexity.LOW,
                                         List.of(orphan), Instant.now());

        assertThrows(ValidationException.class, () -> scheduler.distributeTasks(workflow));
        assertFalse(scheduler.getTask("orphan").isPresent());
    }

    @Test
    void testDistributeRejectsCycles() {
        Task a = Task.builder().id("a").type("implementation").dependsOn("c").build();
        Task b = Task.builder().id("b").type("testing").dependsOn("a").build();
        Task c = Task.builder().id("c").type("deployment").dependsOn("b").build();
        Workflow workflow = new Workflow("wf-cycle", "Cycle", "leader-1", "basic", Complexity.LOW,
                                         List.of(a, b, c), Instant.now());

        assertThrows(ValidationException.class, () -> scheduler.distributeTasks(workflow));
        assertFalse(scheduler.getWorkflow("wf-cycle").isPresent());
    }

    @Test
    void testDistributeEmitsEvents() {
        distributeBasicPlan();

        assertEquals(5, count(EventType.TASK_ADDED));
        assertEquals(1, count(EventType.TASK_READY));
    }

    @Test
    void testScheduleAssignsBestWorkerAndSendsAssignment() {
        Workflow workflow = distributeBasicPlan();
        String planning = taskOf(workflow, "planning");

        List<Assignment> made = scheduler.scheduleReadyTasks();

        assertEquals(1, made.size());
        Assignment assignment = made.get(0);
        assertEquals(planning, assignment.getTaskId());
        assertEquals("leader-1", assignment.getWorkerId().orElseThrow());
        assertEquals(0.9, assignment.getScore(), 0.0001);
        assertEquals("Assigned to leader-1 (score: 90.0%) - Role match: leader, Workload: 0%",
                     assignment.getReasoning());

        Task task = scheduler.getTask(planning).orElseThrow();
        assertEquals(TaskStatus.IN_PROGRESS, task.getStatus());
        assertEquals("leader-1", task.getAssignedWorker());
        assertEquals(WorkflowStatus.IN_PROGRESS, workflow.getStatus());
        assertEquals(1, count(EventType.WORKFLOW_STARTED));

        List<Message> sent = bus.getHistory("leader-1");
        assertEquals(1, sent.size());
        Message message = sent.get(0);
        assertEquals(TaskMessages.TASK_ASSIGNMENT, message.getType());
        assertEquals(Priority.HIGH, message.getPriority());
        Map<?, ?> payload = (Map<?, ?>) message.getPayload();
        assertEquals(planning, payload.get("taskId"));
        assertEquals(workflow.getId(), payload.get("workflowId"));
        assertEquals(assignment.getReasoning(), payload.get("reasoning"));

        // Already running, nothing new to assign
        assertTrue(scheduler.scheduleReadyTasks().isEmpty());
    }

    @Test
    void testScheduleRespectsConcurrencyLimit() {
        PhaseCatalog catalog = PhaseCatalog.builder()
            .category("parallel", Complexity.LOW,
                PhaseTemplate.builder("documentation").independent().build(),
                PhaseTemplate.builder("testing").independent().build())
            .build();
        TaskGraphScheduler limited = newScheduler(catalog, 1);
        limited.distributeTasks(limited.createExecutionPlan("leader-1", "Polish", "parallel"));

        assertEquals(1, limited.scheduleReadyTasks().size());
        assertEquals(1, limited.getWorkflowStatus().getInProgressTasks());
        assertEquals(1, limited.getWorkflowStatus().getPendingTasks());
    }

    @Test
    void testScheduleWithoutWorkersLeavesTasksPending() {
        workers.clear();
        Workflow workflow = distributeBasicPlan();

        assertTrue(scheduler.scheduleReadyTasks().isEmpty());
        assertEquals(TaskStatus.PENDING, scheduler.getTask(taskOf(workflow, "planning")).orElseThrow().getStatus());
    }

    @Test
    void testWorkerResultMessagesDriveCompletion() {
        Workflow workflow = distributeBasicPlan();
        String planning = taskOf(workflow, "planning");
        scheduler.scheduleReadyTasks();

        Map<String, Object> progress = new LinkedHashMap<>();
        progress.put("taskId", planning);
        progress.put("progress", 60);
        bus.publish(Message.builder().type(TaskMessages.TASK_PROGRESS).from("leader-1").to(Message.SYSTEM)
            .payload(progress).build());
        bus.deliverPending();
        assertEquals(60, scheduler.getTask(planning).orElseThrow().getProgress());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("taskId", planning);
        result.put("success", true);
        result.put("output", "roadmap");
        bus.publish(Message.builder().type(TaskMessages.TASK_RESULT).from("leader-1").to(Message.SYSTEM)
            .payload(result).build());
        bus.deliverPending();

        Task task = scheduler.getTask(planning).orElseThrow();
        assertEquals(TaskStatus.COMPLETED, task.getStatus());
        assertEquals("roadmap", task.getResult());
        assertEquals(1, store.loadResults("leader-1").size());
        assertEquals(taskOf(workflow, "research"), scheduler.getNextTask().orElseThrow().getId());
    }

    @Test
    void testMalformedWorkerReportIsIgnored() {
        distributeBasicPlan();

        bus.publish(Message.builder().type(TaskMessages.TASK_RESULT).from("leader-1").to(Message.SYSTEM)
            .payload(Map.of("success", true)).build());
        bus.publish(Message.builder().type(TaskMessages.TASK_RESULT).from("leader-1").to(Message.SYSTEM)
            .payload(Map.of("taskId", "nope", "success", true)).build());

        assertEquals(2, bus.deliverPending());
        assertEquals(0, scheduler.getWorkflowStatus().getCompletedTasks());
    }

    @Test
    void testCompletionIsIdempotent() throws Exception {
        Workflow workflow = distributeBasicPlan();
        String planning = taskOf(workflow, "planning");

        assertTrue(scheduler.markTaskCompleted(planning, "first"));
        assertFalse(scheduler.markTaskCompleted(planning, "second"));

        assertEquals("first", scheduler.getTask(planning).orElseThrow().getResult());
        assertEquals(1, count(EventType.TASK_COMPLETED));
    }

    @Test
    void testCompletionBeforeDependenciesIsRejected() {
        Workflow workflow = distributeBasicPlan();
        String implementation = taskOf(workflow, "implementation");

        assertThrows(IllegalStateException.class, () -> scheduler.markTaskCompleted(implementation, "too early"));

        assertEquals(TaskStatus.PENDING, scheduler.getTask(implementation).orElseThrow().getStatus());
        assertEquals(List.of(taskOf(workflow, "planning")),
            scheduler.getReadyTasks().stream().map(Task::getId).collect(Collectors.toList()));
        assertEquals(0, count(EventType.TASK_COMPLETED));
    }

    @Test
    void testResultFromOtherWorkerIsIgnored() {
        Workflow workflow = distributeBasicPlan();
        String planning = taskOf(workflow, "planning");
        String implementation = taskOf(workflow, "implementation");
        scheduler.scheduleReadyTasks();
        int startedProgress = scheduler.getTask(planning).orElseThrow().getProgress();

        // Planning is held by leader-1; implementation is held by nobody yet
        for (String taskId : List.of(planning, implementation)) {
            bus.publish(Message.builder().type(TaskMessages.TASK_RESULT).from("dev-1").to(Message.SYSTEM)
                .payload(Map.of("taskId", taskId, "success", true)).build());
        }
        bus.publish(Message.builder().type(TaskMessages.TASK_PROGRESS).from("dev-1").to(Message.SYSTEM)
            .payload(Map.of("taskId", planning, "progress", 90)).build());
        bus.deliverPending();

        Task task = scheduler.getTask(planning).orElseThrow();
        assertEquals(TaskStatus.IN_PROGRESS, task.getStatus());
        assertEquals(startedProgress, task.getProgress());
        assertEquals(TaskStatus.PENDING, scheduler.getTask(implementation).orElseThrow().getStatus());
        assertEquals(0, scheduler.getWorkflowStatus().getCompletedTasks());
    }

    @Test
    void testUnknownTaskThrows() {
        assertThrows(TaskNotFoundException.class, () -> scheduler.markTaskCompleted("missing", null));
        assertThrows(TaskNotFoundException.class, () -> scheduler.markTaskFailed("missing", "boom"));
        assertThrows(TaskNotFoundException.class, () -> scheduler.cancelTask("missing", "why"));
        assertThrows(WorkflowNotFoundException.class, () -> scheduler.getWorkflowStatus("missing"));
    }

    @Test
    void testFailureBlocksTransitiveDependents() throws Exception {
        Workflow workflow = distributeBasicPlan();
        scheduler.markTaskCompleted(taskOf(workflow, "planning"), "plan");

        assertTrue(scheduler.markTaskFailed(taskOf(workflow, "research"), "source unavailable"));

        Task research = scheduler.getTask(taskOf(workflow, "research")).orElseThrow();
        assertEquals(TaskStatus.FAILED, research.getStatus());
        assertEquals(ErrorKind.EXECUTION_FAILED, research.getError().getKind());
        for (String phase : List.of("implementation", "testing", "deployment")) {
            Task blocked = scheduler.getTask(taskOf(workflow, phase)).orElseThrow();
            assertEquals(TaskStatus.BLOCKED, blocked.getStatus());
            assertEquals(ErrorKind.DEPENDENCY_BLOCKED, blocked.getError().getKind());
        }
        assertEquals(3, count(EventType.TASK_BLOCKED));
        assertFalse(scheduler.getNextTask().isPresent());

        WorkflowProgress progress = scheduler.getWorkflowStatus(workflow.getId());
        assertEquals(1, progress.getCompletedTasks());
        assertEquals(1, progress.getFailedTasks());
        assertEquals(3, progress.getBlockedTasks());
        assertEquals(20, progress.getProgress());

        // Failed tasks are final
        assertFalse(scheduler.markTaskFailed(taskOf(workflow, "research"), "again"));
        assertThrows(IllegalStateException.class,
            () -> scheduler.markTaskCompleted(taskOf(workflow, "research"), "late"));
        assertThrows(IllegalStateException.class,
            () -> scheduler.markTaskFailed(taskOf(workflow, "planning"), "too late"));
    }

    @Test
    void testCancelNotifiesAssignedWorker() throws Exception {
        Workflow workflow = distributeBasicPlan();
        String planning = taskOf(workflow, "planning");
        scheduler.scheduleReadyTasks();

        assertTrue(scheduler.cancelTask(planning, "Goal withdrawn"));

        Task task = scheduler.getTask(planning).orElseThrow();
        assertEquals(TaskStatus.FAILED, task.getStatus());
        assertEquals(ErrorKind.CANCELLED, task.getError().getKind());
        assertEquals(TaskStatus.BLOCKED, scheduler.getTask(taskOf(workflow, "research")).orElseThrow().getStatus());

        Message cancellation = bus.getHistory("leader-1").stream()
            .filter(m -> m.getType().equals(TaskMessages.TASK_CANCELLED))
            .findFirst()
            .orElseThrow();
        assertEquals(Priority.HIGH, cancellation.getPriority());
        assertEquals(planning, ((Map<?, ?>) cancellation.getPayload()).get("taskId"));

        assertFalse(scheduler.cancelTask(planning, "again"));
    }

    @Test
    void testReassignReturnsTaskToPending() throws Exception {
        Workflow workflow = distributeBasicPlan();
        String planning = taskOf(workflow, "planning");
        scheduler.scheduleReadyTasks();

        assertTrue(scheduler.reassign(planning));

        Task task = scheduler.getTask(planning).orElseThrow();
        assertEquals(TaskStatus.PENDING, task.getStatus());
        assertNull(task.getAssignedWorker());
        assertEquals(1, count(EventType.TASK_REASSIGNED));

        scheduler.markTaskCompleted(planning, "done");
        assertFalse(scheduler.reassign(planning));
    }

    @Test
    void testOfflineWorkerTasksAreRequeued() {
        Workflow workflow = distributeBasicPlan();
        String planning = taskOf(workflow, "planning");
        scheduler.scheduleReadyTasks();
        assertEquals("leader-1", scheduler.getTask(planning).orElseThrow().getAssignedWorker());

        // The roster now reports the leader offline
        workers.set(0, workers.get(0).withStatus(WorkerStatus.OFFLINE));
        List<Assignment> made = scheduler.scheduleReadyTasks();

        assertTrue(recorded.stream().anyMatch(e -> e.getType() == EventType.TASK_REASSIGNED
                && ErrorKind.WORKER_OFFLINE == e.getAttribute("reason")));
        assertEquals(1, made.size());
        assertNotEquals("leader-1", scheduler.getTask(planning).orElseThrow().getAssignedWorker());
    }

    @Test
    void testHandleWorkerOfflineRequeuesOnlyThatWorker() {
        Workflow workflow = distributeBasicPlan();
        String planning = taskOf(workflow, "planning");
        scheduler.scheduleReadyTasks();

        assertEquals(0, scheduler.handleWorkerOffline("dev-1"));
        assertEquals(1, scheduler.handleWorkerOffline("leader-1"));

        Task task = scheduler.getTask(planning).orElseThrow();
        assertEquals(TaskStatus.PENDING, task.getStatus());
        assertNull(task.getAssignedWorker());
        assertEquals(1, count(EventType.TASK_REASSIGNED));
    }

    @Test
    void testWorkflowCompletesAndPublishesProgress() throws Exception {
        Workflow workflow = distributeBasicPlan();

        for (Task task : workflow.getTasks()) {
            scheduler.markTaskCompleted(task.getId(), task.getType() + " done");
        }

        assertEquals(WorkflowStatus.COMPLETED, workflow.getStatus());
        assertEquals(1, count(EventType.WORKFLOW_COMPLETED));

        Map<?, ?> state = (Map<?, ?>) sync
            .getState(TaskMessages.WORKFLOW_STATE_PREFIX + workflow.getId())
            .orElseThrow();
        assertEquals("COMPLETED", state.get("status"));
        assertEquals(100, state.get("progress"));
        assertEquals(5, state.get("completedTasks"));
        assertEquals(5, state.get("totalTasks"));

        WorkflowStatusReport report = scheduler.getWorkflowStatus();
        assertEquals(5, report.getTotalTasks());
        assertEquals(100, report.getProgress());
        assertTrue(report.getActiveWorkflows().isEmpty());
    }

    @Test
    void testTaskGraphAndAssignments() throws Exception {
        Workflow workflow = distributeBasicPlan();
        scheduler.scheduleReadyTasks();

        Map<String, Set<String>> graph = scheduler.getTaskGraph(workflow.getId());
        assertEquals(5, graph.size());
        assertTrue(graph.get(taskOf(workflow, "planning")).isEmpty());

        Map<String, List<Task>> assignments = scheduler.getTaskAssignments(workflow.getId());
        assertEquals(Set.of("leader-1"), assignments.keySet());
    }

    @Test
    void testPersistWorkflowVersions() throws Exception {
        Workflow workflow = distributeBasicPlan();

        assertEquals(2, scheduler.persistWorkflow(workflow.getId()));
        assertEquals(2, scheduler.loadWorkflow(workflow.getId()).orElseThrow().getVersion());
        assertEquals(workflow.getId(), scheduler.loadWorkflow(workflow.getId()).orElseThrow().getData().get("id"));
    }

    @Test
    void testPurgeDropsSettledWorkflowsAfterRetention() throws Exception {
        Workflow finished = distributeBasicPlan();
        for (Task task : finished.getTasks()) {
            scheduler.markTaskCompleted(task.getId(), null);
        }
        Workflow running = distributeBasicPlan();

        // Still inside the retention window
        assertEquals(0, scheduler.purgeExpired());

        clock.advance(Duration.ofHours(2));
        assertEquals(5, scheduler.purgeExpired());

        assertFalse(scheduler.getWorkflow(finished.getId()).isPresent());
        assertFalse(scheduler.getTask(taskOf(finished, "planning")).isPresent());
        assertTrue(scheduler.loadWorkflow(finished.getId()).isPresent());
        assertTrue(scheduler.getWorkflow(running.getId()).isPresent());
    }

    @Test
    void testPurgeDropsFailedWorkflows() throws Exception {
        Workflow workflow = distributeBasicPlan();
        scheduler.markTaskFailed(taskOf(workflow, "planning"), "abandoned");

        clock.advance(Duration.ofHours(2));

        assertEquals(5, scheduler.purgeExpired());
        assertFalse(scheduler.getWorkflow(workflow.getId()).isPresent());
    }
}
