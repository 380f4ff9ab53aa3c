package com.enterprise.orchestration.integration;

import com.enterprise.orchestration.OrchestratorFactory;
import com.enterprise.orchestration.bus.Message;
import com.enterprise.orchestration.config.OrchestrationConfig;
import com.enterprise.orchestration.core.*;
import com.enterprise.orchestration.monitoring.HealthChecker;
import com.enterprise.orchestration.monitoring.HealthReport;
import com.enterprise.orchestration.scheduler.GoalClassifier;
import com.enterprise.orchestration.scheduler.PhaseCatalog;
import com.enterprise.orchestration.scheduler.TaskClassificationTable;
import com.enterprise.orchestration.scheduler.TaskMessages;
import com.enterprise.orchestration.scheduler.WorkflowProgress;
import com.enterprise.orchestration.sync.ConflictStrategy;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs a workflow end to end through the background ticks, with workers answering over the bus
 */
class OrchestratorIntegrationTest {

    private DefaultOrchestrator orchestrator;
    private SimpleMeterRegistry registry;
    private final List<String> handledTasks = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        OrchestrationConfig config = OrchestrationConfig.builder()
            .schedulerConfig(new OrchestrationConfig.SchedulerConfig(
                Duration.ofMillis(50), 10, Duration.ofHours(1),
                PhaseCatalog.defaults(), TaskClassificationTable.defaults(), GoalClassifier.fixed(null)))
            .busConfig(new OrchestrationConfig.BusConfig(
                Duration.ofMillis(20), 3, Duration.ofMillis(10), Duration.ofMillis(100), Duration.ofHours(1)))
            .syncConfig(new OrchestrationConfig.SyncConfig(
                Duration.ofMillis(200), Duration.ofSeconds(1), Duration.ofSeconds(1), ConflictStrategy.MERGE))
            .build();

        WorkerRoster roster = WorkerRoster.of(List.of(
            WorkerDescriptor.idle("leader-1", "leader", Set.of("planning", "coordination")),
            WorkerDescriptor.idle("dev-1", "developer", Set.of("coding", "testing", "research")),
            WorkerDescriptor.idle("senior-1", "senior_developer", Set.of("deployment", "devops"))));

        registry = new SimpleMeterRegistry();
        orchestrator = OrchestratorFactory.create(config, roster, registry);
        for (String worker : List.of("leader-1", "dev-1", "senior-1")) {
            orchestrator.subscribe(worker, List.of(TaskMessages.TASK_ASSIGNMENT), message -> completeAssignment(worker, message));
        }
        orchestrator.start();
    }

    @AfterEach
    void tearDown() throws Exception {
        if (orchestrator != null) {
            orchestrator.stop().get(10, TimeUnit.SECONDS);
            orchestrator.close();
        }
    }

    // Simulated worker: reports success for every assignment it receives
    private void completeAssignment(String worker, Message assignment) {
        Map<?, ?> payload = (Map<?, ?>) assignment.getPayload();
        String taskId = payload.get("taskId").toString();
        handledTasks.add(worker + ":" + payload.get("type"));

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("taskId", taskId);
        result.put("success", true);
        result.put("output", payload.get("type") + " done by " + worker);
        orchestrator.publish(Message.builder()
            .type(TaskMessages.TASK_RESULT)
            .from(worker)
            .to(Message.SYSTEM)
            .payload(result)
            .build());
    }

    private static void await(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("Condition not met within " + timeout);
            }
            Thread.sleep(20);
        }
    }

    @Test
    void testWorkflowRunsToCompletion() throws Exception {
        assertTrue(orchestrator.isRunning());

        Workflow workflow = orchestrator.createExecutionPlan("leader-1", "Ship the release", "basic");
        orchestrator.distributeTasks(workflow);

        // Progress is published last, after the completion events
        String stateKey = TaskMessages.WORKFLOW_STATE_PREFIX + workflow.getId();
        await(() -> orchestrator.getState(stateKey)
                .map(value -> "COMPLETED".equals(((Map<?, ?>) value).get("status")))
                .orElse(false),
            Duration.ofSeconds(10));

        assertEquals(WorkflowStatus.COMPLETED, workflow.getStatus());

        // Phases ran in dependency order on the best matching workers
        assertEquals(List.of("leader-1:planning", "dev-1:research", "dev-1:implementation",
                             "dev-1:testing", "senior-1:deployment"), handledTasks);

        WorkflowProgress progress = orchestrator.getWorkflowStatus(workflow.getId());
        assertEquals(100, progress.getProgress());
        assertEquals(5, progress.getCompletedTasks());

        assertEquals(5.0, registry.get("orchestration.tasks.completed").counter().count());
        assertEquals(1.0, registry.get("orchestration.workflows.completed").counter().count());
    }

    @Test
    void testUndeliverableMessageIsDeadLettered() throws Exception {
        String id = orchestrator.publish(Message.builder().type("ping").to("ghost").build());

        await(() -> !orchestrator.getDeadLetters().isEmpty(), Duration.ofSeconds(10));

        assertEquals(id, orchestrator.getDeadLetters().get(0).getMessageId());
        assertEquals(ErrorKind.RECIPIENT_NOT_FOUND, orchestrator.getDeadLetters().get(0).getErrorKind());
        assertEquals(3, orchestrator.getDeadLetters().get(0).getRetryCount());
    }

    @Test
    void testHealthCheck() throws Exception {
        HealthReport report = new HealthChecker(orchestrator).performHealthCheck()
            .get(5, TimeUnit.SECONDS);

        assertTrue(report.getCheck("orchestrator.running").orElseThrow().isPassed());
        assertTrue(report.getCheck("bus.queue").orElseThrow().isPassed());
        assertTrue(report.getCheck("bus.dlq").orElseThrow().isPassed());
        assertTrue(report.getCheck("sync.pending_conflicts").orElseThrow().isPassed());
        // No task has finished yet
        assertFalse(report.getCheck("tasks.success_rate").isPresent());
    }

    @Test
    void testStopAndRestart() throws Exception {
        orchestrator.stop().get(10, TimeUnit.SECONDS);
        assertFalse(orchestrator.isRunning());

        orchestrator.start();
        assertTrue(orchestrator.isRunning());
    }
}
