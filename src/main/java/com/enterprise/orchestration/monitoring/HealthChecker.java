package com.enterprise.orchestration.monitoring;

import com.enterprise.orchestration.bus.QueueStatus;
import com.enterprise.orchestration.core.Orchestrator;
import com.enterprise.orchestration.dlq.DeadLetterQueueStatistics;
import com.enterprise.orchestration.scheduler.WorkflowStatusReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Runs liveness checks over the scheduler, bus, dead letters and synchronizer
 */
public class HealthChecker {

    private static final Logger logger = LoggerFactory.getLogger(HealthChecker.class);

    private static final int MAX_HEALTHY_QUEUE_SIZE = 10000;
    private static final int MAX_PENDING_CONFLICTS = 100;
    private static final double MIN_SUCCESS_RATE = 80.0;
    private static final double MAX_MEMORY_USAGE = 90.0;

    private final Orchestrator orchestrator;

    public HealthChecker(Orchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    public CompletableFuture<HealthReport> performHealthCheck() {
        return CompletableFuture.supplyAsync(() -> {
            HealthReport.Builder builder = HealthReport.builder();
            builder.check("orchestrator.running", orchestrator.isRunning(),
                orchestrator.isRunning() ? "Orchestrator is running" : "Orchestrator is not running");
            guarded(builder, "bus", () -> checkMessageBus(builder));
            guarded(builder, "tasks", () -> checkTaskGraph(builder));
            guarded(builder, "sync", () -> checkStateSync(builder));
            checkMemory(builder);

            HealthReport report = builder.build(Instant.now());
            if (!report.isHealthy()) {
                logger.warn("Health check failed: {}", report.getFailed());
            }
            return report;
        });
    }

    // A check that throws is reported as a failed "<area>.status" check
    private static void guarded(HealthReport.Builder builder, String area, Runnable check) {
        try {
            check.run();
        } catch (RuntimeException e) {
            logger.debug("Health check for {} threw", area, e);
            builder.check(area + ".status", false, "Check failed: " + e.getMessage());
        }
    }

    private void checkMessageBus(HealthReport.Builder builder) {
        QueueStatus queue = orchestrator.getQueueStatus();
        builder.check("bus.queue", queue.getQueueSize() < MAX_HEALTHY_QUEUE_SIZE,
            String.format("%d queued, %d parked, %d subscribers",
                queue.getQueueSize(), queue.getParkedCount(), queue.getSubscriberCount()));

        DeadLetterQueueStatistics deadLetters = orchestrator.getMessageBus().getDeadLetterQueue().getStatistics();
        builder.check("bus.dlq", deadLetters.getSize() < deadLetters.getCapacity(),
            String.format("%d dead letters (%.1f%% of capacity)", deadLetters.getSize(), deadLetters.getUtilization()));
    }

    private void checkTaskGraph(HealthReport.Builder builder) {
        WorkflowStatusReport report = orchestrator.getWorkflowStatus();
        builder.check("tasks.active", true,
            String.format("%d tasks in progress across %d active workflows",
                report.getInProgressTasks(), report.getActiveWorkflows().size()));

        long finished = report.getCompletedTasks() + report.getFailedTasks();
        if (finished == 0) {
            return;
        }
        double successRate = report.getCompletedTasks() * 100.0 / finished;
        builder.check("tasks.success_rate", successRate > MIN_SUCCESS_RATE,
            String.format("%.1f%% of %d finished tasks completed", successRate, finished));
    }

    private void checkStateSync(HealthReport.Builder builder) {
        int pending = orchestrator.getStateSynchronizer().getPendingConflicts().size();
        builder.check("sync.pending_conflicts", pending < MAX_PENDING_CONFLICTS,
            pending + " conflicts awaiting manual resolution");
    }

    private static void checkMemory(HealthReport.Builder builder) {
        Runtime runtime = Runtime.getRuntime();
        long max = runtime.maxMemory();
        long used = runtime.totalMemory() - runtime.freeMemory();
        double usage = used * 100.0 / max;
        builder.check("system.memory", usage < MAX_MEMORY_USAGE,
            String.format("%.1f%% of %d MB heap in use", usage, max / (1024 * 1024)));
    }
}
