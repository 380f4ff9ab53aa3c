package com.enterprise.orchestration;

import com.enterprise.orchestration.config.OrchestrationConfig;
import com.enterprise.orchestration.core.DefaultOrchestrator;
import com.enterprise.orchestration.core.WorkerRoster;
import com.enterprise.orchestration.dlq.InMemoryDeadLetterQueue;
import com.enterprise.orchestration.dlq.MapDBDeadLetterQueue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorFactoryTest {

    @TempDir
    File tempDir;

    @Test
    void testCreateDefault() {
        try (DefaultOrchestrator orchestrator = OrchestratorFactory.createDefault()) {
            assertNotNull(orchestrator);
            assertFalse(orchestrator.isRunning());
            assertTrue(orchestrator.getHousekeeping().isPresent());
            assertTrue(orchestrator.getMetricsCollector().isPresent());
            assertTrue(orchestrator.getMessageBus().getDeadLetterQueue() instanceof InMemoryDeadLetterQueue);
        }
    }

    @Test
    void testCreateWithPersistentStorage() throws Exception {
        OrchestrationConfig config = OrchestrationConfig.builder()
            .storeConfig(new OrchestrationConfig.StoreConfig(new File(tempDir, "state.db").getAbsolutePath()))
            .dlqConfig(new OrchestrationConfig.DeadLetterQueueConfig(
                true, new File(tempDir, "dlq.db").getAbsolutePath(), 100, true, Duration.ofDays(7)))
            .monitoringConfig(new OrchestrationConfig.MonitoringConfig(false, true))
            .housekeepingConfig(new OrchestrationConfig.HousekeepingConfig(false, null))
            .build();

        try (DefaultOrchestrator orchestrator = OrchestratorFactory.create(config, WorkerRoster.empty())) {
            assertTrue(orchestrator.getMessageBus().getDeadLetterQueue() instanceof MapDBDeadLetterQueue);
            assertFalse(orchestrator.getHousekeeping().isPresent());
            assertFalse(orchestrator.getMetricsCollector().isPresent());

            orchestrator.setState("shared", "value", "leader-1");
            assertEquals("value", orchestrator.getState("shared").orElseThrow());
        }
    }

    @Test
    void testCreateWithInvalidConfig() {
        OrchestrationConfig invalidConfig = OrchestrationConfig.builder()
            .schedulerConfig(new OrchestrationConfig.SchedulerConfig(
                Duration.ofSeconds(1), -1, Duration.ofHours(1),
                OrchestrationConfig.Defaults.defaultSchedulerConfig().getPhaseCatalog(),
                OrchestrationConfig.Defaults.defaultSchedulerConfig().getClassificationTable(), null))
            .build();

        IllegalArgumentException error = assertThrows(IllegalArgumentException.class,
            () -> OrchestratorFactory.create(invalidConfig, WorkerRoster.empty()));
        assertTrue(error.getMessage().startsWith("Configuration validation failed:"));
        assertTrue(error.getMessage().contains("scheduler.maxConcurrentTasks"));
    }

    @Test
    void testClosedOrchestratorCannotStart() {
        DefaultOrchestrator orchestrator = OrchestratorFactory.createDefault();
        orchestrator.close();

        assertThrows(IllegalStateException.class, orchestrator::start);
    }
}
