package com.enterprise.orchestration;

import com.enterprise.orchestration.bus.MessageBus;
import com.enterprise.orchestration.bus.RetryPolicy;
import com.enterprise.orchestration.config.ConfigValidator;
import com.enterprise.orchestration.config.OrchestrationConfig;
import com.enterprise.orchestration.core.DefaultOrchestrator;
import com.enterprise.orchestration.core.Orchestrator;
import com.enterprise.orchestration.core.WorkerRoster;
import com.enterprise.orchestration.dlq.DeadLetterQueue;
import com.enterprise.orchestration.dlq.InMemoryDeadLetterQueue;
import com.enterprise.orchestration.dlq.MapDBDeadLetterQueue;
import com.enterprise.orchestration.events.EventPublisher;
import com.enterprise.orchestration.monitoring.HealthChecker;
import com.enterprise.orchestration.monitoring.MetricsCollector;
import com.enterprise.orchestration.scheduler.HousekeepingScheduler;
import com.enterprise.orchestration.scheduler.TaskGraphScheduler;
import com.enterprise.orchestration.store.InMemoryStateStore;
import com.enterprise.orchestration.store.MapDBStateStore;
import com.enterprise.orchestration.store.StateStore;
import com.enterprise.orchestration.sync.StateSynchronizer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Factory for creating and configuring the orchestration core
 */
public class OrchestratorFactory {

    private static final Logger logger = LoggerFactory.getLogger(OrchestratorFactory.class);

    private OrchestratorFactory() {
    }

    /**
     * Create an orchestrator with default configuration and no registered workers
     */
    public static DefaultOrchestrator createDefault() {
        return create(OrchestrationConfig.builder().build(), WorkerRoster.empty());
    }

    /**
     * Create an orchestrator with custom configuration
     */
    public static DefaultOrchestrator create(OrchestrationConfig config, WorkerRoster roster) {
        MeterRegistry meterRegistry = config.getMonitoringConfig() != null
                && config.getMonitoringConfig().isEnableMetrics() ? new SimpleMeterRegistry() : null;
        return create(config, roster, meterRegistry);
    }

    /**
     * Create an orchestrator that reports metrics to the given registry; a null registry disables metrics
     */
    public static DefaultOrchestrator create(OrchestrationConfig config, WorkerRoster roster,
                                             MeterRegistry meterRegistry) {
        ConfigValidator validator = new ConfigValidator();
        List<ConfigValidator.ValidationError> errors = validator.validate(config);

        if (!errors.isEmpty()) {
            StringBuilder errorMsg = new StringBuilder("Configuration validation failed:\n");
            errors.forEach(error -> errorMsg.append("  - ").append(error).append("\n"));
            throw new IllegalArgumentException(errorMsg.toString());
        }

        logger.info("Creating orchestrator with configuration: {}", config);

        StateStore store = null;
        DeadLetterQueue deadLetterQueue = null;
        try {
            EventPublisher events = new EventPublisher();
            MetricsCollector metricsCollector = null;
            if (meterRegistry != null) {
                metricsCollector = new MetricsCollector(meterRegistry);
                metricsCollector.bindTo(events);
            }

            store = createStore(config.getStoreConfig());
            deadLetterQueue = createDeadLetterQueue(config.getDlqConfig());

            MessageBus bus = createMessageBus(config.getBusConfig(), deadLetterQueue, events, roster);
            StateSynchronizer sync = createSynchronizer(config.getSyncConfig(), store, events);
            TaskGraphScheduler scheduler = createScheduler(config.getSchedulerConfig(), bus, sync, store,
                                                           events, roster);

            HousekeepingScheduler housekeeping = null;
            if (config.getHousekeepingConfig().isEnabled()) {
                housekeeping = new HousekeepingScheduler(scheduler, bus,
                                                         config.getHousekeepingConfig().getCronPattern());
            }

            DefaultOrchestrator orchestrator = new DefaultOrchestrator(
                scheduler, bus, sync, store, deadLetterQueue, events, housekeeping, metricsCollector,
                config.getSchedulerConfig().getTickInterval(),
                config.getBusConfig().getDeliveryInterval(),
                config.getSyncConfig().getReconcileInterval());

            logger.info("Orchestrator created successfully");
            return orchestrator;

        } catch (RuntimeException e) {
            logger.error("Failed to create orchestrator", e);
            if (deadLetterQueue != null) {
                deadLetterQueue.close();
            }
            if (store != null) {
                store.close();
            }
            throw new IllegalStateException("Failed to create orchestrator", e);
        }
    }

    /**
     * Health checker bound to the given orchestrator
     */
    public static HealthChecker createHealthChecker(Orchestrator orchestrator) {
        return new HealthChecker(orchestrator);
    }

    private static StateStore createStore(OrchestrationConfig.StoreConfig config) {
        if (!config.isPersistent()) {
            return new InMemoryStateStore();
        }
        return new MapDBStateStore(config.getDbPath());
    }

    private static DeadLetterQueue createDeadLetterQueue(OrchestrationConfig.DeadLetterQueueConfig config) {
        if (!config.isPersistent()) {
            return new InMemoryDeadLetterQueue(
                config.getMaxCapacity(),
                config.isEnableRetentionPolicy(),
                config.getRetention()
            );
        }

        return new MapDBDeadLetterQueue(
            config.getDbPath(),
            config.getMaxCapacity(),
            config.isEnableRetentionPolicy(),
            config.getRetention()
        );
    }

    private static MessageBus createMessageBus(OrchestrationConfig.BusConfig config, DeadLetterQueue deadLetterQueue,
                                               EventPublisher events, WorkerRoster roster) {
        RetryPolicy retryPolicy = RetryPolicy.builder()
            .maxRetries(config.getMaxRetries())
            .baseDelay(config.getBaseRetryDelay())
            .maxDelay(config.getMaxRetryDelay())
            .build();
        return new MessageBus(retryPolicy, config.getHistoryRetention(), deadLetterQueue, events, roster);
    }

    private static StateSynchronizer createSynchronizer(OrchestrationConfig.SyncConfig config, StateStore store,
                                                        EventPublisher events) {
        return new StateSynchronizer(store, events, config.getLockTimeout(),
                                     config.getManualResolutionTimeout(), config.getDefaultStrategy());
    }

    private static TaskGraphScheduler createScheduler(OrchestrationConfig.SchedulerConfig config, MessageBus bus,
                                                      StateSynchronizer sync, StateStore store,
                                                      EventPublisher events, WorkerRoster roster) {
        return new TaskGraphScheduler(
            config.getPhaseCatalog(),
            config.getClassificationTable(),
            config.getGoalClassifier(),
            bus, sync, store, events, roster,
            config.getMaxConcurrentTasks(),
            config.getTaskRetention());
    }
}
