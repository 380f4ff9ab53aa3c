package com.enterprise.orchestration.config;

import com.enterprise.orchestration.scheduler.GoalClassifier;
import com.enterprise.orchestration.scheduler.HousekeepingScheduler;
import com.enterprise.orchestration.scheduler.PhaseCatalog;
import com.enterprise.orchestration.scheduler.TaskClassificationTable;
import com.enterprise.orchestration.sync.ConflictStrategy;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration for the orchestration core
 */
public class OrchestrationConfig {

    private final SchedulerConfig schedulerConfig;
    private final BusConfig busConfig;
    private final SyncConfig syncConfig;
    private final StoreConfig storeConfig;
    private final DeadLetterQueueConfig dlqConfig;
    private final MonitoringConfig monitoringConfig;
    private final HousekeepingConfig housekeepingConfig;
    private final Map<String, Object> customProperties;

    public OrchestrationConfig(SchedulerConfig schedulerConfig, BusConfig busConfig, SyncConfig syncConfig,
                               StoreConfig storeConfig, DeadLetterQueueConfig dlqConfig,
                               MonitoringConfig monitoringConfig, HousekeepingConfig housekeepingConfig,
                               Map<String, Object> customProperties) {
        this.schedulerConfig = schedulerConfig;
        this.busConfig = busConfig;
        this.syncConfig = syncConfig;
        this.storeConfig = storeConfig;
        this.dlqConfig = dlqConfig;
        this.monitoringConfig = monitoringConfig;
        this.housekeepingConfig = housekeepingConfig;
        this.customProperties = customProperties;
    }

    public SchedulerConfig getSchedulerConfig() { return schedulerConfig; }
    public BusConfig getBusConfig() { return busConfig; }
    public SyncConfig getSyncConfig() { return syncConfig; }
    public StoreConfig getStoreConfig() { return storeConfig; }
    public DeadLetterQueueConfig getDlqConfig() { return dlqConfig; }
    public MonitoringConfig getMonitoringConfig() { return monitoringConfig; }
    public HousekeepingConfig getHousekeepingConfig() { return housekeepingConfig; }
    public Map<String, Object> getCustomProperties() { return customProperties; }

    @Override
    public String toString() {
        return "OrchestrationConfig{" +
                "maxConcurrentTasks=" + schedulerConfig.getMaxConcurrentTasks() +
                ", maxRetries=" + busConfig.getMaxRetries() +
                ", lockTimeout=" + syncConfig.getLockTimeout() +
                ", store=" + (storeConfig.isPersistent() ? storeConfig.getDbPath() : "in-memory") +
                ", dlq=" + (dlqConfig.isPersistent() ? dlqConfig.getDbPath() : "in-memory") +
                '}';
    }

    /**
     * Task graph scheduler configuration
     */
    public static class SchedulerConfig {
        private final Duration tickInterval;
        private final int maxConcurrentTasks;
        private final Duration taskRetention;
        private final PhaseCatalog phaseCatalog;
        private final TaskClassificationTable classificationTable;
        private final GoalClassifier goalClassifier;

        public SchedulerConfig(Duration tickInterval, int maxConcurrentTasks, Duration taskRetention,
                               PhaseCatalog phaseCatalog, TaskClassificationTable classificationTable,
                               GoalClassifier goalClassifier) {
            this.tickInterval = tickInterval;
            this.maxConcurrentTasks = maxConcurrentTasks;
            this.taskRetention = taskRetention;
            this.phaseCatalog = phaseCatalog;
            this.classificationTable = classificationTable;
            this.goalClassifier = goalClassifier;
        }

        public Duration getTickInterval() { return tickInterval; }
        public int getMaxConcurrentTasks() { return maxConcurrentTasks; }
        public Duration getTaskRetention() { return taskRetention; }
        public PhaseCatalog getPhaseCatalog() { return phaseCatalog; }
        public TaskClassificationTable getClassificationTable() { return classificationTable; }
        public GoalClassifier getGoalClassifier() { return goalClassifier; }
    }

    /**
     * Message bus configuration
     */
    public static class BusConfig {
        private final Duration deliveryInterval;
        private final int maxRetries;
        private final Duration baseRetryDelay;
        private final Duration maxRetryDelay;
        private final Duration historyRetention;

        public BusConfig(Duration deliveryInterval, int maxRetries, Duration baseRetryDelay,
                         Duration maxRetryDelay, Duration historyRetention) {
            this.deliveryInterval = deliveryInterval;
            this.maxRetries = maxRetries;
            this.baseRetryDelay = baseRetryDelay;
            this.maxRetryDelay = maxRetryDelay;
            this.historyRetention = historyRetention;
        }

        public Duration getDeliveryInterval() { return deliveryInterval; }
        public int getMaxRetries() { return maxRetries; }
        public Duration getBaseRetryDelay() { return baseRetryDelay; }
        public Duration getMaxRetryDelay() { return maxRetryDelay; }
        public Duration getHistoryRetention() { return historyRetention; }
    }

    /**
     * State synchronizer configuration
     */
    public static class SyncConfig {
        private final Duration reconcileInterval;
        private final Duration lockTimeout;
        private final Duration manualResolutionTimeout;
        private final ConflictStrategy defaultStrategy;

        public SyncConfig(Duration reconcileInterval, Duration lockTimeout, Duration manualResolutionTimeout,
                          ConflictStrategy defaultStrategy) {
            this.reconcileInterval = reconcileInterval;
            this.lockTimeout = lockTimeout;
            this.manualResolutionTimeout = manualResolutionTimeout;
            this.defaultStrategy = defaultStrategy;
        }

        public Duration getReconcileInterval() { return reconcileInterval; }
        public Duration getLockTimeout() { return lockTimeout; }
        public Duration getManualResolutionTimeout() { return manualResolutionTimeout; }
        public ConflictStrategy getDefaultStrategy() { return defaultStrategy; }
    }

    /**
     * State store configuration. Without a database path the store is kept in memory.
     */
    public static class StoreConfig {
        private final String dbPath;

        public StoreConfig(String dbPath) {
            this.dbPath = dbPath;
        }

        public String getDbPath() { return dbPath; }

        public boolean isPersistent() {
            return dbPath != null;
        }
    }

    /**
     * Dead Letter Queue configuration
     */
    public static class DeadLetterQueueConfig {
        private final boolean persistent;
        private final String dbPath;
        private final int maxCapacity;
        private final boolean enableRetentionPolicy;
        private final Duration retention;

        public DeadLetterQueueConfig(boolean persistent, String dbPath, int maxCapacity,
                                     boolean enableRetentionPolicy, Duration retention) {
            this.persistent = persistent;
            this.dbPath = dbPath;
            this.maxCapacity = maxCapacity;
            this.enableRetentionPolicy = enableRetentionPolicy;
            this.retention = retention;
        }

        public boolean isPersistent() { return persistent; }
        public String getDbPath() { return dbPath; }
        public int getMaxCapacity() { return maxCapacity; }
        public boolean isEnableRetentionPolicy() { return enableRetentionPolicy; }
        public Duration getRetention() { return retention; }
    }

    /**
     * Monitoring configuration
     */
    public static class MonitoringConfig {
        private final boolean enableMetrics;
        private final boolean enableHealthChecks;

        public MonitoringConfig(boolean enableMetrics, boolean enableHealthChecks) {
            this.enableMetrics = enableMetrics;
            this.enableHealthChecks = enableHealthChecks;
        }

        public boolean isEnableMetrics() { return enableMetrics; }
        public boolean isEnableHealthChecks() { return enableHealthChecks; }
    }

    /**
     * Retention housekeeping configuration
     */
    public static class HousekeepingConfig {
        private final boolean enabled;
        private final String cronPattern;

        public HousekeepingConfig(boolean enabled, String cronPattern) {
            this.enabled = enabled;
            this.cronPattern = cronPattern;
        }

        public boolean isEnabled() { return enabled; }
        public String getCronPattern() { return cronPattern; }
    }

    /**
     * Builder for creating configurations
     */
    public static class Builder {
        private SchedulerConfig schedulerConfig = Defaults.defaultSchedulerConfig();
        private BusConfig busConfig = Defaults.defaultBusConfig();
        private SyncConfig syncConfig = Defaults.defaultSyncConfig();
        private StoreConfig storeConfig = Defaults.defaultStoreConfig();
        private DeadLetterQueueConfig dlqConfig = Defaults.defaultDeadLetterQueueConfig();
        private MonitoringConfig monitoringConfig = Defaults.defaultMonitoringConfig();
        private HousekeepingConfig housekeepingConfig = Defaults.defaultHousekeepingConfig();
        private Map<String, Object> customProperties = new java.util.HashMap<>();

        public Builder schedulerConfig(SchedulerConfig schedulerConfig) {
            this.schedulerConfig = schedulerConfig;
            return this;
        }

        public Builder busConfig(BusConfig busConfig) {
            this.busConfig = busConfig;
            return this;
        }

        public Builder syncConfig(SyncConfig syncConfig) {
            this.syncConfig = syncConfig;
            return this;
        }

        public Builder storeConfig(StoreConfig storeConfig) {
            this.storeConfig = storeConfig;
            return this;
        }

        public Builder dlqConfig(DeadLetterQueueConfig dlqConfig) {
            this.dlqConfig = dlqConfig;
            return this;
        }

        public Builder monitoringConfig(MonitoringConfig monitoringConfig) {
            this.monitoringConfig = monitoringConfig;
            return this;
        }

        public Builder housekeepingConfig(HousekeepingConfig housekeepingConfig) {
            this.housekeepingConfig = housekeepingConfig;
            return this;
        }

        public Builder customProperty(String key, Object value) {
            this.customProperties.put(key, value);
            return this;
        }

        public OrchestrationConfig build() {
            return new OrchestrationConfig(schedulerConfig, busConfig, syncConfig, storeConfig,
                                           dlqConfig, monitoringConfig, housekeepingConfig, customProperties);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Default configurations
     */
    public static class Defaults {
        public static SchedulerConfig defaultSchedulerConfig() {
            return new SchedulerConfig(
                Duration.ofSeconds(1), 10, Duration.ofHours(24),
                PhaseCatalog.defaults(), TaskClassificationTable.defaults(), GoalClassifier.fixed(null)
            );
        }

        public static BusConfig defaultBusConfig() {
            return new BusConfig(
                Duration.ofMillis(100), 3, Duration.ofSeconds(1), Duration.ofMinutes(1), Duration.ofHours(24)
            );
        }

        public static SyncConfig defaultSyncConfig() {
            return new SyncConfig(
                Duration.ofSeconds(5), Duration.ofSeconds(10), Duration.ofSeconds(30), ConflictStrategy.MERGE
            );
        }

        public static StoreConfig defaultStoreConfig() {
            return new StoreConfig(null);
        }

        public static DeadLetterQueueConfig defaultDeadLetterQueueConfig() {
            String tmpDir = System.getProperty("java.io.tmpdir");
            String uniqueName = java.util.UUID.randomUUID().toString();
            String path = tmpDir.endsWith("/") ? (tmpDir + "dlq-" + uniqueName + ".db")
                                              : (tmpDir + "/dlq-" + uniqueName + ".db");
            return new DeadLetterQueueConfig(
                false, path, 10000, true, Duration.ofDays(30)
            );
        }

        public static MonitoringConfig defaultMonitoringConfig() {
            return new MonitoringConfig(true, true);
        }

        public static HousekeepingConfig defaultHousekeepingConfig() {
            return new HousekeepingConfig(true, HousekeepingScheduler.DEFAULT_PATTERN);
        }
    }
}
