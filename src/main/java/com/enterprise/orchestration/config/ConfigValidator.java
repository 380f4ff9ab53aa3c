package com.enterprise.orchestration.config;

import it.sauronsoftware.cron4j.SchedulingPattern;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Validates orchestration configuration
 */
public class ConfigValidator {

    /**
     * Validate the configuration and return any validation errors
     */
    public List<ValidationError> validate(OrchestrationConfig config) {
        List<ValidationError> errors = new ArrayList<>();

        validateSchedulerConfig(config.getSchedulerConfig(), errors);
        validateBusConfig(config.getBusConfig(), errors);
        validateSyncConfig(config.getSyncConfig(), errors);
        validateStoreConfig(config.getStoreConfig(), errors);
        validateDeadLetterQueueConfig(config.getDlqConfig(), errors);
        validateHousekeepingConfig(config.getHousekeepingConfig(), errors);

        return errors;
    }

    private void validateSchedulerConfig(OrchestrationConfig.SchedulerConfig config, List<ValidationError> errors) {
        if (config == null) {
            errors.add(new ValidationError("scheduler", "Scheduler configuration is required"));
            return;
        }
        requirePositive("scheduler.tickInterval", config.getTickInterval(), errors);
        if (config.getMaxConcurrentTasks() <= 0) {
            errors.add(new ValidationError("scheduler.maxConcurrentTasks",
                "Maximum concurrent tasks must be greater than 0"));
        }
        requireNonNegative("scheduler.taskRetention", config.getTaskRetention(), errors);
        if (config.getPhaseCatalog() == null) {
            errors.add(new ValidationError("scheduler.phaseCatalog", "Phase catalog is required"));
        }
        if (config.getClassificationTable() == null) {
            errors.add(new ValidationError("scheduler.classificationTable", "Classification table is required"));
        }
    }

    private void validateBusConfig(OrchestrationConfig.BusConfig config, List<ValidationError> errors) {
        if (config == null) {
            errors.add(new ValidationError("bus", "Bus configuration is required"));
            return;
        }
        requirePositive("bus.deliveryInterval", config.getDeliveryInterval(), errors);
        if (config.getMaxRetries() <= 0) {
            errors.add(new ValidationError("bus.maxRetries",
                "Maximum retries must be greater than 0"));
        }
        requireNonNegative("bus.baseRetryDelay", config.getBaseRetryDelay(), errors);
        requireNonNegative("bus.maxRetryDelay", config.getMaxRetryDelay(), errors);
        if (config.getBaseRetryDelay() != null && config.getMaxRetryDelay() != null
                && config.getBaseRetryDelay().compareTo(config.getMaxRetryDelay()) > 0) {
            errors.add(new ValidationError("bus.delayRange",
                "Base retry delay cannot be greater than maximum retry delay"));
        }
        requireNonNegative("bus.historyRetention", config.getHistoryRetention(), errors);
    }

    private void validateSyncConfig(OrchestrationConfig.SyncConfig config, List<ValidationError> errors) {
        if (config == null) {
            errors.add(new ValidationError("sync", "Sync configuration is required"));
            return;
        }
        requirePositive("sync.reconcileInterval", config.getReconcileInterval(), errors);
        requirePositive("sync.lockTimeout", config.getLockTimeout(), errors);
        requirePositive("sync.manualResolutionTimeout", config.getManualResolutionTimeout(), errors);
        if (config.getDefaultStrategy() == null) {
            errors.add(new ValidationError("sync.defaultStrategy", "Default conflict strategy is required"));
        }
    }

    private void validateStoreConfig(OrchestrationConfig.StoreConfig config, List<ValidationError> errors) {
        if (config == null) {
            errors.add(new ValidationError("store", "Store configuration is required"));
            return;
        }
        if (config.isPersistent() && config.getDbPath().trim().isEmpty()) {
            errors.add(new ValidationError("store.dbPath",
                "Database path cannot be blank"));
        }
    }

    private void validateDeadLetterQueueConfig(OrchestrationConfig.DeadLetterQueueConfig config,
                                               List<ValidationError> errors) {
        if (config == null) {
            errors.add(new ValidationError("dlq", "Dead letter queue configuration is required"));
            return;
        }
        if (config.isPersistent() && (config.getDbPath() == null || config.getDbPath().trim().isEmpty())) {
            errors.add(new ValidationError("dlq.dbPath",
                "Database path is required for a persistent dead letter queue"));
        }
        if (config.getMaxCapacity() <= 0) {
            errors.add(new ValidationError("dlq.maxCapacity",
                "Maximum capacity must be greater than 0"));
        }
        if (config.isEnableRetentionPolicy()) {
            requirePositive("dlq.retention", config.getRetention(), errors);
        }
    }

    private void validateHousekeepingConfig(OrchestrationConfig.HousekeepingConfig config,
                                            List<ValidationError> errors) {
        if (config == null) {
            errors.add(new ValidationError("housekeeping", "Housekeeping configuration is required"));
            return;
        }
        if (config.isEnabled() && (config.getCronPattern() == null
                || !SchedulingPattern.validate(config.getCronPattern()))) {
            errors.add(new ValidationError("housekeeping.cronPattern",
                "Invalid cron expression: " + config.getCronPattern()));
        }
    }

    private static void requirePositive(String field, Duration value, List<ValidationError> errors) {
        if (value == null || value.isZero() || value.isNegative()) {
            errors.add(new ValidationError(field, "Must be greater than 0"));
        }
    }

    private static void requireNonNegative(String field, Duration value, List<ValidationError> errors) {
        if (value == null) {
            errors.add(new ValidationError(field, "Is required"));
        } else if (value.isNegative()) {
            errors.add(new ValidationError(field, "Cannot be negative"));
        }
    }

    /**
     * Validation error
     */
    public static class ValidationError {
        private final String field;
        private final String message;

        public ValidationError(String field, String message) {
            this.field = field;
            this.message = message;
        }

        public String getField() { return field; }
        public String getMessage() { return message; }

        @Override
        public String toString() {
            return String.format("%s: %s", field, message);
        }
    }
}
