package com.enterprise.orchestration.scheduler;

import com.enterprise.orchestration.core.Complexity;
import com.enterprise.orchestration.core.Task;
import com.enterprise.orchestration.exception.ValidationException;

import java.util.*;

/**
 * Per-phase defaults for priority, complexity, preferred role and the capabilities a worker
 * needs to be a good fit. Phases without an entry use {@link #DEFAULT_CAPABILITIES}.
 */
public final class TaskClassificationTable {

    public static final Set<String> DEFAULT_CAPABILITIES = Collections.singleton("general");

    private final Map<String, Classification> classifications;

    private TaskClassificationTable(Map<String, Classification> classifications) {
        this.classifications = Collections.unmodifiableMap(classifications);
    }

    public Optional<Classification> lookup(String phase) {
        return Optional.ofNullable(phase != null ? classifications.get(phase) : null);
    }

    /**
     * Capabilities a worker should have for the given task type
     */
    public Set<String> requiredCapabilities(String taskType) {
        return lookup(taskType)
            .map(Classification::getCapabilities)
            .filter(caps -> !caps.isEmpty())
            .orElse(DEFAULT_CAPABILITIES);
    }

    public Set<String> getPhases() {
        return classifications.keySet();
    }

    public static TaskClassificationTable defaults() {
        return builder()
            .classify("planning", 5, Complexity.HIGH, "leader",
                "planning", "strategic_thinking", "coordination")
            .classify("research", 4, Complexity.MEDIUM, "researcher",
                "research", "data_collection", "analysis")
            .classify("complex_coding", 5, Complexity.HIGH, "senior_developer",
                "complex_coding", "architecture", "debugging")
            .classify("implementation", 3, Complexity.MEDIUM, "developer",
                "coding", "programming")
            .classify("testing", 3, Complexity.LOW, "developer",
                "testing", "quality_assurance")
            .classify("documentation", 2, Complexity.LOW, "developer",
                "documentation", "writing")
            .classify("deployment", 4, Complexity.MEDIUM, "senior_developer",
                "deployment", "devops", "system_administration")
            .classify("architecture", 5, Complexity.HIGH, "leader")
            .classify("development", 3, Complexity.MEDIUM, "developer")
            .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Classification of one phase name
     */
    public static final class Classification {
        private final int priority;
        private final Complexity complexity;
        private final String role;
        private final Set<String> capabilities;

        public Classification(int priority, Complexity complexity, String role, Set<String> capabilities) {
            if (priority < Task.MIN_PRIORITY || priority > Task.MAX_PRIORITY) {
                throw new ValidationException("Classification priority must be between "
                        + Task.MIN_PRIORITY + " and " + Task.MAX_PRIORITY + ": " + priority);
            }
            this.priority = priority;
            this.complexity = Objects.requireNonNull(complexity, "Complexity cannot be null");
            this.role = role;
            this.capabilities = capabilities != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(capabilities))
                : Collections.emptySet();
        }

        public int getPriority() { return priority; }

        public Complexity getComplexity() { return complexity; }

        public String getRole() { return role; }

        public Set<String> getCapabilities() { return capabilities; }
    }

    public static class Builder {
        private final Map<String, Classification> classifications = new LinkedHashMap<>();

        public Builder classify(String phase, int priority, Complexity complexity, String role,
                                String... capabilities) {
            if (phase == null || phase.isBlank()) {
                throw new ValidationException("Phase name is required");
            }
            classifications.put(phase, new Classification(priority, complexity, role,
                    new LinkedHashSet<>(Arrays.asList(capabilities))));
            return this;
        }

        public TaskClassificationTable build() {
            return new TaskClassificationTable(new LinkedHashMap<>(classifications));
        }
    }
}
