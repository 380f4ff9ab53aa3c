package com.enterprise.orchestration.scheduler;

import com.enterprise.orchestration.core.Complexity;
import com.enterprise.orchestration.core.Task;
import com.enterprise.orchestration.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One phase of a project category's plan.
 * <p>
 * Priority, complexity and role are optional here: the classification table takes precedence for
 * priority and complexity, the template for the role. {@code dependsOn} is null for the default
 * linear chain, empty for a phase with no dependencies, or the names of earlier phases.
 */
public final class PhaseTemplate {

    private final String phaseName;
    private final Integer priority;
    private final Complexity complexity;
    private final String preferredRole;
    private final double estimatedHours;
    private final String description;
    private final List<String> dependsOn;

    private PhaseTemplate(Builder builder) {
        this.phaseName = builder.phaseName;
        this.priority = builder.priority;
        this.complexity = builder.complexity;
        this.preferredRole = builder.preferredRole;
        this.estimatedHours = builder.estimatedHours;
        this.description = builder.description;
        this.dependsOn = builder.dependsOn != null ? Collections.unmodifiableList(builder.dependsOn) : null;
    }

    public static PhaseTemplate of(String phaseName) {
        return builder(phaseName).build();
    }

    public static PhaseTemplate of(String phaseName, String preferredRole, double estimatedHours) {
        return builder(phaseName).preferredRole(preferredRole).estimatedHours(estimatedHours).build();
    }

    public String getPhaseName() { return phaseName; }

    public Integer getPriority() { return priority; }

    public Complexity getComplexity() { return complexity; }

    public String getPreferredRole() { return preferredRole; }

    public double getEstimatedHours() { return estimatedHours; }

    public String getDescription() { return description; }

    /**
     * Null when the phase follows its predecessor
     */
    public List<String> getDependsOn() { return dependsOn; }

    public boolean hasExplicitDependencies() {
        return dependsOn != null;
    }

    @Override
    public String toString() {
        return "PhaseTemplate{" + phaseName + (dependsOn != null ? ", dependsOn=" + dependsOn : "") + '}';
    }

    public static Builder builder(String phaseName) {
        return new Builder(phaseName);
    }

    public static class Builder {
        private final String phaseName;
        private Integer priority;
        private Complexity complexity;
        private String preferredRole;
        private double estimatedHours;
        private String description;
        private List<String> dependsOn;

        private Builder(String phaseName) {
            this.phaseName = phaseName;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder complexity(Complexity complexity) {
            this.complexity = complexity;
            return this;
        }

        public Builder preferredRole(String preferredRole) {
            this.preferredRole = preferredRole;
            return this;
        }

        public Builder estimatedHours(double estimatedHours) {
            this.estimatedHours = estimatedHours;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder dependsOn(String... phases) {
            if (this.dependsOn == null) {
                this.dependsOn = new ArrayList<>();
            }
            Collections.addAll(this.dependsOn, phases);
            return this;
        }

        /**
         * Marks the phase as having no dependencies at all
         */
        public Builder independent() {
            this.dependsOn = new ArrayList<>();
            return this;
        }

        public PhaseTemplate build() {
            if (phaseName == null || phaseName.isBlank()) {
                throw new ValidationException("Phase name is required");
            }
            if (priority != null && (priority < Task.MIN_PRIORITY || priority > Task.MAX_PRIORITY)) {
                throw new ValidationException("Phase " + phaseName + " priority must be between "
                        + Task.MIN_PRIORITY + " and " + Task.MAX_PRIORITY);
            }
            if (estimatedHours < 0) {
                throw new ValidationException("Phase " + phaseName + " estimated hours cannot be negative");
            }
            if (dependsOn != null && dependsOn.contains(phaseName)) {
                throw new ValidationException("Phase " + phaseName + " cannot depend on itself");
            }
            return new PhaseTemplate(this);
        }
    }
}
