package com.enterprise.orchestration.scheduler;

import com.enterprise.orchestration.core.Complexity;
import com.enterprise.orchestration.exception.ValidationException;

import java.util.*;

/**
 * Ordered phase templates keyed by project category.
 * Unknown categories fall back to the default category.
 */
public final class PhaseCatalog {

    public static final String BASIC = "basic";
    public static final double DEFAULT_PHASE_HOURS = 4;

    private final Map<String, CategoryPlan> categories;
    private final String defaultCategory;

    private PhaseCatalog(Map<String, CategoryPlan> categories, String defaultCategory) {
        this.categories = Collections.unmodifiableMap(categories);
        this.defaultCategory = defaultCategory;
    }

    /**
     * Resolves a category name, falling back to the default category
     */
    public String resolveCategory(String category) {
        if (category != null && categories.containsKey(category)) {
            return category;
        }
        return defaultCategory;
    }

    public List<PhaseTemplate> phasesFor(String category) {
        return categories.get(resolveCategory(category)).phases;
    }

    public Complexity complexityFor(String category) {
        return categories.get(resolveCategory(category)).complexity;
    }

    public Set<String> getCategories() {
        return categories.keySet();
    }

    public String getDefaultCategory() {
        return defaultCategory;
    }

    /**
     * Catalog of the standard project categories plus the {@code basic} fallback plan
     */
    public static PhaseCatalog defaults() {
        return builder()
            .category(BASIC, Complexity.MEDIUM,
                phase("planning"),
                phase("research"),
                phase("implementation"),
                PhaseTemplate.of("testing", "developer", 8),
                PhaseTemplate.of("deployment", "senior_developer", 4))
            .category("web_application", Complexity.MEDIUM,
                PhaseTemplate.of("requirements_analysis", "leader", 4),
                PhaseTemplate.of("ui_design", "researcher", 8),
                PhaseTemplate.of("backend_development", "senior_developer", 16),
                PhaseTemplate.of("frontend_development", "developer", 12),
                PhaseTemplate.of("integration", "senior_developer", 6),
                PhaseTemplate.of("testing", "developer", 8),
                PhaseTemplate.of("deployment", "senior_developer", 4))
            .category("mobile_app", Complexity.HIGH,
                PhaseTemplate.of("requirements_analysis", "leader", 4),
                phase("ui_ux_design"),
                phase("development"),
                PhaseTemplate.of("testing", "developer", 8),
                PhaseTemplate.of("deployment", "senior_developer", 4))
            .category("api_service", Complexity.MEDIUM,
                phase("api_design"),
                PhaseTemplate.of("backend_development", "senior_developer", 16),
                phase("database_design"),
                PhaseTemplate.of("testing", "developer", 8),
                phase("documentation"),
                PhaseTemplate.of("deployment", "senior_developer", 4))
            .category("data_analysis", Complexity.MEDIUM,
                PhaseTemplate.of("data_collection", "researcher", 6),
                PhaseTemplate.of("data_cleaning", "researcher", 8),
                PhaseTemplate.of("analysis", "researcher", 12),
                PhaseTemplate.of("visualization", "developer", 6),
                PhaseTemplate.of("reporting", "researcher", 4))
            .category("machine_learning", Complexity.HIGH,
                phase("data_preparation"),
                phase("model_design"),
                phase("training"),
                phase("validation"),
                PhaseTemplate.of("deployment", "senior_developer", 4))
            .defaultCategory(BASIC)
            .build();
    }

    // Phase without a task template: role comes from the classification table
    private static PhaseTemplate phase(String name) {
        return PhaseTemplate.builder(name).estimatedHours(DEFAULT_PHASE_HOURS).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static final class CategoryPlan {
        private final Complexity complexity;
        private final List<PhaseTemplate> phases;

        private CategoryPlan(Complexity complexity, List<PhaseTemplate> phases) {
            this.complexity = complexity;
            this.phases = Collections.unmodifiableList(new ArrayList<>(phases));
        }
    }

    public static class Builder {
        private final Map<String, CategoryPlan> categories = new LinkedHashMap<>();
        private String defaultCategory;

        public Builder category(String name, Complexity complexity, PhaseTemplate... phases) {
            return category(name, complexity, Arrays.asList(phases));
        }

        public Builder category(String name, Complexity complexity, List<PhaseTemplate> phases) {
            categories.put(name, new CategoryPlan(complexity != null ? complexity : Complexity.MEDIUM, phases));
            return this;
        }

        public Builder defaultCategory(String defaultCategory) {
            this.defaultCategory = defaultCategory;
            return this;
        }

        public PhaseCatalog build() {
            if (categories.isEmpty()) {
                throw new ValidationException("Phase catalog must define at least one category");
            }
            String fallback = defaultCategory != null ? defaultCategory : categories.keySet().iterator().next();
            if (!categories.containsKey(fallback)) {
                throw new ValidationException("Default category " + fallback + " is not defined");
            }
            categories.forEach(Builder::validatePlan);
            return new PhaseCatalog(new LinkedHashMap<>(categories), fallback);
        }

        private static void validatePlan(String category, CategoryPlan plan) {
            if (category == null || category.isBlank()) {
                throw new ValidationException("Category name is required");
            }
            if (plan.phases.isEmpty()) {
                throw new ValidationException("Category " + category + " has no phases");
            }
            Set<String> seen = new HashSet<>();
            for (PhaseTemplate phase : plan.phases) {
                if (phase.hasExplicitDependencies()) {
                    for (String dependency : phase.getDependsOn()) {
                        if (!seen.contains(dependency)) {
                            throw new ValidationException("Phase " + phase.getPhaseName() + " in " + category
                                    + " depends on " + dependency + " which is not an earlier phase");
                        }
                    }
                }
                if (!seen.add(phase.getPhaseName())) {
                    throw new ValidationException("Duplicate phase " + phase.getPhaseName() + " in " + category);
                }
            }
        }
    }
}
