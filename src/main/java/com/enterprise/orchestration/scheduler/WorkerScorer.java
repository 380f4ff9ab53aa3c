package com.enterprise.orchestration.scheduler;

import com.enterprise.orchestration.core.Assignment;
import com.enterprise.orchestration.core.Task;
import com.enterprise.orchestration.core.WorkerDescriptor;

import java.util.Collection;
import java.util.Locale;
import java.util.Set;

/**
 * Scores workers against a task by role match, capability overlap and spare capacity,
 * and picks the best candidate.
 */
public class WorkerScorer {

    public static final double ROLE_WEIGHT = 0.5;
    public static final double CAPABILITY_WEIGHT = 0.3;
    public static final double LOAD_WEIGHT = 0.2;

    private static final String FALLBACK_ROLE = "developer";

    private final TaskClassificationTable classifications;

    public WorkerScorer(TaskClassificationTable classifications) {
        this.classifications = classifications;
    }

    /**
     * Role the task prefers: its own metadata, then the classification table, then {@code developer}
     */
    public String preferredRole(Task task) {
        String role = task.getPreferredRole();
        if (role != null && !role.isBlank()) {
            return role;
        }
        return classifications.lookup(task.getType())
            .map(TaskClassificationTable.Classification::getRole)
            .filter(r -> r != null && !r.isBlank())
            .orElse(FALLBACK_ROLE);
    }

    /**
     * Suitability of a worker for a task, between 0 and 1. Offline workers score 0.
     */
    public double score(Task task, WorkerDescriptor worker) {
        if (worker.isOffline()) {
            return 0.0;
        }
        double score = 0.0;

        if (preferredRole(task).equals(worker.getRole())) {
            score += ROLE_WEIGHT;
        }

        Set<String> required = classifications.requiredCapabilities(task.getType());
        long matching = required.stream().filter(worker.getCapabilities()::contains).count();
        score += ((double) matching / Math.max(required.size(), 1)) * CAPABILITY_WEIGHT;

        score += ((100 - worker.getCurrentLoad()) / 100.0) * LOAD_WEIGHT;

        return Math.min(score, 1.0);
    }

    /**
     * Picks the candidate with the strictly highest positive score; the first one seen wins ties.
     */
    public Assignment select(Task task, Collection<WorkerDescriptor> candidates) {
        WorkerDescriptor best = null;
        double bestScore = 0.0;
        for (WorkerDescriptor candidate : candidates) {
            double candidateScore = score(task, candidate);
            if (candidateScore > bestScore) {
                bestScore = candidateScore;
                best = candidate;
            }
        }
        if (best == null) {
            return Assignment.unassigned(task.getId());
        }
        return new Assignment(task.getId(), best.getId(), bestScore, reasoning(best, bestScore));
    }

    private static String reasoning(WorkerDescriptor worker, double score) {
        return String.format(Locale.ROOT, "Assigned to %s (score: %.1f%%) - Role match: %s, Workload: %d%%",
                worker.getId(), score * 100, worker.getRole(), worker.getCurrentLoad());
    }
}
