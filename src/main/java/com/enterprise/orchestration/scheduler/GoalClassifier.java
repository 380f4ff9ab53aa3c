package com.enterprise.orchestration.scheduler;

/**
 * Maps a free-text goal to a project category of the phase catalog.
 * Returning null or an unknown category selects the catalog's default category.
 */
@FunctionalInterface
public interface GoalClassifier {

    String classify(String goal);

    static GoalClassifier fixed(String category) {
        return goal -> category;
    }
}
