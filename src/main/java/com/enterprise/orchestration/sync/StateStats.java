package com.enterprise.orchestration.sync;

public class StateStats {

    private final int totalStates;
    private final long totalVersions;
    private final double averageVersion;

    public StateStats(int totalStates, long totalVersions) {
        this.totalStates = totalStates;
        this.totalVersions = totalVersions;
        this.averageVersion = totalStates > 0 ? (double) totalVersions / totalStates : 0.0;
    }

    public int getTotalStates() { return totalStates; }

    public long getTotalVersions() { return totalVersions; }

    public double getAverageVersion() { return averageVersion; }

    @Override
    public String toString() {
        return "StateStats{" +
                "totalStates=" + totalStates +
                ", totalVersions=" + totalVersions +
                ", averageVersion=" + averageVersion +
                '}';
    }
}
