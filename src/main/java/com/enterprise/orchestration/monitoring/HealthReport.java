package com.enterprise.orchestration.monitoring;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Outcome of one health check run, with checks in the order they were made
 */
public class HealthReport {

    private final Map<String, Check> checks;
    private final Instant checkedAt;

    private HealthReport(Map<String, Check> checks, Instant checkedAt) {
        this.checks = Collections.unmodifiableMap(checks);
        this.checkedAt = checkedAt;
    }

    public boolean isHealthy() {
        return checks.values().stream().allMatch(Check::isPassed);
    }

    public Map<String, Check> getChecks() { return checks; }

    public Optional<Check> getCheck(String name) {
        return Optional.ofNullable(checks.get(name));
    }

    public Instant getCheckedAt() { return checkedAt; }

    public List<Check> getFailed() {
        return checks.values().stream().filter(check -> !check.isPassed()).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "HealthReport{healthy=" + isHealthy() + ", failed=" + getFailed() + ", checkedAt=" + checkedAt + '}';
    }

    public static final class Check {
        private final String name;
        private final boolean passed;
        private final String detail;

        Check(String name, boolean passed, String detail) {
            this.name = name;
            this.passed = passed;
            this.detail = detail;
        }

        public String getName() { return name; }

        public boolean isPassed() { return passed; }

        public String getDetail() { return detail; }

        @Override
        public String toString() {
            return name + (passed ? " ok: " : " FAILED: ") + detail;
        }
    }

    static Builder builder() {
        return new Builder();
    }

    static final class Builder {
        private final List<Check> checks = new ArrayList<>();

        Builder check(String name, boolean passed, String detail) {
            checks.add(new Check(name, passed, detail));
            return this;
        }

        HealthReport build(Instant checkedAt) {
            Map<String, Check> byName = new LinkedHashMap<>();
            for (Check check : checks) {
                byName.put(check.getName(), check);
            }
            return new HealthReport(byName, checkedAt);
        }
    }
}
