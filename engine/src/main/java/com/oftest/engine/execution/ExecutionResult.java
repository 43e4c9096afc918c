package com.oftest.engine.execution;

import com.oftest.engine.TestResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Results of one suite run with summary counts.
 */
public class ExecutionResult {

    private final String suiteName;
    private final Instant startTime;
    private Instant endTime;
    private final List<TestResult> results = new ArrayList<>();

    public ExecutionResult(String suiteName) {
        this.suiteName = suiteName;
        this.startTime = Instant.now();
    }

    /**
     * Add a test result.
     */
    void addResult(TestResult result) {
        results.add(result);
    }

    /**
     * Mark the run as complete.
     */
    void complete() {
        this.endTime = Instant.now();
    }

    public String getSuiteName() {
        return suiteName;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public List<TestResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    /**
     * Number of tests executed, skipped ones included.
     */
    public int getRan() {
        return results.size();
    }

    public int getPassed() {
        return (int) results.stream().filter(TestResult::isPassed).count();
    }

    public int getFailures() {
        return (int) results.stream().filter(TestResult::isFailed).count();
    }

    public int getErrors() {
        return (int) results.stream().filter(TestResult::isError).count();
    }

    /**
     * Tests that reported themselves skipped while running.
     */
    public int getSkippedAtRuntime() {
        return (int) results.stream().filter(TestResult::isSkipped).count();
    }

    public long getTotalDurationMs() {
        return results.stream().mapToLong(TestResult::getDurationMs).sum();
    }

    public boolean isAllPassed() {
        return getFailures() == 0 && getErrors() == 0;
    }

    /**
     * Get a summary string for the run.
     */
    public String getSummary() {
        return String.format("Suite: %s | Ran: %d | Passed: %d | Failed: %d | Errors: %d | Skipped: %d | Duration: %d ms",
                suiteName, getRan(), getPassed(), getFailures(),
                getErrors(), getSkippedAtRuntime(), getTotalDurationMs());
    }
}
