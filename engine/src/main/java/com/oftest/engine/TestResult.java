package com.oftest.engine;

/**
 * Result of a single test execution.
 *
 * <p>Tests create results with the static factories; the execution reporter
 * then stamps the qualified test name, description and duration through
 * {@link #complete(String, String, long)}.</p>
 */
public final class TestResult {

    /**
     * Test execution status.
     */
    public enum Status {
        PASSED,
        FAILED,
        ERROR,
        SKIPPED
    }

    private final String testName;
    private final String description;
    private final Status status;
    private final String message;
    private final long durationMs;
    private final Throwable error;

    private TestResult(String testName, String description, Status status, String message,
                       long durationMs, Throwable error) {
        this.testName = testName;
        this.description = description;
        this.status = status;
        this.message = message;
        this.durationMs = durationMs;
        this.error = error;
    }

    /**
     * Create a passed result.
     */
    public static TestResult passed(String message) {
        return new TestResult(null, null, Status.PASSED, message, 0, null);
    }

    /**
     * Create a failed result.
     */
    public static TestResult failed(String message) {
        return new TestResult(null, null, Status.FAILED, message, 0, null);
    }

    /**
     * Create a failed result caused by an assertion.
     */
    public static TestResult failed(String message, Throwable error) {
        return new TestResult(null, null, Status.FAILED, message, 0, error);
    }

    /**
     * Create an error result.
     */
    public static TestResult error(String message, Throwable error) {
        return new TestResult(null, null, Status.ERROR, message, 0, error);
    }

    /**
     * Create a skipped result.
     */
    public static TestResult skipped(String message) {
        return new TestResult(null, null, Status.SKIPPED, message, 0, null);
    }

    /**
     * Copy of this result attributed to a test.
     */
    public TestResult complete(String testName, String description, long durationMs) {
        return new TestResult(testName, description, status, message, durationMs, error);
    }

    public String getTestName() {
        return testName;
    }

    public String getDescription() {
        return description;
    }

    public Status getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public Throwable getError() {
        return error;
    }

    public boolean isPassed() {
        return status == Status.PASSED;
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }

    public boolean isError() {
        return status == Status.ERROR;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }

    @Override
    public String toString() {
        return String.format("[%s] %s - %s (%d ms)",
                status, testName, message, durationMs);
    }
}
