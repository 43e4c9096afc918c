package com.oftest.engine.execution;

/**
 * Overall classification of a run, one-to-one with the process exit status.
 */
public enum Outcome {
    SUCCESS(0),
    FAILURE(1);

    private final int exitCode;

    Outcome(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }

    /**
     * Classify a tally. Any failure or error fails the run; runtime skips
     * fail it only when {@code failOnSkipped} is set.
     */
    public static Outcome classify(int failures, int errors, int skipped, boolean failOnSkipped) {
        if (failures > 0 || errors > 0) {
            return FAILURE;
        }
        if (skipped > 0 && failOnSkipped) {
            return FAILURE;
        }
        return SUCCESS;
    }
}
