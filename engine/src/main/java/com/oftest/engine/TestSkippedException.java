package com.oftest.engine;

/**
 * Thrown by a test that finds its preconditions unmet at execution time.
 */
public class TestSkippedException extends RuntimeException {

    public TestSkippedException(String reason) {
        super(reason);
    }
}
