package com.oftest.engine;

/**
 * Base class for fatal errors raised while setting up a test run.
 *
 * <p>Any of these stops the run before a single test executes. Failures
 * inside individual tests are reported through {@link TestResult} instead.</p>
 */
public class OfTestException extends RuntimeException {

    public OfTestException(String message) {
        super(message);
    }

    public OfTestException(String message, Throwable cause) {
        super(message, cause);
    }
}
