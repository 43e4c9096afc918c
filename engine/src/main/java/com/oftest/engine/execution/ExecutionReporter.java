package com.oftest.engine.execution;

import com.oftest.engine.OfTest;
import com.oftest.engine.TestContext;
import com.oftest.engine.TestDescriptor;
import com.oftest.engine.TestResult;
import com.oftest.engine.TestSkippedException;
import com.oftest.engine.suite.Suite;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a suite one test at a time and classifies the outcome.
 *
 * <p>Each test gets a fresh instance. A failure, error or skip in one test is
 * recorded and the next test runs regardless.</p>
 */
public class ExecutionReporter {

    private static final Logger log = LoggerFactory.getLogger(ExecutionReporter.class);

    private final boolean failOnSkipped;
    private final ExecutionListener listener;

    public ExecutionReporter(boolean failOnSkipped) {
        this(failOnSkipped, ExecutionListener.NONE);
    }

    public ExecutionReporter(boolean failOnSkipped, ExecutionListener listener) {
        this.failOnSkipped = failOnSkipped;
        this.listener = listener != null ? listener : ExecutionListener.NONE;
    }

    public boolean isFailOnSkipped() {
        return failOnSkipped;
    }

    /**
     * Run every test of the suite in order.
     */
    public ExecutionResult run(Suite suite, TestContext context) {
        return run("oftest", suite, context);
    }

    /**
     * Run every test of the suite in order, naming the result.
     */
    public ExecutionResult run(String suiteName, Suite suite, TestContext context) {
        ExecutionResult result = new ExecutionResult(suiteName);
        log.info("Running {} test(s): {}", suite.size(), suite.getQualifiedNames());

        for (TestDescriptor test : suite) {
            log.info("Running test: {}", test.getQualifiedName());
            listener.onTestStarted(test);

            long startTime = System.currentTimeMillis();
            TestResult testResult = runTest(test, context)
                    .complete(test.getQualifiedName(), test.getDescription(),
                            System.currentTimeMillis() - startTime);

            result.addResult(testResult);
            log.info("Test {}: {} - {}", test.getQualifiedName(), testResult.getStatus(), testResult.getMessage());
            listener.onTestFinished(test, testResult);
        }

        result.complete();
        log.info(result.getSummary());
        return result;
    }

    /**
     * Classify a finished run.
     */
    public Outcome classify(ExecutionResult result) {
        return Outcome.classify(result.getFailures(), result.getErrors(), result.getSkippedAtRuntime(), failOnSkipped);
    }

    private TestResult runTest(TestDescriptor descriptor, TestContext context) {
        OfTest test;
        try {
            test = descriptor.newInstance();
        } catch (ReflectiveOperationException | RuntimeException | LinkageError e) {
            log.error("Cannot instantiate {}", descriptor.getQualifiedName(), e);
            return TestResult.error("Cannot instantiate test: " + e, e);
        }

        TestResult result;
        try {
            test.setUp(context);
            result = test.execute(context);
            if (result == null) {
                result = TestResult.error("Test returned no result", null);
            }
        } catch (TestSkippedException e) {
            result = TestResult.skipped(e.getMessage());
        } catch (AssertionError e) {
            result = TestResult.failed(e.getMessage() != null ? e.getMessage() : "Assertion failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result = TestResult.error("Test interrupted", e);
        } catch (Exception e) {
            log.debug("Exception in {}", descriptor.getQualifiedName(), e);
            result = TestResult.error("Exception during test: " + e.getMessage(), e);
        } catch (Error e) {
            rethrowIfFatal(e);
            log.error("Error in {}", descriptor.getQualifiedName(), e);
            result = TestResult.error("Error during test: " + e, e);
        }

        try {
            test.tearDown(context);
        } catch (AssertionError e) {
            log.warn("tearDown check failed for {}", descriptor.getQualifiedName(), e);
            if (!result.isFailed() && !result.isError()) {
                result = TestResult.failed("tearDown failed: " + e.getMessage(), e);
            }
        } catch (Exception | Error e) {
            if (e instanceof Error) {
                rethrowIfFatal((Error) e);
            }
            log.warn("tearDown failed for {}", descriptor.getQualifiedName(), e);
            if (!result.isFailed() && !result.isError()) {
                result = TestResult.error("tearDown failed: " + e.getMessage(), e);
            }
        }
        return result;
    }

    /**
     * Let errors the JVM cannot recover from end the run. A stack overflow stays with its test.
     */
    private static void rethrowIfFatal(Error e) {
        if (e instanceof VirtualMachineError && !(e instanceof StackOverflowError)) {
            throw e;
        }
    }
}
