package com.oftest.engine.execution;

import com.oftest.engine.TestContext;
import com.oftest.engine.TestDescriptor;
import com.oftest.engine.TestResult;
import com.oftest.engine.fixtures.BrokenStatic;
import com.oftest.engine.fixtures.ConstructorFailing;
import com.oftest.engine.fixtures.Erroring;
import com.oftest.engine.fixtures.ExecutionLog;
import com.oftest.engine.fixtures.Failing;
import com.oftest.engine.fixtures.NullResult;
import com.oftest.engine.fixtures.Recursing;
import com.oftest.engine.fixtures.ReportsFailure;
import com.oftest.engine.fixtures.SelfSkipping;
import com.oftest.engine.fixtures.SetUpFailing;
import com.oftest.engine.fixtures.TearDownAsserting;
import com.oftest.engine.fixtures.TearDownFailing;
import com.oftest.engine.fixtures.basic.Bonus;
import com.oftest.engine.fixtures.basic.Echo;
import com.oftest.engine.suite.Suite;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.oftest.engine.TestRegistries.descriptor;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ExecutionReporter.
 */
class ExecutionReporterTest {

    private TestContext context;

    @BeforeEach
    void setUp() {
        ExecutionLog.clear();
        context = TestContext.builder()
                .portMap(Map.of(1, "veth1"))
                .defaultTimeoutMs(100)
                .build();
    }

    private static Suite suite(TestDescriptor... tests) {
        return new Suite(List.of(tests));
    }

    // ==================== Ordering and Isolation ====================

    @Test
    void run_executesInSuiteOrderWithLifecycle() {
        ExecutionResult result = new ExecutionReporter(false).run(
                suite(descriptor("basic", Echo.class), descriptor("basic", Bonus.class)), context);

        assertEquals(List.of("Echo.setUp", "Echo.execute", "Echo.tearDown", "Bonus.execute"), ExecutionLog.events());
        assertEquals(2, result.getRan());
        assertEquals(2, result.getPassed());
        assertTrue(result.isAllPassed());
    }

    @Test
    void run_failuresAndErrorsDoNotStopTheSuite() {
        ExecutionResult result = new ExecutionReporter(false).run(suite(
                descriptor("misc", Failing.class),
                descriptor("misc", Erroring.class),
                descriptor("misc", ReportsFailure.class),
                descriptor("basic", Echo.class)), context);

        assertEquals(List.of("Failing.execute", "Failing.tearDown", "Erroring.execute",
                "ReportsFailure.execute", "Echo.setUp", "Echo.execute", "Echo.tearDown"), ExecutionLog.events());
        assertEquals(4, result.getRan());
        assertEquals(2, result.getFailures());
        assertEquals(1, result.getErrors());
        assertEquals(1, result.getPassed());
        assertFalse(result.isAllPassed());
    }

    @Test
    void run_assertionErrorIsFailureWithMessage() {
        TestResult result = new ExecutionReporter(false)
                .run(suite(descriptor("misc", Failing.class)), context).getResults().get(0);

        assertEquals(TestResult.Status.FAILED, result.getStatus());
        assertEquals("expected 136 bytes", result.getMessage());
        assertInstanceOf(AssertionError.class, result.getError());
        assertEquals("misc.Failing", result.getTestName());
    }

    @Test
    void run_exceptionIsErrorWithCause() {
        TestResult result = new ExecutionReporter(false)
                .run(suite(descriptor("misc", Erroring.class)), context).getResults().get(0);

        assertEquals(TestResult.Status.ERROR, result.getStatus());
        assertInstanceOf(IllegalStateException.class, result.getError());
        assertTrue(result.getMessage().contains("controller went away"));
    }

    @Test
    void run_setUpFailureSkipsExecuteButRunsTearDown() {
        TestResult result = new ExecutionReporter(false)
                .run(suite(descriptor("misc", SetUpFailing.class)), context).getResults().get(0);

        assertEquals(TestResult.Status.ERROR, result.getStatus());
        assertEquals(List.of("SetUpFailing.tearDown"), ExecutionLog.events());
    }

    @Test
    void run_tearDownFailureTurnsPassIntoError() {
        TestResult result = new ExecutionReporter(false)
                .run(suite(descriptor("misc", TearDownFailing.class)), context).getResults().get(0);

        assertEquals(TestResult.Status.ERROR, result.getStatus());
        assertTrue(result.getMessage().contains("tearDown"));
    }

    @Test
    void run_constructorFailureIsError() {
        ExecutionResult result = new ExecutionReporter(false).run(suite(
                descriptor("misc", ConstructorFailing.class),
                descriptor("basic", Bonus.class)), context);

        assertEquals(1, result.getErrors());
        assertEquals(1, result.getPassed());
    }

    @Test
    void run_assertionInTearDownIsFailureAndSuiteContinues() {
        ExecutionResult result = new ExecutionReporter(false).run(suite(
                descriptor("misc", TearDownAsserting.class),
                descriptor("basic", Bonus.class)), context);

        assertEquals(2, result.getRan());
        TestResult first = result.getResults().get(0);
        assertEquals(TestResult.Status.FAILED, first.getStatus());
        assertTrue(first.getMessage().contains("flow table not empty"));
        assertEquals(List.of("Bonus.execute"), ExecutionLog.events());
    }

    @Test
    void run_failingStaticInitializerIsErrorAndSuiteContinues() {
        ExecutionResult result = new ExecutionReporter(false).run(suite(
                descriptor("misc", BrokenStatic.class),
                descriptor("basic", Bonus.class)), context);

        assertEquals(2, result.getRan());
        assertEquals(1, result.getErrors());
        assertEquals(1, result.getPassed());
        assertInstanceOf(LinkageError.class, result.getResults().get(0).getError());
        assertEquals(List.of("Bonus.execute"), ExecutionLog.events());
    }

    @Test
    void run_stackOverflowIsErrorAndSuiteContinues() {
        ExecutionResult result = new ExecutionReporter(false).run(suite(
                descriptor("misc", Recursing.class),
                descriptor("basic", Bonus.class)), context);

        assertEquals(2, result.getRan());
        TestResult first = result.getResults().get(0);
        assertEquals(TestResult.Status.ERROR, first.getStatus());
        assertInstanceOf(StackOverflowError.class, first.getError());
        assertEquals(List.of("Recursing.tearDown", "Bonus.execute"), ExecutionLog.events());
    }

    @Test
    void run_nullResultIsError() {
        ExecutionResult result = new ExecutionReporter(false).run(suite(descriptor("misc", NullResult.class)), context);

        assertEquals(1, result.getErrors());
    }

    @Test
    void run_selfSkippedTestCountsAsRuntimeSkip() {
        ExecutionResult result = new ExecutionReporter(false).run(suite(descriptor("misc", SelfSkipping.class)), context);

        assertEquals(1, result.getRan());
        assertEquals(1, result.getSkippedAtRuntime());
        assertEquals("needs two ports", result.getResults().get(0).getMessage());
        assertTrue(result.isAllPassed());
    }

    @Test
    void run_emptySuite() {
        ExecutionResult result = new ExecutionReporter(true).run(new Suite(List.of()), context);

        assertEquals(0, result.getRan());
        assertNotNull(result.getEndTime());
    }

    @Test
    void run_resultsCarryDescriptionAndQualifiedName() {
        TestResult result = new ExecutionReporter(false)
                .run(suite(descriptor("basic", Echo.class)), context).getResults().get(0);

        assertEquals("basic.Echo", result.getTestName());
        assertEquals("", result.getDescription());
        assertTrue(result.getDurationMs() >= 0);
    }

    @Test
    void run_notifiesListener() {
        List<String> events = new ArrayList<>();
        ExecutionListener listener = new ExecutionListener() {
            @Override
            public void onTestStarted(TestDescriptor test) {
                events.add("start " + test.getQualifiedName());
            }

            @Override
            public void onTestFinished(TestDescriptor test, TestResult result) {
                events.add("end " + test.getQualifiedName() + " " + result.getStatus());
            }
        };

        new ExecutionReporter(false, listener).run(suite(
                descriptor("basic", Echo.class), descriptor("misc", Failing.class)), context);

        assertEquals(List.of("start basic.Echo", "end basic.Echo PASSED",
                "start misc.Failing", "end misc.Failing FAILED"), events);
    }

    // ==================== Classification ====================

    @Test
    void classify_usesFailOnSkipped() {
        Suite skipping = suite(descriptor("misc", SelfSkipping.class), descriptor("basic", Bonus.class));

        ExecutionReporter lenient = new ExecutionReporter(false);
        assertEquals(Outcome.SUCCESS, lenient.classify(lenient.run(skipping, context)));

        ExecutionReporter strict = new ExecutionReporter(true);
        assertEquals(Outcome.FAILURE, strict.classify(strict.run(skipping, context)));
    }

    @Test
    void classify_failureWinsOverEverything() {
        ExecutionReporter reporter = new ExecutionReporter(false);

        ExecutionResult result = reporter.run(suite(descriptor("misc", Erroring.class)), context);

        assertEquals(Outcome.FAILURE, reporter.classify(result));
        assertEquals(1, reporter.classify(result).exitCode());
    }

    @Test
    void summary_includesCounts() {
        ExecutionResult result = new ExecutionReporter(false).run("nightly", suite(
                descriptor("basic", Echo.class), descriptor("misc", Failing.class)), context);

        String summary = result.getSummary();
        assertTrue(summary.contains("Suite: nightly"));
        assertTrue(summary.contains("Ran: 2"));
        assertTrue(summary.contains("Failed: 1"));
    }
}
