package com.oftest.runner.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.oftest.engine.TestContext;
import com.oftest.engine.TestDescriptor;
import com.oftest.engine.execution.ExecutionReporter;
import com.oftest.engine.execution.ExecutionResult;
import com.oftest.engine.execution.Outcome;
import com.oftest.engine.suite.Suite;
import com.oftest.runner.fixtures.Bonus;
import com.oftest.runner.fixtures.Echo;
import com.oftest.runner.fixtures.MultiPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ReportGenerator.
 */
class ReportGeneratorTest {

    private ExecutionResult result;
    private Outcome outcome;
    private final ReportGenerator generator = new ReportGenerator();

    @BeforeEach
    void setUp() {
        Suite suite = new Suite(List.of(
                new TestDescriptor("basic", "Bonus", Bonus.class, 100, ""),
                new TestDescriptor("basic", "Echo", Echo.class, 100, "Echo request and reply"),
                new TestDescriptor("dataplane", "MultiPort", MultiPort.class, 10, "")));
        TestContext context = TestContext.builder().portMap(Map.of(1, "veth1")).build();
        ExecutionReporter reporter = new ExecutionReporter(false);
        result = reporter.run("nightly", suite, context);
        outcome = reporter.classify(result);
    }

    @Test
    void text_containsSummaryAndResults() {
        String report = generator.generate(result, outcome, ReportGenerator.Format.TEXT);

        assertTrue(report.contains("Suite: nightly"));
        assertTrue(report.contains("Ran:         3"));
        assertTrue(report.contains("Failed:      1"));
        assertTrue(report.contains("Skipped:     1"));
        assertTrue(report.contains("[FAIL] basic.Bonus"));
        assertTrue(report.contains("[ok] basic.Echo"));
        assertTrue(report.contains("Validates: Echo request and reply"));
        assertTrue(report.contains("[skip] dataplane.MultiPort"));
        assertTrue(report.contains("RESULT: FAILURE"));
    }

    @Test
    void json_isParseableWithCounts() throws Exception {
        String report = generator.generate(result, outcome, ReportGenerator.Format.JSON);

        JsonNode root = new ObjectMapper().readTree(report);
        assertEquals("nightly", root.get("suiteName").asText());
        assertEquals("FAILURE", root.get("outcome").asText());
        assertEquals(1, root.get("exitCode").asInt());
        assertEquals(3, root.get("summary").get("ran").asInt());
        assertEquals(1, root.get("summary").get("failures").asInt());
        assertEquals(1, root.get("summary").get("skipped").asInt());

        JsonNode bonus = root.get("results").get(0);
        assertEquals("basic.Bonus", bonus.get("testName").asText());
        assertEquals("FAILED", bonus.get("status").asText());
        assertEquals(AssertionError.class.getName(), bonus.get("error").get("type").asText());
    }

    @Test
    void format_fromString() {
        assertEquals(ReportGenerator.Format.JSON, ReportGenerator.Format.fromString("json"));
        assertEquals(ReportGenerator.Format.TEXT, ReportGenerator.Format.fromString("TEXT"));
        assertThrows(IllegalArgumentException.class, () -> ReportGenerator.Format.fromString("html"));
        assertThrows(IllegalArgumentException.class, () -> ReportGenerator.Format.fromString(null));
    }
}
