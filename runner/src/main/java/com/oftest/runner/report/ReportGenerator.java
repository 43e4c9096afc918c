package com.oftest.runner.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.oftest.engine.TestResult;
import com.oftest.engine.execution.ExecutionResult;
import com.oftest.engine.execution.Outcome;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.Locale;

/**
 * Generates run reports in text or JSON.
 */
public class ReportGenerator {

    /**
     * Report format options.
     */
    public enum Format {
        TEXT,
        JSON;

        public static Format fromString(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new IllegalArgumentException("Invalid report format: " + value + " (expected text or json)", e);
            }
        }
    }

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    /**
     * Generate a report in the specified format.
     */
    public String generate(ExecutionResult result, Outcome outcome, Format format) {
        switch (format) {
            case JSON:
                return generateJson(result, outcome);
            case TEXT:
            default:
                return generateText(result, outcome);
        }
    }

    /**
     * Generate a text report.
     */
    public String generateText(ExecutionResult result, Outcome outcome) {
        StringBuilder sb = new StringBuilder();

        sb.append("=".repeat(70)).append("\n");
        sb.append("OFTest Report\n");
        sb.append("=".repeat(70)).append("\n\n");

        sb.append("Suite: ").append(result.getSuiteName()).append("\n");
        sb.append("Started: ").append(result.getStartTime()).append("\n");
        if (result.getEndTime() != null) {
            sb.append("Completed: ").append(result.getEndTime()).append("\n");
        }
        sb.append("\n");

        sb.append("-".repeat(70)).append("\n");
        sb.append("SUMMARY\n");
        sb.append("-".repeat(70)).append("\n");
        sb.append(String.format("Ran:         %d%n", result.getRan()));
        sb.append(String.format("Passed:      %d%n", result.getPassed()));
        sb.append(String.format("Failed:      %d%n", result.getFailures()));
        sb.append(String.format("Errors:      %d%n", result.getErrors()));
        sb.append(String.format("Skipped:     %d%n", result.getSkippedAtRuntime()));
        sb.append(String.format("Duration:    %d ms%n", result.getTotalDurationMs()));
        sb.append("\n");

        sb.append("-".repeat(70)).append("\n");
        sb.append("TEST RESULTS\n");
        sb.append("-".repeat(70)).append("\n\n");

        for (TestResult test : result.getResults()) {
            sb.append(String.format("[%s] %s%n", getStatusIcon(test.getStatus()), test.getTestName()));
            if (test.getDescription() != null && !test.getDescription().isEmpty()) {
                sb.append(String.format("    Validates: %s%n", test.getDescription()));
            }
            sb.append(String.format("    Status:   %s%n", test.getStatus()));
            sb.append(String.format("    Duration: %d ms%n", test.getDurationMs()));
            sb.append(String.format("    Message:  %s%n", test.getMessage()));

            if (test.getError() != null) {
                sb.append("    Error:    ").append(test.getError().getClass().getName())
                        .append(": ").append(test.getError().getMessage()).append("\n");
            }
            sb.append("\n");
        }

        sb.append("=".repeat(70)).append("\n");
        sb.append("RESULT: ").append(outcome).append("\n");
        sb.append("=".repeat(70)).append("\n");

        return sb.toString();
    }

    /**
     * Generate a JSON report.
     */
    public String generateJson(ExecutionResult result, Outcome outcome) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("suiteName", result.getSuiteName());
        root.put("startTime", result.getStartTime().toString());
        if (result.getEndTime() != null) {
            root.put("endTime", result.getEndTime().toString());
        }
        root.put("outcome", outcome.name());
        root.put("exitCode", outcome.exitCode());

        ObjectNode summary = root.putObject("summary");
        summary.put("ran", result.getRan());
        summary.put("passed", result.getPassed());
        summary.put("failures", result.getFailures());
        summary.put("errors", result.getErrors());
        summary.put("skipped", result.getSkippedAtRuntime());
        summary.put("durationMs", result.getTotalDurationMs());

        ArrayNode results = root.putArray("results");
        for (TestResult test : result.getResults()) {
            ObjectNode resultNode = results.addObject();
            resultNode.put("testName", test.getTestName());
            if (test.getDescription() != null) {
                resultNode.put("description", test.getDescription());
            }
            resultNode.put("status", test.getStatus().name());
            resultNode.put("message", test.getMessage());
            resultNode.put("durationMs", test.getDurationMs());

            if (test.getError() != null) {
                ObjectNode errorNode = resultNode.putObject("error");
                errorNode.put("type", test.getError().getClass().getName());
                errorNode.put("message", test.getError().getMessage());

                StringWriter sw = new StringWriter();
                test.getError().printStackTrace(new PrintWriter(sw));
                errorNode.put("stackTrace", sw.toString());
            }
        }

        try {
            return objectMapper.writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to generate JSON report", e);
        }
    }

    private String getStatusIcon(TestResult.Status status) {
        switch (status) {
            case PASSED:
                return "ok";
            case FAILED:
                return "FAIL";
            case ERROR:
                return "ERROR";
            case SKIPPED:
                return "skip";
            default:
                return "?";
        }
    }
}
