package com.acme.finops.pluginhost.conformance.report;

import com.acme.finops.pluginhost.conformance.ConformanceReport;
import com.acme.finops.pluginhost.conformance.PluginUnderTest;
import com.acme.finops.pluginhost.conformance.TestCategory;
import com.acme.finops.pluginhost.conformance.TestResult;
import com.acme.finops.pluginhost.conformance.TestStatus;
import com.acme.finops.pluginhost.error.ErrorKind;
import com.acme.finops.pluginhost.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads the output of {@link ReportRenderers#json(ConformanceReport)} back into a report.
 * The summary block is not trusted; it is recomputed from the results.
 */
public final class ReportJson {

    private ReportJson() {
    }

    /**
     * @throws IOException if the text is not JSON or a required field is missing or invalid
     */
    public static ConformanceReport parse(String json) throws IOException {
        JsonNode root = JsonCodec.readTree(json);
        if (root == null || !root.isObject()) {
            throw new IOException("conformance report must be a JSON object");
        }
        try {
            JsonNode pluginNode = root.path("plugin");
            PluginUnderTest plugin = new PluginUnderTest(
                JsonCodec.requiredText(pluginNode, "path"),
                JsonCodec.optionalText(pluginNode, "name", ""),
                JsonCodec.optionalText(pluginNode, "version", ""),
                JsonCodec.optionalText(pluginNode, "protocol_version", ""),
                JsonCodec.optionalText(pluginNode, "comm_mode", ""));

            List<TestResult> results = new ArrayList<>();
            for (JsonNode node : root.path("results")) {
                results.add(new TestResult(
                    JsonCodec.requiredText(node, "name"),
                    TestCategory.parse(JsonCodec.requiredText(node, "category")),
                    TestStatus.parse(JsonCodec.requiredText(node, "status")),
                    Duration.ofMillis(node.path("duration_ms").asLong(0L)),
                    JsonCodec.optionalText(node, "error", ""),
                    JsonCodec.optionalText(node, "details", "")));
            }

            Instant timestamp = Instant.parse(JsonCodec.requiredText(root, "timestamp"));
            String rawKind = JsonCodec.optionalText(root, "plugin_error_kind", "");
            ErrorKind faultKind = rawKind.isEmpty() ? null : ErrorKind.valueOf(rawKind);
            return new ConformanceReport(
                JsonCodec.requiredText(root, "suite"),
                plugin,
                results,
                timestamp,
                Duration.ofMillis(root.path("duration_ms").asLong(0L)),
                JsonCodec.optionalText(root, "plugin_error", ""),
                faultKind);
        } catch (IllegalArgumentException | DateTimeParseException e) {
            throw new IOException("invalid conformance report: " + e.getMessage(), e);
        }
    }
}
