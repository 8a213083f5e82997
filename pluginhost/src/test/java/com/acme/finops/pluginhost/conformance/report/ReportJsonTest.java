package com.acme.finops.pluginhost.conformance.report;

import com.acme.finops.pluginhost.conformance.ConformanceReport;
import com.acme.finops.pluginhost.conformance.Summary;
import com.acme.finops.pluginhost.conformance.TestStatus;
import com.acme.finops.pluginhost.error.ErrorKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReportJsonTest {

    @Test
    void shouldReadBackRenderedReport() throws Exception {
        ConformanceReport original = SampleReports.mixed();

        ConformanceReport parsed = ReportJson.parse(ReportRenderers.json(original));

        assertEquals(original.plugin(), parsed.plugin());
        assertEquals(original.results(), parsed.results());
        assertEquals(original.summary(), parsed.summary());
        assertEquals(Instant.parse("2026-10-19T12:00:00Z"), parsed.timestamp());
        assertEquals(Duration.ofMillis(2_500), parsed.duration());
        assertTrue(parsed.fault().isEmpty());
    }

    @Test
    void shouldReadBackPluginFault() throws Exception {
        ConformanceReport parsed = ReportJson.parse(ReportRenderers.json(SampleReports.faulted(ErrorKind.HANDSHAKE_TIMEOUT)));

        assertEquals(ErrorKind.HANDSHAKE_TIMEOUT, parsed.faultKind().orElseThrow());
        assertTrue(parsed.fault().orElseThrow().startsWith("plugin aws failed"));
    }

    @Test
    void shouldRecomputeSummaryFromResults() throws Exception {
        String json = """
            {
              "suite": "conformance",
              "plugin": {"path": "/bin/p", "name": "p"},
              "results": [
                {"name": "A", "category": "protocol", "status": "pass", "duration_ms": 3},
                {"name": "B", "category": "cost", "status": "error", "error": "boom"}
              ],
              "summary": {"total": 9, "passed": 9, "failed": 0, "skipped": 0, "errors": 0},
              "timestamp": "2026-10-19T12:00:00Z"
            }
            """;

        ConformanceReport parsed = ReportJson.parse(json);

        assertEquals(new Summary(2, 1, 0, 0, 1), parsed.summary());
        assertEquals(TestStatus.ERROR, parsed.results().get(1).status());
        assertEquals("boom", parsed.results().get(1).error());
    }

    @Test
    void shouldRejectInvalidDocuments() {
        assertThrows(IOException.class, () -> ReportJson.parse("not json"));
        assertThrows(IOException.class, () -> ReportJson.parse("[1, 2]"));
        assertThrows(IOException.class, () -> ReportJson.parse(
            "{\"suite\":\"s\",\"plugin\":{\"path\":\"/p\"},\"results\":[],\"timestamp\":\"yesterday\"}"));
        assertThrows(IOException.class, () -> ReportJson.parse(
            "{\"suite\":\"s\",\"plugin\":{\"path\":\"/p\"},\"results\":[{\"name\":\"A\",\"category\":\"bogus\",\"status\":\"pass\"}],"
                + "\"timestamp\":\"2026-10-19T12:00:00Z\"}"));
    }
}
