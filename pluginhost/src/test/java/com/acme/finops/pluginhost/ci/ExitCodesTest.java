package com.acme.finops.pluginhost.ci;

import com.acme.finops.pluginhost.conformance.ConformanceReport;
import com.acme.finops.pluginhost.conformance.PluginUnderTest;
import com.acme.finops.pluginhost.conformance.TestCategory;
import com.acme.finops.pluginhost.conformance.TestResult;
import com.acme.finops.pluginhost.conformance.TestStatus;
import com.acme.finops.pluginhost.error.ErrorKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

class ExitCodesTest {

    private static ConformanceReport report(ErrorKind faultKind, TestStatus... statuses) {
        List<TestResult> results = new ArrayList<>();
        for (int i = 0; i < statuses.length; i++) {
            results.add(new TestResult("Case_" + i, TestCategory.PROTOCOL, statuses[i], Duration.ofMillis(1), "", ""));
        }
        return new ConformanceReport("conformance", new PluginUnderTest("/bin/p", "p", "1.0.0", "1.0.0", "tcp"),
            results, Instant.now(), Duration.ofMillis(5), faultKind == null ? null : "start failed", faultKind);
    }

    @Test
    void shouldReturnZeroWhenEverythingPassedOrSkipped() {
        assertEquals(ExitCodes.ALL_PASSED, ExitCodes.forReport(report(null, TestStatus.PASS, TestStatus.SKIP)));
        assertEquals(ExitCodes.ALL_PASSED, ExitCodes.forReport(report(null)));
    }

    @Test
    void shouldReturnOneForFailures() {
        assertEquals(ExitCodes.TEST_FAILURES, ExitCodes.forReport(report(null, TestStatus.PASS, TestStatus.FAIL)));
    }

    @Test
    void shouldLetErrorsOutrankFailures() {
        assertEquals(ExitCodes.PLUGIN_CRASHED,
            ExitCodes.forReport(report(null, TestStatus.FAIL, TestStatus.ERROR, TestStatus.FAIL)));
    }

    @Test
    void shouldMapStartFaults() {
        assertEquals(ExitCodes.PLUGIN_CRASHED, ExitCodes.forReport(report(ErrorKind.HANDSHAKE_TIMEOUT, TestStatus.ERROR)));
        assertEquals(ExitCodes.PROTOCOL_MISMATCH, ExitCodes.forReport(report(ErrorKind.PROTOCOL_MISMATCH, TestStatus.ERROR)));
    }
}
