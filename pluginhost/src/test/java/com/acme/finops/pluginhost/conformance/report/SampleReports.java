package com.acme.finops.pluginhost.conformance.report;

import com.acme.finops.pluginhost.conformance.ConformanceReport;
import com.acme.finops.pluginhost.conformance.PluginUnderTest;
import com.acme.finops.pluginhost.conformance.TestCategory;
import com.acme.finops.pluginhost.conformance.TestResult;
import com.acme.finops.pluginhost.conformance.TestStatus;
import com.acme.finops.pluginhost.error.ErrorKind;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

final class SampleReports {
    static final Instant AT = Instant.parse("2026-10-19T12:00:00.750Z");
    static final PluginUnderTest PLUGIN = new PluginUnderTest("/opt/plugins/finfocus-plugin-aws", "aws", "1.4.2", "1.0.0", "tcp");

    private SampleReports() {
    }

    static ConformanceReport mixed() {
        return new ConformanceReport("conformance", PLUGIN, List.of(
            new TestResult("Identity_ReturnsPluginName", TestCategory.PROTOCOL, TestStatus.PASS, Duration.ofMillis(12), "", "name=aws"),
            new TestResult("GetProjectedCost_ValidResource", TestCategory.COST, TestStatus.FAIL, Duration.ofMillis(40),
                "currency 'usd' is not an ISO-4217 code", ""),
            new TestResult("GetActualCost_ReturnsDatedResults", TestCategory.COST, TestStatus.SKIP, Duration.ZERO, "",
                "plugin does not declare actual_cost"),
            new TestResult("DryRun_ReturnsFieldMappings", TestCategory.DRYRUN, TestStatus.ERROR, Duration.ofMillis(3),
                "UNAVAILABLE: connection lost", "")
        ), AT, Duration.ofMillis(2_500), null, null);
    }

    static ConformanceReport allPassed() {
        return new ConformanceReport("conformance", PLUGIN, List.of(
            new TestResult("Identity_ReturnsPluginName", TestCategory.PROTOCOL, TestStatus.PASS, Duration.ofMillis(12), "", ""),
            new TestResult("GetActualCost_ReturnsDatedResults", TestCategory.COST, TestStatus.SKIP, Duration.ZERO, "",
                "plugin does not declare actual_cost")
        ), AT, Duration.ofMillis(900), null, null);
    }

    static ConformanceReport faulted(ErrorKind kind) {
        return new ConformanceReport("conformance", PLUGIN, List.of(
            new TestResult("Identity_ReturnsPluginName", TestCategory.PROTOCOL, TestStatus.ERROR, Duration.ZERO,
                kind + ": plugin aws failed", "")
        ), AT, Duration.ofMillis(100), "plugin aws failed\n--- stdout ---\n", kind);
    }
}
