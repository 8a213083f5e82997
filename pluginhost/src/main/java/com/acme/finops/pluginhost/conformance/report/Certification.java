package com.acme.finops.pluginhost.conformance.report;

import com.acme.finops.pluginhost.conformance.ConformanceReport;
import com.acme.finops.pluginhost.conformance.Summary;
import com.acme.finops.pluginhost.conformance.TestResult;
import com.acme.finops.pluginhost.conformance.TestStatus;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Certification verdict derived from a conformance report. A plugin is certified iff the run had no
 * failed and no errored cases and the plugin came up at all.
 */
public record Certification(String pluginName,
                            String pluginVersion,
                            boolean certified,
                            Instant certifiedAt,
                            List<String> issues,
                            Summary summary) {

    public Certification {
        Objects.requireNonNull(pluginName, "pluginName");
        Objects.requireNonNull(pluginVersion, "pluginVersion");
        Objects.requireNonNull(certifiedAt, "certifiedAt");
        Objects.requireNonNull(summary, "summary");
        issues = List.copyOf(issues);
    }

    public static Certification certify(ConformanceReport report) {
        return certify(report, Instant.now());
    }

    public static Certification certify(ConformanceReport report, Instant at) {
        Objects.requireNonNull(report, "report");
        List<String> issues = new ArrayList<>();
        report.fault().ifPresent(f -> issues.add("plugin: " + f.lines().findFirst().orElse(f)));
        for (TestResult r : report.results()) {
            if (r.status() == TestStatus.FAIL || r.status() == TestStatus.ERROR) {
                issues.add(r.name() + ": " + r.error());
            }
        }
        Summary summary = report.summary();
        boolean certified = summary.allPassed() && report.fault().isEmpty();
        return new Certification(report.plugin().name(), report.plugin().version(), certified, at, issues, summary);
    }

    public String toMarkdown() {
        StringBuilder sb = new StringBuilder();
        sb.append("# FinFocus Plugin Certification\n\n");
        sb.append("**Plugin**: ").append(pluginName).append('\n');
        sb.append("**Version**: ").append(pluginVersion).append('\n');
        sb.append("**Status**: ").append(certified ? "✅ CERTIFIED" : "❌ FAILED").append('\n');
        sb.append("**Date**: ").append(DateTimeFormatter.RFC_1123_DATE_TIME.format(certifiedAt.atOffset(ZoneOffset.UTC)))
            .append("\n\n");

        sb.append("## Summary\n\n");
        sb.append("- Total Tests: ").append(summary.total()).append('\n');
        sb.append("- Passed: ").append(summary.passed()).append('\n');
        sb.append("- Failed: ").append(summary.failed()).append('\n');
        sb.append("- Skipped: ").append(summary.skipped()).append('\n');
        sb.append("- Errors: ").append(summary.errors()).append("\n\n");

        if (!issues.isEmpty()) {
            sb.append("## Issues\n\n");
            for (String issue : issues) {
                sb.append("- ").append(issue).append('\n');
            }
        }
        return sb.toString();
    }
}
