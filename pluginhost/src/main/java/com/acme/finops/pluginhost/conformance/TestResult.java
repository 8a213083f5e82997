package com.acme.finops.pluginhost.conformance;

import java.time.Duration;
import java.util.Objects;

/**
 * Outcome of one conformance case. {@code error} is empty for passes; {@code details} is free text.
 */
public record TestResult(String name,
                         TestCategory category,
                         TestStatus status,
                         Duration duration,
                         String error,
                         String details) {
    public TestResult {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(status, "status");
        duration = duration == null ? Duration.ZERO : duration;
        error = error == null ? "" : error;
        details = details == null ? "" : details;
    }

    public static TestResult of(ConformanceTestCase testCase, TestStatus status, Duration duration, String error, String details) {
        return new TestResult(testCase.name(), testCase.category(), status, duration, error, details);
    }
}
