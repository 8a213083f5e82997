package com.acme.finops.pluginhost.conformance;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * One declared conformance check.
 *
 * @param precondition returns a skip reason when the case does not apply to this plugin
 * @param body         performs the calls and assertions; returns free-text details for the report
 */
public record ConformanceTestCase(String name,
                                  TestCategory category,
                                  String description,
                                  Duration timeout,
                                  Precondition precondition,
                                  Body body) {

    @FunctionalInterface
    public interface Precondition {
        Optional<String> skipReason(TestContext context);
    }

    @FunctionalInterface
    public interface Body {
        String run(TestContext context) throws Exception;
    }

    public static final Precondition ALWAYS = context -> Optional.empty();

    public ConformanceTestCase {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(body, "body");
        description = description == null ? "" : description;
        precondition = precondition == null ? ALWAYS : precondition;
    }
}
