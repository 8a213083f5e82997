package com.acme.finops.pluginhost.conformance;

import com.acme.finops.pluginhost.error.ErrorKind;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable record of one suite run. Results are in declared case order and the summary is always
 * derived from them.
 *
 * @param pluginFault     why the plugin could not be brought up, empty when it started
 * @param pluginFaultKind taxonomy kind of {@code pluginFault}, {@code null} when none
 */
public record ConformanceReport(String suiteName,
                                PluginUnderTest plugin,
                                List<TestResult> results,
                                Instant timestamp,
                                Duration duration,
                                String pluginFault,
                                ErrorKind pluginFaultKind) {

    public ConformanceReport {
        Objects.requireNonNull(suiteName, "suiteName");
        Objects.requireNonNull(plugin, "plugin");
        results = List.copyOf(results);
        timestamp = timestamp == null ? Instant.now() : timestamp;
        duration = duration == null ? Duration.ZERO : duration;
        pluginFault = pluginFault == null ? "" : pluginFault;
    }

    public Summary summary() {
        return Summary.of(results);
    }

    public Optional<String> fault() {
        return pluginFault.isEmpty() ? Optional.empty() : Optional.of(pluginFault);
    }

    public Optional<ErrorKind> faultKind() {
        return Optional.ofNullable(pluginFaultKind);
    }
}
