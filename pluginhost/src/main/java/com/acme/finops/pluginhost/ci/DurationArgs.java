package com.acme.finops.pluginhost.ci;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses command-line durations such as {@code 250ms}, {@code 30s}, {@code 5m} or {@code 1h}.
 * A bare number is read as seconds.
 */
final class DurationArgs {
    private static final Pattern DURATION = Pattern.compile("(\\d+)(ms|s|m|h)?");

    private DurationArgs() {
    }

    static Duration parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("duration is required");
        }
        Matcher m = DURATION.matcher(raw.trim().toLowerCase(Locale.ROOT));
        if (!m.matches()) {
            throw new IllegalArgumentException("invalid duration: " + raw + " (expected e.g. 30s, 5m, 1h)");
        }
        long amount = Long.parseLong(m.group(1));
        String unit = m.group(2) == null ? "s" : m.group(2);
        Duration d = switch (unit) {
            case "ms" -> Duration.ofMillis(amount);
            case "m" -> Duration.ofMinutes(amount);
            case "h" -> Duration.ofHours(amount);
            default -> Duration.ofSeconds(amount);
        };
        if (d.isZero()) {
            throw new IllegalArgumentException("duration must be positive: " + raw);
        }
        return d;
    }
}
