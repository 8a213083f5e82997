package com.acme.finops.pluginhost.util;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Typed reads from an explicit environment map. Missing, blank or malformed values fall back to the
 * default; numeric values outside {@code [min, max]} are clamped rather than rejected.
 */
public final class EnvVars {
    private EnvVars() {
    }

    /**
     * Accepts {@code true/false}, {@code 1/0}, {@code yes/no} and {@code on/off} in any case.
     */
    public static boolean getBoolean(Map<String, String> env, String name, boolean defaultValue) {
        String raw = raw(env, name);
        if (raw == null) {
            return defaultValue;
        }
        return switch (raw.toLowerCase(Locale.ROOT)) {
            case "true", "1", "yes", "on" -> true;
            case "false", "0", "no", "off" -> false;
            default -> defaultValue;
        };
    }

    public static long getLongClamped(Map<String, String> env, String name, long defaultValue, long min, long max) {
        String raw = raw(env, name);
        if (raw == null) {
            return defaultValue;
        }
        long parsed;
        try {
            parsed = Long.parseLong(raw);
        } catch (NumberFormatException malformed) {
            return defaultValue;
        }
        return Math.max(min, Math.min(parsed, max));
    }

    public static int getIntClamped(Map<String, String> env, String name, int defaultValue, int min, int max) {
        return (int) getLongClamped(env, name, defaultValue, min, max);
    }

    /**
     * Reads a millisecond count into a {@link Duration}.
     */
    public static Duration getMillisClamped(Map<String, String> env, String name, long defaultMillis, long minMillis, long maxMillis) {
        return Duration.ofMillis(getLongClamped(env, name, defaultMillis, minMillis, maxMillis));
    }

    /**
     * A leading {@code ~} expands to {@code user.home}.
     */
    public static Path getPath(Map<String, String> env, String name, Path defaultValue) {
        String raw = raw(env, name);
        if (raw == null) {
            return defaultValue;
        }
        if (raw.equals("~") || raw.startsWith("~/")) {
            return Path.of(System.getProperty("user.home") + raw.substring(1));
        }
        return Path.of(raw);
    }

    private static String raw(Map<String, String> env, String name) {
        String v = env.get(name);
        return v == null || v.isBlank() ? null : v.trim();
    }
}
