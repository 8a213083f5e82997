package com.acme.finops.pluginhost.util;

import java.time.Duration;
import java.util.Objects;

/**
 * Monotonic point in time after which an operation must have produced a result.
 */
public final class Deadline {
    private final long expiresAtNanos;

    private Deadline(long expiresAtNanos) {
        this.expiresAtNanos = expiresAtNanos;
    }

    public static Deadline after(Duration duration) {
        Objects.requireNonNull(duration, "duration");
        return afterNanos(duration.toNanos());
    }

    public static Deadline afterMillis(long millis) {
        return afterNanos(Math.max(0L, millis) * 1_000_000L);
    }

    private static Deadline afterNanos(long nanos) {
        return new Deadline(System.nanoTime() + Math.max(0L, nanos));
    }

    public long remainingNanos() {
        return Math.max(0L, expiresAtNanos - System.nanoTime());
    }

    public long remainingMillis() {
        return (remainingNanos() + 999_999L) / 1_000_000L;
    }

    public Duration remaining() {
        return Duration.ofNanos(remainingNanos());
    }

    public boolean isExpired() {
        return expiresAtNanos - System.nanoTime() <= 0;
    }

    /**
     * Returns whichever of the two deadlines expires first.
     */
    public Deadline min(Deadline other) {
        Objects.requireNonNull(other, "other");
        return expiresAtNanos - other.expiresAtNanos <= 0 ? this : other;
    }

    public Deadline cap(Duration duration) {
        return min(after(duration));
    }

    @Override
    public String toString() {
        return "Deadline{remainingMs=" + remainingMillis() + "}";
    }
}
