package com.acme.finops.pluginhost.model;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

/**
 * Half-open interval {@code [start, end)}.
 */
public record TimeWindow(Instant start, Instant end) {
    public TimeWindow {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("window end must be after start: " + start + " .. " + end);
        }
    }

    /**
     * Whether the UTC day {@code date} overlaps the window. A window ending at midnight excludes its end day.
     */
    public boolean contains(LocalDate date) {
        Instant dayStart = date.atStartOfDay(ZoneOffset.UTC).toInstant();
        return dayStart.isBefore(end) && dayStart.plus(1, ChronoUnit.DAYS).isAfter(start);
    }
}
