package com.acme.finops.pluginhost.model;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TimeWindowTest {
    private static final TimeWindow MARCH_FIRST_WEEK =
        new TimeWindow(Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-03-08T00:00:00Z"));

    @Test
    void shouldExcludeDayStartingAtWindowEnd() {
        assertTrue(MARCH_FIRST_WEEK.contains(LocalDate.parse("2024-03-01")));
        assertTrue(MARCH_FIRST_WEEK.contains(LocalDate.parse("2024-03-07")));
        assertFalse(MARCH_FIRST_WEEK.contains(LocalDate.parse("2024-03-08")));
        assertFalse(MARCH_FIRST_WEEK.contains(LocalDate.parse("2024-02-29")));
    }

    @Test
    void shouldIncludeDaysPartlyCoveredByWindow() {
        TimeWindow midday = new TimeWindow(Instant.parse("2024-03-01T12:00:00Z"), Instant.parse("2024-03-02T06:00:00Z"));

        assertTrue(midday.contains(LocalDate.parse("2024-03-01")));
        assertTrue(midday.contains(LocalDate.parse("2024-03-02")));
        assertFalse(midday.contains(LocalDate.parse("2024-03-03")));
    }

    @Test
    void shouldRejectEmptyWindow() {
        Instant at = Instant.parse("2024-03-01T00:00:00Z");
        assertThrows(IllegalArgumentException.class, () -> new TimeWindow(at, at));
    }
}
