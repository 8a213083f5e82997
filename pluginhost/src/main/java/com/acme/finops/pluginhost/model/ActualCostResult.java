package com.acme.finops.pluginhost.model;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Observed spend for one day.
 */
public record ActualCostResult(LocalDate date, String currency, double cost, String source) {
    public ActualCostResult {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(currency, "currency");
        source = source == null ? "" : source;
    }
}
