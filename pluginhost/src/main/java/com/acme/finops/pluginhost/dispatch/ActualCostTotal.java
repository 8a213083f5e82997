package com.acme.finops.pluginhost.dispatch;

import com.acme.finops.pluginhost.model.ActualCostResult;

import java.util.List;

/**
 * Summed actual cost for one resource, with the per-day entries that went into the sum in date order.
 */
public record ActualCostTotal(String currency, double total, List<ActualCostResult> daily) {
    public ActualCostTotal {
        daily = List.copyOf(daily);
    }
}
