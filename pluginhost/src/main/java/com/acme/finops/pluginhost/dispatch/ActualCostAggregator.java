package com.acme.finops.pluginhost.dispatch;

import com.acme.finops.pluginhost.error.ErrorKind;
import com.acme.finops.pluginhost.error.PluginHostException;
import com.acme.finops.pluginhost.model.ActualCostResult;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Combines actual-cost answers from several plugins. No currency conversion: answers in more than one
 * currency are rejected. When two plugins report the same day, the earlier-declared plugin's entry counts.
 */
public final class ActualCostAggregator {

    private ActualCostAggregator() {
    }

    public static Optional<ActualCostTotal> total(ResourceResult<List<ActualCostResult>> result) throws PluginHostException {
        TreeSet<String> currencies = new TreeSet<>();
        for (CallOutcome.Success<List<ActualCostResult>> s : result.successes()) {
            s.value().forEach(r -> currencies.add(r.currency()));
        }
        if (currencies.size() > 1) {
            throw new PluginHostException(ErrorKind.MIXED_CURRENCIES,
                "actual cost for " + result.resource().id() + " reported in " + String.join(", ", currencies));
        }
        if (currencies.isEmpty()) {
            return Optional.empty();
        }

        Map<LocalDate, ActualCostResult> byDate = new TreeMap<>();
        for (CallOutcome.Success<List<ActualCostResult>> s : result.successes()) {
            Map<LocalDate, ActualCostResult> fromPlugin = new TreeMap<>();
            for (ActualCostResult r : s.value()) {
                fromPlugin.merge(r.date(), r, (a, b) -> new ActualCostResult(a.date(), a.currency(), a.cost() + b.cost(), a.source()));
            }
            fromPlugin.forEach(byDate::putIfAbsent);
        }
        double sum = 0.0d;
        for (ActualCostResult r : byDate.values()) {
            sum += r.cost();
        }
        return Optional.of(new ActualCostTotal(currencies.first(), sum, new ArrayList<>(byDate.values())));
    }
}
