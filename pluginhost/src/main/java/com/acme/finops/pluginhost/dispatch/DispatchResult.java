package com.acme.finops.pluginhost.dispatch;

import java.util.List;
import java.util.Optional;

/**
 * Per-resource results of one dispatch batch, one entry per input resource in input order.
 * Resources without an explicit id share their type as id, so lookups by id return the first match.
 */
public final class DispatchResult<T> {
    private final List<ResourceResult<T>> results;

    DispatchResult(List<ResourceResult<T>> results) {
        this.results = List.copyOf(results);
    }

    public Optional<ResourceResult<T>> get(String resourceId) {
        return results.stream().filter(r -> r.resource().id().equals(resourceId)).findFirst();
    }

    public ResourceResult<T> at(int index) {
        return results.get(index);
    }

    public int size() {
        return results.size();
    }

    public List<ResourceResult<T>> results() {
        return results;
    }

    public long pricedCount() {
        return results.stream().filter(r -> r.winner().isPresent()).count();
    }
}
