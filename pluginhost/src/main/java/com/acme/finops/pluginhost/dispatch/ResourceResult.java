package com.acme.finops.pluginhost.dispatch;

import com.acme.finops.pluginhost.model.ResourceDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Every plugin outcome for one resource, in plugin declaration order.
 */
public record ResourceResult<T>(ResourceDescriptor resource, List<CallOutcome<T>> outcomes) {

    public ResourceResult {
        Objects.requireNonNull(resource, "resource");
        outcomes = List.copyOf(outcomes);
    }

    /**
     * First successful outcome in declaration order.
     */
    public Optional<CallOutcome.Success<T>> winner() {
        for (CallOutcome<T> o : outcomes) {
            if (o instanceof CallOutcome.Success<T> s) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    public Optional<T> value() {
        return winner().map(CallOutcome.Success::value);
    }

    public List<CallOutcome.Success<T>> successes() {
        List<CallOutcome.Success<T>> out = new ArrayList<>();
        for (CallOutcome<T> o : outcomes) {
            if (o instanceof CallOutcome.Success<T> s) {
                out.add(s);
            }
        }
        return out;
    }

    public List<CallOutcome.Failure<T>> failures() {
        List<CallOutcome.Failure<T>> out = new ArrayList<>();
        for (CallOutcome<T> o : outcomes) {
            if (o instanceof CallOutcome.Failure<T> f) {
                out.add(f);
            }
        }
        return out;
    }

    /**
     * {@code true} when no ready plugin matched the resource.
     */
    public boolean unmatched() {
        return outcomes.isEmpty();
    }
}
