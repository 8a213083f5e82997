package com.acme.finops.pluginhost.telemetry;

import com.acme.finops.pluginhost.error.ErrorKind;

public final class NoopDispatchMetrics implements DispatchMetrics {
    public static final NoopDispatchMetrics INSTANCE = new NoopDispatchMetrics();

    private NoopDispatchMetrics() {
    }

    @Override
    public void incCalls(String plugin, long n) {
    }

    @Override
    public void incSuccesses(String plugin, long n) {
    }

    @Override
    public void incFailures(String plugin, ErrorKind kind, long n) {
    }

    @Override
    public void incUnmatchedResources(long n) {
    }

    @Override
    public void observeCallNanos(long nanos) {
    }

    @Override
    public void observeBatchNanos(long nanos) {
    }
}
