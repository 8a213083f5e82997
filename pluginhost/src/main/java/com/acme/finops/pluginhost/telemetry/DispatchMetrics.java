package com.acme.finops.pluginhost.telemetry;

import com.acme.finops.pluginhost.error.ErrorKind;

public interface DispatchMetrics {
    void incCalls(String plugin, long n);
    void incSuccesses(String plugin, long n);
    void incFailures(String plugin, ErrorKind kind, long n);
    void incUnmatchedResources(long n);
    void observeCallNanos(long nanos);
    void observeBatchNanos(long nanos);
}
