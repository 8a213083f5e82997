package com.acme.finops.pluginhost.telemetry;

import com.acme.finops.pluginhost.error.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;

class AtomicDispatchMetricsTest {

    @Test
    void shouldAggregateCountersAndLatencies() {
        AtomicDispatchMetrics metrics = new AtomicDispatchMetrics();
        metrics.incCalls("alpha", 2);
        metrics.incCalls("beta", 1);
        metrics.incSuccesses("alpha", 1);
        metrics.incFailures("alpha", ErrorKind.TIMEOUT, 1);
        metrics.incFailures("beta", ErrorKind.TIMEOUT, 1);
        metrics.incFailures("beta", ErrorKind.NO_DATA, 1);
        metrics.incUnmatchedResources(3);
        metrics.observeCallNanos(1_000);
        metrics.observeCallNanos(3_000);
        metrics.observeBatchNanos(-5);

        AtomicDispatchMetrics.Snapshot s = metrics.snapshot();

        assertEquals(2L, s.callsByPlugin().get("alpha"));
        assertEquals(1L, s.successesByPlugin().get("alpha"));
        assertEquals(2L, s.failuresByKind().get(ErrorKind.TIMEOUT));
        assertEquals(3L, s.failures());
        assertEquals(3L, s.unmatchedResources());
        assertEquals(4_000L, s.callNanosTotal());
        assertEquals(2L, s.callSamples());
        assertEquals(0L, s.batchSamples());
    }

    @Test
    void shouldIgnoreNonPositiveIncrements() {
        AtomicDispatchMetrics metrics = new AtomicDispatchMetrics();
        metrics.incCalls("alpha", 0);
        metrics.incSuccesses("alpha", -1);
        NoopDispatchMetrics.INSTANCE.incCalls("alpha", 5);

        assertEquals(0, metrics.snapshot().callsByPlugin().size());
        assertEquals(0, metrics.snapshot().successesByPlugin().size());
    }
}
