package com.acme.finops.pluginhost.telemetry;

import com.acme.finops.pluginhost.error.ErrorKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

public final class AtomicDispatchMetrics implements DispatchMetrics {
    private final ConcurrentHashMap<String, LongAdder> callsByPlugin = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, LongAdder> successesByPlugin = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<ErrorKind, LongAdder> failuresByKind = new ConcurrentHashMap<>();
    private final LongAdder unmatchedResources = new LongAdder();
    private final LongAdder callNanos = new LongAdder();
    private final LongAdder callSamples = new LongAdder();
    private final LongAdder batchNanos = new LongAdder();
    private final LongAdder batchSamples = new LongAdder();

    @Override
    public void incCalls(String plugin, long n) {
        if (n <= 0) return;
        callsByPlugin.computeIfAbsent(plugin, ignored -> new LongAdder()).add(n);
    }

    @Override
    public void incSuccesses(String plugin, long n) {
        if (n <= 0) return;
        successesByPlugin.computeIfAbsent(plugin, ignored -> new LongAdder()).add(n);
    }

    @Override
    public void incFailures(String plugin, ErrorKind kind, long n) {
        if (n <= 0) return;
        failuresByKind.computeIfAbsent(kind, ignored -> new LongAdder()).add(n);
    }

    @Override
    public void incUnmatchedResources(long n) {
        unmatchedResources.add(Math.max(0L, n));
    }

    @Override
    public void observeCallNanos(long nanos) {
        if (nanos < 0) return;
        callNanos.add(nanos);
        callSamples.increment();
    }

    @Override
    public void observeBatchNanos(long nanos) {
        if (nanos < 0) return;
        batchNanos.add(nanos);
        batchSamples.increment();
    }

    public Snapshot snapshot() {
        Map<ErrorKind, Long> failures = new EnumMap<>(ErrorKind.class);
        failuresByKind.forEach((k, v) -> failures.put(k, v.sum()));
        return new Snapshot(
            sumOf(callsByPlugin),
            sumOf(successesByPlugin),
            Collections.unmodifiableMap(failures),
            unmatchedResources.sum(),
            callNanos.sum(),
            callSamples.sum(),
            batchNanos.sum(),
            batchSamples.sum()
        );
    }

    private static Map<String, Long> sumOf(ConcurrentHashMap<String, LongAdder> src) {
        Map<String, Long> out = new HashMap<>();
        src.forEach((k, v) -> out.put(k, v.sum()));
        return Collections.unmodifiableMap(out);
    }

    public record Snapshot(Map<String, Long> callsByPlugin,
                           Map<String, Long> successesByPlugin,
                           Map<ErrorKind, Long> failuresByKind,
                           long unmatchedResources,
                           long callNanosTotal,
                           long callSamples,
                           long batchNanosTotal,
                           long batchSamples) {

        public long failures() {
            return failuresByKind.values().stream().mapToLong(Long::longValue).sum();
        }
    }
}
