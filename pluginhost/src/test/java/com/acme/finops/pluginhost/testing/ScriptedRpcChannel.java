package com.acme.finops.pluginhost.testing;

import com.acme.finops.pluginhost.transport.api.RpcChannel;
import com.acme.finops.pluginhost.transport.api.RpcTransportException;
import com.acme.finops.pluginhost.transport.api.TransportFailure;
import com.acme.finops.pluginhost.util.Deadline;
import com.acme.finops.pluginhost.util.JsonCodec;
import com.acme.finops.pluginhost.wire.WireErrorCodes;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory channel answering each method from a script. Honors deadlines like a real transport.
 */
public final class ScriptedRpcChannel implements RpcChannel {

    @FunctionalInterface
    public interface Handler {
        JsonNode handle(JsonNode params);
    }

    private final Map<String, Handler> handlers = new ConcurrentHashMap<>();
    private final Map<String, Duration> delays = new ConcurrentHashMap<>();
    private final List<String> calls = new CopyOnWriteArrayList<>();
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicBoolean open = new AtomicBoolean(true);

    public ScriptedRpcChannel on(String method, Handler handler) {
        handlers.put(method, handler);
        return this;
    }

    public ScriptedRpcChannel respond(String method, String json) {
        return on(method, params -> parse(json));
    }

    public ScriptedRpcChannel fail(String method, String code, String message) {
        return on(method, params -> {
            throw RpcTransportException.remote(code, message);
        });
    }

    /**
     * Answers only after {@code delay}; the caller's deadline still applies.
     */
    public ScriptedRpcChannel delay(String method, Duration delay) {
        delays.put(method, delay);
        return this;
    }

    public ScriptedRpcChannel hang(String method) {
        return delay(method, Duration.ofDays(1));
    }

    public List<String> calls() {
        return List.copyOf(calls);
    }

    @Override
    public CompletableFuture<JsonNode> call(String method, JsonNode params, Deadline deadline) {
        calls.add(method);
        if (!open.get()) {
            return CompletableFuture.failedFuture(new RpcTransportException(TransportFailure.CLOSED, "channel closed"));
        }
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        pending.incrementAndGet();
        future.whenComplete((ignored, error) -> pending.decrementAndGet());

        CompletableFuture.delayedExecutor(deadline.remainingNanos(), TimeUnit.NANOSECONDS).execute(() ->
            future.completeExceptionally(new RpcTransportException(TransportFailure.DEADLINE_EXCEEDED,
                method + " deadline exceeded")));

        Duration delay = delays.getOrDefault(method, Duration.ZERO);
        CompletableFuture.delayedExecutor(delay.toNanos(), TimeUnit.NANOSECONDS).execute(() -> answer(method, params, future));
        return future;
    }

    private void answer(String method, JsonNode params, CompletableFuture<JsonNode> future) {
        Handler handler = handlers.get(method);
        if (handler == null) {
            future.completeExceptionally(RpcTransportException.remote(WireErrorCodes.UNIMPLEMENTED, method + " not implemented"));
            return;
        }
        try {
            future.complete(handler.handle(params));
        } catch (RpcTransportException e) {
            future.completeExceptionally(e);
        }
    }

    @Override
    public boolean isOpen() {
        return open.get();
    }

    @Override
    public String endpoint() {
        return "memory://scripted";
    }

    @Override
    public int pendingCalls() {
        return pending.get();
    }

    @Override
    public void close() {
        open.set(false);
    }

    private static JsonNode parse(String json) {
        try {
            return JsonCodec.readTree(json);
        } catch (Exception e) {
            throw new IllegalArgumentException("bad scripted JSON: " + json, e);
        }
    }
}
