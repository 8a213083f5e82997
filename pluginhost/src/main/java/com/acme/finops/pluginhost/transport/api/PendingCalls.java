package com.acme.finops.pluginhost.transport.api;

import com.acme.finops.pluginhost.util.Deadline;
import com.acme.finops.pluginhost.wire.RpcResponse;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Request-id keyed table of in-flight calls shared by both transports. Each entry owns a deadline timer
 * and removes itself on any completion, including cancellation.
 */
public final class PendingCalls {
    private final AtomicLong ids = new AtomicLong();
    private final ConcurrentHashMap<Long, CompletableFuture<JsonNode>> pending = new ConcurrentHashMap<>();

    public record Registration(long id, CompletableFuture<JsonNode> future) {
    }

    public Registration register(String method, Deadline deadline, ScheduledExecutorService timer) {
        long id = ids.incrementAndGet();
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        pending.put(id, future);
        long remaining = deadline.remainingNanos();
        if (remaining <= 0) {
            future.completeExceptionally(deadlineExceeded(method));
        } else {
            ScheduledFuture<?> timeout = timer.schedule(
                () -> future.completeExceptionally(deadlineExceeded(method)), remaining, TimeUnit.NANOSECONDS);
            future.whenComplete((ignored, error) -> timeout.cancel(false));
        }
        future.whenComplete((ignored, error) -> pending.remove(id));
        return new Registration(id, future);
    }

    /**
     * Routes a response to its waiting call.
     *
     * @return {@code false} when no call with that id is pending (late or stale response)
     */
    public boolean complete(RpcResponse response) {
        CompletableFuture<JsonNode> future = pending.remove(response.id());
        if (future == null) {
            return false;
        }
        if (response.isError()) {
            return future.completeExceptionally(
                RpcTransportException.remote(response.error().code(), response.error().message()));
        }
        return future.complete(response.result());
    }

    public void fail(long id, RpcTransportException error) {
        CompletableFuture<JsonNode> future = pending.remove(id);
        if (future != null) {
            future.completeExceptionally(error);
        }
    }

    public void failAll(TransportFailure failure, String message) {
        List<Map.Entry<Long, CompletableFuture<JsonNode>>> snapshot = new ArrayList<>(pending.entrySet());
        for (Map.Entry<Long, CompletableFuture<JsonNode>> e : snapshot) {
            pending.remove(e.getKey());
            e.getValue().completeExceptionally(new RpcTransportException(failure, message));
        }
    }

    public int size() {
        return pending.size();
    }

    private static RpcTransportException deadlineExceeded(String method) {
        return new RpcTransportException(TransportFailure.DEADLINE_EXCEEDED, method + " deadline exceeded");
    }
}
