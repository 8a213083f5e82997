package com.acme.finops.pluginhost.transport.stdio;

import com.acme.finops.pluginhost.transport.api.PendingCalls;
import com.acme.finops.pluginhost.transport.api.RpcChannel;
import com.acme.finops.pluginhost.transport.api.RpcTransportException;
import com.acme.finops.pluginhost.transport.api.TransportFailure;
import com.acme.finops.pluginhost.util.Deadline;
import com.acme.finops.pluginhost.util.JsonCodec;
import com.acme.finops.pluginhost.wire.FrameCodec;
import com.acme.finops.pluginhost.wire.RpcRequest;
import com.acme.finops.pluginhost.wire.RpcResponse;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Pipe transport over a child's stdin/stdout. A pipe carries one conversation, so calls are serialized:
 * a call is written only after the previous one completed, and callers queue in arrival order. Waiting
 * for the pipe counts against the call's own deadline.
 */
public final class StdioRpcChannel implements RpcChannel {
    private static final Logger LOG = Logger.getLogger(StdioRpcChannel.class.getName());

    private final String pluginName;
    private final String endpoint;
    private final InputStream fromPlugin;
    private final OutputStream toPlugin;
    private final ScheduledExecutorService timer;
    private final PendingCalls pending = new PendingCalls();
    private final Semaphore pipe = new Semaphore(1, true);
    private final ExecutorService writer;
    private final Thread reader;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public StdioRpcChannel(String pluginName,
                           String endpoint,
                           InputStream fromPlugin,
                           OutputStream toPlugin,
                           ScheduledExecutorService timer) {
        this.pluginName = Objects.requireNonNull(pluginName, "pluginName");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.fromPlugin = Objects.requireNonNull(fromPlugin, "fromPlugin");
        this.toPlugin = Objects.requireNonNull(toPlugin, "toPlugin");
        this.timer = Objects.requireNonNull(timer, "timer");
        this.writer = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "stdio-writer-" + pluginName);
            t.setDaemon(true);
            return t;
        });
        this.reader = new Thread(this::readLoop, "stdio-reader-" + pluginName);
        this.reader.setDaemon(true);
        this.reader.start();
    }

    @Override
    public CompletableFuture<JsonNode> call(String method, JsonNode params, Deadline deadline) {
        if (!isOpen()) {
            return CompletableFuture.failedFuture(
                new RpcTransportException(TransportFailure.CLOSED, "channel closed before " + method));
        }
        PendingCalls.Registration reg = pending.register(method, deadline, timer);
        CompletableFuture<JsonNode> future = reg.future();
        if (future.isDone()) {
            return future;
        }
        AtomicBoolean holdsPipe = new AtomicBoolean(false);
        future.whenComplete((ignored, error) -> {
            if (holdsPipe.compareAndSet(true, false)) {
                pipe.release();
            }
        });
        try {
            writer.execute(() -> send(reg, method, params, deadline, holdsPipe));
        } catch (RejectedExecutionException e) {
            pending.fail(reg.id(), new RpcTransportException(TransportFailure.CLOSED, "channel closed before " + method, e));
        }
        return future;
    }

    private void send(PendingCalls.Registration reg, String method, JsonNode params, Deadline deadline, AtomicBoolean holdsPipe) {
        CompletableFuture<JsonNode> future = reg.future();
        try {
            if (future.isDone() || !pipe.tryAcquire(deadline.remainingNanos(), TimeUnit.NANOSECONDS)) {
                return;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pending.fail(reg.id(), new RpcTransportException(TransportFailure.CLOSED, "writer interrupted", e));
            return;
        }
        holdsPipe.set(true);
        if (future.isDone()) {
            if (holdsPipe.compareAndSet(true, false)) {
                pipe.release();
            }
            return;
        }
        try {
            byte[] payload = JsonCodec.writeBytes(new RpcRequest(reg.id(), method, deadline.remainingMillis(), params).toJson());
            FrameCodec.writeFrame(toPlugin, payload);
        } catch (IOException e) {
            pending.fail(reg.id(), new RpcTransportException(TransportFailure.CLOSED, "write failed for " + method, e));
        }
    }

    private void readLoop() {
        try {
            while (!closed.get()) {
                byte[] frame = FrameCodec.readFrame(fromPlugin);
                if (frame == null) {
                    break;
                }
                RpcResponse response = RpcResponse.fromJson(JsonCodec.readTree(frame));
                if (!pending.complete(response)) {
                    LOG.fine(() -> "dropping stale response plugin=" + pluginName + " id=" + response.id());
                }
            }
            LOG.fine(() -> "stdio channel reached end of stream plugin=" + pluginName);
            failAndClose(TransportFailure.CLOSED, "plugin " + pluginName + " closed its output");
        } catch (IOException e) {
            if (!closed.get()) {
                LOG.log(Level.WARNING, "stdio channel read failed plugin=" + pluginName, e);
            }
            failAndClose(TransportFailure.MALFORMED, "unreadable output from " + pluginName + ": " + e.getMessage());
        }
    }

    private void failAndClose(TransportFailure failure, String message) {
        pending.failAll(failure, message);
        close();
    }

    @Override
    public boolean isOpen() {
        return !closed.get();
    }

    @Override
    public String endpoint() {
        return endpoint;
    }

    @Override
    public int pendingCalls() {
        return pending.size();
    }

    /**
     * Closes the plugin's stdin, which a well-behaved plugin treats as a shutdown request.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        writer.shutdownNow();
        try {
            toPlugin.close();
        } catch (IOException e) {
            LOG.log(Level.FINE, "closing plugin stdin failed plugin=" + pluginName, e);
        }
        pending.failAll(TransportFailure.CLOSED, "channel closed");
    }
}
