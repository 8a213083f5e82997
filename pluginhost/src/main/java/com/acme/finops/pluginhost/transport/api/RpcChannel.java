package com.acme.finops.pluginhost.transport.api;

import com.acme.finops.pluginhost.util.Deadline;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.concurrent.CompletableFuture;

/**
 * Transport SPI between the host and one plugin process.
 *
 * <p>Implementations must:</p>
 * <ul>
 *   <li>complete every returned future, at the latest when the deadline expires;</li>
 *   <li>fail futures with {@link RpcTransportException} only;</li>
 *   <li>forget a call as soon as its future is cancelled;</li>
 *   <li>fail all pending calls with {@link TransportFailure#CLOSED} when the channel closes.</li>
 * </ul>
 */
public interface RpcChannel extends AutoCloseable {

    CompletableFuture<JsonNode> call(String method, JsonNode params, Deadline deadline);

    boolean isOpen();

    /**
     * Human-readable endpoint, e.g. {@code tcp://127.0.0.1:40123} or {@code stdio://pid-4711}.
     */
    String endpoint();

    int pendingCalls();

    @Override
    void close();
}
