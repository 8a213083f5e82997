package com.acme.finops.pluginhost.transport.netty;

import com.acme.finops.pluginhost.transport.api.PendingCalls;
import com.acme.finops.pluginhost.transport.api.RpcChannel;
import com.acme.finops.pluginhost.transport.api.RpcTransportException;
import com.acme.finops.pluginhost.transport.api.TransportFailure;
import com.acme.finops.pluginhost.util.Deadline;
import com.acme.finops.pluginhost.util.JsonCodec;
import com.acme.finops.pluginhost.util.PluginHostDefaults;
import com.acme.finops.pluginhost.wire.RpcRequest;
import com.acme.finops.pluginhost.wire.RpcResponse;
import com.acme.finops.pluginhost.wire.WireFormatException;
import com.fasterxml.jackson.databind.JsonNode;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;

import java.io.IOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * TCP transport over one Netty connection. Calls are multiplexed by request id, so any number may be in
 * flight concurrently.
 */
public final class NettyRpcChannel implements RpcChannel {
    private static final Logger LOG = Logger.getLogger(NettyRpcChannel.class.getName());

    private final String pluginName;
    private final Channel channel;
    private final PendingCalls pending;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private NettyRpcChannel(String pluginName, Channel channel, PendingCalls pending) {
        this.pluginName = pluginName;
        this.channel = channel;
        this.pending = pending;
    }

    /**
     * Connects to a plugin that announced {@code host:port}; blocks at most {@code connectTimeout}.
     */
    public static NettyRpcChannel connect(EventLoopGroup group,
                                          String pluginName,
                                          String host,
                                          int port,
                                          Duration connectTimeout) {
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(pluginName, "pluginName");
        PendingCalls pending = new PendingCalls();
        int timeoutMs = (int) Math.max(1L, Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()));
        Bootstrap bootstrap = new Bootstrap()
            .group(group)
            .channel(NioSocketChannel.class)
            .option(ChannelOption.TCP_NODELAY, true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutMs)
            .handler(new ChannelInitializer<>() {
                @Override
                protected void initChannel(Channel ch) {
                    ch.pipeline().addLast("frame-decoder",
                        new LengthFieldBasedFrameDecoder(PluginHostDefaults.MAX_FRAME_BYTES, 0, 4, 0, 4));
                    ch.pipeline().addLast("frame-encoder", new LengthFieldPrepender(4));
                    ch.pipeline().addLast("rpc-response", new ResponseHandler(pluginName, pending));
                }
            });

        ChannelFuture connect = bootstrap.connect(host, port);
        boolean finished;
        try {
            finished = connect.await(timeoutMs + 250L, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connect.cancel(false);
            throw new RpcTransportException(TransportFailure.CONNECT_FAILED, "interrupted while connecting", e);
        }
        if (!finished || !connect.isSuccess()) {
            connect.channel().close();
            Throwable cause = connect.cause();
            throw new RpcTransportException(TransportFailure.CONNECT_FAILED,
                "cannot connect to " + host + ":" + port + (cause == null ? "" : ": " + cause.getMessage()), cause);
        }
        NettyRpcChannel rpc = new NettyRpcChannel(pluginName, connect.channel(), pending);
        connect.channel().closeFuture().addListener(f -> rpc.onChannelClosed());
        LOG.fine(() -> "tcp channel connected plugin=" + pluginName + " endpoint=" + rpc.endpoint());
        return rpc;
    }

    @Override
    public CompletableFuture<JsonNode> call(String method, JsonNode params, Deadline deadline) {
        if (!isOpen()) {
            return CompletableFuture.failedFuture(
                new RpcTransportException(TransportFailure.CLOSED, "channel closed before " + method));
        }
        PendingCalls.Registration reg = pending.register(method, deadline, channel.eventLoop());
        if (reg.future().isDone()) {
            return reg.future();
        }
        byte[] payload;
        try {
            payload = JsonCodec.writeBytes(new RpcRequest(reg.id(), method, deadline.remainingMillis(), params).toJson());
        } catch (IOException e) {
            pending.fail(reg.id(), new RpcTransportException(TransportFailure.MALFORMED, "cannot encode " + method, e));
            return reg.future();
        }
        channel.writeAndFlush(Unpooled.wrappedBuffer(payload)).addListener((ChannelFutureListener) write -> {
            if (!write.isSuccess()) {
                pending.fail(reg.id(), new RpcTransportException(TransportFailure.CLOSED,
                    "write failed for " + method, write.cause()));
            }
        });
        return reg.future();
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && channel.isActive();
    }

    @Override
    public String endpoint() {
        return "tcp://" + channel.remoteAddress();
    }

    @Override
    public int pendingCalls() {
        return pending.size();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        channel.close();
        pending.failAll(TransportFailure.CLOSED, "channel closed");
    }

    private void onChannelClosed() {
        closed.set(true);
        pending.failAll(TransportFailure.CLOSED, "connection to " + pluginName + " lost");
    }

    private static final class ResponseHandler extends SimpleChannelInboundHandler<ByteBuf> {
        private final String pluginName;
        private final PendingCalls pending;

        private ResponseHandler(String pluginName, PendingCalls pending) {
            this.pluginName = pluginName;
            this.pending = pending;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame) throws Exception {
            RpcResponse response = RpcResponse.fromJson(JsonCodec.readTree(ByteBufUtil.getBytes(frame)));
            if (!pending.complete(response)) {
                LOG.fine(() -> "dropping stale response plugin=" + pluginName + " id=" + response.id());
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            if (cause instanceof WireFormatException || cause instanceof IOException) {
                LOG.log(Level.WARNING, "tcp channel error plugin=" + pluginName, cause);
            } else {
                LOG.log(Level.SEVERE, "unexpected tcp channel failure plugin=" + pluginName, cause);
            }
            pending.failAll(TransportFailure.MALFORMED, "malformed response from " + pluginName + ": " + cause.getMessage());
            ctx.close();
        }
    }
}
