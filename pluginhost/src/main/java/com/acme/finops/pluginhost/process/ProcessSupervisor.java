package com.acme.finops.pluginhost.process;

import com.acme.finops.pluginhost.compat.CompatAnalyzer;
import com.acme.finops.pluginhost.compat.CompatResult;
import com.acme.finops.pluginhost.compat.SpecVersionCompatAnalyzer;
import com.acme.finops.pluginhost.error.ErrorKind;
import com.acme.finops.pluginhost.error.PluginHostException;
import com.acme.finops.pluginhost.error.PluginRpcException;
import com.acme.finops.pluginhost.manifest.PluginManifest;
import com.acme.finops.pluginhost.model.PluginInfo;
import com.acme.finops.pluginhost.rpc.CostSourceClient;
import com.acme.finops.pluginhost.transport.api.CommMode;
import com.acme.finops.pluginhost.transport.api.RpcChannel;
import com.acme.finops.pluginhost.transport.api.RpcTransportException;
import com.acme.finops.pluginhost.transport.netty.NettyRpcChannel;
import com.acme.finops.pluginhost.transport.stdio.StdioRpcChannel;
import com.acme.finops.pluginhost.util.Deadline;
import com.acme.finops.pluginhost.util.HostConfig;
import com.acme.finops.pluginhost.util.PluginHostDefaults;
import com.acme.finops.pluginhost.util.PluginHostEnvKeys;
import com.acme.finops.pluginhost.wire.HandshakeLine;
import com.acme.finops.pluginhost.wire.WireFormatException;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Starts, watches and stops plugin processes.
 *
 * <p>Start sequence: launch, handshake (TCP) or channel attach (STDIO), one identity call, then
 * {@code GetPluginInfo}. The whole sequence is bounded by the handshake timeout. Any failure leaves no
 * child behind: the process tree is force-killed and reaped before the exception is thrown.</p>
 *
 * <p>Every lifecycle transition of every handle is published on {@link #stateChanges()}. The queue has a
 * single intended consumer, usually a {@code PluginRegistry}.</p>
 */
public final class ProcessSupervisor implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(ProcessSupervisor.class.getName());

    private final HostConfig config;
    private final String hostSpecVersion;
    private final CompatAnalyzer compatAnalyzer;
    private final EventLoopGroup ioGroup;
    private final ScheduledExecutorService timer;
    private final BlockingQueue<PluginStateChange> stateChanges = new LinkedBlockingQueue<>();
    private final Set<PluginProcess> live = ConcurrentHashMap.newKeySet();
    private final AtomicLong handleIds = new AtomicLong();
    private final AtomicBoolean running = new AtomicBoolean(true);

    public ProcessSupervisor(HostConfig config) {
        this(config, PluginHostDefaults.HOST_SPEC_VERSION);
    }

    public ProcessSupervisor(HostConfig config, String hostSpecVersion) {
        this(config, hostSpecVersion, new SpecVersionCompatAnalyzer());
    }

    public ProcessSupervisor(HostConfig config, String hostSpecVersion, CompatAnalyzer compatAnalyzer) {
        this.config = Objects.requireNonNull(config, "config");
        this.hostSpecVersion = Objects.requireNonNull(hostSpecVersion, "hostSpecVersion");
        this.compatAnalyzer = Objects.requireNonNull(compatAnalyzer, "compatAnalyzer");
        this.ioGroup = new NioEventLoopGroup(config.ioThreads());
        this.timer = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "pluginhost-deadline-timer");
            t.setDaemon(true);
            return t;
        });
    }

    public BlockingQueue<PluginStateChange> stateChanges() {
        return stateChanges;
    }

    public HostConfig config() {
        return config;
    }

    public List<PluginProcess> liveProcesses() {
        return List.copyOf(live);
    }

    /**
     * Launches the plugin and blocks until it is READY (or DEGRADED) or the handshake timeout expires.
     */
    public PluginProcess start(PluginManifest manifest, CommMode mode) throws PluginHostException {
        Objects.requireNonNull(manifest, "manifest");
        Objects.requireNonNull(mode, "mode");
        if (!running.get()) {
            throw new PluginHostException(ErrorKind.UNAVAILABLE, "supervisor is closed");
        }
        Deadline startup = Deadline.after(config.handshakeTimeout());

        ProcessBuilder pb = new ProcessBuilder(manifest.binary().toString(), mode.launchFlag())
            .directory(manifest.directory().toFile());
        pb.environment().put(PluginHostEnvKeys.FINFOCUS_PLUGIN_MODE, mode.wireName());
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new PluginHostException(ErrorKind.UNAVAILABLE,
                "cannot launch plugin " + manifest.key() + " binary=" + manifest.binary() + ": " + e.getMessage(), e);
        }

        PluginProcess handle = new PluginProcess(handleIds.incrementAndGet(), manifest, mode, process,
            PluginHostDefaults.OUTPUT_CAPTURE_LINES, stateChanges::offer);
        live.add(handle);
        LOG.info(() -> "plugin launched plugin=" + manifest.key() + " mode=" + mode.wireName() + " pid=" + process.pid());
        pumpLines(process.getErrorStream(), "plugin-stderr-" + manifest.name(), line -> {
            handle.stderrCapture().append(line);
            LOG.fine(() -> "[" + manifest.name() + "] " + line);
        });
        process.onExit().thenAccept(p -> onProcessExit(handle));

        handle.transition(PluginState.HANDSHAKING, "", -1);
        try {
            RpcChannel channel = mode == CommMode.TCP
                ? connectTcp(handle, startup)
                : new StdioRpcChannel(manifest.name(), "stdio://pid-" + process.pid(),
                    process.getInputStream(), process.getOutputStream(), timer);
            handle.attach(channel, channel.endpoint());
            probe(handle, channel, startup);
        } catch (PluginHostException e) {
            abort(handle, e.getMessage());
            throw new PluginHostException(e.kind(), e.getMessage(), handle.diagnostics(), e);
        } catch (RuntimeException e) {
            abort(handle, String.valueOf(e.getMessage()));
            throw new PluginHostException(ErrorKind.UNAVAILABLE, "plugin " + manifest.key() + " failed to start: "
                + e.getMessage(), handle.diagnostics(), e);
        }
        return handle;
    }

    /**
     * Stops {@code handle} and starts a fresh process for the same manifest and mode.
     */
    public PluginProcess restart(PluginProcess handle) throws PluginHostException {
        stop(handle);
        return start(handle.manifest(), handle.mode());
    }

    /**
     * Closes the channel, sends SIGTERM, waits the grace period, then force-kills the process and its
     * descendants. Always reaps. Safe to call more than once and on crashed handles.
     */
    public void stop(PluginHandle handle) {
        if (!(handle instanceof PluginProcess p)) {
            throw new IllegalArgumentException("handle was not started by this supervisor: " + handle);
        }
        if (!p.markStopRequested()) {
            return;
        }
        RpcChannel channel = p.channel();
        if (channel != null) {
            channel.close();
        }
        terminate(p.process(), config.stopGrace());
        live.remove(p);
        p.transition(PluginState.STOPPED, "stop requested", exitCodeOf(p.process()));
        LOG.info(() -> "plugin stopped plugin=" + p.key() + " pid=" + p.pid());
    }

    private RpcChannel connectTcp(PluginProcess handle, Deadline startup) throws PluginHostException {
        CompletableFuture<String> handshake = new CompletableFuture<>();
        Process process = handle.process();
        pumpLines(process.getInputStream(), "plugin-stdout-" + handle.name(), line -> {
            if (!handshake.isDone() && HandshakeLine.looksLikeHandshake(line)) {
                handshake.complete(line);
            } else {
                handle.stdoutCapture().append(line);
            }
        });
        process.onExit().thenAccept(p -> handshake.completeExceptionally(
            new IllegalStateException("plugin exited before handshake, exit code " + p.exitValue())));

        String rawLine;
        try {
            rawLine = handshake.get(startup.remainingNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            throw new PluginHostException(ErrorKind.HANDSHAKE_TIMEOUT, "plugin " + handle.key()
                + " did not complete handshake within " + config.handshakeTimeout().toMillis() + "ms", e);
        } catch (ExecutionException e) {
            throw new PluginHostException(ErrorKind.UNAVAILABLE, "plugin " + handle.key() + ": "
                + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PluginHostException(ErrorKind.CANCELLED, "interrupted during handshake with " + handle.key(), e);
        }

        HandshakeLine line;
        try {
            line = HandshakeLine.parse(rawLine);
        } catch (WireFormatException e) {
            throw new PluginHostException(ErrorKind.PROTOCOL_MISMATCH, "plugin " + handle.key() + ": " + e.getMessage(), e);
        }
        checkSpecVersion(handle, line.specVersion());

        Duration connectTimeout = Duration.ofMillis(Math.min(startup.remainingMillis(), PluginHostDefaults.DEFAULT_CONNECT_TIMEOUT_MS));
        try {
            return NettyRpcChannel.connect(ioGroup, handle.name(), line.host(), line.port(), connectTimeout);
        } catch (RpcTransportException e) {
            throw new PluginHostException(ErrorKind.UNAVAILABLE, "plugin " + handle.key() + ": " + e.getMessage(), e);
        }
    }

    private void probe(PluginProcess handle, RpcChannel channel, Deadline startup) throws PluginHostException {
        CostSourceClient probe = CostSourceClient.ungated(handle.name(), channel);
        try {
            String identity = probe.identity(startup);
            if (!identity.equals(handle.name())) {
                LOG.fine(() -> "plugin identity differs from manifest name manifest=" + handle.name() + " identity=" + identity);
            }
        } catch (PluginRpcException e) {
            throw startupFailure(handle, "identity", e);
        }

        PluginInfo info = null;
        String degradedReason = null;
        try {
            info = probe.pluginInfo(startup);
        } catch (PluginRpcException e) {
            switch (e.kind()) {
                case NOT_SUPPORTED -> LOG.warning(() -> "plugin does not implement GetPluginInfo, treating as legacy plugin="
                    + handle.key());
                case TIMEOUT, UNAVAILABLE, CANCELLED -> throw startupFailure(handle, "plugin info", e);
                default -> degradedReason = "plugin info failed: " + e.getMessage();
            }
        }
        if (info != null) {
            handle.pluginInfo(info);
            if (handle.mode() == CommMode.STDIO) {
                checkSpecVersion(handle, info.specVersion());
            }
        }
        PluginState target = degradedReason == null ? PluginState.READY : PluginState.DEGRADED;
        String reason = degradedReason == null ? "" : degradedReason;
        if (!handle.transitionFrom(PluginState.HANDSHAKING, target, reason)) {
            throw new PluginHostException(ErrorKind.UNAVAILABLE, "plugin " + handle.key() + " exited during startup");
        }
        if (target == PluginState.READY) {
            LOG.info(() -> "plugin ready plugin=" + handle.key() + " endpoint=" + handle.endpoint());
        } else {
            LOG.warning(() -> "plugin degraded plugin=" + handle.key() + " reason=" + reason);
        }
    }

    private PluginHostException startupFailure(PluginProcess handle, String step, PluginRpcException e) {
        ErrorKind kind = switch (e.kind()) {
            case TIMEOUT -> ErrorKind.HANDSHAKE_TIMEOUT;
            case PROTOCOL_MISMATCH, CANCELLED -> e.kind();
            default -> ErrorKind.UNAVAILABLE;
        };
        return new PluginHostException(kind, "plugin " + handle.key() + " failed " + step + " during startup: "
            + e.getMessage(), e);
    }

    private void checkSpecVersion(PluginProcess handle, String pluginSpecVersion) throws PluginHostException {
        CompatResult result = compatAnalyzer.analyze(hostSpecVersion, pluginSpecVersion);
        if (result instanceof CompatResult.MajorMismatch mismatch) {
            throw new PluginHostException(ErrorKind.PROTOCOL_MISMATCH, "plugin " + handle.key() + " speaks spec "
                + mismatch.plugin() + ", host speaks " + mismatch.host());
        }
        if (result instanceof CompatResult.Invalid invalid) {
            if (config.strictCompatibility()) {
                throw new PluginHostException(ErrorKind.PROTOCOL_MISMATCH, "plugin " + handle.key()
                    + " reported unparseable spec version '" + invalid.rawPluginVersion() + "'");
            }
            LOG.warning(() -> "plugin spec version unparseable, continuing plugin=" + handle.key()
                + " specVersion=" + invalid.rawPluginVersion());
        }
    }

    private void abort(PluginProcess handle, String reason) {
        handle.markStopRequested();
        handle.transition(PluginState.CRASHED, reason, -1);
        RpcChannel channel = handle.channel();
        if (channel != null) {
            channel.close();
        }
        terminate(handle.process(), Duration.ZERO);
        live.remove(handle);
        LOG.warning(() -> "plugin start failed plugin=" + handle.key() + " reason=" + reason);
    }

    private void onProcessExit(PluginProcess handle) {
        if (handle.stopRequested()) {
            return;
        }
        int exitCode = exitCodeOf(handle.process());
        if (handle.transition(PluginState.CRASHED, "process exited with code " + exitCode, exitCode)) {
            LOG.warning(() -> "plugin crashed plugin=" + handle.key() + " pid=" + handle.pid() + " exitCode=" + exitCode
                + " stderr=" + tail(handle.capturedStderr()));
        }
        RpcChannel channel = handle.channel();
        if (channel != null) {
            channel.close();
        }
        live.remove(handle);
    }

    private static void terminate(Process process, Duration grace) {
        List<ProcessHandle> descendants = process.descendants().toList();
        try {
            if (process.isAlive() && !grace.isZero()) {
                process.destroy();
                process.waitFor(grace.toMillis(), TimeUnit.MILLISECONDS);
            }
            if (process.isAlive()) {
                process.destroyForcibly();
            }
            descendants.forEach(ProcessHandle::destroyForcibly);
            if (!process.waitFor(PluginHostDefaults.REAP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                LOG.warning(() -> "plugin process not reaped pid=" + process.pid());
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            descendants.forEach(ProcessHandle::destroyForcibly);
            Thread.currentThread().interrupt();
        }
    }

    private static int exitCodeOf(Process process) {
        return process.isAlive() ? -1 : process.exitValue();
    }

    private static String tail(String text) {
        int max = 512;
        return text.length() <= max ? text.strip() : "..." + text.substring(text.length() - max).strip();
    }

    private static void pumpLines(InputStream in, String threadName, Consumer<String> sink) {
        Thread t = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    sink.accept(line);
                }
            } catch (IOException e) {
                LOG.log(Level.FINE, "output pump ended thread=" + threadName, e);
            }
        }, threadName);
        t.setDaemon(true);
        t.start();
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        for (PluginProcess p : List.copyOf(live)) {
            stop(p);
        }
        ioGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        timer.shutdownNow();
        LOG.info("process supervisor closed");
    }
}
