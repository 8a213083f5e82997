package com.acme.finops.pluginhost.process;

import com.acme.finops.pluginhost.manifest.PluginManifest;
import com.acme.finops.pluginhost.model.PluginInfo;
import com.acme.finops.pluginhost.rpc.CostSourceClient;
import com.acme.finops.pluginhost.transport.api.CommMode;
import com.acme.finops.pluginhost.transport.api.RpcChannel;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * One OS process running a plugin. Owned by {@link ProcessSupervisor}; consumers see it as a
 * {@link PluginHandle}.
 */
public final class PluginProcess implements PluginHandle {
    private static final Logger LOG = Logger.getLogger(PluginProcess.class.getName());

    private final long handleId;
    private final PluginManifest manifest;
    private final CommMode mode;
    private final Process process;
    private final OutputCapture stdout;
    private final OutputCapture stderr;
    private final Consumer<PluginStateChange> stateSink;
    private final AtomicReference<PluginState> state = new AtomicReference<>(PluginState.STARTING);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);

    private volatile RpcChannel channel;
    private volatile CostSourceClient client;
    private volatile PluginInfo info;
    private volatile String endpoint = "";

    PluginProcess(long handleId,
                  PluginManifest manifest,
                  CommMode mode,
                  Process process,
                  int captureLines,
                  Consumer<PluginStateChange> stateSink) {
        this.handleId = handleId;
        this.manifest = Objects.requireNonNull(manifest, "manifest");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.process = Objects.requireNonNull(process, "process");
        this.stdout = new OutputCapture(captureLines);
        this.stderr = new OutputCapture(captureLines);
        this.stateSink = Objects.requireNonNull(stateSink, "stateSink");
    }

    @Override
    public long handleId() {
        return handleId;
    }

    @Override
    public PluginManifest manifest() {
        return manifest;
    }

    @Override
    public CommMode mode() {
        return mode;
    }

    @Override
    public PluginState state() {
        return state.get();
    }

    /**
     * Client gated on READY. Before the channel is attached every call fails as not ready.
     */
    @Override
    public CostSourceClient client() {
        CostSourceClient c = client;
        if (c == null) {
            throw new IllegalStateException("plugin " + name() + " has no channel yet");
        }
        return c;
    }

    @Override
    public Optional<PluginInfo> pluginInfo() {
        return Optional.ofNullable(info);
    }

    public long pid() {
        return process.pid();
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    public String endpoint() {
        return endpoint;
    }

    public String capturedStdout() {
        return stdout.snapshot();
    }

    public String capturedStderr() {
        return stderr.snapshot();
    }

    /**
     * Captured output in the form attached to start failures.
     */
    public String diagnostics() {
        return "--- stdout ---\n" + stdout.snapshot() + "--- stderr ---\n" + stderr.snapshot();
    }

    /**
     * Waits for the process to exit.
     *
     * @return {@code true} if it has exited within the timeout
     */
    public boolean awaitExit(Duration timeout) throws InterruptedException {
        try {
            process.onExit().get(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            return !process.isAlive();
        }
    }

    // ---- Supervisor-side ----

    Process process() {
        return process;
    }

    OutputCapture stdoutCapture() {
        return stdout;
    }

    OutputCapture stderrCapture() {
        return stderr;
    }

    RpcChannel channel() {
        return channel;
    }

    void attach(RpcChannel channel, String endpoint) {
        this.channel = channel;
        this.endpoint = endpoint;
        this.client = new CostSourceClient(manifest.name(), channel, this::isReady);
    }

    void pluginInfo(PluginInfo info) {
        this.info = info;
    }

    boolean markStopRequested() {
        return stopRequested.compareAndSet(false, true);
    }

    boolean stopRequested() {
        return stopRequested.get();
    }

    /**
     * Moves to {@code to} unless already there or already STOPPED, and publishes the change.
     */
    boolean transition(PluginState to, String reason, int exitCode) {
        while (true) {
            PluginState from = state.get();
            if (from == to || from == PluginState.STOPPED) {
                return false;
            }
            if (state.compareAndSet(from, to)) {
                LOG.fine(() -> "plugin state plugin=" + name() + " handle=" + handleId + " " + from + "->" + to
                    + (reason.isEmpty() ? "" : " reason=" + reason));
                stateSink.accept(new PluginStateChange(key(), handleId, from, to, reason, exitCode, Instant.now()));
                return true;
            }
        }
    }

    /**
     * Moves {@code expected -> to} atomically; fails if another transition won the race.
     */
    boolean transitionFrom(PluginState expected, PluginState to, String reason) {
        if (!state.compareAndSet(expected, to)) {
            return false;
        }
        stateSink.accept(new PluginStateChange(key(), handleId, expected, to, reason, -1, Instant.now()));
        return true;
    }

    @Override
    public String toString() {
        return "PluginProcess{" + key() + ", handle=" + handleId + ", mode=" + mode.wireName()
            + ", state=" + state.get() + ", pid=" + process.pid() + "}";
    }
}
