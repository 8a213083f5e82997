package com.acme.finops.pluginhost.conformance;

import com.acme.finops.pluginhost.error.ErrorKind;
import com.acme.finops.pluginhost.error.PluginHostException;
import com.acme.finops.pluginhost.error.PluginRpcException;
import com.acme.finops.pluginhost.manifest.PluginManifest;
import com.acme.finops.pluginhost.model.PluginInfo;
import com.acme.finops.pluginhost.process.PluginProcess;
import com.acme.finops.pluginhost.process.ProcessSupervisor;
import com.acme.finops.pluginhost.util.Deadline;
import com.acme.finops.pluginhost.util.HostConfig;
import com.acme.finops.pluginhost.util.PluginHostDefaults;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the declared cases, in order, against one plugin process.
 *
 * <p>Timing rules: the handshake timeout bounds startup; the suite timeout starts once the plugin is
 * ready. Each case gets {@code min(case timeout, remaining suite time)}; a case that runs out of time
 * fails, and cases not yet started when the suite time is gone are skipped. Every selected case appears
 * in the report exactly once.</p>
 *
 * <p>A case during which the plugin process dies is an error; the plugin is restarted once for the
 * remaining cases. If the restart fails, the remaining cases are errors as well.</p>
 */
public final class ConformanceSuite {
    private static final Logger LOG = Logger.getLogger(ConformanceSuite.class.getName());
    private static final Duration CRASH_PROBE = Duration.ofMillis(500);

    private final List<ConformanceTestCase> cases;
    private final HostConfig hostConfig;
    private final String hostSpecVersion;

    public ConformanceSuite() {
        this(ConformanceTests.standard());
    }

    public ConformanceSuite(List<ConformanceTestCase> cases) {
        this(cases, HostConfig.fromEnv(), PluginHostDefaults.HOST_SPEC_VERSION);
    }

    public ConformanceSuite(List<ConformanceTestCase> cases, HostConfig hostConfig, String hostSpecVersion) {
        this.cases = List.copyOf(Objects.requireNonNull(cases, "cases"));
        this.hostConfig = Objects.requireNonNull(hostConfig, "hostConfig");
        this.hostSpecVersion = Objects.requireNonNull(hostSpecVersion, "hostSpecVersion");
    }

    public List<ConformanceTestCase> cases() {
        return cases;
    }

    public List<ConformanceTestCase> selected(SuiteConfig config) {
        return cases.stream().filter(config::selects).toList();
    }

    public ConformanceReport run(SuiteConfig config) {
        Objects.requireNonNull(config, "config");
        Instant timestamp = Instant.now();
        long startedNanos = System.nanoTime();
        List<ConformanceTestCase> selected = selected(config);
        PluginManifest manifest = manifestFor(config.pluginPath());
        LOG.info(() -> "conformance run plugin=" + config.pluginPath() + " mode=" + config.mode().wireName()
            + " cases=" + selected.size());

        HostConfig effective = hostConfig.withHandshakeTimeout(config.handshakeTimeout());
        AtomicInteger caseThreads = new AtomicInteger();
        ExecutorService runner = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "conformance-case-" + caseThreads.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        try (ProcessSupervisor supervisor = new ProcessSupervisor(effective, hostSpecVersion)) {
            PluginProcess plugin;
            try {
                plugin = supervisor.start(manifest, config.mode());
                if (!plugin.isReady()) {
                    throw new PluginHostException(ErrorKind.INTERNAL, "plugin " + manifest.name()
                        + " started but is " + plugin.state() + ": GetPluginInfo failed", plugin.diagnostics(), null);
                }
            } catch (PluginHostException e) {
                LOG.warning(() -> "plugin under test failed to start: " + e.getMessage());
                List<TestResult> results = new ArrayList<>();
                for (ConformanceTestCase c : selected) {
                    results.add(TestResult.of(c, TestStatus.ERROR, Duration.ZERO, e.kind() + ": " + e.getMessage(), ""));
                }
                String fault = e.diagnostics().isBlank() ? e.getMessage() : e.getMessage() + "\n" + e.diagnostics();
                return new ConformanceReport(PluginHostDefaults.CONFORMANCE_SUITE_NAME, describe(config, manifest, null),
                    results, timestamp, elapsed(startedNanos), fault, e.kind());
            }

            PluginUnderTest under = describe(config, manifest, plugin);
            Deadline suiteDeadline = Deadline.after(config.suiteTimeout());
            List<TestResult> results = new ArrayList<>();
            String unavailable = null;
            for (ConformanceTestCase testCase : selected) {
                if (suiteDeadline.isExpired()) {
                    results.add(TestResult.of(testCase, TestStatus.SKIP, Duration.ZERO, "", "suite timeout"));
                    continue;
                }
                if (unavailable != null) {
                    results.add(TestResult.of(testCase, TestStatus.ERROR, Duration.ZERO, unavailable, ""));
                    continue;
                }
                TestResult result = runCase(testCase, plugin, suiteDeadline, config, runner);
                results.add(result);
                log(config.verbosity(), result);

                if (pluginDied(plugin, result)) {
                    if (result.status() != TestStatus.ERROR) {
                        results.set(results.size() - 1, TestResult.of(testCase, TestStatus.ERROR, result.duration(),
                            "plugin crashed: " + result.error(), result.details()));
                    }
                    LOG.warning(() -> "plugin crashed during " + testCase.name() + ", restarting");
                    try {
                        plugin = supervisor.restart(plugin);
                    } catch (PluginHostException e) {
                        unavailable = "plugin unavailable after crash: " + e.getMessage();
                        LOG.warning("plugin restart failed: " + e.getMessage());
                    }
                }
            }
            return new ConformanceReport(PluginHostDefaults.CONFORMANCE_SUITE_NAME, under, results, timestamp,
                elapsed(startedNanos), null, null);
        } finally {
            runner.shutdownNow();
        }
    }

    private TestResult runCase(ConformanceTestCase testCase,
                               PluginProcess plugin,
                               Deadline suiteDeadline,
                               SuiteConfig config,
                               ExecutorService runner) {
        Deadline caseDeadline = suiteDeadline.cap(testCase.timeout());
        TestContext ctx = new TestContext(plugin, caseDeadline, config.environment(), hostSpecVersion);
        long started = System.nanoTime();

        Optional<String> skip = testCase.precondition().skipReason(ctx);
        if (skip.isPresent()) {
            return TestResult.of(testCase, TestStatus.SKIP, Duration.ZERO, "", skip.get());
        }

        Future<String> body = runner.submit(() -> testCase.body().run(ctx));
        try {
            String details = body.get(caseDeadline.remainingNanos(), TimeUnit.NANOSECONDS);
            return TestResult.of(testCase, TestStatus.PASS, elapsed(started), "", details);
        } catch (TimeoutException e) {
            body.cancel(true);
            Duration took = elapsed(started);
            return TestResult.of(testCase, TestStatus.FAIL, took, "timed out after " + took.toMillis() + "ms", "");
        } catch (InterruptedException e) {
            body.cancel(true);
            Thread.currentThread().interrupt();
            return TestResult.of(testCase, TestStatus.ERROR, elapsed(started), "conformance run interrupted", "");
        } catch (ExecutionException e) {
            return classify(testCase, e.getCause(), elapsed(started));
        }
    }

    private static TestResult classify(ConformanceTestCase testCase, Throwable cause, Duration took) {
        if (cause instanceof CaseSkipped skipped) {
            return TestResult.of(testCase, TestStatus.SKIP, took, "", skipped.getMessage());
        }
        if (cause instanceof ConformanceCheckFailed failed) {
            return TestResult.of(testCase, TestStatus.FAIL, took, failed.getMessage(), "");
        }
        if (cause instanceof PluginRpcException rpc) {
            if (rpc.kind() == ErrorKind.TIMEOUT) {
                return TestResult.of(testCase, TestStatus.FAIL, took, "timed out after " + took.toMillis() + "ms", "");
            }
            if (rpc.kind() == ErrorKind.UNAVAILABLE) {
                return TestResult.of(testCase, TestStatus.ERROR, took, rpc.kind() + ": " + rpc.getMessage(), "");
            }
            return TestResult.of(testCase, TestStatus.FAIL, took, "unexpected " + rpc.kind() + ": " + rpc.getMessage(), "");
        }
        LOG.log(Level.WARNING, "conformance case " + testCase.name() + " threw unexpectedly", cause);
        return TestResult.of(testCase, TestStatus.ERROR, took, String.valueOf(cause), "");
    }

    private static boolean pluginDied(PluginProcess plugin, TestResult result) {
        if (!plugin.isAlive()) {
            return true;
        }
        if (result.status() != TestStatus.ERROR) {
            return false;
        }
        try {
            return plugin.awaitExit(CRASH_PROBE);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static void log(Verbosity verbosity, TestResult result) {
        if (verbosity == Verbosity.QUIET) {
            return;
        }
        Level level = result.status() == TestStatus.PASS || result.status() == TestStatus.SKIP ? Level.FINE : Level.INFO;
        LOG.log(level, () -> "case " + result.name() + " status=" + result.status().wireName()
            + " durationMs=" + result.duration().toMillis()
            + (result.error().isEmpty() ? "" : " error=" + result.error()));
    }

    /**
     * Conformance targets a bare binary, not an installed plugin, so the manifest is synthesized.
     */
    static PluginManifest manifestFor(Path pluginPath) {
        Path absolute = pluginPath.toAbsolutePath().normalize();
        String fileName = absolute.getFileName().toString();
        String name = fileName.startsWith(PluginHostDefaults.BINARY_PREFIX)
            ? fileName.substring(PluginHostDefaults.BINARY_PREFIX.length())
            : fileName;
        return new PluginManifest(name, "0.0.0", PluginHostDefaults.HOST_SPEC_VERSION, List.of("*"), absolute,
            Map.of(), absolute.getParent());
    }

    private static PluginUnderTest describe(SuiteConfig config, PluginManifest manifest, PluginProcess plugin) {
        Optional<PluginInfo> info = plugin == null ? Optional.empty() : plugin.pluginInfo();
        return new PluginUnderTest(
            config.pluginPath().toString(),
            info.map(PluginInfo::name).orElse(manifest.name()),
            info.map(PluginInfo::version).orElse(""),
            info.map(PluginInfo::specVersion).orElse(""),
            config.mode().wireName());
    }

    private static Duration elapsed(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }
}
