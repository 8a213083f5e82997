package com.acme.finops.pluginhost.dispatch;

import com.acme.finops.pluginhost.error.ErrorKind;
import com.acme.finops.pluginhost.error.PluginRpcException;
import com.acme.finops.pluginhost.model.ActualCostResult;
import com.acme.finops.pluginhost.model.ProjectedCost;
import com.acme.finops.pluginhost.model.Recommendation;
import com.acme.finops.pluginhost.model.ResourceDescriptor;
import com.acme.finops.pluginhost.model.TimeWindow;
import com.acme.finops.pluginhost.process.PluginHandle;
import com.acme.finops.pluginhost.registry.PluginRegistry;
import com.acme.finops.pluginhost.rpc.CostSourceClient;
import com.acme.finops.pluginhost.rpc.ErrorClassifier;
import com.acme.finops.pluginhost.telemetry.DispatchMetrics;
import com.acme.finops.pluginhost.telemetry.NoopDispatchMetrics;
import com.acme.finops.pluginhost.util.Deadline;
import com.acme.finops.pluginhost.util.HostConfig;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Logger;

/**
 * Fans a query out to every matching READY plugin, concurrently, and settles precedence.
 *
 * <p>For each resource, one call goes to each matching plugin. Each call is bounded by the per-call
 * timeout and by the batch's umbrella deadline, whichever is earlier. A failing plugin only affects its
 * own outcome. Once every call has settled, the resource's winner is the first plugin in registry
 * declaration order whose call succeeded, so results do not depend on response timing.</p>
 */
public final class Dispatcher {
    private static final Logger LOG = Logger.getLogger(Dispatcher.class.getName());

    private final PluginRegistry registry;
    private final Duration callTimeout;
    private final Duration umbrellaTimeout;
    private final DispatchMetrics metrics;

    public Dispatcher(PluginRegistry registry, HostConfig config) {
        this(registry, config.callTimeout(), config.dispatchTimeout(), NoopDispatchMetrics.INSTANCE);
    }

    public Dispatcher(PluginRegistry registry, Duration callTimeout, Duration umbrellaTimeout) {
        this(registry, callTimeout, umbrellaTimeout, NoopDispatchMetrics.INSTANCE);
    }

    public Dispatcher(PluginRegistry registry, Duration callTimeout, Duration umbrellaTimeout, DispatchMetrics metrics) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout");
        this.umbrellaTimeout = Objects.requireNonNull(umbrellaTimeout, "umbrellaTimeout");
        this.metrics = metrics == null ? NoopDispatchMetrics.INSTANCE : metrics;
    }

    @FunctionalInterface
    private interface CallIssuer<T> {
        CompletableFuture<T> issue(CostSourceClient client, ResourceDescriptor resource, Deadline deadline);
    }

    private record PendingCall<T>(String plugin, CompletableFuture<T> future) {
    }

    public DispatchResult<ProjectedCost> dispatchProjectedCost(List<ResourceDescriptor> resources) {
        return fanOut("projected-cost", resources, CostSourceClient::projectedCostAsync);
    }

    public DispatchResult<List<Recommendation>> dispatchRecommendations(List<ResourceDescriptor> resources) {
        return fanOut("recommendations", resources, CostSourceClient::recommendationsAsync);
    }

    /**
     * Recommendations from every plugin that answered, concatenated in declaration order.
     */
    public static List<Recommendation> mergeRecommendations(ResourceResult<List<Recommendation>> result) {
        List<Recommendation> merged = new ArrayList<>();
        for (CallOutcome.Success<List<Recommendation>> s : result.successes()) {
            merged.addAll(s.value());
        }
        return merged;
    }

    public ResourceResult<List<ActualCostResult>> dispatchActualCost(ResourceDescriptor resource, TimeWindow window) {
        Objects.requireNonNull(window, "window");
        DispatchResult<List<ActualCostResult>> result = fanOut("actual-cost", List.of(resource),
            (client, r, deadline) -> client.actualCostAsync(r.id(), window, deadline));
        return result.results().get(0);
    }

    private <T> DispatchResult<T> fanOut(String operation, List<ResourceDescriptor> resources, CallIssuer<T> issuer) {
        Objects.requireNonNull(resources, "resources");
        long startedNanos = System.nanoTime();
        Deadline umbrella = Deadline.after(umbrellaTimeout);

        List<List<PendingCall<T>>> perResource = new ArrayList<>(resources.size());
        List<CompletableFuture<?>> all = new ArrayList<>();
        for (ResourceDescriptor resource : resources) {
            List<PendingCall<T>> calls = registry.withReadyHandles(handle -> issue(handle, resource, umbrella, issuer));
            if (calls.isEmpty()) {
                metrics.incUnmatchedResources(1);
                LOG.fine(() -> "dispatch no matching plugin op=" + operation + " resource=" + resource.id());
            }
            calls.forEach(c -> all.add(c.future()));
            perResource.add(calls);
        }

        boolean interrupted = awaitAll(all, umbrella);

        List<ResourceResult<T>> results = new ArrayList<>(resources.size());
        int failures = 0;
        for (int i = 0; i < resources.size(); i++) {
            List<CallOutcome<T>> outcomes = new ArrayList<>();
            for (PendingCall<T> call : perResource.get(i)) {
                CallOutcome<T> outcome = settle(call, interrupted);
                if (outcome instanceof CallOutcome.Failure<T> f) {
                    failures++;
                    metrics.incFailures(f.plugin(), f.kind(), 1);
                    LOG.fine(() -> "dispatch call failed op=" + operation + " plugin=" + f.plugin()
                        + " kind=" + f.kind() + " message=" + f.message());
                } else {
                    metrics.incSuccesses(call.plugin(), 1);
                }
                outcomes.add(outcome);
            }
            results.add(new ResourceResult<>(resources.get(i), outcomes));
        }
        long elapsedNanos = System.nanoTime() - startedNanos;
        metrics.observeBatchNanos(elapsedNanos);
        int failed = failures;
        LOG.info(() -> "dispatch complete op=" + operation + " resources=" + resources.size() + " calls=" + all.size()
            + " failures=" + failed + " elapsedMs=" + TimeUnit.NANOSECONDS.toMillis(elapsedNanos));
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return new DispatchResult<>(results);
    }

    private <T> Optional<PendingCall<T>> issue(PluginHandle handle,
                                               ResourceDescriptor resource,
                                               Deadline umbrella,
                                               CallIssuer<T> issuer) {
        if (!PluginMatcher.matches(handle.manifest(), resource)) {
            return Optional.empty();
        }
        metrics.incCalls(handle.name(), 1);
        long callStart = System.nanoTime();
        CompletableFuture<T> future = issuer.issue(handle.client(), resource, Deadline.after(callTimeout).min(umbrella));
        future.whenComplete((ignored, error) -> metrics.observeCallNanos(System.nanoTime() - callStart));
        return Optional.of(new PendingCall<>(handle.name(), future));
    }

    private static boolean awaitAll(List<CompletableFuture<?>> all, Deadline umbrella) {
        if (all.isEmpty()) {
            return false;
        }
        try {
            CompletableFuture.allOf(all.toArray(CompletableFuture[]::new))
                .get(umbrella.remainingNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            LOG.finest(() -> "dispatch batch settled with failures first=" + e.getCause());
        } catch (TimeoutException e) {
            LOG.fine(() -> "dispatch umbrella deadline reached pending=" + all.stream().filter(f -> !f.isDone()).count());
        } catch (InterruptedException e) {
            all.forEach(f -> f.cancel(false));
            return true;
        }
        return false;
    }

    private static <T> CallOutcome<T> settle(PendingCall<T> call, boolean interrupted) {
        CompletableFuture<T> future = call.future();
        if (!future.isDone()) {
            future.cancel(false);
            return new CallOutcome.Failure<>(call.plugin(), interrupted ? ErrorKind.CANCELLED : ErrorKind.TIMEOUT,
                interrupted ? "dispatch interrupted" : "umbrella deadline exceeded");
        }
        try {
            return new CallOutcome.Success<>(call.plugin(), future.join());
        } catch (RuntimeException e) {
            PluginRpcException rpc = ErrorClassifier.classify(e, call.plugin(), "dispatch");
            return new CallOutcome.Failure<>(call.plugin(), rpc.kind(), rpc.getMessage());
        }
    }
}
