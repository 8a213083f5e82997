package com.acme.finops.pluginhost.rpc;

import com.acme.finops.pluginhost.error.ErrorKind;
import com.acme.finops.pluginhost.error.PluginRpcException;
import com.acme.finops.pluginhost.model.ActualCostResult;
import com.acme.finops.pluginhost.model.DryRunResult;
import com.acme.finops.pluginhost.model.PluginInfo;
import com.acme.finops.pluginhost.model.ProjectedCost;
import com.acme.finops.pluginhost.model.PropertyBag;
import com.acme.finops.pluginhost.model.Recommendation;
import com.acme.finops.pluginhost.model.ResourceDescriptor;
import com.acme.finops.pluginhost.model.TimeWindow;
import com.acme.finops.pluginhost.transport.api.RpcChannel;
import com.acme.finops.pluginhost.util.Deadline;
import com.acme.finops.pluginhost.util.JsonCodec;
import com.acme.finops.pluginhost.wire.WireFormatException;
import com.acme.finops.pluginhost.wire.WireMethods;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Typed view of the cost-source contract over any {@link RpcChannel}.
 *
 * <p>Every failure leaving this class is a {@link PluginRpcException}; async futures complete exceptionally
 * with one (wrapped in {@link CompletionException} where the JDK does so). A call against a plugin that is
 * not ready fails at once with {@link ErrorKind#UNAVAILABLE} and never touches the channel.</p>
 */
public final class CostSourceClient {
    // Margin past the deadline before a blocked caller stops waiting on a channel that failed to time out.
    private static final long AWAIT_SLACK_MILLIS = 250L;

    private final String pluginName;
    private final RpcChannel channel;
    private final BooleanSupplier ready;

    public CostSourceClient(String pluginName, RpcChannel channel, BooleanSupplier ready) {
        this.pluginName = Objects.requireNonNull(pluginName, "pluginName");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.ready = Objects.requireNonNull(ready, "ready");
    }

    /**
     * Client that skips the readiness gate; used by the supervisor while bringing a process up.
     */
    public static CostSourceClient ungated(String pluginName, RpcChannel channel) {
        return new CostSourceClient(pluginName, channel, () -> true);
    }

    public String pluginName() {
        return pluginName;
    }

    // ---- Async ----

    public CompletableFuture<String> identityAsync(Deadline deadline) {
        return invoke(WireMethods.IDENTITY, JsonCodec.objectNode(), deadline, PayloadCodec::decodeIdentity);
    }

    public CompletableFuture<ProjectedCost> projectedCostAsync(ResourceDescriptor resource, Deadline deadline) {
        return invoke(WireMethods.GET_PROJECTED_COST, PayloadCodec.resourceParams(resource), deadline,
            PayloadCodec::decodeProjectedCost);
    }

    public CompletableFuture<List<ActualCostResult>> actualCostAsync(String resourceId, TimeWindow window, Deadline deadline) {
        return invoke(WireMethods.GET_ACTUAL_COST, PayloadCodec.actualCostParams(resourceId, window), deadline,
            PayloadCodec::decodeActualCost);
    }

    public CompletableFuture<List<Recommendation>> recommendationsAsync(ResourceDescriptor resource, Deadline deadline) {
        return invoke(WireMethods.GET_RECOMMENDATIONS, PayloadCodec.resourceParams(resource), deadline,
            PayloadCodec::decodeRecommendations);
    }

    public CompletableFuture<PluginInfo> pluginInfoAsync(Deadline deadline) {
        return invoke(WireMethods.GET_PLUGIN_INFO, JsonCodec.objectNode(), deadline, PayloadCodec::decodePluginInfo);
    }

    public CompletableFuture<DryRunResult> dryRunAsync(ResourceDescriptor resource, PropertyBag simulation, Deadline deadline) {
        return invoke(WireMethods.DRY_RUN, PayloadCodec.dryRunParams(resource, simulation), deadline,
            PayloadCodec::decodeDryRun);
    }

    // ---- Blocking ----

    public String identity(Deadline deadline) throws PluginRpcException {
        return await(identityAsync(deadline), WireMethods.IDENTITY, deadline);
    }

    public ProjectedCost projectedCost(ResourceDescriptor resource, Deadline deadline) throws PluginRpcException {
        return await(projectedCostAsync(resource, deadline), WireMethods.GET_PROJECTED_COST, deadline);
    }

    public List<ActualCostResult> actualCost(String resourceId, TimeWindow window, Deadline deadline) throws PluginRpcException {
        return await(actualCostAsync(resourceId, window, deadline), WireMethods.GET_ACTUAL_COST, deadline);
    }

    public List<Recommendation> recommendations(ResourceDescriptor resource, Deadline deadline) throws PluginRpcException {
        return await(recommendationsAsync(resource, deadline), WireMethods.GET_RECOMMENDATIONS, deadline);
    }

    public PluginInfo pluginInfo(Deadline deadline) throws PluginRpcException {
        return await(pluginInfoAsync(deadline), WireMethods.GET_PLUGIN_INFO, deadline);
    }

    public DryRunResult dryRun(ResourceDescriptor resource, PropertyBag simulation, Deadline deadline) throws PluginRpcException {
        return await(dryRunAsync(resource, simulation, deadline), WireMethods.DRY_RUN, deadline);
    }

    private <T> CompletableFuture<T> invoke(String method, JsonNode params, Deadline deadline, PayloadDecoder<T> decoder) {
        Objects.requireNonNull(deadline, "deadline");
        if (!ready.getAsBoolean()) {
            return CompletableFuture.failedFuture(
                new PluginRpcException(ErrorKind.UNAVAILABLE, pluginName, method, "plugin not ready"));
        }
        CompletableFuture<JsonNode> raw = channel.call(method, params, deadline);
        CompletableFuture<T> typed = raw.handle((result, error) -> {
            if (error != null) {
                throw new CompletionException(ErrorClassifier.classify(error, pluginName, method));
            }
            try {
                return decoder.decode(result);
            } catch (WireFormatException e) {
                throw new CompletionException(ErrorClassifier.classify(e, pluginName, method));
            }
        });
        typed.whenComplete((ignored, error) -> {
            if (error instanceof CancellationException) {
                raw.cancel(false);
            }
        });
        return typed;
    }

    private <T> T await(CompletableFuture<T> future, String method, Deadline deadline) throws PluginRpcException {
        try {
            return future.get(deadline.remainingMillis() + AWAIT_SLACK_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            future.cancel(false);
            Thread.currentThread().interrupt();
            throw ErrorClassifier.classify(e, pluginName, method);
        } catch (TimeoutException e) {
            future.cancel(false);
            throw ErrorClassifier.classify(e, pluginName, method);
        } catch (ExecutionException | CancellationException e) {
            throw ErrorClassifier.classify(e, pluginName, method);
        }
    }
}
