package com.acme.finops.pluginhost.rpc;

import com.acme.finops.pluginhost.error.ErrorKind;
import com.acme.finops.pluginhost.error.PluginRpcException;
import com.acme.finops.pluginhost.model.ProjectedCost;
import com.acme.finops.pluginhost.model.PropertyBag;
import com.acme.finops.pluginhost.model.ResourceDescriptor;
import com.acme.finops.pluginhost.model.TimeWindow;
import com.acme.finops.pluginhost.testing.ScriptedRpcChannel;
import com.acme.finops.pluginhost.util.Deadline;
import com.acme.finops.pluginhost.util.JsonCodec;
import com.acme.finops.pluginhost.wire.WireErrorCodes;
import com.acme.finops.pluginhost.wire.WireMethods;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CostSourceClientTest {
    private static final ResourceDescriptor EC2 = new ResourceDescriptor("aws", "aws:ec2/instance:Instance",
        PropertyBag.of(Map.of("instanceType", "t3.micro")));

    @Test
    void shouldDecodeProjectedCost() throws Exception {
        ScriptedRpcChannel channel = new ScriptedRpcChannel().on(WireMethods.GET_PROJECTED_COST, params -> {
            String type = params.path("resource").path("properties").path("instanceType").asText();
            return JsonCodec.objectNode()
                .put("currency", "USD")
                .put("unit_price", 0.0104)
                .put("cost_per_month", 7.592)
                .put("billing_detail", type);
        });
        CostSourceClient client = CostSourceClient.ungated("alpha", channel);

        ProjectedCost cost = client.projectedCost(EC2, Deadline.after(Duration.ofSeconds(2)));

        assertEquals("USD", cost.currency());
        assertEquals(7.592d, cost.costPerMonth());
        assertEquals("t3.micro", cost.billingDetail());
    }

    @Test
    void shouldClassifyRemoteErrors() {
        ScriptedRpcChannel channel = new ScriptedRpcChannel()
            .fail(WireMethods.GET_RECOMMENDATIONS, WireErrorCodes.UNIMPLEMENTED, "no recommendations");
        CostSourceClient client = CostSourceClient.ungated("alpha", channel);

        PluginRpcException e = assertThrows(PluginRpcException.class,
            () -> client.recommendations(EC2, Deadline.after(Duration.ofSeconds(2))));
        assertEquals(ErrorKind.NOT_SUPPORTED, e.kind());
    }

    @Test
    void shouldTimeOutAtDeadline() {
        ScriptedRpcChannel channel = new ScriptedRpcChannel().hang(WireMethods.IDENTITY);
        CostSourceClient client = CostSourceClient.ungated("alpha", channel);

        PluginRpcException e = assertTimeoutPreemptively(Duration.ofSeconds(3),
            () -> assertThrows(PluginRpcException.class, () -> client.identity(Deadline.after(Duration.ofMillis(200)))));
        assertEquals(ErrorKind.TIMEOUT, e.kind());
    }

    @Test
    void shouldRefuseCallsWhenNotReady() {
        ScriptedRpcChannel channel = new ScriptedRpcChannel().respond(WireMethods.IDENTITY, "{\"name\":\"alpha\"}");
        CostSourceClient client = new CostSourceClient("alpha", channel, () -> false);

        PluginRpcException e = assertThrows(PluginRpcException.class,
            () -> client.identity(Deadline.after(Duration.ofSeconds(1))));
        assertEquals(ErrorKind.UNAVAILABLE, e.kind());
        assertTrue(channel.calls().isEmpty());
    }

    @Test
    void shouldReportMalformedPayloadAsProtocolMismatch() {
        ScriptedRpcChannel channel = new ScriptedRpcChannel().respond(WireMethods.GET_ACTUAL_COST, "{\"results\":\"nope\"}");
        CostSourceClient client = CostSourceClient.ungated("alpha", channel);

        PluginRpcException e = assertThrows(PluginRpcException.class, () -> client.actualCost("web-1",
            new TimeWindow(Instant.parse("2024-03-01T00:00:00Z"), Instant.parse("2024-03-02T00:00:00Z")),
            Deadline.after(Duration.ofSeconds(1))));
        assertEquals(ErrorKind.PROTOCOL_MISMATCH, e.kind());
    }

    @Test
    void shouldForgetCallWhenTypedFutureIsCancelled() throws Exception {
        ScriptedRpcChannel channel = new ScriptedRpcChannel().hang(WireMethods.GET_PLUGIN_INFO);
        CostSourceClient client = CostSourceClient.ungated("alpha", channel);

        CompletableFuture<?> future = client.pluginInfoAsync(Deadline.after(Duration.ofSeconds(30)));
        assertEquals(1, channel.pendingCalls());
        future.cancel(true);

        assertEquals(0, channel.pendingCalls());
        assertEquals(List.of(WireMethods.GET_PLUGIN_INFO), channel.calls());
    }
}
