package com.acme.finops.pluginhost.rpc;

import com.acme.finops.pluginhost.model.ActualCostResult;
import com.acme.finops.pluginhost.model.DryRunResult;
import com.acme.finops.pluginhost.model.FieldMappingStatus;
import com.acme.finops.pluginhost.model.PluginInfo;
import com.acme.finops.pluginhost.model.PropertyBag;
import com.acme.finops.pluginhost.model.ResourceDescriptor;
import com.acme.finops.pluginhost.util.JsonCodec;
import com.acme.finops.pluginhost.wire.WireFormatException;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PayloadCodecTest {

    @Test
    void shouldEncodeResourceInSnakeCase() {
        ResourceDescriptor resource = new ResourceDescriptor("web-1", "aws", "aws:ec2/instance:Instance",
            PropertyBag.of(Map.of("instanceType", "t3.micro", "tags", Map.of("env", "prod"))));

        JsonNode params = PayloadCodec.resourceParams(resource);

        assertEquals("web-1", params.path("resource").path("id").asText());
        assertEquals("aws:ec2/instance:Instance", params.path("resource").path("resource_type").asText());
        assertEquals("prod", params.path("resource").path("properties").path("tags").path("env").asText());
    }

    @Test
    void shouldDecodeActualCostEntries() throws Exception {
        List<ActualCostResult> results = PayloadCodec.decodeActualCost(JsonCodec.readTree(
            "{\"results\":[{\"date\":\"2024-03-01\",\"currency\":\"USD\",\"cost\":1.5,\"source\":\"cur\"}]}"));

        assertEquals(1, results.size());
        assertEquals(LocalDate.of(2024, 3, 1), results.get(0).date());
        assertEquals(1.5d, results.get(0).cost());
        assertTrue(PayloadCodec.decodeActualCost(JsonCodec.readTree("{}")).isEmpty());
    }

    @Test
    void shouldRejectMalformedResults() {
        assertThrows(WireFormatException.class,
            () -> PayloadCodec.decodeActualCost(JsonCodec.readTree("{\"results\":[{\"date\":\"March\",\"currency\":\"USD\"}]}")));
        assertThrows(WireFormatException.class, () -> PayloadCodec.decodeProjectedCost(JsonCodec.readTree("{\"cost_per_month\":3}")));
        assertThrows(WireFormatException.class, () -> PayloadCodec.decodeRecommendations(JsonCodec.readTree("{\"recommendations\":{}}")));
        assertThrows(WireFormatException.class, () -> PayloadCodec.decodeIdentity(JsonCodec.readTree("{}")));
    }

    @Test
    void shouldDecodePluginInfoAndDryRun() throws Exception {
        PluginInfo info = PayloadCodec.decodePluginInfo(JsonCodec.readTree(
            "{\"name\":\"aws-public\",\"version\":\"0.3.0\",\"spec_version\":\"1.0.0\",\"providers\":[\"aws\"],"
                + "\"metadata\":{\"actual_cost\":\"true\"}}"));
        DryRunResult dryRun = PayloadCodec.decodeDryRun(JsonCodec.readTree(
            "{\"field_mappings\":[{\"field_name\":\"instanceType\",\"status\":\"SUPPORTED\"}],"
                + "\"config_valid\":false,\"config_errors\":[\"region missing\"]}"));

        assertEquals(List.of("aws"), info.providers());
        assertTrue(info.declares("actual_cost"));
        assertEquals(FieldMappingStatus.SUPPORTED, dryRun.fieldMappings().get(0).status());
        assertFalse(dryRun.configValid());
        assertEquals(List.of("region missing"), dryRun.configErrors());
    }
}
