package com.acme.finops.pluginhost.rpc;

import com.acme.finops.pluginhost.model.ActualCostResult;
import com.acme.finops.pluginhost.model.DryRunResult;
import com.acme.finops.pluginhost.model.FieldMapping;
import com.acme.finops.pluginhost.model.FieldMappingStatus;
import com.acme.finops.pluginhost.model.PluginInfo;
import com.acme.finops.pluginhost.model.ProjectedCost;
import com.acme.finops.pluginhost.model.PropertyBag;
import com.acme.finops.pluginhost.model.Recommendation;
import com.acme.finops.pluginhost.model.ResourceDescriptor;
import com.acme.finops.pluginhost.model.TimeWindow;
import com.acme.finops.pluginhost.util.JsonCodec;
import com.acme.finops.pluginhost.wire.WireFormatException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON shapes of request params and result payloads for each contract method.
 */
public final class PayloadCodec {

    private PayloadCodec() {
    }

    // ---- Requests ----

    public static ObjectNode resourceParams(ResourceDescriptor resource) {
        ObjectNode params = JsonCodec.objectNode();
        params.set("resource", encodeResource(resource));
        return params;
    }

    public static ObjectNode actualCostParams(String resourceId, TimeWindow window) {
        ObjectNode params = JsonCodec.objectNode();
        params.put("resource_id", resourceId);
        params.put("start", window.start().toString());
        params.put("end", window.end().toString());
        return params;
    }

    public static ObjectNode dryRunParams(ResourceDescriptor resource, PropertyBag simulation) {
        ObjectNode params = resourceParams(resource);
        params.set("simulation", encodeBag(simulation == null ? PropertyBag.empty() : simulation));
        return params;
    }

    public static ObjectNode encodeResource(ResourceDescriptor resource) {
        ObjectNode node = JsonCodec.objectNode();
        node.put("id", resource.id());
        node.put("provider", resource.provider());
        node.put("resource_type", resource.resourceType());
        node.set("properties", encodeBag(resource.properties()));
        return node;
    }

    public static ResourceDescriptor decodeResource(JsonNode node) throws WireFormatException {
        if (node == null || !node.isObject()) {
            throw new WireFormatException("resource must be an object");
        }
        String type = JsonCodec.optionalText(node, "resource_type", "");
        if (type.isBlank()) {
            throw new WireFormatException("resource_type is required");
        }
        return new ResourceDescriptor(JsonCodec.optionalText(node, "id", null),
            JsonCodec.optionalText(node, "provider", ""), type, decodeBag(node.get("properties")));
    }

    public static ObjectNode encodeBag(PropertyBag bag) {
        ObjectNode node = JsonCodec.objectNode();
        bag.asMap().forEach((k, v) -> node.set(k, encodeValue(v)));
        return node;
    }

    private static JsonNode encodeValue(Object v) {
        if (v instanceof PropertyBag nested) {
            return encodeBag(nested);
        }
        if (v instanceof List<?> list) {
            ArrayNode array = JsonCodec.arrayNode();
            list.forEach(item -> array.add(encodeValue(item)));
            return array;
        }
        return JsonCodec.valueToTree(v);
    }

    public static PropertyBag decodeBag(JsonNode node) {
        if (node == null || !node.isObject()) {
            return PropertyBag.empty();
        }
        Map<String, Object> raw = new LinkedHashMap<>();
        node.fields().forEachRemaining(e -> raw.put(e.getKey(), decodeValue(e.getValue())));
        return PropertyBag.of(raw);
    }

    private static Object decodeValue(JsonNode v) {
        if (v.isNumber()) return v.asDouble();
        if (v.isBoolean()) return v.asBoolean();
        if (v.isTextual()) return v.asText();
        if (v.isObject()) return decodeBag(v);
        if (v.isArray()) {
            List<Object> list = new ArrayList<>();
            v.forEach(item -> list.add(decodeValue(item)));
            return list;
        }
        return null;
    }

    // ---- Results ----

    public static String decodeIdentity(JsonNode result) throws WireFormatException {
        String name = JsonCodec.optionalText(result, "name", "");
        if (name.isBlank()) {
            throw new WireFormatException("Identity result without name");
        }
        return name;
    }

    public static ProjectedCost decodeProjectedCost(JsonNode result) throws WireFormatException {
        String currency = JsonCodec.optionalText(result, "currency", "");
        if (currency.isBlank()) {
            throw new WireFormatException("projected cost without currency");
        }
        return new ProjectedCost(currency,
            JsonCodec.optionalDouble(result, "unit_price", 0.0d),
            JsonCodec.optionalDouble(result, "cost_per_month", 0.0d),
            JsonCodec.optionalText(result, "billing_detail", ""));
    }

    public static ObjectNode encodeProjectedCost(ProjectedCost cost) {
        ObjectNode node = JsonCodec.objectNode();
        node.put("currency", cost.currency());
        node.put("unit_price", cost.unitPrice());
        node.put("cost_per_month", cost.costPerMonth());
        node.put("billing_detail", cost.billingDetail());
        return node;
    }

    public static List<ActualCostResult> decodeActualCost(JsonNode result) throws WireFormatException {
        List<ActualCostResult> out = new ArrayList<>();
        for (JsonNode item : arrayField(result, "results")) {
            String currency = JsonCodec.optionalText(item, "currency", "");
            String date = JsonCodec.optionalText(item, "date", "");
            if (currency.isBlank() || date.isBlank()) {
                throw new WireFormatException("actual cost entry needs date and currency");
            }
            try {
                out.add(new ActualCostResult(LocalDate.parse(date), currency,
                    JsonCodec.optionalDouble(item, "cost", 0.0d), JsonCodec.optionalText(item, "source", "")));
            } catch (DateTimeParseException e) {
                throw new WireFormatException("actual cost date is not ISO-8601: " + date, e);
            }
        }
        return out;
    }

    public static List<Recommendation> decodeRecommendations(JsonNode result) throws WireFormatException {
        List<Recommendation> out = new ArrayList<>();
        for (JsonNode item : arrayField(result, "recommendations")) {
            String id = JsonCodec.optionalText(item, "id", "");
            if (id.isBlank()) {
                throw new WireFormatException("recommendation without id");
            }
            out.add(new Recommendation(id,
                JsonCodec.optionalText(item, "category", ""),
                JsonCodec.optionalText(item, "action_type", ""),
                JsonCodec.optionalText(item, "description", ""),
                JsonCodec.optionalDouble(item, "estimated_savings", 0.0d),
                JsonCodec.optionalText(item, "currency", "")));
        }
        return out;
    }

    public static PluginInfo decodePluginInfo(JsonNode result) throws WireFormatException {
        String name = JsonCodec.optionalText(result, "name", "");
        if (name.isBlank()) {
            throw new WireFormatException("plugin info without name");
        }
        return new PluginInfo(name,
            JsonCodec.optionalText(result, "version", ""),
            JsonCodec.optionalText(result, "spec_version", ""),
            JsonCodec.textList(result, "providers"),
            JsonCodec.stringMap(result, "metadata"));
    }

    public static DryRunResult decodeDryRun(JsonNode result) throws WireFormatException {
        List<FieldMapping> mappings = new ArrayList<>();
        for (JsonNode item : arrayField(result, "field_mappings")) {
            String field = JsonCodec.optionalText(item, "field_name", "");
            if (field.isBlank()) {
                throw new WireFormatException("field mapping without field_name");
            }
            FieldMappingStatus status;
            try {
                status = FieldMappingStatus.parse(JsonCodec.optionalText(item, "status", ""));
            } catch (IllegalArgumentException e) {
                throw new WireFormatException("field mapping " + field + " has unknown status", e);
            }
            mappings.add(new FieldMapping(field, status,
                JsonCodec.optionalText(item, "condition", ""),
                JsonCodec.optionalText(item, "expected_type", "")));
        }
        return new DryRunResult(mappings,
            JsonCodec.optionalBoolean(result, "config_valid", true),
            JsonCodec.textList(result, "config_errors"));
    }

    private static JsonNode arrayField(JsonNode result, String field) throws WireFormatException {
        JsonNode node = result == null ? null : result.get(field);
        if (node == null || node.isNull()) {
            return JsonCodec.arrayNode();
        }
        if (!node.isArray()) {
            throw new WireFormatException(field + " must be an array");
        }
        return node;
    }
}
