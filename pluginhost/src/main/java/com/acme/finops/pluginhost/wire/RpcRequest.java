package com.acme.finops.pluginhost.wire;

import com.acme.finops.pluginhost.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Objects;

/**
 * Request envelope {@code {"id","method","deadline_ms","params"}}. {@code deadline_ms} is the time budget
 * the caller grants, relative to send time.
 */
public record RpcRequest(long id, String method, long deadlineMs, JsonNode params) {
    public RpcRequest {
        Objects.requireNonNull(method, "method");
        params = params == null ? JsonCodec.objectNode() : params;
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonCodec.objectNode();
        node.put("id", id);
        node.put("method", method);
        node.put("deadline_ms", deadlineMs);
        node.set("params", params);
        return node;
    }

    public static RpcRequest fromJson(JsonNode node) throws WireFormatException {
        if (node == null || !node.isObject() || !node.path("id").isIntegralNumber()) {
            throw new WireFormatException("request without numeric id");
        }
        JsonNode method = node.get("method");
        if (method == null || !method.isTextual()) {
            throw new WireFormatException("request without method");
        }
        return new RpcRequest(node.get("id").asLong(), method.asText(),
            JsonCodec.optionalLong(node, "deadline_ms", 0L), node.get("params"));
    }
}
