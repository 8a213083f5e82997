package com.acme.finops.pluginhost.wire;

import com.acme.finops.pluginhost.util.JsonCodec;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Response envelope: either {@code {"id","result"}} or {@code {"id","error":{"code","message"}}}.
 */
public record RpcResponse(long id, JsonNode result, Error error) {

    public record Error(String code, String message) {
        public Error {
            code = code == null || code.isBlank() ? WireErrorCodes.INTERNAL : code;
            message = message == null ? "" : message;
        }
    }

    public static RpcResponse success(long id, JsonNode result) {
        return new RpcResponse(id, result == null ? JsonCodec.objectNode() : result, null);
    }

    public static RpcResponse failure(long id, String code, String message) {
        return new RpcResponse(id, null, new Error(code, message));
    }

    public boolean isError() {
        return error != null;
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonCodec.objectNode();
        node.put("id", id);
        if (error != null) {
            ObjectNode err = node.putObject("error");
            err.put("code", error.code());
            err.put("message", error.message());
        } else {
            node.set("result", result);
        }
        return node;
    }

    public static RpcResponse fromJson(JsonNode node) throws WireFormatException {
        if (node == null || !node.isObject() || !node.path("id").isIntegralNumber()) {
            throw new WireFormatException("response without numeric id");
        }
        long id = node.get("id").asLong();
        JsonNode err = node.get("error");
        if (err != null && err.isObject()) {
            return failure(id, JsonCodec.optionalText(err, "code", WireErrorCodes.INTERNAL),
                JsonCodec.optionalText(err, "message", ""));
        }
        JsonNode result = node.get("result");
        if (result == null) {
            throw new WireFormatException("response " + id + " has neither result nor error");
        }
        return success(id, result);
    }
}
