package com.acme.finops.pluginhost.rpc;

import com.acme.finops.pluginhost.wire.WireFormatException;
import com.fasterxml.jackson.databind.JsonNode;

@FunctionalInterface
interface PayloadDecoder<T> {
    T decode(JsonNode result) throws WireFormatException;
}
