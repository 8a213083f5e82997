package com.acme.finops.pluginhost.rpc;

import com.acme.finops.pluginhost.error.ErrorKind;
import com.acme.finops.pluginhost.error.PluginRpcException;
import com.acme.finops.pluginhost.transport.api.RpcTransportException;
import com.acme.finops.pluginhost.transport.api.TransportFailure;
import com.acme.finops.pluginhost.wire.WireErrorCodes;
import com.acme.finops.pluginhost.wire.WireFormatException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ErrorClassifierTest {

    @Test
    void shouldMapTransportFailures() {
        assertEquals(ErrorKind.UNAVAILABLE, kindOf(new RpcTransportException(TransportFailure.CLOSED, "gone")));
        assertEquals(ErrorKind.UNAVAILABLE, kindOf(new RpcTransportException(TransportFailure.CONNECT_FAILED, "refused")));
        assertEquals(ErrorKind.TIMEOUT, kindOf(new RpcTransportException(TransportFailure.DEADLINE_EXCEEDED, "late")));
        assertEquals(ErrorKind.PROTOCOL_MISMATCH, kindOf(new RpcTransportException(TransportFailure.MALFORMED, "junk")));
        assertEquals(ErrorKind.PROTOCOL_MISMATCH, kindOf(new WireFormatException("bad frame")));
    }

    @Test
    void shouldMapRemoteCodes() {
        assertEquals(ErrorKind.NOT_SUPPORTED, kindOf(RpcTransportException.remote(WireErrorCodes.UNIMPLEMENTED, "x")));
        assertEquals(ErrorKind.NOT_SUPPORTED, kindOf(RpcTransportException.remote(WireErrorCodes.NOT_FOUND, "x")));
        assertEquals(ErrorKind.NO_DATA, kindOf(RpcTransportException.remote(WireErrorCodes.NO_DATA, "x")));
        assertEquals(ErrorKind.INVALID_ARGUMENT, kindOf(RpcTransportException.remote(WireErrorCodes.INVALID_ARGUMENT, "x")));
        assertEquals(ErrorKind.INTERNAL, kindOf(RpcTransportException.remote("TEAPOT", "x")));
    }

    @Test
    void shouldUnwrapFutureExceptionsAndKeepPluginName() {
        RpcTransportException cause = RpcTransportException.remote(WireErrorCodes.NO_DATA, "no rows");
        PluginRpcException e = ErrorClassifier.classify(new ExecutionException(new CompletionException(cause)), "alpha", "GetActualCost");

        assertEquals(ErrorKind.NO_DATA, e.kind());
        assertEquals("alpha", e.pluginName());
        assertEquals("GetActualCost", e.method());
        assertTrue(e.getMessage().startsWith("alpha.GetActualCost: "));
        assertSame(e, ErrorClassifier.classify(new CompletionException(e), "beta", "Identity"));
        assertEquals(ErrorKind.CANCELLED, kindOf(new CancellationException()));
    }

    private static ErrorKind kindOf(Throwable t) {
        return ErrorClassifier.classify(t, "p", "m").kind();
    }
}
