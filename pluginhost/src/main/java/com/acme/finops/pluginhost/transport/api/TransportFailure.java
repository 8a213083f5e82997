package com.acme.finops.pluginhost.transport.api;

public enum TransportFailure {
    CONNECT_FAILED,
    CLOSED,
    DEADLINE_EXCEEDED,
    MALFORMED,
    REMOTE_ERROR
}
