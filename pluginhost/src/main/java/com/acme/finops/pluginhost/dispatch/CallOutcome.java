package com.acme.finops.pluginhost.dispatch;

import com.acme.finops.pluginhost.error.ErrorKind;

/**
 * Result of one plugin call within a fan-out.
 */
public sealed interface CallOutcome<T> permits CallOutcome.Success, CallOutcome.Failure {

    String plugin();

    record Success<T>(String plugin, T value) implements CallOutcome<T> {}

    record Failure<T>(String plugin, ErrorKind kind, String message) implements CallOutcome<T> {}
}
