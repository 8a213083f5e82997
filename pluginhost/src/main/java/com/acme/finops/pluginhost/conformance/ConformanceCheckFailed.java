package com.acme.finops.pluginhost.conformance;

/**
 * A plugin answer violated the contract. Reported as {@link TestStatus#FAIL}.
 */
public final class ConformanceCheckFailed extends Exception {
    public ConformanceCheckFailed(String message) {
        super(message);
    }

    public static void check(boolean condition, String message) throws ConformanceCheckFailed {
        if (!condition) {
            throw new ConformanceCheckFailed(message);
        }
    }
}
