package com.acme.finops.pluginhost.ci;

import com.acme.finops.pluginhost.conformance.ConformanceReport;
import com.acme.finops.pluginhost.conformance.TestResult;
import com.acme.finops.pluginhost.conformance.TestStatus;
import com.acme.finops.pluginhost.error.ErrorKind;

/**
 * Process exit codes of the conformance command. When several conditions apply, the highest code wins.
 */
public final class ExitCodes {
    public static final int ALL_PASSED = 0;
    public static final int TEST_FAILURES = 1;
    public static final int PLUGIN_CRASHED = 2;
    public static final int PROTOCOL_MISMATCH = 3;
    public static final int INVALID_ARGUMENTS = 4;

    private ExitCodes() {
    }

    public static int forReport(ConformanceReport report) {
        int code = ALL_PASSED;
        if (report.fault().isPresent()) {
            code = report.faultKind().orElse(ErrorKind.UNAVAILABLE) == ErrorKind.PROTOCOL_MISMATCH
                ? PROTOCOL_MISMATCH
                : PLUGIN_CRASHED;
        }
        for (TestResult r : report.results()) {
            if (r.status() == TestStatus.ERROR) {
                code = Math.max(code, PLUGIN_CRASHED);
            } else if (r.status() == TestStatus.FAIL) {
                code = Math.max(code, TEST_FAILURES);
            }
        }
        return code;
    }
}
