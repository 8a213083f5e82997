package com.acme.finops.pluginhost.conformance;

import java.util.List;

public record Summary(int total, int passed, int failed, int skipped, int errors) {

    public static Summary of(List<TestResult> results) {
        int passed = 0;
        int failed = 0;
        int skipped = 0;
        int errors = 0;
        for (TestResult r : results) {
            switch (r.status()) {
                case PASS -> passed++;
                case FAIL -> failed++;
                case SKIP -> skipped++;
                case ERROR -> errors++;
            }
        }
        return new Summary(results.size(), passed, failed, skipped, errors);
    }

    public boolean allPassed() {
        return failed == 0 && errors == 0;
    }
}
