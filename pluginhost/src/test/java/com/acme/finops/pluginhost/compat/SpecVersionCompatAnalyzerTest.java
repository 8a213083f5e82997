package com.acme.finops.pluginhost.compat;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SpecVersionCompatAnalyzerTest {
    private final SpecVersionCompatAnalyzer analyzer = new SpecVersionCompatAnalyzer();

    @Test
    void shouldParseVersionsWithPrefixAndSuffix() {
        assertEquals(new SemanticVersion(1, 2, 3, "rc.1"), SemanticVersion.parse("v1.2.3-rc.1+build.7").orElseThrow());
        assertEquals(new SemanticVersion(2, 0, 0, ""), SemanticVersion.parse("2").orElseThrow());
        assertTrue(SemanticVersion.parse("one.two").isEmpty());
        assertTrue(SemanticVersion.parse("  ").isEmpty());
    }

    @Test
    void shouldOrderReleaseAbovePreRelease() {
        SemanticVersion rc = SemanticVersion.parse("1.0.0-rc.1").orElseThrow();
        SemanticVersion release = SemanticVersion.parse("1.0.0").orElseThrow();
        SemanticVersion next = SemanticVersion.parse("1.0.1").orElseThrow();
        assertTrue(rc.compareTo(release) < 0);
        assertTrue(release.compareTo(next) < 0);
    }

    @Test
    void shouldTolerateMinorDriftAndRejectMajorMismatch() {
        assertInstanceOf(CompatResult.Compatible.class, analyzer.analyze("1.0.0", "1.7.2"));
        assertInstanceOf(CompatResult.Compatible.class, analyzer.analyze("1.4.0", "v1.0.0"));
        assertInstanceOf(CompatResult.MajorMismatch.class, analyzer.analyze("1.0.0", "2.0.0"));
    }

    @Test
    void shouldFlagUnparseablePluginVersion() {
        CompatResult result = analyzer.analyze("1.0.0", "latest");
        CompatResult.Invalid invalid = assertInstanceOf(CompatResult.Invalid.class, result);
        assertEquals("latest", invalid.rawPluginVersion());
        assertThrows(IllegalArgumentException.class, () -> analyzer.analyze("bogus", "1.0.0"));
    }
}
