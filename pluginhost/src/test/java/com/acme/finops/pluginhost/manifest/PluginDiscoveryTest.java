package com.acme.finops.pluginhost.manifest;

import com.acme.finops.pluginhost.error.ErrorKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PluginDiscoveryTest {
    private final PluginDiscovery discovery = new PluginDiscovery();

    @TempDir
    Path root;

    @Test
    void shouldReturnEmptyResultForMissingRoot() {
        DiscoveryResult result = discovery.scan(root.resolve("absent"));
        assertTrue(result.manifests().isEmpty());
        assertFalse(result.hasIssues());
    }

    @Test
    void shouldListVersionsInStableOrder() throws Exception {
        ManifestFixtures.install(root, "beta", "1.0.0", ManifestFixtures.manifest("beta", "1.0.0"), "beta");
        ManifestFixtures.install(root, "alpha", "2.0.0", ManifestFixtures.manifest("alpha", "2.0.0"), "alpha");
        ManifestFixtures.install(root, "alpha", "1.0.0", ManifestFixtures.manifest("alpha", "1.0.0"), "alpha");

        DiscoveryResult first = discovery.scan(root);
        DiscoveryResult second = discovery.scan(root);

        assertEquals(List.of("alpha@1.0.0", "alpha@2.0.0", "beta@1.0.0"),
            first.manifests().stream().map(m -> m.name() + "@" + m.version()).toList());
        assertEquals(first, second);
    }

    @Test
    void shouldReportExactlyOneConflictForDuplicateKeys() throws Exception {
        ManifestFixtures.install(root, "alpha", "1.0.0", ManifestFixtures.manifest("alpha", "1.0.0"), "alpha");
        ManifestFixtures.install(root, "alpha-copy", "1.0.0", ManifestFixtures.manifest("alpha", "1.0.0"), "alpha");
        ManifestFixtures.install(root, "gamma", "1.0.0", ManifestFixtures.manifest("gamma", "1.0.0"), "gamma");

        DiscoveryResult result = discovery.scan(root);

        assertEquals(1, result.issues().size());
        DiscoveryIssue.VersionConflict conflict =
            assertInstanceOf(DiscoveryIssue.VersionConflict.class, result.issues().get(0));
        assertEquals(ErrorKind.VERSION_CONFLICT, conflict.kind());
        assertEquals(new PluginKey("alpha", "1.0.0"), conflict.key());
        assertEquals(2, conflict.paths().size());
        assertEquals(List.of("gamma"), result.manifests().stream().map(PluginManifest::name).toList());
    }

    @Test
    void shouldRecordMalformedEntriesWithoutAbortingScan() throws Exception {
        ManifestFixtures.install(root, "bad", "1.0.0", "[]", "bad");
        ManifestFixtures.install(root, "good", "1.0.0", ManifestFixtures.manifest("good", "1.0.0"), "good");

        DiscoveryResult result = discovery.scan(root);

        assertEquals(1, result.manifests().size());
        assertEquals(1, result.issues().size());
        assertEquals(ErrorKind.MALFORMED_MANIFEST, result.issues().get(0).kind());
    }

    @Test
    void shouldSelectHighestVersionPerName() throws Exception {
        ManifestFixtures.install(root, "alpha", "1.10.0", ManifestFixtures.manifest("alpha", "1.10.0"), "alpha");
        ManifestFixtures.install(root, "alpha", "1.9.0", ManifestFixtures.manifest("alpha", "1.9.0"), "alpha");
        ManifestFixtures.install(root, "alpha", "nightly", ManifestFixtures.manifest("alpha", "nightly"), "alpha");

        LatestSelection selection = PluginDiscovery.latestPerName(discovery.scan(root).manifests());

        assertEquals(1, selection.latest().size());
        assertEquals("1.10.0", selection.latest().get(0).version());
        assertEquals(1, selection.warnings().size());
    }
}
