package com.acme.finops.pluginhost.manifest;

import com.acme.finops.pluginhost.compat.SemanticVersion;
import com.acme.finops.pluginhost.error.PluginHostException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Scans {@code <root>/<name>/<version>/} for manifests. Pure filesystem work: no process is started.
 *
 * <p>Directory entries are visited in lexicographic order so repeated scans of an unchanged tree return
 * identical results.</p>
 */
public final class PluginDiscovery {
    private static final Logger LOG = Logger.getLogger(PluginDiscovery.class.getName());

    private final ManifestLoader loader;

    public PluginDiscovery() {
        this(new ManifestLoader());
    }

    public PluginDiscovery(ManifestLoader loader) {
        this.loader = Objects.requireNonNull(loader, "loader");
    }

    public DiscoveryResult scan(Path root) {
        Objects.requireNonNull(root, "root");
        List<DiscoveryIssue> issues = new ArrayList<>();
        if (!Files.isDirectory(root)) {
            LOG.fine(() -> "plugin root absent root=" + root);
            return new DiscoveryResult(List.of(), List.of());
        }

        List<PluginManifest> loaded = new ArrayList<>();
        for (Path nameDir : sortedSubdirectories(root, issues)) {
            for (Path versionDir : sortedSubdirectories(nameDir, issues)) {
                try {
                    loaded.add(loader.load(versionDir));
                } catch (PluginHostException e) {
                    LOG.warning(() -> "discovery skipped entry path=" + versionDir + " reason=" + e.getMessage());
                    issues.add(new DiscoveryIssue.MalformedManifest(versionDir, e.getMessage()));
                }
            }
        }

        Map<PluginKey, List<PluginManifest>> byKey = loaded.stream()
            .collect(Collectors.groupingBy(PluginManifest::key, LinkedHashMap::new, Collectors.toList()));
        List<PluginManifest> accepted = new ArrayList<>();
        for (Map.Entry<PluginKey, List<PluginManifest>> e : byKey.entrySet()) {
            if (e.getValue().size() == 1) {
                accepted.add(e.getValue().get(0));
                continue;
            }
            List<Path> paths = e.getValue().stream().map(PluginManifest::directory).toList();
            LOG.warning(() -> "discovery version conflict key=" + e.getKey() + " paths=" + paths);
            issues.add(new DiscoveryIssue.VersionConflict(e.getKey(), paths));
        }
        LOG.info(() -> "discovery complete root=" + root + " plugins=" + accepted.size() + " issues=" + issues.size());
        return new DiscoveryResult(accepted, issues);
    }

    /**
     * Picks the highest semantic version per plugin name, preserving first-seen name order.
     */
    public static LatestSelection latestPerName(List<PluginManifest> manifests) {
        Map<String, PluginManifest> best = new LinkedHashMap<>();
        Map<String, SemanticVersion> bestVersion = new LinkedHashMap<>();
        List<String> warnings = new ArrayList<>();
        for (PluginManifest m : manifests) {
            Optional<SemanticVersion> parsed = SemanticVersion.parse(m.version());
            if (parsed.isEmpty()) {
                warnings.add("skipping " + m.key() + ": version is not semantic");
                continue;
            }
            SemanticVersion current = bestVersion.get(m.name());
            if (current == null || parsed.get().compareTo(current) > 0) {
                best.put(m.name(), m);
                bestVersion.put(m.name(), parsed.get());
            }
        }
        return new LatestSelection(new ArrayList<>(best.values()), warnings);
    }

    private static List<Path> sortedSubdirectories(Path dir, List<DiscoveryIssue> issues) {
        try (Stream<Path> entries = Files.list(dir)) {
            return entries.filter(Files::isDirectory).sorted().toList();
        } catch (IOException e) {
            LOG.log(Level.WARNING, "discovery cannot list dir=" + dir, e);
            issues.add(new DiscoveryIssue.MalformedManifest(dir, "unreadable directory: " + e.getMessage()));
            return List.of();
        }
    }
}
