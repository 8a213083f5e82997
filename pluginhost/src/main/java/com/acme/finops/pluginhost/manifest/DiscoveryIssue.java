package com.acme.finops.pluginhost.manifest;

import com.acme.finops.pluginhost.error.ErrorKind;

import java.nio.file.Path;
import java.util.List;

/**
 * Non-fatal problem found while scanning the plugin root. Issues never abort a scan.
 */
public sealed interface DiscoveryIssue permits DiscoveryIssue.MalformedManifest, DiscoveryIssue.VersionConflict {

    ErrorKind kind();

    String describe();

    record MalformedManifest(Path path, String reason) implements DiscoveryIssue {
        @Override
        public ErrorKind kind() {
            return ErrorKind.MALFORMED_MANIFEST;
        }

        @Override
        public String describe() {
            return "malformed manifest at " + path + ": " + reason;
        }
    }

    record VersionConflict(PluginKey key, List<Path> paths) implements DiscoveryIssue {
        public VersionConflict {
            paths = List.copyOf(paths);
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.VERSION_CONFLICT;
        }

        @Override
        public String describe() {
            return "version conflict for " + key + " declared by " + paths;
        }
    }
}
