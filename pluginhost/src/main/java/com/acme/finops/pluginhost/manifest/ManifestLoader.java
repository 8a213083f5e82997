package com.acme.finops.pluginhost.manifest;

import com.acme.finops.pluginhost.error.ErrorKind;
import com.acme.finops.pluginhost.error.PluginHostException;
import com.acme.finops.pluginhost.util.JsonCodec;
import com.acme.finops.pluginhost.util.PluginHostDefaults;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Reads {@code manifest.json} from one version directory and resolves the plugin binary next to it.
 */
public final class ManifestLoader {

    public PluginManifest load(Path versionDir) throws PluginHostException {
        Path manifestPath = versionDir.resolve(PluginHostDefaults.MANIFEST_FILE_NAME);
        if (!Files.isRegularFile(manifestPath)) {
            throw malformed("missing " + PluginHostDefaults.MANIFEST_FILE_NAME + " in " + versionDir);
        }
        JsonNode root;
        try {
            root = JsonCodec.readTree(Files.readString(manifestPath));
        } catch (JsonProcessingException e) {
            throw new PluginHostException(ErrorKind.MALFORMED_MANIFEST,
                "unparseable manifest " + manifestPath + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new PluginHostException(ErrorKind.MALFORMED_MANIFEST, "unreadable manifest " + manifestPath, e);
        }
        if (root == null || !root.isObject()) {
            throw malformed("manifest root must be an object: " + manifestPath);
        }

        String name;
        String version;
        String specVersion;
        try {
            name = JsonCodec.requiredText(root, "name");
            version = JsonCodec.requiredText(root, "version");
            specVersion = JsonCodec.requiredText(root, "spec_version");
        } catch (IllegalArgumentException e) {
            throw malformed(e.getMessage() + " in " + manifestPath);
        }
        JsonNode providersNode = root.get("supported_providers");
        if (providersNode == null || !providersNode.isArray()) {
            throw malformed("missing required array field: supported_providers in " + manifestPath);
        }
        List<String> providers = JsonCodec.textList(root, "supported_providers");
        Map<String, String> metadata = JsonCodec.stringMap(root, "metadata");

        String declaredBinary = JsonCodec.optionalText(root, "binary", null);
        Path binary = resolveBinary(versionDir, name, declaredBinary)
            .orElseThrow(() -> malformed("no executable binary for plugin " + name + " in " + versionDir));

        return new PluginManifest(name, version, specVersion, providers, binary, metadata, versionDir);
    }

    /**
     * Binary lookup order: the manifest's {@code binary} field, {@code finfocus-plugin-<name>},
     * {@code <name>}, then the first executable regular file in name order.
     */
    static Optional<Path> resolveBinary(Path versionDir, String name, String declaredBinary) {
        if (declaredBinary != null && !declaredBinary.isBlank()) {
            Path declared = versionDir.resolve(declaredBinary.trim()).normalize();
            return isExecutableFile(declared) ? Optional.of(declared) : Optional.empty();
        }
        List<Path> candidates = List.of(
            versionDir.resolve(PluginHostDefaults.BINARY_PREFIX + name),
            versionDir.resolve(name)
        );
        for (Path candidate : candidates) {
            if (isExecutableFile(candidate)) {
                return Optional.of(candidate);
            }
        }
        List<Path> others = new ArrayList<>();
        try (Stream<Path> entries = Files.list(versionDir)) {
            entries.filter(ManifestLoader::isExecutableFile)
                .filter(p -> !p.getFileName().toString().equals(PluginHostDefaults.MANIFEST_FILE_NAME))
                .forEach(others::add);
        } catch (IOException e) {
            return Optional.empty();
        }
        others.sort(null);
        return others.stream().findFirst();
    }

    private static boolean isExecutableFile(Path p) {
        return Files.isRegularFile(p) && Files.isExecutable(p);
    }

    private static PluginHostException malformed(String message) {
        return new PluginHostException(ErrorKind.MALFORMED_MANIFEST, message);
    }
}
