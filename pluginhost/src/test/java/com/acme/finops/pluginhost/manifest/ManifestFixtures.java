package com.acme.finops.pluginhost.manifest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

final class ManifestFixtures {
    private ManifestFixtures() {
    }

    static Path install(Path root, String dirName, String version, String manifestJson, String binaryName) throws IOException {
        Path versionDir = Files.createDirectories(root.resolve(dirName).resolve(version));
        Files.writeString(versionDir.resolve("manifest.json"), manifestJson);
        if (binaryName != null) {
            Path binary = versionDir.resolve(binaryName);
            Files.writeString(binary, "#!/bin/sh\nexit 0\n");
            if (!binary.toFile().setExecutable(true)) {
                throw new IOException("cannot mark executable: " + binary);
            }
        }
        return versionDir;
    }

    static String manifest(String name, String version) {
        return """
            {
              "name": "%s",
              "version": "%s",
              "spec_version": "1.0.0",
              "supported_providers": ["aws", "gcp"],
              "metadata": {"actual_cost": "true"}
            }
            """.formatted(name, version);
    }
}
