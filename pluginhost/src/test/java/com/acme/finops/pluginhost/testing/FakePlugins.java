package com.acme.finops.pluginhost.testing;

import com.acme.finops.pluginhost.manifest.PluginManifest;
import com.acme.finops.pluginhost.wire.FrameCodec;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Writes executable plugin binaries for process-level tests: shell wrappers around {@link FakeCostPlugin}
 * and raw shell scripts for misbehaving plugins.
 */
public final class FakePlugins {
    public static final String SPEC_VERSION = "1.0.0";

    private FakePlugins() {
    }

    /**
     * Installs {@code finfocus-plugin-<name>} in {@code dir}, running {@link FakeCostPlugin} with {@code options}.
     */
    public static Path javaPlugin(Path dir, String name, String... options) throws IOException {
        StringBuilder script = new StringBuilder("#!/bin/sh\nexec ")
            .append(quote(Path.of(System.getProperty("java.home"), "bin", "java").toString()))
            .append(" -cp ").append(quote(classpath()))
            .append(' ').append(FakeCostPlugin.class.getName())
            .append(' ').append(quote("--name=" + name));
        for (String option : options) {
            script.append(' ').append(quote(option));
        }
        script.append(" \"$@\"\n");
        return script(dir, "finfocus-plugin-" + name, script.toString());
    }

    public static Path script(Path dir, String fileName, String body) throws IOException {
        Files.createDirectories(dir);
        Path file = dir.resolve(fileName);
        Files.writeString(file, body);
        if (!file.toFile().setExecutable(true)) {
            throw new IOException("cannot mark executable: " + file);
        }
        return file;
    }

    public static PluginManifest manifest(String name, Path binary) {
        return new PluginManifest(name, "0.9.0", SPEC_VERSION, List.of("aws"), binary,
            Map.of("actual_cost", "true"), binary.getParent());
    }

    private static String classpath() throws IOException {
        Set<String> entries = new LinkedHashSet<>();
        for (Class<?> anchor : List.of(FakeCostPlugin.class, FrameCodec.class, ObjectMapper.class, JsonFactory.class,
            JsonProperty.class)) {
            try {
                entries.add(Path.of(anchor.getProtectionDomain().getCodeSource().getLocation().toURI()).toString());
            } catch (URISyntaxException e) {
                throw new IOException("cannot locate classes of " + anchor.getName(), e);
            }
        }
        return String.join(File.pathSeparator, entries);
    }

    private static String quote(String raw) {
        return "'" + raw.replace("'", "'\\''") + "'";
    }
}
