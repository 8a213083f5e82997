package com.acme.finops.pluginhost.conformance;

import com.acme.finops.pluginhost.transport.api.CommMode;
import com.acme.finops.pluginhost.util.PluginHostDefaults;

import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Settings for one conformance run.
 *
 * @param categories empty means every category
 * @param nameFilter {@code null} means every case
 * @param environment values consulted by case preconditions, normally the process environment
 */
public record SuiteConfig(Path pluginPath,
                          CommMode mode,
                          Verbosity verbosity,
                          OutputFormat outputFormat,
                          Path outputFile,
                          Duration suiteTimeout,
                          Duration handshakeTimeout,
                          Set<TestCategory> categories,
                          Pattern nameFilter,
                          Map<String, String> environment) {

    public SuiteConfig {
        Objects.requireNonNull(pluginPath, "pluginPath");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(verbosity, "verbosity");
        Objects.requireNonNull(outputFormat, "outputFormat");
        Objects.requireNonNull(suiteTimeout, "suiteTimeout");
        Objects.requireNonNull(handshakeTimeout, "handshakeTimeout");
        if (suiteTimeout.isNegative() || suiteTimeout.isZero()) {
            throw new IllegalArgumentException("suite timeout must be positive: " + suiteTimeout);
        }
        categories = categories == null || categories.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(categories));
        environment = Map.copyOf(environment == null ? Map.of() : environment);
    }

    public static Builder builder(Path pluginPath) {
        return new Builder(pluginPath);
    }

    public boolean selects(ConformanceTestCase testCase) {
        if (!categories.isEmpty() && !categories.contains(testCase.category())) {
            return false;
        }
        return nameFilter == null || nameFilter.matcher(testCase.name()).find();
    }

    public static final class Builder {
        private final Path pluginPath;
        private CommMode mode = CommMode.TCP;
        private Verbosity verbosity = Verbosity.NORMAL;
        private OutputFormat outputFormat = OutputFormat.TABLE;
        private Path outputFile;
        private Duration suiteTimeout = Duration.ofMillis(PluginHostDefaults.DEFAULT_SUITE_TIMEOUT_MS);
        private Duration handshakeTimeout = Duration.ofMillis(PluginHostDefaults.DEFAULT_HANDSHAKE_TIMEOUT_MS);
        private Set<TestCategory> categories = Set.of();
        private Pattern nameFilter;
        private Map<String, String> environment = System.getenv();

        private Builder(Path pluginPath) {
            this.pluginPath = pluginPath;
        }

        public Builder mode(CommMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder verbosity(Verbosity verbosity) {
            this.verbosity = verbosity;
            return this;
        }

        public Builder outputFormat(OutputFormat outputFormat) {
            this.outputFormat = outputFormat;
            return this;
        }

        public Builder outputFile(Path outputFile) {
            this.outputFile = outputFile;
            return this;
        }

        public Builder suiteTimeout(Duration suiteTimeout) {
            this.suiteTimeout = suiteTimeout;
            return this;
        }

        public Builder handshakeTimeout(Duration handshakeTimeout) {
            this.handshakeTimeout = handshakeTimeout;
            return this;
        }

        public Builder categories(Set<TestCategory> categories) {
            this.categories = categories;
            return this;
        }

        /**
         * @throws IllegalArgumentException if {@code regex} does not compile
         */
        public Builder nameFilter(String regex) {
            if (regex == null || regex.isBlank()) {
                this.nameFilter = null;
                return this;
            }
            try {
                this.nameFilter = Pattern.compile(regex);
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("invalid test filter regex: " + e.getDescription(), e);
            }
            return this;
        }

        public Builder environment(Map<String, String> environment) {
            this.environment = environment;
            return this;
        }

        public SuiteConfig build() {
            return new SuiteConfig(pluginPath, mode, verbosity, outputFormat, outputFile, suiteTimeout,
                handshakeTimeout, categories, nameFilter, environment);
        }
    }
}
