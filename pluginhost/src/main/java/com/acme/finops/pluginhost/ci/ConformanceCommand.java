package com.acme.finops.pluginhost.ci;

import com.acme.finops.pluginhost.conformance.ConformanceReport;
import com.acme.finops.pluginhost.conformance.ConformanceSuite;
import com.acme.finops.pluginhost.conformance.OutputFormat;
import com.acme.finops.pluginhost.conformance.SuiteConfig;
import com.acme.finops.pluginhost.conformance.TestCategory;
import com.acme.finops.pluginhost.conformance.Verbosity;
import com.acme.finops.pluginhost.conformance.report.Certification;
import com.acme.finops.pluginhost.conformance.report.ReportRenderers;
import com.acme.finops.pluginhost.transport.api.CommMode;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

@CommandLine.Command(
    name = "conformance",
    description = "Run the protocol conformance suite against a cost-source plugin binary.",
    mixinStandardHelpOptions = true,
    showDefaultValues = true
)
public final class ConformanceCommand implements Callable<Integer> {
    private static final Logger LOG = Logger.getLogger(ConformanceCommand.class.getName());

    @CommandLine.Parameters(index = "0", paramLabel = "PLUGIN_PATH", description = "Path to the plugin executable.")
    private Path pluginPath;

    @CommandLine.Option(names = "--mode", description = "Communication mode (tcp|stdio).", defaultValue = "tcp")
    private String mode;

    @CommandLine.Option(names = "--verbosity", description = "quiet|normal|verbose|debug.", defaultValue = "normal")
    private String verbosity;

    @CommandLine.Option(names = "--output", description = "Report format (table|json|junit).", defaultValue = "table")
    private String output;

    @CommandLine.Option(names = "--output-file", description = "Write the report here instead of stdout.",
        defaultValue = CommandLine.Option.NULL_VALUE)
    private Path outputFile;

    @CommandLine.Option(names = "--timeout", description = "Global suite timeout (e.g. 30s, 5m).", defaultValue = "5m")
    private String timeout;

    @CommandLine.Option(names = "--handshake-timeout", description = "Bound on plugin startup.", defaultValue = "5s")
    private String handshakeTimeout;

    @CommandLine.Option(names = "--category", description = "Restrict to a category; repeatable "
        + "(protocol|cost|error|recommendation|dryrun).")
    private List<String> categories = new ArrayList<>();

    @CommandLine.Option(names = "--filter", description = "Regex matched against test names.",
        defaultValue = CommandLine.Option.NULL_VALUE)
    private String filter;

    @CommandLine.Option(names = "--certification-file", description = "Also write a Markdown certification report.",
        defaultValue = CommandLine.Option.NULL_VALUE)
    private Path certificationFile;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    private final ConformanceSuite suite;

    public ConformanceCommand() {
        this(new ConformanceSuite());
    }

    public ConformanceCommand(ConformanceSuite suite) {
        this.suite = suite;
    }

    @Override
    public Integer call() throws IOException {
        SuiteConfig config;
        try {
            config = toConfig();
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }
        LogLevels.apply(config.verbosity());

        ConformanceReport report = suite.run(config);
        String rendered = switch (config.outputFormat()) {
            case TABLE -> ReportRenderers.table(report, config.verbosity());
            case JSON -> ReportRenderers.json(report);
            case JUNIT -> ReportRenderers.junit(report);
        };
        if (config.outputFile() == null) {
            PrintWriter out = spec.commandLine().getOut();
            out.print(rendered);
            out.flush();
        } else {
            Files.writeString(config.outputFile(), rendered, StandardCharsets.UTF_8);
            LOG.info(() -> "conformance report written path=" + config.outputFile());
        }
        if (certificationFile != null) {
            Files.writeString(certificationFile, Certification.certify(report).toMarkdown(), StandardCharsets.UTF_8);
        }
        int exit = ExitCodes.forReport(report);
        LOG.log(exit == ExitCodes.ALL_PASSED ? Level.FINE : Level.INFO,
            () -> "conformance finished exitCode=" + exit + " summary=" + report.summary());
        return exit;
    }

    SuiteConfig toConfig() {
        Set<TestCategory> selected = EnumSet.noneOf(TestCategory.class);
        for (String raw : categories) {
            selected.add(TestCategory.parse(raw));
        }
        return SuiteConfig.builder(pluginPath)
            .mode(CommMode.parse(mode))
            .verbosity(Verbosity.parse(verbosity))
            .outputFormat(OutputFormat.parse(output))
            .outputFile(outputFile)
            .suiteTimeout(DurationArgs.parse(timeout))
            .handshakeTimeout(DurationArgs.parse(handshakeTimeout))
            .categories(selected)
            .nameFilter(filter)
            .build();
    }

    public static CommandLine commandLine(ConformanceCommand command) {
        CommandLine cmd = new CommandLine(command);
        cmd.setParameterExceptionHandler((ex, args) -> {
            CommandLine source = ex.getCommandLine();
            source.getErr().println(ex.getMessage());
            source.usage(source.getErr());
            return ExitCodes.INVALID_ARGUMENTS;
        });
        cmd.setExecutionExceptionHandler((ex, source, parseResult) -> {
            LOG.log(Level.SEVERE, "conformance run failed", ex);
            source.getErr().println("conformance run failed: " + ex.getMessage());
            return ExitCodes.PLUGIN_CRASHED;
        });
        return cmd;
    }

    public static void main(String[] args) {
        LogLevels.loadBundledConfig();
        System.exit(commandLine(new ConformanceCommand()).execute(args));
    }
}
