package work.geodsl.cli;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import picocli.CommandLine;
import work.geodsl.api.DslRunner;
import work.geodsl.api.RunResult;
import work.geodsl.command.CommandTable;
import work.geodsl.config.KernelConfiguration;
import work.geodsl.config.KernelConfigurationLoader;
import work.geodsl.config.LogLevel;

@CommandLine.Command(
    name = "geodsl",
    description = "Evaluate geometry command lines against a fresh construction.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class GeoDslCommand implements Callable<Integer> {
    enum Format {
        JSON,
        YAML,
        TEXT
    }

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(
        names = {"-c", "--config"},
        paramLabel = "TOML",
        description = "Kernel configuration file ([kernel] and [filters] tables).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = {"-e", "--eval"},
        paramLabel = "LINE",
        description = "Input line to evaluate; repeatable, evaluated before FILE."
    )
    private List<String> evalLines = new ArrayList<>();

    @CommandLine.Parameters(
        arity = "0..1",
        paramLabel = "FILE",
        description = "Script with one input line per line; '-' reads stdin (default when no -e is given)."
    )
    private String script;

    @CommandLine.Option(
        names = "--format",
        description = "Output format: ${COMPLETION-CANDIDATES}.",
        defaultValue = "JSON"
    )
    private Format format = Format.JSON;

    @CommandLine.Option(
        names = "--log-level",
        description = "Log threshold (trace|debug|info|warn|error|off).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String logLevelRaw;

    @CommandLine.Option(
        names = "--fail-fast",
        description = "Stop at the first rejected line."
    )
    private boolean failFast;

    @CommandLine.Option(
        names = "--exam",
        description = "Exam mode: only commands named with --allow (or in the configuration) may run."
    )
    private boolean examMode;

    @CommandLine.Option(
        names = "--allow",
        paramLabel = "COMMAND",
        split = ",",
        description = "Commands permitted in exam mode."
    )
    private List<String> allowed = new ArrayList<>();

    @CommandLine.Option(
        names = "--cas",
        description = "Enable CAS commands."
    )
    private boolean casAllowed;

    @Override
    public Integer call() throws Exception {
        KernelConfiguration configuration = resolveConfiguration();
        configuration.logLevel().apply();

        List<String> lines = new ArrayList<>(evalLines);
        lines.addAll(readScript());

        RunResult result = new DslRunner().run(lines, configuration, failFast);
        var out = spec.commandLine().getOut();
        switch (format) {
            case YAML -> out.print(result.toYaml());
            case TEXT -> out.print(result.toText());
            default -> out.println(result.toPrettyJson());
        }
        out.flush();
        return result.status().exitCode();
    }

    private KernelConfiguration resolveConfiguration() {
        if (config != null && !Files.isRegularFile(config)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Configuration file not found: " + config);
        }
        var builder = KernelConfigurationLoader.load(config).toBuilder();
        if (examMode) {
            builder.examMode(true);
        }
        if (!allowed.isEmpty()) {
            List<String> unknown = allowed.stream()
                .filter(name -> !CommandTable.standard().contains(name))
                .collect(Collectors.toList());
            if (!unknown.isEmpty()) {
                throw new CommandLine.ParameterException(spec.commandLine(), "Unknown commands in --allow: " + unknown);
            }
            builder.allowedCommands(allowed);
        }
        if (casAllowed) {
            builder.casAllowed(true);
        }
        if (logLevelRaw != null) {
            builder.logLevel(LogLevel.from(logLevelRaw));
        }
        return builder.build();
    }

    private List<String> readScript() throws IOException {
        if (script == null) {
            return evalLines.isEmpty() ? readStdin() : List.of();
        }
        if ("-".equals(script)) {
            return readStdin();
        }
        Path path = Path.of(script);
        if (!Files.isRegularFile(path)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Script not found: " + script);
        }
        return Files.readAllLines(path, StandardCharsets.UTF_8);
    }

    private List<String> readStdin() throws IOException {
        try (var reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.toList());
        }
    }
}
