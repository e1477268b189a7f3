package work.keymap.zmk2kanata.cli;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.keymap.zmk2kanata.api.ConversionConfiguration;
import work.keymap.zmk2kanata.api.ConversionResult;
import work.keymap.zmk2kanata.api.KeymapConverter;
import work.keymap.zmk2kanata.config.ConverterSettings;
import work.keymap.zmk2kanata.config.ConverterSettingsLoader;
import work.keymap.zmk2kanata.error.ConversionError;
import work.keymap.zmk2kanata.error.Severity;
import work.keymap.zmk2kanata.keys.ModifierStyle;

@CommandLine.Command(
    name = "convert",
    description = "Convert a ZMK .keymap file into a Kanata .kbd configuration.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    showDefaultValues = true
)
final class ConvertCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(index = "0", paramLabel = "INPUT", description = "ZMK keymap file.")
    private Path input;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Kanata file to write (default: standard output).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path output;

    @CommandLine.Option(
        names = {"-I", "--include"},
        paramLabel = "DIR",
        description = "Extra include directory for the C preprocessor (repeatable)."
    )
    private List<Path> includes = new ArrayList<>();

    @CommandLine.Option(names = "--mac", description = "Use Mac modifier names (lcmd/lopt).")
    private Boolean mac;

    @CommandLine.Option(names = "--no-preprocess", description = "Parse the input as is, without running cpp.")
    private Boolean noPreprocess;

    @CommandLine.Option(
        names = "--cpp",
        paramLabel = "COMMAND",
        description = "C preprocessor executable (default: cpp).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String cpp;

    @CommandLine.Option(
        names = "--config",
        paramLabel = "FILE",
        description = "Settings file (default: zmk2kanata.toml next to the input, when present).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path config;

    @CommandLine.Option(
        names = "--metadata",
        paramLabel = "FILE",
        description = "Write conversion metadata as JSON, or YAML for .yaml/.yml files.",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private Path metadata;

    @CommandLine.Option(
        names = "--fail-on",
        paramLabel = "LEVEL",
        description = "Severity that aborts the conversion (debug|info|warning|error|critical).",
        defaultValue = CommandLine.Option.NULL_VALUE
    )
    private String failOn;

    @Override
    public Integer call() throws Exception {
        if (!Files.isRegularFile(input)) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Keymap file not found: " + input);
        }
        ConverterSettings settings = config != null
            ? ConverterSettingsLoader.load(config)
            : ConverterSettingsLoader.discover(input).orElse(ConverterSettings.empty());

        ConversionConfiguration configuration = configuration(settings);
        ConversionResult result = new KeymapConverter().convert(configuration);
        if (metadata != null) {
            writeMetadata(result);
        }

        PrintWriter err = spec.commandLine().getErr();
        if (!result.succeeded()) {
            result.metadata().errors().bySource().values().stream()
                .flatMap(List::stream)
                .filter(error -> error.severity().isAtLeast(configuration.raiseThreshold()))
                .map(ConversionError::describe)
                .forEach(line -> err.println(spec.commandLine().getColorScheme().errorText(line)));
            err.flush();
            return result.status().exitCode();
        }

        if (output != null) {
            Path parent = output.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(output, result.output(), StandardCharsets.UTF_8);
            err.println("Wrote " + output + " (" + result.metadata().layerCount() + " layers, "
                + result.metadata().errors().total() + " diagnostics)");
            err.flush();
        } else {
            PrintWriter out = spec.commandLine().getOut();
            out.print(result.output());
            out.flush();
        }
        return result.status().exitCode();
    }

    ConversionConfiguration configuration(ConverterSettings settings) {
        boolean preprocess = !Boolean.TRUE.equals(noPreprocess) && settings.preprocess().orElse(true);
        boolean macStyle = mac != null ? mac : settings.mac().orElse(false);
        Severity threshold = failOn != null
            ? parseSeverity(failOn)
            : settings.failOn().orElse(Severity.ERROR);
        List<Path> includeDirectories = new ArrayList<>(settings.includeDirectories());
        includeDirectories.addAll(includes);
        return ConversionConfiguration.builder()
            .input(input)
            .includeDirectories(includeDirectories)
            .preprocess(preprocess)
            .preprocessorCommand(cpp != null ? cpp : settings.preprocessorCommand().orElse(ConversionConfiguration.DEFAULT_PREPROCESSOR))
            .modifierStyle(macStyle ? ModifierStyle.MAC : ModifierStyle.PC)
            .raiseThreshold(threshold)
            .build();
    }

    private Severity parseSeverity(String value) {
        try {
            return Severity.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.ParameterException(spec.commandLine(), ex.getMessage());
        }
    }

    private void writeMetadata(ConversionResult result) throws IOException {
        String name = metadata.getFileName().toString().toLowerCase(Locale.ROOT);
        boolean yaml = name.endsWith(".yaml") || name.endsWith(".yml");
        Path parent = metadata.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(metadata, yaml ? result.toYaml() : result.toPrettyJson() + "\n", StandardCharsets.UTF_8);
    }
}
