package work.keymap.zmk2kanata.config;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlInvalidTypeException;
import org.tomlj.TomlParseResult;
import work.keymap.zmk2kanata.error.Severity;

/**
 * Reads {@link ConverterSettings} from TOML.
 *
 * <pre>
 * [preprocessor]
 * enabled = true
 * command = "cpp"
 * include = ["config", "../zmk/app/include"]
 *
 * [output]
 * mac = false
 *
 * [errors]
 * threshold = "error"
 * </pre>
 *
 * Relative include directories are resolved against the directory holding the file.
 */
public final class ConverterSettingsLoader {
    private static final Logger LOG = LoggerFactory.getLogger(ConverterSettingsLoader.class);

    private ConverterSettingsLoader() {}

    /**
     * Looks for {@value ConverterSettings#FILE_NAME} next to the keymap.
     */
    public static Optional<ConverterSettings> discover(Path keymap) {
        Path parent = keymap.toAbsolutePath().getParent();
        if (parent == null) {
            return Optional.empty();
        }
        Path candidate = parent.resolve(ConverterSettings.FILE_NAME);
        if (!Files.isRegularFile(candidate)) {
            return Optional.empty();
        }
        LOG.debug("Using settings from {}", candidate);
        return Optional.of(load(candidate));
    }

    public static ConverterSettings load(Path path) {
        String content;
        try {
            content = Files.readString(path);
        } catch (IOException ex) {
            throw new UncheckedIOException("Cannot read settings file " + path, ex);
        }
        Path base = path.toAbsolutePath().getParent();
        return parse(content, base != null ? base : Path.of("").toAbsolutePath(), path.toString());
    }

    static ConverterSettings parse(String content, Path baseDirectory, String origin) {
        TomlParseResult result = Toml.parse(content);
        if (result.hasErrors()) {
            String problems = result.errors().stream().map(Object::toString).collect(Collectors.joining("; "));
            throw new IllegalArgumentException("Invalid settings file " + origin + ": " + problems);
        }
        try {
            return new ConverterSettings(
                Optional.ofNullable(result.getBoolean("preprocessor.enabled")),
                Optional.ofNullable(result.getString("preprocessor.command")).filter(command -> !command.isBlank()),
                includes(result.getArray("preprocessor.include"), baseDirectory),
                Optional.ofNullable(result.getBoolean("output.mac")),
                Optional.ofNullable(result.getString("errors.threshold")).map(Severity::from)
            );
        } catch (TomlInvalidTypeException ex) {
            throw new IllegalArgumentException("Invalid settings file " + origin + ": " + ex.getMessage(), ex);
        }
    }

    private static List<Path> includes(TomlArray array, Path baseDirectory) {
        List<Path> directories = new ArrayList<>();
        if (array == null) {
            return directories;
        }
        for (int i = 0; i < array.size(); i++) {
            directories.add(baseDirectory.resolve(array.getString(i)).normalize());
        }
        return directories;
    }
}
