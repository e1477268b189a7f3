package work.keymap.zmk2kanata.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.keymap.zmk2kanata.error.Severity;

/**
 * Defaults read from a {@code zmk2kanata.toml} file. Command-line flags win over every value here.
 */
public record ConverterSettings(
    Optional<Boolean> preprocess,
    Optional<String> preprocessorCommand,
    List<Path> includeDirectories,
    Optional<Boolean> mac,
    Optional<Severity> failOn
) {
    public static final String FILE_NAME = "zmk2kanata.toml";

    public ConverterSettings {
        Objects.requireNonNull(preprocess, "preprocess");
        Objects.requireNonNull(preprocessorCommand, "preprocessorCommand");
        includeDirectories = List.copyOf(Objects.requireNonNull(includeDirectories, "includeDirectories"));
        Objects.requireNonNull(mac, "mac");
        Objects.requireNonNull(failOn, "failOn");
    }

    public static ConverterSettings empty() {
        return new ConverterSettings(Optional.empty(), Optional.empty(), List.of(), Optional.empty(), Optional.empty());
    }
}
