package work.keymap.zmk2kanata.api;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.keymap.zmk2kanata.error.Severity;
import work.keymap.zmk2kanata.keys.ModifierStyle;

/**
 * Immutable configuration of one keymap conversion.
 *
 * @param input ZMK keymap file to convert
 * @param includeDirectories extra {@code -I} directories handed to the C preprocessor
 * @param preprocess whether the input goes through the C preprocessor first
 * @param preprocessorCommand executable used as the C preprocessor
 * @param modifierStyle PC or Mac modifier names in the output
 * @param raiseThreshold severity at which a diagnostic aborts the conversion
 */
public record ConversionConfiguration(
    Path input,
    List<Path> includeDirectories,
    boolean preprocess,
    String preprocessorCommand,
    ModifierStyle modifierStyle,
    Severity raiseThreshold
) {
    public static final String DEFAULT_PREPROCESSOR = "cpp";

    public ConversionConfiguration {
        Objects.requireNonNull(input, "input");
        includeDirectories = List.copyOf(Objects.requireNonNull(includeDirectories, "includeDirectories"));
        Objects.requireNonNull(preprocessorCommand, "preprocessorCommand");
        Objects.requireNonNull(modifierStyle, "modifierStyle");
        Objects.requireNonNull(raiseThreshold, "raiseThreshold");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Path input;
        private final List<Path> includeDirectories = new ArrayList<>();
        private boolean preprocess = true;
        private String preprocessorCommand = DEFAULT_PREPROCESSOR;
        private ModifierStyle modifierStyle = ModifierStyle.PC;
        private Severity raiseThreshold = Severity.ERROR;

        public Builder input(Path input) {
            this.input = input;
            return this;
        }

        public Builder includeDirectory(Path directory) {
            this.includeDirectories.add(directory);
            return this;
        }

        public Builder includeDirectories(List<Path> directories) {
            this.includeDirectories.addAll(directories);
            return this;
        }

        public Builder preprocess(boolean preprocess) {
            this.preprocess = preprocess;
            return this;
        }

        public Builder preprocessorCommand(String preprocessorCommand) {
            this.preprocessorCommand = preprocessorCommand;
            return this;
        }

        public Builder modifierStyle(ModifierStyle modifierStyle) {
            this.modifierStyle = modifierStyle;
            return this;
        }

        public Builder raiseThreshold(Severity raiseThreshold) {
            this.raiseThreshold = raiseThreshold;
            return this;
        }

        public ConversionConfiguration build() {
            return new ConversionConfiguration(
                input,
                includeDirectories,
                preprocess,
                preprocessorCommand,
                modifierStyle,
                raiseThreshold
            );
        }
    }
}
