package work.keymap.zmk2kanata.api;

import java.nio.file.Path;
import java.util.List;

/**
 * Expands {@code #include}, {@code #define} and macro invocations of a keymap before parsing.
 */
@FunctionalInterface
public interface Preprocessor {
    /**
     * @throws work.keymap.zmk2kanata.error.PreprocessorFailureException when the expansion fails
     */
    String expand(Path input, List<Path> includeDirectories);
}
