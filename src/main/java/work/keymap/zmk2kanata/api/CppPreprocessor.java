package work.keymap.zmk2kanata.api;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.keymap.zmk2kanata.error.PreprocessorFailureException;

/**
 * Runs the system C preprocessor ({@code cpp -E -x c -P}) over a keymap file.
 *
 * <p>The include path is, in order: the bundled ZMK headers, the directory of the input file and
 * the configured directories. Standard error of the process is captured into a temporary file so a chatty
 * preprocessor cannot block on a full pipe.
 */
public final class CppPreprocessor implements Preprocessor {
    private static final Logger LOG = LoggerFactory.getLogger(CppPreprocessor.class);

    private final String command;

    public CppPreprocessor(String command) {
        this.command = Objects.requireNonNull(command, "command");
    }

    @Override
    public String expand(Path input, List<Path> includeDirectories) {
        Path headers = null;
        Path stderr = null;
        try {
            headers = BundledHeaders.extract();
            List<String> args = commandLine(headers, input, includeDirectories);
            LOG.debug("Running {}", args);
            stderr = Files.createTempFile("zmk2kanata-cpp", ".err");
            Process process = new ProcessBuilder(args)
                .redirectError(stderr.toFile())
                .start();
            process.getOutputStream().close();
            String output = new String(process.getInputStream().readAllBytes(), StandardCharsets.UTF_8);
            int exit = process.waitFor();
            if (exit != 0) {
                String diagnostics = Files.readString(stderr, StandardCharsets.UTF_8).trim();
                throw new PreprocessorFailureException(
                    command + " exited with status " + exit + (diagnostics.isEmpty() ? "" : ": " + diagnostics), null);
            }
            return output;
        } catch (IOException ex) {
            throw new PreprocessorFailureException("Unable to run C preprocessor '" + command + "': " + ex.getMessage(), ex);
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new PreprocessorFailureException("Interrupted while running " + command, ex);
        } finally {
            deleteQuietly(stderr);
            deleteQuietly(headers);
        }
    }

    List<String> commandLine(Path bundledHeaders, Path input, List<Path> includeDirectories) {
        List<String> args = new ArrayList<>();
        args.add(command);
        args.add("-E");
        args.add("-x");
        args.add("c");
        args.add("-P");
        args.add("-D__DTS__");
        args.add("-I" + bundledHeaders.toAbsolutePath());
        Path parent = input.toAbsolutePath().getParent();
        if (parent != null) {
            args.add("-I" + parent);
        }
        for (Path directory : includeDirectories) {
            args.add("-I" + directory.toAbsolutePath());
        }
        args.add(input.toAbsolutePath().toString());
        return args;
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            BundledHeaders.deleteRecursively(file);
        } catch (IOException ex) {
            LOG.debug("Could not delete {}: {}", file, ex.getMessage());
        }
    }
}
