package work.keymap.zmk2kanata.api;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.List;

/**
 * Minimal {@code behaviors.dtsi} and {@code dt-bindings/zmk/*.h} headers shipped in the jar so a
 * stock keymap preprocesses without a ZMK checkout. They are copied into a temporary include
 * directory for each preprocessor run.
 */
final class BundledHeaders {
    static final String RESOURCE_ROOT = "/zmk2kanata/include/";
    static final List<String> FILES = List.of(
        "behaviors.dtsi",
        "dt-bindings/zmk/keys.h",
        "dt-bindings/zmk/behaviors.h",
        "dt-bindings/zmk/mouse.h",
        "dt-bindings/zmk/matrix_transform.h",
        "dt-bindings/zmk/bt.h",
        "dt-bindings/zmk/outputs.h",
        "dt-bindings/zmk/rgb.h",
        "dt-bindings/zmk/ext_power.h",
        "dt-bindings/zmk/backlight.h"
    );

    private BundledHeaders() {}

    static Path extract() throws IOException {
        Path root = Files.createTempDirectory("zmk2kanata-include");
        try {
            for (String file : FILES) {
                copy(file, root.resolve(file));
            }
        } catch (IOException | RuntimeException ex) {
            deleteRecursively(root);
            throw ex;
        }
        return root;
    }

    private static void copy(String file, Path destination) throws IOException {
        try (InputStream raw = BundledHeaders.class.getResourceAsStream(RESOURCE_ROOT + file)) {
            if (raw == null) {
                throw new IllegalStateException("Bundled header missing from resources (" + file + ")");
            }
            Files.createDirectories(destination.getParent());
            Files.copy(raw, destination);
        }
    }

    static void deleteRecursively(Path root) throws IOException {
        if (!Files.exists(root)) {
            return;
        }
        Files.walkFileTree(root, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                Files.deleteIfExists(dir);
                return FileVisitResult.CONTINUE;
            }
        });
    }
}
