package work.keymap.zmk2kanata.support;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import work.keymap.zmk2kanata.dts.DtsParser;
import work.keymap.zmk2kanata.dts.DtsRoot;
import work.keymap.zmk2kanata.error.ErrorManager;
import work.keymap.zmk2kanata.extract.KeymapExtractor;
import work.keymap.zmk2kanata.model.KeymapConfig;

public final class KeymapFixtures {
    private KeymapFixtures() {}

    public static Path keymapPath(String name) {
        return Path.of("src", "test", "resources", "keymaps", name).toAbsolutePath();
    }

    public static String keymap(String name) {
        try {
            return Files.readString(keymapPath(name), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    public static DtsRoot parse(String text, ErrorManager errors) {
        return new DtsParser(errors).parse(text);
    }

    public static KeymapConfig extract(String text, ErrorManager errors) {
        return new KeymapExtractor(errors).extract(parse(text, errors));
    }

    /**
     * Wraps layer bodies into a minimal keymap: {@code layer("base", "&kp A &kp B")}.
     */
    public static String keymapWithLayers(String... nameAndBindings) {
        StringBuilder sb = new StringBuilder("/ {\n    keymap {\n        compatible = \"zmk,keymap\";\n");
        for (int i = 0; i + 1 < nameAndBindings.length; i += 2) {
            sb.append("        ").append(nameAndBindings[i]).append(" {\n")
                .append("            bindings = <").append(nameAndBindings[i + 1]).append(">;\n")
                .append("        };\n");
        }
        return sb.append("    };\n};\n").toString();
    }
}
