package work.keymap.zmk2kanata.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import work.keymap.zmk2kanata.error.ConversionError;
import work.keymap.zmk2kanata.error.ErrorKind;
import work.keymap.zmk2kanata.error.PreprocessorFailureException;
import work.keymap.zmk2kanata.error.Severity;
import work.keymap.zmk2kanata.support.KeymapFixtures;

class KeymapConverterTest {
    private static ConversionConfiguration.Builder configuration(String keymap) {
        return ConversionConfiguration.builder().input(KeymapFixtures.keymapPath(keymap));
    }

    @Test
    void convertsTextWithoutPreprocessing() {
        ConversionResult result = new KeymapConverter()
            .convertText(KeymapFixtures.keymap("basic.keymap"), configuration("basic.keymap").build());

        assertEquals(ConversionResult.Status.SUCCESS, result.status());
        assertEquals(List.of("default_layer", "nav_layer"), result.metadata().layerNames());
        assertEquals(2, result.metadata().behaviorCount());
        assertEquals(300, result.metadata().globalSettings().tapTimeMs());
        assertTrue(result.output().contains("(deflayer nav_layer"));
    }

    @Test
    void preprocessorReceivesInputAndIncludes() {
        List<Path> seen = new ArrayList<>();
        Path include = Path.of("zmk", "include");
        KeymapConverter converter = new KeymapConverter((input, includes) -> {
            seen.add(input);
            seen.addAll(includes);
            return KeymapFixtures.keymap("basic.keymap");
        });

        ConversionResult result = converter.convert(configuration("basic.keymap").includeDirectory(include).build());

        assertTrue(result.succeeded());
        assertEquals(List.of(KeymapFixtures.keymapPath("basic.keymap"), include), seen);
    }

    @Test
    void preprocessorFailureIsCritical() {
        KeymapConverter converter = new KeymapConverter((input, includes) -> {
            throw new PreprocessorFailureException("cpp exited with status 1: missing header", null);
        });

        ConversionResult result = converter.convert(configuration("basic.keymap").build());

        assertEquals(ConversionResult.Status.FAILURE, result.status());
        assertEquals(1, result.status().exitCode());
        assertEquals("", result.output());
        ConversionError error = result.metadata().errors().bySource().get("preprocessor").get(0);
        assertEquals(Severity.CRITICAL, error.severity());
        assertEquals(ErrorKind.PREPROCESSOR_FAILURE, error.kind());
        assertNull(result.metadata().globalSettings());
    }

    @Test
    void parseErrorAbortsConversion() {
        ConversionResult result = new KeymapConverter()
            .convert(configuration("broken.keymap").preprocess(false).build());

        assertFalse(result.succeeded());
        ConversionError error = result.metadata().errors().bySource().get("parser").get(0);
        assertEquals(Severity.CRITICAL, error.severity());
        assertEquals(ErrorKind.PARSE_ERROR, error.kind());
        assertTrue(error.message().contains("Unterminated array"));
        assertEquals(1, result.metadata().errors().count(Severity.CRITICAL));
    }

    @Test
    void oversizedTimingIsAParseFailure() {
        String text = String.join("\n",
            "/ {",
            "    behaviors {",
            "        hm: homerow_mods {",
            "            compatible = \"zmk,behavior-hold-tap\";",
            "            #binding-cells = <2>;",
            "            tapping-term-ms = <99999999999999999999>;",
            "            bindings = <&kp>, <&kp>;",
            "        };",
            "    };",
            "};");

        ConversionResult result = new KeymapConverter().convertText(text, configuration("basic.keymap").build());

        assertFalse(result.succeeded());
        ConversionError error = result.metadata().errors().bySource().get("parser").get(0);
        assertEquals(ErrorKind.PARSE_ERROR, error.kind());
        assertEquals(6, error.line());
    }

    @Test
    void missingInputIsReported() {
        ConversionConfiguration config = ConversionConfiguration.builder()
            .input(KeymapFixtures.keymapPath("does-not-exist.keymap"))
            .preprocess(false)
            .build();

        ConversionResult result = new KeymapConverter().convert(config);

        assertFalse(result.succeeded());
        assertEquals(ErrorKind.INPUT_FAILURE, result.metadata().errors().bySource().get("input").get(0).kind());
    }

    @Test
    void lowerThresholdTurnsWarningsFatal() {
        String text = KeymapFixtures.keymapWithLayers("base", "&kp A &bogus");

        ConversionResult lenient = new KeymapConverter().convertText(text, configuration("basic.keymap").build());
        ConversionResult strict = new KeymapConverter()
            .convertText(text, configuration("basic.keymap").raiseThreshold(Severity.WARNING).build());

        assertTrue(lenient.succeeded());
        assertTrue(lenient.metadata().errors().count(Severity.WARNING) > 0);
        assertFalse(strict.succeeded());
    }

    @Test
    void serializesMetadata() {
        ConversionResult result = new KeymapConverter()
            .convertText(KeymapFixtures.keymap("basic.keymap"), configuration("basic.keymap").build());

        String json = result.toPrettyJson();
        assertTrue(json.contains("\"status\" : \"success\""));
        assertTrue(json.contains("\"layerCount\" : 2"));
        assertTrue(json.contains("\"tapTimeMs\" : 300"));

        String yaml = result.toYaml();
        assertTrue(yaml.contains("status:"));
        assertTrue(yaml.contains("nav_layer"));
    }

    @Test
    void cppCommandLine() {
        Path input = Path.of("config", "corne.keymap");
        Path bundled = Path.of("bundled");
        List<String> args = new CppPreprocessor("cpp").commandLine(bundled, input, List.of(Path.of("include")));

        assertEquals(List.of("cpp", "-E", "-x", "c", "-P", "-D__DTS__"), args.subList(0, 6));
        assertEquals("-I" + bundled.toAbsolutePath(), args.get(6));
        assertEquals("-I" + input.toAbsolutePath().getParent(), args.get(7));
        assertEquals("-I" + Path.of("include").toAbsolutePath(), args.get(8));
        assertEquals(input.toAbsolutePath().toString(), args.get(9));
    }
}
