package work.keymap.zmk2kanata.dts;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import work.keymap.zmk2kanata.error.ConversionError;
import work.keymap.zmk2kanata.error.ErrorKind;
import work.keymap.zmk2kanata.error.ErrorManager;
import work.keymap.zmk2kanata.error.Severity;

class DtsParserTest {
    private final ErrorManager errors = new ErrorManager();
    private final DtsParser parser = new DtsParser(errors);

    private List<ConversionError> warnings() {
        return errors.errors().stream()
            .filter(error -> error.severity() == Severity.WARNING)
            .collect(Collectors.toList());
    }

    @Test
    void parsesBehaviorNode() {
        DtsRoot root = parser.parse(String.join("\n",
            "/ {",
            "    behaviors {",
            "        hm: homerow_mods {",
            "            compatible = \"zmk,behavior-hold-tap\";",
            "            #binding-cells = <2>;",
            "            tapping-term-ms = <280>;",
            "            bindings = <&kp>, <&kp>;",
            "            hold-trigger-on-release;",
            "        };",
            "    };",
            "};"));

        DtsNode node = root.findNode("/behaviors/homerow_mods").orElseThrow();
        assertEquals("zmk,behavior-hold-tap", node.stringProperty("compatible").orElseThrow());
        assertEquals(2, node.integerProperty("#binding-cells").orElseThrow());
        assertEquals(280, node.integerProperty("tapping-term-ms").orElseThrow());
        assertTrue(node.hasFlag("hold-trigger-on-release"));
        assertEquals(List.of("&kp", "&kp"), node.property("bindings").orElseThrow().cellTexts());
        assertEquals("hm", node.label().orElseThrow());
        assertEquals(node, root.findByLabel("hm").orElseThrow());
        assertEquals(3, node.line());
    }

    @Test
    void mergesRootBlocksAndWarnsOnOverwrite() {
        DtsRoot root = parser.parse("/ { a = <1>; keymap { x = <1>; }; };\n/ { a = <2>; b = \"x\"; keymap { y = <3>; }; };");

        assertEquals(2, root.integerProperty("a").orElseThrow());
        assertEquals("x", root.stringProperty("b").orElseThrow());
        DtsNode keymap = root.child("keymap").orElseThrow();
        assertEquals(1, keymap.integerProperty("x").orElseThrow());
        assertEquals(3, keymap.integerProperty("y").orElseThrow());
        assertEquals(1, warnings().size());
        assertTrue(warnings().get(0).message().contains("'a'"));
    }

    @Test
    void identicalRedefinitionIsSilent() {
        parser.parse("/ { a = <1>; };\n/ { a = <1>; };");
        assertTrue(warnings().isEmpty());
    }

    @Test
    void missingSemicolonAfterPropertyIsFatal() {
        DtsParseException ex = assertThrows(DtsParseException.class, () -> parser.parse("/ {\n  a = <1>\n};"));
        assertEquals(3, ex.line());
        assertEquals(1, ex.column());
        assertTrue(ex.error().message().startsWith("Missing ';' after property 'a'"));
        assertEquals(ErrorKind.PARSE_ERROR, ex.kind());
        assertFalse(ex.snippet().isEmpty());
    }

    @Test
    void unexpectedTopLevelTokenIsFatal() {
        assertThrows(DtsParseException.class, () -> parser.parse("foo = <1>;"));
    }

    @Test
    void labelOverridesMergeIntoLabelledNode() {
        DtsRoot root = parser.parse("/ { target: node { x = <1>; }; };\n&target { y = <2>; };");
        DtsNode node = root.findNode("/node").orElseThrow();
        assertEquals(1, node.integerProperty("x").orElseThrow());
        assertEquals(2, node.integerProperty("y").orElseThrow());
        assertTrue(warnings().isEmpty());
    }

    @Test
    void overrideOfUnknownLabelIsReported() {
        parser.parse("/ { };\n&missing { y = <2>; };");
        assertEquals(1, warnings().size());
        assertEquals(ErrorKind.UNSUPPORTED_FEATURE, warnings().get(0).kind());
    }

    @Test
    void strayBlockIsMergedWithWarning() {
        DtsRoot root = parser.parse("{ a = <5>; };");
        assertEquals(5, root.integerProperty("a").orElseThrow());
        assertEquals(1, warnings().size());
    }

    @Test
    void evaluatesCellExpressionsAndHex() {
        DtsRoot root = parser.parse("/ { v = <(1 << 3) 0x10 (((0x02) << 24) | ((0x07 << 16) | (0x04)))>; };");
        List<Object> cells = root.property("v").orElseThrow().cells();
        assertEquals(List.of(8, 16, 0x02070004), cells);
    }

    @Test
    void rejectsIntegersWiderThanACell() {
        DtsParseException ex = assertThrows(DtsParseException.class,
            () -> parser.parse("/ {\n    t = <99999999999999999999>;\n};"));
        assertEquals(2, ex.line());
        assertEquals(10, ex.column());
        assertTrue(ex.error().message().contains("99999999999999999999"));
        assertEquals(ErrorKind.PARSE_ERROR, ex.kind());
    }

    @Test
    void doesNotTruncateLargeIntegers() {
        DtsParseException ex = assertThrows(DtsParseException.class,
            () -> parser.parse("/ { tapping-term-ms = <200 4294967496>; };"));
        assertEquals(1, ex.line());
        assertEquals(28, ex.column());
        assertThrows(DtsParseException.class, () -> parser.parse("/ { v = <(1 << 40)>; };"));
    }

    @Test
    void keepsFullWidthCellsAsTwosComplement() {
        DtsRoot root = parser.parse("/ { v = <0xFFFFFFFF (0x80 << 24)>; };");
        assertEquals(List.of(-1, Integer.MIN_VALUE), root.property("v").orElseThrow().cells());
    }

    @Test
    void keepsModifierExpressionsAsSingleCells() {
        DtsRoot root = parser.parse("/ { bindings = <&kp LC(LS(A)) &kp B>; };");
        assertEquals(List.of("&kp", "LC(LS(A))", "&kp", "B"), root.property("bindings").orElseThrow().cellTexts());
    }

    @Test
    void tracksCellLines() {
        DtsRoot root = parser.parse("/ {\n  bindings = <\n    &kp A\n    &kp B\n  >;\n};");
        DtsProperty bindings = root.property("bindings").orElseThrow();
        assertEquals(3, bindings.cellLine(0));
        assertEquals(4, bindings.cellLine(2));
    }

    @Test
    void skipsDirectives() {
        DtsRoot root = parser.parse("/dts-v1/;\n/ { a = <1>; };");
        assertEquals(1, root.integerProperty("a").orElseThrow());
    }
}
