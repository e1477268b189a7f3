package work.keymap.zmk2kanata.output;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.keymap.zmk2kanata.error.ErrorManager;
import work.keymap.zmk2kanata.keys.ModifierStyle;
import work.keymap.zmk2kanata.model.KeymapConfig;
import work.keymap.zmk2kanata.support.KeymapFixtures;

class KanataAssemblerTest {
    private static String assemble(String text, ModifierStyle style) {
        ErrorManager errors = new ErrorManager();
        KeymapConfig config = KeymapFixtures.extract(text, errors);
        return new KanataAssembler(style).assemble(config, errors);
    }

    private static int occurrences(String haystack, String needle) {
        int count = 0;
        int from = 0;
        while ((from = haystack.indexOf(needle, from)) >= 0) {
            count++;
            from += needle.length();
        }
        return count;
    }

    @Test
    void basicKeymapLayout() {
        String output = assemble(KeymapFixtures.keymap("basic.keymap"), ModifierStyle.PC);

        assertTrue(output.startsWith(";; ZMK to Kanata Configuration\n"));
        assertTrue(output.contains(";; Modifier convention: PC (lmet/lalt)"));
        assertTrue(output.contains("(defvar\n  tap-time 300\n  hold-time 400\n)"));
        assertTrue(output.contains("  hm_lshift_a (tap-hold-release $tap-time 280 a lsft)\n"));
        assertTrue(output.contains("  shift_a (macro S-a)\n"));
        assertTrue(output.contains("(deflayer default_layer\n  a b c\n  d e f\n)"));
        assertTrue(output.contains("(deflayer nav_layer\n  @hm_lshift_a (layer-while-held default_layer) _\n  @shift_a XX C-S-lalt\n)"));
        assertTrue(output.contains(";; diagnostics: 0 critical, 0 error, 0 warning"));
    }

    @Test
    void sectionsAppearInOrder() {
        String output = assemble(KeymapFixtures.keymap("basic.keymap"), ModifierStyle.PC);
        int defvar = output.indexOf("(defvar");
        int defalias = output.indexOf("(defalias");
        int macro = output.indexOf("#| defmacro shift_a");
        int firstLayer = output.indexOf("(deflayer default_layer");
        int secondLayer = output.indexOf("(deflayer nav_layer");
        int summary = output.indexOf(";; Conversion summary");
        assertTrue(defvar < defalias && defalias < macro && macro < firstLayer);
        assertTrue(firstLayer < secondLayer && secondLayer < summary);
        assertTrue(output.contains("#| defmacro shift_a\n  press lsft\n  tap a\n  release lsft\n|#"));
    }

    @Test
    void repeatedBindingsShareOneAlias() {
        String text = KeymapFixtures.keymapWithLayers(
            "base", "&mt LSHIFT A &kp B",
            "lower", "&mt LSHIFT A &kp C",
            "upper", "&mt LSHIFT A &kp D");
        String output = assemble(text, ModifierStyle.PC);

        assertEquals(1, occurrences(output, "  mt_lshift_a (tap-hold-press $tap-time $hold-time a lsft)"));
        assertEquals(3, occurrences(output, "@mt_lshift_a"));
    }

    @Test
    void declaredHoldTapUsedOnEveryLayerIsDefinedOnce() {
        String text = String.join("\n",
            "/ {",
            "    behaviors {",
            "        hm: homerow_mods {",
            "            compatible = \"zmk,behavior-hold-tap\";",
            "            #binding-cells = <2>;",
            "            flavor = \"balanced\";",
            "            bindings = <&kp>, <&kp>;",
            "        };",
            "    };",
            "    keymap {",
            "        compatible = \"zmk,keymap\";",
            "        base { bindings = <&hm LSHIFT A &kp B>; };",
            "        lower { bindings = <&hm LSHIFT A &kp C>; };",
            "        upper { bindings = <&hm LSHIFT A &kp D>; };",
            "    };",
            "};");
        String output = assemble(text, ModifierStyle.PC);

        assertEquals(1, occurrences(output, "  hm_lshift_a (tap-hold-release $tap-time $hold-time a lsft)"));
        assertEquals(3, occurrences(output, "@hm_lshift_a"));
        assertTrue(output.contains("(deflayer upper\n  @hm_lshift_a d\n)"));
    }

    @Test
    void chordsEnableConcurrentTapHold() {
        String text = String.join("\n",
            "/ {",
            "    combos {",
            "        compatible = \"zmk,combos\";",
            "        combo_esc {",
            "            key-positions = <0 1>;",
            "            bindings = <&kp ESC>;",
            "        };",
            "    };",
            "    keymap {",
            "        compatible = \"zmk,keymap\";",
            "        base { bindings = <&kp Q &kp W>; };",
            "    };",
            "};");
        String output = assemble(text, ModifierStyle.PC);

        int defcfg = output.indexOf("(defcfg\n  concurrent-tap-hold yes\n)");
        assertTrue(defcfg > 0);
        assertTrue(defcfg < output.indexOf("(defvar"));
        assertTrue(output.contains("(defchordsv2-experimental\n  (q w) esc 50 all-released ()\n)"));
    }

    @Test
    void noDefcfgWithoutChords() {
        String output = assemble(KeymapFixtures.keymap("basic.keymap"), ModifierStyle.PC);
        assertEquals(-1, output.indexOf("(defcfg"));
        assertTrue(output.contains(";; No defsrc:"));
    }

    @Test
    void outputIsDeterministic() {
        String text = KeymapFixtures.keymap("basic.keymap");
        assertEquals(assemble(text, ModifierStyle.PC), assemble(text, ModifierStyle.PC));
    }

    @Test
    void macStyleHeader() {
        String output = assemble(KeymapFixtures.keymap("basic.keymap"), ModifierStyle.MAC);
        assertTrue(output.contains(";; Modifier convention: Mac (lcmd/lopt)"));
    }

    @Test
    void unreferencedMacrosFollowUsedOnes() {
        String text = "/ {\n"
            + "    macros {\n"
            + "        unused: unused {\n"
            + "            compatible = \"zmk,behavior-macro\";\n"
            + "            #binding-cells = <0>;\n"
            + "            bindings = <&macro_tap &kp X>;\n"
            + "        };\n"
            + "        used: used {\n"
            + "            compatible = \"zmk,behavior-macro\";\n"
            + "            #binding-cells = <0>;\n"
            + "            bindings = <&macro_tap &kp Y>;\n"
            + "        };\n"
            + "    };\n"
            + "    keymap {\n"
            + "        compatible = \"zmk,keymap\";\n"
            + "        base {\n"
            + "            bindings = <&used &kp A>;\n"
            + "        };\n"
            + "    };\n"
            + "};\n";
        String output = assemble(text, ModifierStyle.PC);

        int used = output.indexOf("#| defmacro used");
        int unused = output.indexOf("#| defmacro unused");
        assertTrue(used >= 0 && unused > used);
        assertTrue(output.contains("  unused (macro x)\n"));
        assertTrue(output.contains("(deflayer base\n  @used a\n)"));
    }
}
