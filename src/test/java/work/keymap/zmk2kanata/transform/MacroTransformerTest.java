package work.keymap.zmk2kanata.transform;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.keymap.zmk2kanata.error.ErrorKind;
import work.keymap.zmk2kanata.error.ErrorManager;
import work.keymap.zmk2kanata.keys.KeyName;
import work.keymap.zmk2kanata.keys.ModifierStyle;
import work.keymap.zmk2kanata.model.GlobalSettings;
import work.keymap.zmk2kanata.model.KeymapConfig;
import work.keymap.zmk2kanata.model.Macro;
import work.keymap.zmk2kanata.model.MacroStep;

class MacroTransformerTest {
    private final ErrorManager errors = new ErrorManager();
    private final KeymapConfig config = new KeymapConfig(List.of(), Map.of(), GlobalSettings.DEFAULTS, List.of(), List.of());
    private final MacroTransformer transformer = new MacroTransformer(new TransformContext(config, ModifierStyle.PC, errors));

    private static MacroStep step(String behavior, String... params) {
        return new MacroStep(behavior, List.of(params), 1);
    }

    private static Macro macro(Optional<Integer> waitMs, Optional<Integer> tapMs, MacroStep... steps) {
        return new Macro("m", 0, 1, waitMs, tapMs, List.of(steps));
    }

    @Test
    void replaysPressTapReleaseInOrder() {
        KanataFragment fragment = transformer.transform(macro(Optional.empty(), Optional.empty(),
            step(MacroStep.PRESS), step("&kp", "LSHIFT"),
            step(MacroStep.TAP), step("&kp", "A"),
            step(MacroStep.RELEASE), step("&kp", "LSHIFT")), List.of());

        assertEquals(List.of("press lsft", "tap a", "release lsft"), fragment.script());
        assertEquals("(macro S-a)", fragment.definition());
        assertEquals("m", fragment.name());
        assertTrue(fragment.isMacro());
    }

    @Test
    void waitMsSeparatesKeyActions() {
        KanataFragment fragment = transformer.transform(macro(Optional.of(30), Optional.empty(),
            step("&kp", "H"), step("&kp", "I")), List.of());

        assertEquals(List.of("tap h", "delay 30", "tap i"), fragment.script());
        assertEquals("(macro h 30 i)", fragment.definition());
    }

    @Test
    void tapMsUsesTimedTaps() {
        KanataFragment fragment = transformer.transform(macro(Optional.empty(), Optional.of(40),
            step("&kp", "A")), List.of());
        assertEquals(List.of("tap-hold-ms 40 a"), fragment.script());
    }

    @Test
    void waitTimeStepEmitsDelay() {
        KanataFragment fragment = transformer.transform(macro(Optional.empty(), Optional.empty(),
            step("&kp", "A"), step(MacroStep.WAIT_TIME, "100"), step("&kp", "B")), List.of());
        assertEquals(List.of("tap a", "delay 100", "tap b"), fragment.script());
        assertEquals("(macro a 100 b)", fragment.definition());
    }

    @Test
    void negativeWaitTimeIsRejectedAndReported() {
        KanataFragment fragment = transformer.transform(macro(Optional.empty(), Optional.empty(),
            step(MacroStep.WAIT_TIME, "-5"), step("&kp", "A")), List.of());

        assertEquals(List.of(";; TODO: rejected &macro_wait_time -5", "tap a"), fragment.script());
        assertEquals(1, errors.errors().size());
        assertEquals(ErrorKind.TIMING_VALIDATION, errors.errors().get(0).kind());
    }

    @Test
    void unsupportedStepsStayAsComments() {
        KanataFragment fragment = transformer.transform(macro(Optional.empty(), Optional.empty(),
            step("&bt", "BT_CLR"), step("&kp", "A")), List.of());

        assertEquals(";; TODO: unsupported macro step &bt BT_CLR", fragment.script().get(0));
        assertEquals("(macro a)", fragment.definition());
        assertEquals(1, fragment.notes().size());
        assertEquals(ErrorKind.UNSUPPORTED_FEATURE, errors.errors().get(0).kind());
    }

    @Test
    void forwardsBindingParameter() {
        Macro oneParam = new Macro("type_it", 1, 1, Optional.empty(), Optional.empty(), List.of(
            step(MacroStep.PARAM_1TO1), step("&kp", "MACRO_PLACEHOLDER")));

        KanataFragment fragment = transformer.transform(oneParam, List.of(new KeyName("B")));
        assertEquals(List.of("tap b"), fragment.script());
        assertEquals("type_it_b", fragment.name());
    }

    @Test
    void emptyMacroRendersAsNoOp() {
        KanataFragment fragment = transformer.transform(macro(Optional.empty(), Optional.empty()), List.of());
        assertEquals("XX", fragment.definition());
        assertEquals(List.of(";; empty macro"), fragment.script());
    }
}
