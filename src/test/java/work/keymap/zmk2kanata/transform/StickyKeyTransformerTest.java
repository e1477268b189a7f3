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
import work.keymap.zmk2kanata.model.StickyKey;

class StickyKeyTransformerTest {
    private final KeymapConfig config = new KeymapConfig(List.of(), Map.of(), GlobalSettings.DEFAULTS, List.of(), List.of());
    private final ErrorManager errors = new ErrorManager();
    private final StickyKeyTransformer transformer =
        new StickyKeyTransformer(new TransformContext(config, ModifierStyle.PC, errors));

    @Test
    void releasesAfterDefaultTimeout() {
        StickyKey sticky = new StickyKey("sticky", 1, 1, Optional.empty(), false, false, List.of("&kp"));
        KanataFragment fragment = transformer.transform(sticky, List.of(new KeyName("LSHIFT")));
        assertEquals("sticky_lshift", fragment.name());
        assertEquals("(one-shot-release 1000 lsft)", fragment.definition());
    }

    @Test
    void quickReleaseUsesOneShotPress() {
        StickyKey sticky = new StickyKey("sticky", 1, 1, Optional.of(500), true, false, List.of("&kp"));
        KanataFragment fragment = transformer.transform(sticky, List.of(new KeyName("LSHIFT")));
        assertEquals("(one-shot-press 500 lsft)", fragment.definition());
    }

    @Test
    void builtinStickyKey() {
        KanataFragment fragment = transformer.stickyKey(new KeyName("LCTRL"));
        assertEquals("sk_lctrl", fragment.name());
        assertEquals("(one-shot-release 1000 lctl)", fragment.definition());
    }

    @Test
    void ignoreModifiersIsKeptAsNote() {
        StickyKey sticky = new StickyKey("skm", 1, 7, Optional.empty(), false, true, List.of("&kp"));
        KanataFragment fragment = transformer.transform(sticky, List.of(new KeyName("LSHIFT")));
        transformer.transform(sticky, List.of(new KeyName("LCTRL")));

        assertEquals("(one-shot-release 1000 lsft)", fragment.definition());
        assertEquals(List.of(";; TODO: ignore-modifiers on skm has no Kanata equivalent"), fragment.notes());
        assertEquals(1, errors.errors().size());
        assertEquals(ErrorKind.UNSUPPORTED_FEATURE, errors.errors().get(0).kind());
    }

    @Test
    void plainStickyKeyHasNoNotes() {
        StickyKey sticky = new StickyKey("sticky", 1, 1, Optional.empty(), false, false, List.of("&kp"));
        assertTrue(transformer.transform(sticky, List.of(new KeyName("LSHIFT"))).notes().isEmpty());
        assertTrue(errors.errors().isEmpty());
    }
}
