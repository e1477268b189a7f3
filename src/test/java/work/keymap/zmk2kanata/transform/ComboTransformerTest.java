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
import work.keymap.zmk2kanata.model.BehaviorRef;
import work.keymap.zmk2kanata.model.Binding;
import work.keymap.zmk2kanata.model.BuiltinBehavior;
import work.keymap.zmk2kanata.model.Combo;
import work.keymap.zmk2kanata.model.GlobalSettings;
import work.keymap.zmk2kanata.model.KeymapConfig;
import work.keymap.zmk2kanata.model.Layer;

class ComboTransformerTest {
    private final ErrorManager errors = new ErrorManager();

    private static Binding kp(String key) {
        return new Binding(new BehaviorRef.Builtin(BuiltinBehavior.KP), List.of(new KeyName(key)), 1, "&kp " + key);
    }

    private ComboTransformer transformer(List<Layer> layers) {
        KeymapConfig config = new KeymapConfig(layers, Map.of(), GlobalSettings.DEFAULTS, List.of(), List.of());
        return new ComboTransformer(new TransformContext(config, ModifierStyle.PC, errors), (binding, owner) -> "esc");
    }

    private static Combo combo(List<Integer> positions, Optional<Integer> timeout, List<Integer> layers) {
        return new Combo("combo_esc", 3, positions, timeout, List.of(kp("ESC")), layers);
    }

    @Test
    void chordsUseBaseLayerKeys() {
        ComboTransformer transformer = transformer(List.of(new Layer("base", 0, List.of(kp("Q"), kp("W")))));
        assertEquals(Optional.of("(q w) esc 50 all-released ()"),
            transformer.transform(combo(List.of(0, 1), Optional.empty(), List.of())));
    }

    @Test
    void restrictedCombosDisableOtherLayers() {
        ComboTransformer transformer = transformer(List.of(
            new Layer("base", 0, List.of(kp("Q"), kp("W"))),
            new Layer("nav", 1, List.of(kp("A"), kp("B")))));
        assertEquals(Optional.of("(q w) esc 30 all-released (nav)"),
            transformer.transform(combo(List.of(0, 1), Optional.of(30), List.of(0))));
    }

    @Test
    void positionOutsideBaseLayerIsSkipped() {
        ComboTransformer transformer = transformer(List.of(new Layer("base", 0, List.of(kp("Q")))));
        assertTrue(transformer.transform(combo(List.of(0, 7), Optional.empty(), List.of())).isEmpty());
        assertEquals(ErrorKind.EXTRACTION_ERROR, errors.errors().get(0).kind());
    }

    @Test
    void comboWithoutBaseLayerIsSkipped() {
        assertTrue(transformer(List.of()).transform(combo(List.of(0), Optional.empty(), List.of())).isEmpty());
        assertEquals(1, errors.errors().size());
    }
}
