package work.keymap.zmk2kanata.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import work.keymap.zmk2kanata.error.ErrorKind;
import work.keymap.zmk2kanata.model.Binding;
import work.keymap.zmk2kanata.model.BuiltinBehavior;
import work.keymap.zmk2kanata.model.BehaviorRef;
import work.keymap.zmk2kanata.model.Combo;
import work.keymap.zmk2kanata.model.Layer;

/**
 * Combos to {@code defchordsv2-experimental} entries:
 * {@code (keys...) action timeout all-released (disabled-layers...)}.
 *
 * <p>Chord keys are the base layer's plain keys at the combo positions. A combo without
 * positions or bindings, or whose positions are not plain keys, is skipped with a warning.
 */
public final class ComboTransformer {
    public static final int DEFAULT_TIMEOUT_MS = 50;

    private final TransformContext context;
    private final BiFunction<Binding, String, String> renderer;

    public ComboTransformer(TransformContext context, BiFunction<Binding, String, String> renderer) {
        this.context = Objects.requireNonNull(context, "context");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    public Optional<String> transform(Combo combo) {
        String owner = "combo " + combo.name();
        if (combo.keyPositions().isEmpty() || combo.bindings().isEmpty()) {
            skip(combo, combo.keyPositions().isEmpty() ? "no key-positions" : "no bindings");
            return Optional.empty();
        }
        Optional<Layer> base = context.config().layers().stream().findFirst();
        if (base.isEmpty()) {
            skip(combo, "no base layer");
            return Optional.empty();
        }
        List<String> keys = new ArrayList<>();
        for (int position : combo.keyPositions()) {
            List<Binding> bindings = base.get().bindings();
            if (position < 0 || position >= bindings.size()) {
                skip(combo, "key position " + position + " is outside the base layer");
                return Optional.empty();
            }
            Binding binding = bindings.get(position);
            boolean plainKey = binding.ref() instanceof BehaviorRef.Builtin builtin
                && builtin.builtin() == BuiltinBehavior.KP && !binding.params().isEmpty();
            if (!plainKey) {
                skip(combo, "key position " + position + " is not a plain key (" + binding.source() + ")");
                return Optional.empty();
            }
            keys.add(context.resolver().toKanata(binding.params().get(0)));
        }
        String action = renderer.apply(combo.bindings().get(0), owner);
        int timeout = combo.timeoutMs().orElse(DEFAULT_TIMEOUT_MS);
        return Optional.of("(" + String.join(" ", keys) + ") " + action + " " + timeout
            + " all-released (" + String.join(" ", disabledLayers(combo)) + ")");
    }

    private List<String> disabledLayers(Combo combo) {
        List<String> disabled = new ArrayList<>();
        if (combo.layers().isEmpty()) {
            return disabled;
        }
        for (Layer layer : context.config().layers()) {
            if (!combo.layers().contains(layer.index())) {
                disabled.add(layer.name());
            }
        }
        return disabled;
    }

    private void skip(Combo combo, String reason) {
        context.errors().warning(TransformContext.SOURCE, ErrorKind.EXTRACTION_ERROR,
            "Combo " + combo.name() + " skipped: " + reason,
            Map.of("combo", combo.name(), "line", combo.line()));
    }
}
