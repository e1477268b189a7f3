package work.keymap.zmk2kanata.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.BiFunction;
import work.keymap.zmk2kanata.model.Binding;
import work.keymap.zmk2kanata.model.TapDance;

/**
 * {@code (tap-dance T (a1 a2 ...))}; each action is rendered like a layer binding, so nested
 * hold-taps become alias references.
 */
public final class TapDanceTransformer {
    private final BiFunction<Binding, String, String> renderer;

    public TapDanceTransformer(BiFunction<Binding, String, String> renderer) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    public KanataFragment transform(TapDance behavior) {
        String owner = "tap-dance " + behavior.name();
        List<String> actions = new ArrayList<>();
        for (Binding binding : behavior.bindings()) {
            actions.add(renderer.apply(binding, owner));
        }
        String timeout = TransformContext.timing(behavior.tappingTermMs(), TransformContext.TAP_TIME_VAR);
        List<String> notes = new ArrayList<>();
        if (actions.isEmpty()) {
            notes.add(";; TODO: tap-dance " + behavior.name() + " has no bindings");
            actions.add("XX");
        }
        return KanataFragment.alias(AliasNames.aliasName(behavior.name(), List.of()),
            "(tap-dance " + timeout + " (" + String.join(" ", actions) + "))", notes);
    }
}
