package work.keymap.zmk2kanata.transform;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import work.keymap.zmk2kanata.error.ErrorKind;
import work.keymap.zmk2kanata.keys.KeyParam;
import work.keymap.zmk2kanata.model.StickyKey;

/**
 * Sticky keys to Kanata one-shots: {@code (one-shot-release R key)}, or {@code one-shot-press}
 * when {@code quick-release} is set. R defaults to ZMK's 1000 ms. {@code ignore-modifiers} is left as a
 * note.
 */
public final class StickyKeyTransformer {
    public static final int DEFAULT_RELEASE_AFTER_MS = 1000;

    private final TransformContext context;
    private final Set<String> reported = new HashSet<>();

    public StickyKeyTransformer(TransformContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    public KanataFragment transform(StickyKey behavior, List<KeyParam> params) {
        String owner = "sticky key " + behavior.name();
        String inner = behavior.bindings().isEmpty() ? "&kp" : behavior.bindings().get(0);
        String action = context.innerAction(inner, params.get(0), owner);
        int releaseAfter = behavior.releaseAfterMs().orElse(DEFAULT_RELEASE_AFTER_MS);
        String form = behavior.quickRelease() ? "one-shot-press" : "one-shot-release";
        List<String> notes = new ArrayList<>();
        if (behavior.ignoreModifiers()) {
            notes.add(";; TODO: ignore-modifiers on " + behavior.name() + " has no Kanata equivalent");
            if (reported.add(behavior.name())) {
                context.warn(ErrorKind.UNSUPPORTED_FEATURE,
                    "ignore-modifiers on " + behavior.name() + " not translated", owner);
            }
        }
        return KanataFragment.alias(AliasNames.aliasName(behavior.name(), params),
            "(" + form + " " + releaseAfter + " " + action + ")", notes);
    }

    public KanataFragment stickyKey(KeyParam key) {
        return KanataFragment.alias(AliasNames.aliasName("sk", List.of(key)),
            "(one-shot-release " + DEFAULT_RELEASE_AFTER_MS + " " + context.key(key, "&sk") + ")", List.of());
    }
}
