package work.keymap.zmk2kanata.transform;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import work.keymap.zmk2kanata.keys.KeyParam;
import work.keymap.zmk2kanata.model.LayerSwitchKind;

/**
 * {@code &mo}, {@code &to}, {@code &tog} render inline; {@code &lt} becomes a tap-hold alias.
 */
public final class LayerTransformer {
    private final TransformContext context;

    public LayerTransformer(TransformContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    public Optional<String> inline(LayerSwitchKind kind, KeyParam layer, String owner) {
        return context.layerAction(kind, layer, owner);
    }

    /**
     * ZMK's {@code &lt} is tap-preferred.
     */
    public Optional<KanataFragment> layerTap(KeyParam layer, KeyParam key, String owner) {
        return context.layerAction(LayerSwitchKind.MOMENTARY, layer, owner).map(hold -> KanataFragment.alias(
            AliasNames.aliasName("lt", List.of(layer, key)),
            "(tap-hold " + TransformContext.TAP_TIME_VAR + " " + TransformContext.HOLD_TIME_VAR + " "
                + context.key(key, owner) + " " + hold + ")",
            List.of()));
    }
}
