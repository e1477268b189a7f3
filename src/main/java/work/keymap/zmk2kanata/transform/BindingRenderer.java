package work.keymap.zmk2kanata.transform;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import work.keymap.zmk2kanata.error.ErrorKind;
import work.keymap.zmk2kanata.keys.KeyName;
import work.keymap.zmk2kanata.keys.KeyParam;
import work.keymap.zmk2kanata.model.Behavior;
import work.keymap.zmk2kanata.model.BehaviorRef;
import work.keymap.zmk2kanata.model.Binding;
import work.keymap.zmk2kanata.model.BuiltinBehavior;
import work.keymap.zmk2kanata.model.Combo;
import work.keymap.zmk2kanata.model.HoldTap;
import work.keymap.zmk2kanata.model.LayerSwitch;
import work.keymap.zmk2kanata.model.LayerSwitchKind;
import work.keymap.zmk2kanata.model.Macro;
import work.keymap.zmk2kanata.model.StickyKey;
import work.keymap.zmk2kanata.model.TapDance;

/**
 * Renders one binding to the text placed in a {@code deflayer} row.
 *
 * <p>Plain keys, transparency and layer switches render inline. Hold-taps, macros, sticky keys
 * and tap-dances are registered in the {@link AliasRegistry} and referenced as {@code @name}.
 * Placeholders render as {@code XX} followed by a block comment.
 */
public final class BindingRenderer {
    private final TransformContext context;
    private final AliasRegistry aliases;
    private final HoldTapTransformer holdTaps;
    private final MacroTransformer macros;
    private final StickyKeyTransformer stickyKeys;
    private final LayerTransformer layers;
    private final TapDanceTransformer tapDances;
    private final ComboTransformer combos;
    private final Set<String> renderedMacros = new HashSet<>();

    public BindingRenderer(TransformContext context, AliasRegistry aliases) {
        this.context = Objects.requireNonNull(context, "context");
        this.aliases = Objects.requireNonNull(aliases, "aliases");
        this.holdTaps = new HoldTapTransformer(context);
        this.macros = new MacroTransformer(context);
        this.stickyKeys = new StickyKeyTransformer(context);
        this.layers = new LayerTransformer(context);
        this.tapDances = new TapDanceTransformer(this::render);
        this.combos = new ComboTransformer(context, this::render);
    }

    public String render(Binding binding, String owner) {
        BehaviorRef ref = binding.ref();
        if (ref instanceof BehaviorRef.Unknown) {
            return TransformContext.placeholder(binding.source());
        }
        if (ref instanceof BehaviorRef.Builtin builtin) {
            return renderBuiltin(builtin.builtin(), binding, owner);
        }
        return renderDeclared(((BehaviorRef.Resolved) ref).behavior(), binding, owner);
    }

    /**
     * Registers a declared macro that no binding used, so its definition still reaches the output.
     */
    public void registerUnreferenced(Macro macro) {
        if (renderedMacros.add(macro.name())) {
            aliases.register(macros.transform(macro, List.of()));
        }
    }

    public ComboTransformer combos() {
        return combos;
    }

    private String renderBuiltin(BuiltinBehavior builtin, Binding binding, String owner) {
        List<KeyParam> params = binding.params();
        switch (builtin) {
            case KP:
                return context.key(params.get(0), owner);
            case TRANS:
                return "_";
            case NONE:
                return "XX";
            case MO:
                return inlineLayer(layers.inline(LayerSwitchKind.MOMENTARY, params.get(0), owner), binding);
            case TO:
                return inlineLayer(layers.inline(LayerSwitchKind.TO, params.get(0), owner), binding);
            case TOG:
                return inlineLayer(layers.inline(LayerSwitchKind.TOGGLE, params.get(0), owner), binding);
            case MT:
                return reference(holdTaps.modTap(params.get(0), params.get(1)));
            case LT: {
                Optional<KanataFragment> fragment = layers.layerTap(params.get(0), params.get(1), owner);
                return fragment.map(this::reference).orElse(TransformContext.placeholder(binding.source()));
            }
            case SK:
                return reference(stickyKeys.stickyKey(params.get(0)));
            default:
                return TransformContext.placeholder(binding.source());
        }
    }

    private String renderDeclared(Behavior behavior, Binding binding, String owner) {
        List<KeyParam> params = binding.params();
        if (behavior instanceof HoldTap holdTap) {
            if (params.size() < 2) {
                return mismatch(behavior, binding, owner, 2);
            }
            return reference(holdTaps.transform(holdTap, params));
        }
        if (behavior instanceof Macro macro) {
            renderedMacros.add(macro.name());
            return reference(macros.transform(macro, params));
        }
        if (behavior instanceof StickyKey stickyKey) {
            if (params.isEmpty()) {
                return mismatch(behavior, binding, owner, 1);
            }
            return reference(stickyKeys.transform(stickyKey, params));
        }
        if (behavior instanceof LayerSwitch layerSwitch) {
            if (params.isEmpty() && layerSwitch.layerRef().isEmpty()) {
                return mismatch(behavior, binding, owner, 1);
            }
            KeyParam layer = params.isEmpty()
                ? new KeyName(layerSwitch.layerRef().get())
                : params.get(0);
            return inlineLayer(layers.inline(layerSwitch.kind(), layer, owner), binding);
        }
        if (behavior instanceof TapDance tapDance) {
            return reference(tapDances.transform(tapDance));
        }
        Combo combo = (Combo) behavior;
        context.warn(ErrorKind.BINDING_RESOLUTION, "Combo " + combo.name() + " cannot be bound to a key in " + owner, owner);
        return TransformContext.placeholder(binding.source());
    }

    private String mismatch(Behavior behavior, Binding binding, String owner, int needed) {
        context.warn(ErrorKind.BINDING_RESOLUTION,
            behavior.name() + " needs " + needed + " parameter(s) but declares #binding-cells = "
                + behavior.bindingCells() + " in " + owner, owner);
        return TransformContext.placeholder(binding.source());
    }

    private String reference(KanataFragment fragment) {
        return "@" + aliases.reference(fragment);
    }

    private static String inlineLayer(Optional<String> action, Binding binding) {
        return action.orElse(TransformContext.placeholder(binding.source()));
    }
}
