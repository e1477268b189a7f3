package work.keymap.zmk2kanata.transform;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.keymap.zmk2kanata.error.ErrorKind;
import work.keymap.zmk2kanata.error.ErrorManager;
import work.keymap.zmk2kanata.keys.KeyName;
import work.keymap.zmk2kanata.keys.KeyParam;
import work.keymap.zmk2kanata.keys.KeycodeMap;
import work.keymap.zmk2kanata.keys.MalformedKey;
import work.keymap.zmk2kanata.keys.ModifierExpression;
import work.keymap.zmk2kanata.keys.ModifierResolver;
import work.keymap.zmk2kanata.keys.ModifierStyle;
import work.keymap.zmk2kanata.model.Behavior;
import work.keymap.zmk2kanata.model.BuiltinBehavior;
import work.keymap.zmk2kanata.model.GlobalSettings;
import work.keymap.zmk2kanata.model.KeymapConfig;
import work.keymap.zmk2kanata.model.LayerSwitch;
import work.keymap.zmk2kanata.model.LayerSwitchKind;

/**
 * Shared state of one transform pass: the extracted keymap, the modifier convention and the
 * run's error manager.
 */
public final class TransformContext {
    static final String SOURCE = "transformer";
    static final String TAP_TIME_VAR = "$tap-time";
    static final String HOLD_TIME_VAR = "$hold-time";

    private final KeymapConfig config;
    private final ModifierResolver resolver;
    private final ErrorManager errors;

    public TransformContext(KeymapConfig config, ModifierStyle style, ErrorManager errors) {
        this.config = Objects.requireNonNull(config, "config");
        this.resolver = new ModifierResolver(style);
        this.errors = Objects.requireNonNull(errors, "errors");
    }

    public KeymapConfig config() {
        return config;
    }

    public GlobalSettings globalSettings() {
        return config.globalSettings();
    }

    public ModifierResolver resolver() {
        return resolver;
    }

    public ErrorManager errors() {
        return errors;
    }

    /**
     * Kanata text for a key parameter. Unknown keycodes pass through lower-cased with a warning.
     */
    public String key(KeyParam param, String owner) {
        if (!(param instanceof MalformedKey)) {
            unknownKey(param).ifPresent(raw -> warn(ErrorKind.BINDING_RESOLUTION,
                "Unknown keycode " + raw + " in " + owner + " passed through as " + resolver.keyName(raw), owner));
        }
        return resolver.toKanata(param);
    }

    /**
     * Name of the layer a parameter points to (ZMK layer index).
     */
    public Optional<String> layerName(KeyParam param, String owner) {
        Optional<Integer> index = Optional.empty();
        if (param instanceof KeyName name) {
            try {
                index = Optional.of(Integer.parseInt(name.raw().trim()));
            } catch (NumberFormatException ex) {
                // a layer name macro the preprocessor did not expand
                if (config.layers().stream().anyMatch(layer -> layer.name().equals(name.raw()))) {
                    return Optional.of(name.raw());
                }
            }
        }
        Optional<String> layer = index.flatMap(config::layer).map(l -> l.name());
        if (layer.isEmpty()) {
            warn(ErrorKind.BINDING_RESOLUTION, "No layer " + param.raw() + " for " + owner, owner);
        }
        return layer;
    }

    /**
     * Layer action for a momentary/to/toggle switch.
     */
    public Optional<String> layerAction(LayerSwitchKind kind, KeyParam param, String owner) {
        return layerName(param, owner).map(name -> "(" + layerVerb(kind) + " " + name + ")");
    }

    static String layerVerb(LayerSwitchKind kind) {
        switch (kind) {
            case TO:
                return "layer-switch";
            case TOGGLE:
                return "layer-toggle";
            default:
                return "layer-while-held";
        }
    }

    /**
     * Renders one of the single-parameter bindings a hold-tap or sticky key wraps
     * ({@code &kp}, {@code &mo}, ...).
     */
    public String innerAction(String reference, KeyParam param, String owner) {
        Optional<BuiltinBehavior> builtin = BuiltinBehavior.from(reference);
        if (builtin.isPresent()) {
            switch (builtin.get()) {
                case KP:
                    return key(param, owner);
                case MO:
                    return layerAction(LayerSwitchKind.MOMENTARY, param, owner).orElse(placeholder(reference + " " + param.raw()));
                case TO:
                    return layerAction(LayerSwitchKind.TO, param, owner).orElse(placeholder(reference + " " + param.raw()));
                case TOG:
                    return layerAction(LayerSwitchKind.TOGGLE, param, owner).orElse(placeholder(reference + " " + param.raw()));
                case TRANS:
                    return "_";
                case NONE:
                    return "XX";
                default:
                    break;
            }
        }
        Optional<Behavior> declared = config.behavior(reference);
        if (declared.isPresent() && declared.get() instanceof LayerSwitch layerSwitch) {
            return layerAction(layerSwitch.kind(), param, owner).orElse(placeholder(reference + " " + param.raw()));
        }
        warn(ErrorKind.BINDING_RESOLUTION, "Cannot nest " + reference + " inside " + owner, owner);
        return placeholder(reference + " " + param.raw());
    }

    void warn(ErrorKind kind, String message, String owner) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("owner", owner);
        errors.warning(SOURCE, kind, message, context);
    }

    /**
     * No-op key followed by a block comment naming what could not be translated.
     */
    public static String placeholder(String what) {
        return "XX #| " + what.replace("|#", "| #") + " |#";
    }

    static String timing(Optional<Integer> explicit, String variable) {
        return explicit.map(String::valueOf).orElse(variable);
    }

    private Optional<String> unknownKey(KeyParam param) {
        KeyParam current = param;
        while (current instanceof ModifierExpression expression) {
            current = expression.args().get(0);
        }
        if (current instanceof KeyName name && !KeycodeMap.isKnown(name.raw())) {
            return Optional.of(name.raw());
        }
        return Optional.empty();
    }
}
