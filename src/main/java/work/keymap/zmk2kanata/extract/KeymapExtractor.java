package work.keymap.zmk2kanata.extract;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.keymap.zmk2kanata.dts.DtsNode;
import work.keymap.zmk2kanata.dts.DtsProperty;
import work.keymap.zmk2kanata.dts.DtsRoot;
import work.keymap.zmk2kanata.error.ErrorKind;
import work.keymap.zmk2kanata.error.ErrorManager;
import work.keymap.zmk2kanata.model.Behavior;
import work.keymap.zmk2kanata.model.Binding;
import work.keymap.zmk2kanata.model.Combo;
import work.keymap.zmk2kanata.model.ConditionalLayer;
import work.keymap.zmk2kanata.model.Flavor;
import work.keymap.zmk2kanata.model.GlobalSettings;
import work.keymap.zmk2kanata.model.HoldTap;
import work.keymap.zmk2kanata.model.KeymapConfig;
import work.keymap.zmk2kanata.model.Layer;
import work.keymap.zmk2kanata.model.LayerSwitch;
import work.keymap.zmk2kanata.model.LayerSwitchKind;
import work.keymap.zmk2kanata.model.Macro;
import work.keymap.zmk2kanata.model.MacroStep;
import work.keymap.zmk2kanata.model.StickyKey;
import work.keymap.zmk2kanata.model.TapDance;

/**
 * Builds the {@link KeymapConfig} from a parsed devicetree.
 *
 * <p>Behaviors are the children of nodes named {@code behaviors} or {@code macros}, classified by
 * their {@code compatible}. Every direct child of the {@code keymap} node is a layer; layer indices
 * count all of those children, so a skipped layer keeps its slot. Anything that cannot be extracted
 * is reported and skipped individually.
 */
public final class KeymapExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(KeymapExtractor.class);
    private static final String SOURCE = "extractor";

    static final String HOLD_TAP = "zmk,behavior-hold-tap";
    static final String MACRO = "zmk,behavior-macro";
    static final String MACRO_ONE_PARAM = "zmk,behavior-macro-one-param";
    static final String MACRO_TWO_PARAM = "zmk,behavior-macro-two-param";
    static final String STICKY_KEY = "zmk,behavior-sticky-key";
    static final String TAP_DANCE = "zmk,behavior-tap-dance";
    static final String MOMENTARY_LAYER = "zmk,behavior-momentary-layer";
    static final String TO_LAYER = "zmk,behavior-to-layer";
    static final String TOGGLE_LAYER = "zmk,behavior-toggle-layer";

    private final ErrorManager errors;
    private final TimingValidator timings;

    public KeymapExtractor(ErrorManager errors) {
        this.errors = Objects.requireNonNull(errors, "errors");
        this.timings = new TimingValidator(errors, SOURCE);
    }

    public KeymapConfig extract(DtsRoot root) {
        Objects.requireNonNull(root, "root");
        GlobalSettings settings = globalSettings(root);

        Map<String, Behavior> behaviors = new LinkedHashMap<>();
        List<DtsNode> tapDances = new ArrayList<>();
        for (DtsNode container : root.descendants()) {
            if (!"behaviors".equals(container.name()) && !"macros".equals(container.name())) {
                continue;
            }
            for (DtsNode node : container.children()) {
                if (TAP_DANCE.equals(node.stringProperty("compatible").orElse(null))) {
                    tapDances.add(node);
                    continue;
                }
                behavior(node).ifPresent(behavior -> register(behaviors, behavior));
            }
        }
        // tap-dances bind other behaviors, so they are parsed once the rest is known
        BindingParser bindings = new BindingParser(errors, behaviors);
        for (DtsNode node : tapDances) {
            tapDance(node, bindings).ifPresent(behavior -> register(behaviors, behavior));
        }

        List<Combo> combos = combos(root, bindings);
        List<ConditionalLayer> conditionalLayers = conditionalLayers(root);
        List<Layer> layers = layers(root, bindings);
        LOG.debug("Extracted {} layers, {} behaviors, {} combos", layers.size(), behaviors.size(), combos.size());
        return new KeymapConfig(layers, behaviors, settings, combos, conditionalLayers);
    }

    GlobalSettings globalSettings(DtsRoot root) {
        int tap = GlobalSettings.DEFAULT_TAP_TIME_MS;
        int hold = GlobalSettings.DEFAULT_HOLD_TIME_MS;
        List<DtsNode> sources = new ArrayList<>();
        sources.add(root);
        root.child("global").ifPresent(sources::add);
        for (DtsNode node : sources) {
            tap = timings.validate("global settings", "tap-time", timing(node, "tap-time")).orElse(tap);
            hold = timings.validate("global settings", "hold-time", timing(node, "hold-time")).orElse(hold);
        }
        return new GlobalSettings(tap, hold);
    }

    private Optional<Behavior> behavior(DtsNode node) {
        String name = node.label().orElse(node.name());
        Optional<String> compatible = node.stringProperty("compatible");
        if (compatible.isEmpty()) {
            skip(node, "compatible", "Behavior " + name + " has no compatible property, skipped");
            return Optional.empty();
        }
        String owner = "behavior " + name;
        switch (compatible.get()) {
            case HOLD_TAP:
                return holdTap(node, name, owner);
            case MACRO:
                return macro(node, name, owner, 0);
            case MACRO_ONE_PARAM:
                return macro(node, name, owner, 1);
            case MACRO_TWO_PARAM:
                return macro(node, name, owner, 2);
            case STICKY_KEY:
                return stickyKey(node, name, owner);
            case MOMENTARY_LAYER:
                return Optional.of(layerSwitch(node, name, LayerSwitchKind.MOMENTARY));
            case TO_LAYER:
                return Optional.of(layerSwitch(node, name, LayerSwitchKind.TO));
            case TOGGLE_LAYER:
                return Optional.of(layerSwitch(node, name, LayerSwitchKind.TOGGLE));
            default:
                skip(node, "compatible", "Unsupported compatible '" + compatible.get() + "' on behavior " + name + ", skipped");
                return Optional.empty();
        }
    }

    private Optional<Behavior> holdTap(DtsNode node, String name, String owner) {
        Optional<DtsProperty> bindings = node.property("bindings");
        if (bindings.isEmpty()) {
            skip(node, "bindings", "Hold-tap " + name + " has no bindings, skipped");
            return Optional.empty();
        }
        Optional<Flavor> flavor = Optional.empty();
        Optional<String> flavorText = node.stringProperty("flavor");
        if (flavorText.isPresent()) {
            flavor = Flavor.from(flavorText.get());
            if (flavor.isEmpty()) {
                errors.warning(SOURCE, ErrorKind.EXTRACTION_ERROR,
                    "Unknown flavor '" + flavorText.get() + "' on " + owner + ", using the default",
                    Map.of("node", node.path(), "property", "flavor"));
            }
        }
        List<Integer> positions = integers(node, "hold-trigger-key-positions");
        return Optional.of(new HoldTap(
            name,
            bindingCells(node, 2),
            node.line(),
            timings.validate(owner, "tapping-term-ms", timing(node, "tapping-term-ms")),
            timings.validate(owner, "hold-time-ms", timing(node, "hold-time-ms")),
            timings.validate(owner, "quick-tap-ms", timing(node, "quick-tap-ms")),
            timings.validate(owner, "require-prior-idle-ms", timing(node, "require-prior-idle-ms")),
            flavor,
            positions,
            node.hasFlag("hold-trigger-on-release"),
            node.hasFlag("retro-tap"),
            references(bindings.get())));
    }

    private Optional<Behavior> macro(DtsNode node, String name, String owner, int defaultCells) {
        Optional<DtsProperty> bindings = node.property("bindings");
        if (bindings.isEmpty()) {
            skip(node, "bindings", "Macro " + name + " has no bindings, skipped");
            return Optional.empty();
        }
        List<MacroStep> steps = new ArrayList<>();
        List<Object> cells = bindings.get().cells();
        int i = 0;
        while (i < cells.size()) {
            Object cell = cells.get(i);
            int line = bindings.get().cellLine(i);
            i++;
            if (!BindingParser.isReference(cell)) {
                errors.warning(SOURCE, ErrorKind.EXTRACTION_ERROR,
                    "Ignored macro token '" + BindingParser.cellText(cell) + "' without a behavior in " + owner,
                    Map.of("node", node.path(), "line", line));
                continue;
            }
            List<String> params = new ArrayList<>();
            while (i < cells.size() && !BindingParser.isReference(cells.get(i))) {
                params.add(BindingParser.cellText(cells.get(i)));
                i++;
            }
            steps.add(new MacroStep(String.valueOf(cell), params, line));
        }
        return Optional.of(new Macro(
            name,
            bindingCells(node, defaultCells),
            node.line(),
            timings.validate(owner, "wait-ms", timing(node, "wait-ms")),
            timings.validate(owner, "tap-ms", timing(node, "tap-ms")),
            steps));
    }

    private Optional<Behavior> stickyKey(DtsNode node, String name, String owner) {
        Optional<DtsProperty> bindings = node.property("bindings");
        if (bindings.isEmpty()) {
            skip(node, "bindings", "Sticky key " + name + " has no bindings, skipped");
            return Optional.empty();
        }
        return Optional.of(new StickyKey(
            name,
            bindingCells(node, 1),
            node.line(),
            timings.validate(owner, "release-after-ms", timing(node, "release-after-ms")),
            node.hasFlag("quick-release"),
            node.hasFlag("ignore-modifiers"),
            references(bindings.get())));
    }

    private LayerSwitch layerSwitch(DtsNode node, String name, LayerSwitchKind kind) {
        Optional<String> layer = node.stringProperty("layer").or(() -> node.integerProperty("layer").map(String::valueOf));
        return new LayerSwitch(name, bindingCells(node, 1), node.line(), kind, layer);
    }

    private Optional<Behavior> tapDance(DtsNode node, BindingParser parser) {
        String name = node.label().orElse(node.name());
        Optional<DtsProperty> bindings = node.property("bindings");
        if (bindings.isEmpty()) {
            skip(node, "bindings", "Tap-dance " + name + " has no bindings, skipped");
            return Optional.empty();
        }
        String owner = "behavior " + name;
        return Optional.of(new TapDance(
            name,
            bindingCells(node, 0),
            node.line(),
            timings.validate(owner, "tapping-term-ms", timing(node, "tapping-term-ms")),
            parser.parse(bindings.get(), owner)));
    }

    private List<Combo> combos(DtsRoot root, BindingParser parser) {
        List<Combo> combos = new ArrayList<>();
        for (DtsNode container : root.descendants()) {
            if (!"combos".equals(container.name())) {
                continue;
            }
            for (DtsNode node : container.children()) {
                String owner = "combo " + node.name();
                List<Binding> bindings = node.property("bindings")
                    .map(property -> parser.parse(property, owner))
                    .orElse(List.of());
                combos.add(new Combo(
                    node.name(),
                    node.line(),
                    integers(node, "key-positions"),
                    timings.validate(owner, "timeout-ms", timing(node, "timeout-ms")),
                    bindings,
                    integers(node, "layers")));
            }
        }
        return combos;
    }

    private List<ConditionalLayer> conditionalLayers(DtsRoot root) {
        List<ConditionalLayer> result = new ArrayList<>();
        for (DtsNode container : root.descendants()) {
            boolean matches = "conditional_layers".equals(container.name())
                || "zmk,conditional-layers".equals(container.stringProperty("compatible").orElse(null));
            if (!matches) {
                continue;
            }
            for (DtsNode node : container.children()) {
                Optional<Integer> then = node.integerProperty("then-layer");
                List<Integer> ifLayers = integers(node, "if-layers");
                if (then.isEmpty() || ifLayers.isEmpty()) {
                    skip(node, then.isEmpty() ? "then-layer" : "if-layers",
                        "Conditional layer " + node.name() + " needs if-layers and then-layer, skipped");
                    continue;
                }
                result.add(new ConditionalLayer(node.name(), ifLayers, then.get(), node.line()));
            }
        }
        return result;
    }

    private List<Layer> layers(DtsRoot root, BindingParser parser) {
        Optional<DtsNode> keymap = root.descendants().stream()
            .filter(node -> "keymap".equals(node.name())
                || "zmk,keymap".equals(node.stringProperty("compatible").orElse(null)))
            .findFirst();
        if (keymap.isEmpty()) {
            errors.warning(SOURCE, ErrorKind.EXTRACTION_ERROR, "No keymap node found, no layers extracted", Map.of());
            return List.of();
        }
        List<Layer> layers = new ArrayList<>();
        int index = 0;
        for (DtsNode node : keymap.get().children()) {
            int layerIndex = index++;
            Optional<DtsProperty> bindings = node.property("bindings");
            if (bindings.isEmpty()) {
                skip(node, "bindings", "Layer " + node.name() + " has no bindings, skipped");
                continue;
            }
            layers.add(new Layer(node.name(), layerIndex, parser.parse(bindings.get(), "layer " + node.name())));
        }
        return layers;
    }

    private void register(Map<String, Behavior> behaviors, Behavior behavior) {
        Behavior previous = behaviors.put(behavior.name(), behavior);
        if (previous != null) {
            errors.warning(SOURCE, ErrorKind.EXTRACTION_ERROR,
                "Behavior " + behavior.name() + " declared twice, line " + behavior.line() + " wins",
                Map.of("behavior", behavior.name()));
        }
    }

    private void skip(DtsNode node, String property, String message) {
        errors.warning(SOURCE, ErrorKind.EXTRACTION_ERROR, message,
            Map.of("node", node.path(), "property", property, "line", node.line()));
    }

    private static Optional<Integer> timing(DtsNode node, String property) {
        return node.integerProperty(property);
    }

    private static int bindingCells(DtsNode node, int fallback) {
        return node.integerProperty("#binding-cells").orElse(fallback);
    }

    private static List<String> references(DtsProperty property) {
        List<String> refs = new ArrayList<>();
        for (Object cell : property.cells()) {
            if (BindingParser.isReference(cell)) {
                refs.add((String) cell);
            }
        }
        return refs;
    }

    private static List<Integer> integers(DtsNode node, String property) {
        List<Integer> values = new ArrayList<>();
        node.property(property).ifPresent(p -> {
            for (Object cell : p.cells()) {
                if (cell instanceof Integer value) {
                    values.add(value);
                }
            }
            p.integerValue().filter(v -> p.cells().isEmpty()).ifPresent(values::add);
        });
        return values;
    }
}
