package work.keymap.zmk2kanata.extract;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.keymap.zmk2kanata.dts.DtsProperty;
import work.keymap.zmk2kanata.error.ErrorKind;
import work.keymap.zmk2kanata.error.ErrorManager;
import work.keymap.zmk2kanata.keys.KeyName;
import work.keymap.zmk2kanata.keys.KeyParam;
import work.keymap.zmk2kanata.keys.KeycodeMap;
import work.keymap.zmk2kanata.keys.MalformedKey;
import work.keymap.zmk2kanata.keys.ModifierResolver;
import work.keymap.zmk2kanata.model.Behavior;
import work.keymap.zmk2kanata.model.BehaviorRef;
import work.keymap.zmk2kanata.model.Binding;
import work.keymap.zmk2kanata.model.BuiltinBehavior;

/**
 * Splits a {@code bindings} array on top-level {@code &} references and turns each fragment into a
 * {@link Binding}. Problems never abort the array: they produce placeholder bindings and warnings.
 */
public final class BindingParser {
    /** Stock ZMK behaviors without a Kanata counterpart, with their parameter counts. */
    static final Map<String, Integer> UNSUPPORTED_STOCK;

    static {
        Map<String, Integer> stock = new LinkedHashMap<>();
        stock.put("bt", 2);
        stock.put("out", 1);
        stock.put("ext_power", 1);
        stock.put("rgb_ug", 1);
        stock.put("bl", 1);
        stock.put("bootloader", 0);
        stock.put("sys_reset", 0);
        stock.put("reset", 0);
        stock.put("caps_word", 0);
        stock.put("key_repeat", 0);
        stock.put("gresc", 0);
        stock.put("kt", 1);
        stock.put("sl", 1);
        stock.put("mkp", 1);
        stock.put("mmv", 1);
        stock.put("msc", 1);
        stock.put("studio_unlock", 0);
        UNSUPPORTED_STOCK = Map.copyOf(stock);
    }

    private static final String SOURCE = "extractor";

    private final ErrorManager errors;
    private final Map<String, Behavior> behaviors;

    public BindingParser(ErrorManager errors, Map<String, Behavior> behaviors) {
        this.errors = Objects.requireNonNull(errors, "errors");
        this.behaviors = Objects.requireNonNull(behaviors, "behaviors");
    }

    /**
     * @param owner what the array belongs to, used in diagnostics (e.g. {@code layer default_layer})
     */
    public List<Binding> parse(DtsProperty property, String owner) {
        List<Object> cells = property.cells();
        if (cells.isEmpty() && property.value() instanceof String single) {
            cells = List.of(single);
        }
        List<Binding> bindings = new ArrayList<>();
        int i = 0;
        if (i < cells.size() && !isReference(cells.get(0))) {
            int start = i;
            while (i < cells.size() && !isReference(cells.get(i))) {
                i++;
            }
            bindings.add(stray(cells.subList(start, i), property.cellLine(start), owner));
        }
        while (i < cells.size()) {
            int refIndex = i;
            String reference = String.valueOf(cells.get(i++));
            int paramStart = i;
            while (i < cells.size() && !isReference(cells.get(i))) {
                i++;
            }
            List<Object> params = cells.subList(paramStart, i);
            bindings.addAll(bind(reference, params, property.cellLine(refIndex), owner));
        }
        return bindings;
    }

    private List<Binding> bind(String reference, List<Object> params, int line, String owner) {
        String name = reference.substring(1);
        String source = describe(reference, params);
        Optional<BehaviorRef> ref = resolve(name);
        if (ref.isEmpty()) {
            Integer stockCells = UNSUPPORTED_STOCK.get(name);
            String reason = stockCells != null
                ? "behavior " + reference + " has no Kanata equivalent"
                : "unknown behavior " + reference;
            warn(ErrorKind.BINDING_RESOLUTION, reason + " in " + owner, owner, source, line);
            List<Binding> out = new ArrayList<>();
            if (stockCells != null && params.size() > stockCells) {
                List<Object> own = params.subList(0, stockCells);
                out.add(Binding.placeholder(reference, reason, line, describe(reference, own)));
                out.add(surplus(params.subList(stockCells, params.size()), line, owner));
            } else {
                out.add(Binding.placeholder(reference, reason, line, source));
            }
            return out;
        }

        int expected = cellCount(ref.get());
        if (params.size() < expected) {
            String reason = reference + " expects " + expected + " parameter(s), got " + params.size();
            warn(ErrorKind.BINDING_RESOLUTION, reason + " in " + owner, owner, source, line);
            return List.of(Binding.placeholder(reference, reason, line, source));
        }
        List<Binding> out = new ArrayList<>();
        List<KeyParam> keyParams = new ArrayList<>();
        for (Object cell : params.subList(0, expected)) {
            KeyParam param = toParam(cell);
            if (param instanceof MalformedKey malformed) {
                warn(ErrorKind.MALFORMED_MACRO,
                    "Malformed key " + malformed.raw() + " (" + malformed.reason() + ") in " + owner, owner, source, line);
            }
            keyParams.add(param);
        }
        out.add(new Binding(ref.get(), keyParams, line, describe(reference, params.subList(0, expected))));
        if (params.size() > expected) {
            out.add(surplus(params.subList(expected, params.size()), line, owner));
        }
        return out;
    }

    Optional<BehaviorRef> resolve(String name) {
        Behavior declared = behaviors.get(name);
        if (declared != null) {
            return Optional.of(new BehaviorRef.Resolved(declared));
        }
        return BuiltinBehavior.from(name).map(BehaviorRef.Builtin::new);
    }

    private static int cellCount(BehaviorRef ref) {
        if (ref instanceof BehaviorRef.Resolved resolved) {
            return resolved.behavior().bindingCells();
        }
        return ((BehaviorRef.Builtin) ref).builtin().bindingCells();
    }

    private Binding stray(List<Object> cells, int line, String owner) {
        String text = describe("", cells).trim();
        String reason = "parameters without a behavior: " + text;
        warn(ErrorKind.BINDING_RESOLUTION, reason + " in " + owner, owner, text, line);
        return Binding.placeholder("?", reason, line, text);
    }

    private Binding surplus(List<Object> cells, int line, String owner) {
        String text = describe("", cells).trim();
        String reason = "unexpected extra parameters: " + text;
        warn(ErrorKind.BINDING_RESOLUTION, reason + " in " + owner, owner, text, line);
        return Binding.placeholder("?", reason, line, text);
    }

    private void warn(ErrorKind kind, String message, String owner, String binding, int line) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("owner", owner);
        context.put("binding", binding);
        context.put("line", line);
        errors.warning(SOURCE, kind, message, context);
    }

    /**
     * Integer cells carrying a HID usage page are keycodes; small integers (layer indices, counts)
     * stay numeric.
     */
    static KeyParam toParam(Object cell) {
        if (cell instanceof Integer value) {
            if (((value >>> 16) & 0xFF) != 0) {
                return KeycodeMap.decode(value).orElse(new KeyName("0x" + Integer.toHexString(value)));
            }
            return new KeyName(String.valueOf(value));
        }
        return ModifierResolver.parse(String.valueOf(cell));
    }

    /**
     * Text of a cell for places that keep raw strings (macro steps).
     */
    static String cellText(Object cell) {
        return toParam(cell).raw();
    }

    static boolean isReference(Object cell) {
        return cell instanceof String text && text.startsWith("&");
    }

    private static String describe(String reference, List<Object> params) {
        StringBuilder sb = new StringBuilder(reference);
        for (Object param : params) {
            sb.append(' ').append(param instanceof Integer ? cellText(param) : param);
        }
        return sb.toString();
    }
}
