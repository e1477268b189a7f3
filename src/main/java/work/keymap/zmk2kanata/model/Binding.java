package work.keymap.zmk2kanata.model;

import java.util.List;
import java.util.Objects;
import work.keymap.zmk2kanata.keys.KeyParam;

/**
 * One behavior invocation at a key position.
 *
 * @param source the binding text as written, e.g. {@code &mt LSHIFT A}
 */
public record Binding(BehaviorRef ref, List<KeyParam> params, int line, String source) {
    public Binding {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(source, "source");
        params = List.copyOf(params);
    }

    public static Binding placeholder(String name, String reason, int line, String source) {
        return new Binding(new BehaviorRef.Unknown(name, reason), List.of(), line, source);
    }

    public boolean isPlaceholder() {
        return ref instanceof BehaviorRef.Unknown;
    }
}
