package work.keymap.zmk2kanata.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code zmk,behavior-tap-dance}: the n-th binding fires after n taps.
 */
public record TapDance(
    String name,
    int bindingCells,
    int line,
    Optional<Integer> tappingTermMs,
    List<Binding> bindings
) implements Behavior {
    public TapDance {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(tappingTermMs, "tappingTermMs");
        bindings = List.copyOf(bindings);
    }
}
