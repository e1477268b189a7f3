package work.keymap.zmk2kanata.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A child of the {@code combos} node.
 *
 * @param layers layer indices the combo is active on; empty means all layers
 */
public record Combo(
    String name,
    int line,
    List<Integer> keyPositions,
    Optional<Integer> timeoutMs,
    List<Binding> bindings,
    List<Integer> layers
) implements Behavior {
    public Combo {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(timeoutMs, "timeoutMs");
        keyPositions = List.copyOf(keyPositions);
        bindings = List.copyOf(bindings);
        layers = List.copyOf(layers);
    }

    @Override
    public int bindingCells() {
        return 0;
    }
}
