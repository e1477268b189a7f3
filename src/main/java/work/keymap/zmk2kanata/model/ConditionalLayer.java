package work.keymap.zmk2kanata.model;

import java.util.List;
import java.util.Objects;

/**
 * {@code then-layer} activates while all {@code if-layers} are active.
 */
public record ConditionalLayer(String name, List<Integer> ifLayers, int thenLayer, int line) {
    public ConditionalLayer {
        Objects.requireNonNull(name, "name");
        ifLayers = List.copyOf(ifLayers);
    }
}
