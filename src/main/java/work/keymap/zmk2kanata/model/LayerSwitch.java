package work.keymap.zmk2kanata.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A declared layer behavior ({@code zmk,behavior-momentary-layer} and friends). The target layer
 * normally comes from the binding parameter, so {@code layerRef} is usually empty.
 */
public record LayerSwitch(String name, int bindingCells, int line, LayerSwitchKind kind, Optional<String> layerRef)
    implements Behavior {
    public LayerSwitch {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(layerRef, "layerRef");
    }
}
