package work.keymap.zmk2kanata.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code zmk,behavior-macro} (and its one/two parameter variants). Steps are a replay script, order matters.
 */
public record Macro(
    String name,
    int bindingCells,
    int line,
    Optional<Integer> waitMs,
    Optional<Integer> tapMs,
    List<MacroStep> steps
) implements Behavior {
    public Macro {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(waitMs, "waitMs");
        Objects.requireNonNull(tapMs, "tapMs");
        steps = List.copyOf(steps);
    }
}
