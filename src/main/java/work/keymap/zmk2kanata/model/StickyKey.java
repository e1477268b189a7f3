package work.keymap.zmk2kanata.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code zmk,behavior-sticky-key}.
 */
public record StickyKey(
    String name,
    int bindingCells,
    int line,
    Optional<Integer> releaseAfterMs,
    boolean quickRelease,
    boolean ignoreModifiers,
    List<String> bindings
) implements Behavior {
    public StickyKey {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(releaseAfterMs, "releaseAfterMs");
        bindings = List.copyOf(bindings);
    }
}
