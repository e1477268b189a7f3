package work.keymap.zmk2kanata.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * {@code zmk,behavior-hold-tap}. Timing components are empty unless the keymap sets them.
 *
 * @param bindings the hold and tap behaviors, e.g. {@code [&kp, &kp]}
 */
public record HoldTap(
    String name,
    int bindingCells,
    int line,
    Optional<Integer> tappingTermMs,
    Optional<Integer> holdTimeMs,
    Optional<Integer> quickTapMs,
    Optional<Integer> requirePriorIdleMs,
    Optional<Flavor> flavor,
    List<Integer> holdTriggerPositions,
    boolean holdTriggerOnRelease,
    boolean retroTap,
    List<String> bindings
) implements Behavior {
    public HoldTap {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(tappingTermMs, "tappingTermMs");
        Objects.requireNonNull(holdTimeMs, "holdTimeMs");
        Objects.requireNonNull(quickTapMs, "quickTapMs");
        Objects.requireNonNull(requirePriorIdleMs, "requirePriorIdleMs");
        Objects.requireNonNull(flavor, "flavor");
        holdTriggerPositions = List.copyOf(holdTriggerPositions);
        bindings = List.copyOf(bindings);
    }
}
