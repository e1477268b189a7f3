package work.keymap.zmk2kanata.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import work.keymap.zmk2kanata.keys.KeyParam;
import work.keymap.zmk2kanata.model.Flavor;
import work.keymap.zmk2kanata.model.HoldTap;

/**
 * Hold-tap behaviors and the built-in {@code &mt} to Kanata {@code tap-hold} variants.
 *
 * <p>Output is {@code (tap-hold T H tap hold)}: T is {@code quick-tap-ms} and H is
 * {@code tapping-term-ms} when the keymap sets them, otherwise the global {@code $tap-time} and
 * {@code $hold-time} variables.
 */
public final class HoldTapTransformer {
    private final TransformContext context;

    public HoldTapTransformer(TransformContext context) {
        this.context = Objects.requireNonNull(context, "context");
    }

    public KanataFragment transform(HoldTap behavior, List<KeyParam> params) {
        String owner = "hold-tap " + behavior.name();
        String holdRef = behavior.bindings().size() > 0 ? behavior.bindings().get(0) : "&kp";
        String tapRef = behavior.bindings().size() > 1 ? behavior.bindings().get(1) : "&kp";
        String hold = context.innerAction(holdRef, params.get(0), owner);
        String tap = context.innerAction(tapRef, params.get(1), owner);
        String t = TransformContext.timing(behavior.quickTapMs(), TransformContext.TAP_TIME_VAR);
        String h = TransformContext.timing(behavior.tappingTermMs().or(behavior::holdTimeMs), TransformContext.HOLD_TIME_VAR);
        String definition = "(" + variant(behavior) + " " + t + " " + h + " " + tap + " " + hold + ")";
        return KanataFragment.alias(AliasNames.aliasName(behavior.name(), params), definition, notes(behavior));
    }

    /**
     * ZMK's {@code &mt} is hold-preferred.
     */
    public KanataFragment modTap(KeyParam modifier, KeyParam key) {
        String owner = "&mt";
        String definition = "(tap-hold-press " + TransformContext.TAP_TIME_VAR + " " + TransformContext.HOLD_TIME_VAR + " "
            + context.key(key, owner) + " " + context.key(modifier, owner) + ")";
        return KanataFragment.alias(AliasNames.aliasName("mt", List.of(modifier, key)), definition, List.of());
    }

    static String variant(HoldTap behavior) {
        if (behavior.flavor().isPresent()) {
            return variant(behavior.flavor().get());
        }
        return behavior.holdTriggerOnRelease() ? "tap-hold-release" : "tap-hold";
    }

    static String variant(Flavor flavor) {
        switch (flavor) {
            case HOLD_PREFERRED:
            case TAP_UNLESS_INTERRUPTED:
                return "tap-hold-press";
            case BALANCED:
                return "tap-hold-release";
            default:
                return "tap-hold";
        }
    }

    private static List<String> notes(HoldTap behavior) {
        List<String> notes = new ArrayList<>();
        if (behavior.retroTap()) {
            notes.add(";; TODO: retro-tap on " + behavior.name() + " has no Kanata equivalent");
        }
        if (!behavior.holdTriggerPositions().isEmpty()) {
            String positions = behavior.holdTriggerPositions().stream().map(String::valueOf).collect(Collectors.joining(" "));
            notes.add(";; TODO: hold-trigger-key-positions <" + positions + "> on " + behavior.name() + " not translated");
        }
        behavior.requirePriorIdleMs().ifPresent(ms ->
            notes.add(";; TODO: require-prior-idle-ms " + ms + " on " + behavior.name() + " not translated"));
        if (behavior.flavor().isPresent() && behavior.holdTriggerOnRelease()) {
            notes.add(";; TODO: hold-trigger-on-release on " + behavior.name() + " combined with flavor "
                + behavior.flavor().get().zmkName() + " not translated");
        }
        return notes;
    }
}
