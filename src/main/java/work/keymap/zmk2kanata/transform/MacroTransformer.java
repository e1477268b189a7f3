package work.keymap.zmk2kanata.transform;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import work.keymap.zmk2kanata.error.ErrorKind;
import work.keymap.zmk2kanata.extract.TimingValidator;
import work.keymap.zmk2kanata.keys.KeyName;
import work.keymap.zmk2kanata.keys.KeyParam;
import work.keymap.zmk2kanata.keys.Modifier;
import work.keymap.zmk2kanata.keys.ModifierResolver;
import work.keymap.zmk2kanata.model.BuiltinBehavior;
import work.keymap.zmk2kanata.model.Macro;
import work.keymap.zmk2kanata.model.MacroStep;

/**
 * Replays a ZMK macro's bindings through the TAP / PRESS / RELEASE state machine.
 *
 * <p>{@code &macro_tap}, {@code &macro_press} and {@code &macro_release} only switch the mode;
 * each following {@code &kp X} is rendered in the active mode. The result carries the ordered
 * replay script ({@code press lsft}, {@code tap a}, {@code delay 30}) and a Kanata
 * {@code (macro ...)} action in which pressed modifiers become chord prefixes.
 */
public final class MacroTransformer {
    private enum Mode {
        TAP,
        PRESS,
        RELEASE
    }

    /** State of a pending {@code &macro_param_*} forward. */
    private enum Forward {
        NONE,
        VALUE,
        MISSING
    }

    private final TransformContext context;
    private final TimingValidator timings;

    public MacroTransformer(TransformContext context) {
        this.context = Objects.requireNonNull(context, "context");
        this.timings = new TimingValidator(context.errors(), TransformContext.SOURCE);
    }

    public KanataFragment transform(Macro macro, List<KeyParam> params) {
        String owner = "macro " + macro.name();
        List<String> script = new ArrayList<>();
        List<String> actions = new ArrayList<>();
        List<String> notes = new ArrayList<>();
        Set<Modifier> held = new LinkedHashSet<>();

        Mode mode = Mode.TAP;
        Optional<Integer> tapMs = macro.tapMs();
        Optional<Integer> waitMs = macro.waitMs();
        Forward forward = Forward.NONE;
        KeyParam substitute = null;
        int substituteSlot = 0;
        boolean keyActionSeen = false;

        for (MacroStep step : macro.steps()) {
            switch (step.behavior()) {
                case MacroStep.TAP:
                    mode = Mode.TAP;
                    continue;
                case MacroStep.PRESS:
                    mode = Mode.PRESS;
                    continue;
                case MacroStep.RELEASE:
                    mode = Mode.RELEASE;
                    continue;
                case MacroStep.WAIT_TIME: {
                    Optional<Integer> delay = timings.validate(owner, "&macro_wait_time", number(step));
                    if (delay.isPresent()) {
                        script.add("delay " + delay.get());
                        actions.add(String.valueOf(delay.get()));
                    } else {
                        script.add(";; TODO: rejected " + step.describe());
                    }
                    continue;
                }
                case MacroStep.TAP_TIME: {
                    Optional<Integer> tap = timings.validate(owner, "&macro_tap_time", number(step));
                    if (tap.isPresent()) {
                        tapMs = tap;
                    } else {
                        script.add(";; TODO: rejected " + step.describe());
                    }
                    continue;
                }
                case MacroStep.PARAM_1TO1:
                case MacroStep.PARAM_1TO2:
                case MacroStep.PARAM_2TO1:
                case MacroStep.PARAM_2TO2: {
                    int from = step.behavior().equals(MacroStep.PARAM_1TO1) || step.behavior().equals(MacroStep.PARAM_1TO2) ? 0 : 1;
                    substituteSlot = step.behavior().endsWith("to1") ? 0 : 1;
                    if (from < params.size()) {
                        substitute = params.get(from);
                        forward = Forward.VALUE;
                    } else {
                        forward = Forward.MISSING;
                    }
                    continue;
                }
                default:
                    break;
            }

            boolean keyPress = BuiltinBehavior.KP.equals(BuiltinBehavior.from(step.behavior()).orElse(null));
            if (!keyPress) {
                String note = ";; TODO: unsupported macro step " + step.describe();
                script.add(note);
                notes.add(note + " in " + macro.name());
                context.warn(ErrorKind.UNSUPPORTED_FEATURE,
                    "Unsupported step " + step.describe() + " in " + owner + " kept as a comment", owner);
                forward = Forward.NONE;
                continue;
            }
            if (forward == Forward.MISSING) {
                script.add(";; TODO: " + step.describe() + " waits for a macro parameter");
                forward = Forward.NONE;
                continue;
            }

            List<KeyParam> keys = new ArrayList<>();
            for (String raw : step.params()) {
                keys.add(ModifierResolver.parse(raw));
            }
            if (forward == Forward.VALUE) {
                // the placeholder cell (MACRO_PLACEHOLDER) may be absent
                while (keys.size() <= substituteSlot) {
                    keys.add(substitute);
                }
                keys.set(substituteSlot, substitute);
                forward = Forward.NONE;
            }
            for (KeyParam key : keys) {
                if (keyActionSeen && waitMs.isPresent()) {
                    script.add("delay " + waitMs.get());
                    actions.add(String.valueOf(waitMs.get()));
                }
                keyActionSeen = true;
                String text = context.key(key, owner);
                Optional<Modifier> modifier = asModifier(key);
                switch (mode) {
                    case PRESS:
                        script.add("press " + text);
                        if (modifier.isPresent()) {
                            held.add(modifier.get());
                        } else {
                            actions.add(chord(held, text));
                            notes.add(";; TODO: " + macro.name() + " holds " + text + ", Kanata macros can only tap it");
                        }
                        break;
                    case RELEASE:
                        script.add("release " + text);
                        modifier.ifPresent(held::remove);
                        break;
                    default:
                        script.add(tapMs.isPresent() ? "tap-hold-ms " + tapMs.get() + " " + text : "tap " + text);
                        actions.add(chord(held, text));
                        break;
                }
            }
        }

        if (!held.isEmpty()) {
            notes.add(";; TODO: " + macro.name() + " never releases " + held.iterator().next().kanataName(context.resolver().style()));
        }
        String definition = actions.isEmpty() ? "XX" : "(macro " + String.join(" ", actions) + ")";
        if (script.isEmpty()) {
            script.add(";; empty macro");
        }
        return new KanataFragment(AliasNames.aliasName(macro.name(), params), definition, dedupe(notes), script);
    }

    /**
     * Timing argument of a step; a missing or non-numeric argument counts as 0 so it is rejected
     * and reported.
     */
    private static Optional<Integer> number(MacroStep step) {
        if (step.params().isEmpty()) {
            return Optional.of(0);
        }
        try {
            return Optional.of(Integer.parseInt(step.params().get(0).trim()));
        } catch (NumberFormatException ex) {
            return Optional.of(0);
        }
    }

    private static Optional<Modifier> asModifier(KeyParam key) {
        if (key instanceof KeyName name) {
            return Modifier.byKeycode(name.raw());
        }
        return Optional.empty();
    }

    /**
     * Prefixes the held modifiers that have a chord form; the others cannot be expressed inside
     * a Kanata macro and are dropped from the action (the script keeps them).
     */
    private static String chord(Set<Modifier> held, String key) {
        StringBuilder sb = new StringBuilder();
        for (Modifier modifier : held) {
            modifier.chordPrefix().ifPresent(sb::append);
        }
        return sb.append(key).toString();
    }

    private static List<String> dedupe(List<String> notes) {
        return new ArrayList<>(new LinkedHashSet<>(notes));
    }
}
