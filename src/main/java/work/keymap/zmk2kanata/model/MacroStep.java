package work.keymap.zmk2kanata.model;

import java.util.List;
import java.util.Objects;

/**
 * One entry of a macro's {@code bindings}, e.g. {@code &kp A} or {@code &macro_wait_time 50}.
 */
public record MacroStep(String behavior, List<String> params, int line) {
    public static final String TAP = "&macro_tap";
    public static final String PRESS = "&macro_press";
    public static final String RELEASE = "&macro_release";
    public static final String WAIT_TIME = "&macro_wait_time";
    public static final String TAP_TIME = "&macro_tap_time";
    public static final String PAUSE_FOR_RELEASE = "&macro_pause_for_release";
    public static final String PARAM_1TO1 = "&macro_param_1to1";
    public static final String PARAM_1TO2 = "&macro_param_1to2";
    public static final String PARAM_2TO1 = "&macro_param_2to1";
    public static final String PARAM_2TO2 = "&macro_param_2to2";

    public MacroStep {
        Objects.requireNonNull(behavior, "behavior");
        params = List.copyOf(params);
    }

    public String describe() {
        return params.isEmpty() ? behavior : behavior + " " + String.join(" ", params);
    }
}
