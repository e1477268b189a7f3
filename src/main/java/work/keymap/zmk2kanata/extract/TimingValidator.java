package work.keymap.zmk2kanata.extract;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.keymap.zmk2kanata.error.ErrorKind;
import work.keymap.zmk2kanata.error.ErrorManager;

/**
 * Rejects non-positive and absurdly large timings. A rejected value is reported and dropped,
 * never clamped.
 */
public final class TimingValidator {
    public static final int MAX_TIMING_MS = 10_000;

    private final ErrorManager errors;
    private final String source;

    public TimingValidator(ErrorManager errors, String source) {
        this.errors = Objects.requireNonNull(errors, "errors");
        this.source = Objects.requireNonNull(source, "source");
    }

    public static boolean isValid(int value) {
        return value > 0 && value <= MAX_TIMING_MS;
    }

    public Optional<Integer> validate(String owner, String property, Optional<Integer> value) {
        if (value.isEmpty()) {
            return value;
        }
        int ms = value.get();
        if (isValid(ms)) {
            return value;
        }
        String reason = ms <= 0 ? "must be positive" : "exceeds " + MAX_TIMING_MS + " ms";
        errors.warning(source, ErrorKind.TIMING_VALIDATION,
            "Rejected " + property + " = " + ms + " on " + owner + " (" + reason + ")",
            Map.of("owner", owner, "property", property, "value", ms));
        return Optional.empty();
    }
}
