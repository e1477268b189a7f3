package work.keymap.zmk2kanata.model;

import java.util.Locale;
import java.util.Optional;

/**
 * ZMK hold-tap flavors.
 */
public enum Flavor {
    TAP_PREFERRED("tap-preferred"),
    HOLD_PREFERRED("hold-preferred"),
    BALANCED("balanced"),
    TAP_UNLESS_INTERRUPTED("tap-unless-interrupted");

    private final String zmkName;

    Flavor(String zmkName) {
        this.zmkName = zmkName;
    }

    public String zmkName() {
        return zmkName;
    }

    public static Optional<Flavor> from(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (Flavor flavor : values()) {
            if (flavor.zmkName.equals(normalized)) {
                return Optional.of(flavor);
            }
        }
        return Optional.empty();
    }
}
