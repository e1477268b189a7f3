package work.keymap.zmk2kanata.model;

import java.util.Optional;

/**
 * Stock ZMK behaviors the converter understands without a declaration in the keymap.
 */
public enum BuiltinBehavior {
    KP("kp", 1),
    MO("mo", 1),
    TO("to", 1),
    TOG("tog", 1),
    MT("mt", 2),
    LT("lt", 2),
    SK("sk", 1),
    TRANS("trans", 0),
    NONE("none", 0);

    private final String zmkName;
    private final int bindingCells;

    BuiltinBehavior(String zmkName, int bindingCells) {
        this.zmkName = zmkName;
        this.bindingCells = bindingCells;
    }

    public String zmkName() {
        return zmkName;
    }

    public int bindingCells() {
        return bindingCells;
    }

    /**
     * Looks up {@code kp} or {@code &kp}.
     */
    public static Optional<BuiltinBehavior> from(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String bare = name.startsWith("&") ? name.substring(1) : name;
        for (BuiltinBehavior builtin : values()) {
            if (builtin.zmkName.equals(bare)) {
                return Optional.of(builtin);
            }
        }
        return Optional.empty();
    }
}
