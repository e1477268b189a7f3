package work.keymap.zmk2kanata.keys;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The eight canonical ZMK modifiers with their function form ({@code LS(...)}), keycode
 * spellings and Kanata names.
 */
public enum Modifier {
    LCTRL("LC", 0x01, "lctl", "lctl", "C-", List.of("LCTRL", "LCTL", "LEFT_CONTROL")),
    LSHIFT("LS", 0x02, "lsft", "lsft", "S-", List.of("LSHIFT", "LSHFT", "LSFT", "LEFT_SHIFT")),
    LALT("LA", 0x04, "lalt", "lopt", "A-", List.of("LALT", "LEFT_ALT", "LOPT")),
    LGUI("LG", 0x08, "lmet", "lcmd", "M-", List.of("LGUI", "LEFT_GUI", "LCMD", "LWIN", "LMETA", "LEFT_WIN", "LEFT_COMMAND", "LEFT_META")),
    RCTRL("RC", 0x10, "rctl", "rctl", null, List.of("RCTRL", "RCTL", "RIGHT_CONTROL")),
    RSHIFT("RS", 0x20, "rsft", "rsft", null, List.of("RSHIFT", "RSHFT", "RSFT", "RIGHT_SHIFT")),
    RALT("RA", 0x40, "ralt", "ropt", "RA-", List.of("RALT", "RIGHT_ALT", "ROPT")),
    RGUI("RG", 0x80, "rmet", "rcmd", null, List.of("RGUI", "RIGHT_GUI", "RCMD", "RWIN", "RMETA", "RIGHT_WIN", "RIGHT_COMMAND", "RIGHT_META"));

    private final String function;
    private final int implicitBit;
    private final String pcName;
    private final String macName;
    private final String chordPrefix;
    private final List<String> keycodes;

    Modifier(String function, int implicitBit, String pcName, String macName, String chordPrefix, List<String> keycodes) {
        this.function = function;
        this.implicitBit = implicitBit;
        this.pcName = pcName;
        this.macName = macName;
        this.chordPrefix = chordPrefix;
        this.keycodes = keycodes;
    }

    /** Two-letter function name, e.g. {@code LS}. */
    public String function() {
        return function;
    }

    /** Bit of this modifier in the top byte of an encoded ZMK keycode. */
    public int implicitBit() {
        return implicitBit;
    }

    public String kanataName(ModifierStyle style) {
        return style == ModifierStyle.MAC ? macName : pcName;
    }

    /** Kanata chord prefix ({@code C-}, {@code S-}, ...), empty for modifiers that have none. */
    public Optional<String> chordPrefix() {
        return Optional.ofNullable(chordPrefix);
    }

    public static Optional<Modifier> byFunction(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String upper = name.trim().toUpperCase(Locale.ROOT);
        for (Modifier modifier : values()) {
            if (modifier.function.equals(upper)) {
                return Optional.of(modifier);
            }
        }
        return Optional.empty();
    }

    public static Optional<Modifier> byKeycode(String keycode) {
        if (keycode == null) {
            return Optional.empty();
        }
        String upper = keycode.trim().toUpperCase(Locale.ROOT);
        for (Modifier modifier : values()) {
            if (modifier.keycodes.contains(upper)) {
                return Optional.of(modifier);
            }
        }
        return Optional.empty();
    }
}
