package work.keymap.zmk2kanata.keys;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * ZMK keycode names to Kanata key names, plus the HID usage table used when a keymap was
 * expanded by the preprocessor and carries numbers instead of names.
 */
public final class KeycodeMap {
    private static final Map<String, String> ZMK_TO_KANATA;
    private static final Map<Integer, String> USAGE_TO_ZMK;

    static {
        Map<String, String> keys = new HashMap<>();
        for (char c = 'A'; c <= 'Z'; c++) {
            keys.put(String.valueOf(c), String.valueOf(c).toLowerCase(Locale.ROOT));
        }
        for (int digit = 0; digit <= 9; digit++) {
            keys.put("N" + digit, String.valueOf(digit));
            keys.put("NUMBER_" + digit, String.valueOf(digit));
            keys.put("KP_N" + digit, "kp" + digit);
            keys.put("KP_NUMBER_" + digit, "kp" + digit);
        }
        for (int f = 1; f <= 24; f++) {
            keys.put("F" + f, "f" + f);
        }

        put(keys, "ret", "ENTER", "RET", "RETURN");
        put(keys, "esc", "ESC", "ESCAPE");
        put(keys, "bspc", "BSPC", "BACKSPACE");
        put(keys, "del", "DEL", "DELETE");
        put(keys, "tab", "TAB");
        put(keys, "spc", "SPACE", "SPC");
        put(keys, "caps", "CAPS", "CAPSLOCK", "CLCK");
        put(keys, "left", "LEFT", "LEFT_ARROW");
        put(keys, "rght", "RIGHT", "RIGHT_ARROW");
        put(keys, "up", "UP", "UP_ARROW");
        put(keys, "down", "DOWN", "DOWN_ARROW");
        put(keys, "home", "HOME");
        put(keys, "end", "END");
        put(keys, "pgup", "PG_UP", "PAGE_UP");
        put(keys, "pgdn", "PG_DN", "PAGE_DOWN");
        put(keys, "ins", "INS", "INSERT");
        put(keys, "prnt", "PSCRN", "PRINTSCREEN");
        put(keys, "slck", "SLCK", "SCROLLLOCK");
        put(keys, "pause", "PAUSE", "PAUSE_BREAK");
        put(keys, "menu", "MENU", "K_APP", "K_CMENU");

        put(keys, "grv", "GRAVE", "GRV");
        put(keys, "min", "MINUS");
        put(keys, "eql", "EQUAL");
        put(keys, "lbrc", "LBKT", "LEFT_BRACKET");
        put(keys, "rbrc", "RBKT", "RIGHT_BRACKET");
        put(keys, "bksl", "BSLH", "BACKSLASH");
        put(keys, "scln", "SEMI", "SEMICOLON", "SCLN");
        put(keys, "apo", "APOS", "SQT", "APOSTROPHE", "SINGLE_QUOTE");
        put(keys, "comm", "COMMA");
        put(keys, ".", "DOT", "PERIOD");
        put(keys, "/", "FSLH", "SLASH");

        // shifted symbols have no key of their own in Kanata
        put(keys, "S-1", "EXCL", "EXCLAMATION");
        put(keys, "S-2", "AT", "AT_SIGN");
        put(keys, "S-3", "HASH", "POUND");
        put(keys, "S-4", "DLLR", "DOLLAR");
        put(keys, "S-5", "PRCNT", "PERCENT");
        put(keys, "S-6", "CARET");
        put(keys, "S-7", "AMPS", "AMPERSAND");
        put(keys, "S-8", "STAR", "ASTRK", "ASTERISK");
        put(keys, "S-9", "LPAR", "LPRN", "LEFT_PARENTHESIS");
        put(keys, "S-0", "RPAR", "RPRN", "RIGHT_PARENTHESIS");
        put(keys, "S-min", "UNDER", "UNDERSCORE");
        put(keys, "S-eql", "PLUS");
        put(keys, "S-lbrc", "LBRC", "LEFT_BRACE");
        put(keys, "S-rbrc", "RBRC", "RIGHT_BRACE");
        put(keys, "S-bksl", "PIPE");
        put(keys, "S-grv", "TILDE");
        put(keys, "S-scln", "COLON");
        put(keys, "S-apo", "DQT", "DOUBLE_QUOTES");
        put(keys, "S-comm", "LT", "LESS_THAN");
        put(keys, "S-.", "GT", "GREATER_THAN");
        put(keys, "S-/", "QMARK", "QUESTION");

        put(keys, "kp.", "KP_DOT");
        put(keys, "kp+", "KP_PLUS");
        put(keys, "kp-", "KP_MINUS");
        put(keys, "kp*", "KP_MULTIPLY", "KP_ASTERISK");
        put(keys, "kp/", "KP_DIVIDE", "KP_SLASH");
        put(keys, "kprt", "KP_ENTER");

        put(keys, "mute", "C_MUTE");
        put(keys, "volu", "C_VOL_UP", "C_VOLUME_UP");
        put(keys, "vold", "C_VOL_DN", "C_VOLUME_DOWN");
        put(keys, "pp", "C_PP", "C_PLAY_PAUSE");
        put(keys, "next", "C_NEXT");
        put(keys, "prev", "C_PREV", "C_PREVIOUS");
        put(keys, "brup", "C_BRI_UP", "C_BRIGHTNESS_INC");
        put(keys, "brdown", "C_BRI_DN", "C_BRIGHTNESS_DEC");
        ZMK_TO_KANATA = Collections.unmodifiableMap(keys);

        Map<Integer, String> usages = new HashMap<>();
        for (int i = 0; i < 26; i++) {
            usages.put(0x04 + i, String.valueOf((char) ('A' + i)));
        }
        for (int i = 0; i < 9; i++) {
            usages.put(0x1E + i, "N" + (i + 1));
            usages.put(0x59 + i, "KP_N" + (i + 1));
        }
        usages.put(0x27, "N0");
        usages.put(0x62, "KP_N0");
        String[] block = {"ENTER", "ESC", "BSPC", "TAB", "SPACE", "MINUS", "EQUAL", "LBKT", "RBKT", "BSLH",
            null, "SEMI", "SQT", "GRAVE", "COMMA", "DOT", "FSLH", "CAPS"};
        for (int i = 0; i < block.length; i++) {
            if (block[i] != null) {
                usages.put(0x28 + i, block[i]);
            }
        }
        for (int f = 1; f <= 12; f++) {
            usages.put(0x39 + f, "F" + f);
        }
        String[] nav = {"PSCRN", "SLCK", "PAUSE", "INS", "HOME", "PG_UP", "DEL", "END", "PG_DN",
            "RIGHT", "LEFT", "DOWN", "UP"};
        for (int i = 0; i < nav.length; i++) {
            usages.put(0x46 + i, nav[i]);
        }
        usages.put(0x54, "KP_DIVIDE");
        usages.put(0x55, "KP_MULTIPLY");
        usages.put(0x56, "KP_MINUS");
        usages.put(0x57, "KP_PLUS");
        usages.put(0x58, "KP_ENTER");
        usages.put(0x63, "KP_DOT");
        usages.put(0x65, "K_APP");
        Modifier[] modifiers = Modifier.values();
        for (int i = 0; i < modifiers.length; i++) {
            usages.put(0xE0 + i, modifiers[i].name());
        }
        USAGE_TO_ZMK = Collections.unmodifiableMap(usages);
    }

    private KeycodeMap() {}

    private static void put(Map<String, String> keys, String kanata, String... zmkNames) {
        for (String zmk : zmkNames) {
            keys.put(zmk, kanata);
        }
    }

    /**
     * Kanata name of a ZMK keycode, numeric usages included.
     */
    public static Optional<String> toKanata(String zmk, ModifierStyle style) {
        if (zmk == null || zmk.isBlank()) {
            return Optional.empty();
        }
        String upper = zmk.trim().toUpperCase(Locale.ROOT);
        Optional<Modifier> modifier = Modifier.byKeycode(upper);
        if (modifier.isPresent()) {
            return Optional.of(modifier.get().kanataName(style));
        }
        String mapped = ZMK_TO_KANATA.get(upper);
        if (mapped != null) {
            return Optional.of(mapped);
        }
        return parseNumber(upper).flatMap(KeycodeMap::usageName).flatMap(name -> toKanata(name, style));
    }

    public static boolean isKnown(String zmk) {
        return toKanata(zmk, ModifierStyle.PC).isPresent();
    }

    /**
     * Symbolic ZMK name of a HID keyboard usage. The usage page in bits 16-23 and the implicit
     * modifier byte are ignored.
     */
    public static Optional<String> usageName(int encoded) {
        return Optional.ofNullable(USAGE_TO_ZMK.get(encoded & 0xFFFF));
    }

    /**
     * Decodes a preprocessed keycode such as {@code 0x02070004} ({@code LS(A)}) into a key parameter.
     */
    public static Optional<KeyParam> decode(int encoded) {
        Optional<String> name = usageName(encoded);
        if (name.isEmpty()) {
            return Optional.empty();
        }
        KeyParam param = new KeyName(name.get());
        int implicitMods = (encoded >>> 24) & 0xFF;
        Modifier[] modifiers = Modifier.values();
        for (int i = modifiers.length - 1; i >= 0; i--) {
            if ((implicitMods & modifiers[i].implicitBit()) != 0) {
                param = ModifierExpression.of(modifiers[i], param);
            }
        }
        return Optional.of(param);
    }

    private static Optional<Integer> parseNumber(String text) {
        try {
            if (text.startsWith("0X")) {
                return Optional.of((int) Long.parseLong(text.substring(2), 16));
            }
            if (!text.isEmpty() && text.chars().allMatch(Character::isDigit)) {
                return Optional.of((int) Long.parseLong(text));
            }
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
        return Optional.empty();
    }
}
