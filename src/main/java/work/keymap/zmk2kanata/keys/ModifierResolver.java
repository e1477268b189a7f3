package work.keymap.zmk2kanata.keys;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Parses and renders ZMK modifier expressions such as {@code LC(LS(LALT))}.
 *
 * <p>Each of the eight modifier functions takes exactly one argument, which is either a keycode or
 * another modifier expression. Nesting is unbounded. Malformed input ({@code LS()}, unbalanced
 * parentheses, an unknown function name) never throws: it becomes a {@link MalformedKey} and renders
 * as an inline Kanata comment.
 */
public final class ModifierResolver {
    private final ModifierStyle style;

    public ModifierResolver(ModifierStyle style) {
        this.style = Objects.requireNonNull(style, "style");
    }

    public ModifierStyle style() {
        return style;
    }

    public static KeyParam parse(String text) {
        if (text == null || text.isBlank()) {
            return new MalformedKey(text == null ? "" : text, "empty key");
        }
        String raw = text.trim();
        int open = raw.indexOf('(');
        if (open < 0) {
            if (raw.indexOf(')') >= 0) {
                return new MalformedKey(raw, "unmatched ')'");
            }
            return new KeyName(raw);
        }
        if (!raw.endsWith(")") || !balanced(raw)) {
            return new MalformedKey(raw, "unmatched parentheses");
        }
        String function = raw.substring(0, open).trim();
        Optional<Modifier> modifier = Modifier.byFunction(function);
        if (function.isEmpty() || modifier.isEmpty()) {
            return new MalformedKey(raw, "unknown modifier function '" + function + "'");
        }
        String inner = raw.substring(open + 1, raw.length() - 1).trim();
        if (inner.isEmpty()) {
            return new MalformedKey(raw, "missing argument");
        }
        List<String> args = splitTopLevel(inner);
        if (args.size() != 1) {
            return new MalformedKey(raw, function + " takes exactly one argument");
        }
        KeyParam argument = parse(args.get(0));
        if (argument instanceof MalformedKey malformed) {
            return new MalformedKey(raw, malformed.reason());
        }
        return ModifierExpression.of(modifier.get(), argument);
    }

    /**
     * Canonical lower-case form: {@code resolve("LC(LS(LALT))")} is {@code lc(ls(lalt))}.
     */
    public String resolve(String text) {
        return canonical(parse(text));
    }

    public String canonical(KeyParam param) {
        if (param instanceof KeyName key) {
            return keyName(key.raw());
        }
        if (param instanceof ModifierExpression expression) {
            List<String> args = new ArrayList<>();
            for (KeyParam arg : expression.args()) {
                args.add(canonical(arg));
            }
            return expression.modifier().function().toLowerCase(Locale.ROOT) + "(" + String.join(" ", args) + ")";
        }
        return malformedComment((MalformedKey) param);
    }

    /**
     * Kanata action text. Left modifiers (and right alt) become chord prefixes ({@code C-S-lalt});
     * other right modifiers fall back to {@code (multi rctl a)}.
     */
    public String toKanata(KeyParam param) {
        if (param instanceof KeyName key) {
            return keyName(key.raw());
        }
        if (param instanceof MalformedKey malformed) {
            return malformedComment(malformed);
        }
        List<Modifier> modifiers = new ArrayList<>();
        KeyParam current = param;
        while (current instanceof ModifierExpression expression) {
            modifiers.add(expression.modifier());
            current = expression.args().get(0);
        }
        String base = toKanata(current);
        if (current instanceof MalformedKey) {
            return base;
        }
        boolean prefixable = modifiers.stream().allMatch(m -> m.chordPrefix().isPresent());
        if (prefixable) {
            StringBuilder sb = new StringBuilder();
            for (Modifier modifier : modifiers) {
                sb.append(modifier.chordPrefix().get());
            }
            return sb.append(base).toString();
        }
        StringBuilder sb = new StringBuilder("(multi");
        for (Modifier modifier : modifiers) {
            sb.append(' ').append(modifier.kanataName(style));
        }
        return sb.append(' ').append(base).append(')').toString();
    }

    /**
     * Kanata name for a keycode; unknown names pass through lower-cased.
     */
    public String keyName(String zmk) {
        return KeycodeMap.toKanata(zmk, style).orElse(zmk.trim().toLowerCase(Locale.ROOT));
    }

    public static String malformedComment(MalformedKey malformed) {
        return "XX #| malformed macro: " + malformed.raw().replace("|#", "| #") + " |#";
    }

    private static boolean balanced(String text) {
        int depth = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    return false;
                }
                // the outermost group must close at the very end
                if (depth == 0 && i != text.length() - 1) {
                    return false;
                }
            }
        }
        return depth == 0;
    }

    private static List<String> splitTopLevel(String inner) {
        List<String> parts = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < inner.length(); i++) {
            char c = inner.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                parts.add(inner.substring(start, i).trim());
                start = i + 1;
            }
        }
        parts.add(inner.substring(start).trim());
        return parts;
    }
}
