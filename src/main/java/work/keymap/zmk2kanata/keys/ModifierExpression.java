package work.keymap.zmk2kanata.keys;

import java.util.List;
import java.util.Objects;

/**
 * {@code LC(LS(LALT))}: a modifier function applied to its arguments (always one for ZMK).
 */
public record ModifierExpression(Modifier modifier, List<KeyParam> args) implements KeyParam {
    public ModifierExpression {
        Objects.requireNonNull(modifier, "modifier");
        args = List.copyOf(args);
    }

    public static ModifierExpression of(Modifier modifier, KeyParam arg) {
        return new ModifierExpression(modifier, List.of(arg));
    }

    @Override
    public String raw() {
        StringBuilder sb = new StringBuilder(modifier.function()).append('(');
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) {
                sb.append(',');
            }
            sb.append(args.get(i).raw());
        }
        return sb.append(')').toString();
    }
}
