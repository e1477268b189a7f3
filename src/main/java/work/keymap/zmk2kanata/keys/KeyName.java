package work.keymap.zmk2kanata.keys;

import java.util.Objects;

/**
 * A plain keycode or parameter such as {@code A}, {@code LSHIFT}, {@code N1} or a layer index.
 */
public record KeyName(String raw) implements KeyParam {
    public KeyName {
        Objects.requireNonNull(raw, "raw");
    }
}
