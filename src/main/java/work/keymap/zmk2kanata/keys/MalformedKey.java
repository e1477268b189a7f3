package work.keymap.zmk2kanata.keys;

import java.util.Objects;

/**
 * A parameter that could not be parsed. Rendered as an inline comment so the rest of the layer survives.
 */
public record MalformedKey(String raw, String reason) implements KeyParam {
    public MalformedKey {
        Objects.requireNonNull(raw, "raw");
        Objects.requireNonNull(reason, "reason");
    }
}
