package work.keymap.zmk2kanata.error;

import java.util.Objects;

/**
 * Unchecked failure carrying the {@link ConversionError} that aborted a stage.
 */
public class ConversionException extends RuntimeException {
    private final ConversionError error;

    public ConversionException(ConversionError error) {
        this(error, null);
    }

    public ConversionException(ConversionError error, Throwable cause) {
        super(Objects.requireNonNull(error, "error").message(), cause);
        this.error = error;
    }

    public ConversionError error() {
        return error;
    }

    public ErrorKind kind() {
        return error.kind();
    }
}
