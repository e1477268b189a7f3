package work.keymap.zmk2kanata.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One diagnostic collected during a conversion run.
 *
 * @param message human readable description
 * @param source component that reported the condition (e.g. {@code parser}, {@code extractor})
 * @param severity severity of the condition
 * @param kind error category
 * @param line 1-based source line, or {@code null} when unknown
 * @param column 1-based source column, or {@code null} when unknown
 * @param context extra diagnostic data (node name, property, snippet...)
 */
public record ConversionError(
    String message,
    String source,
    Severity severity,
    ErrorKind kind,
    Integer line,
    Integer column,
    Map<String, Object> context
) {
    public ConversionError {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(kind, "kind");
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public static ConversionError of(String source, Severity severity, ErrorKind kind, String message) {
        return new ConversionError(message, source, severity, kind, null, null, Map.of());
    }

    public ConversionError at(int line, int column) {
        return new ConversionError(message, source, severity, kind, line, column, context);
    }

    public ConversionError withContext(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(context);
        merged.put(key, value);
        return new ConversionError(message, source, severity, kind, line, column, merged);
    }

    public ConversionError withSeverity(Severity newSeverity) {
        return new ConversionError(message, source, newSeverity, kind, line, column, context);
    }

    /**
     * Single-line rendering used by the output summary and the logger.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append('[').append(severity.name()).append("] ").append(source).append(": ").append(message);
        if (line != null) {
            sb.append(" (line ").append(line);
            if (column != null) {
                sb.append(", column ").append(column);
            }
            sb.append(')');
        }
        return sb.toString();
    }
}
