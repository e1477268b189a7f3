package work.keymap.zmk2kanata.error;

import java.util.Locale;

/**
 * Ordered severities for conversion diagnostics ({@code DEBUG < INFO < WARNING < ERROR < CRITICAL}).
 */
public enum Severity {
    DEBUG,
    INFO,
    WARNING,
    ERROR,
    CRITICAL;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    public static Severity from(String value) {
        if (value == null || value.isBlank()) {
            return ERROR;
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        if ("WARN".equals(normalized)) {
            return WARNING;
        }
        if ("FATAL".equals(normalized)) {
            return CRITICAL;
        }
        try {
            return Severity.valueOf(normalized);
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unsupported severity: " + value);
        }
    }
}
