package work.keymap.zmk2kanata.model;

/**
 * Keymap-wide timings, emitted as Kanata {@code defvar}s.
 */
public record GlobalSettings(int tapTimeMs, int holdTimeMs) {
    public static final int DEFAULT_TAP_TIME_MS = 200;
    public static final int DEFAULT_HOLD_TIME_MS = 250;
    public static final GlobalSettings DEFAULTS = new GlobalSettings(DEFAULT_TAP_TIME_MS, DEFAULT_HOLD_TIME_MS);

    public GlobalSettings {
        if (tapTimeMs <= 0 || holdTimeMs <= 0) {
            throw new IllegalArgumentException("Global timings must be positive: tap=" + tapTimeMs + ", hold=" + holdTimeMs);
        }
    }
}
