package work.keymap.zmk2kanata.keys;

/**
 * Which modifier key names the output uses.
 */
public enum ModifierStyle {
    /** {@code lmet}, {@code lalt}, ... */
    PC,
    /** {@code lcmd}, {@code lopt}, ... */
    MAC
}
