package work.keymap.zmk2kanata.keys;

/**
 * One binding parameter: a plain keycode, a modifier expression or a malformed value kept for
 * diagnostics.
 */
public sealed interface KeyParam permits KeyName, ModifierExpression, MalformedKey {
    /** The parameter as written in the keymap. */
    String raw();
}
