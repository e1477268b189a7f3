package work.keymap.zmk2kanata.model;

public enum LayerSwitchKind {
    MOMENTARY,
    TO,
    TOGGLE,
    TAP
}
