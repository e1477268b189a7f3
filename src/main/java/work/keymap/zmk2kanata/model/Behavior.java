package work.keymap.zmk2kanata.model;

/**
 * A behavior declared in the keymap. The set of variants is closed; transformers switch over it
 * exhaustively.
 */
public sealed interface Behavior permits HoldTap, Macro, StickyKey, LayerSwitch, Combo, TapDance {
    /** Devicetree label if present, else the node name. */
    String name();

    /** Number of parameters a binding passes ({@code #binding-cells}). */
    int bindingCells();

    /** Source line of the declaring node. */
    int line();
}
