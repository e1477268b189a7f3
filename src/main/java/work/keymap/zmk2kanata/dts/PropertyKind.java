package work.keymap.zmk2kanata.dts;

/**
 * Shape of a property value as written in the source.
 */
public enum PropertyKind {
    /** {@code name = "text";} */
    STRING,
    /** {@code name = "a", "b";} */
    STRING_LIST,
    /** {@code name = 42;} */
    INTEGER,
    /** {@code name = <...>, <...>;} with integer and string cells. */
    ARRAY,
    /** {@code name = &label;} */
    REFERENCE,
    /** {@code name;} */
    BOOLEAN
}
