package work.keymap.zmk2kanata.dts;

/**
 * Token categories produced by the {@link Tokenizer}.
 */
public enum TokenKind {
    ROOT,
    LBRACE,
    RBRACE,
    SEMICOLON,
    EQUALS,
    COMMA,
    COLON,
    IDENTIFIER,
    NUMBER,
    STRING,
    /** A whole {@code <...>} cell array, brackets included. */
    ARRAY,
    REFERENCE,
    /** Devicetree directives such as {@code /dts-v1/}. */
    DIRECTIVE,
    UNKNOWN,
    EOF
}
