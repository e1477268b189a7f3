package work.keymap.zmk2kanata.dts;

import java.util.Objects;

/**
 * A lexical token with its 1-based line/column and 0-based offset.
 */
public record Token(TokenKind kind, String text, int line, int column, int offset) {
    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    @Override
    public String toString() {
        return kind + "('" + text + "') at line " + line + ", column " + column;
    }
}
