package work.keymap.zmk2kanata.dts;

import work.keymap.zmk2kanata.error.ConversionError;
import work.keymap.zmk2kanata.error.ConversionException;
import work.keymap.zmk2kanata.error.ErrorKind;
import work.keymap.zmk2kanata.error.Severity;
import work.keymap.zmk2kanata.shared.ContextSnippets;

/**
 * Structural syntax error in devicetree source. Carries the position and a rendered snippet.
 */
public final class DtsParseException extends ConversionException {
    private final int line;
    private final int column;
    private final String snippet;

    private DtsParseException(ConversionError error, int line, int column, String snippet) {
        super(error);
        this.line = line;
        this.column = column;
        this.snippet = snippet;
    }

    public static DtsParseException at(String source, String message, int line, int column) {
        String snippet = ContextSnippets.render(source, line, column);
        ConversionError error = ConversionError.of("parser", Severity.ERROR, ErrorKind.PARSE_ERROR, message)
            .at(line, column)
            .withContext("snippet", snippet);
        return new DtsParseException(error, line, column, snippet);
    }

    public static DtsParseException at(String source, String message, Token token) {
        return at(source, message, token.line(), token.column());
    }

    public int line() {
        return line;
    }

    public int column() {
        return column;
    }

    public String snippet() {
        return snippet;
    }

    @Override
    public String getMessage() {
        String base = super.getMessage() + " at line " + line + ", column " + column;
        return snippet.isEmpty() ? base : base + "\n\n" + snippet;
    }
}
