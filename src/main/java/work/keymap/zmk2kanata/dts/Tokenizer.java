package work.keymap.zmk2kanata.dts;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import work.keymap.zmk2kanata.error.ErrorKind;
import work.keymap.zmk2kanata.error.ErrorManager;

/**
 * Turns devicetree source into a materialized token list.
 *
 * <p>Comments are blanked before scanning (newlines kept, so positions still match the
 * original text). Preprocessor leftovers starting with {@code #} are blanked unless the line
 * holds an {@code =}, which keeps {@code #binding-cells = <1>;}. A whole {@code <...>} cell
 * array is returned as a single {@link TokenKind#ARRAY} token.
 */
public final class Tokenizer {
    static final int MIN_ITERATIONS = 10_000;
    static final int ITERATIONS_PER_CHAR = 8;

    private static final String SOURCE = "tokenizer";

    private final ErrorManager errors;

    private String original;
    private String text;
    private int pos;
    private int line;
    private int column;

    public Tokenizer(ErrorManager errors) {
        this.errors = Objects.requireNonNull(errors, "errors");
    }

    public List<Token> tokenize(String source) {
        Objects.requireNonNull(source, "source");
        this.original = source;
        this.text = blankDirectives(stripComments(source));
        this.pos = 0;
        this.line = 1;
        this.column = 1;

        List<Token> tokens = new ArrayList<>();
        long ceiling = Math.max(MIN_ITERATIONS, (long) ITERATIONS_PER_CHAR * text.length());
        long iterations = 0;
        while (true) {
            if (++iterations > ceiling) {
                throw DtsParseException.at(original, "Tokenizer exceeded its iteration limit of " + ceiling, line, column);
            }
            skipWhitespace();
            if (pos >= text.length()) {
                break;
            }
            int before = pos;
            tokens.add(next());
            if (pos == before) {
                throw DtsParseException.at(original, "Tokenizer made no progress on '" + text.charAt(pos) + "'", line, column);
            }
        }
        tokens.add(new Token(TokenKind.EOF, "", line, column, pos));
        return tokens;
    }

    private Token next() {
        char c = text.charAt(pos);
        int startLine = line;
        int startColumn = column;
        int startOffset = pos;
        switch (c) {
            case '{':
                advance(1);
                return new Token(TokenKind.LBRACE, "{", startLine, startColumn, startOffset);
            case '}':
                advance(1);
                return new Token(TokenKind.RBRACE, "}", startLine, startColumn, startOffset);
            case ';':
                advance(1);
                return new Token(TokenKind.SEMICOLON, ";", startLine, startColumn, startOffset);
            case '=':
                advance(1);
                return new Token(TokenKind.EQUALS, "=", startLine, startColumn, startOffset);
            case ',':
                advance(1);
                return new Token(TokenKind.COMMA, ",", startLine, startColumn, startOffset);
            case ':':
                advance(1);
                return new Token(TokenKind.COLON, ":", startLine, startColumn, startOffset);
            case '"':
                return readString(startLine, startColumn, startOffset);
            case '<':
                return readArray(startLine, startColumn, startOffset);
            case '&':
                return readReference(startLine, startColumn, startOffset);
            case '/':
                return readSlash(startLine, startColumn, startOffset);
            default:
                break;
        }
        if (isIdentifierStart(c)) {
            return readWord(startLine, startColumn, startOffset);
        }
        advance(1);
        return new Token(TokenKind.UNKNOWN, String.valueOf(c), startLine, startColumn, startOffset);
    }

    private Token readString(int startLine, int startColumn, int startOffset) {
        advance(1);
        StringBuilder value = new StringBuilder();
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (c == '\\' && pos + 1 < text.length()) {
                value.append(unescape(text.charAt(pos + 1)));
                advance(2);
                continue;
            }
            if (c == '"') {
                advance(1);
                return new Token(TokenKind.STRING, value.toString(), startLine, startColumn, startOffset);
            }
            if (c == '\n') {
                break;
            }
            value.append(c);
            advance(1);
        }
        throw DtsParseException.at(original, "Unterminated string literal", startLine, startColumn);
    }

    private Token readArray(int startLine, int startColumn, int startOffset) {
        int depth = 0;
        boolean inString = false;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            char la = pos + 1 < text.length() ? text.charAt(pos + 1) : '\0';
            if (inString) {
                if (c == '\\') {
                    advance(Math.min(2, text.length() - pos));
                    continue;
                }
                if (c == '"') {
                    inString = false;
                }
                advance(1);
                continue;
            }
            if (c == '"') {
                inString = true;
                advance(1);
                continue;
            }
            // shift operators inside cell expressions do not nest
            if (depth > 0 && (c == '<' && la == '<' || c == '>' && la == '>')) {
                advance(2);
                continue;
            }
            if (c == '<') {
                depth++;
            } else if (c == '>') {
                depth--;
                if (depth == 0) {
                    advance(1);
                    return new Token(TokenKind.ARRAY, text.substring(startOffset, pos), startLine, startColumn, startOffset);
                }
            }
            advance(1);
        }
        throw DtsParseException.at(original, "Unterminated array starting here", startLine, startColumn);
    }

    private Token readReference(int startLine, int startColumn, int startOffset) {
        advance(1);
        if (pos < text.length() && text.charAt(pos) == '{') {
            while (pos < text.length() && text.charAt(pos) != '}') {
                advance(1);
            }
            if (pos >= text.length()) {
                throw DtsParseException.at(original, "Unterminated path reference", startLine, startColumn);
            }
            advance(1);
        } else {
            while (pos < text.length() && isIdentifierStart(text.charAt(pos))) {
                advance(1);
            }
        }
        return new Token(TokenKind.REFERENCE, text.substring(startOffset, pos), startLine, startColumn, startOffset);
    }

    private Token readSlash(int startLine, int startColumn, int startOffset) {
        int end = pos + 1;
        while (end < text.length() && (Character.isLetterOrDigit(text.charAt(end)) || text.charAt(end) == '-')) {
            end++;
        }
        if (end > pos + 1 && end < text.length() && text.charAt(end) == '/') {
            advance(end + 1 - pos);
            return new Token(TokenKind.DIRECTIVE, text.substring(startOffset, pos), startLine, startColumn, startOffset);
        }
        advance(1);
        return new Token(TokenKind.ROOT, "/", startLine, startColumn, startOffset);
    }

    private Token readWord(int startLine, int startColumn, int startOffset) {
        while (pos < text.length() && isIdentifierPart(text.charAt(pos))) {
            advance(1);
        }
        String word = text.substring(startOffset, pos);
        TokenKind kind = isNumber(word) ? TokenKind.NUMBER : TokenKind.IDENTIFIER;
        return new Token(kind, word, startLine, startColumn, startOffset);
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            advance(1);
        }
    }

    private void advance(int count) {
        for (int i = 0; i < count && pos < text.length(); i++) {
            if (text.charAt(pos) == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
            pos++;
        }
    }

    static boolean isNumber(String word) {
        if (word.startsWith("0x") || word.startsWith("0X")) {
            return word.length() > 2 && word.substring(2).chars().allMatch(ch -> Character.digit(ch, 16) >= 0);
        }
        return !word.isEmpty() && word.chars().allMatch(Character::isDigit);
    }

    private static boolean isIdentifierStart(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '#' || c == '-' || c == '.' || c == '+' || c == '@';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || c == ',';
    }

    private static char unescape(char c) {
        switch (c) {
            case 'n':
                return '\n';
            case 't':
                return '\t';
            case 'r':
                return '\r';
            default:
                return c;
        }
    }

    /**
     * Replaces comments with spaces, keeping newlines and string literals intact.
     */
    static String stripComments(String source) {
        StringBuilder out = new StringBuilder(source.length());
        int i = 0;
        boolean inString = false;
        while (i < source.length()) {
            char c = source.charAt(i);
            char la = i + 1 < source.length() ? source.charAt(i + 1) : '\0';
            if (inString) {
                out.append(c);
                if (c == '\\' && la != '\0' && la != '\n') {
                    out.append(la);
                    i += 2;
                    continue;
                }
                if (c == '"' || c == '\n') {
                    inString = false;
                }
                i++;
                continue;
            }
            if (c == '"') {
                inString = true;
                out.append(c);
                i++;
            } else if (c == '/' && la == '/') {
                while (i < source.length() && source.charAt(i) != '\n') {
                    out.append(' ');
                    i++;
                }
            } else if (c == '/' && la == '*') {
                int end = source.indexOf("*/", i + 2);
                int stop = end < 0 ? source.length() : end + 2;
                for (int j = i; j < stop; j++) {
                    out.append(source.charAt(j) == '\n' ? '\n' : ' ');
                }
                i = stop;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /**
     * Blanks preprocessor leftovers ({@code # 12 "file"}, stray {@code #include}/{@code #define}).
     * Lines holding an {@code =} are property assignments and stay.
     */
    String blankDirectives(String source) {
        String[] lines = source.split("\n", -1);
        boolean continuation = false;
        for (int i = 0; i < lines.length; i++) {
            String current = lines[i];
            String trimmed = current.strip();
            if (continuation) {
                continuation = trimmed.endsWith("\\");
                lines[i] = "";
                continue;
            }
            if (trimmed.startsWith("#") && !trimmed.contains("=")) {
                errors.debug(SOURCE, ErrorKind.PARSE_ERROR, "Skipped preprocessor line " + (i + 1) + ": " + trimmed);
                continuation = trimmed.endsWith("\\");
                lines[i] = "";
            }
        }
        return String.join("\n", lines);
    }
}
