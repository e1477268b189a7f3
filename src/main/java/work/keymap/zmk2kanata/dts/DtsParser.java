package work.keymap.zmk2kanata.dts;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import work.keymap.zmk2kanata.error.ErrorKind;
import work.keymap.zmk2kanata.error.ErrorManager;

/**
 * Recursive-descent parser from tokens to a {@link DtsRoot}.
 *
 * <p>Preprocessed keymaps legitimately contain several {@code / { ... };} blocks (one per included
 * file), so top-level blocks, stray anonymous {@code { ... }} blocks and duplicate child nodes are
 * merged; a later property replaces an earlier one and is reported as a warning. Top-level
 * {@code &label { ... };} overrides are merged into the labelled node when it exists.
 */
public final class DtsParser {
    private static final String SOURCE = "parser";

    private final ErrorManager errors;
    private final Tokenizer tokenizer;

    private String source;
    private List<Token> tokens;
    private int index;

    public DtsParser(ErrorManager errors) {
        this.errors = Objects.requireNonNull(errors, "errors");
        this.tokenizer = new Tokenizer(errors);
    }

    public DtsRoot parse(String text) {
        this.source = Objects.requireNonNull(text, "text");
        this.tokens = tokenizer.tokenize(text);
        this.index = 0;

        DtsRoot root = new DtsRoot();
        List<LabelOverride> overrides = new ArrayList<>();
        int rootBlocks = 0;
        while (!peek().is(TokenKind.EOF)) {
            Token token = peek();
            switch (token.kind()) {
                case DIRECTIVE:
                    skipDirective();
                    break;
                case ROOT: {
                    advance();
                    expect(TokenKind.LBRACE, "Expected '{' after '/'");
                    DtsNode block = new DtsNode(DtsRoot.NAME, token.line());
                    parseBody(block, token);
                    optional(TokenKind.SEMICOLON);
                    if (rootBlocks++ > 0) {
                        errors.debug(SOURCE, ErrorKind.PARSE_ERROR, "Merging root block at line " + token.line());
                    }
                    merge(root, block);
                    break;
                }
                case LBRACE: {
                    advance();
                    errors.warning(SOURCE, ErrorKind.PARSE_ERROR,
                        "Stray '{' at top level parsed as an anonymous block and merged into the root",
                        Map.of("line", token.line(), "column", token.column()));
                    DtsNode block = new DtsNode(DtsRoot.NAME, token.line());
                    parseBody(block, token);
                    optional(TokenKind.SEMICOLON);
                    merge(root, block);
                    break;
                }
                case REFERENCE: {
                    advance();
                    expect(TokenKind.LBRACE, "Expected '{' after reference " + token.text());
                    DtsNode block = new DtsNode(token.text(), token.line());
                    parseBody(block, token);
                    optional(TokenKind.SEMICOLON);
                    overrides.add(new LabelOverride(token, block));
                    break;
                }
                default:
                    throw DtsParseException.at(source, "Unexpected '" + token.text() + "' at top level, expected '/ {'", token);
            }
        }
        applyOverrides(root, overrides);
        root.seal(source);
        return root;
    }

    private void parseBody(DtsNode node, Token opener) {
        while (true) {
            Token token = peek();
            switch (token.kind()) {
                case RBRACE:
                    advance();
                    return;
                case EOF:
                    throw DtsParseException.at(source, "Missing '}' for node '" + node.name() + "' opened here", opener);
                case SEMICOLON:
                    advance();
                    break;
                case DIRECTIVE:
                    skipDirective();
                    break;
                case IDENTIFIER:
                case NUMBER:
                    parseMember(node);
                    break;
                default:
                    throw DtsParseException.at(source, "Unexpected '" + token.text() + "' in node '" + node.name() + "'", token);
            }
        }
    }

    private void parseMember(DtsNode node) {
        List<String> labels = new ArrayList<>();
        while (peek().is(TokenKind.IDENTIFIER) && peekAt(1).is(TokenKind.COLON)) {
            labels.add(advance().text());
            advance();
        }
        Token nameToken = advance();
        if (!nameToken.is(TokenKind.IDENTIFIER) && !nameToken.is(TokenKind.NUMBER)) {
            throw DtsParseException.at(source, "Expected a node name after label", nameToken);
        }
        String name = nameToken.text();
        Token next = peek();
        if (next.is(TokenKind.LBRACE) || !labels.isEmpty()) {
            expect(TokenKind.LBRACE, "Expected '{' after node name '" + name + "'");
            DtsNode child = new DtsNode(name, nameToken.line());
            labels.forEach(child::addLabel);
            parseBody(child, nameToken);
            expect(TokenKind.SEMICOLON, "Missing ';' after node '" + name + "'");
            Optional<DtsNode> existing = node.child(name);
            if (existing.isPresent()) {
                merge(existing.get(), child);
            } else {
                node.addChild(child);
            }
            return;
        }
        if (next.is(TokenKind.SEMICOLON)) {
            advance();
            setProperty(node, DtsProperty.flag(name, nameToken.line()));
            return;
        }
        if (next.is(TokenKind.EQUALS)) {
            advance();
            DtsProperty property = parseValue(name, nameToken);
            expect(TokenKind.SEMICOLON, "Missing ';' after property '" + name + "'");
            setProperty(node, property);
            return;
        }
        throw DtsParseException.at(source, "Expected '=', ';' or '{' after '" + name + "'", next);
    }

    private DtsProperty parseValue(String name, Token nameToken) {
        List<Object> parts = new ArrayList<>();
        List<Integer> cellLines = new ArrayList<>();
        List<TokenKind> kinds = new ArrayList<>();
        while (true) {
            Token token = peek();
            switch (token.kind()) {
                case STRING:
                    parts.add(token.text());
                    cellLines.add(token.line());
                    break;
                case NUMBER:
                    parts.add(cellInteger(token.text(), token.line(), token.column()));
                    cellLines.add(token.line());
                    break;
                case REFERENCE:
                    parts.add(token.text());
                    cellLines.add(token.line());
                    break;
                case ARRAY:
                    splitCells(token, parts, cellLines);
                    break;
                default:
                    throw DtsParseException.at(source, "Invalid value for property '" + name + "'", token);
            }
            kinds.add(token.kind());
            advance();
            if (!optional(TokenKind.COMMA)) {
                break;
            }
        }

        if (kinds.size() == 1 && !kinds.contains(TokenKind.ARRAY)) {
            TokenKind only = kinds.get(0);
            PropertyKind kind = only == TokenKind.STRING ? PropertyKind.STRING
                : only == TokenKind.NUMBER ? PropertyKind.INTEGER
                : PropertyKind.REFERENCE;
            return new DtsProperty(name, parts.get(0), kind, nameToken.line(), List.of());
        }
        boolean allStrings = kinds.stream().allMatch(kind -> kind == TokenKind.STRING);
        PropertyKind kind = allStrings ? PropertyKind.STRING_LIST : PropertyKind.ARRAY;
        return new DtsProperty(name, parts, kind, nameToken.line(), cellLines);
    }

    /**
     * Splits {@code <...>} into whitespace separated cells. Parenthesised groups such as
     * {@code LC(LS(A))} or {@code (1 << 2)} stay whole.
     */
    private void splitCells(Token array, List<Object> cells, List<Integer> cellLines) {
        String text = array.text();
        int line = array.line();
        int column = array.column() + 1;
        int depth = 0;
        StringBuilder current = new StringBuilder();
        int cellLine = line;
        int cellColumn = column;
        for (int i = 1; i < text.length() - 1; i++) {
            char c = text.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')' && depth > 0) {
                depth--;
            }
            if (Character.isWhitespace(c) && depth == 0) {
                flushCell(current, cellLine, cellColumn, cells, cellLines);
            } else {
                if (current.length() == 0) {
                    cellLine = line;
                    cellColumn = column;
                }
                current.append(c);
            }
            if (c == '\n') {
                line++;
                column = 1;
            } else {
                column++;
            }
        }
        flushCell(current, cellLine, cellColumn, cells, cellLines);
    }

    private void flushCell(StringBuilder current, int line, int column, List<Object> cells, List<Integer> cellLines) {
        if (current.length() == 0) {
            return;
        }
        String cell = current.toString();
        current.setLength(0);
        String body = cell.startsWith("-") ? cell.substring(1) : cell;
        Object value = cell;
        if (Tokenizer.isNumber(body)) {
            value = cellInteger(cell, line, column);
        } else if (cell.startsWith("(")) {
            Optional<Long> evaluated = CellExpression.evaluate(cell);
            if (evaluated.isPresent()) {
                value = toCell(evaluated.get())
                    .orElseThrow(() -> outOfRange(cell, line, column));
            }
        }
        cells.add(value);
        cellLines.add(line);
    }

    private Integer cellInteger(String text, int line, int column) {
        return parseInteger(text).orElseThrow(() -> outOfRange(text, line, column));
    }

    private DtsParseException outOfRange(String text, int line, int column) {
        return DtsParseException.at(source, "Integer " + text + " does not fit in a 32-bit cell", line, column);
    }

    /**
     * Cells are 32 bits wide: values up to {@code 0xFFFFFFFF} are kept as their two's complement
     * {@code int}, anything wider is rejected.
     */
    static Optional<Integer> parseInteger(String text) {
        boolean negative = text.startsWith("-");
        String body = negative ? text.substring(1) : text;
        long value;
        try {
            value = body.startsWith("0x") || body.startsWith("0X")
                ? Long.parseLong(body.substring(2), 16)
                : Long.parseLong(body);
        } catch (NumberFormatException ex) {
            return Optional.empty();
        }
        return toCell(negative ? -value : value);
    }

    static Optional<Integer> toCell(long value) {
        if (value < Integer.MIN_VALUE || value > 0xFFFFFFFFL) {
            return Optional.empty();
        }
        return Optional.of((int) value);
    }

    private void setProperty(DtsNode node, DtsProperty property) {
        DtsProperty previous = node.putProperty(property);
        if (previous != null && !previous.value().equals(property.value())) {
            errors.warning(SOURCE, ErrorKind.PARSE_ERROR,
                "Property '" + property.name() + "' of " + node.path() + " redefined at line " + property.line()
                    + " (previous value from line " + previous.line() + " replaced)",
                Map.of("node", node.path(), "property", property.name()));
        }
    }

    /**
     * Merges {@code incoming} into {@code target}: labels are added, properties overwrite, children
     * merge recursively.
     */
    private void merge(DtsNode target, DtsNode incoming) {
        incoming.labels().forEach(target::addLabel);
        for (DtsProperty property : incoming.properties().values()) {
            setProperty(target, property);
        }
        for (DtsNode child : new ArrayList<>(incoming.children())) {
            Optional<DtsNode> existing = target.child(child.name());
            if (existing.isPresent()) {
                merge(existing.get(), child);
            } else {
                target.addChild(child);
            }
        }
    }

    private void applyOverrides(DtsRoot root, List<LabelOverride> overrides) {
        for (LabelOverride override : overrides) {
            String label = override.reference().text().substring(1);
            Optional<DtsNode> target = root.descendants().stream()
                .filter(node -> node.labels().contains(label))
                .findFirst();
            if (target.isPresent()) {
                merge(target.get(), override.block());
            } else {
                errors.warning(SOURCE, ErrorKind.UNSUPPORTED_FEATURE,
                    "Override of unknown label " + override.reference().text() + " ignored",
                    Map.of("line", override.reference().line()));
            }
        }
    }

    private void skipDirective() {
        Token directive = advance();
        while (!peek().is(TokenKind.SEMICOLON) && !peek().is(TokenKind.EOF)
            && !peek().is(TokenKind.ROOT) && !peek().is(TokenKind.LBRACE) && !peek().is(TokenKind.RBRACE)) {
            advance();
        }
        optional(TokenKind.SEMICOLON);
        errors.debug(SOURCE, ErrorKind.PARSE_ERROR, "Ignored directive " + directive.text() + " at line " + directive.line());
    }

    private Token peek() {
        return peekAt(0);
    }

    private Token peekAt(int offset) {
        int target = Math.min(index + offset, tokens.size() - 1);
        return tokens.get(target);
    }

    private Token advance() {
        Token token = peek();
        if (!token.is(TokenKind.EOF)) {
            index++;
        }
        return token;
    }

    private Token expect(TokenKind kind, String message) {
        Token token = peek();
        if (!token.is(kind)) {
            throw DtsParseException.at(source, message, token);
        }
        return advance();
    }

    private boolean optional(TokenKind kind) {
        if (peek().is(kind)) {
            advance();
            return true;
        }
        return false;
    }

    private record LabelOverride(Token reference, DtsNode block) {
    }
}
