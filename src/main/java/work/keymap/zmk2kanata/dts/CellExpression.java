package work.keymap.zmk2kanata.dts;

import java.util.Optional;

/**
 * Evaluates the integer expressions the preprocessor leaves in cells, e.g.
 * {@code (((0x02) << 24) | ((0x07 << 16) | (0x04)))}. Supports {@code | & << >> + -} and parentheses.
 */
final class CellExpression {
    private final String text;
    private int pos;

    private CellExpression(String text) {
        this.text = text;
    }

    /**
     * @return the value with 64-bit intermediate precision, empty when the text is not an expression
     */
    static Optional<Long> evaluate(String text) {
        CellExpression expression = new CellExpression(text);
        try {
            long value = expression.or();
            expression.skipSpaces();
            if (expression.pos != text.length()) {
                return Optional.empty();
            }
            return Optional.of(value);
        } catch (NumberFormatException | IllegalStateException ex) {
            return Optional.empty();
        }
    }

    private long or() {
        long value = and();
        while (consume("|")) {
            value |= and();
        }
        return value;
    }

    private long and() {
        long value = shift();
        while (consume("&")) {
            value &= shift();
        }
        return value;
    }

    private long shift() {
        long value = additive();
        while (true) {
            if (consume("<<")) {
                value <<= additive();
            } else if (consume(">>")) {
                value >>= additive();
            } else {
                return value;
            }
        }
    }

    private long additive() {
        long value = unary();
        while (true) {
            if (consume("+")) {
                value += unary();
            } else if (consume("-")) {
                value -= unary();
            } else {
                return value;
            }
        }
    }

    private long unary() {
        if (consume("-")) {
            return -unary();
        }
        return primary();
    }

    private long primary() {
        skipSpaces();
        if (consume("(")) {
            long value = or();
            if (!consume(")")) {
                throw new IllegalStateException("expected ')'");
            }
            return value;
        }
        int start = pos;
        while (pos < text.length() && Character.isLetterOrDigit(text.charAt(pos))) {
            pos++;
        }
        String number = text.substring(start, pos);
        if (number.startsWith("0x") || number.startsWith("0X")) {
            return literal(number.substring(2), 16);
        }
        return literal(number, 10);
    }

    private static long literal(String digits, int radix) {
        try {
            return Long.parseLong(digits, radix);
        } catch (NumberFormatException ex) {
            if (!digits.isEmpty() && digits.chars().allMatch(ch -> Character.digit(ch, radix) >= 0)) {
                // a well-formed literal wider than 64 bits
                return Long.MAX_VALUE;
            }
            throw ex;
        }
    }

    private boolean consume(String symbol) {
        skipSpaces();
        if (text.startsWith(symbol, pos)) {
            pos += symbol.length();
            return true;
        }
        return false;
    }

    private void skipSpaces() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }
}
