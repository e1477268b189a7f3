package work.keymap.zmk2kanata.shared;

/**
 * Renders a few source lines around a position with a caret under the offending column.
 */
public final class ContextSnippets {
    public static final int DEFAULT_CONTEXT_LINES = 2;

    private ContextSnippets() {}

    public static String render(String source, int line, int column) {
        return render(source, line, column, DEFAULT_CONTEXT_LINES);
    }

    public static String render(String source, int line, int column, int contextLines) {
        if (source == null || line < 1) {
            return "";
        }
        String[] lines = source.split("\\r?\\n", -1);
        if (line > lines.length) {
            return "";
        }
        int start = Math.max(0, line - contextLines - 1);
        int end = Math.min(lines.length, line + contextLines);
        int width = String.valueOf(end).length();

        StringBuilder sb = new StringBuilder();
        for (int i = start; i < end; i++) {
            if (sb.length() > 0) {
                sb.append('\n');
            }
            sb.append(pad(String.valueOf(i + 1), width)).append(" | ").append(lines[i]);
            if (i == line - 1) {
                sb.append('\n').append(" ".repeat(width)).append(" | ")
                    .append(" ".repeat(Math.max(0, column - 1))).append('^');
            }
        }
        return sb.toString();
    }

    private static String pad(String value, int width) {
        return " ".repeat(Math.max(0, width - value.length())) + value;
    }
}
