package work.keymap.zmk2kanata.shared;

import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

class ContextSnippetsTest {
    @Test
    void caretUnderColumn() {
        assertEquals("1 | a\n2 | bc\n  |  ^\n3 | d", ContextSnippets.render("a\nbc\nd", 2, 2, 1));
    }

    @Test
    void lineNumbersArePadded() {
        StringBuilder source = new StringBuilder();
        for (int i = 1; i <= 12; i++) {
            source.append("line").append(i).append('\n');
        }
        assertEquals(" 9 | line9\n10 | line10\n   | ^\n11 | line11", ContextSnippets.render(source.toString(), 10, 1, 1));
    }

    @Test
    void outOfRangeRendersNothing() {
        assertEquals("", ContextSnippets.render("a", 5, 1));
        assertEquals("", ContextSnippets.render("a", 0, 1));
        assertEquals("", ContextSnippets.render(null, 1, 1));
    }
}
