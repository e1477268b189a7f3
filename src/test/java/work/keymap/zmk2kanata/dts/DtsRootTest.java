package work.keymap.zmk2kanata.dts;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;
import work.keymap.zmk2kanata.error.ErrorManager;

class DtsRootTest {
    private final DtsParser parser = new DtsParser(new ErrorManager());

    @Test
    void duplicateLabelOnDistinctNodesFails() {
        DtsParseException ex = assertThrows(DtsParseException.class,
            () -> parser.parse("/ { a: n1 { }; a: n2 { }; };"));
        assertTrue(ex.error().message().contains("Duplicate label 'a'"));
    }

    @Test
    void resolvesLabelsAndPaths() {
        DtsRoot root = parser.parse("/ { x: n1 { m: inner { }; }; other { }; };");

        assertEquals("/n1", root.resolveReference("&x").orElseThrow().path());
        assertEquals("/n1/inner", root.resolveReference("m").orElseThrow().path());
        assertEquals("/n1/inner", root.resolveReference("&{/n1/inner}").orElseThrow().path());
        assertEquals(2, root.labelIndex().size());
        assertEquals(root.findByLabel("x").orElseThrow(), root.node(root.labelIndex().get("x")));
    }

    @Test
    void unknownReferencesAreNotFound() {
        DtsRoot root = parser.parse("/ { x: n1 { }; };");

        assertTrue(root.resolveReference("&nope").isEmpty());
        assertTrue(root.resolveReference("&{/missing}").isEmpty());
        assertTrue(root.findByLabel("nope").isEmpty());
        assertTrue(root.resolveReference("").isEmpty());
    }
}
