package work.keymap.zmk2kanata.error;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;
import org.junit.jupiter.api.Test;

class ErrorManagerTest {
    @Test
    void warningsAreRecordedBelowThreshold() {
        ErrorManager errors = new ErrorManager();
        errors.warning("extractor", ErrorKind.BINDING_RESOLUTION, "unknown behavior &foo", Map.of("owner", "layer base"));
        errors.debug("tokenizer", ErrorKind.PARSE_ERROR, "skipped #include");

        assertEquals(2, errors.errors().size());
        assertEquals(1, errors.errorsFrom("extractor").size());
        assertTrue(errors.hasErrorsAtLeast(Severity.WARNING));
        assertFalse(errors.hasErrorsAtLeast(Severity.ERROR));
    }

    @Test
    void reportRaisesAtThreshold() {
        ErrorManager errors = new ErrorManager(Severity.WARNING);
        ConversionException ex = assertThrows(ConversionException.class,
            () -> errors.warning("transformer", ErrorKind.UNSUPPORTED_FEATURE, "retro-tap", Map.of()));

        assertEquals(ErrorKind.UNSUPPORTED_FEATURE, ex.kind());
        assertSame(errors.errors().get(0), ex.error());
    }

    @Test
    void recordNeverRaises() {
        ErrorManager errors = new ErrorManager(Severity.DEBUG);
        errors.record(ConversionError.of("input", Severity.CRITICAL, ErrorKind.INPUT_FAILURE, "gone"));
        assertTrue(errors.hasErrorsAtLeast(Severity.CRITICAL));
    }

    @Test
    void reportCountsBySeverityAndSource() {
        ErrorManager errors = new ErrorManager();
        errors.warning("extractor", ErrorKind.BINDING_RESOLUTION, "a", Map.of());
        errors.warning("extractor", ErrorKind.BINDING_RESOLUTION, "b", Map.of());
        errors.debug("parser", ErrorKind.PARSE_ERROR, "c");

        ErrorReport report = errors.toReport();

        assertEquals(3, report.total());
        assertEquals(2, report.count(Severity.WARNING));
        assertEquals(0, report.count(Severity.CRITICAL));
        assertEquals(2, report.bySource().get("extractor").size());
        assertEquals(0, report.countsBySeverity().get("error"));
    }

    @Test
    void describeIncludesPosition() {
        ConversionError error = ConversionError.of("parser", Severity.ERROR, ErrorKind.PARSE_ERROR, "Missing ';'").at(3, 1);
        assertEquals("[ERROR] parser: Missing ';' (line 3, column 1)", error.describe());
    }

    @Test
    void severityNames() {
        assertEquals(Severity.WARNING, Severity.from("warn"));
        assertEquals(Severity.CRITICAL, Severity.from("Fatal"));
        assertEquals(Severity.INFO, Severity.from(" info "));
        assertEquals(Severity.ERROR, Severity.from(""));
        assertThrows(IllegalArgumentException.class, () -> Severity.from("loud"));
        assertTrue(Severity.CRITICAL.isAtLeast(Severity.ERROR));
        assertFalse(Severity.INFO.isAtLeast(Severity.WARNING));
    }
}
