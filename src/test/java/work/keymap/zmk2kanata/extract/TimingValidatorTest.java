package work.keymap.zmk2kanata.extract;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;
import work.keymap.zmk2kanata.error.ErrorKind;
import work.keymap.zmk2kanata.error.ErrorManager;

class TimingValidatorTest {
    private final ErrorManager errors = new ErrorManager();
    private final TimingValidator validator = new TimingValidator(errors, "extractor");

    @Test
    void keepsPlausibleValues() {
        assertEquals(Optional.of(1), validator.validate("macro m", "wait-ms", Optional.of(1)));
        assertEquals(Optional.of(10_000), validator.validate("macro m", "wait-ms", Optional.of(10_000)));
        assertEquals(Optional.empty(), validator.validate("macro m", "wait-ms", Optional.empty()));
        assertTrue(errors.errors().isEmpty());
    }

    @Test
    void rejectsNegativeZeroAndAbsurdValues() {
        assertEquals(Optional.empty(), validator.validate("macro m", "wait-ms", Optional.of(-10)));
        assertEquals(Optional.empty(), validator.validate("macro m", "wait-ms", Optional.of(0)));
        assertEquals(Optional.empty(), validator.validate("macro m", "wait-ms", Optional.of(10_001)));
        assertEquals(3, errors.errors().size());
        assertTrue(errors.errors().stream().allMatch(error -> error.kind() == ErrorKind.TIMING_VALIDATION));
        assertEquals(-10, errors.errors().get(0).context().get("value"));
    }
}
