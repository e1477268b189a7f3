package work.keymap.zmk2kanata.keys;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;
import org.junit.jupiter.api.Test;

class KeycodeMapTest {
    @Test
    void mapsCommonKeycodes() {
        assertEquals(Optional.of("a"), KeycodeMap.toKanata("A", ModifierStyle.PC));
        assertEquals(Optional.of("1"), KeycodeMap.toKanata("N1", ModifierStyle.PC));
        assertEquals(Optional.of("1"), KeycodeMap.toKanata("NUMBER_1", ModifierStyle.PC));
        assertEquals(Optional.of("spc"), KeycodeMap.toKanata("SPACE", ModifierStyle.PC));
        assertEquals(Optional.of("ret"), KeycodeMap.toKanata("RET", ModifierStyle.PC));
        assertEquals(Optional.of("bspc"), KeycodeMap.toKanata("BSPC", ModifierStyle.PC));
        assertEquals(Optional.of("f12"), KeycodeMap.toKanata("F12", ModifierStyle.PC));
        assertEquals(Optional.of("lsft"), KeycodeMap.toKanata("LSHIFT", ModifierStyle.PC));
        assertEquals(Optional.of("volu"), KeycodeMap.toKanata("C_VOL_UP", ModifierStyle.PC));
    }

    @Test
    void shiftedSymbolsBecomeChords() {
        assertEquals(Optional.of("S-1"), KeycodeMap.toKanata("EXCL", ModifierStyle.PC));
        assertEquals(Optional.of("S-min"), KeycodeMap.toKanata("UNDERSCORE", ModifierStyle.PC));
        assertEquals(Optional.of("S-/"), KeycodeMap.toKanata("QMARK", ModifierStyle.PC));
    }

    @Test
    void isCaseInsensitive() {
        assertEquals(Optional.of("esc"), KeycodeMap.toKanata("esc", ModifierStyle.PC));
        assertTrue(KeycodeMap.isKnown("lshift"));
        assertFalse(KeycodeMap.isKnown("NOT_A_KEY"));
    }

    @Test
    void decodesPreprocessedKeycodes() {
        assertEquals(Optional.of("A"), KeycodeMap.usageName(0x00070004));
        assertEquals("LS(A)", KeycodeMap.decode(0x02070004).orElseThrow().raw());
        assertEquals("LC(LS(B))", KeycodeMap.decode(0x03070005).orElseThrow().raw());
        assertEquals("LSHIFT", KeycodeMap.decode(0x000700E1).orElseThrow().raw());
        assertTrue(KeycodeMap.decode(0x0007FFFF).isEmpty());
    }

    @Test
    void numericUsagesResolveThroughTheTable() {
        assertEquals(Optional.of("a"), KeycodeMap.toKanata("0x70004", ModifierStyle.PC));
    }
}
