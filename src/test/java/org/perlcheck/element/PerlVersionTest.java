package org.perlcheck.element;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class PerlVersionTest {

    @Test
    public void testDecimalAndDottedNotationsAgree() {
        assertEquals(PerlVersion.parse("v5.10.0"), PerlVersion.parse("5.010"));
        assertEquals(PerlVersion.parse("5.10.1"), PerlVersion.parse("5.010001"));
        assertEquals(PerlVersion.parse("v5.36"), PerlVersion.parse("5.036"));
        assertEquals(PerlVersion.parse("5.010").hashCode(), PerlVersion.parse("v5.10.0").hashCode());
    }

    @Test
    public void testComponents() {
        PerlVersion version = PerlVersion.parse("5.008_001");

        assertEquals(5, version.getRevision());
        assertEquals(8, version.getVersion());
        assertEquals(1, version.getSubversion());
        assertEquals("v5.8.1", version.toString());
    }

    @Test
    public void testShortFractionIsPadded() {
        assertEquals(600, PerlVersion.parse("5.6").getVersion());
    }

    @Test
    public void testOrdering() {
        assertTrue(PerlVersion.parse("5.012").isAtLeast(PerlVersion.NAMED_CAPTURES));
        assertTrue(PerlVersion.parse("5.010").isAtLeast(PerlVersion.NAMED_CAPTURES));
        assertFalse(PerlVersion.parse("5.008").isAtLeast(PerlVersion.NAMED_CAPTURES));
        assertFalse(PerlVersion.parse("v5.9.5").isAtLeast(PerlVersion.NAMED_CAPTURES));
        assertTrue(PerlVersion.parse("6").isAtLeast(PerlVersion.parse("5.999")));
    }

    @Test
    public void testNotAVersion() {
        assertThrows(IllegalArgumentException.class, () -> PerlVersion.parse("strict"));
        assertThrows(IllegalArgumentException.class, () -> PerlVersion.parse("0x10"));
    }
}
