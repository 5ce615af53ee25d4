package search;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static search.ByteStrings.ascii;

public class AlphabetTest {

    @Test
    public void testBinary() {
        assertEquals(2, Alphabet.BINARY.size());
        assertEquals(0, Alphabet.BINARY.index(0));
        assertEquals(1, Alphabet.BINARY.index(1));
        assertEquals(-1, Alphabet.BINARY.index(2));
        assertEquals(256, Alphabet.FULL_BYTE.size());
    }

    @Test
    public void testIndexIsShiftedBySmallestSymbol() {
        Alphabet a = new Alphabet('a', 'd');
        assertEquals(4, a.size());
        assertEquals(0, a.index('a'));
        assertEquals(3, a.index('d'));
        assertEquals(-1, a.index('e'));
        assertEquals(-1, a.index('`'));
        assertTrue(a.contains('c'));
        assertFalse(a.contains('z'));
    }

    @Test
    public void testDeriveCoversPatternAndText() {
        byte[] p = ascii("cab");
        byte[] t = ascii("bbbbx");
        Alphabet a = Alphabet.derive(p, p.length, t, t.length);
        assertEquals('a', a.minChar());
        assertEquals('x', a.maxChar());
    }

    @Test
    public void testDeriveTreatsBytesAsUnsigned() {
        byte[] p = {(byte) 0xF0};
        byte[] t = {(byte) 0x10, (byte) 0xFF};
        Alphabet a = Alphabet.derive(p, 1, t, 2);
        assertEquals(0x10, a.minChar());
        assertEquals(0xFF, a.maxChar());
    }

    @Test
    public void testDeriveOnlyLooksAtPrefixes() {
        byte[] p = ascii("aaz");
        byte[] t = ascii("bbz");
        Alphabet a = Alphabet.derive(p, 2, t, 2);
        assertEquals(new Alphabet('a', 'b'), a);
    }

    @Test
    public void testFirstOutside() {
        assertEquals(-1, Alphabet.BINARY.firstOutside(new byte[]{0, 1, 1}, 3));
        assertEquals(2, Alphabet.BINARY.firstOutside(new byte[]{0, 1, 2}, 3));
        assertEquals(-1, Alphabet.BINARY.firstOutside(new byte[]{0, 1, 2}, 2));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsInvertedBounds() {
        new Alphabet(5, 4);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsBoundsAboveByteRange() {
        new Alphabet(0, 256);
    }
}
