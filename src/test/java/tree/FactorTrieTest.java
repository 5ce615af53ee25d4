package tree;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntOpenHashSet;
import org.junit.Test;
import search.Alphabet;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;
import static search.ByteStrings.ascii;
import static search.ByteStrings.digits;

public class FactorTrieTest {

    @Test
    public void testSharedFactorsLandOnOneNode() {
        byte[] x = digits("0100101");
        FactorTrie trie = FactorTrie.build(x, x.length, 2, Alphabet.BINARY);

        int n01 = trie.locate(digits("01"), 0);
        int n10 = trie.locate(digits("10"), 0);
        int n00 = trie.locate(digits("00"), 0);
        int n11 = trie.locate(digits("11"), 0);

        // factors: 01@0 10@1 00@2 01@3 10@4 01@5
        assertEquals(IntArrayList.wrap(new int[]{0, 3, 5}), trie.positionsAt(n01));
        assertEquals(IntArrayList.wrap(new int[]{1, 4}), trie.positionsAt(n10));
        assertEquals(IntArrayList.wrap(new int[]{2}), trie.positionsAt(n00));
        assertEquals(FactorTrie.NONE, n11);
        assertEquals(6, trie.positionCount());
        // root, '0', '1', and the three depth-2 nodes
        assertEquals(6, trie.nodeCount());
    }

    @Test
    public void testPositionsAreAscending() {
        Random rnd = new Random(7);
        byte[] x = new byte[300];
        for (int i = 0; i < x.length; i++) x[i] = (byte) rnd.nextInt(2);
        FactorTrie trie = FactorTrie.build(x, x.length, 4, Alphabet.BINARY);
        for (int v = 0; v < 16; v++) {
            byte[] f = {(byte) (v >> 3 & 1), (byte) (v >> 2 & 1), (byte) (v >> 1 & 1), (byte) (v & 1)};
            int node = trie.locate(f, 0);
            if (node == FactorTrie.NONE) continue;
            IntArrayList ps = new IntArrayList(trie.positionsAt(node));
            for (int i = 1; i < ps.size(); i++) {
                assertTrue(ps.getInt(i - 1) < ps.getInt(i));
            }
        }
    }

    @Test
    public void testInsertionOrderDoesNotChangeContent() {
        Random rnd = new Random(11);
        byte[] x = new byte[120];
        for (int i = 0; i < x.length; i++) x[i] = (byte) rnd.nextInt(3);
        Alphabet alphabet = new Alphabet(0, 2);
        int l = 3;

        FactorTrie ordered = FactorTrie.build(x, x.length, l, alphabet);

        List<Integer> offsets = new ArrayList<>();
        for (int k = 0; k <= x.length - l; k++) offsets.add(k);
        Collections.shuffle(offsets, rnd);
        FactorTrie shuffled = new FactorTrie(l, alphabet);
        for (int k : offsets) {
            assertTrue(shuffled.insert(x, k, k));
        }

        assertEquals(ordered.nodeCount(), shuffled.nodeCount());
        assertEquals(ordered.positionCount(), shuffled.positionCount());
        for (int k = 0; k <= x.length - l; k++) {
            IntOpenHashSet a = new IntOpenHashSet(ordered.positionsAt(ordered.locate(x, k)));
            IntOpenHashSet b = new IntOpenHashSet(shuffled.positionsAt(shuffled.locate(x, k)));
            assertEquals(a, b);
            assertTrue(a.contains(k));
        }
    }

    @Test
    public void testOutOfRangeSymbolsFailClosed() {
        Alphabet lower = new Alphabet('a', 'c');
        byte[] x = ascii("abzab");
        FactorTrie trie = FactorTrie.build(x, x.length, 2, lower);

        // "bz" and "za" stop early and record nothing
        assertEquals(2, trie.positionCount());
        assertEquals(FactorTrie.NONE, trie.locate(ascii("bz"), 0));
        assertEquals(FactorTrie.NONE, trie.locate(ascii("zz"), 0));
        assertEquals(FactorTrie.NONE, trie.child(FactorTrie.ROOT, 0xFF));
        assertEquals(IntArrayList.wrap(new int[]{0, 3}), trie.positionsAt(trie.locate(ascii("ab"), 0)));
        assertFalse(trie.insert(ascii("az"), 0, 9));
    }

    @Test
    public void testPartialPathKeepsItsNodes() {
        FactorTrie trie = new FactorTrie(3, new Alphabet('a', 'b'));
        assertFalse(trie.insert(ascii("abz"), 0, 0));
        // root, 'a', 'ab' survive without positions
        assertEquals(3, trie.nodeCount());
        int a = trie.child(FactorTrie.ROOT, 'a');
        assertNotEquals(FactorTrie.NONE, a);
        assertEquals(PositionList.NIL, trie.head(a));
    }

    @Test
    public void testSingleSymbolAlphabet() {
        byte[] x = {5, 5, 5};
        FactorTrie trie = FactorTrie.build(x, 3, 1, new Alphabet(5, 5));
        assertEquals(2, trie.nodeCount());
        assertEquals(IntArrayList.wrap(new int[]{0, 1, 2}), trie.positionsAt(trie.locate(x, 0)));
    }

    @Test
    public void testReleaseDropsEverything() {
        byte[] x = digits("0110");
        FactorTrie trie = FactorTrie.build(x, 4, 2, Alphabet.BINARY);
        trie.release();
        assertTrue(trie.isReleased());
        assertEquals(0, trie.nodeCount());
        assertEquals(0, trie.positionCount());
        try {
            trie.locate(x, 0);
            throw new AssertionError("locate after release must fail");
        } catch (IllegalStateException expected) {
            // ok
        }
        trie.release();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testFactorLongerThanPattern() {
        FactorTrie.build(digits("01"), 2, 3, Alphabet.BINARY);
    }
}
