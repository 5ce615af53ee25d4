package tree;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import search.Alphabet;

/**
 * FactorTrie
 *
 * Trie over the length-l factors of a pattern. Node ids index one flat arena of child slots,
 * sigma slots per node, where slot (node * sigma + symbol - minChar) holds the child id.
 * The root is node 0 and is never anybody's child, so 0 doubles as "no child" ({@link #NONE}).
 * Every node also owns one chain in a {@link PositionList} holding the pattern offsets k whose
 * window x[k..k+l) spells the path from the root to that node.
 *
 * Build:
 *   for k = 0 .. m-l, walk/extend the trie along x[k..k+l) and append k to the arrival node.
 *   Offsets are inserted left to right, so each chain is sorted ascending.
 *
 * Lookups of symbols outside [minChar, maxChar] fail closed: they report no child.
 */
public final class FactorTrie {

    public static final int ROOT = 0;
    public static final int NONE = 0;

    private final Alphabet alphabet;
    private final int sigma;
    private final int factorLength;

    private final IntArrayList children;   // sigma slots per node
    private final IntArrayList heads;      // head of each node's position chain
    private final PositionList positions;
    private boolean released = false;

    public FactorTrie(int factorLength, Alphabet alphabet) {
        this(factorLength, alphabet, 16);
    }

    public FactorTrie(int factorLength, Alphabet alphabet, int expectedFactors) {
        if (factorLength < 1) {
            throw new IllegalArgumentException("factorLength must be positive");
        }
        if (alphabet == null) {
            throw new IllegalArgumentException("alphabet cannot be null");
        }
        this.alphabet = alphabet;
        this.sigma = alphabet.size();
        this.factorLength = factorLength;
        int expected = Math.max(1, expectedFactors);
        this.children = new IntArrayList(sigma * Math.min(expected, 64));
        this.heads = new IntArrayList(Math.min(expected, 1 << 10));
        this.positions = new PositionList(expected);
        newNode(); // root
    }

    /**
     * Trie over every length-l window of pattern[0..m), inserted in ascending offset order.
     */
    public static FactorTrie build(byte[] pattern, int m, int l, Alphabet alphabet) {
        if (pattern == null) {
            throw new IllegalArgumentException("pattern cannot be null");
        }
        if (l < 1 || l > m || m > pattern.length) {
            throw new IllegalArgumentException("need 1 <= l <= m <= pattern.length, got l=" + l + ", m=" + m);
        }
        int factors = m - l + 1;
        FactorTrie trie = new FactorTrie(l, alphabet, factors);
        for (int k = 0; k < factors; k++) {
            trie.insert(pattern, k, k);
        }
        return trie;
    }

    /**
     * Walks source[from..from+l), creating missing nodes, and appends {@code offset} to the
     * chain of the node reached. A symbol outside the alphabet stops the walk at the deepest
     * node reached so far and nothing is recorded. Returns true when the offset was recorded.
     */
    public boolean insert(byte[] source, int from, int offset) {
        ensureLive();
        if (from < 0 || from + factorLength > source.length) {
            throw new IllegalArgumentException("factor [" + from + "," + (from + factorLength) + ") outside source");
        }
        int node = ROOT;
        for (int i = 0; i < factorLength; i++) {
            int slot = alphabet.index(source[from + i] & 0xFF);
            if (slot < 0) {
                return false;
            }
            int at = node * sigma + slot;
            int child = children.getInt(at);
            if (child == NONE) {
                child = newNode();
                children.set(at, child);
            }
            node = child;
        }
        heads.set(node, positions.append(heads.getInt(node), offset));
        return true;
    }

    // Child of node for symbol, NONE when absent or out of range.
    public int child(int node, int symbol) {
        ensureLive();
        int slot = alphabet.index(symbol);
        if (slot < 0) {
            return NONE;
        }
        return children.getInt(node * sigma + slot);
    }

    /**
     * Walks l symbols of source starting at {@code from}. Returns the arrival node, or NONE as soon
     * as a child is missing.
     */
    public int locate(byte[] source, int from) {
        ensureLive();
        int node = ROOT;
        for (int k = 0; k < factorLength; k++) {
            node = child(node, source[from + k] & 0xFF);
            if (node == NONE) {
                return NONE;
            }
        }
        return node;
    }

    // Head cell of the node's position chain, PositionList.NIL when empty.
    public int head(int node) {
        ensureLive();
        return heads.getInt(node);
    }

    public PositionList positions() {
        return positions;
    }

    public IntList positionsAt(int node) {
        return positions.toList(head(node));
    }

    public int factorLength() {
        return factorLength;
    }

    public Alphabet alphabet() {
        return alphabet;
    }

    public int nodeCount() {
        return heads.size();
    }

    public int positionCount() {
        return positions.size();
    }

    public boolean isReleased() {
        return released;
    }

    // Drops every node and position chain at once.
    public void release() {
        if (released) return;
        children.clear();
        children.trim();
        heads.clear();
        heads.trim();
        positions.release();
        released = true;
    }

    private int newNode() {
        int id = heads.size();
        children.size(children.size() + sigma); // new slots are 0 == NONE
        heads.add(PositionList.NIL);
        return id;
    }

    private void ensureLive() {
        if (released) {
            throw new IllegalStateException("FactorTrie already released");
        }
    }
}
