package tree;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;

/**
 * PositionList
 *
 * Arena of singly linked chains of pattern offsets. Each trie node owns at most one chain,
 * identified by the index of its head cell. A cell is (offset, next); {@link #NIL} ends a chain.
 * Chains are append-only and keep insertion order. The arena is dropped as a whole by
 * {@link #release()}, which invalidates every chain it holds.
 */
public final class PositionList {

    public static final int NIL = -1;

    private final IntArrayList offsets;
    private final IntArrayList next;
    private boolean released = false;

    public PositionList() {
        this(16);
    }

    public PositionList(int expectedCells) {
        int cap = Math.max(1, expectedCells);
        this.offsets = new IntArrayList(cap);
        this.next = new IntArrayList(cap);
    }

    /**
     * Appends {@code offset} at the tail of the chain starting at {@code head}.
     * Returns the head of the chain, which is a new cell when {@code head} is NIL.
     */
    public int append(int head, int offset) {
        ensureLive();
        int cell = offsets.size();
        offsets.add(offset);
        next.add(NIL);
        if (head == NIL) {
            return cell;
        }
        int tail = head;
        while (next.getInt(tail) != NIL) {
            tail = next.getInt(tail);
        }
        next.set(tail, cell);
        return head;
    }

    public int offset(int cell) {
        ensureLive();
        return offsets.getInt(cell);
    }

    public int next(int cell) {
        ensureLive();
        return next.getInt(cell);
    }

    public int length(int head) {
        ensureLive();
        int len = 0;
        for (int c = head; c != NIL; c = next.getInt(c)) {
            len++;
        }
        return len;
    }

    // Copy of the chain in chain order.
    public IntList toList(int head) {
        ensureLive();
        IntArrayList out = new IntArrayList();
        for (int c = head; c != NIL; c = next.getInt(c)) {
            out.add(offsets.getInt(c));
        }
        return out;
    }

    // Number of cells across all chains.
    public int size() {
        return offsets.size();
    }

    public boolean isReleased() {
        return released;
    }

    public void release() {
        offsets.clear();
        offsets.trim();
        next.clear();
        next.trim();
        released = true;
    }

    private void ensureLive() {
        if (released) {
            throw new IllegalStateException("PositionList already released");
        }
    }
}
