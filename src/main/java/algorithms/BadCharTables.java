package algorithms;

import search.Alphabet;

import java.util.Arrays;

/**
 * Berry-Ravindran style shift tables over pairs of adjacent symbols, one built from the pattern
 * (cursors moving right) and one from the reversed pattern (cursors moving left).
 *
 * For a pattern x of length m the table t is filled as:
 *   t[a][b] = m + 2                 for every pair
 *   t[a][x[0]] = m + 1              for every a
 *   t[x[i]][x[i+1]] = m - i         for i in [0, m-2]
 *   t[x[m-1]][b] = 1                for every b
 * Every value lies in [1, m + 2].
 */
public final class BadCharTables {

    private final Alphabet alphabet;
    private final int sigma;
    private final int m;
    private final int[] forward;
    private final int[] backward;

    private BadCharTables(Alphabet alphabet, int m, int[] forward, int[] backward) {
        this.alphabet = alphabet;
        this.sigma = alphabet.size();
        this.m = m;
        this.forward = forward;
        this.backward = backward;
    }

    public static BadCharTables build(byte[] pattern, int m, Alphabet alphabet) {
        if (pattern == null || alphabet == null) {
            throw new IllegalArgumentException("pattern and alphabet cannot be null");
        }
        if (m < 2 || m > pattern.length) {
            throw new IllegalArgumentException("pattern length must be in [2," + pattern.length + "]: " + m);
        }
        byte[] reversed = new byte[m];
        for (int i = 0; i < m; i++) {
            reversed[i] = pattern[m - 1 - i];
        }
        return new BadCharTables(alphabet, m,
                fill(pattern, m, alphabet),
                fill(reversed, m, alphabet));
    }

    // Pairs touching a symbol outside the alphabet are simply not recorded.
    private static int[] fill(byte[] x, int m, Alphabet alphabet) {
        final int sigma = alphabet.size();
        int[] table = new int[sigma * sigma];
        Arrays.fill(table, m + 2);

        int first = alphabet.index(x[0] & 0xFF);
        if (first >= 0) {
            for (int a = 0; a < sigma; ++a) {
                table[a * sigma + first] = m + 1;
            }
        }
        for (int i = 0; i < m - 1; ++i) {
            int a = alphabet.index(x[i] & 0xFF);
            int b = alphabet.index(x[i + 1] & 0xFF);
            if (a >= 0 && b >= 0) {
                table[a * sigma + b] = m - i;
            }
        }
        int last = alphabet.index(x[m - 1] & 0xFF);
        if (last >= 0) {
            for (int b = 0; b < sigma; ++b) {
                table[last * sigma + b] = 1;
            }
        }
        return table;
    }

    /** Advance after reading text symbols (a, b) just past the window; 1 when either is outside the alphabet. */
    public int forwardShift(int a, int b) {
        return lookup(forward, a, b);
    }

    /** Retreat after reading text symbols (a, b) just before the window, nearest first. */
    public int backwardShift(int a, int b) {
        return lookup(backward, a, b);
    }

    private int lookup(int[] table, int a, int b) {
        int ia = alphabet.index(a);
        int ib = alphabet.index(b);
        if (ia < 0 || ib < 0) {
            return 1;
        }
        return table[ia * sigma + ib];
    }

    public int patternLength() {
        return m;
    }

    public Alphabet alphabet() {
        return alphabet;
    }

    // Raw row-major cells, for inspection.
    public int[] forwardCells() {
        return forward.clone();
    }

    public int[] backwardCells() {
        return backward.clone();
    }
}
