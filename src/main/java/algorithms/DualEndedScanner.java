package algorithms;

import search.Alphabet;
import search.PhaseListener;
import search.SearchAlgorithm;
import search.SearchResult;
import utilities.MatcherLogger;

/**
 * TVSBS with four windows.
 *
 * The alignment range [0, n-m] is split at q = n/2 into two lanes. In the left lane cursor s1
 * moves right from 0 while s2 moves left from q-1; in the right lane s3 moves right from q while
 * s4 moves left from n-m. A lane is live while its forward cursor has not passed its backward
 * cursor, and the scan runs while either lane is live. Forward cursors shift with the
 * {@link BadCharTables} forward table keyed by the two symbols right after the window, backward
 * cursors with the backward table keyed by the two symbols right before it.
 *
 * Each cursor remembers its last confirmed occurrence (l1..l4). A cursor only verifies a window
 * that the opposite cursor of its lane cannot have confirmed already: s1 < l2, s2 > l1,
 * s3 < l4, s4 > l3. Together with the safe shifts this counts every occurrence exactly once.
 *
 * The text buffer needs 2m writable bytes past n: two copies of the pattern are written there
 * so that the lookahead of a forward cursor always reads defined bytes.
 */
public class DualEndedScanner implements SearchAlgorithm {

    @Override
    public String name() {
        return "tvsbs-w4";
    }

    public static boolean isApplicable(int m, int n) {
        return m >= 2 && n >= m + 2;
    }

    /**
     * Scans a private copy of text[0..n), the caller's buffer is never written.
     */
    @Override
    public SearchResult search(byte[] pattern, int m, byte[] text, int n, Alphabet alphabet, PhaseListener listener) {
        SearchAlgorithm.checkArguments(pattern, m, text, n, alphabet);
        if (!isApplicable(m, n)) {
            return SearchResult.notApplicable();
        }
        byte[] scratch;
        try {
            scratch = new byte[n + 2 * m];
        } catch (OutOfMemoryError e) {
            MatcherLogger.error("tvsbs-w4: scratch buffer allocation failed for n=" + n + ", m=" + m, e);
            return SearchResult.allocationFailure();
        }
        System.arraycopy(text, 0, scratch, 0, n);
        return searchInPlace(pattern, m, scratch, n, alphabet, listener);
    }

    /**
     * Scans {@code guardedText} directly. Bytes [n, n+2m) are overwritten with two copies of the
     * pattern during the scan and byte n is reset to 0 afterwards.
     */
    public SearchResult searchInPlace(byte[] pattern, int m, byte[] guardedText, int n,
                                      Alphabet alphabet, PhaseListener listener) {
        SearchAlgorithm.checkArguments(pattern, m, guardedText, Math.min(n, guardedText.length), alphabet);
        if (!isApplicable(m, n)) {
            return SearchResult.notApplicable();
        }
        if (guardedText.length - n < 2 * m) {
            throw new IllegalArgumentException("text buffer needs " + (2 * m) + " spare bytes after n="
                    + n + ", has " + (guardedText.length - n));
        }

        BadCharTables tables;
        listener.beginPreprocessing();
        try {
            tables = BadCharTables.build(pattern, m, alphabet);
        } catch (OutOfMemoryError e) {
            MatcherLogger.error("tvsbs-w4: shift table allocation failed for sigma=" + alphabet.size(), e);
            return SearchResult.allocationFailure();
        } finally {
            listener.endPreprocessing();
        }

        listener.beginSearching();
        int count = scan(tables, pattern, m, guardedText, n);
        listener.endSearching();
        return SearchResult.ok(count);
    }

    static int scan(BadCharTables tables, byte[] x, int m, byte[] y, int n) {
        for (int i = 0; i < m; i++) {
            y[n + i] = y[n + m + i] = x[i];
        }
        final int mm1 = m - 1, mp1 = m + 1;
        final byte firstch = x[0];
        final byte lastch = x[mm1];

        int count = 0;
        int q = n / 2;
        int s1 = 0, s2 = q - 1, s3 = q, s4 = n - m;
        if (s2 > n - m) s2 = n - m;
        // l2 and l4 start one past their cursor so that a lane holding a single alignment
        // (s3 == s4 == n-m) still gets that alignment verified by its forward cursor
        int l1 = s1, l2 = s2 + 1, l3 = s3, l4 = s4 + 1;

        boolean left = s1 <= s2;
        boolean right = s3 <= s4;
        while (left || right) {
            boolean first = (left && (firstch == y[s1] || firstch == y[s2]))
                    || (right && (firstch == y[s3] || firstch == y[s4]));
            if (first) {
                boolean last = (left && (lastch == y[s1 + mm1] || lastch == y[s2 + mm1]))
                        || (right && (lastch == y[s3 + mm1] || lastch == y[s4 + mm1]));
                if (last) {
                    if (left) {
                        if (s1 < l2 && equalsAt(x, m, y, s1)) {
                            l1 = s1;
                            count++;
                        }
                        if (s2 > l1 && equalsAt(x, m, y, s2)) {
                            l2 = s2;
                            count++;
                        }
                    }
                    if (right) {
                        if (s3 < l4 && equalsAt(x, m, y, s3)) {
                            l3 = s3;
                            count++;
                        }
                        if (s4 > l3 && equalsAt(x, m, y, s4)) {
                            l4 = s4;
                            count++;
                        }
                    }
                }
            }
            if (left) {
                s1 += tables.forwardShift(y[s1 + m] & 0xFF, y[s1 + mp1] & 0xFF);
                // below index 2 any retreat ends the lane, s1 has already moved past
                s2 -= s2 >= 2 ? tables.backwardShift(y[s2 - 1] & 0xFF, y[s2 - 2] & 0xFF) : 1;
                left = s1 <= s2;
            }
            if (right) {
                s3 += tables.forwardShift(y[s3 + m] & 0xFF, y[s3 + mp1] & 0xFF);
                s4 -= tables.backwardShift(y[s4 - 1] & 0xFF, y[s4 - 2] & 0xFF);
                right = s3 <= s4;
            }
        }
        y[n] = 0;
        return count;
    }

    private static boolean equalsAt(byte[] x, int m, byte[] y, int s) {
        for (int i = 0; i < m; i++) {
            if (x[i] != y[s + i]) {
                return false;
            }
        }
        return true;
    }
}
