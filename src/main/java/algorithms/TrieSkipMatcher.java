package algorithms;

import search.Alphabet;
import search.PhaseListener;
import search.SearchAlgorithm;
import search.SearchResult;
import tree.FactorTrie;
import tree.PositionList;
import utilities.MatcherLogger;
import utilities.MathUtils;

/**
 * Gamma skip search.
 *
 * Preprocessing indexes every length-l factor of the pattern in a {@link FactorTrie}, with
 * l = {@link MathUtils#factorLength(int, int)}. The search samples text windows y[j..j+l) for
 * j = m-l, m-l + (m-l+1), ... while j <= n-l. Consecutive windows are m-l+1 apart, so every
 * occurrence of length m contains at least one sampled window entirely. A window found in the
 * trie yields the candidates j-k for each offset k stored at the arrival node, each one
 * verified by a full comparison.
 */
public class TrieSkipMatcher implements SearchAlgorithm {

    @Override
    public String name() {
        return "gskip";
    }

    @Override
    public SearchResult search(byte[] pattern, int m, byte[] text, int n, Alphabet alphabet, PhaseListener listener) {
        SearchAlgorithm.checkArguments(pattern, m, text, n, alphabet);

        FactorTrie trie;
        int l;
        listener.beginPreprocessing();
        try {
            l = MathUtils.factorLength(m, alphabet.size());
            trie = FactorTrie.build(pattern, m, l, alphabet);
        } catch (OutOfMemoryError e) {
            MatcherLogger.error("gskip: trie allocation failed for m=" + m + ", sigma=" + alphabet.size(), e);
            return SearchResult.allocationFailure();
        } finally {
            listener.endPreprocessing();
        }

        int outside = alphabet.firstOutside(pattern, m);
        if (outside >= 0) {
            MatcherLogger.warning("gskip: pattern symbol " + (pattern[outside] & 0xFF) + " at " + outside
                    + " outside alphabet [" + alphabet.minChar() + "," + alphabet.maxChar() + "]");
        }

        try {
            listener.beginSearching();
            int occurrences = scan(trie, pattern, m, text, n);
            listener.endSearching();
            return SearchResult.ok(occurrences);
        } finally {
            trie.release();
        }
    }

    // Search phase over an already built trie; the trie is left untouched.
    static int scan(FactorTrie trie, byte[] pattern, int m, byte[] text, int n) {
        final int l = trie.factorLength();
        final int limit = n - l + 1;
        final int shift = MathUtils.skipStride(m, l);
        final PositionList positions = trie.positions();

        int occurrences = 0;
        int j = m - l;
        while (j < limit) {
            int node = trie.locate(text, j);
            if (node != FactorTrie.NONE) {
                for (int cell = trie.head(node); cell != PositionList.NIL; cell = positions.next(cell)) {
                    int start = j - positions.offset(cell);
                    if (SearchAlgorithm.matchesAt(pattern, m, text, n, start)) {
                        occurrences++;
                    }
                }
            }
            j += shift;
        }
        return occurrences;
    }
}
