package search;

// Brute-force reference: compares the pattern at every offset in [0, n-m].
public class NaiveSearch implements SearchAlgorithm {

    @Override
    public String name() {
        return "bf";
    }

    @Override
    public SearchResult search(byte[] pattern, int m, byte[] text, int n, Alphabet alphabet, PhaseListener listener) {
        SearchAlgorithm.checkArguments(pattern, m, text, n, alphabet);

        listener.beginPreprocessing();
        listener.endPreprocessing();

        listener.beginSearching();
        int count = 0;
        for (int s = 0; s + m <= n; s++) {
            if (SearchAlgorithm.matchesAt(pattern, m, text, n, s)) {
                count++;
            }
        }
        listener.endSearching();
        return SearchResult.ok(count);
    }

    public static int count(byte[] pattern, byte[] text) {
        return new NaiveSearch().search(pattern, text, Alphabet.FULL_BYTE).count();
    }
}
