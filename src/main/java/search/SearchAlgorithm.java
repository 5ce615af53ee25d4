package search;

/**
 * Exact matcher contract: count every offset of text[0..n) where pattern[0..m) occurs verbatim.
 * Implementations report the preprocessing and searching phases to the given listener.
 */
public interface SearchAlgorithm {

    String name();

    SearchResult search(byte[] pattern, int m, byte[] text, int n, Alphabet alphabet, PhaseListener listener);

    default SearchResult search(byte[] pattern, byte[] text, Alphabet alphabet) {
        return search(pattern, pattern.length, text, text.length, alphabet, PhaseListener.NONE);
    }

    default SearchResult search(byte[] pattern, byte[] text) {
        return search(pattern, text, Alphabet.derive(pattern, pattern.length, text, text.length));
    }

    static void checkArguments(byte[] pattern, int m, byte[] text, int n, Alphabet alphabet) {
        if (pattern == null || text == null) {
            throw new IllegalArgumentException("pattern and text cannot be null");
        }
        if (alphabet == null) {
            throw new IllegalArgumentException("alphabet cannot be null");
        }
        if (m < 1 || m > pattern.length) {
            throw new IllegalArgumentException("pattern length must be in [1," + pattern.length + "]: " + m);
        }
        if (n < 0 || n > text.length) {
            throw new IllegalArgumentException("text length must be in [0," + text.length + "]: " + n);
        }
    }

    // Byte-for-byte comparison of pattern[0..m) with text[start..start+m), bounded by n.
    static boolean matchesAt(byte[] pattern, int m, byte[] text, int n, int start) {
        if (start < 0 || start + m > n) {
            return false;
        }
        for (int i = 0; i < m; i++) {
            if (pattern[i] != text[start + i]) {
                return false;
            }
        }
        return true;
    }
}
