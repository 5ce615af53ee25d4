package search;

// Contiguous symbol range [minChar, maxChar] over unsigned bytes.
public record Alphabet(int minChar, int maxChar) {

    public static final Alphabet BINARY = new Alphabet(0, 1);
    public static final Alphabet FULL_BYTE = new Alphabet(0, 255);

    public Alphabet {
        if (minChar < 0 || maxChar > 255) {
            throw new IllegalArgumentException("alphabet bounds must lie in [0,255]");
        }
        if (minChar > maxChar) {
            throw new IllegalArgumentException("minChar must not exceed maxChar");
        }
    }

    // Actual byte range present in pattern[0..m) and text[0..n).
    public static Alphabet derive(byte[] pattern, int m, byte[] text, int n) {
        int min = 255;
        int max = 0;
        for (int i = 0; i < m; i++) {
            int c = pattern[i] & 0xFF;
            if (c < min) min = c;
            if (c > max) max = c;
        }
        for (int i = 0; i < n; i++) {
            int c = text[i] & 0xFF;
            if (c < min) min = c;
            if (c > max) max = c;
        }
        if (min > max) {
            // nothing to look at
            return new Alphabet(0, 0);
        }
        return new Alphabet(min, max);
    }

    public int size() {
        return maxChar - minChar + 1;
    }

    public boolean contains(int symbol) {
        return symbol >= minChar && symbol <= maxChar;
    }

    /** Zero-based slot of {@code symbol}, or -1 when it falls outside the range. */
    public int index(int symbol) {
        if (symbol < minChar || symbol > maxChar) {
            return -1;
        }
        return symbol - minChar;
    }

    // First offset in bytes[0..len) whose symbol is outside the range, -1 if none.
    public int firstOutside(byte[] bytes, int len) {
        for (int i = 0; i < len; i++) {
            if (!contains(bytes[i] & 0xFF)) {
                return i;
            }
        }
        return -1;
    }
}
