package datagenerators;

import org.apache.commons.math3.distribution.ZipfDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.Arrays;

// Random texts and patterns over a contiguous byte range [minChar, maxChar].
public class Generator {

    private final RandomGenerator rng;

    public Generator(long seed) {
        // Seeded random number generator for reproducibility
        this.rng = new Well19937c(seed);
    }

    public byte[] generateUniform(int length, int minChar, int maxChar) {
        checkRange(length, minChar, maxChar);
        int span = maxChar - minChar + 1;
        byte[] out = new byte[length];
        for (int i = 0; i < length; i++) {
            out[i] = (byte) (minChar + rng.nextInt(span));
        }
        return out;
    }

    public byte[] generateZipf(int length, int minChar, int maxChar, double exponent) {
        checkRange(length, minChar, maxChar);
        int alphabetSize = maxChar - minChar + 1;
        if (alphabetSize == 1) {
            byte[] out = new byte[length];
            Arrays.fill(out, (byte) minChar);
            return out;
        }

        // ZipfDistribution samples integers in the closed interval [1, alphabetSize]
        ZipfDistribution dist = new ZipfDistribution(rng, alphabetSize, exponent);

        byte[] out = new byte[length];
        for (int i = 0; i < length; i++) {
            int rank = dist.sample();                 // 1 .. alphabetSize
            out[i] = (byte) (minChar + (rank - 1));   // map to [minChar, maxChar]
        }
        return out;
    }

    /**
     * Pattern of length m copied from a random offset of text, so it occurs at least once.
     * Falls back to a fresh uniform pattern when the text is shorter than m.
     */
    public byte[] extractPattern(byte[] text, int m, int minChar, int maxChar) {
        if (m > text.length) {
            return generateUniform(m, minChar, maxChar);
        }
        int from = rng.nextInt(text.length - m + 1);
        return Arrays.copyOfRange(text, from, from + m);
    }

    // Writes pattern into text at the given offsets, overlapping writes allowed.
    public static void plant(byte[] text, byte[] pattern, int... offsets) {
        for (int off : offsets) {
            if (off < 0 || off + pattern.length > text.length) {
                throw new IllegalArgumentException("cannot plant pattern of length " + pattern.length + " at " + off);
            }
            System.arraycopy(pattern, 0, text, off, pattern.length);
        }
    }

    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    private static void checkRange(int length, int minChar, int maxChar) {
        if (length < 0) throw new IllegalArgumentException("length < 0");
        if (minChar < 0 || maxChar > 255) throw new IllegalArgumentException("symbols must lie in [0,255]");
        if (minChar > maxChar) throw new IllegalArgumentException("minChar must not exceed maxChar");
    }
}
