package utilities;

public final class  MathUtils {
    private MathUtils() {
        throw new AssertionError("MathUtils must not be instantiated");
    }

    /**
     * Length l of the pattern factors indexed by the skip-search trie: the number of base-sigma
     * digits of m, i.e. start at 1 and divide m by sigma while it stays above sigma.
     * Any sigma <= 1 gives l = 1.
     */
    public static int factorLength(int m, int sigma) {
        if (sigma > 1) {
            int result = 1, tmp = m;
            while (tmp > sigma) {
                tmp /= sigma;
                ++result;
            }
            return result;
        }
        return 1;
    }

    // Distance between consecutive sampled text windows of the skip-search scan.
    public static int skipStride(int m, int factorLength) {
        return m - factorLength + 1;
    }

    public static double nanosToMs(double nanos) {
        return nanos / 1_000_000.0;
    }
}
