package utilities;

import java.util.Locale;

// Averages of one algorithm over `runs` inputs with pattern length m.
public record RunResult(String algorithm,
                        int patternLength,
                        int textLength,
                        int runs,
                        double avgPreprocessingMs,
                        double avgSearchMs,
                        long totalOccurrences,
                        int passed,
                        int failed,
                        int notApplicable) {

    public boolean allPassed() {
        return failed == 0;
    }

    public void print() {
        System.out.printf(Locale.ROOT,
                "  %-10s m=%-5d pre=%.4f ms  search=%.4f ms  occ=%d  ok=%d  failed=%d  n/a=%d%n",
                algorithm, patternLength, avgPreprocessingMs, avgSearchMs, totalOccurrences,
                passed, failed, notApplicable);
    }
}
