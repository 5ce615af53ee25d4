import utilities.BenchmarkOptions;
import utilities.BenchmarkRunner;
import utilities.MatcherLogger;
import utilities.RunResult;

import java.util.List;
import java.util.Locale;

/**
 * Command-line driver: runs the selected matchers over generated texts, prints per pattern length
 * preprocessing and search averages, and checks every count against the brute-force scan.
 * Exits with status 1 when any check failed.
 */
public final class Main {

    public static void main(String[] args) {
        BenchmarkOptions options;
        try {
            options = BenchmarkOptions.parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid arguments: " + e.getMessage());
            System.exit(2);
            return;
        }

        System.out.printf(Locale.ROOT,
                "Text length: %d  Runs: %d  Alphabet: %s [%d,%d]  Distribution: %s%n",
                options.textLength(), options.runs(), options.alphabetMode().token(),
                options.minChar(), options.maxChar(), options.distribution().token());

        List<RunResult> results = BenchmarkRunner.run(options);
        int lastM = -1;
        for (RunResult r : results) {
            if (r.patternLength() != lastM) {
                System.out.printf(Locale.ROOT, "Pattern length %d%n", r.patternLength());
                lastM = r.patternLength();
            }
            r.print();
        }

        int failures = BenchmarkRunner.totalFailures(results);
        long checks = results.stream().mapToLong(r -> r.passed() + r.failed()).sum();
        System.out.printf(Locale.ROOT, "Checked %d run(s), %d failure(s)%n", checks, failures);
        if (failures > 0) {
            MatcherLogger.error("Correctness failures: " + failures);
            System.exit(1);
        }
    }
}
