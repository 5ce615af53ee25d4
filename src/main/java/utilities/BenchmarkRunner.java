package utilities;

import algorithms.BadCharTables;
import datagenerators.Generator;
import search.Alphabet;
import search.NaiveSearch;
import search.PhaseTimer;
import search.SearchAlgorithm;
import search.SearchResult;
import tree.FactorTrie;
import utilities.BenchmarkEnums.AlgorithmType;
import utilities.BenchmarkEnums.AlphabetMode;
import utilities.BenchmarkEnums.Distribution;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

// Runs every selected algorithm over generated inputs, timing both phases and checking counts.
public final class BenchmarkRunner {
    private BenchmarkRunner() {}

    public static List<RunResult> run(BenchmarkOptions options) {
        Generator generator = new Generator(options.seed());
        NaiveSearch reference = new NaiveSearch();
        PhaseTimer timer = new PhaseTimer();
        MemUtil memUtil = options.memoryReport() ? new MemUtil() : null;

        Map<AlgorithmType, SearchAlgorithm> algorithms = new EnumMap<>(AlgorithmType.class);
        for (AlgorithmType type : options.algorithms()) {
            algorithms.put(type, AlgorithmFactory.create(type));
        }

        MatcherLogger.info(String.format(Locale.ROOT,
                "Benchmark: n=%d, m=%s, runs=%d, alphabet=%s [%d,%d], distribution=%s, seed=%d",
                options.textLength(), options.patternLengths(), options.runs(), options.alphabetMode().token(),
                options.minChar(), options.maxChar(), options.distribution().token(), options.seed()));

        if (memUtil != null) {
            MatcherLogger.debug(memUtil.vmDetails());
        }

        List<RunResult> results = new ArrayList<>();
        for (int m : options.patternLengths()) {
            Map<AlgorithmType, Accumulator> acc = new EnumMap<>(AlgorithmType.class);
            algorithms.keySet().forEach(type -> acc.put(type, new Accumulator()));

            for (int r = 0; r < options.runs(); r++) {
                byte[] text = options.distribution() == Distribution.ZIPF
                        ? generator.generateZipf(options.textLength(), options.minChar(), options.maxChar(), options.zipfExponent())
                        : generator.generateUniform(options.textLength(), options.minChar(), options.maxChar());
                byte[] pattern = generator.extractPattern(text, m, options.minChar(), options.maxChar());
                int n = text.length;

                Alphabet alphabet = options.alphabetMode() == AlphabetMode.FIXED_BINARY
                        ? Alphabet.BINARY
                        : Alphabet.derive(pattern, m, text, n);
                int expected = reference.search(pattern, m, text, n, alphabet, timer).count();

                if (memUtil != null && r == 0 && algorithms.containsKey(AlgorithmType.GAMMA_SKIP)) {
                    FactorTrie trie = FactorTrie.build(pattern, m, MathUtils.factorLength(m, alphabet.size()), alphabet);
                    try {
                        MatcherLogger.info(memUtil.jolTrieReport(trie, false).report());
                    } finally {
                        trie.release();
                    }
                }
                if (memUtil != null && r == 0 && m >= 2 && algorithms.containsKey(AlgorithmType.TVSBS_W4)) {
                    MatcherLogger.info(memUtil.jolTablesReport(BadCharTables.build(pattern, m, alphabet), false).report());
                }

                for (Map.Entry<AlgorithmType, SearchAlgorithm> e : algorithms.entrySet()) {
                    timer.reset();
                    SearchResult res = e.getValue().search(pattern, m, text, n, alphabet, timer);
                    acc.get(e.getKey()).add(e.getValue().name(), m, expected, res, timer);
                }
            }

            for (Map.Entry<AlgorithmType, Accumulator> e : acc.entrySet()) {
                RunResult rr = e.getValue().toResult(e.getKey().displayName(), m, options.textLength(), options.runs());
                results.add(rr);
            }
        }
        return results;
    }

    public static int totalFailures(List<RunResult> results) {
        return results.stream().mapToInt(RunResult::failed).sum();
    }

    private static final class Accumulator {
        long preNanos;
        long searchNanos;
        int timed;
        long occurrences;
        int passed;
        int failed;
        int notApplicable;

        void add(String name, int m, int expected, SearchResult res, PhaseTimer timer) {
            switch (res.status()) {
                case NOT_APPLICABLE -> notApplicable++;
                case ALLOCATION_FAILURE -> {
                    failed++;
                    MatcherLogger.error(name + ": allocation failure at m=" + m);
                }
                case OK -> {
                    preNanos += timer.preprocessingNanos();
                    searchNanos += timer.searchingNanos();
                    timed++;
                    occurrences += res.count();
                    if (res.count() == expected) {
                        passed++;
                    } else {
                        failed++;
                        MatcherLogger.warning(String.format(Locale.ROOT,
                                "%s: wrong count at m=%d, expected %d got %d", name, m, expected, res.count()));
                    }
                }
            }
        }

        RunResult toResult(String name, int m, int n, int runs) {
            double avgPre = timed == 0 ? 0.0 : MathUtils.nanosToMs((double) preNanos / timed);
            double avgSearch = timed == 0 ? 0.0 : MathUtils.nanosToMs((double) searchNanos / timed);
            return new RunResult(name, m, n, runs, avgPre, avgSearch, occurrences, passed, failed, notApplicable);
        }
    }
}
