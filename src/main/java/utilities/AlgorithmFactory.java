package utilities;

import algorithms.DualEndedScanner;
import algorithms.TrieSkipMatcher;
import search.NaiveSearch;
import search.SearchAlgorithm;
import utilities.BenchmarkEnums.AlgorithmType;

import java.util.ArrayList;
import java.util.List;

/**
 * Central place to construct matchers for benchmarks and tests.
 */
public final class AlgorithmFactory {

    private AlgorithmFactory() {}

    public static SearchAlgorithm create(AlgorithmType type) {
        return switch (type) {
            case GAMMA_SKIP -> new TrieSkipMatcher();
            case TVSBS_W4 -> new DualEndedScanner();
            case BRUTE_FORCE -> new NaiveSearch();
        };
    }

    public static SearchAlgorithm create(String token) {
        return create(AlgorithmType.fromString(token));
    }

    public static List<SearchAlgorithm> createAll(List<AlgorithmType> types) {
        List<SearchAlgorithm> out = new ArrayList<>(types.size());
        for (AlgorithmType type : types) {
            out.add(create(type));
        }
        return out;
    }
}
