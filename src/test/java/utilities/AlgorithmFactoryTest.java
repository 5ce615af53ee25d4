package utilities;

import algorithms.DualEndedScanner;
import algorithms.TrieSkipMatcher;
import org.junit.Test;
import search.NaiveSearch;
import utilities.BenchmarkEnums.AlgorithmType;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

public class AlgorithmFactoryTest {

    @Test
    public void testTokensAndAliases() {
        assertTrue(AlgorithmFactory.create("gskip") instanceof TrieSkipMatcher);
        assertTrue(AlgorithmFactory.create("GammaSkip") instanceof TrieSkipMatcher);
        assertTrue(AlgorithmFactory.create("tvsbs-w4") instanceof DualEndedScanner);
        assertTrue(AlgorithmFactory.create(" TVSBS ") instanceof DualEndedScanner);
        assertTrue(AlgorithmFactory.create("bf") instanceof NaiveSearch);
    }

    @Test
    public void testNamesMatchTokens() {
        for (AlgorithmType type : AlgorithmType.values()) {
            assertEquals(type.token(), AlgorithmFactory.create(type).name());
        }
    }

    @Test
    public void testFreshInstances() {
        assertNotSame(AlgorithmFactory.create(AlgorithmType.GAMMA_SKIP), AlgorithmFactory.create(AlgorithmType.GAMMA_SKIP));
        assertEquals(2, AlgorithmFactory.createAll(List.of(AlgorithmType.TVSBS_W4, AlgorithmType.BRUTE_FORCE)).size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownToken() {
        AlgorithmFactory.create("horspool");
    }
}
