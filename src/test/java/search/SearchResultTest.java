package search;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static search.ByteStrings.digits;

public class SearchResultTest {

    @Test
    public void testLegacyCount() {
        assertEquals(7, SearchResult.ok(7).legacyCount());
        assertEquals(-1, SearchResult.notApplicable().legacyCount());
        assertTrue(SearchResult.ok(0).isOk());
        assertFalse(SearchResult.notApplicable().isOk());
    }

    @Test(expected = IllegalStateException.class)
    public void testAllocationFailureIsNotACount() {
        SearchResult.allocationFailure().legacyCount();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOkNeedsNonNegativeCount() {
        SearchResult.ok(-1);
    }

    @Test
    public void testNaiveSearch() {
        NaiveSearch bf = new NaiveSearch();
        assertEquals(3, bf.search(digits("01"), digits("010101"), Alphabet.BINARY).count());
        assertEquals(3, bf.search(digits("000"), digits("00000"), Alphabet.BINARY).count());
        assertEquals(0, bf.search(digits("11"), digits("0000000000"), Alphabet.BINARY).count());
        assertEquals(0, bf.search(digits("0101"), digits("01"), Alphabet.BINARY).count());
        assertEquals(1, bf.search(digits("0110"), digits("0110"), Alphabet.BINARY).count());
    }

    @Test
    public void testPhaseTimerRecordsBothPhases() {
        PhaseTimer timer = new PhaseTimer();
        new NaiveSearch().search(digits("01"), 2, digits("0101"), 4, Alphabet.BINARY, timer);
        assertTrue(timer.preprocessingNanos() >= 0);
        assertTrue(timer.searchingNanos() >= 0);
        timer.reset();
        assertEquals(0L, timer.searchingNanos());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsEmptyPattern() {
        new NaiveSearch().search(new byte[0], 0, digits("01"), 2, Alphabet.BINARY, PhaseListener.NONE);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRejectsLengthBeyondArray() {
        new NaiveSearch().search(digits("01"), 2, digits("01"), 3, Alphabet.BINARY, PhaseListener.NONE);
    }
}
