package search;

// Wall-clock timing of preprocessing and searching, one search call at a time.
public final class PhaseTimer implements PhaseListener {

    private long preStart;
    private long searchStart;
    private long preprocessingNanos;
    private long searchingNanos;

    @Override
    public void beginPreprocessing() {
        preStart = System.nanoTime();
    }

    @Override
    public void endPreprocessing() {
        preprocessingNanos = System.nanoTime() - preStart;
    }

    @Override
    public void beginSearching() {
        searchStart = System.nanoTime();
    }

    @Override
    public void endSearching() {
        searchingNanos = System.nanoTime() - searchStart;
    }

    public long preprocessingNanos() {
        return preprocessingNanos;
    }

    public long searchingNanos() {
        return searchingNanos;
    }

    public double preprocessingMs() {
        return preprocessingNanos / 1_000_000.0;
    }

    public double searchingMs() {
        return searchingNanos / 1_000_000.0;
    }

    public void reset() {
        preStart = searchStart = 0L;
        preprocessingNanos = searchingNanos = 0L;
    }
}
