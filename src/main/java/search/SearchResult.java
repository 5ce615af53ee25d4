package search;

/**
 * Outcome of one search call. A count is only meaningful when {@link #status()} is {@link Status#OK}.
 */
public record SearchResult(Status status, int count) {

    public enum Status {
        OK,
        NOT_APPLICABLE,
        ALLOCATION_FAILURE
    }

    public static final int NOT_APPLICABLE_COUNT = -1;

    private static final SearchResult NOT_APPLICABLE = new SearchResult(Status.NOT_APPLICABLE, NOT_APPLICABLE_COUNT);
    private static final SearchResult ALLOCATION_FAILURE = new SearchResult(Status.ALLOCATION_FAILURE, 0);

    public SearchResult {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (status == Status.OK && count < 0) {
            throw new IllegalArgumentException("count must be non-negative");
        }
    }

    public static SearchResult ok(int count) {
        return new SearchResult(Status.OK, count);
    }

    public static SearchResult notApplicable() {
        return NOT_APPLICABLE;
    }

    public static SearchResult allocationFailure() {
        return ALLOCATION_FAILURE;
    }

    public boolean isOk() {
        return status == Status.OK;
    }

    // Integer contract of the benchmarking tool: count, or -1 for inapplicable input.
    public int legacyCount() {
        return switch (status) {
            case OK -> count;
            case NOT_APPLICABLE -> NOT_APPLICABLE_COUNT;
            case ALLOCATION_FAILURE -> throw new IllegalStateException("search aborted: allocation failure");
        };
    }
}
