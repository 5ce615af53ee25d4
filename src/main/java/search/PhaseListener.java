package search;

// Boundaries of the two measurable phases of a search call.
public interface PhaseListener {

    PhaseListener NONE = new PhaseListener() {};

    default void beginPreprocessing() {}

    default void endPreprocessing() {}

    default void beginSearching() {}

    default void endSearching() {}
}
