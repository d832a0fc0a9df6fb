package timetabler.core;

import java.util.List;

/**
 * Sequential stream of pseudo-random numbers used by the search. Draws are
 * consumed in a fixed order, so a fixed seed reproduces a run exactly.
 */
public interface RandomSource {

    /** Uniform integer in {@code [0, bound)}. */
    int nextInt(int bound);

    /** Uniform double in {@code [0, 1)}. */
    double nextDouble();

    default <T> T choose(List<T> items) {
        if (items.isEmpty()) throw new IllegalArgumentException("cannot choose from an empty list");
        return items.get(nextInt(items.size()));
    }
}
