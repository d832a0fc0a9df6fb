package timetabler.core;

import timetabler.model.Assignment;
import timetabler.model.SearchPhase;

import java.util.Arrays;

/**
 * Mutable state of one solve: current and best assignment, their costs, the
 * iteration counter, temperature and move statistics. Owned by a single
 * {@link AnnealingScheduler#solve} call and never shared.
 */
class SearchState {

    private static final int INITIAL_TRACE_CAPACITY = 1024;

    private final RandomSource random;
    private int[] bestCostTrace;

    private SearchPhase phase = SearchPhase.INIT;
    private Assignment current;
    private int currentCost;
    private Assignment best;
    private int bestCost;
    private int iteration;
    private double temperature;

    private int accepted;
    private int rejected;
    private int skipped;

    SearchState(RandomSource random, int maxIterations) {
        this.random = random;
        // grown on demand in endIteration
        this.bestCostTrace = new int[Math.min(maxIterations, INITIAL_TRACE_CAPACITY)];
    }

    void start(Assignment initial, int cost) {
        this.current = initial;
        this.currentCost = cost;
        this.best = initial.copy();
        this.bestCost = cost;
        this.phase = SearchPhase.SAMPLING;
    }

    RandomSource random() { return random; }
    SearchPhase phase() { return phase; }
    Assignment current() { return current; }
    int currentCost() { return currentCost; }
    Assignment best() { return best; }
    int bestCost() { return bestCost; }
    int iteration() { return iteration; }
    double temperature() { return temperature; }
    int accepted() { return accepted; }
    int rejected() { return rejected; }
    int skipped() { return skipped; }

    void setTemperature(double temperature) {
        this.temperature = temperature;
    }

    void acceptImprovement(int cost) {
        currentCost = cost;
        bestCost = cost;
        best = current.copy();
        accepted++;
    }

    void acceptWorse(int cost) {
        currentCost = cost;
        accepted++;
    }

    void reject() {
        rejected++;
    }

    void skip() {
        skipped++;
    }

    void endIteration() {
        if (iteration == bestCostTrace.length) {
            int grown = (int) Math.min(Integer.MAX_VALUE - 8L, Math.max(16L, 2L * bestCostTrace.length));
            bestCostTrace = Arrays.copyOf(bestCostTrace, grown);
        }
        bestCostTrace[iteration] = bestCost;
        iteration++;
    }

    void terminate() {
        phase = bestCost == 0 ? SearchPhase.TERMINATED_FEASIBLE : SearchPhase.TERMINATED_BEST_EFFORT;
    }

    int[] bestCostTrace() {
        return Arrays.copyOf(bestCostTrace, iteration);
    }
}
