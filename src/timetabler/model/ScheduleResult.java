package timetabler.model;

import java.util.Collections;
import java.util.List;

/**
 * Outcome of one solve. For a feasible result the assignment is the
 * zero-cost one; for a search-exhausted result it is the best assignment
 * found (diagnostics only); for a structural failure there is no assignment.
 */
public class ScheduleResult {
    private final ResultStatus status;
    private final InfeasibilityReason reason;
    private final SearchPhase phase;
    private final Assignment assignment;
    private final int bestCost;
    private final int iterations;
    private final int acceptedMoves;
    private final int rejectedMoves;
    private final int skippedMoves;
    private final double runtimeMillis;
    private final long seed;
    private final int[] bestCostTrace;
    private final List<Integer> examsWithoutCandidates;
    private final List<Violation> violations;

    private ScheduleResult(Builder b) {
        this.status = b.status;
        this.reason = b.reason;
        this.phase = b.phase;
        this.assignment = b.assignment;
        this.bestCost = b.bestCost;
        this.iterations = b.iterations;
        this.acceptedMoves = b.acceptedMoves;
        this.rejectedMoves = b.rejectedMoves;
        this.skippedMoves = b.skippedMoves;
        this.runtimeMillis = b.runtimeMillis;
        this.seed = b.seed;
        this.bestCostTrace = b.bestCostTrace == null ? new int[0] : b.bestCostTrace;
        this.examsWithoutCandidates = b.examsWithoutCandidates == null
                ? List.of() : Collections.unmodifiableList(b.examsWithoutCandidates);
        this.violations = b.violations == null ? List.of() : Collections.unmodifiableList(b.violations);
    }

    public static Builder feasible(Assignment assignment) {
        return new Builder(ResultStatus.FEASIBLE, null).assignment(assignment);
    }

    public static Builder infeasible(InfeasibilityReason reason) {
        return new Builder(ResultStatus.INFEASIBLE, reason);
    }

    public ResultStatus getStatus() { return status; }
    public boolean isFeasible() { return status == ResultStatus.FEASIBLE; }

    /** @return why no feasible timetable was reported, or {@code null} when feasible */
    public InfeasibilityReason getReason() { return reason; }

    /** @return the zero-cost or best-effort assignment, {@code null} after a structural failure */
    public Assignment getAssignment() { return assignment; }

    /** Phase the search ended in; {@code null} for results not produced by a solve. */
    public SearchPhase getPhase() { return phase; }

    /** @return best weighted cost found, or -1 when no assignment was built */
    public int getBestCost() { return bestCost; }
    public int getIterations() { return iterations; }
    public int getAcceptedMoves() { return acceptedMoves; }
    public int getRejectedMoves() { return rejectedMoves; }
    public int getSkippedMoves() { return skippedMoves; }
    public double getRuntimeMillis() { return runtimeMillis; }
    public long getSeed() { return seed; }

    /** Best cost after each executed iteration, in order. */
    public int[] getBestCostTrace() { return bestCostTrace.clone(); }

    public List<Integer> getExamsWithoutCandidates() { return examsWithoutCandidates; }
    public List<Violation> getViolations() { return violations; }

    public static class Builder {
        private final ResultStatus status;
        private final InfeasibilityReason reason;
        private SearchPhase phase;
        private Assignment assignment;
        private int bestCost;
        private int iterations;
        private int acceptedMoves;
        private int rejectedMoves;
        private int skippedMoves;
        private double runtimeMillis;
        private long seed;
        private int[] bestCostTrace;
        private List<Integer> examsWithoutCandidates;
        private List<Violation> violations;

        private Builder(ResultStatus status, InfeasibilityReason reason) {
            this.status = status;
            this.reason = reason;
        }

        public Builder phase(SearchPhase phase) { this.phase = phase; return this; }
        public Builder assignment(Assignment assignment) { this.assignment = assignment; return this; }
        public Builder bestCost(int bestCost) { this.bestCost = bestCost; return this; }
        public Builder iterations(int iterations) { this.iterations = iterations; return this; }
        public Builder acceptedMoves(int n) { this.acceptedMoves = n; return this; }
        public Builder rejectedMoves(int n) { this.rejectedMoves = n; return this; }
        public Builder skippedMoves(int n) { this.skippedMoves = n; return this; }
        public Builder runtimeMillis(double ms) { this.runtimeMillis = ms; return this; }
        public Builder seed(long seed) { this.seed = seed; return this; }
        public Builder bestCostTrace(int[] trace) { this.bestCostTrace = trace; return this; }
        public Builder examsWithoutCandidates(List<Integer> exams) { this.examsWithoutCandidates = exams; return this; }
        public Builder violations(List<Violation> violations) { this.violations = violations; return this; }

        public ScheduleResult build() {
            return new ScheduleResult(this);
        }
    }
}
