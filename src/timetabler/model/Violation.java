package timetabler.model;

/**
 * Contribution of one constraint class to the cost of an assignment.
 */
public class Violation {
    private final String constraint;
    private final int count;
    private final int penalty;

    public Violation(String constraint, int count, int penalty) {
        this.constraint = constraint;
        this.count = count;
        this.penalty = penalty;
    }

    public String getConstraint() { return constraint; }
    public int getCount() { return count; }
    public int getPenalty() { return penalty; }

    @Override
    public String toString() {
        return constraint + ": " + count + " (penalty " + penalty + ")";
    }
}
