package timetabler.model;

public enum ResultStatus {
    FEASIBLE("sat"),
    INFEASIBLE("unsat");

    private final String label;

    ResultStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
