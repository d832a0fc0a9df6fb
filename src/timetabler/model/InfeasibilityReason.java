package timetabler.model;

public enum InfeasibilityReason {
    // some exam has no (room, slot) candidate at all, search never started
    STRUCTURAL("Structural: exam without any feasible room/slot candidate"),
    // iteration budget consumed with violations left
    SEARCH_EXHAUSTED("Search exhausted: iteration budget used, violations remain");

    private final String description;

    InfeasibilityReason(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
