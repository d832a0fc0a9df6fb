package timetabler.model;

/** Where a solve stopped. */
public enum SearchPhase {
    // never left initialisation: some exam had no candidate
    INIT,
    SAMPLING,
    TERMINATED_FEASIBLE,
    TERMINATED_BEST_EFFORT
}
