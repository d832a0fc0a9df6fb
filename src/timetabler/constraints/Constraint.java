package timetabler.constraints;

import timetabler.model.Assignment;
import timetabler.model.Violation;

public interface Constraint {
    // Short name used in reports and the violation log
    String getName();

    // Violation count and weighted penalty of a complete assignment; must not modify it
    Violation evaluate(Assignment assignment);

    // Message shown when the rule is broken
    String getViolationMessage();
}
