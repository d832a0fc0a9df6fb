package timetabler.constraints;

import timetabler.model.Assignment;
import timetabler.model.Violation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ConstraintSet {
    private final List<Constraint> list = new ArrayList<>();

    public ConstraintSet add(Constraint c) {
        list.add(c);
        return this;
    }

    public List<Constraint> getConstraints() {
        return Collections.unmodifiableList(list);
    }

    public int cost(Assignment a) {
        int total = 0;
        for (Constraint k : list) {
            total += k.evaluate(a).getPenalty();
        }
        return total;
    }

    public boolean ok(Assignment a) {
        for (Constraint k : list) {
            if (k.evaluate(a).getCount() > 0)
                return false;
        }
        return true;
    }

    public List<Violation> explain(Assignment a) {
        List<Violation> reasons = new ArrayList<>();
        for (Constraint k : list) {
            Violation v = k.evaluate(a);
            if (v.getCount() > 0) {
                reasons.add(v);
            }
        }
        return reasons;
    }
}
