package timetabler.constraints;

import timetabler.model.Assignment;
import timetabler.model.Placement;
import timetabler.model.Violation;

import java.util.HashMap;
import java.util.Map;

/**
 * k exams sharing one (room, slot) count as k-1 double bookings.
 */
public class OneExamPerRoomPerTime implements Constraint {

    private final int weight;

    public OneExamPerRoomPerTime(int weight) {
        this.weight = weight;
    }

    @Override
    public String getName() {
        return "room-double-booking";
    }

    @Override
    public Violation evaluate(Assignment a) {
        Map<Placement, Integer> occ = new HashMap<>();
        for (int e = 0; e < a.size(); e++) {
            occ.merge(a.getPlacement(e), 1, Integer::sum);
        }
        int count = 0;
        for (int cnt : occ.values()) {
            if (cnt > 1) count += cnt - 1;
        }
        return new Violation(getName(), count, weight * count);
    }

    @Override
    public String getViolationMessage() {
        return "Room is already occupied at that time";
    }
}
