package timetabler.constraints;

import timetabler.model.Assignment;
import timetabler.model.Violation;

import java.util.HashMap;
import java.util.Map;

/**
 * At most maxPerDay exams per student and day. Each exam beyond the cap on
 * a student's day is one violation.
 */
public class MaxExamsPerDay implements Constraint {

    private final int[][] examsByStudent;
    private final int[] dayOfSlot; // slot -> day
    private final int maxPerDay; // e.g. 2
    private final int weight;

    public MaxExamsPerDay(int[][] examsByStudent, int[] dayOfSlot, int maxPerDay, int weight) {
        this.examsByStudent = examsByStudent;
        this.dayOfSlot = dayOfSlot;
        this.maxPerDay = maxPerDay;
        this.weight = weight;
    }

    @Override
    public String getName() {
        return "student-day-cap";
    }

    @Override
    public Violation evaluate(Assignment a) {
        int count = 0;
        Map<Integer, Integer> countPerDay = new HashMap<>();
        for (int[] exams : examsByStudent) {
            if (exams.length <= maxPerDay) continue; // cannot exceed the cap
            countPerDay.clear();
            for (int e : exams) {
                countPerDay.merge(dayOfSlot[a.getSlot(e)], 1, Integer::sum);
            }
            for (int c : countPerDay.values()) {
                if (c > maxPerDay) count += c - maxPerDay;
            }
        }
        return new Violation(getName(), count, weight * count);
    }

    @Override
    public String getViolationMessage() {
        return "Daily exam limit per student exceeded";
    }
}
