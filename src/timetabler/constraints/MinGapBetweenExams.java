package timetabler.constraints;

import timetabler.model.Assignment;
import timetabler.model.Violation;

/**
 * Two exams of one student must be more than {@code minGap} slots apart.
 * A same-slot pair is also a min-gap violation, on top of the clash.
 */
public class MinGapBetweenExams implements Constraint {
    private final int[][] examsByStudent;
    private final int minGap;
    private final int weight;

    public MinGapBetweenExams(int[][] examsByStudent, int minGap, int weight) {
        this.examsByStudent = examsByStudent;
        this.minGap = minGap;
        this.weight = weight;
    }

    @Override
    public String getName() {
        return "student-min-gap";
    }

    @Override
    public Violation evaluate(Assignment a) {
        int count = 0;
        for (int[] exams : examsByStudent) {
            for (int i = 0; i < exams.length; i++) {
                int t1 = a.getSlot(exams[i]);
                for (int j = i + 1; j < exams.length; j++) {
                    if (Math.abs(t1 - a.getSlot(exams[j])) <= minGap) count++;
                }
            }
        }
        return new Violation(getName(), count, weight * count);
    }

    @Override
    public String getViolationMessage() {
        return "Student exams closer than the minimum gap";
    }
}
