package timetabler.constraints;

import timetabler.model.Assignment;
import timetabler.model.Violation;

/**
 * Every pair of exams of one student placed in the same slot is a clash.
 */
public class NoStudentClash implements Constraint {
    private final int[][] examsByStudent; // studentId -> sorted exam ids
    private final int weight;

    public NoStudentClash(int[][] examsByStudent, int weight) {
        this.examsByStudent = examsByStudent;
        this.weight = weight;
    }

    @Override
    public String getName() {
        return "student-clash";
    }

    @Override
    public Violation evaluate(Assignment a) {
        int count = 0;
        for (int[] exams : examsByStudent) {
            for (int i = 0; i < exams.length; i++) {
                int t1 = a.getSlot(exams[i]);
                for (int j = i + 1; j < exams.length; j++) {
                    if (t1 == a.getSlot(exams[j])) count++;
                }
            }
        }
        return new Violation(getName(), count, weight * count);
    }

    @Override
    public String getViolationMessage() {
        return "Student has two exams in the same slot";
    }
}
