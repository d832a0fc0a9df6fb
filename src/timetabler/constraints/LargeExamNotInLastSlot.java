package timetabler.constraints;

import timetabler.model.Assignment;
import timetabler.model.Violation;

public class LargeExamNotInLastSlot implements Constraint {

    private final boolean[] largeExam; // examId -> size >= threshold
    private final boolean[] lastSlot; // slot -> last slot of its day
    private final int weight;

    public LargeExamNotInLastSlot(boolean[] largeExam, boolean[] lastSlot, int weight) {
        this.largeExam = largeExam;
        this.lastSlot = lastSlot;
        this.weight = weight;
    }

    @Override
    public String getName() {
        return "large-exam-last-slot";
    }

    @Override
    public Violation evaluate(Assignment a) {
        int count = 0;
        for (int e = 0; e < a.size(); e++) {
            if (largeExam[e] && lastSlot[a.getSlot(e)]) count++;
        }
        return new Violation(getName(), count, weight * count);
    }

    @Override
    public String getViolationMessage() {
        return "Large exam placed in the last slot of a day";
    }
}
