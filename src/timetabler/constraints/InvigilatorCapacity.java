package timetabler.constraints;

import timetabler.model.Assignment;
import timetabler.model.Violation;

/**
 * Summed invigilator demand of the exams in one slot may not exceed the
 * examiner capacity. The violation count is the total excess over all slots.
 */
public class InvigilatorCapacity implements Constraint {

    private final int[] demand; // examId -> invigilators needed
    private final int numberOfSlots;
    private final int capacity;
    private final int weight;

    public InvigilatorCapacity(int[] demand, int numberOfSlots, int capacity, int weight) {
        this.demand = demand;
        this.numberOfSlots = numberOfSlots;
        this.capacity = capacity;
        this.weight = weight;
    }

    @Override
    public String getName() {
        return "invigilator-capacity";
    }

    @Override
    public Violation evaluate(Assignment a) {
        int[] perSlot = new int[numberOfSlots];
        for (int e = 0; e < a.size(); e++) {
            perSlot[a.getSlot(e)] += demand[e];
        }
        int excess = 0;
        for (int d : perSlot) {
            if (d > capacity) excess += d - capacity;
        }
        return new Violation(getName(), excess, weight * excess);
    }

    @Override
    public String getViolationMessage() {
        return "Not enough invigilators for the exams in a slot";
    }
}
