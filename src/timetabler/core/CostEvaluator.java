package timetabler.core;

import timetabler.config.SchedulingConfig;
import timetabler.constraints.ConstraintSet;
import timetabler.constraints.InvigilatorCapacity;
import timetabler.constraints.LargeExamNotInLastSlot;
import timetabler.constraints.MaxExamsPerDay;
import timetabler.constraints.MinGapBetweenExams;
import timetabler.constraints.NoStudentClash;
import timetabler.constraints.OneExamPerRoomPerTime;
import timetabler.constraints.RoomTurnaround;
import timetabler.model.Assignment;
import timetabler.model.ProblemDescription;
import timetabler.model.Violation;

import java.util.List;

/**
 * Weighted violation cost of a complete assignment. The cost is recomputed
 * from scratch on every call, is never negative, and is zero exactly when
 * no rule is broken. Evaluation does not touch the assignment.
 */
public class CostEvaluator {

    private final ConstraintSet constraints;
    private final int numberOfExams;
    private final int numberOfRooms;
    private final int numberOfSlots;

    public CostEvaluator(ProblemDescription problem, IncidenceIndex index, SlotCalendar calendar,
                         SchedulingConfig config) {
        int exams = problem.getNumberOfExams();
        boolean[] large = new boolean[exams];
        int[] demand = new int[exams];
        for (int e = 0; e < exams; e++) {
            large[e] = config.isLargeExam(index.examSize(e));
            demand[e] = config.invigilatorDemand(index.examSize(e));
        }
        int[][] examsByStudent = index.examArrays();

        this.numberOfExams = exams;
        this.numberOfRooms = problem.getNumberOfRooms();
        this.numberOfSlots = problem.getNumberOfSlots();
        this.constraints = new ConstraintSet()
                .add(new OneExamPerRoomPerTime(config.getRoomDoubleWeight()))
                .add(new NoStudentClash(examsByStudent, config.getClashWeight()))
                .add(new MinGapBetweenExams(examsByStudent, config.getMinGap(), config.getMinGapWeight()))
                .add(new MaxExamsPerDay(examsByStudent, calendar.dayIndex(), config.getMaxExamsPerDay(),
                        config.getDayCapWeight()))
                .add(new RoomTurnaround(problem.getNumberOfRooms(), config.getTurnaroundGap(),
                        config.getTurnaroundWeight()))
                .add(new LargeExamNotInLastSlot(large, calendar.lastSlotFlags(), config.getLastSlotWeight()))
                .add(new InvigilatorCapacity(demand, problem.getNumberOfSlots(), config.getExaminerCapacity(),
                        config.getInvigilatorWeight()));
    }

    public static CostEvaluator forProblem(ProblemDescription problem, SchedulingConfig config) {
        return new CostEvaluator(problem, IncidenceIndex.build(problem),
                new SlotCalendar(problem.getNumberOfSlots(), config.getSlotsPerDay()), config);
    }

    public int cost(Assignment assignment) {
        checkComplete(assignment);
        return constraints.cost(assignment);
    }

    public boolean isSatisfying(Assignment assignment) {
        checkComplete(assignment);
        return constraints.ok(assignment);
    }

    /** Non-zero contributions by constraint class, in evaluation order. */
    public List<Violation> explain(Assignment assignment) {
        checkComplete(assignment);
        return constraints.explain(assignment);
    }

    ConstraintSet getConstraints() {
        return constraints;
    }

    private void checkComplete(Assignment assignment) {
        if (assignment.size() != numberOfExams || !assignment.isComplete()) {
            throw new IllegalArgumentException("Cost is only defined for a complete assignment of "
                    + numberOfExams + " exams");
        }
        for (int e = 0; e < numberOfExams; e++) {
            if (assignment.getRoom(e) >= numberOfRooms || assignment.getSlot(e) >= numberOfSlots) {
                throw new IllegalArgumentException("Exam " + e + " is placed at " + assignment.getPlacement(e)
                        + " outside " + numberOfRooms + " room(s) and " + numberOfSlots + " slot(s)");
            }
        }
    }
}
