package timetabler.core;

import org.junit.jupiter.api.Test;
import timetabler.TestInstances;
import timetabler.config.SchedulingConfig;
import timetabler.model.Assignment;
import timetabler.model.Placement;
import timetabler.model.ProblemDescription;
import timetabler.model.Violation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CostEvaluatorTest {

    private static final SchedulingConfig DEFAULTS = SchedulingConfig.defaults();

    private static Assignment assign(int[]... roomSlot) {
        List<Placement> list = new ArrayList<>();
        for (int[] rs : roomSlot) list.add(new Placement(rs[0], rs[1]));
        return Assignment.of(list);
    }

    private static Map<String, Integer> counts(CostEvaluator ev, Assignment a) {
        return ev.explain(a).stream().collect(Collectors.toMap(Violation::getConstraint, Violation::getCount));
    }

    @Test
    void evaluatesAllSevenConstraintClasses() {
        ProblemDescription p = TestInstances.disjointExams(1, 1, 1, List.of(1));
        List<String> names = CostEvaluator.forProblem(p, DEFAULTS).getConstraints().getConstraints().stream()
                .map(c -> c.getName())
                .collect(Collectors.toList());

        assertEquals(List.of("room-double-booking", "student-clash", "student-min-gap", "student-day-cap",
                "room-turnaround", "large-exam-last-slot", "invigilator-capacity"), names);
    }

    @Test
    void conflictFreeAssignmentCostsNothing() {
        ProblemDescription p = TestInstances.disjointExams(2, 1, 8, List.of(5, 5));
        CostEvaluator ev = CostEvaluator.forProblem(p, DEFAULTS);
        Assignment a = assign(new int[]{0, 0}, new int[]{1, 0});

        assertEquals(0, ev.cost(a));
        assertTrue(ev.isSatisfying(a));
        assertTrue(ev.explain(a).isEmpty());
    }

    @Test
    void roomDoubleBookingAlsoBreaksTurnaround() {
        ProblemDescription p = TestInstances.disjointExams(3, 1, 8, List.of(5));
        CostEvaluator ev = CostEvaluator.forProblem(p, DEFAULTS);
        // three exams in room 0, slot 0: k-1 = 2 double bookings, two zero gaps
        Assignment a = assign(new int[]{0, 0}, new int[]{0, 0}, new int[]{0, 0});

        assertEquals(Map.of("room-double-booking", 2, "room-turnaround", 2), counts(ev, a));
        assertEquals(10 * 2 + 6 * 2, ev.cost(a));
    }

    @Test
    void sameSlotClashPaysClashAndMinGap() {
        ProblemDescription p = TestInstances.problem(1, 2, 8, List.of(5, 5), new int[]{0, 0}, new int[]{1, 0});
        CostEvaluator ev = CostEvaluator.forProblem(p, DEFAULTS);
        Assignment a = assign(new int[]{0, 0}, new int[]{1, 0});

        assertEquals(Map.of("student-clash", 1, "student-min-gap", 1), counts(ev, a));
        assertEquals(16, ev.cost(a));
    }

    @Test
    void adjacentSlotsBreakOnlyTheMinimumGap() {
        ProblemDescription p = TestInstances.problem(1, 2, 8, List.of(5, 5), new int[]{0, 0}, new int[]{1, 0});
        CostEvaluator ev = CostEvaluator.forProblem(p, DEFAULTS);

        assertEquals(6, ev.cost(assign(new int[]{0, 0}, new int[]{1, 1})));
        assertEquals(0, ev.cost(assign(new int[]{0, 0}, new int[]{1, 2})));
    }

    @Test
    void minGapIsCountedPerStudentPair() {
        // two students share both exams
        ProblemDescription p = TestInstances.problem(2, 2, 8, List.of(5, 5),
                new int[]{0, 0}, new int[]{1, 0}, new int[]{0, 1}, new int[]{1, 1});
        CostEvaluator ev = CostEvaluator.forProblem(p, DEFAULTS);
        assertEquals(12, ev.cost(assign(new int[]{0, 0}, new int[]{1, 1})));
    }

    @Test
    void thirdExamOnOneDayIsAnOverload() {
        ProblemDescription p = TestInstances.problem(1, 3, 6, List.of(5, 5, 5),
                new int[]{0, 0}, new int[]{1, 0}, new int[]{2, 0});
        SchedulingConfig sixPerDay = SchedulingConfig.builder().slotsPerDay(6).build();
        CostEvaluator ev = CostEvaluator.forProblem(p, sixPerDay);
        Assignment a = assign(new int[]{0, 0}, new int[]{1, 2}, new int[]{2, 4});

        assertEquals(Map.of("student-day-cap", 1), counts(ev, a));
        assertEquals(8, ev.cost(a));
    }

    @Test
    void dayOverloadGrowsWithEveryExtraExam() {
        ProblemDescription p = TestInstances.problem(1, 4, 8, List.of(5, 5, 5, 5),
                new int[]{0, 0}, new int[]{1, 0}, new int[]{2, 0}, new int[]{3, 0});
        SchedulingConfig config = SchedulingConfig.builder().slotsPerDay(8).build();
        CostEvaluator ev = CostEvaluator.forProblem(p, config);
        Assignment a = assign(new int[]{0, 0}, new int[]{1, 2}, new int[]{2, 4}, new int[]{3, 6});

        assertEquals(Map.of("student-day-cap", 2), counts(ev, a));
        assertEquals(16, ev.cost(a));
    }

    @Test
    void roomReuseInTheNextSlotBreaksTurnaround() {
        ProblemDescription p = TestInstances.disjointExams(2, 1, 8, List.of(5));
        CostEvaluator ev = CostEvaluator.forProblem(p, DEFAULTS);

        Assignment tooClose = assign(new int[]{0, 1}, new int[]{0, 0});
        assertEquals(Map.of("room-turnaround", 1), counts(ev, tooClose));
        assertEquals(6, ev.cost(tooClose));
        assertEquals(0, ev.cost(assign(new int[]{0, 0}, new int[]{0, 2})));
    }

    @Test
    void largeExamInLastSlotOfDay() {
        ProblemDescription p = TestInstances.disjointExams(1, 10, 8, List.of(10));
        CostEvaluator ev = CostEvaluator.forProblem(p, DEFAULTS);

        assertEquals(Map.of("large-exam-last-slot", 1), counts(ev, assign(new int[]{0, 3})));
        assertEquals(12, ev.cost(assign(new int[]{0, 7})));
        assertEquals(0, ev.cost(assign(new int[]{0, 2})));
    }

    @Test
    void invigilatorDemandAboveCapacityIsPenalisedPerUnit() {
        // six small exams in one slot need 12 invigilators, capacity is 10
        ProblemDescription p = TestInstances.disjointExams(6, 1, 4, Collections.nCopies(6, 5));
        CostEvaluator ev = CostEvaluator.forProblem(p, DEFAULTS);
        Assignment a = assign(new int[]{0, 0}, new int[]{1, 0}, new int[]{2, 0},
                new int[]{3, 0}, new int[]{4, 0}, new int[]{5, 0});

        assertEquals(Map.of("invigilator-capacity", 2), counts(ev, a));
        assertEquals(16, ev.cost(a));
    }

    @Test
    void largeExamsNeedThreeInvigilators() {
        // four large exams (demand 3 each) in slot 0: 12 > 10
        ProblemDescription p = TestInstances.disjointExams(4, 10, 4, Collections.nCopies(4, 10));
        CostEvaluator ev = CostEvaluator.forProblem(p, DEFAULTS);
        Assignment a = assign(new int[]{0, 0}, new int[]{1, 0}, new int[]{2, 0}, new int[]{3, 0});

        assertEquals(16, ev.cost(a));
    }

    @Test
    void weightsComeFromTheConfig() {
        ProblemDescription p = TestInstances.problem(1, 2, 8, List.of(5, 5), new int[]{0, 0}, new int[]{1, 0});
        SchedulingConfig config = SchedulingConfig.builder().clashWeight(100).minGapWeight(1).build();
        CostEvaluator ev = CostEvaluator.forProblem(p, config);
        assertEquals(101, ev.cost(assign(new int[]{0, 0}, new int[]{1, 0})));
    }

    @Test
    void costIsNonNegativePureAndZeroExactlyWhenSatisfied() {
        ProblemDescription p = TestInstances.random(3L, 20, 10, 8, 3, 6, 5);
        CostEvaluator ev = CostEvaluator.forProblem(p, DEFAULTS);
        Random rnd = new Random(11);

        for (int round = 0; round < 200; round++) {
            Assignment a = new Assignment(p.getNumberOfExams());
            for (int e = 0; e < a.size(); e++) {
                a.place(e, new Placement(rnd.nextInt(3), rnd.nextInt(8)));
            }
            Assignment before = a.copy();

            int first = ev.cost(a);
            int second = ev.cost(a);
            assertTrue(first >= 0);
            assertEquals(first, second);
            assertEquals(before, a);
            assertEquals(first == 0, ev.isSatisfying(a));
            assertEquals(first, ev.explain(a).stream().mapToInt(Violation::getPenalty).sum());
        }
    }

    @Test
    void refusesIncompleteAssignments() {
        ProblemDescription p = TestInstances.disjointExams(2, 1, 4, List.of(5));
        CostEvaluator ev = CostEvaluator.forProblem(p, DEFAULTS);
        assertThrows(IllegalArgumentException.class, () -> ev.cost(new Assignment(2)));
        assertThrows(IllegalArgumentException.class, () -> ev.cost(assign(new int[]{0, 0})));
    }

    @Test
    void refusesPlacementsOutsideTheInstance() {
        ProblemDescription p = TestInstances.disjointExams(2, 1, 4, List.of(5));
        CostEvaluator ev = CostEvaluator.forProblem(p, DEFAULTS);

        IllegalArgumentException slot = assertThrows(IllegalArgumentException.class,
                () -> ev.cost(assign(new int[]{0, 0}, new int[]{0, 9})));
        assertTrue(slot.getMessage().contains("Exam 1"));
        assertThrows(IllegalArgumentException.class, () -> ev.explain(assign(new int[]{1, 0}, new int[]{0, 2})));
        assertThrows(IllegalArgumentException.class, () -> ev.isSatisfying(assign(new int[]{0, 4}, new int[]{0, 2})));
    }
}
