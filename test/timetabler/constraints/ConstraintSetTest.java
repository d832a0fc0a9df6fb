package timetabler.constraints;

import org.junit.jupiter.api.Test;
import timetabler.model.Assignment;
import timetabler.model.Placement;
import timetabler.model.Violation;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConstraintSetTest {

    // student 0 sits exams 0 and 1, student 1 sits exams 1 and 2
    private static final int[][] EXAMS_BY_STUDENT = {{0, 1}, {1, 2}};

    private static Assignment at(int[]... roomSlot) {
        Assignment a = new Assignment(roomSlot.length);
        for (int e = 0; e < roomSlot.length; e++) {
            a.place(e, new Placement(roomSlot[e][0], roomSlot[e][1]));
        }
        return a;
    }

    @Test
    void emptySetAcceptsEverything() {
        ConstraintSet set = new ConstraintSet();
        Assignment a = at(new int[]{0, 0}, new int[]{0, 0});

        assertEquals(0, set.cost(a));
        assertTrue(set.ok(a));
        assertTrue(set.explain(a).isEmpty());
    }

    @Test
    void costAddsWeightedPenalties() {
        ConstraintSet set = new ConstraintSet()
                .add(new OneExamPerRoomPerTime(10))
                .add(new NoStudentClash(EXAMS_BY_STUDENT, 7));
        // exams 0 and 1 share room and slot and a student
        Assignment a = at(new int[]{0, 0}, new int[]{0, 0}, new int[]{1, 5});

        assertEquals(17, set.cost(a));
        assertFalse(set.ok(a));
    }

    @Test
    void explainListsOnlyBrokenConstraintsInOrder() {
        ConstraintSet set = new ConstraintSet()
                .add(new OneExamPerRoomPerTime(10))
                .add(new NoStudentClash(EXAMS_BY_STUDENT, 10))
                .add(new MinGapBetweenExams(EXAMS_BY_STUDENT, 1, 6));
        Assignment a = at(new int[]{0, 0}, new int[]{1, 1}, new int[]{2, 4});

        List<Violation> v = set.explain(a);

        assertEquals(1, v.size());
        assertEquals("student-min-gap", v.get(0).getConstraint());
        assertEquals(1, v.get(0).getCount());
        assertEquals(6, v.get(0).getPenalty());
        assertEquals("student-min-gap: 1 (penalty 6)", v.get(0).toString());
    }

    @Test
    void constraintListIsReadOnly() {
        ConstraintSet set = new ConstraintSet().add(new OneExamPerRoomPerTime(1));
        assertThrows(UnsupportedOperationException.class,
                () -> set.getConstraints().add(new OneExamPerRoomPerTime(2)));
    }

    @Test
    void doubleBookingCountsExtraOccupants() {
        Assignment a = at(new int[]{0, 0}, new int[]{0, 0}, new int[]{0, 0}, new int[]{0, 1}, new int[]{0, 1});
        assertEquals(3, new OneExamPerRoomPerTime(1).evaluate(a).getCount());
    }

    @Test
    void turnaroundLooksAtSortedSlotsPerRoom() {
        RoomTurnaround rule = new RoomTurnaround(2, 1, 6);
        // room 0 used at 5, 0, 3: sorted gaps 3 and 2; room 1 at 2 and 3
        Assignment a = at(new int[]{0, 5}, new int[]{0, 0}, new int[]{0, 3}, new int[]{1, 2}, new int[]{1, 3});

        Violation v = rule.evaluate(a);
        assertEquals(1, v.getCount());
        assertEquals(6, v.getPenalty());
    }

    @Test
    void minGapUsesAbsoluteDistance() {
        MinGapBetweenExams rule = new MinGapBetweenExams(EXAMS_BY_STUDENT, 2, 1);

        assertEquals(2, rule.evaluate(at(new int[]{0, 4}, new int[]{1, 2}, new int[]{2, 0})).getCount());
        assertEquals(0, rule.evaluate(at(new int[]{0, 6}, new int[]{1, 3}, new int[]{2, 0})).getCount());
    }

    @Test
    void dayCapCountsExamsBeyondTheLimit() {
        int[][] oneStudent = {{0, 1, 2, 3}};
        int[] dayOfSlot = {0, 0, 0, 0, 1, 1, 1, 1};
        MaxExamsPerDay rule = new MaxExamsPerDay(oneStudent, dayOfSlot, 2, 8);

        Assignment threeOnDayZero = at(new int[]{0, 0}, new int[]{1, 1}, new int[]{2, 2}, new int[]{3, 4});
        assertEquals(1, rule.evaluate(threeOnDayZero).getCount());
        assertEquals(8, rule.evaluate(threeOnDayZero).getPenalty());

        Assignment twoAndTwo = at(new int[]{0, 0}, new int[]{1, 2}, new int[]{2, 4}, new int[]{3, 6});
        assertEquals(0, rule.evaluate(twoAndTwo).getCount());
    }

    @Test
    void lastSlotRuleOnlyConcernsLargeExams() {
        boolean[] large = {true, false};
        boolean[] last = {false, true};
        LargeExamNotInLastSlot rule = new LargeExamNotInLastSlot(large, last, 12);

        assertEquals(0, rule.evaluate(at(new int[]{0, 0}, new int[]{0, 1})).getCount());
        assertEquals(12, rule.evaluate(at(new int[]{0, 1}, new int[]{1, 1})).getPenalty());
    }

    @Test
    void invigilatorExcessIsSummedOverSlots() {
        InvigilatorCapacity rule = new InvigilatorCapacity(new int[]{3, 3, 2, 2}, 2, 5, 8);

        // slot 0 needs 6, slot 1 needs 4
        Violation v = rule.evaluate(at(new int[]{0, 0}, new int[]{1, 0}, new int[]{2, 1}, new int[]{3, 1}));
        assertEquals(1, v.getCount());
        assertEquals(8, v.getPenalty());
        // slot 0 needs 10
        assertEquals(5, rule.evaluate(at(new int[]{0, 0}, new int[]{1, 0}, new int[]{2, 0}, new int[]{3, 0})).getCount());
    }

    @Test
    void everyRuleHasANameAndMessage() {
        List<Constraint> all = List.of(
                new OneExamPerRoomPerTime(1),
                new NoStudentClash(EXAMS_BY_STUDENT, 1),
                new MinGapBetweenExams(EXAMS_BY_STUDENT, 1, 1),
                new MaxExamsPerDay(EXAMS_BY_STUDENT, new int[]{0}, 2, 1),
                new RoomTurnaround(1, 1, 1),
                new LargeExamNotInLastSlot(new boolean[0], new boolean[0], 1),
                new InvigilatorCapacity(new int[0], 1, 10, 1));
        for (Constraint c : all) {
            assertFalse(c.getName().isBlank());
            assertFalse(c.getViolationMessage().isBlank());
        }
    }
}
