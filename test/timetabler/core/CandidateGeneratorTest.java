package timetabler.core;

import org.junit.jupiter.api.Test;
import timetabler.TestInstances;
import timetabler.config.SchedulingConfig;
import timetabler.model.Placement;
import timetabler.model.ProblemDescription;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CandidateGeneratorTest {

    private static CandidateSet generate(ProblemDescription p, SchedulingConfig config) {
        IncidenceIndex index = IncidenceIndex.build(p);
        SlotCalendar cal = new SlotCalendar(p.getNumberOfSlots(), config.getSlotsPerDay());
        return new CandidateGenerator(config).generate(p, index, cal);
    }

    @Test
    void keepsOnlyRoomsThatFitInRoomThenSlotOrder() {
        // exam 0 has 3 students, exam 1 has 1
        ProblemDescription p = TestInstances.problem(4, 2, 2, List.of(2, 3, 1),
                new int[]{0, 0}, new int[]{0, 1}, new int[]{0, 2}, new int[]{1, 3});
        CandidateSet set = generate(p, SchedulingConfig.defaults());

        assertEquals(List.of(new Placement(1, 0), new Placement(1, 1)), set.get(0));
        assertEquals(6, set.size(1));
        assertEquals(new Placement(0, 0), set.get(1).get(0));
        assertEquals(new Placement(2, 1), set.get(1).get(5));
        assertTrue(set.isStructurallyFeasible());
    }

    @Test
    void largeExamsSkipTheLastSlotOfEveryDay() {
        ProblemDescription p = TestInstances.disjointExams(1, 10, 8, List.of(10));
        CandidateSet set = generate(p, SchedulingConfig.defaults());

        assertEquals(6, set.size(0));
        for (Placement c : set.get(0)) {
            assertFalse(c.getSlotId() == 3 || c.getSlotId() == 7, "last slot offered: " + c);
        }
    }

    @Test
    void smallExamsMayUseTheLastSlot() {
        ProblemDescription p = TestInstances.disjointExams(1, 9, 4, List.of(10));
        assertEquals(4, generate(p, SchedulingConfig.defaults()).size(0));
    }

    @Test
    void withoutDaysNoSlotIsExcluded() {
        ProblemDescription p = TestInstances.disjointExams(1, 10, 4, List.of(10));
        SchedulingConfig config = SchedulingConfig.builder().slotsPerDay(0).build();
        assertEquals(4, generate(p, config).size(0));
    }

    @Test
    void reportsExamsWithoutCandidates() {
        ProblemDescription p = TestInstances.problem(3, 2, 3, List.of(2),
                new int[]{0, 0}, new int[]{1, 0}, new int[]{1, 1}, new int[]{1, 2});
        CandidateSet set = generate(p, SchedulingConfig.defaults());

        assertFalse(set.isStructurallyFeasible());
        assertEquals(List.of(1), set.examsWithoutCandidates());
        assertEquals(3, set.totalSize());
    }

    @Test
    void zeroSlotsLeavesEveryExamWithoutCandidates() {
        ProblemDescription p = TestInstances.disjointExams(2, 1, 0, List.of(5));
        assertEquals(List.of(0, 1), generate(p, SchedulingConfig.defaults()).examsWithoutCandidates());
    }
}
