package timetabler.dao;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import timetabler.model.Assignment;
import timetabler.model.InfeasibilityReason;
import timetabler.model.Placement;
import timetabler.model.ScheduleResult;
import timetabler.model.Violation;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DBManagerTest {

    @TempDir
    Path dir;

    private DBManager db;

    @BeforeEach
    void setUp() throws Exception {
        db = DBManager.forFile(dir.resolve("runs.db"));
        db.initializeDatabase();
    }

    @Test
    void feasibleRunRoundTrips() throws Exception {
        Assignment a = Assignment.of(List.of(new Placement(0, 3), new Placement(1, 0), new Placement(0, 1)));
        ScheduleResult result = ScheduleResult.feasible(a)
                .bestCost(0)
                .iterations(120)
                .runtimeMillis(4.25)
                .seed(42)
                .build();

        long id = db.saveRun(result);

        List<DBManager.RunRecord> runs = db.loadRuns();
        assertEquals(1, runs.size());
        DBManager.RunRecord run = runs.get(0);
        assertEquals(id, run.id());
        assertEquals("FEASIBLE", run.status());
        assertNull(run.reason());
        assertEquals(120, run.iterations());
        assertEquals(4.25, run.runtimeMs());
        assertEquals(42L, run.seed());
        assertEquals(a.toPlacements(), db.loadSchedule(id));
        assertTrue(db.loadViolationLog(id).isEmpty());
    }

    @Test
    void exhaustedRunKeepsViolationLog() throws Exception {
        ScheduleResult result = ScheduleResult.infeasible(InfeasibilityReason.SEARCH_EXHAUSTED)
                .assignment(Assignment.of(List.of(new Placement(0, 0), new Placement(0, 0))))
                .bestCost(16)
                .violations(List.of(new Violation("room-double-booking", 1, 10),
                        new Violation("room-turnaround", 1, 6)))
                .build();

        long id = db.saveRun(result);

        List<Violation> log = db.loadViolationLog(id);
        assertEquals(2, log.size());
        assertEquals("room-double-booking", log.get(0).getConstraint());
        assertEquals(6, log.get(1).getPenalty());
        assertEquals("SEARCH_EXHAUSTED", db.loadRuns().get(0).reason());
        assertEquals(16, db.loadRuns().get(0).bestCost());
    }

    @Test
    void structuralRunStoresNoSchedule() throws Exception {
        long id = db.saveRun(ScheduleResult.infeasible(InfeasibilityReason.STRUCTURAL).bestCost(-1).build());

        assertTrue(db.loadSchedule(id).isEmpty());
        assertEquals(-1, db.loadRuns().get(0).bestCost());
    }

    @Test
    void runsGetIncreasingIdsAndCanBeCleared() throws Exception {
        long first = db.saveRun(ScheduleResult.feasible(new Assignment(0)).build());
        long second = db.saveRun(ScheduleResult.feasible(new Assignment(0)).build());
        assertTrue(second > first);

        db.clearRuns();
        assertTrue(db.loadRuns().isEmpty());
    }

    @Test
    void schemaCreationIsRepeatable() throws Exception {
        db.saveRun(ScheduleResult.feasible(new Assignment(0)).build());
        db.initializeDatabase();
        assertEquals(1, db.loadRuns().size());
    }
}
