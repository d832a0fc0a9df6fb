package timetabler.dao;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import timetabler.model.Assignment;
import timetabler.model.Placement;
import timetabler.model.ScheduleResult;
import timetabler.model.Violation;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * SQLite store for solver runs: one row per run, the (best) schedule of the
 * run and its per-constraint violation log.
 */
public class DBManager {

    private static final Logger log = LoggerFactory.getLogger(DBManager.class);

    public static final String DEFAULT_DB_URL = "jdbc:sqlite:timetabler.db";

    private final String url;

    public DBManager(String url) {
        this.url = url;
    }

    public static DBManager forFile(Path dbFile) {
        return new DBManager("jdbc:sqlite:" + dbFile.toAbsolutePath());
    }

    public void initializeDatabase() throws SQLException {
        try (Connection conn = getConnection();
                Statement st = conn.createStatement()) {
            st.execute("CREATE TABLE IF NOT EXISTS runs ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT, status TEXT, reason TEXT, best_cost INTEGER, "
                    + "iterations INTEGER, runtime_ms REAL, seed INTEGER, created_at TEXT DEFAULT CURRENT_TIMESTAMP)");
            st.execute("CREATE TABLE IF NOT EXISTS schedule (run_id INTEGER, exam_id INTEGER, room_id INTEGER, slot_id INTEGER)");
            st.execute("CREATE TABLE IF NOT EXISTS violation_log ("
                    + "id INTEGER PRIMARY KEY AUTOINCREMENT, run_id INTEGER, constraint_name TEXT, count INTEGER, penalty INTEGER)");
        }
    }

    public Connection getConnection() throws SQLException {
        return DriverManager.getConnection(url);
    }

    // =============================================================
    // RUNS
    // =============================================================

    /**
     * Stores a run together with its assignment (if any) and violation log.
     *
     * @return id of the new run
     */
    public long saveRun(ScheduleResult result) throws SQLException {
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                long runId = insertRun(conn, result);
                if (result.getAssignment() != null) {
                    insertSchedule(conn, runId, result.getAssignment());
                }
                insertViolations(conn, runId, result.getViolations());
                conn.commit();
                log.info("Saved run {} ({}, best cost {})", runId, result.getStatus(), result.getBestCost());
                return runId;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        }
    }

    private long insertRun(Connection conn, ScheduleResult result) throws SQLException {
        String sql = "INSERT INTO runs(status, reason, best_cost, iterations, runtime_ms, seed) VALUES(?, ?, ?, ?, ?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, result.getStatus().name());
            ps.setString(2, result.getReason() == null ? null : result.getReason().name());
            ps.setInt(3, result.getBestCost());
            ps.setInt(4, result.getIterations());
            ps.setDouble(5, result.getRuntimeMillis());
            ps.setLong(6, result.getSeed());
            ps.executeUpdate();
        }
        try (Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery("SELECT last_insert_rowid()")) {
            rs.next();
            return rs.getLong(1);
        }
    }

    private void insertSchedule(Connection conn, long runId, Assignment a) throws SQLException {
        String sql = "INSERT INTO schedule(run_id, exam_id, room_id, slot_id) VALUES(?, ?, ?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (int e = 0; e < a.size(); e++) {
                ps.setLong(1, runId);
                ps.setInt(2, e);
                ps.setInt(3, a.getRoom(e));
                ps.setInt(4, a.getSlot(e));
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private void insertViolations(Connection conn, long runId, List<Violation> violations) throws SQLException {
        String sql = "INSERT INTO violation_log(run_id, constraint_name, count, penalty) VALUES(?, ?, ?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (Violation v : violations) {
                ps.setLong(1, runId);
                ps.setString(2, v.getConstraint());
                ps.setInt(3, v.getCount());
                ps.setInt(4, v.getPenalty());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    public List<RunRecord> loadRuns() throws SQLException {
        List<RunRecord> list = new ArrayList<>();
        String sql = "SELECT id, status, reason, best_cost, iterations, runtime_ms, seed FROM runs ORDER BY id";
        try (Connection conn = getConnection();
                Statement st = conn.createStatement();
                ResultSet rs = st.executeQuery(sql)) {
            while (rs.next()) {
                list.add(new RunRecord(
                        rs.getLong("id"),
                        rs.getString("status"),
                        rs.getString("reason"),
                        rs.getInt("best_cost"),
                        rs.getInt("iterations"),
                        rs.getDouble("runtime_ms"),
                        rs.getLong("seed")));
            }
        }
        return list;
    }

    // =============================================================
    // SCHEDULE / VIOLATIONS
    // =============================================================

    /** Placements of a run indexed by exam id; empty when the run stored no assignment. */
    public List<Placement> loadSchedule(long runId) throws SQLException {
        List<Placement> list = new ArrayList<>();
        String sql = "SELECT exam_id, room_id, slot_id FROM schedule WHERE run_id = ? ORDER BY exam_id";
        try (Connection conn = getConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    list.add(new Placement(rs.getInt("room_id"), rs.getInt("slot_id")));
                }
            }
        }
        return list;
    }

    public List<Violation> loadViolationLog(long runId) throws SQLException {
        List<Violation> list = new ArrayList<>();
        String sql = "SELECT constraint_name, count, penalty FROM violation_log WHERE run_id = ? ORDER BY id";
        try (Connection conn = getConnection(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, runId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    list.add(new Violation(rs.getString("constraint_name"), rs.getInt("count"), rs.getInt("penalty")));
                }
            }
        }
        return list;
    }

    public void clearRuns() throws SQLException {
        try (Connection conn = getConnection(); Statement st = conn.createStatement()) {
            st.executeUpdate("DELETE FROM violation_log");
            st.executeUpdate("DELETE FROM schedule");
            st.executeUpdate("DELETE FROM runs");
        }
    }

    // --- Helper Records ---
    public static record RunRecord(long id, String status, String reason, int bestCost, int iterations,
            double runtimeMs, long seed) {
    }
}
