package timetabler.export;

import timetabler.assign.SeatAllocator;
import timetabler.core.IncidenceIndex;
import timetabler.core.SlotCalendar;
import timetabler.model.Assignment;
import timetabler.model.ProblemDescription;
import timetabler.model.ScheduleResult;
import timetabler.model.StudentSeat;
import timetabler.model.Timeslot;
import timetabler.model.Violation;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns a {@link ScheduleResult} into text and table rows.
 * <p>
 * The plain report is {@code runtime_ms: <ms>}, then {@code sat} with one
 * {@code exam <e>: room <r>, slot <t>} line per exam, or {@code unsat}.
 */
public class ResultReporter {

    public static final String[] HEADER = {"Exam", "Room", "Slot", "Day", "Position", "Students"};
    public static final String[] SEAT_HEADER = {"Student", "Exam", "Room", "Slot", "Day", "Seat"};

    private final SlotCalendar calendar;

    public ResultReporter(SlotCalendar calendar) {
        this.calendar = calendar;
    }

    public String report(ScheduleResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "runtime_ms: %.3f", result.getRuntimeMillis())).append('\n');
        sb.append(result.getStatus().getLabel()).append('\n');
        if (result.isFeasible()) {
            Assignment a = result.getAssignment();
            for (int e = 0; e < a.size(); e++) {
                sb.append("exam ").append(e)
                        .append(": room ").append(a.getRoom(e))
                        .append(", slot ").append(a.getSlot(e))
                        .append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * Slot-centric view: one header per used slot, then the exams held in it
     * ordered by room.
     */
    public String slotView(Assignment assignment) {
        Map<Integer, Map<Integer, List<Integer>>> bySlot = new TreeMap<>();
        for (int e = 0; e < assignment.size(); e++) {
            bySlot.computeIfAbsent(assignment.getSlot(e), k -> new TreeMap<>())
                    .computeIfAbsent(assignment.getRoom(e), k -> new ArrayList<>())
                    .add(e);
        }

        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Integer, Map<Integer, List<Integer>>> slot : bySlot.entrySet()) {
            Timeslot ts = calendar.timeslot(slot.getKey());
            sb.append(ts).append('\n');
            for (Map.Entry<Integer, List<Integer>> room : slot.getValue().entrySet()) {
                for (int e : room.getValue()) {
                    sb.append("  room ").append(room.getKey()).append(": exam ").append(e).append('\n');
                }
            }
        }
        return sb.toString();
    }

    /** Reason, best cost and per-constraint breakdown of an infeasible result. */
    public String diagnostics(ScheduleResult result) {
        if (result.isFeasible()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        sb.append("reason: ").append(result.getReason().getDescription()).append('\n');
        if (!result.getExamsWithoutCandidates().isEmpty()) {
            sb.append("exams without candidates: ").append(result.getExamsWithoutCandidates()).append('\n');
        }
        if (result.getAssignment() != null) {
            sb.append("best cost: ").append(result.getBestCost())
                    .append(" after ").append(result.getIterations()).append(" iteration(s)").append('\n');
            for (Violation v : result.getViolations()) {
                sb.append("  ").append(v).append('\n');
            }
        }
        return sb.toString();
    }

    /**
     * Table rows for the exporters, header row first.
     */
    public List<String[]> rows(ProblemDescription problem, Assignment assignment) {
        IncidenceIndex index = IncidenceIndex.build(problem);
        List<String[]> rows = new ArrayList<>();
        rows.add(HEADER.clone());
        for (int e = 0; e < assignment.size(); e++) {
            int slot = assignment.getSlot(e);
            rows.add(new String[]{
                    String.valueOf(e),
                    String.valueOf(assignment.getRoom(e)),
                    String.valueOf(slot),
                    String.valueOf(calendar.dayOf(slot)),
                    String.valueOf(calendar.positionOf(slot)),
                    String.valueOf(index.examSize(e))
            });
        }
        return rows;
    }

    /**
     * Seating rows grouped by student, each student's exams in slot order,
     * header row first.
     */
    public List<String[]> seatRows(List<StudentSeat> seats) {
        List<String[]> rows = new ArrayList<>();
        rows.add(SEAT_HEADER.clone());
        for (List<StudentSeat> timetable : SeatAllocator.byStudent(seats).values()) {
            for (StudentSeat seat : timetable) {
                rows.add(new String[]{
                        String.valueOf(seat.getStudentId()),
                        String.valueOf(seat.getExamId()),
                        String.valueOf(seat.getRoomId()),
                        String.valueOf(seat.getSlotId()),
                        String.valueOf(calendar.dayOf(seat.getSlotId())),
                        String.valueOf(seat.getSeatNo())
                });
            }
        }
        return rows;
    }
}
