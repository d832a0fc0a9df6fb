package timetabler.assign;

import timetabler.core.IncidenceIndex;
import timetabler.model.Assignment;
import timetabler.model.ProblemDescription;
import timetabler.model.StudentSeat;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

/**
 * Gives every student of a placed exam a seat number in the exam's room.
 * The order is a shuffle seeded by the run seed, the exam and its slot, so
 * the same timetable always yields the same seating.
 */
public class SeatAllocator {

    private final long seed;

    public SeatAllocator(long seed) {
        this.seed = seed;
    }

    /**
     * @param problem    instance the assignment belongs to
     * @param assignment complete assignment (normally a feasible one)
     * @return seat rows ordered by exam, then seat number
     */
    public List<StudentSeat> allocate(ProblemDescription problem, Assignment assignment) {
        if (assignment.size() != problem.getNumberOfExams() || !assignment.isComplete()) {
            throw new IllegalArgumentException("Seats can only be allocated for a complete assignment");
        }
        IncidenceIndex index = IncidenceIndex.build(problem);
        List<StudentSeat> out = new ArrayList<>();

        for (int e = 0; e < assignment.size(); e++) {
            out.addAll(assign(e, assignment.getRoom(e), assignment.getSlot(e),
                    problem.getRoomCapacity(assignment.getRoom(e)), new ArrayList<>(index.studentsOf(e))));
        }
        return out;
    }

    /**
     * Seats the students of one exam. If the room is too small the surplus
     * students get no seat; callers compare the sizes when that matters.
     */
    public List<StudentSeat> assign(int examId, int roomId, int slotId, int capacity, List<Integer> students) {
        List<Integer> pool = new ArrayList<>(students);
        Collections.sort(pool);
        long s = seed ^ (31L * examId) ^ ((long) slotId << 16);
        Collections.shuffle(pool, new Random(s));

        List<StudentSeat> out = new ArrayList<>();
        int cap = Math.max(0, capacity);
        for (int k = 0; k < cap && k < pool.size(); k++) {
            out.add(new StudentSeat(pool.get(k), examId, roomId, slotId, k + 1));
        }
        return out;
    }

    /** Per-student timetable: studentId -> seats sorted by slot. */
    public static Map<Integer, List<StudentSeat>> byStudent(List<StudentSeat> seats) {
        Map<Integer, List<StudentSeat>> map = new TreeMap<>();
        for (StudentSeat seat : seats) {
            map.computeIfAbsent(seat.getStudentId(), k -> new ArrayList<>()).add(seat);
        }
        for (List<StudentSeat> l : map.values()) {
            l.sort((a, b) -> Integer.compare(a.getSlotId(), b.getSlotId()));
        }
        return map;
    }
}
