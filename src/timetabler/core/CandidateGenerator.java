package timetabler.core;

import timetabler.config.SchedulingConfig;
import timetabler.model.Classroom;
import timetabler.model.Placement;
import timetabler.model.ProblemDescription;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Precomputes the structurally eligible (room, slot) pairs of every exam:
 * the room must hold all of its students, and a large exam never goes into
 * the last slot of a day. Rooms and slots are enumerated in ascending id
 * order, so the result is deterministic.
 */
public class CandidateGenerator {

    private final SchedulingConfig config;

    public CandidateGenerator(SchedulingConfig config) {
        this.config = config;
    }

    public CandidateSet generate(ProblemDescription problem, IncidenceIndex index, SlotCalendar calendar) {
        List<List<Placement>> byExam = new ArrayList<>(problem.getNumberOfExams());
        List<Classroom> rooms = problem.getRooms();

        for (int e = 0; e < problem.getNumberOfExams(); e++) {
            int size = index.examSize(e);
            boolean large = config.isLargeExam(size);

            List<Classroom> fitting = rooms.stream()
                    .filter(r -> size <= r.getCapacity())
                    .collect(Collectors.toList());

            List<Placement> candidates = new ArrayList<>();
            for (Classroom r : fitting) {
                for (int t = 0; t < calendar.getNumberOfSlots(); t++) {
                    if (large && calendar.isLastSlotOfDay(t)) continue;
                    candidates.add(new Placement(r.getId(), t));
                }
            }
            byExam.add(candidates);
        }
        return new CandidateSet(byExam);
    }
}
