package timetabler.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Static input of one timetabling instance: the four counts, the capacity of
 * every room and the exam/student incidence pairs. Immutable once built; the
 * constructor rejects anything that breaks the input contract.
 */
public class ProblemDescription {
    private final int numberOfStudents;
    private final int numberOfExams;
    private final int numberOfSlots;
    private final int numberOfRooms;
    private final List<Integer> roomCapacities;
    private final List<Enrollment> enrollments;

    public ProblemDescription(int numberOfStudents,
                              int numberOfExams,
                              int numberOfSlots,
                              int numberOfRooms,
                              List<Integer> roomCapacities,
                              List<Enrollment> enrollments) {
        if (numberOfStudents < 0 || numberOfExams < 0 || numberOfSlots < 0 || numberOfRooms < 0) {
            throw new InputContractViolationException("Counts must be non-negative (students=" + numberOfStudents
                    + ", exams=" + numberOfExams + ", slots=" + numberOfSlots + ", rooms=" + numberOfRooms + ")");
        }
        if (roomCapacities == null || roomCapacities.size() != numberOfRooms) {
            throw new InputContractViolationException("room_capacities length must equal number_of_rooms ("
                    + (roomCapacities == null ? "null" : roomCapacities.size()) + " != " + numberOfRooms + ")");
        }
        for (int r = 0; r < roomCapacities.size(); r++) {
            Integer cap = roomCapacities.get(r);
            if (cap == null || cap < 0) {
                throw new InputContractViolationException("Room " + r + " capacity must be non-negative: " + cap);
            }
        }
        List<Enrollment> pairs = enrollments == null ? List.of() : enrollments;
        for (Enrollment e : pairs) {
            if (e == null) throw new InputContractViolationException("null exam/student pair");
            if (e.getExamId() < 0 || e.getExamId() >= numberOfExams) {
                throw new InputContractViolationException(
                        "exam id " + e.getExamId() + " out of range(0.." + (numberOfExams - 1) + ")");
            }
            if (e.getStudentId() < 0 || e.getStudentId() >= numberOfStudents) {
                throw new InputContractViolationException(
                        "student id " + e.getStudentId() + " out of range(0.." + (numberOfStudents - 1) + ")");
            }
        }

        this.numberOfStudents = numberOfStudents;
        this.numberOfExams = numberOfExams;
        this.numberOfSlots = numberOfSlots;
        this.numberOfRooms = numberOfRooms;
        this.roomCapacities = Collections.unmodifiableList(new ArrayList<>(roomCapacities));
        this.enrollments = Collections.unmodifiableList(new ArrayList<>(pairs));
    }

    public int getNumberOfStudents() { return numberOfStudents; }
    public int getNumberOfExams() { return numberOfExams; }
    public int getNumberOfSlots() { return numberOfSlots; }
    public int getNumberOfRooms() { return numberOfRooms; }
    public List<Integer> getRoomCapacities() { return roomCapacities; }
    public List<Enrollment> getEnrollments() { return enrollments; }

    public int getRoomCapacity(int roomId) {
        return roomCapacities.get(roomId);
    }

    public List<Classroom> getRooms() {
        List<Classroom> rooms = new ArrayList<>(numberOfRooms);
        for (int r = 0; r < numberOfRooms; r++) {
            rooms.add(new Classroom(r, roomCapacities.get(r)));
        }
        return rooms;
    }

    @Override
    public String toString() {
        return "ProblemDescription[S=" + numberOfStudents + ", E=" + numberOfExams + ", T=" + numberOfSlots
                + ", R=" + numberOfRooms + ", pairs=" + enrollments.size() + "]";
    }
}
