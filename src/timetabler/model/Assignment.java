package timetabler.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Room and slot of every exam, kept as two parallel arrays indexed by exam
 * id. Mutable; the search engine moves exams in place and keeps copies of
 * the best one seen.
 */
public class Assignment {
    private final int[] rooms;
    private final int[] slots;

    public Assignment(int numberOfExams) {
        this.rooms = new int[numberOfExams];
        this.slots = new int[numberOfExams];
        Arrays.fill(rooms, -1);
        Arrays.fill(slots, -1);
    }

    private Assignment(int[] rooms, int[] slots) {
        this.rooms = rooms;
        this.slots = slots;
    }

    public static Assignment of(List<Placement> placements) {
        Assignment a = new Assignment(placements.size());
        for (int e = 0; e < placements.size(); e++) {
            a.place(e, placements.get(e));
        }
        return a;
    }

    public int size() {
        return rooms.length;
    }

    public int getRoom(int examId) {
        return rooms[examId];
    }

    public int getSlot(int examId) {
        return slots[examId];
    }

    public Placement getPlacement(int examId) {
        return new Placement(rooms[examId], slots[examId]);
    }

    public void place(int examId, Placement placement) {
        rooms[examId] = placement.getRoomId();
        slots[examId] = placement.getSlotId();
    }

    public boolean isComplete() {
        for (int e = 0; e < rooms.length; e++) {
            if (rooms[e] < 0 || slots[e] < 0) return false;
        }
        return true;
    }

    public Assignment copy() {
        return new Assignment(rooms.clone(), slots.clone());
    }

    public List<Placement> toPlacements() {
        List<Placement> out = new ArrayList<>(rooms.length);
        for (int e = 0; e < rooms.length; e++) {
            out.add(getPlacement(e));
        }
        return out;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Assignment)) return false;
        Assignment other = (Assignment) o;
        return Arrays.equals(rooms, other.rooms) && Arrays.equals(slots, other.slots);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(rooms) + Arrays.hashCode(slots);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int e = 0; e < rooms.length; e++) {
            if (e > 0) sb.append("; ");
            sb.append(e).append("->(").append(rooms[e]).append(',').append(slots[e]).append(')');
        }
        return sb.toString();
    }
}
