package timetabler.constraints;

import timetabler.model.Assignment;
import timetabler.model.Violation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Consecutive uses of a room (after sorting its slots) need more than
 * {@code turnaroundGap} slots between them. Two exams in the same room and
 * slot also count, since their gap is zero.
 */
public class RoomTurnaround implements Constraint {

    private final int numberOfRooms;
    private final int turnaroundGap;
    private final int weight;

    public RoomTurnaround(int numberOfRooms, int turnaroundGap, int weight) {
        this.numberOfRooms = numberOfRooms;
        this.turnaroundGap = turnaroundGap;
        this.weight = weight;
    }

    @Override
    public String getName() {
        return "room-turnaround";
    }

    @Override
    public Violation evaluate(Assignment a) {
        List<List<Integer>> slotsByRoom = new ArrayList<>(numberOfRooms);
        for (int r = 0; r < numberOfRooms; r++) slotsByRoom.add(new ArrayList<>());
        for (int e = 0; e < a.size(); e++) {
            slotsByRoom.get(a.getRoom(e)).add(a.getSlot(e));
        }

        int count = 0;
        for (List<Integer> times : slotsByRoom) {
            if (times.size() < 2) continue;
            Collections.sort(times);
            for (int i = 1; i < times.size(); i++) {
                if (times.get(i) - times.get(i - 1) <= turnaroundGap) count++;
            }
        }
        return new Violation(getName(), count, weight * count);
    }

    @Override
    public String getViolationMessage() {
        return "Room reused without enough turnaround time";
    }
}
