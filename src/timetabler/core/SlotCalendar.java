package timetabler.core;

import timetabler.model.Timeslot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Groups slot indices into fixed-size days. With {@code slotsPerDay <= 0} the
 * whole horizon is a single day and no slot counts as the last of its day.
 */
public class SlotCalendar {

    private final int numberOfSlots;
    private final int slotsPerDay;

    public SlotCalendar(int numberOfSlots, int slotsPerDay) {
        if (numberOfSlots < 0) throw new IllegalArgumentException("negative slot count");
        this.numberOfSlots = numberOfSlots;
        this.slotsPerDay = slotsPerDay;
    }

    public int getNumberOfSlots() {
        return numberOfSlots;
    }

    public int getSlotsPerDay() {
        return slotsPerDay;
    }

    public int dayOf(int slot) {
        return slotsPerDay > 0 ? slot / slotsPerDay : 0;
    }

    public int positionOf(int slot) {
        return slotsPerDay > 0 ? slot % slotsPerDay : slot;
    }

    public boolean isLastSlotOfDay(int slot) {
        return slotsPerDay > 0 && slot % slotsPerDay == slotsPerDay - 1;
    }

    public int numberOfDays() {
        if (numberOfSlots == 0) return 0;
        return dayOf(numberOfSlots - 1) + 1;
    }

    public int[] dayIndex() {
        int[] days = new int[numberOfSlots];
        for (int t = 0; t < numberOfSlots; t++) days[t] = dayOf(t);
        return days;
    }

    public boolean[] lastSlotFlags() {
        boolean[] last = new boolean[numberOfSlots];
        for (int t = 0; t < numberOfSlots; t++) last[t] = isLastSlotOfDay(t);
        return last;
    }

    public Timeslot timeslot(int slot) {
        return new Timeslot(slot, dayOf(slot), positionOf(slot), isLastSlotOfDay(slot));
    }

    public List<Timeslot> build() {
        List<Timeslot> result = new ArrayList<>(numberOfSlots);
        for (int t = 0; t < numberOfSlots; t++) {
            result.add(timeslot(t));
        }
        return Collections.unmodifiableList(result);
    }
}
