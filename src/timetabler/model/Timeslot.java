package timetabler.model;

/**
 * A discrete slot index together with the day it belongs to and its
 * position inside that day.
 */
public class Timeslot {
    private final int index;
    private final int day;
    private final int position;
    private final boolean lastOfDay;

    public Timeslot(int index, int day, int position, boolean lastOfDay) {
        if (index < 0 || day < 0 || position < 0)
            throw new IllegalArgumentException("negative slot coordinates");
        this.index = index;
        this.day = day;
        this.position = position;
        this.lastOfDay = lastOfDay;
    }

    public int getIndex() { return index; }
    public int getDay() { return day; }
    public int getPosition() { return position; }
    public boolean isLastOfDay() { return lastOfDay; }

    @Override
    public String toString() {
        return "Slot " + index + " - Day " + day + ", position " + position;
    }
}
