package timetabler.model;

/**
 * A (room, slot) pair. Used both as a candidate for an exam and as the
 * current position of an exam inside an {@link Assignment}.
 */
public class Placement {
    private final int roomId;
    private final int slotId;

    public Placement(int roomId, int slotId) {
        this.roomId = roomId;
        this.slotId = slotId;
    }

    public int getRoomId() {
        return roomId;
    }

    public int getSlotId() {
        return slotId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Placement)) return false;
        Placement other = (Placement) o;
        return roomId == other.roomId && slotId == other.slotId;
    }

    @Override
    public int hashCode() {
        return 31 * roomId + slotId;
    }

    @Override
    public String toString() {
        return "room " + roomId + ", slot " + slotId;
    }
}
