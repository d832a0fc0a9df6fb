package timetabler.model;

public class StudentSeat {
    private final int studentId;
    private final int examId;
    private final int roomId;
    private final int slotId;
    private final int seatNo; // 1..capacity

    public StudentSeat(int studentId, int examId, int roomId, int slotId, int seatNo) {
        this.studentId = studentId;
        this.examId = examId;
        this.roomId = roomId;
        this.slotId = slotId;
        this.seatNo = seatNo;
    }

    public int getStudentId() { return studentId; }
    public int getExamId() { return examId; }
    public int getRoomId() { return roomId; }
    public int getSlotId() { return slotId; }
    public int getSeatNo() { return seatNo; }
}
