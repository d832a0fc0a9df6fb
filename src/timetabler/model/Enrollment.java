package timetabler.model;

/**
 * One (exam, student) incidence pair of an instance.
 */
public class Enrollment {
    private final int examId;
    private final int studentId;

    public Enrollment(int examId, int studentId) {
        this.examId = examId;
        this.studentId = studentId;
    }

    public int getExamId() {
        return examId;
    }

    public int getStudentId() {
        return studentId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Enrollment)) return false;
        Enrollment other = (Enrollment) o;
        return examId == other.examId && studentId == other.studentId;
    }

    @Override
    public int hashCode() {
        return 31 * examId + studentId;
    }

    @Override
    public String toString() {
        return examId + " " + studentId;
    }
}
