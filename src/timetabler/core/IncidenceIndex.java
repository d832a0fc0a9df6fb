package timetabler.core;

import timetabler.model.Enrollment;
import timetabler.model.ProblemDescription;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only exam/student incidence built once per solve: who sits each exam,
 * which exams each student takes, and the size of every exam. Duplicate pairs
 * in the input count once.
 */
public class IncidenceIndex {

    private final List<Set<Integer>> studentsByExam;
    private final List<Set<Integer>> examsByStudent;
    private final int[] examSize;
    // sorted exam ids per student, for the pairwise loops of the cost function
    private final int[][] examArrays;

    private IncidenceIndex(List<Set<Integer>> studentsByExam, List<Set<Integer>> examsByStudent) {
        this.studentsByExam = studentsByExam;
        this.examsByStudent = examsByStudent;
        this.examSize = new int[studentsByExam.size()];
        for (int e = 0; e < examSize.length; e++) {
            examSize[e] = studentsByExam.get(e).size();
        }
        this.examArrays = new int[examsByStudent.size()][];
        for (int s = 0; s < examArrays.length; s++) {
            examArrays[s] = examsByStudent.get(s).stream().mapToInt(Integer::intValue).toArray();
        }
    }

    public static IncidenceIndex build(ProblemDescription problem) {
        List<Set<Integer>> byExam = new ArrayList<>(problem.getNumberOfExams());
        for (int e = 0; e < problem.getNumberOfExams(); e++) byExam.add(new TreeSet<>());
        List<Set<Integer>> byStudent = new ArrayList<>(problem.getNumberOfStudents());
        for (int s = 0; s < problem.getNumberOfStudents(); s++) byStudent.add(new TreeSet<>());

        for (Enrollment en : problem.getEnrollments()) {
            byExam.get(en.getExamId()).add(en.getStudentId());
            byStudent.get(en.getStudentId()).add(en.getExamId());
        }

        List<Set<Integer>> roExam = new ArrayList<>(byExam.size());
        for (Set<Integer> s : byExam) roExam.add(Collections.unmodifiableSet(s));
        List<Set<Integer>> roStudent = new ArrayList<>(byStudent.size());
        for (Set<Integer> s : byStudent) roStudent.add(Collections.unmodifiableSet(s));

        return new IncidenceIndex(Collections.unmodifiableList(roExam), Collections.unmodifiableList(roStudent));
    }

    public int numberOfExams() {
        return examSize.length;
    }

    public int numberOfStudents() {
        return examArrays.length;
    }

    public Set<Integer> studentsOf(int examId) {
        return studentsByExam.get(examId);
    }

    public Set<Integer> examsOf(int studentId) {
        return examsByStudent.get(studentId);
    }

    public int examSize(int examId) {
        return examSize[examId];
    }

    public int[] examSizes() {
        return examSize.clone();
    }

    /** Sorted exam ids of the student; callers must not modify the array. */
    int[] examArray(int studentId) {
        return examArrays[studentId];
    }

    int[][] examArrays() {
        return examArrays;
    }
}
