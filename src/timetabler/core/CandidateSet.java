package timetabler.core;

import timetabler.model.Placement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per exam, the ordered (room, slot) pairs that pass the capacity and
 * large-exam slot rules. An exam with an empty list makes the instance
 * structurally infeasible.
 */
public class CandidateSet {

    private final List<List<Placement>> byExam;

    CandidateSet(List<List<Placement>> byExam) {
        List<List<Placement>> copy = new ArrayList<>(byExam.size());
        for (List<Placement> l : byExam) copy.add(Collections.unmodifiableList(new ArrayList<>(l)));
        this.byExam = Collections.unmodifiableList(copy);
    }

    public int numberOfExams() {
        return byExam.size();
    }

    public List<Placement> get(int examId) {
        return byExam.get(examId);
    }

    public int size(int examId) {
        return byExam.get(examId).size();
    }

    public int totalSize() {
        int n = 0;
        for (List<Placement> l : byExam) n += l.size();
        return n;
    }

    public List<Integer> examsWithoutCandidates() {
        List<Integer> out = new ArrayList<>();
        for (int e = 0; e < byExam.size(); e++) {
            if (byExam.get(e).isEmpty()) out.add(e);
        }
        return out;
    }

    public boolean isStructurallyFeasible() {
        for (List<Placement> l : byExam) {
            if (l.isEmpty()) return false;
        }
        return true;
    }
}
