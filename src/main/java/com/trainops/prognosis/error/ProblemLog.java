package com.trainops.prognosis.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Accumulates the problems of one public operation. The operation continues after each problem; the caller (or a
 * test) can inspect what was skipped afterward.
 */
public class ProblemLog {

    private final List<Problem> problems = new ArrayList<>();

    public void add (Problem problem) {
        problems.add(problem);
    }

    public void addAll (ProblemLog other) {
        problems.addAll(other.problems);
    }

    public List<Problem> getProblems () {
        return Collections.unmodifiableList(problems);
    }

    public List<Problem> ofType (ProblemType type) {
        return problems.stream().filter(p -> p.type == type).collect(Collectors.toList());
    }

    public int count (ProblemType type) {
        return (int) problems.stream().filter(p -> p.type == type).count();
    }

    public boolean contains (ProblemType type) {
        return count(type) > 0;
    }

    public boolean isEmpty () {
        return problems.isEmpty();
    }

    public int size () {
        return problems.size();
    }

    @Override
    public String toString () {
        return problems.toString();
    }

}
