package com.trainops.prognosis.error;

import java.util.HashMap;
import java.util.Map;

/**
 * One problem encountered while importing schedules, building the event graph, ingesting live occurrences or
 * computing the prognosis. Problems are collected in a {@link ProblemLog} rather than thrown.
 */
public class Problem {

    /** The kind of problem encountered. */
    public final ProblemType type;

    /** The train concerned, or 0 if the problem is not specific to one train. */
    public final int trainId;

    /** Key-value pairs providing additional information about this problem. */
    public Map<String, String> info = new HashMap<>();

    /** Human readable description of the offending object (event, edge, stop, occurrence). */
    public String subject = null;

    private Problem (ProblemType type, int trainId) {
        this.type = type;
        this.trainId = trainId;
    }

    public static Problem forTrain (ProblemType type, int trainId) {
        return new Problem(type, trainId);
    }

    public static Problem forGraph (ProblemType type) {
        return new Problem(type, 0);
    }

    /**
     * Add a single key-value pair of supplemental info to this problem.
     * @return the modified object, so info can be added to a newly created problem without assigning it.
     */
    public Problem addInfo (String key, Object value) {
        info.put(key, String.valueOf(value));
        return this;
    }

    public Problem setSubject (String subject) {
        this.subject = subject;
        return this;
    }

    @Override
    public String toString () {
        StringBuilder sb = new StringBuilder(type.name());
        if (trainId != 0) sb.append(" train ").append(trainId);
        if (subject != null) sb.append(' ').append(subject);
        if (!info.isEmpty()) sb.append(' ').append(info);
        return sb.toString();
    }

}
