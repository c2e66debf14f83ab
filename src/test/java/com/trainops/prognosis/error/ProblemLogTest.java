package com.trainops.prognosis.error;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProblemLogTest {

    @Test
    public void problemsAreCollectedByType () {
        ProblemLog log = new ProblemLog();
        assertTrue(log.isEmpty());
        log.add(Problem.forTrain(ProblemType.NOT_FOUND, 12).setSubject("arrival at 3").addInfo("searched", "arrival"));
        ProblemLog other = new ProblemLog();
        other.add(Problem.forGraph(ProblemType.CYCLE_DETECTED));
        other.add(Problem.forTrain(ProblemType.NOT_FOUND, 13));
        log.addAll(other);

        assertEquals(3, log.size());
        assertEquals(2, log.count(ProblemType.NOT_FOUND));
        assertTrue(log.contains(ProblemType.CYCLE_DETECTED));
        assertFalse(log.contains(ProblemType.INCOMPLETE_DATA));
        Problem first = log.ofType(ProblemType.NOT_FOUND).get(0);
        assertEquals("arrival", first.info.get("searched"));
        assertEquals("NOT_FOUND train 12 arrival at 3 {searched=arrival}", first.toString());
        assertEquals(Priority.HIGH, ProblemType.CYCLE_DETECTED.priority);
    }

}
