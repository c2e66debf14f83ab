package com.trainops.prognosis;

import com.fasterxml.jackson.databind.JsonNode;
import com.trainops.prognosis.api.EventSummary;
import com.trainops.prognosis.api.TargetSummary;
import com.trainops.prognosis.config.JsonUtilities;
import com.trainops.prognosis.config.PrognosisConfig;
import com.trainops.prognosis.error.ProblemLog;
import com.trainops.prognosis.error.ProblemType;
import com.trainops.prognosis.ingest.LiveOccurrence;
import com.trainops.prognosis.ingest.OccurrenceKind;
import com.trainops.prognosis.target.TrainSchedule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static com.trainops.prognosis.ScheduleFixtures.at;
import static com.trainops.prognosis.ScheduleFixtures.fromOutside;
import static com.trainops.prognosis.ScheduleFixtures.stop;
import static com.trainops.prognosis.ScheduleFixtures.train;
import static com.trainops.prognosis.util.TimeUtils.hm;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class PrognosisEngineTest {

    private PrognosisEngine engine;

    @BeforeEach
    public void setUp () {
        engine = new PrognosisEngine(PrognosisConfig.fromJson("{minDwellPlannedStop: 60}"));
    }

    private static TrainSchedule throughTrain () {
        return fromOutside(train(1, stop("1", at(9, 10), at(9, 11))), "E1", "A1");
    }

    @Test
    public void lateArrivalDelaysTheRestOfTheRun () throws Exception {
        ProblemLog problems = engine.updateSchedules(Collections.singletonList(throughTrain()));
        assertTrue(problems.isEmpty());
        assertEquals(4, engine.trainPath(1).size());

        problems = engine.ingest(Arrays.asList(
                new LiveOccurrence(1, OccurrenceKind.ENTRY, at(9, 9), "E1", "E1", false),
                new LiveOccurrence(1, OccurrenceKind.ARRIVAL, at(9, 13), "1", "1", true)));
        assertTrue(problems.isEmpty());

        List<EventSummary> path = engine.trainPath(1);
        assertEquals(hm(9, 13), (int) path.get(1).measuredTime);
        assertEquals(hm(9, 14), (int) path.get(2).predictedTime);
        assertEquals(hm(9, 15), (int) path.get(3).effectiveTime);

        List<TargetSummary> stops = engine.targetSummaries(1);
        assertEquals(3, stops.size());
        assertEquals(0, (int) stops.get(0).departureDelay);
        assertEquals(180, (int) stops.get(1).arrivalDelay);
        assertEquals(180, (int) stops.get(1).departureDelay);
        assertEquals(180, (int) stops.get(2).arrivalDelay);

        JsonNode json = JsonUtilities.objectMapper.readTree(JsonUtilities.objectToJsonString(path));
        assertEquals(4, json.size());
        assertEquals("Ab", json.get(2).get("kind").asText());
        assertEquals("09:14", json.get(2).get("effective").asText());
        assertFalse(json.get(2).has("measuredTime"));
    }

    @Test
    public void scheduleUpdateKeepsMeasurements () {
        TrainSchedule schedule = throughTrain();
        engine.updateSchedules(Collections.singletonList(schedule));
        engine.ingest(Collections.singletonList(
                new LiveOccurrence(1, OccurrenceKind.ENTRY, at(9, 9), "E1", "E1", false)));

        schedule.entered = true;
        schedule.addStop(stop("2", at(9, 20), at(9, 21)));
        engine.updateSchedules(Collections.singletonList(schedule));
        engine.prognose();

        List<EventSummary> path = engine.trainPath(1);
        assertEquals(6, path.size());
        assertEquals(hm(9, 9), (int) path.get(0).measuredTime);
        assertEquals("An", path.get(5).kind);
        assertEquals(hm(9, 22), (int) path.get(5).plannedTime);
    }

    @Test
    public void timetableWithoutPassedStopsKeepsTheRun () {
        TrainSchedule schedule = fromOutside(train(1,
                stop("1", at(9, 10), at(9, 11)),
                stop("2", at(9, 20), at(9, 21))), "E1", "A1");
        engine.updateSchedules(Collections.singletonList(schedule));
        engine.ingest(Arrays.asList(
                new LiveOccurrence(1, OccurrenceKind.ENTRY, at(9, 9), "E1", "E1", false),
                new LiveOccurrence(1, OccurrenceKind.ARRIVAL, at(9, 10), "1", "1", true),
                new LiveOccurrence(1, OccurrenceKind.DEPARTURE, at(9, 11), "1", "1", true)));

        TrainSchedule rest = fromOutside(train(1, stop("2", at(9, 20), at(9, 21))), "E1", "A1");
        rest.entered = true;
        ProblemLog problems = engine.updateSchedules(Collections.singletonList(rest));
        problems.addAll(engine.prognose());
        assertTrue(problems.isEmpty());

        List<EventSummary> path = engine.trainPath(1);
        assertEquals(6, path.size());
        assertEquals(hm(9, 9), (int) path.get(0).measuredTime);
        assertEquals(hm(9, 10), (int) path.get(1).measuredTime);
        assertEquals(hm(9, 11), (int) path.get(2).measuredTime);
        assertEquals(hm(9, 20), (int) path.get(3).effectiveTime);

        List<TargetSummary> targets = engine.targetSummaries(1);
        assertEquals(4, targets.size());
        assertEquals(0, (int) targets.get(0).departureDelay);
        assertEquals(0, (int) targets.get(1).departureDelay);
    }

    @Test
    public void reportedPositionFixesPassedEvents () {
        TrainSchedule schedule = fromOutside(train(1,
                stop("1", at(9, 10), at(9, 11)),
                stop("2", at(9, 20), at(9, 21)),
                stop("3", at(9, 30), at(9, 31))), null, "A1");
        schedule.entered = true;
        schedule.currentStop = 1;
        schedule.atPlatform = true;
        schedule.delay = 120;
        engine.updateSchedules(Collections.singletonList(schedule));
        engine.prognose();

        List<EventSummary> path = engine.trainPath(1);
        assertEquals(7, path.size());
        assertEquals(hm(9, 10), (int) path.get(0).measuredTime);
        assertEquals(hm(9, 11), (int) path.get(1).measuredTime);
        assertEquals(hm(9, 20), (int) path.get(2).measuredTime);
        assertNull(path.get(3).measuredTime);
        assertEquals(hm(9, 21), (int) path.get(3).predictedTime);
    }

    @Test
    public void reportedDelayMovesTheStartOfATrainInside () {
        TrainSchedule schedule = train(1, stop("1", at(9, 10), at(9, 11)), stop("2", at(9, 20), at(9, 21)));
        schedule.entered = true;
        schedule.currentStop = 0;
        schedule.delay = 180;
        engine.updateSchedules(Collections.singletonList(schedule));
        engine.prognose();

        List<EventSummary> path = engine.trainPath(1);
        assertNull(path.get(0).measuredTime);
        assertEquals(hm(9, 13), (int) path.get(0).predictedTime);
        assertEquals(hm(9, 14), (int) path.get(1).predictedTime);
        assertEquals(hm(9, 23), (int) path.get(2).predictedTime);
        assertEquals(180, (int) engine.targetSummaries(1).get(1).arrivalDelay);
    }

    @Test
    public void unknownTrainsAreReportedNotThrown () {
        ProblemLog problems = engine.ingest(Collections.singletonList(
                new LiveOccurrence(42, OccurrenceKind.ARRIVAL, at(9, 0), "1", "1", true)));
        assertEquals(1, problems.count(ProblemType.NOT_FOUND));
        assertTrue(engine.trainPath(42).isEmpty());
    }

    @Test
    public void resetForgetsEverything () {
        engine.updateSchedules(Collections.singletonList(throughTrain()));
        engine.reset();
        assertTrue(engine.trainPath(1).isEmpty());
        assertEquals(0, engine.targetGraph().vertexCount());
        assertNull(engine.eventGraph().getVertex(0));
    }

}
