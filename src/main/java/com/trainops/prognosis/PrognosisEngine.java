package com.trainops.prognosis;

import com.trainops.prognosis.api.EventSummary;
import com.trainops.prognosis.api.TargetSummary;
import com.trainops.prognosis.config.PrognosisConfig;
import com.trainops.prognosis.error.ProblemLog;
import com.trainops.prognosis.event.EventGraph;
import com.trainops.prognosis.event.build.EventGraphTranslator;
import com.trainops.prognosis.ingest.LiveOccurrence;
import com.trainops.prognosis.ingest.OccurrenceIngester;
import com.trainops.prognosis.prognosis.DelayWriteBack;
import com.trainops.prognosis.prognosis.PrognosisCalculator;
import com.trainops.prognosis.target.TargetGraph;
import com.trainops.prognosis.target.TrainSchedule;
import gnu.trove.list.TIntList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point tying the graphs together. The engine owns one target graph and one event graph and is driven by
 * two inputs: timetable updates and live occurrences. After each batch of occurrences it recomputes the prognosis
 * and writes the resulting delays back onto the targets.
 *
 * The engine is not thread safe. Callers deliver schedule updates and occurrences one call at a time, and each call
 * leaves both graphs consistent. Every call returns the problems encountered; none of them stops processing.
 */
public class PrognosisEngine {

    private static final Logger LOG = LoggerFactory.getLogger(PrognosisEngine.class);

    private final TargetGraph targetGraph;

    private final EventGraph eventGraph = new EventGraph();

    private final Map<Integer, TrainSchedule> trains = new HashMap<>();

    private final EventGraphTranslator translator;

    private final OccurrenceIngester ingester;

    private final PrognosisCalculator calculator = new PrognosisCalculator();

    private final DelayWriteBack writeBack = new DelayWriteBack();

    public PrognosisEngine (PrognosisConfig config) {
        this.targetGraph = new TargetGraph(config);
        this.translator = new EventGraphTranslator(config);
        this.ingester = new OccurrenceIngester(eventGraph, config);
    }

    public PrognosisEngine () {
        this(PrognosisConfig.defaults());
    }

    /**
     * Import new or changed timetables and extend the event graph accordingly. Events that were already measured are
     * kept.
     */
    public ProblemLog updateSchedules (Collection<TrainSchedule> schedules) {
        ProblemLog problems = new ProblemLog();
        for (TrainSchedule schedule : schedules) trains.put(schedule.trainId, schedule);
        for (TrainSchedule schedule : schedules) targetGraph.importTrain(schedule, trains, problems);
        translator.translate(targetGraph, eventGraph, problems);
        LOG.info("Schedule update of {} trains, {} known, {} problems.", schedules.size(), trains.size(),
                problems.size());
        return problems;
    }

    /** Apply a batch of occurrences in order, then update the prognosis. */
    public ProblemLog ingest (List<LiveOccurrence> occurrences) {
        ProblemLog problems = new ProblemLog();
        for (LiveOccurrence occurrence : occurrences) ingester.ingest(occurrence, problems);
        problems.addAll(prognose());
        return problems;
    }

    /** Recompute predicted times and write delays back onto the target graph. */
    public ProblemLog prognose () {
        ProblemLog problems = new ProblemLog();
        calculator.prognose(eventGraph, problems);
        writeBack.writeBack(eventGraph, targetGraph, problems);
        return problems;
    }

    /** Forget all trains and events. */
    public void reset () {
        trains.clear();
        targetGraph.clear();
        eventGraph.clear();
        ingester.clear();
        LOG.info("Prognosis engine reset.");
    }

    /** The events of a train in order. Empty if the train is unknown. */
    public List<EventSummary> trainPath (int trainId) {
        List<EventSummary> result = new ArrayList<>();
        TIntList path = eventGraph.trainPath(trainId);
        for (int i = 0; i < path.size(); i++) result.add(EventSummary.of(eventGraph.getVertex(path.get(i))));
        return result;
    }

    /** The targets of a train in order, with their delays. */
    public List<TargetSummary> targetSummaries (int trainId) {
        List<TargetSummary> result = new ArrayList<>();
        TIntList path = targetGraph.trainPath(trainId);
        for (int i = 0; i < path.size(); i++) result.add(TargetSummary.of(targetGraph.getVertex(path.get(i))));
        return result;
    }

    public EventGraph eventGraph () {
        return eventGraph;
    }

    public TargetGraph targetGraph () {
        return targetGraph;
    }

}
