package com.trainops.prognosis.target;

import com.trainops.prognosis.config.PrognosisConfig;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The operational markers in the flags column of a timetable line. Partner trains are referenced by their id in
 * parentheses, optionally preceded by a digit after the letter, e.g. "E(1234)", "K1(88)" or "F(5)".
 *
 * Unknown letters are ignored.
 */
public class ScheduleFlags {

    /** Partner train id that was not given. */
    public static final int NO_TRAIN = 0;

    private static final Pattern REPLACEMENT = Pattern.compile("E[0-9]?\\(([0-9]+)\\)");
    private static final Pattern COUPLING = Pattern.compile("K[0-9]?\\(([0-9]+)\\)");
    private static final Pattern SPLITTING = Pattern.compile("F[0-9]?\\(([0-9]+)\\)");
    private static final Pattern LOCO_CHANGE = Pattern.compile("W\\[([0-9]+)]\\[([0-9]+)]");

    public final String raw;

    public final int replacementTrain;
    public final int couplingTrain;
    public final int splittingTrain;

    public final boolean passThrough;
    public final boolean runAround;
    public final boolean reversal;
    public final boolean locoChange;
    public final boolean earlyDeparture;

    public ScheduleFlags (String flags) {
        raw = flags == null ? "" : flags;
        replacementTrain = partner(REPLACEMENT, raw);
        couplingTrain = partner(COUPLING, raw);
        splittingTrain = partner(SPLITTING, raw);
        // Strip the partner references so that their digits and letters are not mistaken for flags.
        String letters = REPLACEMENT.matcher(raw).replaceAll("");
        letters = COUPLING.matcher(letters).replaceAll("");
        letters = SPLITTING.matcher(letters).replaceAll("");
        locoChange = LOCO_CHANGE.matcher(letters).find();
        letters = LOCO_CHANGE.matcher(letters).replaceAll("");
        passThrough = letters.indexOf('D') >= 0;
        runAround = letters.indexOf('L') >= 0;
        reversal = letters.indexOf('R') >= 0;
        earlyDeparture = letters.indexOf('A') >= 0;
    }

    private static int partner (Pattern pattern, String flags) {
        Matcher m = pattern.matcher(flags);
        if (!m.find()) return NO_TRAIN;
        try {
            return Integer.parseInt(m.group(1));
        } catch (NumberFormatException e) {
            // Only reachable with more digits than fit in an int.
            return NO_TRAIN;
        }
    }

    public boolean hasReplacement () {
        return replacementTrain != NO_TRAIN;
    }

    public boolean hasCoupling () {
        return couplingTrain != NO_TRAIN;
    }

    public boolean hasSplitting () {
        return splittingTrain != NO_TRAIN;
    }

    /**
     * Estimate the minimum dwell in seconds, which the simulator does not provide. The base part depends on why the
     * train stops, the additional part on what is done with the locomotive.
     */
    public int minimumDwell (PrognosisConfig config) {
        if (passThrough) return 0;
        int dwell = config.minDwellPlannedStop;
        if (hasReplacement()) {
            dwell = config.minDwellReplacement;
        } else if (hasSplitting()) {
            dwell = config.minDwellSplitting;
        } else if (hasCoupling()) {
            dwell = config.minDwellCoupling;
        }
        if (runAround) {
            dwell += config.minDwellRunAround;
        } else if (reversal) {
            dwell += config.minDwellReversal;
        } else if (locoChange) {
            dwell += config.minDwellLocoChange;
        }
        return dwell;
    }

    @Override
    public String toString () {
        return raw;
    }

}
