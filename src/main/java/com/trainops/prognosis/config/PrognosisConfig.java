package com.trainops.prognosis.config;

import com.google.common.io.Resources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;

/**
 * Planning parameters used while building the graphs and interpreting live occurrences. All durations are in
 * seconds. The values shipped in prognosis-defaults.json match the field initializers below; a file only needs to
 * name the values it changes.
 *
 * The minimum dwell of a stop is composed of two parts. The base part is the first of (planned stop, replacement,
 * splitting, coupling) that applies. The additional part is the first of (run-around, reversal, loco change) that
 * applies. Pass-through stops never get a dwell.
 */
public class PrognosisConfig {

    private static final Logger LOG = LoggerFactory.getLogger(PrognosisConfig.class);

    public static final String DEFAULTS_RESOURCE = "prognosis-defaults.json";

    /** Minimum dwell at an ordinary planned stop. */
    public int minDwellPlannedStop = 0;

    /** Minimum dwell when the stop ends in a replacement (train number change). */
    public int minDwellReplacement = 60;

    public int minDwellSplitting = 60;

    public int minDwellCoupling = 60;

    /** Added on top of the base dwell when the locomotive runs around the train. */
    public int minDwellRunAround = 120;

    /** Added on top of the base dwell on a change of direction. */
    public int minDwellReversal = 180;

    /** Added on top of the base dwell on a locomotive change. */
    public int minDwellLocoChange = 300;

    /** Travel time assumed between two events when either of them lacks a planned time. */
    public int defaultTravelSecs = 60;

    /** How long before the first stop an off-network train is expected at its entry point. */
    public int entryLeadSecs = 60;

    /** How long after the last stop an off-network train is expected at its exit point. */
    public int exitLagSecs = 60;

    /** Drop a live occurrence that repeats the previous occurrence of the same train. */
    public boolean ignoreRepeatedOccurrences = true;

    public static PrognosisConfig defaults () {
        URL url = Resources.getResource(PrognosisConfig.class, "/" + DEFAULTS_RESOURCE);
        try (InputStream in = url.openStream()) {
            return fromJson(in);
        } catch (IOException e) {
            throw new PrognosisConfigException("Could not read " + DEFAULTS_RESOURCE, e);
        }
    }

    public static PrognosisConfig fromJson (InputStream in) {
        try {
            PrognosisConfig config = JsonUtilities.lenientObjectMapper.readValue(in, PrognosisConfig.class);
            config.validate();
            return config;
        } catch (IOException e) {
            throw new PrognosisConfigException("Planning parameters are not valid JSON", e);
        }
    }

    public static PrognosisConfig fromJson (String json) {
        try {
            PrognosisConfig config = JsonUtilities.lenientObjectMapper.readValue(json, PrognosisConfig.class);
            config.validate();
            return config;
        } catch (IOException e) {
            throw new PrognosisConfigException("Planning parameters are not valid JSON", e);
        }
    }

    /** Negative durations make no sense anywhere in this class. */
    public void validate () {
        int[] durations = {
            minDwellPlannedStop, minDwellReplacement, minDwellSplitting, minDwellCoupling, minDwellRunAround,
            minDwellReversal, minDwellLocoChange, defaultTravelSecs, entryLeadSecs, exitLagSecs
        };
        for (int d : durations) {
            if (d < 0) {
                throw new PrognosisConfigException("Planning parameters must not contain negative durations: " + d);
            }
        }
        LOG.debug("Planning parameters: dwell stop={}s E={}s F={}s K={}s L={}s R={}s W={}s, travel default {}s",
                minDwellPlannedStop, minDwellReplacement, minDwellSplitting, minDwellCoupling,
                minDwellRunAround, minDwellReversal, minDwellLocoChange, defaultTravelSecs);
    }

}
