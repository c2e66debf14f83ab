package com.trainops.prognosis.config;

/**
 * Thrown when the planning parameters cannot be read. This is the only exception the engine throws on its own;
 * everything encountered while processing schedules and occurrences is collected as a Problem instead.
 */
public class PrognosisConfigException extends RuntimeException {

    public PrognosisConfigException (String message) {
        super(message);
    }

    public PrognosisConfigException (String message, Throwable cause) {
        super(message, cause);
    }

}
