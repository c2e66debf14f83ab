package com.trainops.prognosis.error;

/**
 * The kinds of problem the engine can run into. None of them is fatal: the affected train, event or link is skipped
 * and processing continues. The next schedule update or prognosis run implicitly retries.
 */
public enum ProblemType {

    NOT_FOUND(Priority.MEDIUM, "A train, event or partner train referenced by the input could not be found."),
    INCOMPLETE_DATA(Priority.LOW, "A planned time or location needed for this step is missing."),
    CYCLE_DETECTED(Priority.HIGH, "The event graph contained a cycle, an edge was removed to break it."),
    PROGNOSIS_UNAVAILABLE(Priority.LOW, "No finite time bound could be derived for this event.");

    public final Priority priority;
    public final String englishMessage;

    ProblemType (Priority priority, String englishMessage) {
        this.priority = priority;
        this.englishMessage = englishMessage;
    }

}
