package autoexplore.model;

/** Outcome status of a run, as reported to the status sink and in the result. */
public enum ExplorationStatus {
    NOT_STARTED,
    IN_PROGRESS,
    PAUSED,
    COMPLETED,
    /** Stopped on request; partial results are valid. */
    STOPPED,
    CANCELLED,
    ERROR
}
