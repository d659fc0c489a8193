package autoexplore.model;

/** Rule for choosing the next queued target. */
public enum ExplorationStrategy {
    /** Exhaust the current screen before leaving it. */
    SCREEN_FIRST,
    /** Highest priority anywhere. */
    PRIORITY_BASED,
    /** Prefer targets that have led to new screens before. */
    DEPTH_FIRST,
    /** Prefer the least visited screen. */
    BREADTH_FIRST,
    /** Reading order, top-left first. */
    SYSTEMATIC,
    /** Rotates through the others and settles on whichever discovers most. */
    ADAPTIVE
}
