package autoexplore.model;

/** How aggressively a screen is turned into targets. */
public enum ExplorationMode {
    /** Navigation-like elements only, no scrolling. */
    QUICK,
    NORMAL,
    /** Minimal exclusions, every container scrolled. */
    DEEP,
    /** Targets are supplied by a person. */
    MANUAL
}
