package autoexplore.model;

/** Category of a problem recorded during a run. */
public enum IssueType {
    /** Element could not be exercised after its retry cap. */
    ELEMENT_STUCK,
    BACK_FAILED,
    APP_MINIMIZED,
    /** Left the target and could not return. */
    APP_LEFT,
    TIMEOUT,
    SCROLL_FAILED,
    /** Action closed or crashed the target. */
    DANGEROUS_ELEMENT,
    RECOVERY_FAILED,
    /** Credential or setup screen blocking further exploration. */
    BLOCKER_SCREEN,
    /** Screen could not be reached after the re-routing budget. */
    BRANCH_UNREACHABLE
}
