package autoexplore.learning;

/**
 * Observed effect of one action, with the base reward it earns.
 */
public enum ActionOutcome {

    NEW_SCREEN(1.0),
    NEW_ELEMENTS(0.5),
    NAVIGATE_BACK(0.2),
    NO_CHANGE(-0.1),
    CLOSED_APP(-1.5),
    CRASH(-2.0);

    private final double baseReward;

    ActionOutcome(double baseReward) {
        this.baseReward = baseReward;
    }

    public double getBaseReward() {
        return baseReward;
    }

    /** True for outcomes that took the target application away. */
    public boolean isDestructive() {
        return this == CLOSED_APP || this == CRASH;
    }
}
