package autoexplore.model;

public enum ExplorationGoal {
    QUICK_SCAN,
    DEEP_MAP,
    COMPLETE_COVERAGE
}
