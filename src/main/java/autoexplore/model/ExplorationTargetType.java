package autoexplore.model;

public enum ExplorationTargetType {
    TAP_ELEMENT,
    SCROLL_CONTAINER,
    NAVIGATE_TO_SCREEN
}
