package autoexplore.graph;

/**
 * One hop of a path: activate {@code elementId} on {@code screenId} and expect
 * to arrive on {@code expectedScreenId}.
 */
public record NavigationStep(String screenId, String elementId, String expectedScreenId) {
}
