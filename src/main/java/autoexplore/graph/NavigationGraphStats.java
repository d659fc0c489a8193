package autoexplore.graph;

public record NavigationGraphStats(int totalScreens,
                                   int fullyExploredScreens,
                                   int totalTransitions,
                                   int conditionalElements,
                                   int blockerScreens) {
}
