package autoexplore.graph;

import java.util.Set;

/**
 * Read-only view of the navigation graph, handed to components that route
 * or rank but must never record transitions.
 */
public interface GraphView {

    boolean isKnownScreen(String screenId);

    boolean isBlockerScreen(String screenId);

    boolean isFullyExplored(String screenId);

    boolean isProblematicScreen(String screenId);

    boolean hasIncomingTransitions(String screenId);

    /** Known screens not yet marked fully explored, in discovery order. */
    Set<String> getUnexploredScreens();

    /** All destinations for a trigger, or {@code null} if it was never observed. */
    ElementNavigation getElementNavigation(String fromScreen, String elementId);

    /** Most-visited non-blocker destination of a trigger, or {@code null}. */
    String getRealDestination(String fromScreen, String elementId);

    /** Fewest-hops path over recorded transitions. */
    NavigationPath findPath(String from, String to);

    /** Path through the most reliably reproduced transitions. */
    NavigationPath findOptimalPath(String from, String to);

    NavigationGraphStats getStats();
}
