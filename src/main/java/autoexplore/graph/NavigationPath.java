package autoexplore.graph;

import java.util.List;

/**
 * Result of a path query. "No path" is an ordinary value ({@link #NONE}),
 * never an exception. A found path from a screen to itself has no steps.
 *
 * @param steps hops in execution order
 * @param found whether the destination is reachable
 * @param cost  accumulated edge cost (hop count for unweighted search)
 */
public record NavigationPath(List<NavigationStep> steps, boolean found, double cost) {

    public static final NavigationPath NONE = new NavigationPath(List.of(), false, Double.POSITIVE_INFINITY);

    public NavigationPath {
        steps = List.copyOf(steps);
    }

    static NavigationPath of(List<NavigationStep> steps, double cost) {
        return new NavigationPath(steps, true, cost);
    }

    public int length() {
        return steps.size();
    }

    /** Screen the path ends on, or {@code null} when empty or not found. */
    public String destination() {
        return steps.isEmpty() ? null : steps.get(steps.size() - 1).expectedScreenId();
    }
}
