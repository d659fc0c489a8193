package autoexplore.model;

/**
 * A screen that still has unvisited elements or unscrolled containers.
 *
 * @param screenId       the screen
 * @param unvisitedCount unvisited clickables plus unscrolled containers
 */
public record FrontierItem(String screenId, int unvisitedCount) implements Comparable<FrontierItem> {

    /** Most unvisited work first. */
    @Override
    public int compareTo(FrontierItem other) {
        return Integer.compare(other.unvisitedCount, unvisitedCount);
    }
}
