package autoexplore.model;

/**
 * Per-screen visitation counters kept by the coverage tracker.
 */
public class ScreenElementStats {

    private final String screenId;
    private int totalClickable;
    private int visitedClickable;
    private int totalScrollable;
    private int scrolledScrollable;

    public ScreenElementStats(String screenId, int totalClickable, int totalScrollable) {
        this.screenId        = screenId;
        this.totalClickable  = totalClickable;
        this.totalScrollable = totalScrollable;
    }

    public String getScreenId()           { return screenId; }
    public int    getTotalClickable()     { return totalClickable; }
    public int    getVisitedClickable()   { return visitedClickable; }
    public int    getTotalScrollable()    { return totalScrollable; }
    public int    getScrolledScrollable() { return scrolledScrollable; }

    public void setTotals(int clickable, int scrollable) {
        this.totalClickable  = clickable;
        this.totalScrollable = scrollable;
    }

    public void setVisitedClickable(int visited)    { this.visitedClickable = Math.min(visited, totalClickable); }
    public void setScrolledScrollable(int scrolled) { this.scrolledScrollable = Math.min(scrolled, totalScrollable); }

    public boolean isFullyExplored() {
        return visitedClickable >= totalClickable && scrolledScrollable >= totalScrollable;
    }

    public double getCoverage() {
        return totalClickable > 0 ? (double) visitedClickable / totalClickable : 1.0;
    }

    @Override
    public String toString() {
        return String.format("ScreenElementStats{%s clickable=%d/%d scrollable=%d/%d}",
                screenId, visitedClickable, totalClickable, scrolledScrollable, totalScrollable);
    }
}
