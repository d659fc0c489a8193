package autoexplore.explorer;

import autoexplore.model.ClickableElement;
import autoexplore.model.CoverageMetrics;
import autoexplore.model.ExplorationGoal;
import autoexplore.model.FrontierItem;
import autoexplore.model.Screen;
import autoexplore.model.ScreenElementStats;
import autoexplore.model.ScreenIdentity;
import autoexplore.model.ScrollableContainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives coverage from the run state on demand.
 *
 * <p>Overall coverage weighs elements 50%, screens 30% and scroll containers
 * 20%. Only visited keys that still match an element of a known screen
 * count, so re-captured screens cannot inflate the ratio. A screen with no
 * containers contributes nothing to scroll coverage.
 */
public class CoverageTracker {

    private static final Logger log = LoggerFactory.getLogger(CoverageTracker.class);

    static final double ELEMENT_WEIGHT = 0.5;
    static final double SCREEN_WEIGHT  = 0.3;
    static final double SCROLL_WEIGHT  = 0.2;
    static final int    FRONTIER_LIMIT = 5;

    private CoverageMetrics metrics = CoverageMetrics.EMPTY;
    private final Map<String, ScreenElementStats> screenStats = new LinkedHashMap<>();
    private List<FrontierItem> frontier = List.of();
    private int lastLoggedDecile = -1;

    /**
     * Recomputes every metric.
     *
     * @param screens          every screen discovered so far
     * @param visited          composite keys of activated elements
     * @param exhaustedScreens screens the engine has nothing left to do on
     */
    public CoverageMetrics update(Collection<Screen> screens, Set<String> visited, Set<String> exhaustedScreens) {
        int totalElements = 0, visitedElements = 0, totalScrollable = 0, scrolled = 0, fullyExplored = 0;
        List<FrontierItem> items = new ArrayList<>();

        for (Screen screen : screens) {
            String screenId = screen.getScreenId();
            int unvisited = 0;
            for (ClickableElement e : screen.getClickableElements()) {
                if (visited.contains(ScreenIdentity.compositeKey(screenId, e.getElementId()))) {
                    visitedElements++;
                } else {
                    unvisited++;
                }
            }
            int unscrolled = 0;
            for (ScrollableContainer c : screen.getScrollableContainers()) {
                if (c.isFullyScrolled()) scrolled++; else unscrolled++;
            }
            int clickables  = screen.getClickableElements().size();
            int scrollables = screen.getScrollableContainers().size();
            totalElements   += clickables;
            totalScrollable += scrollables;

            ScreenElementStats stats = screenStats.computeIfAbsent(screenId,
                    id -> new ScreenElementStats(id, clickables, scrollables));
            stats.setTotals(clickables, scrollables);
            stats.setVisitedClickable(clickables - unvisited);
            stats.setScrolledScrollable(scrollables - unscrolled);

            boolean exhausted = exhaustedScreens.contains(screenId);
            if (stats.isFullyExplored() || exhausted) {
                fullyExplored++;
            }
            if (!exhausted && (unvisited > 0 || unscrolled > 0)) {
                items.add(new FrontierItem(screenId, unvisited + unscrolled));
            }
        }
        Collections.sort(items);
        frontier = List.copyOf(items);

        int totalScreens = screens.size();
        double element = totalElements > 0 ? (double) visitedElements / totalElements : 0.0;
        double screen  = totalScreens > 0 ? (double) fullyExplored / totalScreens : 0.0;
        double scroll  = totalScrollable > 0 ? (double) scrolled / totalScrollable : 0.0;
        double overall = element * ELEMENT_WEIGHT + screen * SCREEN_WEIGHT + scroll * SCROLL_WEIGHT;

        List<String> top = new ArrayList<>();
        for (FrontierItem item : items) {
            if (top.size() == FRONTIER_LIMIT) break;
            top.add(item.screenId());
        }
        metrics = new CoverageMetrics(totalScreens, fullyExplored, totalElements, visitedElements,
                totalScrollable, scrolled, items.size(), top, overall);

        int decile = (int) (overall * 10);
        if (decile != lastLoggedDecile) {
            lastLoggedDecile = decile;
            log.info(metrics.summary());
        }
        return metrics;
    }

    public CoverageMetrics getMetrics() {
        return metrics;
    }

    /** Screens that still have work, most unvisited first. */
    public List<FrontierItem> getFrontier() {
        return frontier;
    }

    public ScreenElementStats getScreenStats(String screenId) {
        return screenStats.get(screenId);
    }

    /** Only {@link ExplorationGoal#COMPLETE_COVERAGE} runs have a coverage target. */
    public boolean hasReachedTargetCoverage(ExplorationGoal goal, double targetCoverage) {
        return goal == ExplorationGoal.COMPLETE_COVERAGE && metrics.isComplete(targetCoverage);
    }

    public void reset() {
        metrics = CoverageMetrics.EMPTY;
        screenStats.clear();
        frontier = List.of();
        lastLoggedDecile = -1;
    }
}
