package autoexplore.explorer;

import autoexplore.model.ClickableElement;
import autoexplore.model.CoverageMetrics;
import autoexplore.model.ElementBounds;
import autoexplore.model.ExplorationGoal;
import autoexplore.model.FrontierItem;
import autoexplore.model.Screen;
import autoexplore.model.ScreenIdentity;
import autoexplore.model.ScrollDirection;
import autoexplore.model.ScrollableContainer;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class CoverageTrackerTest {

    private CoverageTracker tracker;
    private Screen home;
    private Screen list;
    private ScrollableContainer feed;
    private Set<String> visited;

    @BeforeMethod
    public void setUp() {
        tracker = new CoverageTracker();
        home = new Screen("com.app", "com.app.MainActivity");
        for (int i = 0; i < 4; i++) {
            home.addClickable(new ClickableElement("com.app:id/item_" + i, "Item " + i, null,
                    "android.widget.TextView", new ElementBounds(100, 400 + i * 200, 600, 150)));
        }
        feed = new ScrollableContainer("com.app:id/feed", "RecyclerView",
                new ElementBounds(0, 300, 1080, 1800), ScrollDirection.VERTICAL);
        home.addScrollable(feed);

        list = new Screen("com.app", "com.app.ListActivity")
                .addClickable(new ClickableElement("com.app:id/row_a", "A", null, "TextView",
                        new ElementBounds(100, 400, 600, 150)))
                .addClickable(new ClickableElement("com.app:id/row_b", "B", null, "TextView",
                        new ElementBounds(100, 600, 600, 150)));

        visited = new HashSet<>();
        visit(home, 0);
        visit(home, 1);
        visit(list, 0);
        visit(list, 1);
    }

    private void visit(Screen screen, int index) {
        visited.add(ScreenIdentity.compositeKey(screen.getScreenId(),
                screen.getClickableElements().get(index).getElementId()));
    }

    @Test(description = "Overall coverage weighs elements 0.5, screens 0.3 and scroll containers 0.2")
    public void update_weightsComponents() {
        CoverageMetrics m = tracker.update(List.of(home, list), visited, Set.of());

        assertThat(m.getTotalElements()).isEqualTo(6);
        assertThat(m.getElementsVisited()).isEqualTo(4);
        assertThat(m.getScreensFullyExplored()).isEqualTo(1);
        assertThat(m.getContainersScrolled()).isZero();
        assertThat(m.getOverallCoverage()).isCloseTo(0.5 * 4 / 6 + 0.3 * 0.5, within(1e-9));
        assertThat(tracker.getScreenStats(list.getScreenId()).isFullyExplored()).isTrue();
    }

    @Test
    public void frontier_listsScreensWithWork() {
        tracker.update(List.of(home, list), visited, Set.of());

        assertThat(tracker.getFrontier()).containsExactly(new FrontierItem(home.getScreenId(), 3));
        assertThat(tracker.getMetrics().getFrontier()).containsExactly(home.getScreenId());
        assertThat(tracker.getMetrics().getUnexploredBranches()).isEqualTo(1);
    }

    @Test
    public void exhaustedScreen_countsAsExplored_andLeavesFrontier() {
        CoverageMetrics m = tracker.update(List.of(home, list), visited, Set.of(home.getScreenId()));

        assertThat(m.getScreensFullyExplored()).isEqualTo(2);
        assertThat(tracker.getFrontier()).isEmpty();
        assertThat(m.getOverallCoverage()).isCloseTo(0.5 * 4 / 6 + 0.3, within(1e-9));
    }

    @Test
    public void scrolledContainer_addsScrollCoverage() {
        feed.setFullyScrolled(true);
        CoverageMetrics m = tracker.update(List.of(home, list), visited, Set.of());

        assertThat(m.getScrollCoverage()).isEqualTo(1.0);
        assertThat(tracker.getFrontier()).containsExactly(new FrontierItem(home.getScreenId(), 2));
    }

    @Test
    public void visitedKeysOfUnknownScreens_ignored() {
        visited.add(ScreenIdentity.compositeKey("ghost", "button"));
        CoverageMetrics m = tracker.update(List.of(home, list), visited, Set.of());
        assertThat(m.getElementsVisited()).isEqualTo(4);
    }

    @Test
    public void targetCoverage_onlyForCompleteCoverageGoal() {
        visit(home, 2);
        visit(home, 3);
        feed.setFullyScrolled(true);
        tracker.update(List.of(home, list), visited, Set.of());

        assertThat(tracker.getMetrics().getOverallCoverage()).isCloseTo(1.0, within(1e-9));
        assertThat(tracker.hasReachedTargetCoverage(ExplorationGoal.COMPLETE_COVERAGE, 0.9)).isTrue();
        assertThat(tracker.hasReachedTargetCoverage(ExplorationGoal.QUICK_SCAN, 0.9)).isFalse();
    }

    @Test
    public void reset_clearsEverything() {
        tracker.update(List.of(home, list), visited, Set.of());
        tracker.reset();

        assertThat(tracker.getMetrics()).isSameAs(CoverageMetrics.EMPTY);
        assertThat(tracker.getFrontier()).isEmpty();
        assertThat(tracker.getScreenStats(home.getScreenId())).isNull();
    }
}
