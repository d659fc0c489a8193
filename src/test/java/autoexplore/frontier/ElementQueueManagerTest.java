package autoexplore.frontier;

import autoexplore.learning.InMemoryPolicyStore;
import autoexplore.learning.QLearningPolicy;
import autoexplore.model.ClickableElement;
import autoexplore.model.ElementBounds;
import autoexplore.model.ExplorationMode;
import autoexplore.model.ExplorationStrategy;
import autoexplore.model.ExplorationTarget;
import autoexplore.model.ExplorationTargetType;
import autoexplore.model.Screen;
import autoexplore.model.ScreenGeometry;
import autoexplore.model.ScreenIdentity;
import autoexplore.model.ScrollDirection;
import autoexplore.model.ScrollableContainer;
import autoexplore.model.TextElement;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

public class ElementQueueManagerTest {

    private ElementQueueManager manager;
    private ExplorationQueue queue;
    private Set<String> visited;

    private ClickableElement search;
    private ClickableElement article;
    private ClickableElement menu;
    private ScrollableContainer feed;
    private Screen home;

    @BeforeMethod
    public void setUp() {
        manager = new ElementQueueManager(null, new PriorityCalculator(null, ScreenGeometry.DEFAULT));
        queue   = new ExplorationQueue();
        visited = new HashSet<>();

        search  = new ClickableElement("com.app:id/search", "Search", null,
                "android.widget.Button", new ElementBounds(100, 300, 200, 100));
        article = new ClickableElement("com.app:id/article", "Article", null,
                "android.widget.TextView", new ElementBounds(300, 800, 400, 150));
        menu    = new ClickableElement("com.app:id/menu_button", null, "Open menu",
                "android.widget.ImageButton", new ElementBounds(900, 100, 100, 100));
        feed    = new ScrollableContainer("com.app:id/feed", "androidx.recyclerview.widget.RecyclerView",
                new ElementBounds(0, 600, 1080, 1500), ScrollDirection.VERTICAL);
        home = new Screen("com.app", "com.app.MainActivity")
                .addClickable(search).addClickable(article).addClickable(menu)
                .addScrollable(feed);
    }

    private QueueResult queue(Screen screen, ExplorationMode mode, ExplorationStrategy strategy) {
        return manager.queueScreen(screen, queue, visited, mode, strategy, Set.of());
    }

    private String key(ClickableElement e) {
        return ScreenIdentity.compositeKey(home.getScreenId(), e.getElementId());
    }

    // ── Normal mode ───────────────────────────────────────────────────────

    @Test
    public void queueScreen_normal_queuesElementsAndScrolls() {
        QueueResult result = queue(home, ExplorationMode.NORMAL, ExplorationStrategy.PRIORITY_BASED);

        assertThat(result.elementsQueued()).isEqualTo(3);
        assertThat(result.scrollContainersQueued()).isEqualTo(1);
        assertThat(result.totalQueued()).isEqualTo(4);
        assertThat(queue.snapshot()).filteredOn(t -> t.type() == ExplorationTargetType.SCROLL_CONTAINER)
                .extracting(ExplorationTarget::priority).containsExactly(ElementQueueManager.DEFAULT_SCROLL_PRIORITY);
        assertThat(manager.isScreenQueued(home.getScreenId())).isTrue();
    }

    @Test
    public void queueScreen_visitedElements_skipped() {
        visited.add(key(search));

        QueueResult result = queue(home, ExplorationMode.NORMAL, ExplorationStrategy.PRIORITY_BASED);

        assertThat(result.skippedVisited()).isEqualTo(1);
        assertThat(queue.snapshot()).extracting(ExplorationTarget::elementId).doesNotContain(search.getElementId());
    }

    @Test
    public void queueScreen_fullyScrolledContainer_notQueued() {
        feed.setFullyScrolled(true);
        assertThat(queue(home, ExplorationMode.NORMAL, ExplorationStrategy.PRIORITY_BASED)
                .scrollContainersQueued()).isZero();
    }

    @Test(description = "A queued screen is re-queued only while it still has unvisited elements")
    public void queueScreen_alreadyQueued_requeuesOnlyUnvisitedWork() {
        queue(home, ExplorationMode.NORMAL, ExplorationStrategy.PRIORITY_BASED);

        QueueResult again = queue(home, ExplorationMode.NORMAL, ExplorationStrategy.PRIORITY_BASED);
        assertThat(again.skippedAlreadyQueued()).isFalse();
        assertThat(again.elementsQueued()).isEqualTo(3);

        visited.add(key(search));
        visited.add(key(article));
        visited.add(key(menu));
        QueueResult done = queue(home, ExplorationMode.NORMAL, ExplorationStrategy.PRIORITY_BASED);
        assertThat(done.skippedAlreadyQueued()).isTrue();
        assertThat(done.totalQueued()).isZero();
    }

    @Test
    public void queueScreen_excludedElements_counted() {
        home.addClickable(new ClickableElement("com.app:id/password_field", null, null,
                "android.widget.EditText", new ElementBounds(100, 1000, 800, 120)));
        home.addClickable(new ClickableElement("com.app:id/dot", null, null,
                "android.view.View", new ElementBounds(500, 500, 10, 10)));

        QueueResult result = queue(home, ExplorationMode.NORMAL, ExplorationStrategy.PRIORITY_BASED);

        assertThat(result.skippedExcluded()).isEqualTo(2);
        assertThat(result.elementsQueued()).isEqualTo(3);
    }

    @Test
    public void queueScreen_lowPriorityScreen_queuesNothing() {
        Screen settings = new Screen("com.app", "com.app.SettingsActivity").addClickable(search).addClickable(article);

        QueueResult result = queue(settings, ExplorationMode.NORMAL, ExplorationStrategy.PRIORITY_BASED);

        assertThat(result.skippedLowPriority()).isEqualTo(2);
        assertThat(queue.isEmpty()).isTrue();
        assertThat(manager.isScreenQueued(settings.getScreenId())).isTrue();
    }

    // ── Modes and strategies ──────────────────────────────────────────────

    @Test(description = "Quick mode keeps only navigation-like elements and never scrolls")
    public void queueScreen_quickMode_navigationOnly() {
        QueueResult result = queue(home, ExplorationMode.QUICK, ExplorationStrategy.PRIORITY_BASED);

        assertThat(result.elementsQueued()).isEqualTo(1);
        assertThat(result.skippedQuickMode()).isEqualTo(2);
        assertThat(result.scrollContainersQueued()).isZero();
        assertThat(queue.poll().elementId()).isEqualTo(menu.getElementId());
    }

    @Test
    public void queueScreen_deepMode_minimalExclusionsAndBonus() {
        ClickableElement tiny = new ClickableElement("com.app:id/dot", null, null,
                "android.view.View", new ElementBounds(500, 500, 10, 10));
        ClickableElement zero = new ClickableElement("com.app:id/ghost", null, null,
                "android.view.View", new ElementBounds(500, 500, 0, 0));
        home.addClickable(tiny).addClickable(zero);
        feed.setFullyScrolled(true);

        QueueResult result = queue(home, ExplorationMode.DEEP, ExplorationStrategy.PRIORITY_BASED);

        assertThat(result.elementsQueued()).isEqualTo(4);
        assertThat(result.skippedExcluded()).isEqualTo(1);
        assertThat(result.scrollContainersQueued()).isEqualTo(1);
        assertThat(queue.snapshot()).filteredOn(t -> t.elementId().equals(article.getElementId()))
                .extracting(ExplorationTarget::priority).containsExactly(20 + ElementQueueManager.DEEP_PRIORITY_BONUS);
        assertThat(queue.snapshot()).filteredOn(t -> t.type() == ExplorationTargetType.SCROLL_CONTAINER)
                .extracting(ExplorationTarget::priority).containsExactly(ElementQueueManager.DEEP_SCROLL_PRIORITY);
    }

    @Test(description = "Systematic strategy orders targets top-left to bottom-right")
    public void queueScreen_systematic_readingOrder() {
        queue(home, ExplorationMode.NORMAL, ExplorationStrategy.SYSTEMATIC);

        // menu (950,150) row 1; search (200,350) row 3; article (500,875) row 8
        assertThat(queue.snapshot()).filteredOn(t -> t.type() == ExplorationTargetType.TAP_ELEMENT)
                .extracting(ExplorationTarget::elementId)
                .containsExactly(menu.getElementId(), search.getElementId(), article.getElementId());
        assertThat(ElementQueueManager.readingOrderPriority(search)).isEqualTo(698);
        assertThat(ElementQueueManager.scrollReadingOrderPriority(feed)).isEqualTo(494);
    }

    @Test
    public void queueScreen_confirmedDeadEnd_skipped() {
        QLearningPolicy policy = new QLearningPolicy(new InMemoryPolicyStore());
        manager = new ElementQueueManager(policy, new PriorityCalculator(policy, ScreenGeometry.DEFAULT));
        String hash = policy.computeScreenHash(home);
        for (int i = 0; i < 5; i++) {
            policy.updateQ(hash, policy.getActionKey(article), -1.0, null);
        }

        QueueResult result = queue(home, ExplorationMode.NORMAL, ExplorationStrategy.PRIORITY_BASED);

        assertThat(result.skippedDeadEnd()).isEqualTo(1);
        assertThat(queue.snapshot()).extracting(ExplorationTarget::elementId).doesNotContain(article.getElementId());
    }

    @Test
    public void queueScreen_dangerousPattern_excluded() {
        QLearningPolicy policy = new QLearningPolicy(new InMemoryPolicyStore());
        manager = new ElementQueueManager(policy, new PriorityCalculator(policy, ScreenGeometry.DEFAULT));
        policy.markPatternDangerous(search);

        QueueResult result = queue(home, ExplorationMode.NORMAL, ExplorationStrategy.PRIORITY_BASED);

        assertThat(result.skippedExcluded()).isEqualTo(1);
    }

    // ── Exclusion rules ───────────────────────────────────────────────────

    @Test
    public void shouldExcludeFromQueue_systemBarsAndEdges() {
        ClickableElement navBand = new ClickableElement("com.app:id/footer", "Footer", null,
                "android.widget.Button", new ElementBounds(400, 2280, 200, 60));
        ClickableElement statusBand = new ClickableElement("com.app:id/clock", "Clock", null,
                "android.widget.Button", new ElementBounds(400, 20, 200, 40));
        ClickableElement edge = new ClickableElement("com.app:id/handle", "Handle", null,
                "android.widget.Button", new ElementBounds(0, 1500, 40, 100));
        ClickableElement offScreen = new ClickableElement("com.app:id/far", "Far", null,
                "android.widget.Button", new ElementBounds(1200, 500, 200, 100));

        assertThat(manager.shouldExcludeFromQueue(navBand)).isTrue();
        assertThat(manager.shouldExcludeFromQueue(statusBand)).isTrue();
        assertThat(manager.shouldExcludeFromQueue(edge)).isTrue();
        assertThat(manager.shouldExcludeFromQueue(offScreen)).isTrue();
        assertThat(manager.shouldExcludeFromQueue(search)).isFalse();
    }

    @Test
    public void shouldExcludeFromQueue_systemUiAndSensitiveFields() {
        ClickableElement systemUi = new ClickableElement("com.android.systemui:id/back", null, null,
                "android.widget.ImageView", new ElementBounds(400, 1000, 200, 100));
        ClickableElement otp = new ClickableElement("com.app:id/otp_input", null, null,
                "android.widget.EditText", new ElementBounds(100, 1000, 800, 120));
        ClickableElement cvv = new ClickableElement(null, "CVV", null,
                "android.widget.EditText", new ElementBounds(100, 1200, 800, 120));
        ClickableElement goHome = new ClickableElement(null, null, "Go home",
                "android.widget.Button", new ElementBounds(400, 1000, 200, 100));

        assertThat(manager.shouldExcludeFromQueue(systemUi)).isTrue();
        assertThat(manager.shouldExcludeFromQueue(otp)).isTrue();
        assertThat(manager.shouldExcludeFromQueue(cvv)).isTrue();
        assertThat(manager.shouldExcludeFromQueue(goHome)).isTrue();
    }

    @Test(description = "Keywords are matched against the resource name, not the package prefix")
    public void shouldExcludeFromQueue_packageNameDoesNotTrigger() {
        ClickableElement e = new ClickableElement("com.homeapp.pinboard:id/feed_item", "Item", null,
                "android.widget.TextView", new ElementBounds(300, 800, 400, 150));
        assertThat(manager.shouldExcludeFromQueue(e)).isFalse();
    }

    // ── Classifiers ───────────────────────────────────────────────────────

    @Test
    public void isLikelyNavigationElement_variants() {
        ClickableElement bottomTab = new ClickableElement(null, "Library", null,
                "android.widget.FrameLayout", new ElementBounds(300, 2250, 200, 100));
        ClickableElement card = new ClickableElement(null, "Promo", null,
                "androidx.cardview.widget.CardView", new ElementBounds(100, 1200, 300, 300));
        ClickableElement wideButton = new ClickableElement(null, "Start", null,
                "android.widget.Button", new ElementBounds(100, 1500, 800, 120));

        assertThat(manager.isLikelyNavigationElement(bottomTab)).isTrue();
        assertThat(manager.isLikelyNavigationElement(card)).isTrue();
        assertThat(manager.isLikelyNavigationElement(wideButton)).isTrue();
        assertThat(manager.isLikelyNavigationElement(menu)).isTrue();
        assertThat(manager.isLikelyNavigationElement(article)).isFalse();
    }

    @Test
    public void isLoginScreen_byActivityOrSignals() {
        Screen byActivity = new Screen("com.app", "com.app.auth.LoginActivity");
        Screen bySignals = new Screen("com.app", "com.app.WelcomeActivity")
                .addText(new TextElement(null, "Username", "android.widget.TextView", null))
                .addClickable(new ClickableElement(null, "Continue", null,
                        "android.widget.Button", new ElementBounds(100, 1500, 800, 120)));

        assertThat(manager.isLoginScreen(byActivity)).isTrue();
        assertThat(manager.isLoginScreen(bySignals)).isTrue();
        assertThat(manager.isLoginScreen(home)).isFalse();
        assertThat(manager.isEscapableScreen(byActivity)).isTrue();
    }

    @Test
    public void isLowPriorityScreen_byMetaTextPile() {
        Screen about = new Screen("com.app", "com.app.InfoActivity");
        for (String text : new String[] {"Version 4.2", "Privacy policy", "Terms of service",
                "Open source licenses", "Copyright 2026"}) {
            about.addText(new TextElement(null, text, "android.widget.TextView", null));
        }
        assertThat(manager.isLowPriorityScreen(about)).isTrue();
        assertThat(manager.isLowPriorityScreen(home)).isFalse();
    }

    @Test
    public void reset_forgetsQueuedScreens() {
        manager.markScreenQueued("abc");
        assertThat(manager.getQueuedScreens()).containsExactly("abc");
        manager.reset();
        assertThat(manager.isScreenQueued("abc")).isFalse();
    }
}
