package autoexplore.frontier;

import autoexplore.learning.QLearningPolicy;
import autoexplore.model.ClickableElement;
import autoexplore.model.ElementBounds;
import autoexplore.model.ExplorationMode;
import autoexplore.model.ExplorationStrategy;
import autoexplore.model.ExplorationTarget;
import autoexplore.model.Screen;
import autoexplore.model.ScreenGeometry;
import autoexplore.model.ScreenIdentity;
import autoexplore.model.ScrollableContainer;
import autoexplore.model.TextElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns a captured screen into queued targets.
 *
 * <p>Each clickable element not yet visited, not a skip-level dead end and
 * not excluded is queued with a priority from {@link PriorityCalculator}
 * (or its reading-order position under {@link ExplorationStrategy#SYSTEMATIC}).
 * Scrollable containers that are not fully scrolled follow, except in
 * {@link ExplorationMode#QUICK}. {@link ExplorationMode#DEEP} keeps every
 * element with a real size and every container.
 *
 * <p>A screen is queued once; later calls only re-queue it while it still
 * has unvisited elements. The manager writes through a {@link QueueAppender}
 * and never reads the queue back.
 */
public class ElementQueueManager {

    private static final Logger log = LoggerFactory.getLogger(ElementQueueManager.class);

    static final int LOW_PRIORITY_MAX_CLICKABLES = 10;
    static final int META_TEXT_THRESHOLD         = 5;
    static final int LOGIN_SIGNAL_THRESHOLD      = 2;
    static final int MIN_ELEMENT_SIZE            = 20;
    static final int EDGE_GESTURE_ZONE           = 30;
    static final int DEEP_PRIORITY_BONUS         = 10;
    static final int DEFAULT_SCROLL_PRIORITY     = 5;
    static final int DEEP_SCROLL_PRIORITY        = 15;

    private static final List<String> SYSTEM_PACKAGES = List.of(
            "com.android.systemui", "com.google.android.apps.nexuslauncher",
            "com.android.launcher", "com.android.launcher3",
            "com.sec.android.app.launcher", "com.miui.home");

    private static final List<String> SENSITIVE_KEYWORDS = List.of(
            "password", "passcode", "passphrase", "pass_word",
            "pin", "pincode", "pin_code", "security_code",
            "credential", "secret", "otp", "verification_code",
            "cvv", "cvc", "card_number", "account_number");

    private static final List<String> SYSTEM_NAV_KEYWORDS = List.of(
            "home", "recent", "recents", "overview", "exit", "minimize",
            "keyboard", "ime", "launcher", "systemui", "go home",
            "show all apps", "switch apps");

    private static final List<String> NAV_PATTERNS = List.of(
            "tab", "nav", "menu", "home", "settings", "profile",
            "back", "more", "drawer", "hamburger", "fab");

    private static final List<String> LOW_PRIORITY_ACTIVITIES = List.of(
            "setting", "preference", "about", "legal", "privacy",
            "terms", "license", "help", "support", "feedback",
            "contact", "faq", "changelog", "whatsnew");

    private static final List<String> META_TEXT = List.of(
            "version", "privacy", "terms", "license", "copyright", "©");

    private static final List<String> LOGIN_ACTIVITIES = List.of(
            "loginactivity", "signinactivity", "sign_in", "sign-in",
            "authactivity", "authenticateactivity",
            "preloginactivity", "pre_login", "pre-login",
            "registeractivity", "signupactivity", "sign_up", "sign-up",
            "passwordactivity", "credentialactivity",
            "verificationactivity", "verifyactivity",
            "otpactivity", "2faactivity", "mfaactivity");

    private static final List<String> LOGIN_TEXT = List.of(
            "log in", "login", "sign in", "username", "password", "email",
            "forgot password", "create account", "register", "sign up");

    private static final List<String> LOGIN_BUTTON_TEXT = List.of(
            "log in", "login", "sign in", "submit", "continue");

    private final QLearningPolicy policy;
    private final PriorityCalculator calculator;
    private final ScreenGeometry geometry;
    private final Set<String> queuedScreens = new HashSet<>();

    /**
     * @param policy source of dead-end and dangerous-pattern knowledge, or {@code null}
     */
    public ElementQueueManager(QLearningPolicy policy, PriorityCalculator calculator) {
        this.policy     = policy;
        this.calculator = calculator;
        this.geometry   = calculator.getGeometry();
    }

    // ── Screen bookkeeping ────────────────────────────────────────────────

    public void reset() {
        queuedScreens.clear();
    }

    public boolean isScreenQueued(String screenId) {
        return queuedScreens.contains(screenId);
    }

    public void markScreenQueued(String screenId) {
        queuedScreens.add(screenId);
    }

    public Set<String> getQueuedScreens() {
        return Collections.unmodifiableSet(queuedScreens);
    }

    // ── Queueing ──────────────────────────────────────────────────────────

    /**
     * Queues the targets of {@code screen}.
     *
     * @param visited        composite keys of elements already activated
     * @param visitedNavTabs bottom-navigation tabs already activated
     */
    public QueueResult queueScreen(Screen screen, QueueAppender queue, Set<String> visited,
                                   ExplorationMode mode, ExplorationStrategy strategy,
                                   Set<String> visitedNavTabs) {
        String screenId = screen.getScreenId();
        if (queuedScreens.contains(screenId)) {
            int unvisited = countUnvisited(screen, visited);
            if (unvisited == 0) {
                log.debug("Screen {} already queued and fully visited", screenId);
                return QueueResult.alreadyQueued();
            }
            log.debug("Re-queuing {} unvisited elements of {}", unvisited, screenId);
        }
        return mode == ExplorationMode.DEEP
                ? queueDeep(screen, queue, visited, strategy, visitedNavTabs)
                : queueNormal(screen, queue, visited, mode, strategy, visitedNavTabs);
    }

    private QueueResult queueNormal(Screen screen, QueueAppender queue, Set<String> visited,
                                    ExplorationMode mode, ExplorationStrategy strategy,
                                    Set<String> visitedNavTabs) {
        String screenId = screen.getScreenId();
        if (isLowPriorityScreen(screen) && screen.getClickableElements().size() <= LOW_PRIORITY_MAX_CLICKABLES) {
            log.info("Low-priority screen {} ({}): not queuing its elements", screenId, screen.getActivity());
            queuedScreens.add(screenId);
            return QueueResult.lowPriority(screen.getClickableElements().size());
        }

        boolean quick = mode == ExplorationMode.QUICK;
        boolean adaptive = strategy == ExplorationStrategy.ADAPTIVE;
        String screenHash = policy != null ? policy.computeScreenHash(screen) : null;
        int queued = 0, skippedVisited = 0, skippedExcluded = 0, skippedQuick = 0, skippedDeadEnd = 0;

        for (ClickableElement element : screen.getClickableElements()) {
            if (visited.contains(ScreenIdentity.compositeKey(screenId, element.getElementId()))) {
                skippedVisited++;
                continue;
            }
            if (policy != null && policy.shouldSkip(screenHash, policy.getActionKey(element))) {
                skippedDeadEnd++;
                continue;
            }
            if (shouldExcludeFromQueue(element)) {
                skippedExcluded++;
                continue;
            }
            if (quick && !isLikelyNavigationElement(element)) {
                skippedQuick++;
                continue;
            }
            int priority = strategy == ExplorationStrategy.SYSTEMATIC
                    ? readingOrderPriority(element)
                    : scoreWithPolicy(element, screenHash, adaptive, visitedNavTabs);
            queue.add(ExplorationTarget.tap(screenId, element, priority));
            queued++;
        }

        int scrolls = 0;
        if (!quick) {
            for (ScrollableContainer container : screen.getScrollableContainers()) {
                if (container.isFullyScrolled()) continue;
                int priority = strategy == ExplorationStrategy.SYSTEMATIC
                        ? scrollReadingOrderPriority(container)
                        : DEFAULT_SCROLL_PRIORITY;
                queue.add(ExplorationTarget.scroll(screenId, container, priority));
                scrolls++;
            }
        }

        queuedScreens.add(screenId);
        QueueResult result = new QueueResult(queued, scrolls, skippedVisited, skippedExcluded,
                skippedQuick, skippedDeadEnd, false, 0);
        log.info("Screen {}: {}", screenId, result);
        return result;
    }

    private QueueResult queueDeep(Screen screen, QueueAppender queue, Set<String> visited,
                                  ExplorationStrategy strategy, Set<String> visitedNavTabs) {
        String screenId = screen.getScreenId();
        boolean adaptive = strategy == ExplorationStrategy.ADAPTIVE;
        String screenHash = policy != null ? policy.computeScreenHash(screen) : null;
        int queued = 0, skippedVisited = 0, skippedExcluded = 0;

        for (ClickableElement element : screen.getClickableElements()) {
            if (visited.contains(ScreenIdentity.compositeKey(screenId, element.getElementId()))) {
                skippedVisited++;
                continue;
            }
            ElementBounds b = element.getBounds();
            if (b == null || b.getWidth() <= 0 || b.getHeight() <= 0) {
                skippedExcluded++;
                continue;
            }
            int priority = strategy == ExplorationStrategy.SYSTEMATIC
                    ? readingOrderPriority(element)
                    : scoreWithPolicy(element, screenHash, adaptive, visitedNavTabs) + DEEP_PRIORITY_BONUS;
            queue.add(ExplorationTarget.tap(screenId, element, priority));
            queued++;
        }

        int scrolls = 0;
        for (ScrollableContainer container : screen.getScrollableContainers()) {
            int priority = strategy == ExplorationStrategy.SYSTEMATIC
                    ? scrollReadingOrderPriority(container)
                    : DEEP_SCROLL_PRIORITY;
            queue.add(ExplorationTarget.scroll(screenId, container, priority));
            scrolls++;
        }

        queuedScreens.add(screenId);
        QueueResult result = new QueueResult(queued, scrolls, skippedVisited, skippedExcluded, 0, 0, false, 0);
        log.info("Screen {} (deep): {}", screenId, result);
        return result;
    }

    private int scoreWithPolicy(ClickableElement element, String screenHash, boolean adaptive,
                                Set<String> visitedNavTabs) {
        if (policy == null) {
            return calculator.score(element, adaptive, visitedNavTabs, 0, false);
        }
        return calculator.score(element, adaptive, visitedNavTabs,
                policy.getElementPriorityBoost(screenHash, element), policy.isDangerousPattern(element));
    }

    /** Top-left first: 100px grid cells in reading order, inverted. */
    static int readingOrderPriority(ClickableElement element) {
        int row = element.getCenterY() / 100;
        int col = element.getCenterX() / 100;
        return 1000 - Math.max(0, Math.min(999, row * 100 + col));
    }

    static int scrollReadingOrderPriority(ScrollableContainer container) {
        ElementBounds b = container.getBounds();
        return 500 - (b == null ? 0 : b.getY() / 100);
    }

    // ── Classifiers ───────────────────────────────────────────────────────

    /**
     * True for elements never worth tapping: degenerate or off-screen bounds,
     * system UI, the status and navigation bar bands, gesture edges, anything
     * that looks like a credential field or system navigation, back buttons,
     * and patterns the policy learned to be dangerous.
     */
    public boolean shouldExcludeFromQueue(ClickableElement element) {
        ElementBounds b = element.getBounds();
        if (b == null || b.getWidth() <= 0 || b.getHeight() <= 0) {
            return true;
        }
        int cx = element.getCenterX();
        int cy = element.getCenterY();
        int width  = geometry.width();
        int height = geometry.height();

        if (cx < 0 || cy < 0 || cx > width || cy > height) {
            log.debug("Excluding off-screen element at ({}, {})", cx, cy);
            return true;
        }
        String rid = PriorityCalculator.lower(element.getResourceId());
        for (String pkg : SYSTEM_PACKAGES) {
            if (rid.startsWith(pkg)) {
                log.debug("Excluding system UI element {}", element.getResourceId());
                return true;
            }
        }
        if (b.getWidth() < MIN_ELEMENT_SIZE || b.getHeight() < MIN_ELEMENT_SIZE) {
            return true;
        }
        if (cy > height - geometry.navBarHeight() - 10) {
            return true;
        }
        if (cy < geometry.statusBarHeight()) {
            return true;
        }
        if ((cx < EDGE_GESTURE_ZONE || cx > width - EDGE_GESTURE_ZONE) && cy > height / 2) {
            return true;
        }

        String ridName = rid.substring(rid.indexOf('/') + 1);
        String desc = PriorityCalculator.lower(element.getContentDescription());
        String text = PriorityCalculator.lower(element.getText());
        for (String keyword : SENSITIVE_KEYWORDS) {
            if (ridName.contains(keyword) || desc.contains(keyword)
                    || (text.length() < 30 && text.contains(keyword))) {
                log.warn("Excluding sensitive element {} ({})", element.getElementId(), keyword);
                return true;
            }
        }
        for (String keyword : SYSTEM_NAV_KEYWORDS) {
            if (ridName.contains(keyword) || desc.contains(keyword)) {
                log.debug("Excluding system-navigation element {} ({})", element.getElementId(), keyword);
                return true;
            }
        }
        if (calculator.isLikelyBackButton(element)) {
            return true;
        }
        return policy != null && policy.isDangerousPattern(element);
    }

    /** Tabs, bars, menus, wide buttons and cards: what {@link ExplorationMode#QUICK} keeps. */
    public boolean isLikelyNavigationElement(ClickableElement element) {
        ElementBounds b = element.getBounds();
        if (b == null) return false;
        int cy = element.getCenterY();
        String cls = element.getClassName().toLowerCase();

        if (calculator.isBottomNavElement(element)) return true;
        if (cy < 120 && b.getHeight() < 80) return true;
        if (cy >= 100 && cy <= 250 && cls.contains("tab")) return true;

        String rid  = PriorityCalculator.lower(element.getResourceId());
        String text = PriorityCalculator.lower(element.getText());
        String desc = PriorityCalculator.lower(element.getContentDescription());
        for (String pattern : NAV_PATTERNS) {
            if (rid.contains(pattern) || text.contains(pattern) || desc.contains(pattern)) return true;
        }
        if (b.getWidth() > geometry.width() * 0.4 && cls.contains("button")) return true;
        return cls.contains("card") || cls.contains("listitem");
    }

    /** Settings, legal and similar pages, by activity name or by a pile of meta text. */
    public boolean isLowPriorityScreen(Screen screen) {
        String activity = screen.getActivity().toLowerCase();
        for (String pattern : LOW_PRIORITY_ACTIVITIES) {
            if (activity.contains(pattern)) {
                return true;
            }
        }
        int metaTexts = 0;
        for (TextElement t : screen.getTextElements()) {
            String text = t.getText().toLowerCase();
            if (containsAny(text, META_TEXT)) metaTexts++;
        }
        return metaTexts >= META_TEXT_THRESHOLD;
    }

    /** Credential walls, by activity name or by login-looking texts and buttons. */
    public boolean isLoginScreen(Screen screen) {
        String activity = screen.getActivity().toLowerCase();
        for (String pattern : LOGIN_ACTIVITIES) {
            if (activity.contains(pattern)) {
                log.info("Login screen detected: {} ({})", screen.getActivity(), pattern);
                return true;
            }
        }
        int signals = 0;
        for (TextElement t : screen.getTextElements()) {
            if (containsAny(t.getText().toLowerCase(), LOGIN_TEXT)) signals++;
        }
        for (ClickableElement e : screen.getClickableElements()) {
            String text = PriorityCalculator.lower(e.getText());
            String desc = PriorityCalculator.lower(e.getContentDescription());
            if (containsAny(text, LOGIN_BUTTON_TEXT) || containsAny(desc, LOGIN_BUTTON_TEXT)) signals++;
        }
        return signals >= LOGIN_SIGNAL_THRESHOLD;
    }

    /** A screen worth leaving quickly. */
    public boolean isEscapableScreen(Screen screen) {
        return isLoginScreen(screen) || isLowPriorityScreen(screen);
    }

    // ── Internals ─────────────────────────────────────────────────────────

    private static int countUnvisited(Screen screen, Set<String> visited) {
        int count = 0;
        for (ClickableElement e : screen.getClickableElements()) {
            if (!visited.contains(ScreenIdentity.compositeKey(screen.getScreenId(), e.getElementId()))) count++;
        }
        return count;
    }

    private static boolean containsAny(String haystack, List<String> needles) {
        for (String needle : needles) {
            if (haystack.contains(needle)) return true;
        }
        return false;
    }
}
