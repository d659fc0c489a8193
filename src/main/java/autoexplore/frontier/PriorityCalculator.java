package autoexplore.frontier;

import autoexplore.learning.QLearningPolicy;
import autoexplore.model.ClickableElement;
import autoexplore.model.ElementBounds;
import autoexplore.model.Screen;
import autoexplore.model.ScreenGeometry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;

/**
 * Scores a candidate element; higher scores are explored sooner.
 *
 * <p>The heuristic part rewards labelled and identified elements, the main
 * content region and unvisited bottom-navigation tabs, and penalizes edges,
 * the toolbar band and links to meta pages (settings, legal, rate-app). In
 * adaptive mode the fixed biases shrink and the learned boost is scaled up,
 * leaving more of the decision to the policy.
 */
public class PriorityCalculator {

    private static final Logger log = LoggerFactory.getLogger(PriorityCalculator.class);

    static final int BOTTOM_NAV_BAND   = 200;
    static final int TOP_BAND          = 200;
    static final int SIDE_EDGE         = 100;
    static final int META_PENALTY      = -30;
    static final int DANGEROUS_PENALTY = -100;
    static final double ADAPTIVE_LEARNED_SCALE = 1.5;

    private static final List<String> META_KEYWORDS = List.of(
            "setting", "about", "contact", "help", "support",
            "privacy", "terms", "legal", "license", "feedback",
            "rate", "review", "share app", "invite", "refer",
            "version", "changelog", "what's new", "faq",
            "policy", "agreement", "tos", "preferences",
            "report", "bug", "issue");

    private static final List<String> BACK_PATTERNS = List.of(
            "navigate_up", "btn_back", "btn_finish", "action_bar_back",
            "toolbar_back", "iv_back", "img_back");

    private final QLearningPolicy policy;
    private final ScreenGeometry geometry;

    /**
     * @param policy learned-value source, or {@code null} for heuristics only
     */
    public PriorityCalculator(QLearningPolicy policy, ScreenGeometry geometry) {
        this.policy   = policy;
        this.geometry = geometry;
    }

    /**
     * Scores {@code element} on {@code screen}, pulling the learned boost and
     * dangerous-pattern flag from the policy when one is attached.
     */
    public int calculatePriority(ClickableElement element, Screen screen, boolean adaptive,
                                 Set<String> visitedNavTabs) {
        int learnedBoost = 0;
        boolean dangerous = false;
        if (policy != null && screen != null) {
            learnedBoost = policy.getElementPriorityBoost(policy.computeScreenHash(screen), element);
            dangerous = policy.isDangerousPattern(element);
        }
        return score(element, adaptive, visitedNavTabs, learnedBoost, dangerous);
    }

    /**
     * Pure scoring function.
     *
     * @param visitedNavTabs bottom-navigation tab ids already activated this run
     * @param learnedBoost   value from {@link QLearningPolicy#getElementPriorityBoost}
     * @param dangerous      whether the element's pattern is known to close the app
     */
    public int score(ClickableElement element, boolean adaptive, Set<String> visitedNavTabs,
                     int learnedBoost, boolean dangerous) {
        int priority = 0;
        int cx = element.getCenterX();
        int cy = element.getCenterY();
        int width  = geometry.width();
        int height = geometry.height();

        if (element.hasText())       priority += 10;
        if (element.hasResourceId()) priority += 5;

        if (isBottomNavElement(element)) {
            boolean unvisited = !visitedNavTabs.contains(navTabId(element));
            if (adaptive) {
                priority += unvisited ? 10 : 5;
            } else {
                priority += unvisited ? 50 : 15;
            }
            if (unvisited) {
                log.debug("Unvisited bottom-nav tab {}", element.getElementId());
            }
        }

        if ((cx < SIDE_EDGE || cx > width - SIDE_EDGE) && cy < height - BOTTOM_NAV_BAND) {
            priority -= adaptive ? 2 : 5;
        }
        if (cy < TOP_BAND) {
            priority -= adaptive ? 1 : 3;
        }
        if (cx > width / 4 && cx < width * 3 / 4 && cy > height / 4 && cy < height * 3 / 4) {
            priority += adaptive ? 15 : 5;
        }

        if (isLowPriorityMetaElement(element)) {
            priority += META_PENALTY;
        }

        priority += adaptive ? (int) (learnedBoost * ADAPTIVE_LEARNED_SCALE) : learnedBoost;
        if (dangerous) {
            priority += DANGEROUS_PENALTY;
        }
        return priority;
    }

    // ── Classifiers ───────────────────────────────────────────────────────

    public boolean isBottomNavElement(ClickableElement element) {
        ElementBounds b = element.getBounds();
        return b != null
                && element.getCenterY() > geometry.height() - BOTTOM_NAV_BAND
                && b.getHeight() > 40 && b.getHeight() < 150;
    }

    /** Key used to remember that a bottom-navigation tab was activated. */
    public static String navTabId(ClickableElement element) {
        return element.hasResourceId() ? element.getResourceId() : element.getElementId();
    }

    public boolean isLowPriorityMetaElement(ClickableElement element) {
        String text = lower(element.getText());
        String rid  = lower(element.getResourceId());
        String desc = lower(element.getContentDescription());
        for (String keyword : META_KEYWORDS) {
            if (text.contains(keyword) || rid.contains(keyword) || desc.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    public boolean isLikelyBackButton(ClickableElement element) {
        String rid  = lower(element.getResourceId());
        String desc = lower(element.getContentDescription());
        for (String pattern : BACK_PATTERNS) {
            if (rid.contains(pattern) || desc.contains(pattern)) return true;
        }
        if (desc.contains("back") || desc.contains("navigate up")) {
            return true;
        }
        if (element.getCenterX() < 150 && element.getCenterY() < 200) {
            String cls = element.getClassName().toLowerCase();
            return cls.contains("imagebutton") || cls.contains("imageview");
        }
        return false;
    }

    public ScreenGeometry getGeometry() {
        return geometry;
    }

    static String lower(String s) {
        return s == null ? "" : s.toLowerCase();
    }
}
