package autoexplore.graph;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Screen-to-screen transitions observed during a run, keyed by the element
 * that triggered them.
 *
 * <p>Each {@code (fromScreen, element)} pair keeps every destination it was
 * ever seen to reach together with an occurrence count, so conditional
 * navigation stays visible instead of the last observation winning.
 *
 * <p>Path queries never throw. An unknown endpoint, an unreachable screen or
 * a blocker destination all yield {@link NavigationPath#NONE}. Blocker
 * screens may still be crossed as intermediate hops.
 *
 * <p>Owned and written by the run's orchestrator thread only; other
 * components see it through {@link GraphView}.
 */
public class NavigationGraph implements GraphView {

    private static final Logger log = LoggerFactory.getLogger(NavigationGraph.class);

    /** Reliability assumed for a transition that was never observed. */
    static final double UNKNOWN_RELIABILITY = 0.5;
    static final double MIN_RELIABILITY     = 0.1;
    static final double MAX_CONFIDENCE_BOOST = 0.2;
    static final double CONFIDENCE_PER_TAP   = 0.02;
    static final double CONDITIONAL_PENALTY  = 0.1;
    static final double BLOCKER_PENALTY      = 0.3;

    /** Activity-name fragments that indicate a credential, setup or account-choice wall. */
    private static final List<String> BLOCKER_PATTERNS = List.of(
            "password", "login", "signin", "sign_in", "signup", "sign_up",
            "auth", "verify", "verification", "setup", "pin", "code",
            "otp", "2fa", "two_factor", "security", "lock", "unlock",
            "register", "registration", "forgot", "reset", "confirm",
            "modeselection", "mode_selection", "usermgmt", "user_mgmt",
            "accountselection", "account_selection", "chooseaccount", "choose_account",
            "selectaccount", "select_account", "authchoice", "auth_choice",
            "signinoptions", "signin_options", "loginoptions", "login_options");

    private final Clock clock;

    /** fromScreen -> (elementId -> navigation), both in insertion order. */
    private final Map<String, Map<String, ElementNavigation>> edges = new LinkedHashMap<>();
    private final Set<String> knownScreens         = new LinkedHashSet<>();
    private final Set<String> fullyExploredScreens = new HashSet<>();
    private final Set<String> blockerScreens       = new LinkedHashSet<>();
    private final Set<String> screensWithIncoming  = new HashSet<>();
    private final Map<String, String> problematicScreens = new LinkedHashMap<>();

    public NavigationGraph() {
        this(Clock.systemUTC());
    }

    public NavigationGraph(Clock clock) {
        this.clock = clock;
    }

    // ── Recording ─────────────────────────────────────────────────────────

    /** Registers a screen; flags it as a blocker when its activity name matches the blocker lexicon. */
    public void addScreen(String screenId, String activity) {
        knownScreens.add(screenId);
        if (activity != null && isBlockerActivity(activity) && blockerScreens.add(screenId)) {
            log.info("Screen {} ({}) classified as blocker", screenId, activity);
        }
    }

    /**
     * Records that activating {@code elementId} on {@code fromScreen} led to
     * {@code toScreen}. Repeating the same observation increments its count.
     */
    public void recordTransition(String fromScreen, String elementId, String toScreen) {
        recordTransition(fromScreen, elementId, toScreen, null);
    }

    public void recordTransition(String fromScreen, String elementId, String toScreen, String toActivity) {
        knownScreens.add(fromScreen);
        addScreen(toScreen, toActivity);
        if (!fromScreen.equals(toScreen)) {
            screensWithIncoming.add(toScreen);
        }

        ElementNavigation nav = edges
                .computeIfAbsent(fromScreen, k -> new LinkedHashMap<>())
                .computeIfAbsent(elementId, k -> new ElementNavigation(fromScreen, k, clock.instant()));
        boolean wasConditional = nav.isConditional();
        nav.addDestination(toScreen);
        if (blockerScreens.contains(toScreen)) {
            nav.markBlocker(toScreen);
        }
        if (!wasConditional && nav.isConditional()) {
            log.info("Conditional navigation detected: {}", nav);
        }
        log.debug("Transition {} --[{}]--> {} (x{})", fromScreen, elementId, toScreen,
                nav.getOccurrences(toScreen));
    }

    public static boolean isBlockerActivity(String activityName) {
        String lower = activityName.toLowerCase();
        for (String pattern : BLOCKER_PATTERNS) {
            if (lower.contains(pattern)) return true;
        }
        return false;
    }

    /** Flags a screen as a blocker based on its content rather than its activity name. */
    public void markAsBlocker(String screenId) {
        knownScreens.add(screenId);
        if (blockerScreens.add(screenId)) {
            for (Map<String, ElementNavigation> byElement : edges.values()) {
                for (ElementNavigation nav : byElement.values()) {
                    if (nav.getDestinations().containsKey(screenId)) nav.markBlocker(screenId);
                }
            }
        }
    }

    public void markFullyExplored(String screenId) {
        fullyExploredScreens.add(screenId);
    }

    /** Forgets which screens were exhausted; edges and blockers stay. */
    public void clearFullyExplored() {
        fullyExploredScreens.clear();
    }

    public void markScreenProblematic(String screenId, String reason) {
        problematicScreens.put(screenId, reason);
        log.warn("Marked screen {} as problematic: {}", screenId, reason);
    }

    // ── Queries ───────────────────────────────────────────────────────────

    @Override
    public boolean isKnownScreen(String screenId) {
        return knownScreens.contains(screenId);
    }

    @Override
    public boolean isBlockerScreen(String screenId) {
        return blockerScreens.contains(screenId);
    }

    public Set<String> getBlockerScreens() {
        return Collections.unmodifiableSet(blockerScreens);
    }

    @Override
    public boolean isFullyExplored(String screenId) {
        return fullyExploredScreens.contains(screenId);
    }

    @Override
    public boolean isProblematicScreen(String screenId) {
        return problematicScreens.containsKey(screenId);
    }

    @Override
    public boolean hasIncomingTransitions(String screenId) {
        return screensWithIncoming.contains(screenId);
    }

    @Override
    public Set<String> getUnexploredScreens() {
        Set<String> result = new LinkedHashSet<>(knownScreens);
        result.removeAll(fullyExploredScreens);
        return result;
    }

    public Set<String> getKnownScreens() {
        return Collections.unmodifiableSet(knownScreens);
    }

    @Override
    public ElementNavigation getElementNavigation(String fromScreen, String elementId) {
        Map<String, ElementNavigation> byElement = edges.get(fromScreen);
        return byElement == null ? null : byElement.get(elementId);
    }

    /** Trigger elements recorded on {@code fromScreen}, in first-seen order. */
    public List<ElementNavigation> getOutgoing(String fromScreen) {
        Map<String, ElementNavigation> byElement = edges.get(fromScreen);
        return byElement == null ? List.of() : new ArrayList<>(byElement.values());
    }

    public List<ElementNavigation> getConditionalElements() {
        List<ElementNavigation> result = new ArrayList<>();
        for (Map<String, ElementNavigation> byElement : edges.values()) {
            for (ElementNavigation nav : byElement.values()) {
                if (nav.isConditional()) result.add(nav);
            }
        }
        return result;
    }

    @Override
    public String getRealDestination(String fromScreen, String elementId) {
        ElementNavigation nav = getElementNavigation(fromScreen, elementId);
        if (nav == null) return null;
        String best = null;
        int bestCount = -1;
        for (Map.Entry<String, Integer> e : nav.getDestinations().entrySet()) {
            if (!blockerScreens.contains(e.getKey()) && e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best != null ? best : nav.getMostVisitedDestination();
    }

    /** Screen id to the set of screens directly reachable from it. */
    public Map<String, Set<String>> adjacency() {
        Map<String, Set<String>> result = new LinkedHashMap<>();
        for (String screen : knownScreens) {
            Set<String> next = new LinkedHashSet<>();
            for (ElementNavigation nav : getOutgoing(screen)) {
                next.addAll(nav.getDestinations().keySet());
            }
            result.put(screen, next);
        }
        return result;
    }

    /**
     * Confidence in {@code from --[element]--> to}, in {@code [0.1, 1.0]}.
     *
     * <p>Share of observations that reached {@code to}, plus a small boost for
     * well-exercised triggers, minus penalties for conditional triggers and
     * blocker destinations. Never-observed triggers score
     * {@value #UNKNOWN_RELIABILITY}.
     */
    public double getTransitionReliability(String from, String elementId, String to) {
        ElementNavigation nav = getElementNavigation(from, elementId);
        if (nav == null || nav.getTotalOccurrences() == 0) {
            return UNKNOWN_RELIABILITY;
        }
        double reliability = (double) nav.getOccurrences(to) / nav.getTotalOccurrences();
        reliability += Math.min(MAX_CONFIDENCE_BOOST, nav.getTapCount() * CONFIDENCE_PER_TAP);
        if (nav.isConditional()) reliability -= CONDITIONAL_PENALTY;
        if (nav.getBlockerDestinations().contains(to) || blockerScreens.contains(to)) {
            reliability -= BLOCKER_PENALTY;
        }
        return Math.max(MIN_RELIABILITY, Math.min(1.0, reliability));
    }

    // ── Path finding ──────────────────────────────────────────────────────

    @Override
    public NavigationPath findPath(String from, String to) {
        if (!isValidDestination(from, to)) {
            return NavigationPath.NONE;
        }
        if (from.equals(to)) {
            return NavigationPath.of(List.of(), 0);
        }

        Map<String, NavigationStep> cameBy = new HashMap<>();
        Set<String> visited = new HashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        visited.add(from);
        queue.add(from);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (ElementNavigation nav : getOutgoing(current)) {
                for (String next : nav.getDestinations().keySet()) {
                    if (!visited.add(next)) continue;
                    cameBy.put(next, new NavigationStep(current, nav.getElementId(), next));
                    if (next.equals(to)) {
                        List<NavigationStep> steps = unwind(cameBy, from, to);
                        return NavigationPath.of(steps, steps.size());
                    }
                    queue.add(next);
                }
            }
        }
        log.debug("No path from {} to {}", from, to);
        return NavigationPath.NONE;
    }

    /**
     * Dijkstra search where each hop costs {@code 1 - reliability}, so the
     * cheapest path is the one most likely to reproduce. Ties go to the
     * shorter path.
     */
    @Override
    public NavigationPath findOptimalPath(String from, String to) {
        if (!isValidDestination(from, to)) {
            return NavigationPath.NONE;
        }
        if (from.equals(to)) {
            return NavigationPath.of(List.of(), 0);
        }

        PriorityQueue<PathState> open = new PriorityQueue<>();
        Set<String> settled = new HashSet<>();
        open.add(new PathState(from, 0.0, List.of(), 0));
        long sequence = 1;

        while (!open.isEmpty()) {
            PathState current = open.poll();
            if (!settled.add(current.screen())) continue;
            if (current.screen().equals(to)) {
                return NavigationPath.of(current.steps(), current.cost());
            }
            for (ElementNavigation nav : getOutgoing(current.screen())) {
                for (String next : nav.getDestinations().keySet()) {
                    if (settled.contains(next)) continue;
                    double edgeCost = 1.0 - getTransitionReliability(current.screen(), nav.getElementId(), next);
                    List<NavigationStep> steps = new ArrayList<>(current.steps());
                    steps.add(new NavigationStep(current.screen(), nav.getElementId(), next));
                    open.add(new PathState(next, current.cost() + edgeCost, steps, sequence++));
                }
            }
        }
        return NavigationPath.NONE;
    }

    @Override
    public NavigationGraphStats getStats() {
        int transitions = 0;
        for (Map<String, ElementNavigation> byElement : edges.values()) {
            for (ElementNavigation nav : byElement.values()) {
                transitions += nav.getDestinations().size();
            }
        }
        return new NavigationGraphStats(knownScreens.size(), fullyExploredScreens.size(),
                transitions, getConditionalElements().size(), blockerScreens.size());
    }

    // ── Internals ─────────────────────────────────────────────────────────

    private boolean isValidDestination(String from, String to) {
        if (from == null || to == null) return false;
        if (!knownScreens.contains(from) || !knownScreens.contains(to)) return false;
        return !blockerScreens.contains(to);
    }

    private static List<NavigationStep> unwind(Map<String, NavigationStep> cameBy, String from, String to) {
        List<NavigationStep> steps = new ArrayList<>();
        String cursor = to;
        while (!cursor.equals(from)) {
            NavigationStep step = cameBy.get(cursor);
            steps.add(step);
            cursor = step.screenId();
        }
        Collections.reverse(steps);
        return steps;
    }

    private record PathState(String screen, double cost, List<NavigationStep> steps, long sequence)
            implements Comparable<PathState> {

        @Override
        public int compareTo(PathState other) {
            int byCost = Double.compare(cost, other.cost);
            if (byCost != 0) return byCost;
            int byLength = Integer.compare(steps.size(), other.steps.size());
            return byLength != 0 ? byLength : Long.compare(sequence, other.sequence);
        }
    }
}
