package autoexplore.explorer;

import autoexplore.frontier.ExplorationQueue;
import autoexplore.frontier.QueueAppender;
import autoexplore.graph.GraphView;
import autoexplore.graph.NavigationGraph;
import autoexplore.model.ClickableElement;
import autoexplore.model.ExplorationIssue;
import autoexplore.model.IssueType;
import autoexplore.model.Screen;
import autoexplore.model.ScreenTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Everything one run knows. Owned and written by the engine's loop thread
 * only; other components get the narrow views {@link #queueAppender()} and
 * {@link #graphView()}.
 *
 * <p>The visited set only grows within a run. A new pass keeps screens,
 * graph and visited keys but clears the queue and the per-pass tap record.
 */
public class ExplorationState {

    private static final Logger log = LoggerFactory.getLogger(ExplorationState.class);

    private final String packageName;
    private final Clock clock;
    private final Instant startTime;

    private final Map<String, Screen> screens = new LinkedHashMap<>();
    private final Set<String> visited = new LinkedHashSet<>();
    private final Set<String> tappedThisPass = new HashSet<>();
    private final Set<String> dangerousElements = new LinkedHashSet<>();
    private final Set<String> exhaustedScreens = new LinkedHashSet<>();
    private final Set<String> visitedNavTabs = new HashSet<>();
    private final Map<String, Integer> elementFailures = new HashMap<>();
    private final List<ScreenTransition> transitions = new ArrayList<>();
    private final List<ExplorationIssue> issues = new ArrayList<>();
    private final ExplorationQueue queue = new ExplorationQueue();
    private final NavigationGraph graph;

    private String currentScreenId;
    private String homeScreenId;
    private int passNumber = 1;
    private int actionsTaken;

    public ExplorationState(String packageName, Clock clock) {
        this.packageName = packageName;
        this.clock       = clock;
        this.startTime   = clock.instant();
        this.graph       = new NavigationGraph(clock);
    }

    // ── Screens ───────────────────────────────────────────────────────────

    /**
     * Registers a captured screen, or merges it into the known one.
     *
     * @return ids of clickable elements not seen before; all of them for a new screen
     */
    public List<String> recordScreen(Screen captured) {
        String id = captured.getScreenId();
        Screen known = screens.get(id);
        if (known == null) {
            screens.put(id, captured);
            graph.addScreen(id, captured.getActivity());
            if (homeScreenId == null) homeScreenId = id;
            return captured.getClickableIds();
        }
        known.incrementVisit();
        return known.mergeFrom(captured);
    }

    public boolean isKnownScreen(String screenId) {
        return screens.containsKey(screenId);
    }

    public Screen getScreen(String screenId) {
        return screens.get(screenId);
    }

    public Collection<Screen> getScreens() {
        return Collections.unmodifiableCollection(screens.values());
    }

    public int screenCount() {
        return screens.size();
    }

    public void markExhausted(String screenId) {
        if (exhaustedScreens.add(screenId)) {
            graph.markFullyExplored(screenId);
        }
    }

    public Set<String> getExhaustedScreens() {
        return Collections.unmodifiableSet(exhaustedScreens);
    }

    // ── Visited elements ──────────────────────────────────────────────────

    /** Adds a composite key; returns {@code false} if it was already visited. */
    public boolean markVisited(String compositeKey) {
        tappedThisPass.add(compositeKey);
        return visited.add(compositeKey);
    }

    public boolean isVisited(String compositeKey) {
        return visited.contains(compositeKey);
    }

    /** Whether the key was already activated in the current pass. */
    public boolean wasTappedThisPass(String compositeKey) {
        return tappedThisPass.contains(compositeKey);
    }

    public Set<String> getVisited() {
        return Collections.unmodifiableSet(visited);
    }

    /** Keys activated in the current pass; what the frontier filters against. */
    public Set<String> getTappedThisPass() {
        return Collections.unmodifiableSet(tappedThisPass);
    }

    public Set<String> getVisitedNavTabs() {
        return Collections.unmodifiableSet(visitedNavTabs);
    }

    public void markNavTabVisited(String tabId) {
        visitedNavTabs.add(tabId);
    }

    /** Counts a transient failure on an element and returns the new count. */
    public int recordElementFailure(String compositeKey) {
        return elementFailures.merge(compositeKey, 1, Integer::sum);
    }

    public void markDangerous(String compositeKey) {
        dangerousElements.add(compositeKey);
    }

    public boolean isDangerous(String compositeKey) {
        return dangerousElements.contains(compositeKey);
    }

    public Set<String> getDangerousElements() {
        return Collections.unmodifiableSet(dangerousElements);
    }

    // ── Transitions and issues ────────────────────────────────────────────

    public void recordTransition(String from, String elementId, String to, String toActivity) {
        graph.recordTransition(from, elementId, to, toActivity);
        transitions.add(new ScreenTransition(from, to, elementId, clock.instant()));
    }

    public List<ScreenTransition> getTransitions() {
        return Collections.unmodifiableList(transitions);
    }

    public ExplorationIssue addIssue(String screenId, String elementId, IssueType type,
                                     String description, ClickableElement element) {
        ExplorationIssue issue = new ExplorationIssue(screenId, elementId, type, description, clock.instant())
                .withElement(element);
        issues.add(issue);
        log.warn("Issue: {}", issue);
        return issue;
    }

    public List<ExplorationIssue> getIssues() {
        return Collections.unmodifiableList(issues);
    }

    // ── Queue and graph ───────────────────────────────────────────────────

    ExplorationQueue queue() {
        return queue;
    }

    NavigationGraph graph() {
        return graph;
    }

    /** Write-only access to the frontier. */
    public QueueAppender queueAppender() {
        return queue;
    }

    public GraphView graphView() {
        return graph;
    }

    public int frontierSize() {
        return queue.size();
    }

    // ── Run bookkeeping ───────────────────────────────────────────────────

    /** Starts another sweep: keeps everything learned, forgets what was queued and tapped. */
    public void beginPass() {
        passNumber++;
        queue.clear();
        tappedThisPass.clear();
        elementFailures.clear();
        exhaustedScreens.clear();
        graph.clearFullyExplored();
        visitedNavTabs.clear();
        log.info("Pass {} begins with {} screens and {} visited elements", passNumber, screens.size(), visited.size());
    }

    public String getPackageName()               { return packageName; }
    public Instant getStartTime()                { return startTime; }
    public String getCurrentScreenId()           { return currentScreenId; }
    public void setCurrentScreenId(String id)    { this.currentScreenId = id; }
    public String getHomeScreenId()              { return homeScreenId; }
    public int getPassNumber()                   { return passNumber; }
    public int getActionsTaken()                 { return actionsTaken; }
    public int incrementActions()                { return ++actionsTaken; }
}
