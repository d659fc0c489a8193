package autoexplore.learning;

import autoexplore.model.ClickableElement;
import autoexplore.model.ExplorationResultIO;
import autoexplore.model.PolicyInsights;
import autoexplore.model.Screen;
import autoexplore.model.ScreenIdentity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Pattern;

/**
 * Tabular Q-learning over generalized screen states and actions.
 *
 * <h3>State and action</h3>
 * A state is {@link #computeScreenHash(Screen)}: activity plus the sorted
 * clickable ids of the first capture, so structurally identical screens share
 * one state. An action
 * is {@link #getActionKey(ClickableElement)}: widget type, resource-id pattern
 * with digits wildcarded, and vertical zone, so values transfer between
 * similar widgets.
 *
 * <h3>Update</h3>
 * <pre>
 *   Q ← Q + α·(r + γ·maxQ(s') + β·H(s,a) − Q)
 * </pre>
 * with α = {@value #ALPHA}, γ = {@value #GAMMA}, β = {@value #BETA}. The human
 * feedback term H is consumed by the update that applies it.
 *
 * <h3>Selection</h3>
 * ε-greedy with ε = max({@value #EPSILON_MIN}, {@value #EPSILON_START}·{@value #EPSILON_DECAY}^t);
 * exploration picks uniformly among untried candidates, exploitation maximizes
 * Q plus a UCB bonus. Dangerous patterns and skip-level dead ends are never
 * candidates.
 *
 * <p>Never throws for unknown states or actions: they read as value 0.
 * Not thread-safe; owned by the control loop.
 */
public class QLearningPolicy {

    private static final Logger log = LoggerFactory.getLogger(QLearningPolicy.class);

    public static final double ALPHA = 0.15;
    public static final double GAMMA = 0.9;
    public static final double BETA  = 0.25;

    public static final double EPSILON_START = 0.30;
    public static final double EPSILON_MIN   = 0.05;
    public static final double EPSILON_DECAY = 0.995;

    static final double DEPTH_BONUS_PER_LEVEL = 0.15;
    static final double MAX_DEPTH_BONUS       = 0.6;
    static final double NOVELTY_BONUS         = 0.3;
    static final double REVISIT_PENALTY       = -0.05;
    static final int    MAX_PENALIZED_REVISITS = 5;
    static final double UCB_COEFFICIENT       = 1.5;

    static final double DEAD_END_VALUE   = -0.05;
    static final int    DEAD_END_VISITS  = 3;
    static final double SKIP_VALUE       = -0.08;
    static final int    SKIP_VISITS      = 5;
    static final double DEAD_SCREEN_CAP  = -0.5;
    static final int    DEAD_END_BOOST   = -80;

    static final double MERGE_EXTERNAL_WEIGHT = 0.7;
    static final int    TOP_ACTIONS = 5;
    public static final int DEFAULT_SCREEN_HEIGHT = 2400;

    private static final Pattern DIGITS = Pattern.compile("\\d+");

    private final PolicyTable table;
    private final Random random;
    private final Clock clock;
    private final ObjectMapper mapper = ExplorationResultIO.getMapper();

    private final Set<String> deadEndScreens = new HashSet<>();
    private final List<RestartRecoveryOutcome> restartOutcomes = new ArrayList<>();
    private int restartAttempts;
    private int restartSuccesses;

    private int screenHeight = DEFAULT_SCREEN_HEIGHT;
    private int currentDepth;

    public QLearningPolicy(PolicyStore store) {
        this(new PolicyTable(store), new Random(), Clock.systemUTC());
    }

    QLearningPolicy(PolicyTable table, Random random, Clock clock) {
        this.table  = table;
        this.random = random;
        this.clock  = clock;
    }

    // ── Context ───────────────────────────────────────────────────────────

    public void setScreenHeight(int screenHeight) {
        if (screenHeight > 0) this.screenHeight = screenHeight;
    }

    /** Navigation depth of the screen the next action is taken from; drives the depth bonus. */
    public void setCurrentDepth(int depth) {
        this.currentDepth = Math.max(0, depth);
    }

    public int getCurrentDepth() {
        return currentDepth;
    }

    // ── State and action encoding ─────────────────────────────────────────

    /**
     * State id of {@code screen}: activity plus its {@link Screen#getStateSignature()
     * state signature}, so the id of a known screen stays put as scrolling
     * merges more elements into it.
     */
    public String computeScreenHash(Screen screen) {
        List<String> ids = screen.getStateSignature();
        return ScreenIdentity.sha256(screen.getActivity() + "|" + String.join(",", ids)).substring(0, 16);
    }

    public String getActionKey(ClickableElement element) {
        String type = element.getSimpleClassName();
        String pattern = "none";
        if (element.getResourceId() != null) {
            String rid = element.getResourceId();
            pattern = DIGITS.matcher(rid.substring(rid.lastIndexOf('/') + 1)).replaceAll("*");
        }
        int y = element.getCenterY();
        String zone;
        if (y < screenHeight / 3) {
            zone = "top";
        } else if (y > screenHeight * 2 / 3) {
            zone = "bottom";
        } else {
            zone = "center";
        }
        return type + "|" + pattern + "|" + zone;
    }

    static String key(String screenHash, String actionKey) {
        return screenHash + "|" + actionKey;
    }

    // ── Values ────────────────────────────────────────────────────────────

    public double getQValue(String screenHash, String actionKey) {
        return table.getValue(key(screenHash, actionKey));
    }

    public int getVisitCount(String screenHash, String actionKey) {
        return table.getVisits(key(screenHash, actionKey));
    }

    public double getMaxQForScreen(String screenHash) {
        return table.maxValueWithPrefix(screenHash + "|");
    }

    /**
     * Applies one learning step for taking {@code actionKey} on {@code screenHash}.
     *
     * @param nextScreenHash state the action led to, or {@code null} when it left the app
     * @return the new value
     */
    public double updateQ(String screenHash, String actionKey, double reward, String nextScreenHash) {
        String key = key(screenHash, actionKey);
        double current  = table.getValue(key);
        double nextMaxQ = nextScreenHash != null ? getMaxQForScreen(nextScreenHash) : 0.0;
        int human       = table.getFeedback(key);

        double updated = current + ALPHA * (reward + GAMMA * nextMaxQ + BETA * human - current);
        table.applyUpdate(key, updated);

        if (human != 0) {
            log.debug("Applied human feedback H={} to {}", human, key);
        }
        log.debug("Q-update {}: r={} q {} -> {}", key, String.format("%.3f", reward),
                String.format("%.3f", current), String.format("%.3f", updated));
        return updated;
    }

    // ── Human feedback ────────────────────────────────────────────────────

    /**
     * Records a human signal for a state-action pair: positive for imitation,
     * negative for veto. Each signal counts as at most ±1.
     */
    public void recordHumanFeedback(String screenHash, String actionKey, int signal) {
        int clamped = Math.max(-1, Math.min(1, signal));
        if (clamped == 0) return;
        int total = table.addFeedback(key(screenHash, actionKey), clamped);
        log.info("Human feedback {} for {} (pending H={})", clamped > 0 ? "+1" : "-1", actionKey, total);
    }

    public int getHumanFeedback(String screenHash, String actionKey) {
        return table.getFeedback(key(screenHash, actionKey));
    }

    public boolean isVetoedAction(String screenHash, String actionKey) {
        return table.getFeedback(key(screenHash, actionKey)) < 0;
    }

    // ── Selection ─────────────────────────────────────────────────────────

    public double getCurrentEpsilon() {
        return Math.max(EPSILON_MIN, EPSILON_START * Math.pow(EPSILON_DECAY, table.getTotalActions()));
    }

    public int getTotalActions() {
        return table.getTotalActions();
    }

    /**
     * Chooses the next element on {@code screen}, or {@code null} when no
     * candidate remains after removing dangerous patterns and dead ends.
     *
     * @param unexploredOnly restrict candidates to elements not yet explored
     */
    public ClickableElement selectElement(Screen screen, boolean unexploredOnly) {
        List<ClickableElement> offered = new ArrayList<>();
        for (ClickableElement element : screen.getClickableElements()) {
            if (!unexploredOnly || !element.isExplored()) offered.add(element);
        }
        return selectElement(computeScreenHash(screen), offered);
    }

    /**
     * Chooses among {@code offered}, all of which live on the screen with
     * {@code screenHash}. Returns {@code null} when every one is dangerous or
     * a skipped dead end.
     */
    public ClickableElement selectElement(String screenHash, List<ClickableElement> offered) {
        List<ClickableElement> candidates = new ArrayList<>();
        for (ClickableElement element : offered) {
            String actionKey = getActionKey(element);
            if (table.isDangerous(actionKey) || shouldSkip(screenHash, actionKey)) continue;
            candidates.add(element);
        }
        if (candidates.isEmpty()) return null;

        table.incrementTotalActions();
        double epsilon = getCurrentEpsilon();

        if (random.nextDouble() < epsilon) {
            List<ClickableElement> untried = new ArrayList<>();
            for (ClickableElement element : candidates) {
                if (table.getVisits(key(screenHash, getActionKey(element))) == 0) untried.add(element);
            }
            List<ClickableElement> pool = untried.isEmpty() ? candidates : untried;
            ClickableElement pick = pool.get(random.nextInt(pool.size()));
            log.debug("Explore (eps={}): {}", String.format("%.3f", epsilon), pick.getElementId());
            return pick;
        }

        int screenVisits = Math.max(1, table.getScreenVisits(screenHash));
        ClickableElement best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (ClickableElement element : candidates) {
            String key = key(screenHash, getActionKey(element));
            int visits = table.getVisits(key);
            double bonus = visits > 0
                    ? UCB_COEFFICIENT * Math.sqrt(Math.log(screenVisits) / visits)
                    : UCB_COEFFICIENT * 2.0;
            double score = table.getValue(key) + bonus;
            if (score > bestScore) {
                best = element;
                bestScore = score;
            }
        }
        log.debug("Exploit (eps={}): {} score={}", String.format("%.3f", epsilon),
                best.getElementId(), String.format("%.3f", bestScore));
        return best;
    }

    /**
     * Integer boost added to an element's heuristic priority, in {@code [-80, 60]}.
     * A confirmed dead end always scores the floor.
     */
    public int getElementPriorityBoost(Screen screen, ClickableElement element) {
        return getElementPriorityBoost(computeScreenHash(screen), element);
    }

    public int getElementPriorityBoost(String screenHash, ClickableElement element) {
        String actionKey = getActionKey(element);
        if (isConfirmedDeadEnd(screenHash, actionKey)) {
            return DEAD_END_BOOST;
        }
        String key = key(screenHash, actionKey);
        int visits = table.getVisits(key);

        int boost = clamp((int) (table.getValue(key) * 40), -40, 40);
        if (visits == 0) {
            boost += 25;
        } else if (visits <= 2) {
            boost += 10;
        }

        int screenVisits = Math.max(1, table.getScreenVisits(screenHash));
        if (visits > 0 && screenVisits > 1) {
            int ucb = (int) (UCB_COEFFICIENT * Math.sqrt(Math.log(screenVisits) / visits) * 10);
            boost += Math.min(ucb, 15);
        }
        return clamp(boost, DEAD_END_BOOST, 60);
    }

    // ── Dead ends and dangerous patterns ──────────────────────────────────

    public boolean isConfirmedDeadEnd(String screenHash, String actionKey) {
        String key = key(screenHash, actionKey);
        if (!table.contains(key)) return false;
        return table.getValue(key) < DEAD_END_VALUE && table.getVisits(key) >= DEAD_END_VISITS;
    }

    public boolean shouldSkip(String screenHash, String actionKey) {
        String key = key(screenHash, actionKey);
        if (!table.contains(key)) return false;
        return table.getValue(key) < SKIP_VALUE && table.getVisits(key) >= SKIP_VISITS;
    }

    public boolean shouldSkipElement(Screen screen, ClickableElement element) {
        String actionKey = getActionKey(element);
        boolean skip = shouldSkip(computeScreenHash(screen), actionKey);
        if (skip) {
            log.debug("Skipping confirmed dead end {}", actionKey);
        }
        return skip;
    }

    public boolean isDangerousPattern(ClickableElement element) {
        return table.isDangerous(getActionKey(element));
    }

    public void markPatternDangerous(ClickableElement element) {
        String pattern = getActionKey(element);
        if (table.addDangerous(pattern)) {
            log.warn("Marked pattern as dangerous: {}", pattern);
        }
    }

    public Set<String> getDangerousPatterns() {
        return table.dangerousPatterns();
    }

    /** Forces every known action on {@code screenHash} to at most {@value #DEAD_SCREEN_CAP}. */
    public int markScreenAsDeadEnd(String screenHash) {
        String prefix = screenHash + "|";
        Map<String, Double> capped = new TreeMap<>();
        for (Map.Entry<String, PolicyEntry> e : table.entries().entrySet()) {
            if (e.getKey().startsWith(prefix)) {
                capped.put(e.getKey(), Math.min(e.getValue().getValue(), DEAD_SCREEN_CAP));
            }
        }
        capped.forEach(table::setValue);
        deadEndScreens.add(screenHash);
        log.info("Dead-end screen {}: penalized {} actions", screenHash, capped.size());
        return capped.size();
    }

    public boolean isDeadEndScreen(String screenHash) {
        return deadEndScreens.contains(screenHash);
    }

    // ── Rewards ───────────────────────────────────────────────────────────

    /**
     * Reward for an outcome, including depth bonus, first-visit novelty and
     * the revisit penalty. For {@link ActionOutcome#NEW_SCREEN} this also
     * counts a visit to {@code destinationHash}.
     */
    public double calculateReward(ActionOutcome outcome, String destinationHash, boolean firstVisitToElement) {
        double reward = outcome.getBaseReward();

        if (outcome == ActionOutcome.NEW_SCREEN) {
            reward += Math.min(currentDepth * DEPTH_BONUS_PER_LEVEL, MAX_DEPTH_BONUS);
        }
        if (firstVisitToElement && !outcome.isDestructive()) {
            reward += NOVELTY_BONUS;
        }
        if (outcome == ActionOutcome.NEW_SCREEN && destinationHash != null) {
            int previous = table.getScreenVisits(destinationHash);
            if (previous > 0) {
                reward += REVISIT_PENALTY * Math.min(previous, MAX_PENALIZED_REVISITS);
            }
            table.incrementScreenVisits(destinationHash);
        }
        return reward;
    }

    public double calculateReward(ActionOutcome outcome) {
        return calculateReward(outcome, null, false);
    }

    public void recordScreenVisit(String screenHash) {
        table.incrementScreenVisits(screenHash);
    }

    public int getScreenVisitCount(String screenHash) {
        return table.getScreenVisits(screenHash);
    }

    public boolean isFirstVisit(String screenHash, String actionKey) {
        return table.getVisits(key(screenHash, actionKey)) == 0;
    }

    // ── Restart recovery ──────────────────────────────────────────────────

    public void recordRestartRecovery(boolean success, String reason) {
        restartAttempts++;
        if (success) restartSuccesses++;
        restartOutcomes.add(new RestartRecoveryOutcome(clock.instant(), success, reason,
                table.size(), countStates()));
        log.info("Restart recovery recorded: success={} reason={} ({} of {} succeeded)",
                success, reason, restartSuccesses, restartAttempts);
    }

    public List<RestartRecoveryOutcome> getRestartRecoveryOutcomes() {
        return Collections.unmodifiableList(restartOutcomes);
    }

    public double getRestartSuccessRate() {
        return restartAttempts == 0 ? 0.0 : (double) restartSuccesses / restartAttempts;
    }

    // ── Statistics and exchange ───────────────────────────────────────────

    public PolicyStatistics getStatistics() {
        Map<String, PolicyEntry> entries = table.entries();
        int visits = 0;
        double sum = 0;
        double max = entries.isEmpty() ? 0 : Double.NEGATIVE_INFINITY;
        double min = entries.isEmpty() ? 0 : Double.POSITIVE_INFINITY;
        for (PolicyEntry e : entries.values()) {
            visits += e.getVisits();
            sum += e.getValue();
            max = Math.max(max, e.getValue());
            min = Math.min(min, e.getValue());
        }
        return new PolicyStatistics(entries.size(), visits, table.dangerousPatterns().size(),
                entries.isEmpty() ? 0 : sum / entries.size(), max, min,
                getCurrentEpsilon(), table.getTotalActions(), countStates(),
                restartAttempts, getRestartSuccessRate());
    }

    public PolicyInsights toInsights() {
        PolicyStatistics stats = getStatistics();
        List<String> top = new ArrayList<>();
        table.entries().entrySet().stream()
                .sorted(Map.Entry.<String, PolicyEntry>comparingByValue(
                        Comparator.comparingDouble(PolicyEntry::getValue)).reversed()
                        .thenComparing(Map.Entry.<String, PolicyEntry>comparingByKey()))
                .limit(TOP_ACTIONS)
                .forEach(e -> top.add(e.getKey()));
        return new PolicyInsights(stats.tableSize(), stats.dangerousPatterns(), stats.averageValue(),
                stats.epsilon(), stats.restartSuccessRate(), top);
    }

    /** All values as a flat, key-sorted JSON object. */
    public String exportQTableJson() {
        Map<String, Double> values = new TreeMap<>();
        table.entries().forEach((k, v) -> values.put(k, v.getValue()));
        try {
            return mapper.writeValueAsString(values);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Blends an externally trained table into this one: new keys are taken
     * as-is, known keys become {@code 0.7·external + 0.3·local}.
     *
     * <p>Accepts a flat {@code {key: value}} object, the same wrapped in
     * {@code "q_table"}, or a policy snapshot with {@code "entries"}.
     *
     * @return number of keys merged; 0 when the input cannot be parsed
     */
    public int mergeQTable(String json) {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.error("Cannot merge policy table: {}", e.getOriginalMessage());
            return 0;
        }
        if (root == null || !root.isObject()) {
            log.error("Cannot merge policy table: expected a JSON object");
            return 0;
        }
        JsonNode values = root.has("q_table") ? root.get("q_table")
                : root.has("entries") ? root.get("entries") : root;

        int merged = 0;
        Iterator<Map.Entry<String, JsonNode>> fields = values.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode node = field.getValue();
            JsonNode valueNode = node.isObject() ? node.get("value") : node;
            if (valueNode == null || !valueNode.isNumber()) {
                log.warn("Skipping non-numeric policy value for {}", field.getKey());
                continue;
            }
            double external = valueNode.asDouble();
            String key = field.getKey();
            double value = table.contains(key)
                    ? external * MERGE_EXTERNAL_WEIGHT + table.getValue(key) * (1 - MERGE_EXTERNAL_WEIGHT)
                    : external;
            table.setValue(key, value);
            merged++;
        }
        log.info("Merged {} policy values (table now {} entries)", merged, table.size());
        return merged;
    }

    /** Forgets everything learned in this process. */
    public void reset() {
        table.clear();
        deadEndScreens.clear();
        restartOutcomes.clear();
        restartAttempts = 0;
        restartSuccesses = 0;
        currentDepth = 0;
        log.info("Policy reset");
    }

    PolicyTable getTable() {
        return table;
    }

    // ── Internals ─────────────────────────────────────────────────────────

    private int countStates() {
        Set<String> states = new HashSet<>();
        for (String key : table.entries().keySet()) {
            int sep = key.indexOf('|');
            states.add(sep < 0 ? key : key.substring(0, sep));
        }
        return states.size();
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
