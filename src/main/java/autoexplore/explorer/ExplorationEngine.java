package autoexplore.explorer;

import autoexplore.device.Actuator;
import autoexplore.device.CaptureException;
import autoexplore.device.HelpRequester;
import autoexplore.device.ScreenProvider;
import autoexplore.explorer.ExplorationStateMachine.ExplorerEvent;
import autoexplore.explorer.ExplorationStateMachine.ExplorerState;
import autoexplore.frontier.ElementQueueManager;
import autoexplore.frontier.ExplorationQueue;
import autoexplore.frontier.PriorityCalculator;
import autoexplore.frontier.QueueResult;
import autoexplore.graph.NavigationGraph;
import autoexplore.graph.NavigationPath;
import autoexplore.graph.NavigationStep;
import autoexplore.learning.ActionOutcome;
import autoexplore.learning.QLearningPolicy;
import autoexplore.learning.StrategyMemory;
import autoexplore.model.ClickableActionType;
import autoexplore.model.ClickableElement;
import autoexplore.model.ElementBounds;
import autoexplore.model.ExplorationGoal;
import autoexplore.model.ExplorationResult;
import autoexplore.model.ExplorationStatus;
import autoexplore.model.ExplorationStrategy;
import autoexplore.model.ExplorationTarget;
import autoexplore.model.ExplorationTargetType;
import autoexplore.model.IssueType;
import autoexplore.model.Screen;
import autoexplore.model.ScreenGeometry;
import autoexplore.model.ScreenIdentity;
import autoexplore.model.ScrollDirection;
import autoexplore.model.ScrollableContainer;
import autoexplore.model.TextElement;
import autoexplore.status.StatusEvent;
import autoexplore.status.StatusSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives an exploration run against a live target app.
 *
 * <p>Each iteration of the loop:
 * <ol>
 *   <li>Observes stop and pause requests.</li>
 *   <li>Checks the goal's termination conditions (screen/element/time budget
 *       or coverage target with a time cap).</li>
 *   <li>Climbs the {@link StuckRecovery} ladder when the staleness signal fires.</li>
 *   <li>Selects the next target with the active strategy.</li>
 *   <li>Re-routes to the target's screen if the device is elsewhere.</li>
 *   <li>Actuates, re-observes once the UI settles and classifies the outcome.</li>
 *   <li>Updates graph, policy, coverage and frontier.</li>
 * </ol>
 * An empty frontier triggers a verification pass before the run completes.
 *
 * <p>The loop runs on one daemon thread and is the only writer of the
 * {@link ExplorationState}. {@link #stop()}, {@link #pause()} and
 * {@link #resume()} only set flags, which the loop checks at the top of every
 * iteration and at every wait.
 */
public class ExplorationEngine {

    private static final Logger log = LoggerFactory.getLogger(ExplorationEngine.class);

    static final long POLL_INTERVAL_MS       = 250;
    static final int  MAX_VERIFICATION_ROUNDS = 2;
    static final int  MAX_NAV_PROBES          = 4;
    static final int  MAX_BACKTRACK_PRESSES   = 3;

    private static final List<String> CRASH_TEXT = List.of("has stopped", "keeps stopping", "isn't responding");

    private final ScreenProvider screenProvider;
    private final Actuator actuator;
    private final QLearningPolicy policy;
    private final StatusSink statusSink;
    private final HelpRequester helpRequester;
    private final StrategyMemory strategyMemory;
    private final ExplorerConfig settings;
    private final Clock clock;
    private final Executor executor;

    private final ExplorationStateMachine machine = new ExplorationStateMachine();
    private final StuckRecovery recovery;
    private final CoverageTracker coverage = new CoverageTracker();
    private final PriorityCalculator calculator;
    private final ElementQueueManager queueManager;
    private final StabilityPoller poller;
    private final EngineRecoveryContext recoveryContext = new EngineRecoveryContext();

    private final AtomicBoolean stopRequested  = new AtomicBoolean();
    private final AtomicBoolean pauseRequested = new AtomicBoolean();
    private final Queue<Feedback> pendingFeedback = new ConcurrentLinkedQueue<>();

    // ── Loop-thread state ─────────────────────────────────────────────────

    private ExplorationState state;
    private ExplorationConfig config;
    private NavigationStack navStack;
    private StalenessTracker staleness;
    private AdaptiveStrategySelector adaptive;
    private Screen lastCapture;
    private Instant runStartedAt;
    private final Map<String, Integer> rerouteFailures = new HashMap<>();
    private final Set<String> reportedBlockers = new HashSet<>();
    private boolean preferCurrentScreen;
    private int consecutiveRelaunches;
    private int consecutiveCaptureFailures;
    private int verificationRounds;
    private ExplorerEvent terminalEvent;

    private volatile ExplorationStatus status = ExplorationStatus.NOT_STARTED;
    private volatile ExplorationResult lastResult;
    private volatile CompletableFuture<ExplorationResult> running;

    private record Feedback(String screenId, String elementId, int signal) {}

    /** What arriving on a captured screen changed. */
    private record Arrival(Screen screen, boolean newScreen, List<String> newElements, boolean blocker) {}

    public ExplorationEngine(ScreenProvider screenProvider, Actuator actuator, QLearningPolicy policy,
                             StatusSink statusSink, ExplorerConfig settings) {
        this(screenProvider, actuator, policy, statusSink, HelpRequester.NONE, null, settings);
    }

    /**
     * @param strategyMemory best strategy per target for adaptive runs, or {@code null}
     */
    public ExplorationEngine(ScreenProvider screenProvider, Actuator actuator, QLearningPolicy policy,
                             StatusSink statusSink, HelpRequester helpRequester,
                             StrategyMemory strategyMemory, ExplorerConfig settings) {
        this(screenProvider, actuator, policy, statusSink, helpRequester, strategyMemory, settings,
                Clock.systemUTC(), StabilityPoller.Sleeper.SYSTEM, newLoopExecutor(), new StuckRecovery());
    }

    /** Package-private constructor for tests: injectable clock, sleeper, executor and recovery ladder. */
    ExplorationEngine(ScreenProvider screenProvider, Actuator actuator, QLearningPolicy policy,
                      StatusSink statusSink, HelpRequester helpRequester, StrategyMemory strategyMemory,
                      ExplorerConfig settings, Clock clock, StabilityPoller.Sleeper sleeper,
                      Executor executor, StuckRecovery recovery) {
        this.screenProvider = Objects.requireNonNull(screenProvider, "screenProvider");
        this.actuator       = Objects.requireNonNull(actuator, "actuator");
        this.policy         = Objects.requireNonNull(policy, "policy");
        this.statusSink     = statusSink != null ? statusSink : StatusSink.NOOP;
        this.helpRequester  = helpRequester != null ? helpRequester : HelpRequester.NONE;
        this.strategyMemory = strategyMemory;
        this.settings       = Objects.requireNonNull(settings, "settings");
        this.clock          = clock;
        this.executor       = executor;
        this.recovery       = recovery;

        ScreenGeometry geometry = settings.getScreenGeometry();
        this.policy.setScreenHeight(geometry.height());
        this.calculator   = new PriorityCalculator(policy, geometry);
        this.queueManager = new ElementQueueManager(policy, calculator);
        this.poller       = new StabilityPoller(clock, sleeper, this::cancelled);

        machine.setTransitionListener((from, to, event) ->
                this.statusSink.publish(StatusEvent.transition(clock.instant(), from, to, event, progress())));
    }

    private static ExecutorService newLoopExecutor() {
        return Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "exploration-loop");
            t.setDaemon(true);
            return t;
        });
    }

    // ── Run control ───────────────────────────────────────────────────────

    /**
     * Starts a fresh run against {@code packageName}.
     *
     * @return completes with the run's result; never completes exceptionally
     * @throws ExplorationException if a run is already active
     */
    public synchronized CompletableFuture<ExplorationResult> start(String packageName, ExplorationConfig config) {
        Objects.requireNonNull(packageName, "packageName");
        Objects.requireNonNull(config, "config");
        if (isRunning()) {
            throw new ExplorationException("A run is already active for " + state.getPackageName());
        }
        this.config = config;
        this.state  = new ExplorationState(packageName, clock);
        this.navStack = new NavigationStack(clock);
        this.adaptive = config.getStrategy() == ExplorationStrategy.ADAPTIVE
                ? new AdaptiveStrategySelector(packageName, strategyMemory,
                        settings.getAdaptiveQuota(), settings.getAdaptiveStagnation())
                : null;
        reportedBlockers.clear();
        queueManager.reset();
        coverage.reset();
        log.info("Starting exploration of {} with {}", packageName, config);
        return launch();
    }

    /**
     * Sweeps the same target again, keeping screens, graph, visited keys and
     * everything the policy learned; the queue and the per-pass tap record
     * start empty.
     *
     * @throws ExplorationException if there is no previous run or one is active
     */
    public synchronized CompletableFuture<ExplorationResult> startAnotherPass() {
        if (state == null) {
            throw new ExplorationException("No previous run to continue");
        }
        if (isRunning()) {
            throw new ExplorationException("A run is already active for " + state.getPackageName());
        }
        state.beginPass();
        queueManager.reset();
        navStack.reset();
        return launch();
    }

    private CompletableFuture<ExplorationResult> launch() {
        stopRequested.set(false);
        pauseRequested.set(false);
        rerouteFailures.clear();
        preferCurrentScreen = false;
        consecutiveRelaunches = 0;
        consecutiveCaptureFailures = 0;
        verificationRounds = 0;
        terminalEvent = null;
        lastCapture = null;
        runStartedAt = clock.instant();
        staleness = new StalenessTracker(settings.getStuckThreshold(), settings.getRestartThreshold(),
                Duration.ofMillis(settings.getPlateauMs()), clock);
        status = ExplorationStatus.IN_PROGRESS;
        machine.processEvent(ExplorerEvent.START_REQUESTED);
        running = CompletableFuture.supplyAsync(this::runLoop, executor);
        return running;
    }

    /** Asks the loop to finish; partial results are kept. */
    public void stop() {
        log.info("Stop requested");
        stopRequested.set(true);
    }

    public void pause() {
        log.info("Pause requested");
        pauseRequested.set(true);
    }

    public void resume() {
        log.info("Resume requested");
        pauseRequested.set(false);
    }

    /**
     * Routes a human signal about an element to the policy: imitate
     * ({@code true}) or veto. Applied by the loop before its next decision.
     */
    public void recordHumanFeedback(String screenId, String elementId, boolean imitate) {
        pendingFeedback.add(new Feedback(screenId, elementId, imitate ? 1 : -1));
        if (!isRunning() && state != null) {
            applyPendingFeedback();
        }
    }

    public boolean isRunning() {
        CompletableFuture<ExplorationResult> f = running;
        return f != null && !f.isDone();
    }

    public ExplorationStatus getStatus() {
        return status;
    }

    public ExplorerState getLifecycleState() {
        return machine.getState();
    }

    public ExplorationResult getLastResult() {
        return lastResult;
    }

    public StuckRecovery.RecoveryStatistics getRecoveryStatistics() {
        return recovery.getStatistics();
    }

    /** Stops the loop thread; a run in progress ends as cancelled. */
    public void shutdown() {
        stopRequested.set(true);
        if (executor instanceof ExecutorService service) {
            service.shutdownNow();
        }
    }

    // ── Loop ──────────────────────────────────────────────────────────────

    private ExplorationResult runLoop() {
        ExplorationStatus outcome;
        String error = null;
        try {
            outcome = initialize() ? explore() : stoppedOrCancelled();
        } catch (ExplorationException e) {
            log.error("Run failed: {}", e.getMessage(), e);
            outcome = failRun();
            error = e.getMessage();
        } catch (RuntimeException e) {
            log.error("Unexpected failure in the exploration loop", e);
            outcome = failRun();
            error = e.toString();
        }
        if (machine.getState() == ExplorerState.COMPLETING) {
            machine.processEvent(terminalEvent != null ? terminalEvent : ExplorerEvent.STOP_REQUESTED);
        }
        if (adaptive != null) {
            adaptive.persist();
        }
        status = outcome;
        ExplorationResult result = buildResult(outcome, error);
        lastResult = result;
        publishProgress("finished: " + coverage.getMetrics().summary());
        log.info("Exploration of {} ended {}: {} screens, {} elements, {} issues",
                state.getPackageName(), outcome, state.screenCount(), state.getVisited().size(),
                state.getIssues().size());
        return result;
    }

    private ExplorationStatus failRun() {
        terminalEvent = ExplorerEvent.RUN_FAILED;
        machine.processEvent(ExplorerEvent.RUN_FAILED);
        return ExplorationStatus.ERROR;
    }

    private ExplorationStatus stoppedOrCancelled() {
        terminalEvent = ExplorerEvent.STOP_REQUESTED;
        machine.processEvent(ExplorerEvent.STOP_REQUESTED);
        return Thread.currentThread().isInterrupted() ? ExplorationStatus.CANCELLED : ExplorationStatus.STOPPED;
    }

    /** Launches the target and registers its first screen; {@code false} if cancelled first. */
    private boolean initialize() {
        Screen home = launchTarget(state.getPassNumber() > 1);
        if (home == null) {
            return false;
        }
        arrive(home, null, null);
        machine.processEvent(ExplorerEvent.INITIALIZATION_COMPLETE);
        publishProgress("initialized on " + home.getScreenId());
        return true;
    }

    private ExplorationStatus explore() {
        while (true) {
            if (cancelled()) {
                return stoppedOrCancelled();
            }
            if (pauseRequested.get()) {
                awaitResume();
                continue;
            }
            applyPendingFeedback();

            ExplorerEvent done = terminationEvent();
            if (done != null) {
                terminalEvent = done;
                machine.processEvent(done);
                return ExplorationStatus.COMPLETED;
            }

            if (staleness.level() != StalenessTracker.Level.FRESH) {
                recoverFromStall();
                if (machine.getState() == ExplorerState.COMPLETING) {
                    terminalEvent = ExplorerEvent.RECOVERY_FAILED;
                    return ExplorationStatus.COMPLETED;
                }
                continue;
            }

            ExplorationTarget target = nextTarget();
            if (target == null) {
                if (verify()) continue;
                if (state.getPassNumber() < config.getMaxPasses()) {
                    beginNextPass();
                    continue;
                }
                terminalEvent = ExplorerEvent.QUEUE_EXHAUSTED;
                machine.processEvent(ExplorerEvent.QUEUE_EXHAUSTED);
                return ExplorationStatus.COMPLETED;
            }
            process(target);
            publishProgress(null);
        }
    }

    private void awaitResume() {
        machine.processEvent(ExplorerEvent.PAUSE_REQUESTED);
        status = ExplorationStatus.PAUSED;
        while (pauseRequested.get() && !cancelled()) {
            if (!poller.pause(POLL_INTERVAL_MS)) break;
        }
        if (!cancelled()) {
            status = ExplorationStatus.IN_PROGRESS;
            machine.processEvent(ExplorerEvent.RESUME_REQUESTED);
        }
    }

    private ExplorerEvent terminationEvent() {
        long elapsed = Duration.between(runStartedAt, clock.instant()).toMillis();
        if (elapsed >= config.effectiveDurationMs()) {
            log.info("Time budget of {} ms used up", config.effectiveDurationMs());
            return ExplorerEvent.BUDGET_EXHAUSTED;
        }
        if (config.getGoal() != ExplorationGoal.COMPLETE_COVERAGE) {
            if (state.screenCount() >= config.getMaxScreens()) {
                log.info("Screen budget of {} reached", config.getMaxScreens());
                return ExplorerEvent.BUDGET_EXHAUSTED;
            }
            if (state.getActionsTaken() >= config.getMaxElements()) {
                log.info("Element budget of {} reached", config.getMaxElements());
                return ExplorerEvent.BUDGET_EXHAUSTED;
            }
        }
        if (config.isStopAtTargetCoverage()
                && coverage.hasReachedTargetCoverage(config.getGoal(), config.getTargetCoverage())) {
            log.info("Target coverage reached: {}", coverage.getMetrics().summary());
            return ExplorerEvent.COVERAGE_REACHED;
        }
        return null;
    }

    private void beginNextPass() {
        state.beginPass();
        queueManager.reset();
        verificationRounds = 0;
        Screen current = state.getScreen(state.getCurrentScreenId());
        if (current != null) {
            queueScreen(current);
        }
    }

    // ── Target selection ──────────────────────────────────────────────────

    private ExplorationTarget nextTarget() {
        ExplorationQueue queue = state.queue();
        if (queue.isEmpty()) return null;
        boolean adaptiveRun = config.getStrategy() == ExplorationStrategy.ADAPTIVE;
        TargetSelectors.SelectionContext ctx = new TargetSelectors.SelectionContext(
                state.getCurrentScreenId(),
                id -> {
                    Screen s = state.getScreen(id);
                    return s == null ? 0 : s.getVisitCount();
                },
                this::leadsAway,
                adaptive != null ? adaptive.current() : ExplorationStrategy.SCREEN_FIRST,
                adaptiveRun ? this::learnedTiebreak : null);
        if (preferCurrentScreen) {
            preferCurrentScreen = false;
            return TargetSelectors.select(ExplorationStrategy.SCREEN_FIRST, queue, ctx);
        }
        return TargetSelectors.select(config.getStrategy(), queue, ctx);
    }

    /**
     * Lets the policy choose among taps the active strategy ranks equal, so
     * epsilon-greedy and the confidence bonus order them. Only taps on the
     * current screen can be compared; {@code null} keeps the strategy's pick.
     */
    private ExplorationTarget learnedTiebreak(List<ExplorationTarget> ties) {
        String currentId = state.getCurrentScreenId();
        Screen current = currentId == null ? null : state.getScreen(currentId);
        if (current == null) return null;
        Map<String, ExplorationTarget> byElement = new HashMap<>();
        List<ClickableElement> offered = new ArrayList<>();
        for (ExplorationTarget t : ties) {
            if (t.type() != ExplorationTargetType.TAP_ELEMENT || !currentId.equals(t.screenId())) continue;
            Optional<ClickableElement> element = current.findElement(t.elementId());
            if (element.isPresent() && byElement.putIfAbsent(t.elementId(), t) == null) {
                offered.add(element.get());
            }
        }
        if (offered.size() < 2) return null;
        ClickableElement pick = policy.selectElement(policy.computeScreenHash(current), offered);
        return pick == null ? null : byElement.get(pick.getElementId());
    }

    private boolean leadsAway(ExplorationTarget target) {
        if (target.type() == ExplorationTargetType.NAVIGATE_TO_SCREEN) return true;
        if (target.type() != ExplorationTargetType.TAP_ELEMENT) return false;
        String destination = state.graph().getRealDestination(target.screenId(), target.elementId());
        if (destination != null) {
            return !destination.equals(target.screenId());
        }
        Screen screen = state.getScreen(target.screenId());
        return screen != null && screen.findElement(target.elementId())
                .map(queueManager::isLikelyNavigationElement)
                .orElse(false);
    }

    // ── Processing one target ─────────────────────────────────────────────

    private void process(ExplorationTarget target) {
        String key = target.compositeKey();
        if (target.type() == ExplorationTargetType.TAP_ELEMENT
                && (state.wasTappedThisPass(key) || state.isDangerous(key))) {
            log.debug("Skipping {}: already handled this pass", key);
            return;
        }
        if (!reach(target)) {
            return;
        }
        if (target.type() == ExplorationTargetType.NAVIGATE_TO_SCREEN) {
            log.debug("Reached {} for re-scan", target.screenId());
            return;
        }
        if (isStale(target)) {
            log.debug("Discarding stale target {}", key);
            return;
        }
        Screen screen = state.getScreen(target.screenId());
        if (target.type() == ExplorationTargetType.TAP_ELEMENT) {
            tap(target, screen);
        } else {
            scroll(target, screen);
        }
    }

    /**
     * The element as the device showed it in the last capture, so gestures
     * land where it is now; the known copy when that capture is another screen.
     */
    private ClickableElement onDevice(String screenId, ClickableElement known) {
        if (lastCapture == null || !lastCapture.getScreenId().equals(screenId)) return known;
        return lastCapture.findElement(known.getElementId()).orElse(known);
    }

    private ScrollableContainer onDevice(String screenId, ScrollableContainer known) {
        if (lastCapture == null || !lastCapture.getScreenId().equals(screenId)) return known;
        return lastCapture.findContainer(known.getElementId())
                .filter(c -> c.getBounds() != null)
                .orElse(known);
    }

    /** The element is gone from the live screen the device shows now. */
    private boolean isStale(ExplorationTarget target) {
        if (lastCapture == null || !lastCapture.getScreenId().equals(target.screenId())) return false;
        return target.type() == ExplorationTargetType.TAP_ELEMENT
                ? lastCapture.findElement(target.elementId()).isEmpty()
                : lastCapture.findContainer(target.elementId()).isEmpty();
    }

    private void tap(ExplorationTarget target, Screen screen) {
        Optional<ClickableElement> found = screen.findElement(target.elementId());
        if (found.isEmpty()) return;
        ClickableElement element = found.get();
        String key = target.compositeKey();
        if (policy.isDangerousPattern(element)) {
            log.debug("Not tapping {}: its pattern closed the app before", key);
            state.markDangerous(key);
            return;
        }

        String fromId     = screen.getScreenId();
        String hash       = policy.computeScreenHash(screen);
        String actionKey  = policy.getActionKey(element);
        boolean firstTry  = policy.isFirstVisit(hash, actionKey);
        String previousId = navStack.previous() != null ? navStack.previous().screenId() : null;

        ClickableElement live = onDevice(fromId, element);
        if (!actuator.tap(live.getCenterX(), live.getCenterY())) {
            onGestureFailed(target, element, IssueType.ELEMENT_STUCK, "Tap");
            return;
        }
        state.markVisited(key);
        element.setExplored(true);
        state.incrementActions();
        machine.processEvent(ExplorerEvent.ELEMENT_TAPPED);
        if (calculator.isBottomNavElement(element)) {
            state.markNavTabVisited(PriorityCalculator.navTabId(element));
        }

        Screen after = observe(config.getActionDelayMs());
        if (after == null) {
            onObservationLost(fromId, element);
            return;
        }
        if (!inTarget(after)) {
            onLeftTarget(fromId, element, key, hash, actionKey, isCrash(after));
            return;
        }
        consecutiveRelaunches = 0;

        String toId = after.getScreenId();
        boolean moved = !toId.equals(fromId);
        Arrival arrival = arrive(after, fromId, element.getElementId());

        ActionOutcome outcome;
        int discoveries = 0;
        if (moved) {
            element.setLeadsToScreen(toId);
            if (arrival.blocker()) {
                element.setActionType(ClickableActionType.NAVIGATION);
                outcome = ActionOutcome.NO_CHANGE;
            } else if (arrival.newScreen()) {
                element.setActionType(ClickableActionType.NAVIGATION);
                outcome = ActionOutcome.NEW_SCREEN;
                discoveries = 1;
            } else if (!arrival.newElements().isEmpty()) {
                element.setActionType(ClickableActionType.NAVIGATION);
                outcome = ActionOutcome.NEW_ELEMENTS;
                discoveries = arrival.newElements().size();
            } else if (toId.equals(previousId)) {
                element.setActionType(ClickableActionType.BACK);
                outcome = ActionOutcome.NAVIGATE_BACK;
            } else {
                element.setActionType(ClickableActionType.NAVIGATION);
                outcome = ActionOutcome.NO_CHANGE;
            }
        } else if (!arrival.newElements().isEmpty()) {
            element.setActionType(ClickableActionType.EXPAND_COLLAPSE);
            outcome = ActionOutcome.NEW_ELEMENTS;
            discoveries = arrival.newElements().size();
        } else {
            outcome = ActionOutcome.NO_CHANGE;
            if (config.isNonDestructive() && isToggle(element)) {
                element.setActionType(ClickableActionType.TOGGLE);
                log.debug("Restoring toggle {}", key);
                live = onDevice(fromId, element);
                actuator.tap(live.getCenterX(), live.getCenterY());
                poller.pause(config.getActionDelayMs());
            } else {
                element.setActionType(ClickableActionType.NO_EFFECT);
            }
        }

        policy.setCurrentDepth(navStack.depth());
        String destinationHash = policy.computeScreenHash(arrival.screen());
        double reward = policy.calculateReward(outcome, destinationHash, firstTry);
        policy.updateQ(hash, actionKey, reward, destinationHash);
        log.debug("Tap {} -> {} ({}, reward {})", key, toId, outcome, String.format("%.2f", reward));

        recordProgress(outcome, discoveries);

        if (arrival.blocker()) {
            goBack();
        } else if (moved && arrival.newScreen() && shouldBacktrackFrom(arrival.screen())) {
            goBack();
        }
    }

    private boolean shouldBacktrackFrom(Screen screen) {
        if (navStack.depth() > config.getMaxDepth()) {
            log.info("Depth {} exceeds {}: backing out of {}", navStack.depth(), config.getMaxDepth(),
                    screen.getScreenId());
            return true;
        }
        return config.isBacktrackAfterNewScreen() || queueManager.isEscapableScreen(screen);
    }

    private void scroll(ExplorationTarget target, Screen screen) {
        Optional<ScrollableContainer> found = screen.findContainer(target.elementId());
        if (found.isEmpty() || found.get().isFullyScrolled()) return;
        ScrollableContainer container = found.get();
        String fromId = screen.getScreenId();

        ElementBounds bounds = onDevice(fromId, container).getBounds();
        if (!actuator.scroll(bounds.getCenterX(), bounds.getCenterY(), directionOf(container))) {
            onGestureFailed(target, null, IssueType.SCROLL_FAILED, "Scroll");
            return;
        }
        state.incrementActions();
        int scrolls = container.incrementScrollCount();

        Screen after = observe(config.getScrollDelayMs());
        if (after == null) {
            onObservationLost(fromId, null);
            return;
        }
        if (!inTarget(after)) {
            state.addIssue(fromId, target.elementId(), IssueType.APP_LEFT, "Scrolling left the target", null);
            recordProgress(ActionOutcome.CLOSED_APP, 0);
            relaunchAfterLeaving();
            return;
        }
        consecutiveRelaunches = 0;

        boolean moved = !after.getScreenId().equals(fromId);
        Arrival arrival = arrive(after, fromId, target.elementId());
        if (moved) {
            container.setFullyScrolled(true);
            recordProgress(arrival.newScreen() ? ActionOutcome.NEW_SCREEN : ActionOutcome.NO_CHANGE,
                    arrival.newScreen() ? 1 : 0);
            return;
        }

        List<String> revealed = arrival.newElements();
        if (revealed.isEmpty()) {
            log.debug("Container {} shows nothing new after {} scrolls", container.getElementId(), scrolls);
            container.setFullyScrolled(true);
            recordProgress(ActionOutcome.NO_CHANGE, 0);
            return;
        }
        container.getDiscoveredElements().addAll(revealed);
        if (scrolls < config.getMaxScrollsPerContainer()) {
            state.queue().add(ExplorationTarget.scroll(fromId, container, target.priority()));
        } else {
            container.setFullyScrolled(true);
        }
        recordProgress(ActionOutcome.NEW_ELEMENTS, revealed.size());
    }

    private static Actuator.Direction directionOf(ScrollableContainer container) {
        return container.getDirection() == ScrollDirection.HORIZONTAL ? Actuator.Direction.RIGHT : Actuator.Direction.DOWN;
    }

    private void recordProgress(ActionOutcome outcome, int discoveries) {
        String current = state.getCurrentScreenId();
        if (discoveries > 0) {
            staleness.recordDiscovery(current);
            verificationRounds = 0;
            machine.processEvent(outcome == ActionOutcome.NEW_SCREEN
                    ? ExplorerEvent.NEW_SCREEN_DISCOVERED
                    : ExplorerEvent.NEW_ELEMENTS_FOUND);
        } else {
            staleness.recordNoProgress(current);
            machine.processEvent(ExplorerEvent.NO_PROGRESS_DETECTED);
        }
        if (adaptive != null) {
            adaptive.recordAction(discoveries);
        }
    }

    /** Gesture was not dispatched: retry up to the cap, then give the element up. */
    private void onGestureFailed(ExplorationTarget target, ClickableElement element, IssueType type, String gesture) {
        String key = target.compositeKey();
        int failures = state.recordElementFailure(key);
        if (failures > settings.getMaxElementRetries()) {
            // counts as handled so it is not queued again
            state.markVisited(key);
            if (target.type() == ExplorationTargetType.SCROLL_CONTAINER) {
                state.getScreen(target.screenId()).findContainer(target.elementId())
                        .ifPresent(c -> c.setFullyScrolled(true));
            }
            state.addIssue(target.screenId(), target.elementId(), type,
                    gesture + " failed " + failures + " times", element);
        } else {
            log.warn("{} on {} failed ({} of {}), re-queued", gesture, key, failures, settings.getMaxElementRetries());
            state.queue().add(target.requeued());
        }
    }

    private void onObservationLost(String fromId, ClickableElement element) {
        if (cancelled()) return;
        state.addIssue(fromId, element != null ? element.getElementId() : null, IssueType.TIMEOUT,
                "Screen could not be captured after the action", element);
        staleness.recordNoProgress(fromId);
        machine.processEvent(ExplorerEvent.NO_PROGRESS_DETECTED);
    }

    private void onLeftTarget(String fromId, ClickableElement element, String key, String hash,
                              String actionKey, boolean crashed) {
        ActionOutcome outcome = crashed ? ActionOutcome.CRASH : ActionOutcome.CLOSED_APP;
        element.setActionType(ClickableActionType.CLOSES_APP);
        state.markDangerous(key);
        policy.markPatternDangerous(element);
        policy.updateQ(hash, actionKey, policy.calculateReward(outcome), null);
        state.addIssue(fromId, element.getElementId(), IssueType.DANGEROUS_ELEMENT,
                crashed ? "Tap crashed the target" : "Tap left the target", element);
        recordProgress(outcome, 0);
        relaunchAfterLeaving();
    }

    /**
     * Brings the target back after an action left it.
     *
     * @throws ExplorationException past the consecutive relaunch limit
     */
    private void relaunchAfterLeaving() {
        consecutiveRelaunches++;
        if (consecutiveRelaunches > config.getMaxLaunchRetries()) {
            throw new ExplorationException("Target left " + consecutiveRelaunches
                    + " times in a row; relaunch limit of " + config.getMaxLaunchRetries() + " exceeded");
        }
        if (actuator.pressBack()) {
            Screen back = observe(config.getTransitionWaitMs());
            if (back != null && inTarget(back)) {
                log.info("Back in {} after pressing back", state.getPackageName());
                arrive(back, null, null);
                return;
            }
        }
        Screen home = launchTarget(false);
        if (home != null) {
            navStack.reset();
            arrive(home, null, null);
        }
    }

    private boolean isToggle(ClickableElement element) {
        String cls = element.getClassName().toLowerCase();
        return cls.contains("switch") || cls.contains("checkbox") || cls.contains("togglebutton");
    }

    private boolean isCrash(Screen screen) {
        if (!"android".equals(screen.getPackageName())) return false;
        for (TextElement t : screen.getTextElements()) {
            String text = t.getText().toLowerCase();
            for (String marker : CRASH_TEXT) {
                if (text.contains(marker)) return true;
            }
        }
        return false;
    }

    // ── Arrival ───────────────────────────────────────────────────────────

    /**
     * Registers a captured screen as the current one: records it (and the
     * transition from {@code fromScreenId} if it differs), updates the
     * navigation stack and queues its targets unless it is a blocker.
     */
    private Arrival arrive(Screen captured, String fromScreenId, String viaElementId) {
        String id = captured.getScreenId();
        boolean isNew = !state.isKnownScreen(id);
        List<String> added = state.recordScreen(captured);
        Screen screen = state.getScreen(id);
        lastCapture = captured;

        if (fromScreenId != null && !fromScreenId.equals(id)) {
            state.recordTransition(fromScreenId, viaElementId, id, screen.getActivity());
        }
        state.setCurrentScreenId(id);
        navStack.enter(id, screen.getActivity(), countUnvisited(screen));
        if (isNew) {
            log.info("New screen {} ({}) with {} clickables", id, screen.getActivity(),
                    screen.getClickableElements().size());
        }

        boolean blocker = isBlocker(screen);
        if (!blocker) {
            queueScreen(screen);
        }
        updateCoverage();
        return new Arrival(screen, isNew, added, blocker);
    }

    private QueueResult queueScreen(Screen screen) {
        String id = screen.getScreenId();
        if (queueManager.isScreenQueued(id)) {
            // re-queued below with fresh priorities
            state.queue().removeIf(t -> id.equals(t.screenId()) && t.type() != ExplorationTargetType.NAVIGATE_TO_SCREEN);
        }
        return queueManager.queueScreen(screen, state.queueAppender(), state.getTappedThisPass(),
                config.getMode(), config.getStrategy(), state.getVisitedNavTabs());
    }

    private boolean isBlocker(Screen screen) {
        String id = screen.getScreenId();
        NavigationGraph graph = state.graph();
        boolean blocker = graph.isBlockerScreen(id);
        if (!blocker && !id.equals(state.getHomeScreenId()) && queueManager.isLoginScreen(screen)) {
            graph.markAsBlocker(id);
            blocker = true;
        }
        if (blocker && reportedBlockers.add(id)) {
            state.addIssue(id, null, IssueType.BLOCKER_SCREEN, "Blocker screen " + screen.getActivity(), null);
        }
        return blocker;
    }

    private int countUnvisited(Screen screen) {
        int count = 0;
        for (ClickableElement e : screen.getClickableElements()) {
            if (!state.isVisited(ScreenIdentity.compositeKey(screen.getScreenId(), e.getElementId()))) count++;
        }
        return count;
    }

    private void updateCoverage() {
        coverage.update(state.getScreens(), state.getVisited(), state.getExhaustedScreens());
    }

    // ── Navigation ────────────────────────────────────────────────────────

    /**
     * Makes sure the device shows the target's screen, re-routing if needed.
     * After the re-routing budget for a screen is used up its targets are
     * dropped from the frontier.
     */
    private boolean reach(ExplorationTarget target) {
        String screenId = target.screenId();
        if (screenId.equals(state.getCurrentScreenId())) return true;
        if (navigateTo(screenId)) {
            rerouteFailures.remove(screenId);
            return true;
        }
        if (cancelled()) return false;

        int failures = rerouteFailures.merge(screenId, 1, Integer::sum);
        if (failures >= settings.getMaxRerouteAttempts()) {
            rerouteFailures.remove(screenId);
            abandonBranch(screenId, IssueType.BRANCH_UNREACHABLE,
                    "Screen unreachable after " + failures + " re-routing attempts");
        } else {
            log.debug("Could not reach {} ({} of {}); working on the current screen meanwhile",
                    screenId, failures, settings.getMaxRerouteAttempts());
            state.queue().add(target.requeued());
            preferCurrentScreen = true;
        }
        return false;
    }

    private boolean navigateTo(String screenId) {
        NavigationPath path = state.graph().findOptimalPath(state.getCurrentScreenId(), screenId);
        if (path.found() && followPath(path, screenId)) return true;
        if (backtrackTo(screenId)) return true;
        return probeNavigationTabs(screenId);
    }

    private boolean followPath(NavigationPath path, String destination) {
        log.debug("Following {}-step path to {}", path.length(), destination);
        for (NavigationStep step : path.steps()) {
            if (cancelled() || !step.screenId().equals(state.getCurrentScreenId())) return false;
            Screen at = state.getScreen(step.screenId());
            Optional<ClickableElement> element = at == null ? Optional.empty() : at.findElement(step.elementId());
            if (element.isEmpty() || !tapAndArrive(at.getScreenId(), element.get())) return false;
            if (!step.expectedScreenId().equals(state.getCurrentScreenId())) {
                log.debug("Step {} led to {} instead of {}", step.elementId(), state.getCurrentScreenId(),
                        step.expectedScreenId());
                break;
            }
        }
        return destination.equals(state.getCurrentScreenId());
    }

    /**
     * Presses back down the stack to {@code screenId}, or to the nearest
     * stacked screen with a known path to it and follows that path.
     */
    private boolean backtrackTo(String screenId) {
        List<NavigationStack.Entry> entries = navStack.entries();
        NavigationGraph graph = state.graph();
        int top = entries.size() - 1;
        for (int i = top - 1; i >= 0 && top - i <= MAX_BACKTRACK_PRESSES; i--) {
            String below = entries.get(i).screenId();
            NavigationPath onward = below.equals(screenId) ? null : graph.findOptimalPath(below, screenId);
            if (onward != null && !onward.found()) continue;
            if (!pressBackTo(below, top - i)) return false;
            return onward == null || followPath(onward, screenId);
        }
        return false;
    }

    private boolean pressBackTo(String screenId, int presses) {
        for (int i = 0; i < presses && !cancelled(); i++) {
            if (!goBack()) return false;
            if (screenId.equals(state.getCurrentScreenId())) return true;
        }
        return false;
    }

    /** Taps bottom-navigation tabs of the current screen, then retries a path from wherever that leads. */
    private boolean probeNavigationTabs(String screenId) {
        Screen current = state.getScreen(state.getCurrentScreenId());
        if (current == null) return false;
        List<ClickableElement> tabs = new ArrayList<>();
        for (ClickableElement e : current.getClickableElements()) {
            if (calculator.isBottomNavElement(e) && !queueManager.shouldExcludeFromQueue(e)) tabs.add(e);
        }
        int probes = 0;
        for (ClickableElement tab : tabs) {
            if (probes++ >= MAX_NAV_PROBES || cancelled()) break;
            String from = state.getCurrentScreenId();
            Screen at = state.getScreen(from);
            if (at == null || at.findElement(tab.getElementId()).isEmpty()) continue;
            if (!tapAndArrive(from, tab)) continue;
            state.markNavTabVisited(PriorityCalculator.navTabId(tab));
            if (screenId.equals(state.getCurrentScreenId())) return true;
            NavigationPath path = state.graph().findPath(state.getCurrentScreenId(), screenId);
            if (path.found() && followPath(path, screenId)) return true;
        }
        return false;
    }

    /** Taps a route element and registers where it led; {@code false} if the gesture or observation failed. */
    private boolean tapAndArrive(String fromId, ClickableElement element) {
        ClickableElement live = onDevice(fromId, element);
        if (!actuator.tap(live.getCenterX(), live.getCenterY())) return false;
        Screen after = observe(config.getTransitionWaitMs());
        if (after == null) return false;
        if (!inTarget(after)) {
            state.addIssue(fromId, element.getElementId(), IssueType.APP_LEFT, "Route step left the target", element);
            relaunchAfterLeaving();
            return false;
        }
        arrive(after, fromId, element.getElementId());
        return true;
    }

    /** Presses back and registers the resulting screen. */
    private boolean goBack() {
        String from = state.getCurrentScreenId();
        if (!actuator.pressBack()) {
            state.addIssue(from, null, IssueType.BACK_FAILED, "Back press was not dispatched", null);
            return false;
        }
        Screen after = observe(config.getTransitionWaitMs());
        if (after == null) return false;
        if (!inTarget(after)) {
            state.addIssue(from, null, IssueType.APP_MINIMIZED, "Back press left the target", null);
            relaunchAfterLeaving();
            return false;
        }
        navStack.pop(1);
        arrive(after, null, null);
        return true;
    }

    private void abandonBranch(String screenId, IssueType type, String description) {
        int dropped = state.queue().removeIf(t -> screenId.equals(t.screenId()));
        state.graph().markScreenProblematic(screenId, description);
        state.markExhausted(screenId);
        state.addIssue(screenId, null, type, description + " (" + dropped + " targets dropped)", null);
    }

    // ── Staleness and recovery ────────────────────────────────────────────

    private void recoverFromStall() {
        StalenessTracker.Level level = staleness.level();
        String stuckOn = state.getCurrentScreenId();
        log.info("Run is stale ({}) on {}: {} actions since the last discovery",
                level, stuckOn, staleness.getActionsSinceDiscovery());
        machine.processEvent(ExplorerEvent.STUCK_THRESHOLD_REACHED);

        recoveryContext.begin(stuckOn);
        StuckRecovery.Rung startAt = level == StalenessTracker.Level.RESTART
                ? StuckRecovery.Rung.RESTART_APP
                : StuckRecovery.Rung.SCROLL_CONTAINER;
        StuckRecovery.RecoveryResult result = recovery.recover(recoveryContext, startAt);
        staleness.recoveryAttempted();

        if (result.success()) {
            machine.processEvent(result.rung() == StuckRecovery.Rung.REQUEST_HELP
                    ? ExplorerEvent.USER_HELPED
                    : ExplorerEvent.RECOVERY_SUCCEEDED);
            staleness.recordDiscovery(state.getCurrentScreenId());
        } else if (!cancelled()) {
            abandonBranch(stuckOn, IssueType.RECOVERY_FAILED, "Recovery failed after " + result.attempted());
            machine.processEvent(ExplorerEvent.RECOVERY_FAILED);
        }
    }

    /** Device side of the recovery ladder. */
    private final class EngineRecoveryContext implements StuckRecovery.RecoveryContext {

        private String stuckScreenId;

        void begin(String screenId) {
            this.stuckScreenId = screenId;
        }

        @Override
        public Optional<ScrollableContainer> nearestScrollable() {
            Screen screen = state.getScreen(state.getCurrentScreenId());
            if (screen == null) return Optional.empty();
            ScreenGeometry g = calculator.getGeometry();
            int cx = g.width() / 2;
            int cy = g.height() / 2;
            return screen.getScrollableContainers().stream()
                    .filter(c -> !c.isFullyScrolled() && c.getBounds() != null)
                    .min(Comparator.comparingLong(c -> distanceSq(c, cx, cy)));
        }

        private long distanceSq(ScrollableContainer c, int cx, int cy) {
            long dx = c.getBounds().getCenterX() - cx;
            long dy = c.getBounds().getCenterY() - cy;
            return dx * dx + dy * dy;
        }

        @Override
        public boolean scroll(ScrollableContainer container) {
            ElementBounds bounds = onDevice(state.getCurrentScreenId(), container).getBounds();
            boolean ok = actuator.scroll(bounds.getCenterX(), bounds.getCenterY(), directionOf(container));
            if (ok) container.incrementScrollCount();
            return ok && poller.pause(config.getScrollDelayMs());
        }

        @Override
        public boolean navigateBack() {
            if (!actuator.pressBack()) return false;
            navStack.pop(1);
            return poller.pause(config.getTransitionWaitMs());
        }

        @Override
        public Optional<ClickableElement> unvisitedNavigationEntry() {
            Screen screen = state.getScreen(state.getCurrentScreenId());
            if (screen == null) return Optional.empty();
            return screen.getClickableElements().stream()
                    .filter(e -> !state.isVisited(ScreenIdentity.compositeKey(screen.getScreenId(), e.getElementId())))
                    .filter(e -> !queueManager.shouldExcludeFromQueue(e))
                    .filter(e -> calculator.isBottomNavElement(e) || queueManager.isLikelyNavigationElement(e))
                    .findFirst();
        }

        @Override
        public boolean tap(ClickableElement element) {
            ClickableElement live = onDevice(state.getCurrentScreenId(), element);
            if (!actuator.tap(live.getCenterX(), live.getCenterY())) return false;
            state.markVisited(ScreenIdentity.compositeKey(state.getCurrentScreenId(), element.getElementId()));
            state.incrementActions();
            return poller.pause(config.getTransitionWaitMs());
        }

        @Override
        public boolean restartApp() {
            Screen home;
            try {
                home = launchTarget(true);
            } catch (ExplorationException e) {
                log.warn("Restart during recovery failed: {}", e.getMessage());
                home = null;
            }
            boolean ok = home != null;
            if (ok) {
                navStack.reset();
                arrive(home, null, null);
            }
            policy.recordRestartRecovery(ok, "stuck on " + stuckScreenId);
            return ok;
        }

        @Override
        public boolean requestHelp(String reason) {
            log.info("Requesting help on {}: {}", state.getCurrentScreenId(), reason);
            return helpRequester.requestHelp(state.getCurrentScreenId(), reason,
                    Duration.ofMillis(settings.getHelpWaitMs()));
        }

        @Override
        public boolean madeProgress() {
            Screen screen = captureOrNull();
            if (screen == null) return false;
            if (!inTarget(screen)) {
                log.debug("Recovery step left the target");
                return false;
            }
            Arrival arrival = arrive(screen, null, null);
            return arrival.newScreen()
                    || !arrival.newElements().isEmpty()
                    || !screen.getScreenId().equals(stuckScreenId);
        }

        @Override
        public boolean cancelled() {
            return ExplorationEngine.this.cancelled();
        }
    }

    // ── Verification pass ─────────────────────────────────────────────────

    /**
     * Looks for work the frontier lost: re-scans the current screen,
     * re-queues known screens that still have unvisited elements, and finally
     * queues a trip back to the home screen.
     *
     * @return {@code true} if the frontier has work again
     */
    private boolean verify() {
        if (verificationRounds >= MAX_VERIFICATION_ROUNDS) return false;
        verificationRounds++;
        log.info("Frontier empty: verification round {} of {}", verificationRounds, MAX_VERIFICATION_ROUNDS);

        Screen current = captureOrNull();
        if (current != null && inTarget(current)) {
            arrive(current, null, null);
        }
        if (!state.queue().isEmpty()) return true;

        NavigationGraph graph = state.graph();
        for (Screen screen : new ArrayList<>(state.getScreens())) {
            String id = screen.getScreenId();
            if (state.getExhaustedScreens().contains(id) || graph.isBlockerScreen(id)
                    || graph.isProblematicScreen(id)) {
                continue;
            }
            QueueResult result = queueScreen(screen);
            if (result.totalQueued() == 0) {
                state.markExhausted(id);
            }
        }
        updateCoverage();
        if (!state.queue().isEmpty()) return true;

        String home = state.getHomeScreenId();
        if (home != null && !home.equals(state.getCurrentScreenId())) {
            state.queue().add(ExplorationTarget.navigate(home, 0));
            return true;
        }
        return false;
    }

    // ── Device access ─────────────────────────────────────────────────────

    /**
     * Launches the target, retrying up to the configured limit.
     *
     * @return its first screen, or {@code null} if cancelled
     * @throws ExplorationException if every attempt failed
     */
    private Screen launchTarget(boolean forceRestart) {
        int attempts = Math.max(1, config.getMaxLaunchRetries());
        String pkg = state.getPackageName();
        for (int attempt = 1; attempt <= attempts; attempt++) {
            if (cancelled()) return null;
            if (!actuator.launchApp(pkg, forceRestart || attempt > 1)) {
                log.warn("Launch attempt {}/{} of {} was not dispatched", attempt, attempts, pkg);
                poller.pause(settings.getCaptureBackoffMs() * attempt);
                continue;
            }
            if (!poller.pause(config.getStabilizationWaitMs())) return null;
            Screen screen = captureOrNull();
            if (screen != null && inTarget(screen)) {
                log.info("{} is up on {}", pkg, screen.getScreenId());
                return screen;
            }
            if (cancelled()) return null;
            log.warn("Launch attempt {}/{} did not bring {} to the front", attempt, attempts, pkg);
        }
        throw new ExplorationException("Could not launch " + pkg + " after " + attempts + " attempts");
    }

    /**
     * Waits {@code delayMs}, then samples until two consecutive captures
     * agree or the transition wait runs out.
     *
     * @return the settled screen, or {@code null} if cancelled or capture kept failing
     */
    private Screen observe(long delayMs) {
        if (!poller.pause(delayMs)) return null;
        StabilityPoller.PollResult<Screen> result = poller.pollUntilStable(
                screenProvider::captureCurrentScreen, ExplorationEngine::sameContent,
                config.getTransitionWaitMs(), POLL_INTERVAL_MS);
        if (cancelled()) return null;
        if (result.value() != null) {
            consecutiveCaptureFailures = 0;
            return result.value();
        }
        return captureOrNull();
    }

    static boolean sameContent(Screen a, Screen b) {
        return a.getScreenId().equals(b.getScreenId()) && a.getClickableIds().equals(b.getClickableIds());
    }

    /**
     * One capture with retries and linear backoff.
     *
     * @return {@code null} if every retry failed or the run was cancelled
     * @throws ExplorationException once the provider has failed repeatedly
     */
    private Screen captureOrNull() {
        int retries = Math.max(1, settings.getCaptureRetries());
        CaptureException last = null;
        for (int attempt = 1; attempt <= retries; attempt++) {
            if (cancelled()) return null;
            try {
                Screen screen = screenProvider.captureCurrentScreen();
                consecutiveCaptureFailures = 0;
                return screen;
            } catch (CaptureException e) {
                last = e;
                log.warn("Capture attempt {}/{} failed: {}", attempt, retries, e.getMessage());
                if (!poller.pause(settings.getCaptureBackoffMs() * attempt)) return null;
            }
        }
        consecutiveCaptureFailures++;
        if (consecutiveCaptureFailures >= retries) {
            throw new ExplorationException("Screen provider unavailable after "
                    + consecutiveCaptureFailures + " failed captures", last);
        }
        return null;
    }

    private boolean inTarget(Screen screen) {
        return state.getPackageName().equals(screen.getPackageName());
    }

    private boolean cancelled() {
        return stopRequested.get() || Thread.currentThread().isInterrupted();
    }

    // ── Feedback, status and result ───────────────────────────────────────

    private void applyPendingFeedback() {
        Feedback feedback;
        while ((feedback = pendingFeedback.poll()) != null) {
            Screen screen = state.getScreen(feedback.screenId());
            if (screen == null) {
                log.warn("Feedback for unknown screen {} ignored", feedback.screenId());
                continue;
            }
            Optional<ClickableElement> element = screen.findElement(feedback.elementId());
            if (element.isEmpty()) {
                log.warn("Feedback for unknown element {} on {} ignored", feedback.elementId(), feedback.screenId());
                continue;
            }
            policy.recordHumanFeedback(policy.computeScreenHash(screen), policy.getActionKey(element.get()),
                    feedback.signal());
        }
    }

    private StatusEvent.Progress progress() {
        ExplorationState s = state;
        if (s == null) {
            return new StatusEvent.Progress(0, 0, 0, status);
        }
        return new StatusEvent.Progress(s.screenCount(), s.getVisited().size(), s.frontierSize(), status);
    }

    private void publishProgress(String message) {
        try {
            statusSink.publish(StatusEvent.progress(clock.instant(), progress(), message));
        } catch (RuntimeException e) {
            log.warn("Status sink failed: {}", e.getMessage());
        }
    }

    private ExplorationResult buildResult(ExplorationStatus outcome, String error) {
        ExplorationResult result = new ExplorationResult();
        result.setPackageName(state.getPackageName());
        result.setStatus(outcome);
        result.setPassNumber(state.getPassNumber());
        result.setStartTime(state.getStartTime());
        result.setEndTime(clock.instant());
        result.setScreens(new ArrayList<>(state.getScreens()));
        result.setTransitions(new ArrayList<>(state.getTransitions()));
        result.setCoverage(coverage.getMetrics());
        result.setIssues(new ArrayList<>(state.getIssues()));
        result.setPolicyInsights(policy.toInsights());
        result.setErrorMessage(error);
        return result;
    }

    // ── Test hooks ────────────────────────────────────────────────────────

    ExplorationState state() {
        return state;
    }

    ExplorationStateMachine machine() {
        return machine;
    }
}
