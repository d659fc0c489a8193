package autoexplore.explorer;

import autoexplore.device.HelpRequester;
import autoexplore.explorer.ExplorationStateMachine.ExplorerState;
import autoexplore.explorer.FakeDevice.Widget;
import autoexplore.learning.InMemoryPolicyStore;
import autoexplore.learning.QLearningPolicy;
import autoexplore.model.ClickableActionType;
import autoexplore.model.ExplorationIssue;
import autoexplore.model.ExplorationResult;
import autoexplore.model.ExplorationStatus;
import autoexplore.model.ExplorationStrategy;
import autoexplore.model.IssueType;
import autoexplore.model.Screen;
import autoexplore.model.ScreenIdentity;
import autoexplore.model.ScreenTransition;
import autoexplore.status.StatusEvent;
import autoexplore.status.StatusSink;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

public class ExplorationEngineTest {

    private static final String MAIN    = "com.shop.MainActivity";
    private static final String CATALOG = "com.shop.CatalogActivity";
    private static final String CART    = "com.shop.CartActivity";

    private static final Widget OPEN_CATALOG = new Widget("open_catalog", "Catalog", 800, CATALOG);
    private static final Widget OPEN_CART    = new Widget("open_cart", "Cart", 1100, CART);
    private static final Widget ITEM         = new Widget("item_one", "Item one", 700, null);
    private static final Widget CHECKOUT     = new Widget("checkout", "Checkout", 900, null);

    private ManualClock clock;
    private QLearningPolicy policy;
    private List<StatusEvent> events;

    @BeforeMethod
    public void setUp() {
        clock  = new ManualClock();
        policy = new QLearningPolicy(new InMemoryPolicyStore());
        events = new ArrayList<>();
    }

    private static FakeDevice shop() {
        return new FakeDevice(MAIN)
                .screen(MAIN, OPEN_CATALOG, OPEN_CART)
                .screen(CATALOG, ITEM)
                .screen(CART, CHECKOUT);
    }

    private ExplorationEngine engine(FakeDevice device, Executor executor) {
        return new ExplorationEngine(device, device, policy, events::add, HelpRequester.NONE, null,
                new ExplorerConfig(new Properties()), clock, clock::advanceMillis, executor, new StuckRecovery());
    }

    private ExplorationEngine engine(FakeDevice device) {
        return engine(device, Runnable::run);
    }

    private ExplorationEngine engine(FakeDevice device, StatusSink sink, StabilityPoller.Sleeper sleeper) {
        return new ExplorationEngine(device, device, policy, sink, HelpRequester.NONE, null,
                new ExplorerConfig(new Properties()), clock, sleeper, Runnable::run, new StuckRecovery());
    }

    private static ExplorationConfig keepGoing() {
        return ExplorationConfig.builder().stopAtTargetCoverage(false).build();
    }

    private static String key(String activity, Widget widget) {
        return ScreenIdentity.compositeKey(FakeDevice.screenId(activity), widget.elementId());
    }

    // ── Complete runs ─────────────────────────────────────────────────────

    @Test(description = "Maps every screen of a small app and activates each element exactly once")
    public void start_smallApp_exploresEverythingOnce() {
        ExplorationEngine engine = engine(shop());

        ExplorationResult result = engine.start(FakeDevice.PKG, ExplorationConfig.defaults()).join();

        assertThat(result.getStatus()).isEqualTo(ExplorationStatus.COMPLETED);
        assertThat(engine.getLifecycleState()).isEqualTo(ExplorerState.COMPLETED);
        assertThat(engine.getLastResult()).isSameAs(result);
        assertThat(result.getScreens()).extracting(Screen::getActivity).containsExactlyInAnyOrder(MAIN, CATALOG, CART);
        assertThat(engine.state().getVisited()).containsExactlyInAnyOrder(
                key(MAIN, OPEN_CATALOG), key(MAIN, OPEN_CART), key(CATALOG, ITEM), key(CART, CHECKOUT));
        assertThat(engine.state().getActionsTaken()).isEqualTo(4);
        assertThat(result.getIssues()).isEmpty();
    }

    @Test(description = "An adaptive run rotating its strategies still covers the app")
    public void start_adaptiveStrategy_exploresEverything() {
        ExplorationEngine engine = engine(shop());
        ExplorationConfig config = ExplorationConfig.builder().strategy(ExplorationStrategy.ADAPTIVE).build();

        ExplorationResult result = engine.start(FakeDevice.PKG, config).join();

        assertThat(result.getStatus()).isEqualTo(ExplorationStatus.COMPLETED);
        assertThat(engine.state().getVisited()).containsExactlyInAnyOrder(
                key(MAIN, OPEN_CATALOG), key(MAIN, OPEN_CART), key(CATALOG, ITEM), key(CART, CHECKOUT));
    }

    @Test
    public void start_smallApp_recordsTransitionsAndOutcomes() {
        ExplorationEngine engine = engine(shop());

        ExplorationResult result = engine.start(FakeDevice.PKG, ExplorationConfig.defaults()).join();

        String home = FakeDevice.screenId(MAIN);
        assertThat(result.getTransitions())
                .extracting(ScreenTransition::fromScreenId, ScreenTransition::toScreenId,
                        ScreenTransition::triggerElementId)
                .contains(tuple(home, FakeDevice.screenId(CATALOG), OPEN_CATALOG.elementId()),
                          tuple(home, FakeDevice.screenId(CART), OPEN_CART.elementId()));

        Screen homeScreen = engine.state().getScreen(home);
        assertThat(homeScreen.findElement(OPEN_CATALOG.elementId()).orElseThrow().getActionType())
                .isEqualTo(ClickableActionType.NAVIGATION);
        Screen catalog = engine.state().getScreen(FakeDevice.screenId(CATALOG));
        assertThat(catalog.findElement(ITEM.elementId()).orElseThrow().getActionType())
                .isEqualTo(ClickableActionType.NO_EFFECT);
        assertThat(result.getPolicyInsights()).isNotNull();
    }

    @Test
    public void start_publishesLifecycleAndFinalProgress() {
        ExplorationEngine engine = engine(shop());

        engine.start(FakeDevice.PKG, ExplorationConfig.defaults()).join();

        StatusEvent first = events.get(0);
        assertThat(first.isTransition()).isTrue();
        assertThat(first.oldState()).isEqualTo(ExplorerState.IDLE);
        assertThat(first.newState()).isEqualTo(ExplorerState.INITIALIZING);

        StatusEvent last = events.get(events.size() - 1);
        assertThat(last.isTransition()).isFalse();
        assertThat(last.message()).startsWith("finished");
        assertThat(last.screensExplored()).isEqualTo(3);
        assertThat(events).filteredOn(StatusEvent::isTransition)
                .extracting(StatusEvent::newState)
                .contains(ExplorerState.EXPLORING, ExplorerState.COMPLETING, ExplorerState.COMPLETED);
    }

    @Test(description = "A second pass keeps everything visited before")
    public void startAnotherPass_visitedSetNeverShrinks() {
        ExplorationEngine engine = engine(shop());
        engine.start(FakeDevice.PKG, ExplorationConfig.defaults()).join();
        Set<String> afterFirst = new HashSet<>(engine.state().getVisited());

        ExplorationResult second = engine.startAnotherPass().join();

        assertThat(second.getStatus()).isEqualTo(ExplorationStatus.COMPLETED);
        assertThat(second.getPassNumber()).isEqualTo(2);
        assertThat(engine.state().getVisited()).containsAll(afterFirst);
        assertThat(second.getScreens()).hasSize(3);
    }

    @Test
    public void startAnotherPass_withoutPreviousRun_throws() {
        assertThatThrownBy(() -> engine(shop()).startAnotherPass())
                .isInstanceOf(ExplorationException.class);
    }

    // ── Budgets ───────────────────────────────────────────────────────────

    @Test
    public void start_screenBudgetOfOne_endsAfterLaunch() {
        ExplorationEngine engine = engine(shop());

        ExplorationResult result = engine.start(FakeDevice.PKG,
                ExplorationConfig.builder().maxScreens(1).build()).join();

        assertThat(result.getStatus()).isEqualTo(ExplorationStatus.COMPLETED);
        assertThat(engine.state().getActionsTaken()).isZero();
        assertThat(result.getScreens()).hasSize(1);
    }

    @Test
    public void start_timeBudgetUsedByLaunch_endsBeforeAnyAction() {
        ExplorationEngine engine = engine(shop());

        ExplorationResult result = engine.start(FakeDevice.PKG,
                ExplorationConfig.builder().maxDurationMs(1_000).build()).join();

        assertThat(result.getStatus()).isEqualTo(ExplorationStatus.COMPLETED);
        assertThat(engine.state().getActionsTaken()).isZero();
    }

    // ── Moving layouts ────────────────────────────────────────────────────

    @Test(description = "Taps land where an element is now, not where it was first seen")
    public void tap_layoutShiftedAfterBack_hitsElementAtItsNewPosition() {
        Widget openCatalog = new Widget("open_catalog", "Catalog", 800, CATALOG);
        Widget buy = new Widget("buy", "Buy", 1100, CART);
        FakeDevice device = new FakeDevice(MAIN)
                .screen(MAIN, openCatalog, buy)
                .screen(CATALOG, ITEM)
                .screen(CART, CHECKOUT)
                .relayoutOnReturn(MAIN,
                        new Widget("banner", "Summer sale", 800, null),
                        new Widget("open_catalog", "Catalog", 1100, CATALOG),
                        new Widget("buy", "Buy", 1400, CART));
        ExplorationEngine engine = engine(device);

        ExplorationResult result = engine.start(FakeDevice.PKG,
                ExplorationConfig.builder().strategy(ExplorationStrategy.SYSTEMATIC).build()).join();

        assertThat(result.getStatus()).isEqualTo(ExplorationStatus.COMPLETED);
        assertThat(device.taps).startsWith(MAIN + "/open_catalog").contains(MAIN + "/buy");
        assertThat(engine.state().isVisited(key(MAIN, buy))).isTrue();
        assertThat(result.getTransitions())
                .filteredOn(t -> buy.elementId().equals(t.triggerElementId()))
                .isNotEmpty()
                .extracting(ScreenTransition::toScreenId)
                .containsOnly(FakeDevice.screenId(CART));
        Screen home = engine.state().getScreen(FakeDevice.screenId(MAIN));
        assertThat(home.findElement(buy.elementId()).orElseThrow().getBounds().getY()).isEqualTo(1400);
    }

    // ── Leaving the target ────────────────────────────────────────────────

    @Test(description = "An element that opens another app is reported, marked dangerous and the app is brought back")
    public void tap_leavesApp_marksElementDangerous() {
        Widget website = new Widget("open_browser", "Website", 1400, "browser");
        FakeDevice device = new FakeDevice(MAIN)
                .screen(MAIN, OPEN_CATALOG, website)
                .screen(CATALOG, ITEM)
                .foreignScreen("browser", () -> new Screen("com.android.chrome", "org.chromium.ChromeTabbedActivity"));
        ExplorationEngine engine = engine(device);

        ExplorationResult result = engine.start(FakeDevice.PKG, ExplorationConfig.defaults()).join();

        assertThat(result.getStatus()).isEqualTo(ExplorationStatus.COMPLETED);
        assertThat(engine.state().isDangerous(key(MAIN, website))).isTrue();
        assertThat(result.getIssues())
                .extracting(ExplorationIssue::getType, ExplorationIssue::getElementId)
                .contains(tuple(IssueType.DANGEROUS_ELEMENT, website.elementId()));
        Screen home = engine.state().getScreen(FakeDevice.screenId(MAIN));
        assertThat(home.findElement(website.elementId()).orElseThrow().getActionType())
                .isEqualTo(ClickableActionType.CLOSES_APP);
        assertThat(policy.getDangerousPatterns()).hasSize(1);
        assertThat(engine.state().isVisited(key(CATALOG, ITEM))).isTrue();
    }

    @Test
    public void tap_crashDialog_reportedAsCrash() {
        Widget orders = new Widget("open_orders", "Orders", 1400, "crash");
        FakeDevice device = new FakeDevice(MAIN)
                .screen(MAIN, orders)
                .foreignScreen("crash", FakeDevice::crashDialog);
        ExplorationEngine engine = engine(device);

        ExplorationResult result = engine.start(FakeDevice.PKG, ExplorationConfig.defaults()).join();

        assertThat(result.getIssues())
                .filteredOn(i -> i.getType() == IssueType.DANGEROUS_ELEMENT)
                .singleElement()
                .extracting(ExplorationIssue::getDescription)
                .isEqualTo("Tap crashed the target");
    }

    // ── Failures and control ──────────────────────────────────────────────

    @Test(description = "A target that never launches ends the run with an error, not an exception")
    public void start_launchFails_endsWithError() {
        FakeDevice device = shop();
        device.launchable = false;
        ExplorationEngine engine = engine(device);

        ExplorationResult result = engine.start(FakeDevice.PKG, ExplorationConfig.defaults()).join();

        assertThat(result.getStatus()).isEqualTo(ExplorationStatus.ERROR);
        assertThat(result.getErrorMessage()).contains("Could not launch");
        assertThat(device.launches).isEqualTo(3);
        assertThat(engine.getLifecycleState()).isEqualTo(ExplorerState.COMPLETED);
    }

    @Test(description = "A screen provider that keeps failing ends the run with an error")
    public void captureKeepsFailing_endsWithError() {
        Widget sync = new Widget("sync", "Sync", 1400, FakeDevice.BLACKOUT);
        FakeDevice device = new FakeDevice(MAIN)
                .screen(MAIN, OPEN_CATALOG, sync)
                .screen(CATALOG, ITEM);
        ExplorationEngine engine = engine(device);

        ExplorationResult result = engine.start(FakeDevice.PKG, ExplorationConfig.defaults()).join();

        assertThat(result.getStatus()).isEqualTo(ExplorationStatus.ERROR);
        assertThat(result.getErrorMessage()).contains("Screen provider unavailable");
        assertThat(engine.getStatus()).isEqualTo(ExplorationStatus.ERROR);
        assertThat(device.taps).contains(MAIN + "/sync");
        assertThat(result.getScreens()).isNotEmpty();
    }

    @Test(description = "A tap the device never dispatches is retried twice, then reported and given up")
    public void tapNotDispatched_requeuedUpToCapThenReported() {
        Widget filter = new Widget("filter", "Filter", 1400, null);
        FakeDevice device = new FakeDevice(MAIN)
                .screen(MAIN, OPEN_CATALOG, filter)
                .screen(CATALOG, ITEM);
        device.refused.add("filter");
        ExplorationEngine engine = engine(device);

        ExplorationResult result = engine.start(FakeDevice.PKG, keepGoing()).join();

        assertThat(result.getStatus()).isEqualTo(ExplorationStatus.COMPLETED);
        assertThat(device.refusedTaps).containsExactly(MAIN + "/filter", MAIN + "/filter", MAIN + "/filter");
        assertThat(result.getIssues())
                .filteredOn(i -> i.getType() == IssueType.ELEMENT_STUCK)
                .singleElement()
                .satisfies(i -> {
                    assertThat(i.getElementId()).isEqualTo(filter.elementId());
                    assertThat(i.getDescription()).isEqualTo("Tap failed 3 times");
                });
        assertThat(engine.state().isVisited(key(MAIN, filter))).isTrue();
        assertThat(engine.state().isVisited(key(CATALOG, ITEM))).isTrue();
    }

    @Test(description = "A login wall is reported once, backed out of and never explored or routed to")
    public void loginScreen_treatedAsBlocker() {
        String login = "com.shop.LoginActivity";
        Widget account = new Widget("open_account", "Account", 1100, login);
        Widget signIn = new Widget("sign_in", "Sign in", 900, MAIN);
        FakeDevice device = new FakeDevice(MAIN)
                .screen(MAIN, OPEN_CATALOG, account)
                .screen(CATALOG, ITEM)
                .screen(login, signIn);
        ExplorationEngine engine = engine(device);

        ExplorationResult result = engine.start(FakeDevice.PKG, keepGoing()).join();

        String loginId = FakeDevice.screenId(login);
        assertThat(result.getStatus()).isEqualTo(ExplorationStatus.COMPLETED);
        assertThat(result.getIssues())
                .filteredOn(i -> i.getType() == IssueType.BLOCKER_SCREEN)
                .extracting(ExplorationIssue::getScreenId)
                .containsExactly(loginId);
        assertThat(engine.state().graph().isBlockerScreen(loginId)).isTrue();
        assertThat(engine.state().graph()
                .getElementNavigation(FakeDevice.screenId(MAIN), account.elementId())
                .getBlockerDestinations()).containsExactly(loginId);
        assertThat(engine.state().isVisited(key(login, signIn))).isFalse();
        assertThat(device.taps).noneMatch(t -> t.startsWith(login));
        assertThat(device.taps).filteredOn((MAIN + "/open_account")::equals).hasSize(1);
        assertThat(engine.state().isVisited(key(CATALOG, ITEM))).isTrue();
    }

    @Test(description = "A screen that cannot be reached three times in a row is dropped with its targets")
    public void unreachableScreen_abandonedAfterThreeReroutes() {
        String promo = "com.shop.PromoActivity";
        Widget openPromo = new Widget("open_promo", "Offers", 800, promo);
        Widget claim = new Widget("claim", "Claim", 900, null);
        FakeDevice device = new FakeDevice(MAIN)
                .screen(MAIN, openPromo)
                .screen(promo, claim)
                .relayoutOnReturn(MAIN);
        ExplorationEngine engine = engine(device);

        ExplorationResult result = engine.start(FakeDevice.PKG, keepGoing()).join();

        String promoId = FakeDevice.screenId(promo);
        assertThat(result.getStatus()).isEqualTo(ExplorationStatus.COMPLETED);
        assertThat(result.getIssues())
                .filteredOn(i -> i.getType() == IssueType.BRANCH_UNREACHABLE)
                .singleElement()
                .satisfies(i -> {
                    assertThat(i.getScreenId()).isEqualTo(promoId);
                    assertThat(i.getDescription()).startsWith("Screen unreachable after 3 re-routing attempts");
                });
        assertThat(engine.state().isVisited(key(promo, claim))).isFalse();
        assertThat(engine.state().graph().isProblematicScreen(promoId)).isTrue();
        assertThat(engine.state().getExhaustedScreens()).contains(promoId);
        assertThat(device.taps).containsExactly(MAIN + "/open_promo");
    }

    @Test(description = "A stall the whole ladder cannot fix abandons the branch and the run still completes")
    public void stuckWithoutRemedy_abandonsBranch() {
        FakeDevice device = new FakeDevice(MAIN).screen(MAIN,
                new Widget("swatch_red", "Red", 300, null),
                new Widget("swatch_blue", "Blue", 500, null),
                new Widget("swatch_green", "Green", 700, null),
                new Widget("swatch_black", "Black", 900, null),
                new Widget("swatch_white", "White", 1100, null),
                new Widget("swatch_grey", "Grey", 1300, null));
        ExplorationEngine engine = engine(device, event -> {
            events.add(event);
            if (event.message() != null && event.message().startsWith("initialized")) device.launchable = false;
        }, clock::advanceMillis);

        ExplorationResult result = engine.start(FakeDevice.PKG, keepGoing()).join();

        String home = FakeDevice.screenId(MAIN);
        assertThat(result.getStatus()).isEqualTo(ExplorationStatus.COMPLETED);
        assertThat(engine.state().getActionsTaken()).isEqualTo(5);
        assertThat(engine.state().getVisited()).hasSize(5);
        assertThat(result.getIssues())
                .filteredOn(i -> i.getType() == IssueType.RECOVERY_FAILED)
                .singleElement()
                .satisfies(i -> {
                    assertThat(i.getScreenId()).isEqualTo(home);
                    assertThat(i.getDescription()).startsWith("Recovery failed after");
                });
        assertThat(engine.state().graph().isProblematicScreen(home)).isTrue();
        assertThat(engine.getRecoveryStatistics().episodes()).isEqualTo(1);
        assertThat(device.launches).isEqualTo(4);
        assertThat(events).filteredOn(StatusEvent::isTransition)
                .extracting(StatusEvent::newState)
                .contains(ExplorerState.STUCK);
    }

    @Test(description = "The verification pass gives up after two rounds even if it keeps finding work")
    public void verification_boundedToTwoRounds() {
        FakeDevice device = new FakeDevice(MAIN)
                .screen(MAIN, OPEN_CATALOG)
                .screen(CATALOG, ITEM);
        device.backWorks = false;
        ExplorationEngine engine = engine(device);

        ExplorationResult result = engine.start(FakeDevice.PKG,
                keepGoing().toBuilder().backtrackAfterNewScreen(false).build()).join();

        assertThat(result.getStatus()).isEqualTo(ExplorationStatus.COMPLETED);
        assertThat(engine.getLifecycleState()).isEqualTo(ExplorerState.COMPLETED);
        assertThat(engine.state().getVisited()).containsExactlyInAnyOrder(key(MAIN, OPEN_CATALOG), key(CATALOG, ITEM));
        assertThat(result.getIssues())
                .filteredOn(i -> i.getType() == IssueType.BRANCH_UNREACHABLE)
                .extracting(ExplorationIssue::getScreenId)
                .containsExactly(FakeDevice.screenId(MAIN), FakeDevice.screenId(MAIN));
    }

    @Test
    public void start_whileRunning_throws() {
        List<Runnable> parked = new ArrayList<>();
        ExplorationEngine engine = engine(shop(), parked::add);

        CompletableFuture<ExplorationResult> run = engine.start(FakeDevice.PKG, ExplorationConfig.defaults());

        assertThat(engine.isRunning()).isTrue();
        assertThatThrownBy(() -> engine.start(FakeDevice.PKG, ExplorationConfig.defaults()))
                .isInstanceOf(ExplorationException.class);

        parked.forEach(Runnable::run);
        assertThat(run.join().getStatus()).isEqualTo(ExplorationStatus.COMPLETED);
        assertThat(engine.isRunning()).isFalse();
    }

    @Test
    public void stop_afterInitialization_endsStoppedWithPartialResult() {
        FakeDevice device = shop();
        ExplorationEngine[] holder = new ExplorationEngine[1];
        ExplorationEngine engine = new ExplorationEngine(device, device, policy, event -> {
            if (event.message() != null && event.message().startsWith("initialized")) holder[0].stop();
        }, HelpRequester.NONE, null, new ExplorerConfig(new Properties()), clock, clock::advanceMillis,
                Runnable::run, new StuckRecovery());
        holder[0] = engine;

        ExplorationResult result = engine.start(FakeDevice.PKG, ExplorationConfig.defaults()).join();

        assertThat(result.getStatus()).isEqualTo(ExplorationStatus.STOPPED);
        assertThat(result.getScreens()).hasSize(1);
        assertThat(device.taps).isEmpty();
        assertThat(engine.getStatus()).isEqualTo(ExplorationStatus.STOPPED);
    }

    @Test(description = "A paused run waits without acting and picks up where it left off")
    public void pause_thenResume_continuesRun() {
        FakeDevice device = shop();
        ExplorationEngine[] holder = new ExplorationEngine[1];
        List<Integer> tapsWhilePaused = new ArrayList<>();
        holder[0] = engine(device, event -> {
            events.add(event);
            if (event.message() != null && event.message().startsWith("initialized")) holder[0].pause();
        }, millis -> {
            clock.advanceMillis(millis);
            if (holder[0].getStatus() == ExplorationStatus.PAUSED) {
                tapsWhilePaused.add(device.taps.size());
                holder[0].resume();
            }
        });

        ExplorationResult result = holder[0].start(FakeDevice.PKG, ExplorationConfig.defaults()).join();

        assertThat(tapsWhilePaused).isNotEmpty().containsOnly(0);
        assertThat(result.getStatus()).isEqualTo(ExplorationStatus.COMPLETED);
        assertThat(holder[0].state().getVisited()).hasSize(4);
        assertThat(events).filteredOn(StatusEvent::isTransition)
                .extracting(StatusEvent::oldState, StatusEvent::newState)
                .containsSubsequence(tuple(ExplorerState.EXPLORING, ExplorerState.PAUSED),
                                     tuple(ExplorerState.PAUSED, ExplorerState.EXPLORING));
    }

    @Test
    public void recordHumanFeedback_whenIdle_appliedImmediately() {
        ExplorationEngine engine = engine(shop());
        engine.start(FakeDevice.PKG, ExplorationConfig.defaults()).join();
        Screen home = engine.state().getScreen(FakeDevice.screenId(MAIN));
        String hash = policy.computeScreenHash(home);
        String action = policy.getActionKey(home.findElement(OPEN_CART.elementId()).orElseThrow());

        engine.recordHumanFeedback(home.getScreenId(), OPEN_CART.elementId(), false);

        assertThat(policy.getHumanFeedback(hash, action)).isEqualTo(-1);
        assertThat(policy.isVetoedAction(hash, action)).isTrue();
    }

    @Test
    public void sameContent_comparesIdAndClickables() throws Exception {
        Screen a = new FakeDevice(MAIN).screen(MAIN, OPEN_CATALOG).captureCurrentScreen();
        Screen b = new FakeDevice(MAIN).screen(MAIN, OPEN_CATALOG).captureCurrentScreen();
        Screen c = new FakeDevice(MAIN).screen(MAIN, OPEN_CATALOG, OPEN_CART).captureCurrentScreen();

        assertThat(ExplorationEngine.sameContent(a, b)).isTrue();
        assertThat(ExplorationEngine.sameContent(a, c)).isFalse();
    }
}
