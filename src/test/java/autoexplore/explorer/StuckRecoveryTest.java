package autoexplore.explorer;

import autoexplore.explorer.StuckRecovery.RecoveryContext;
import autoexplore.explorer.StuckRecovery.RecoveryResult;
import autoexplore.explorer.StuckRecovery.Rung;
import autoexplore.model.ClickableElement;
import autoexplore.model.ElementBounds;
import autoexplore.model.ScrollDirection;
import autoexplore.model.ScrollableContainer;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class StuckRecoveryTest {

    @Mock private RecoveryContext ctx;

    private AutoCloseable mocks;
    private StuckRecovery recovery;
    private ScrollableContainer feed;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        recovery = new StuckRecovery();
        feed = new ScrollableContainer("com.app:id/feed", "RecyclerView",
                new ElementBounds(0, 400, 1080, 1600), ScrollDirection.VERTICAL);
    }

    @AfterMethod
    public void tearDown() throws Exception {
        mocks.close();
    }

    @Test
    public void scrollRung_withProgress_stopsLadder() {
        when(ctx.nearestScrollable()).thenReturn(Optional.of(feed));
        when(ctx.scroll(feed)).thenReturn(true);
        when(ctx.madeProgress()).thenReturn(true);

        RecoveryResult result = recovery.recover(ctx);

        assertThat(result.success()).isTrue();
        assertThat(result.rung()).isEqualTo(Rung.SCROLL_CONTAINER);
        assertThat(result.attempted()).containsExactly(Rung.SCROLL_CONTAINER);
        verify(ctx, never()).navigateBack();
    }

    @Test(description = "Each rung is tried once, in order, until one works")
    public void escalatesToRestart() {
        when(ctx.navigateBack()).thenReturn(false);
        when(ctx.restartApp()).thenReturn(true);

        RecoveryResult result = recovery.recover(ctx);

        assertThat(result.success()).isTrue();
        assertThat(result.rung()).isEqualTo(Rung.RESTART_APP);
        assertThat(result.attempted()).containsExactly(
                Rung.SCROLL_CONTAINER, Rung.NAVIGATE_BACK, Rung.TAP_NAVIGATION, Rung.RESTART_APP);
        verify(ctx, never()).requestHelp(anyString());
    }

    @Test
    public void dispatchedGestureWithoutProgress_escalates() {
        ClickableElement tab = new ClickableElement("com.app:id/tab_search", "Search", null,
                "android.widget.FrameLayout", new ElementBounds(300, 2250, 200, 100));
        when(ctx.navigateBack()).thenReturn(true);
        when(ctx.unvisitedNavigationEntry()).thenReturn(Optional.of(tab));
        when(ctx.tap(tab)).thenReturn(true);
        when(ctx.madeProgress()).thenReturn(false, true);

        RecoveryResult result = recovery.recover(ctx);

        assertThat(result.rung()).isEqualTo(Rung.TAP_NAVIGATION);
        assertThat(result.tried(Rung.NAVIGATE_BACK)).isTrue();
        assertThat(result.tried(Rung.RESTART_APP)).isFalse();
    }

    @Test
    public void allRungsFail_reportsFailure() {
        RecoveryResult result = recovery.recover(ctx);

        assertThat(result.success()).isFalse();
        assertThat(result.rung()).isEqualTo(Rung.REQUEST_HELP);
        assertThat(result.attempted()).hasSize(Rung.values().length);
        verify(ctx).requestHelp(anyString());
    }

    @Test
    public void startAtRestart_skipsGentleRungs() {
        when(ctx.requestHelp(anyString())).thenReturn(true);
        when(ctx.madeProgress()).thenReturn(true);

        RecoveryResult result = recovery.recover(ctx, Rung.RESTART_APP);

        assertThat(result.attempted()).containsExactly(Rung.RESTART_APP, Rung.REQUEST_HELP);
        assertThat(result.rung()).isEqualTo(Rung.REQUEST_HELP);
        verify(ctx, never()).nearestScrollable();
    }

    @Test
    public void cancelled_triesNothing() {
        when(ctx.cancelled()).thenReturn(true);

        RecoveryResult result = recovery.recover(ctx);

        assertThat(result.success()).isFalse();
        assertThat(result.attempted()).isEmpty();
        verify(ctx, never()).restartApp();
    }

    @Test
    public void throwingRung_countsAsFailed() {
        when(ctx.nearestScrollable()).thenThrow(new IllegalStateException("no screen"));
        when(ctx.navigateBack()).thenReturn(true);
        when(ctx.madeProgress()).thenReturn(true);

        RecoveryResult result = recovery.recover(ctx);

        assertThat(result.rung()).isEqualTo(Rung.NAVIGATE_BACK);
        assertThat(result.attempted()).containsExactly(Rung.SCROLL_CONTAINER, Rung.NAVIGATE_BACK);
    }

    @Test(description = "A fatal device error aborts the ladder instead of counting as a failed rung")
    public void fatalDeviceError_propagates() {
        when(ctx.navigateBack()).thenReturn(true);
        when(ctx.madeProgress()).thenThrow(new ExplorationException("screen capture failed 3 times"));

        assertThatThrownBy(() -> recovery.recover(ctx))
                .isInstanceOf(ExplorationException.class)
                .hasMessageContaining("capture");
        verify(ctx, never()).restartApp();
        verify(ctx, never()).requestHelp(anyString());
    }

    @Test
    public void statistics_andRecommendation() {
        Map<Rung, StuckRecovery.RecoveryStep> table = new EnumMap<>(Rung.class);
        table.put(Rung.SCROLL_CONTAINER, c -> false);
        table.put(Rung.NAVIGATE_BACK, c -> true);
        StuckRecovery custom = new StuckRecovery(table);

        for (int i = 0; i < 3; i++) custom.recover(ctx);

        StuckRecovery.RecoveryStatistics stats = custom.getStatistics();
        assertThat(stats.episodes()).isEqualTo(3);
        assertThat(stats.totalAttempts()).isEqualTo(6);
        assertThat(stats.totalSuccesses()).isEqualTo(3);
        assertThat(stats.overallSuccessRate()).isEqualTo(0.5);
        assertThat(custom.getRecommendedStrategy()).isEqualTo(Rung.NAVIGATE_BACK);
    }

    @Test
    public void recommendation_needsEnoughAttempts() {
        when(ctx.restartApp()).thenReturn(true);
        recovery.recover(ctx, Rung.RESTART_APP);
        assertThat(recovery.getRecommendedStrategy()).isNull();
        verify(ctx, never()).scroll(any());
    }
}
