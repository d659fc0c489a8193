package autoexplore.explorer;

import autoexplore.model.ClickableElement;
import autoexplore.model.ScrollableContainer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Escalating ladder of corrective actions for a stalled run.
 *
 * <p>Rungs are tried in {@link Rung} order, each once per episode; the
 * ladder stops at the first rung that produces progress. Each rung is one
 * entry of a dispatch table and talks to the device only through the
 * {@link RecoveryContext} the engine supplies. Exhausting the ladder
 * abandons the current branch, not the run.
 */
public class StuckRecovery {

    private static final Logger log = LoggerFactory.getLogger(StuckRecovery.class);

    static final int MIN_ATTEMPTS_FOR_RECOMMENDATION = 3;

    public enum Rung {
        SCROLL_CONTAINER,
        NAVIGATE_BACK,
        TAP_NAVIGATION,
        RESTART_APP,
        REQUEST_HELP
    }

    /** Device-facing operations a rung may use. */
    public interface RecoveryContext {

        /** Scrollable container closest to the screen center that is not fully scrolled. */
        Optional<ScrollableContainer> nearestScrollable();

        boolean scroll(ScrollableContainer container);

        /** Structured back navigation; {@code false} if no back step was possible. */
        boolean navigateBack();

        /** An unvisited primary-navigation entry (bottom tab, drawer, menu) on the current screen. */
        Optional<ClickableElement> unvisitedNavigationEntry();

        boolean tap(ClickableElement element);

        /** Force-restarts the target and waits for its home screen; learned state is kept. */
        boolean restartApp();

        /** Asks a person for help with a bounded wait. */
        boolean requestHelp(String reason);

        /** Re-observes the device and reports whether the last rung moved the run forward. */
        boolean madeProgress();

        boolean cancelled();
    }

    @FunctionalInterface
    interface RecoveryStep {
        boolean attempt(RecoveryContext ctx);
    }

    /**
     * @param success   whether some rung recovered
     * @param rung      the rung that recovered, or the last one tried
     * @param attempted rungs tried in this episode, in order
     */
    public record RecoveryResult(boolean success, Rung rung, List<Rung> attempted) {

        public boolean tried(Rung r) {
            return attempted.contains(r);
        }
    }

    public record RungStats(Rung rung, int attempts, int successes) {
        public double successRate() {
            return attempts > 0 ? (double) successes / attempts : 0.0;
        }
    }

    public record RecoveryStatistics(int episodes, int totalAttempts, int totalSuccesses, List<RungStats> rungs) {
        public double overallSuccessRate() {
            return totalAttempts > 0 ? (double) totalSuccesses / totalAttempts : 0.0;
        }
    }

    private final Map<Rung, RecoveryStep> table;
    private final Map<Rung, int[]> counts = new EnumMap<>(Rung.class);
    private int episodes;

    public StuckRecovery() {
        this(defaultTable());
    }

    StuckRecovery(Map<Rung, RecoveryStep> table) {
        this.table = new EnumMap<>(table);
        for (Rung r : Rung.values()) counts.put(r, new int[2]);
    }

    private static Map<Rung, RecoveryStep> defaultTable() {
        Map<Rung, RecoveryStep> t = new EnumMap<>(Rung.class);
        t.put(Rung.SCROLL_CONTAINER, ctx -> ctx.nearestScrollable()
                .map(c -> ctx.scroll(c) && ctx.madeProgress())
                .orElse(false));
        t.put(Rung.NAVIGATE_BACK, ctx -> ctx.navigateBack() && ctx.madeProgress());
        t.put(Rung.TAP_NAVIGATION, ctx -> ctx.unvisitedNavigationEntry()
                .map(e -> ctx.tap(e) && ctx.madeProgress())
                .orElse(false));
        t.put(Rung.RESTART_APP, RecoveryContext::restartApp);
        t.put(Rung.REQUEST_HELP, ctx -> ctx.requestHelp("Exploration is stuck") && ctx.madeProgress());
        return t;
    }

    public RecoveryResult recover(RecoveryContext ctx) {
        return recover(ctx, Rung.SCROLL_CONTAINER);
    }

    /**
     * Runs the ladder from {@code startAt} upwards.
     */
    public RecoveryResult recover(RecoveryContext ctx, Rung startAt) {
        episodes++;
        List<Rung> attempted = new ArrayList<>();
        Rung last = startAt;
        for (Rung rung : Rung.values()) {
            if (rung.ordinal() < startAt.ordinal()) continue;
            if (ctx.cancelled()) {
                log.info("Recovery interrupted by cancellation before {}", rung);
                break;
            }
            RecoveryStep step = table.get(rung);
            if (step == null) continue;

            attempted.add(rung);
            last = rung;
            counts.get(rung)[0]++;
            log.info("Recovery rung {} ({})", rung.ordinal() + 1, rung);
            boolean ok;
            try {
                ok = step.attempt(ctx);
            } catch (ExplorationException e) {
                throw e;
            } catch (RuntimeException e) {
                log.warn("Recovery rung {} threw: {}", rung, e.getMessage());
                ok = false;
            }
            if (ok) {
                counts.get(rung)[1]++;
                log.info("Recovered with {}", rung);
                return new RecoveryResult(true, rung, Collections.unmodifiableList(attempted));
            }
        }
        log.warn("Recovery ladder exhausted after {}", attempted);
        return new RecoveryResult(false, last, Collections.unmodifiableList(attempted));
    }

    // ── Statistics ────────────────────────────────────────────────────────

    public RecoveryStatistics getStatistics() {
        List<RungStats> stats = new ArrayList<>();
        int attempts = 0, successes = 0;
        for (Rung r : Rung.values()) {
            int[] c = counts.get(r);
            stats.add(new RungStats(r, c[0], c[1]));
            attempts  += c[0];
            successes += c[1];
        }
        return new RecoveryStatistics(episodes, attempts, successes, stats);
    }

    /** Rung with the best success rate among those tried at least three times, or {@code null}. */
    public Rung getRecommendedStrategy() {
        Rung best = null;
        double bestRate = -1;
        for (RungStats s : getStatistics().rungs()) {
            if (s.attempts() >= MIN_ATTEMPTS_FOR_RECOMMENDATION && s.successRate() > bestRate) {
                best = s.rung();
                bestRate = s.successRate();
            }
        }
        return best;
    }
}
