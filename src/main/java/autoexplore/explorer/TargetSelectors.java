package autoexplore.explorer;

import autoexplore.frontier.ExplorationQueue;
import autoexplore.model.ElementBounds;
import autoexplore.model.ExplorationStrategy;
import autoexplore.model.ExplorationTarget;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.ToIntFunction;

/**
 * One selection function per {@link ExplorationStrategy}, looked up through
 * a single table. Each function removes and returns the target it picks, or
 * returns {@code null} when the queue is empty.
 *
 * <p>Every selector ranks its candidates by its own order. When several
 * candidates rank equal, the context's tiebreak (if any) chooses among them;
 * otherwise the one the queue would dequeue first wins.
 */
public final class TargetSelectors {

    /** Picks the next target from the queue. */
    @FunctionalInterface
    public interface TargetSelector {
        ExplorationTarget select(ExplorationQueue queue, SelectionContext ctx);
    }

    /**
     * What a selector may look at besides the queue.
     *
     * @param currentScreenId  screen the device is on, may be {@code null}
     * @param screenVisits     visit count per screen id
     * @param leadsAway        whether a target is known or likely to open another screen
     * @param adaptiveDelegate strategy the adaptive selector currently runs
     * @param tiebreak         chooses among equally ranked candidates; may be
     *                         {@code null}, and may return {@code null} to keep the default
     */
    public record SelectionContext(String currentScreenId,
                                   ToIntFunction<String> screenVisits,
                                   Predicate<ExplorationTarget> leadsAway,
                                   ExplorationStrategy adaptiveDelegate,
                                   Function<List<ExplorationTarget>, ExplorationTarget> tiebreak) {

        public SelectionContext(String currentScreenId, ToIntFunction<String> screenVisits,
                                Predicate<ExplorationTarget> leadsAway, ExplorationStrategy adaptiveDelegate) {
            this(currentScreenId, screenVisits, leadsAway, adaptiveDelegate, null);
        }
    }

    static final Comparator<ExplorationTarget> BY_PRIORITY =
            Comparator.comparingInt(ExplorationTarget::priority).reversed();

    /** Top to bottom, then left to right, on a 100px grid; targets without bounds last. */
    static final Comparator<ExplorationTarget> READING_ORDER =
            Comparator.comparingLong(TargetSelectors::readingPosition);

    private static final Map<ExplorationStrategy, TargetSelector> TABLE;

    static {
        Map<ExplorationStrategy, TargetSelector> t = new EnumMap<>(ExplorationStrategy.class);
        t.put(ExplorationStrategy.SCREEN_FIRST,   TargetSelectors::screenFirst);
        t.put(ExplorationStrategy.PRIORITY_BASED, TargetSelectors::priorityBased);
        t.put(ExplorationStrategy.DEPTH_FIRST,    TargetSelectors::depthFirst);
        t.put(ExplorationStrategy.BREADTH_FIRST,  TargetSelectors::breadthFirst);
        t.put(ExplorationStrategy.SYSTEMATIC,     TargetSelectors::systematic);
        t.put(ExplorationStrategy.ADAPTIVE,       TargetSelectors::adaptive);
        TABLE = Collections.unmodifiableMap(t);
    }

    private TargetSelectors() {}

    public static TargetSelector forStrategy(ExplorationStrategy strategy) {
        return TABLE.get(strategy);
    }

    public static ExplorationTarget select(ExplorationStrategy strategy, ExplorationQueue queue, SelectionContext ctx) {
        return forStrategy(strategy).select(queue, ctx);
    }

    // ── Variants ──────────────────────────────────────────────────────────

    /** Exhaust the current screen before leaving it. */
    static ExplorationTarget screenFirst(ExplorationQueue queue, SelectionContext ctx) {
        ExplorationTarget here = pollOnScreen(queue, ctx.currentScreenId(), t -> true, BY_PRIORITY, ctx);
        return here != null ? here : pollBest(queue, t -> true, BY_PRIORITY, ctx);
    }

    /** Global maximum, wherever it lives. */
    static ExplorationTarget priorityBased(ExplorationQueue queue, SelectionContext ctx) {
        return pollBest(queue, t -> true, BY_PRIORITY, ctx);
    }

    /** Prefer targets that open another screen, starting where we are. */
    static ExplorationTarget depthFirst(ExplorationQueue queue, SelectionContext ctx) {
        ExplorationTarget t = pollOnScreen(queue, ctx.currentScreenId(), ctx.leadsAway(), BY_PRIORITY, ctx);
        if (t == null) t = pollBest(queue, ctx.leadsAway(), BY_PRIORITY, ctx);
        if (t == null) t = pollOnScreen(queue, ctx.currentScreenId(), x -> true, BY_PRIORITY, ctx);
        return t != null ? t : pollBest(queue, x -> true, BY_PRIORITY, ctx);
    }

    /** Prefer the least-visited screen that still has targets. */
    static ExplorationTarget breadthFirst(ExplorationQueue queue, SelectionContext ctx) {
        String best = null;
        int bestVisits = Integer.MAX_VALUE;
        for (ExplorationTarget t : queue.snapshot()) {
            int visits = ctx.screenVisits().applyAsInt(t.screenId());
            if (visits < bestVisits) {
                best = t.screenId();
                bestVisits = visits;
            }
        }
        if (best == null) return null;
        return pollOnScreen(queue, best, t -> true, BY_PRIORITY, ctx);
    }

    /**
     * Walk the current screen in reading order, whatever the priorities say.
     * With nothing left here, continue on the screen of the highest-priority
     * target.
     */
    static ExplorationTarget systematic(ExplorationQueue queue, SelectionContext ctx) {
        ExplorationTarget here = pollOnScreen(queue, ctx.currentScreenId(), t -> true, READING_ORDER, ctx);
        if (here != null) return here;
        ExplorationTarget head = queue.peek();
        if (head == null) return null;
        return pollOnScreen(queue, head.screenId(), t -> true, READING_ORDER, ctx);
    }

    static ExplorationTarget adaptive(ExplorationQueue queue, SelectionContext ctx) {
        ExplorationStrategy delegate = ctx.adaptiveDelegate();
        if (delegate == null || delegate == ExplorationStrategy.ADAPTIVE) {
            return priorityBased(queue, ctx);
        }
        return TABLE.get(delegate).select(queue, ctx);
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    static long readingPosition(ExplorationTarget target) {
        ElementBounds b = target.bounds();
        if (b == null) return Long.MAX_VALUE;
        long row = Math.max(0, b.getCenterY() / 100);
        long col = Math.max(0, b.getCenterX() / 100);
        return row * 100_000L + col;
    }

    private static ExplorationTarget pollOnScreen(ExplorationQueue queue, String screenId,
                                                  Predicate<ExplorationTarget> filter,
                                                  Comparator<ExplorationTarget> order, SelectionContext ctx) {
        if (screenId == null) return null;
        return pollBest(queue, t -> screenId.equals(t.screenId()) && filter.test(t), order, ctx);
    }

    /**
     * Removes the best candidate under {@code order}. Candidates ranking equal
     * to the best go to the context's tiebreak; without one, dequeue order wins.
     */
    private static ExplorationTarget pollBest(ExplorationQueue queue, Predicate<ExplorationTarget> filter,
                                              Comparator<ExplorationTarget> order, SelectionContext ctx) {
        List<ExplorationTarget> candidates = new ArrayList<>();
        for (ExplorationTarget t : queue.snapshot()) {
            if (filter.test(t)) candidates.add(t);
        }
        if (candidates.isEmpty()) return null;

        ExplorationTarget best = candidates.get(0);
        for (ExplorationTarget t : candidates) {
            if (order.compare(t, best) < 0) best = t;
        }
        ExplorationTarget pick = best;
        if (ctx.tiebreak() != null) {
            List<ExplorationTarget> ties = new ArrayList<>();
            for (ExplorationTarget t : candidates) {
                if (order.compare(t, best) == 0) ties.add(t);
            }
            if (ties.size() > 1) {
                ExplorationTarget chosen = ctx.tiebreak().apply(ties);
                if (chosen != null && ties.contains(chosen)) pick = chosen;
            }
        }
        ExplorationTarget picked = pick;
        return queue.pollFirst(t -> t == picked);
    }
}
