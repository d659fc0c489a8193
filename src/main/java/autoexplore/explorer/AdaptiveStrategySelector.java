package autoexplore.explorer;

import autoexplore.learning.StrategyMemory;
import autoexplore.model.ExplorationStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Meta-strategy for {@link ExplorationStrategy#ADAPTIVE} runs.
 *
 * <p>Cycles through the concrete strategies, attributing every discovery to
 * the strategy active when it happened. A strategy gives way when it has
 * used its action quota or has gone a stagnation window without
 * discovering anything. Once every strategy has had a turn, a stagnating
 * strategy is replaced by the best performer so far rather than simply the
 * next one. The best strategy is remembered per target for future runs.
 */
public class AdaptiveStrategySelector {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveStrategySelector.class);

    static final List<ExplorationStrategy> ROTATION = List.of(
            ExplorationStrategy.SCREEN_FIRST,
            ExplorationStrategy.PRIORITY_BASED,
            ExplorationStrategy.DEPTH_FIRST,
            ExplorationStrategy.BREADTH_FIRST,
            ExplorationStrategy.SYSTEMATIC);

    private static final class Tally {
        int actions;
        int discoveries;

        double rate() {
            return actions > 0 ? (double) discoveries / actions : 0.0;
        }
    }

    private final String targetId;
    private final StrategyMemory memory;
    private final int quota;
    private final int stagnationWindow;
    private final Map<ExplorationStrategy, Tally> tallies = new EnumMap<>(ExplorationStrategy.class);

    private ExplorationStrategy current;
    private int actionsInTurn;
    private int sinceDiscovery;
    private int switches;

    /**
     * @param memory best-strategy store, or {@code null} to start from the head of the rotation
     */
    public AdaptiveStrategySelector(String targetId, StrategyMemory memory, int quota, int stagnationWindow) {
        this.targetId         = targetId;
        this.memory           = memory;
        this.quota            = quota;
        this.stagnationWindow = stagnationWindow;
        for (ExplorationStrategy s : ROTATION) tallies.put(s, new Tally());
        this.current = initialStrategy();
        log.info("Adaptive run for {} starts with {}", targetId, current);
    }

    private ExplorationStrategy initialStrategy() {
        if (memory != null) {
            String remembered = memory.getBestStrategy(targetId);
            if (remembered != null) {
                try {
                    ExplorationStrategy s = ExplorationStrategy.valueOf(remembered);
                    if (ROTATION.contains(s)) return s;
                } catch (IllegalArgumentException e) {
                    log.warn("Ignoring unknown remembered strategy '{}' for {}", remembered, targetId);
                }
            }
        }
        return ROTATION.get(0);
    }

    public ExplorationStrategy current() {
        return current;
    }

    /**
     * Records the outcome of one action taken under {@link #current()} and
     * switches strategy when due.
     *
     * @param discoveries new screens plus new elements the action revealed
     * @return the strategy to use for the next action
     */
    public ExplorationStrategy recordAction(int discoveries) {
        Tally tally = tallies.get(current);
        tally.actions++;
        actionsInTurn++;
        if (discoveries > 0) {
            tally.discoveries += discoveries;
            sinceDiscovery = 0;
        } else {
            sinceDiscovery++;
        }

        if (sinceDiscovery >= stagnationWindow) {
            switchTo(allTried() ? bestOtherThan(current) : next(), "stagnation");
        } else if (actionsInTurn >= quota) {
            switchTo(next(), "quota");
        }
        return current;
    }

    private void switchTo(ExplorationStrategy target, String reason) {
        if (target != current) {
            log.info("Adaptive switch {} -> {} ({}, rate {})", current, target, reason,
                    String.format("%.2f", tallies.get(current).rate()));
            switches++;
        }
        current = target;
        actionsInTurn = 0;
        sinceDiscovery = 0;
    }

    private ExplorationStrategy next() {
        return ROTATION.get((ROTATION.indexOf(current) + 1) % ROTATION.size());
    }

    private boolean allTried() {
        for (Tally t : tallies.values()) {
            if (t.actions == 0) return false;
        }
        return true;
    }

    private ExplorationStrategy bestOtherThan(ExplorationStrategy exclude) {
        ExplorationStrategy best = next();
        double bestRate = -1;
        for (ExplorationStrategy s : ROTATION) {
            if (s == exclude) continue;
            double rate = tallies.get(s).rate();
            if (rate > bestRate) {
                best = s;
                bestRate = rate;
            }
        }
        return best;
    }

    /** Strategy with the most discoveries per action so far, or the current one before any action. */
    public ExplorationStrategy best() {
        ExplorationStrategy best = current;
        double bestRate = -1;
        for (ExplorationStrategy s : ROTATION) {
            Tally t = tallies.get(s);
            if (t.actions > 0 && t.rate() > bestRate) {
                best = s;
                bestRate = t.rate();
            }
        }
        return best;
    }

    public int getDiscoveries(ExplorationStrategy strategy) {
        Tally t = tallies.get(strategy);
        return t == null ? 0 : t.discoveries;
    }

    public int getSwitchCount() {
        return switches;
    }

    /** Saves the best strategy of this run for the target; returns whether the memory changed. */
    public boolean persist() {
        if (memory == null) return false;
        ExplorationStrategy best = best();
        return memory.recordResult(targetId, best.name(), getDiscoveries(best));
    }
}
