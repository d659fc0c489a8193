package autoexplore.explorer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The path of screens that led to the current one, for structured back
 * navigation and depth tracking.
 *
 * <p>Re-entering the screen on top replaces its entry instead of pushing a
 * duplicate. The oldest entries fall off beyond {@link #DEFAULT_MAX_DEPTH}.
 */
public class NavigationStack {

    private static final Logger log = LoggerFactory.getLogger(NavigationStack.class);

    public static final int DEFAULT_MAX_DEPTH        = 20;
    public static final int DEFAULT_MAX_SCREEN_VISITS = 5;

    public record Entry(String screenId, String activity, Instant enteredAt, int unexploredElements) {}

    /** Where to go when the current screen has nothing left. */
    public interface Decision {}

    public record Stay() implements Decision {}

    /** Go back {@code steps} screens to {@code screenId}. */
    public record Backtrack(String screenId, int steps, String reason) implements Decision {}

    public record DeadEnd(String reason) implements Decision {}

    private final int maxDepth;
    private final int maxVisits;
    private final Clock clock;
    private final Deque<Entry> stack = new ArrayDeque<>();
    private final Map<String, Integer> visitCounts = new HashMap<>();
    private final Set<String> deadEnds = new HashSet<>();

    public NavigationStack(Clock clock) {
        this(DEFAULT_MAX_DEPTH, DEFAULT_MAX_SCREEN_VISITS, clock);
    }

    public NavigationStack(int maxDepth, int maxVisits, Clock clock) {
        this.maxDepth  = maxDepth;
        this.maxVisits = maxVisits;
        this.clock     = clock;
    }

    /**
     * Records arriving on a screen.
     *
     * @return {@code true} on the first visit in this run
     */
    public boolean enter(String screenId, String activity, int unexploredElements) {
        int visits = visitCounts.merge(screenId, 1, Integer::sum);
        Entry entry = new Entry(screenId, activity, clock.instant(), unexploredElements);

        Entry top = stack.peekLast();
        if (top != null && top.screenId().equals(screenId)) {
            stack.pollLast();
            stack.addLast(entry);
        } else {
            stack.addLast(entry);
            while (stack.size() > maxDepth) stack.pollFirst();
        }
        log.debug("Entered {} (visit #{}, depth {})", screenId, visits, stack.size());
        return visits == 1;
    }

    /** Pops up to {@code steps} entries, never the root; returns what was popped, most recent first. */
    public List<Entry> pop(int steps) {
        List<Entry> popped = new ArrayList<>();
        for (int i = 0; i < steps && stack.size() > 1; i++) {
            popped.add(stack.pollLast());
        }
        return popped;
    }

    /** Entry below the current one, or {@code null} at the root. */
    public Entry previous() {
        if (stack.size() < 2) return null;
        Iterator<Entry> it = stack.descendingIterator();
        it.next();
        return it.next();
    }

    public Entry current() {
        return stack.peekLast();
    }

    /** Depth of the current screen; the root is 0. */
    public int depth() {
        return Math.max(0, stack.size() - 1);
    }

    public int getVisitCount(String screenId) {
        return visitCounts.getOrDefault(screenId, 0);
    }

    public boolean isOvervisited(String screenId) {
        return getVisitCount(screenId) >= maxVisits;
    }

    public void markDeadEnd(String screenId, String reason) {
        if (deadEnds.add(screenId)) {
            log.info("Marked {} as dead end: {}", screenId, reason);
        }
    }

    public boolean isDeadEnd(String screenId) {
        return deadEnds.contains(screenId);
    }

    /**
     * Stay while the current screen has work and is not over-visited,
     * otherwise back up to the most recent viable screen.
     */
    public Decision decide(String screenId, boolean hasUnexplored, boolean stuck) {
        if (stuck) {
            return backtrack("stuck");
        }
        if (hasUnexplored && !isOvervisited(screenId)) {
            return new Stay();
        }
        markDeadEnd(screenId, hasUnexplored ? "max visits reached" : "no unexplored elements");
        return backtrack(hasUnexplored ? "overvisited" : "exhausted");
    }

    private Decision backtrack(String reason) {
        List<Entry> entries = new ArrayList<>(stack);
        int target = -1;
        for (int i = entries.size() - 2; i >= 0; i--) {
            Entry e = entries.get(i);
            if (isDeadEnd(e.screenId()) || isOvervisited(e.screenId())) continue;
            if (e.unexploredElements() > 0) {
                target = i;
                break;
            }
            if (target < 0) target = i;
        }
        if (target < 0) {
            log.warn("No backtrack candidate ({})", reason);
            return new DeadEnd("no viable backtrack target");
        }
        int steps = entries.size() - 1 - target;
        log.info("Backtracking {} steps to {} ({})", steps, entries.get(target).screenId(), reason);
        return new Backtrack(entries.get(target).screenId(), steps, reason);
    }

    /** Entries root first. */
    public List<Entry> entries() {
        return List.copyOf(stack);
    }

    public void reset() {
        stack.clear();
        visitCounts.clear();
        deadEnds.clear();
    }
}
