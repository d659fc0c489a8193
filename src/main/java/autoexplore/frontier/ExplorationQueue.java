package autoexplore.frontier;

import autoexplore.model.ExplorationTarget;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Pending exploration targets, highest priority first. Equal priorities
 * keep insertion order.
 *
 * <p>Every target is consumed at most once: {@link #poll()} and
 * {@link #pollFirst(Predicate)} remove what they return.
 */
public class ExplorationQueue implements QueueAppender {

    private record Slot(ExplorationTarget target, long sequence) {}

    private final TreeSet<Slot> slots = new TreeSet<>((a, b) -> {
        int byPriority = Integer.compare(b.target().priority(), a.target().priority());
        return byPriority != 0 ? byPriority : Long.compare(a.sequence(), b.sequence());
    });
    private long nextSequence;

    @Override
    public void add(ExplorationTarget target) {
        slots.add(new Slot(target, nextSequence++));
    }

    /** Removes and returns the head, or {@code null} when empty. */
    public ExplorationTarget poll() {
        Slot head = slots.pollFirst();
        return head == null ? null : head.target();
    }

    public ExplorationTarget peek() {
        return slots.isEmpty() ? null : slots.first().target();
    }

    /** Removes and returns the highest-priority target matching {@code filter}, or {@code null}. */
    public ExplorationTarget pollFirst(Predicate<ExplorationTarget> filter) {
        Iterator<Slot> it = slots.iterator();
        while (it.hasNext()) {
            Slot slot = it.next();
            if (filter.test(slot.target())) {
                it.remove();
                return slot.target();
            }
        }
        return null;
    }

    /** Removes every target matching {@code filter}; returns how many were dropped. */
    public int removeIf(Predicate<ExplorationTarget> filter) {
        int before = slots.size();
        slots.removeIf(slot -> filter.test(slot.target()));
        return before - slots.size();
    }

    public boolean anyMatch(Predicate<ExplorationTarget> filter) {
        for (Slot slot : slots) {
            if (filter.test(slot.target())) return true;
        }
        return false;
    }

    /** Targets in dequeue order. */
    public List<ExplorationTarget> snapshot() {
        List<ExplorationTarget> result = new ArrayList<>(slots.size());
        for (Slot slot : slots) result.add(slot.target());
        return result;
    }

    public int size() {
        return slots.size();
    }

    public boolean isEmpty() {
        return slots.isEmpty();
    }

    public void clear() {
        slots.clear();
    }
}
