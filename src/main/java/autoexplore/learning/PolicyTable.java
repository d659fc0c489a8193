package autoexplore.learning;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Authoritative in-memory value table for one process.
 *
 * <p>Seeded from a {@link PolicyStore} snapshot on construction; every
 * mutation is applied here first and then written through to the store,
 * whose durability may lag. Reads never consult the store.
 *
 * <p>Unknown keys read as neutral (value 0, no visits) and are created on
 * first write. When the table reaches {@link #DEFAULT_MAX_ENTRIES}, entries
 * visited fewer than {@value #PRUNE_BELOW_VISITS} times are pruned before a
 * new key is added.
 */
public class PolicyTable {

    private static final Logger log = LoggerFactory.getLogger(PolicyTable.class);

    public static final int DEFAULT_MAX_ENTRIES = 10_000;
    static final int PRUNE_BELOW_VISITS = 2;
    static final int MAX_FEEDBACK = 3;

    private final PolicyStore store;
    private final int maxEntries;

    private final Map<String, PolicyEntry> entries      = new HashMap<>();
    private final Map<String, Integer>     screenVisits = new HashMap<>();
    private final Set<String>              dangerous    = new LinkedHashSet<>();
    private int totalActions;

    public PolicyTable(PolicyStore store) {
        this(store, DEFAULT_MAX_ENTRIES);
    }

    PolicyTable(PolicyStore store, int maxEntries) {
        this.store      = store;
        this.maxEntries = maxEntries;
        PolicySnapshot snapshot = store.load();
        snapshot.getEntries().forEach((k, v) -> entries.put(k, v.copy()));
        screenVisits.putAll(snapshot.getScreenVisits());
        dangerous.addAll(snapshot.getDangerousPatterns());
        totalActions = snapshot.getTotalActions();
        if (!entries.isEmpty()) {
            log.info("Policy table seeded with {} entries, {} dangerous patterns",
                    entries.size(), dangerous.size());
        }
    }

    // ── Values ────────────────────────────────────────────────────────────

    public boolean contains(String key) {
        return entries.containsKey(key);
    }

    public double getValue(String key) {
        PolicyEntry entry = entries.get(key);
        return entry == null ? 0.0 : entry.getValue();
    }

    public int getVisits(String key) {
        PolicyEntry entry = entries.get(key);
        return entry == null ? 0 : entry.getVisits();
    }

    public int getFeedback(String key) {
        PolicyEntry entry = entries.get(key);
        return entry == null ? 0 : entry.getFeedback();
    }

    public void setValue(String key, double value) {
        PolicyEntry entry = entryFor(key);
        entry.setValue(value);
        store.upsert(key, entry);
    }

    /** Sets the value, bumps the visit count and clears pending feedback in one write. */
    public void applyUpdate(String key, double value) {
        PolicyEntry entry = entryFor(key);
        entry.setValue(value);
        entry.setVisits(entry.getVisits() + 1);
        entry.setFeedback(0);
        store.upsert(key, entry);
    }

    /** Adds {@code signal} to the pending feedback, keeping the total within ±{@value #MAX_FEEDBACK}. */
    public int addFeedback(String key, int signal) {
        PolicyEntry entry = entryFor(key);
        int total = Math.max(-MAX_FEEDBACK, Math.min(MAX_FEEDBACK, entry.getFeedback() + signal));
        entry.setFeedback(total);
        store.upsert(key, entry);
        return total;
    }

    /** Largest value among keys starting with {@code prefix}; 0 when there are none. */
    public double maxValueWithPrefix(String prefix) {
        double max = Double.NEGATIVE_INFINITY;
        for (Map.Entry<String, PolicyEntry> e : entries.entrySet()) {
            if (e.getKey().startsWith(prefix)) {
                max = Math.max(max, e.getValue().getValue());
            }
        }
        return max == Double.NEGATIVE_INFINITY ? 0.0 : max;
    }

    /** Read-only view of all entries. */
    public Map<String, PolicyEntry> entries() {
        return Collections.unmodifiableMap(entries);
    }

    public int size() {
        return entries.size();
    }

    // ── Screens and patterns ──────────────────────────────────────────────

    public int getScreenVisits(String screenHash) {
        return screenVisits.getOrDefault(screenHash, 0);
    }

    public int incrementScreenVisits(String screenHash) {
        int visits = screenVisits.merge(screenHash, 1, Integer::sum);
        store.putScreenVisits(screenHash, visits);
        return visits;
    }

    public int screenCount() {
        return screenVisits.size();
    }

    public boolean isDangerous(String pattern) {
        return dangerous.contains(pattern);
    }

    public boolean addDangerous(String pattern) {
        if (!dangerous.add(pattern)) return false;
        store.addDangerousPattern(pattern);
        return true;
    }

    public Set<String> dangerousPatterns() {
        return Collections.unmodifiableSet(dangerous);
    }

    public int getTotalActions() {
        return totalActions;
    }

    public int incrementTotalActions() {
        totalActions++;
        store.putTotalActions(totalActions);
        return totalActions;
    }

    /** Drops all in-memory state. The store keeps what it already persisted. */
    public void clear() {
        entries.clear();
        screenVisits.clear();
        dangerous.clear();
        totalActions = 0;
    }

    // ── Internals ─────────────────────────────────────────────────────────

    private PolicyEntry entryFor(String key) {
        PolicyEntry entry = entries.get(key);
        if (entry == null) {
            if (entries.size() >= maxEntries) {
                prune();
            }
            entry = new PolicyEntry();
            entries.put(key, entry);
        }
        return entry;
    }

    /** Removes rarely visited entries; returns how many were dropped. */
    int prune() {
        int removed = 0;
        Iterator<Map.Entry<String, PolicyEntry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, PolicyEntry> e = it.next();
            if (e.getValue().getVisits() < PRUNE_BELOW_VISITS) {
                it.remove();
                store.remove(e.getKey());
                removed++;
            }
        }
        log.info("Pruned {} low-visit policy entries ({} remain)", removed, entries.size());
        return removed;
    }
}
