package autoexplore.learning;

import java.time.Clock;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Volatile {@link PolicyStore}: learned values survive for the life of the
 * process only. Also the mirror that {@link JsonFilePolicyStore} snapshots.
 *
 * <p>Safe to read from a writer thread while the control loop upserts.
 */
public class InMemoryPolicyStore implements PolicyStore {

    private final Map<String, PolicyEntry> entries      = new ConcurrentHashMap<>();
    private final Map<String, Integer>     screenVisits = new ConcurrentHashMap<>();
    private final Set<String>              dangerous    = ConcurrentHashMap.newKeySet();
    private final AtomicInteger            totalActions = new AtomicInteger();
    private final Clock clock;

    public InMemoryPolicyStore() {
        this(Clock.systemUTC());
    }

    InMemoryPolicyStore(Clock clock) {
        this.clock = clock;
    }

    /** Replaces the current contents with {@code snapshot} without signalling a change. */
    protected void restore(PolicySnapshot snapshot) {
        entries.clear();
        snapshot.getEntries().forEach((k, v) -> entries.put(k, v.copy()));
        screenVisits.clear();
        screenVisits.putAll(snapshot.getScreenVisits());
        dangerous.clear();
        dangerous.addAll(snapshot.getDangerousPatterns());
        totalActions.set(snapshot.getTotalActions());
    }

    /** Called after every mutation. */
    protected void changed() {}

    @Override
    public PolicySnapshot load() {
        PolicySnapshot snapshot = new PolicySnapshot();
        entries.forEach((k, v) -> snapshot.getEntries().put(k, v.copy()));
        snapshot.getScreenVisits().putAll(screenVisits);
        snapshot.getDangerousPatterns().addAll(new TreeSet<>(dangerous));
        snapshot.setTotalActions(totalActions.get());
        snapshot.setSavedAt(clock.instant());
        return snapshot;
    }

    @Override
    public PolicyEntry get(String key) {
        PolicyEntry entry = entries.get(key);
        return entry == null ? null : entry.copy();
    }

    @Override
    public void upsert(String key, PolicyEntry entry) {
        entries.put(key, entry.copy());
        changed();
    }

    @Override
    public void incrementVisitCount(String key) {
        entries.compute(key, (k, existing) -> {
            PolicyEntry next = existing == null ? new PolicyEntry() : existing.copy();
            next.setVisits(next.getVisits() + 1);
            return next;
        });
        changed();
    }

    @Override
    public void remove(String key) {
        if (entries.remove(key) != null) changed();
    }

    @Override
    public void putScreenVisits(String screenHash, int visits) {
        screenVisits.put(screenHash, visits);
        changed();
    }

    @Override
    public void putTotalActions(int total) {
        totalActions.set(total);
        changed();
    }

    @Override
    public void addDangerousPattern(String pattern) {
        if (dangerous.add(pattern)) changed();
    }

    @Override
    public Set<String> getDangerousPatterns() {
        return Collections.unmodifiableSet(dangerous);
    }

    @Override
    public void flush() {}

    @Override
    public void close() {}
}
