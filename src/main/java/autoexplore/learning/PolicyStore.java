package autoexplore.learning;

import java.util.Set;

/**
 * Key-value persistence for learned values, keyed by {@code screenHash|actionKey}.
 *
 * <p>The store is an eventually-durable cache. During a run the in-memory
 * {@link PolicyTable} is authoritative; implementations may defer the durable
 * write, but every write is idempotent by key so replaying or losing the last
 * one leaves a consistent snapshot.
 */
public interface PolicyStore extends AutoCloseable {

    /** Everything currently stored; an empty snapshot when nothing was saved yet. */
    PolicySnapshot load();

    /** Stored entry, or {@code null} when the key was never written. */
    PolicyEntry get(String key);

    /** Stored entry, or a neutral one (value 0, no visits) when absent. */
    default PolicyEntry getOrDefault(String key) {
        PolicyEntry entry = get(key);
        return entry != null ? entry : new PolicyEntry();
    }

    void upsert(String key, PolicyEntry entry);

    /** Increments the visit count of {@code key}, creating a neutral entry first if needed. */
    void incrementVisitCount(String key);

    void remove(String key);

    void putScreenVisits(String screenHash, int visits);

    void putTotalActions(int totalActions);

    void addDangerousPattern(String pattern);

    Set<String> getDangerousPatterns();

    /** Blocks until every pending write has reached durable storage. */
    void flush();

    @Override
    void close();
}
