package autoexplore.learning;

import autoexplore.model.ExplorationResultIO;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Best-performing exploration strategy per target application, remembered
 * across runs in a small JSON file.
 *
 * <p>Strategies are stored by name so this class stays independent of the
 * strategy type. A missing or unreadable file starts an empty memory.
 */
public class StrategyMemory {

    private static final Logger log = LoggerFactory.getLogger(StrategyMemory.class);

    private final Path file;
    private final Clock clock;
    private final ObjectMapper mapper = ExplorationResultIO.getMapper();
    private final Map<String, BestStrategy> byTarget = new TreeMap<>();

    public StrategyMemory(Path file) {
        this(file, Clock.systemUTC());
    }

    StrategyMemory(Path file, Clock clock) {
        this.file  = file;
        this.clock = clock;
        load();
    }

    /** Remembered strategy name for {@code targetId}, or {@code null}. */
    public synchronized String getBestStrategy(String targetId) {
        BestStrategy record = byTarget.get(targetId);
        return record == null ? null : record.strategy;
    }

    public synchronized int getBestDiscoveries(String targetId) {
        BestStrategy record = byTarget.get(targetId);
        return record == null ? 0 : record.discoveries;
    }

    /**
     * Records {@code strategy} as best for {@code targetId} when it beat the
     * remembered discovery count, or when the remembered strategy is the same one.
     *
     * @return whether the memory changed
     */
    public synchronized boolean recordResult(String targetId, String strategy, int discoveries) {
        BestStrategy current = byTarget.get(targetId);
        if (current != null && !current.strategy.equals(strategy) && current.discoveries >= discoveries) {
            return false;
        }
        BestStrategy record = new BestStrategy();
        record.strategy    = strategy;
        record.discoveries = discoveries;
        record.updatedAt   = clock.instant();
        byTarget.put(targetId, record);
        save();
        log.info("Best strategy for {} is now {} ({} discoveries)", targetId, strategy, discoveries);
        return true;
    }

    private void load() {
        if (file == null || !Files.exists(file)) return;
        try {
            Document doc = mapper.readValue(file.toFile(), Document.class);
            if (doc.targets != null) byTarget.putAll(doc.targets);
            log.debug("Loaded strategy memory for {} targets from {}", byTarget.size(), file);
        } catch (IOException e) {
            log.warn("Ignoring unreadable strategy memory {}: {}", file, e.getMessage());
        }
    }

    private void save() {
        if (file == null) return;
        Document doc = new Document();
        doc.targets = new TreeMap<>(byTarget);
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            mapper.writeValue(file.toFile(), doc);
        } catch (IOException e) {
            log.error("Failed to save strategy memory to {}: {}", file, e.getMessage(), e);
        }
    }

    // ── JSON document ─────────────────────────────────────────────────────

    static class Document {
        @JsonProperty("targets")
        Map<String, BestStrategy> targets;
    }

    static class BestStrategy {
        @JsonProperty("strategy")    String strategy;
        @JsonProperty("discoveries") int discoveries;
        @JsonProperty("updatedAt")   Instant updatedAt;
    }
}
