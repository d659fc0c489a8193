package autoexplore.learning;

import autoexplore.model.ExplorationResultIO;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link PolicyStore} backed by a single JSON snapshot file.
 *
 * <p>Mutations update the in-memory mirror immediately and schedule a
 * snapshot write on a dedicated daemon thread, so the control loop never
 * waits on disk. Bursts of mutations coalesce into one write. Each write goes
 * to a temporary sibling file that then atomically replaces the snapshot, so
 * a crash mid-write leaves the previous snapshot intact.
 *
 * <p>On open, an existing snapshot is validated against
 * {@code policy-schema.json} before it is loaded.
 */
public class JsonFilePolicyStore extends InMemoryPolicyStore {

    private static final Logger log = LoggerFactory.getLogger(JsonFilePolicyStore.class);
    private static final String SCHEMA_RESOURCE = "/policy-schema.json";
    private static final long   FLUSH_TIMEOUT_SEC = 10;

    private final Path file;
    private final ObjectMapper mapper = ExplorationResultIO.getMapper();
    private final AtomicBoolean dirty  = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final ExecutorService writer = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "policy-writer");
        t.setDaemon(true);
        return t;
    });

    private JsonFilePolicyStore(Path file, Clock clock) {
        super(clock);
        this.file = file;
    }

    /**
     * Opens the store at {@code file}, loading its snapshot when the file exists.
     *
     * @throws IOException if the file exists but cannot be read or parsed
     * @throws ExplorationResultIO.SchemaValidationException if the snapshot is malformed
     */
    public static JsonFilePolicyStore open(Path file) throws IOException {
        return open(file, Clock.systemUTC());
    }

    static JsonFilePolicyStore open(Path file, Clock clock) throws IOException {
        JsonFilePolicyStore store = new JsonFilePolicyStore(file, clock);
        if (Files.exists(file)) {
            store.restore(readSnapshot(file, store.mapper));
            log.info("Loaded policy store from {} ({} entries)", file, store.load().getEntries().size());
        } else {
            log.info("Policy store {} does not exist yet; starting empty", file);
        }
        return store;
    }

    /** Reads and validates a snapshot file without opening a store on it. */
    public static PolicySnapshot readSnapshot(Path file) throws IOException {
        return readSnapshot(file, ExplorationResultIO.getMapper());
    }

    private static PolicySnapshot readSnapshot(Path file, ObjectMapper mapper) throws IOException {
        String json = Files.readString(file);
        ExplorationResultIO.validate(json, SCHEMA_RESOURCE, file.toString());
        return mapper.readValue(json, PolicySnapshot.class);
    }

    public Path getFile() {
        return file;
    }

    @Override
    protected void changed() {
        if (closed.get()) {
            log.warn("Policy store {} is closed; change kept in memory only", file);
            return;
        }
        if (dirty.compareAndSet(false, true)) {
            writer.execute(this::writeIfDirty);
        }
    }

    @Override
    public void flush() {
        if (closed.get()) return;
        try {
            writer.submit(this::writeIfDirty).get(FLUSH_TIMEOUT_SEC, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while flushing policy store {}", file);
        } catch (ExecutionException | TimeoutException e) {
            log.error("Failed to flush policy store {}: {}", file, e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        flush();
        if (closed.compareAndSet(false, true)) {
            writer.shutdown();
            log.debug("Policy store {} closed", file);
        }
    }

    private void writeIfDirty() {
        if (!dirty.getAndSet(false)) return;
        PolicySnapshot snapshot = load();
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), snapshot);
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
            log.debug("Saved policy snapshot ({} entries) to {}", snapshot.getEntries().size(), file);
        } catch (IOException e) {
            // retried on the next change
            log.error("Failed to save policy snapshot to {}: {}", file, e.getMessage(), e);
        }
    }
}
