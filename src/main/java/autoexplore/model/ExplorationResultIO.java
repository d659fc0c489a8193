package autoexplore.model;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads and writes {@link ExplorationResult} documents as JSON.
 *
 * <p>On read the document is validated against {@code result-schema.json}
 * and rejected when its schema version is not the current one. On write the
 * output is pretty-printed.
 */
public final class ExplorationResultIO {

    private static final Logger log = LoggerFactory.getLogger(ExplorationResultIO.class);
    private static final String SCHEMA_RESOURCE = "/result-schema.json";

    /** Shared mapper, thread-safe once configured. */
    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(SerializationFeature.INDENT_OUTPUT);

    /** Schemas by classpath resource; empty when the resource is missing. */
    private static final Map<String, Optional<JsonSchema>> SCHEMAS = new ConcurrentHashMap<>();

    private ExplorationResultIO() {}

    // ── Public API ────────────────────────────────────────────────────────

    /**
     * Reads a result file.
     *
     * @throws IOException               if the file cannot be read or parsed
     * @throws SchemaValidationException if the document does not match the schema
     * @throws SchemaVersionException    if the schema version is not supported
     */
    public static ExplorationResult read(Path path) throws IOException {
        log.debug("Reading exploration result from: {}", path);
        String json = Files.readString(path);
        validate(json, SCHEMA_RESOURCE, path.toString());
        ExplorationResult result = MAPPER.readValue(json, ExplorationResult.class);
        if (!result.isVersionSupported()) {
            throw new SchemaVersionException("Unsupported schema version: " + result.getSchemaVersion()
                    + " (expected: " + ExplorationResult.CURRENT_SCHEMA_VERSION + ")");
        }
        log.info("Loaded result for '{}' ({} screens, status {}) from {}",
                result.getPackageName(), result.getScreens().size(), result.getStatus(), path);
        return result;
    }

    /** Writes {@code result} to {@code path}, creating parent directories. */
    public static void write(ExplorationResult result, Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        MAPPER.writeValue(path.toFile(), result);
        log.info("Wrote result for '{}' ({} screens) to {}",
                result.getPackageName(), result.getScreens().size(), path);
    }

    public static String toJson(ExplorationResult result) throws IOException {
        return MAPPER.writeValueAsString(result);
    }

    /** Parses a result without schema validation. */
    public static ExplorationResult fromJson(String json) throws IOException {
        return MAPPER.readValue(json, ExplorationResult.class);
    }

    /** The shared mapper, for other JSON documents of this project. */
    public static ObjectMapper getMapper() { return MAPPER; }

    // ── Schema validation ─────────────────────────────────────────────────

    /**
     * Validates {@code json} against the schema at {@code schemaResource}
     * on the classpath. A missing schema only logs a warning.
     */
    public static void validate(String json, String schemaResource, String source) {
        JsonSchema schema = SCHEMAS.computeIfAbsent(schemaResource,
                r -> Optional.ofNullable(loadSchema(r))).orElse(null);
        if (schema == null) {
            log.warn("{} not found on classpath, skipping schema validation", schemaResource);
            return;
        }
        try {
            Set<ValidationMessage> errors = schema.validate(MAPPER.readTree(json));
            if (!errors.isEmpty()) {
                StringBuilder sb = new StringBuilder("Schema validation failed for ").append(source).append(":\n");
                errors.forEach(e -> sb.append("  ").append(e.getMessage()).append("\n"));
                throw new SchemaValidationException(sb.toString());
            }
        } catch (IOException e) {
            throw new SchemaValidationException("Not valid JSON: " + source + " (" + e.getMessage() + ")");
        }
    }

    private static JsonSchema loadSchema(String resource) {
        try (InputStream is = ExplorationResultIO.class.getResourceAsStream(resource)) {
            if (is == null) {
                return null;
            }
            JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
            return factory.getSchema(is);
        } catch (IOException e) {
            log.warn("Failed to load schema {}: {}", resource, e.getMessage());
            return null;
        }
    }

    // ── Exceptions ────────────────────────────────────────────────────────

    public static class SchemaVersionException extends RuntimeException {
        public SchemaVersionException(String msg) { super(msg); }
    }

    public static class SchemaValidationException extends RuntimeException {
        public SchemaValidationException(String msg) { super(msg); }
    }
}
