package autoexplore.learning;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Durable form of the learned policy, as written to and read from a
 * {@link PolicyStore}. Validated against {@code policy-schema.json} on load.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PolicySnapshot {

    public static final String CURRENT_SCHEMA_VERSION = "1.0";

    @JsonProperty("schemaVersion")
    private String schemaVersion = CURRENT_SCHEMA_VERSION;

    @JsonProperty("savedAt")
    private Instant savedAt;

    @JsonProperty("totalActions")
    private int totalActions;

    @JsonProperty("entries")
    private Map<String, PolicyEntry> entries = new TreeMap<>();

    @JsonProperty("screenVisits")
    private Map<String, Integer> screenVisits = new TreeMap<>();

    @JsonProperty("dangerousPatterns")
    private Set<String> dangerousPatterns = new LinkedHashSet<>();

    public PolicySnapshot() {}

    public String                   getSchemaVersion()     { return schemaVersion; }
    public Instant                  getSavedAt()           { return savedAt; }
    public int                      getTotalActions()      { return totalActions; }
    public Map<String, PolicyEntry> getEntries()           { return entries; }
    public Map<String, Integer>     getScreenVisits()      { return screenVisits; }
    public Set<String>              getDangerousPatterns() { return dangerousPatterns; }

    public void setSchemaVersion(String v)                      { this.schemaVersion = v; }
    public void setSavedAt(Instant savedAt)                     { this.savedAt = savedAt; }
    public void setTotalActions(int totalActions)               { this.totalActions = totalActions; }
    public void setEntries(Map<String, PolicyEntry> entries)    { this.entries = entries; }
    public void setScreenVisits(Map<String, Integer> visits)    { this.screenVisits = visits; }
    public void setDangerousPatterns(Set<String> patterns)      { this.dangerousPatterns = patterns; }

    @JsonIgnore
    public boolean isEmpty() {
        return entries.isEmpty() && screenVisits.isEmpty() && dangerousPatterns.isEmpty();
    }

    @Override
    public String toString() {
        return String.format("PolicySnapshot{entries=%d, screens=%d, dangerous=%d, savedAt=%s}",
                entries.size(), screenVisits.size(), dangerousPatterns.size(), savedAt);
    }
}
