package autoexplore.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything a finished (or stopped) run hands back to its caller:
 * discovered screens, observed transitions, final coverage and the full
 * issue log. Serialized by {@link ExplorationResultIO}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExplorationResult {

    public static final String CURRENT_SCHEMA_VERSION = "1.0";

    @JsonProperty("schemaVersion")
    private String schemaVersion = CURRENT_SCHEMA_VERSION;

    @JsonProperty("packageName")
    private String packageName;

    @JsonProperty("status")
    private ExplorationStatus status = ExplorationStatus.NOT_STARTED;

    @JsonProperty("passNumber")
    private int passNumber = 1;

    @JsonProperty("startTime")
    private Instant startTime;

    @JsonProperty("endTime")
    private Instant endTime;

    @JsonProperty("screens")
    private List<Screen> screens = new ArrayList<>();

    @JsonProperty("transitions")
    private List<ScreenTransition> transitions = new ArrayList<>();

    @JsonProperty("coverage")
    private CoverageMetrics coverage = CoverageMetrics.EMPTY;

    @JsonProperty("issues")
    private List<ExplorationIssue> issues = new ArrayList<>();

    @JsonProperty("policyInsights")
    private PolicyInsights policyInsights;

    @JsonProperty("errorMessage")
    private String errorMessage;

    public ExplorationResult() {}

    // ── Getters ──────────────────────────────────────────────────────────

    public String                 getSchemaVersion()  { return schemaVersion; }
    public String                 getPackageName()    { return packageName; }
    public ExplorationStatus      getStatus()         { return status; }
    public int                    getPassNumber()     { return passNumber; }
    public Instant                getStartTime()      { return startTime; }
    public Instant                getEndTime()        { return endTime; }
    public List<Screen>           getScreens()        { return screens; }
    public List<ScreenTransition> getTransitions()    { return transitions; }
    public CoverageMetrics        getCoverage()       { return coverage; }
    public List<ExplorationIssue> getIssues()         { return issues; }
    public PolicyInsights         getPolicyInsights() { return policyInsights; }
    public String                 getErrorMessage()   { return errorMessage; }

    @JsonIgnore
    public boolean isVersionSupported() {
        return CURRENT_SCHEMA_VERSION.equals(schemaVersion);
    }

    // ── Setters ──────────────────────────────────────────────────────────

    public void setSchemaVersion(String v)                   { this.schemaVersion = v; }
    public void setPackageName(String packageName)           { this.packageName = packageName; }
    public void setStatus(ExplorationStatus status)          { this.status = status; }
    public void setPassNumber(int passNumber)                { this.passNumber = passNumber; }
    public void setStartTime(Instant t)                      { this.startTime = t; }
    public void setEndTime(Instant t)                        { this.endTime = t; }
    public void setScreens(List<Screen> screens)             { this.screens = screens; }
    public void setTransitions(List<ScreenTransition> list)  { this.transitions = list; }
    public void setCoverage(CoverageMetrics coverage)        { this.coverage = coverage; }
    public void setIssues(List<ExplorationIssue> issues)     { this.issues = issues; }
    public void setPolicyInsights(PolicyInsights insights)   { this.policyInsights = insights; }
    public void setErrorMessage(String message)              { this.errorMessage = message; }

    @Override
    public String toString() {
        return String.format("ExplorationResult{pkg='%s', status=%s, pass=%d, screens=%d, issues=%d, %s}",
                packageName, status, passNumber, screens.size(), issues.size(), coverage.summary());
    }
}
