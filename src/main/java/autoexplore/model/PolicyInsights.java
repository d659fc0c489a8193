package autoexplore.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/** Snapshot of what the learning policy knows at the end of a run. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PolicyInsights {

    @JsonProperty("tableSize")
    private int tableSize;

    @JsonProperty("dangerousPatterns")
    private int dangerousPatterns;

    @JsonProperty("averageValue")
    private double averageValue;

    @JsonProperty("epsilon")
    private double epsilon;

    @JsonProperty("restartSuccessRate")
    private double restartSuccessRate;

    /** Best-valued state-action keys, highest first. */
    @JsonProperty("topActions")
    private List<String> topActions = new ArrayList<>();

    public PolicyInsights() {}

    public PolicyInsights(int tableSize, int dangerousPatterns, double averageValue, double epsilon,
                          double restartSuccessRate, List<String> topActions) {
        this.tableSize          = tableSize;
        this.dangerousPatterns  = dangerousPatterns;
        this.averageValue       = averageValue;
        this.epsilon            = epsilon;
        this.restartSuccessRate = restartSuccessRate;
        this.topActions         = new ArrayList<>(topActions);
    }

    public int          getTableSize()          { return tableSize; }
    public int          getDangerousPatterns()  { return dangerousPatterns; }
    public double       getAverageValue()       { return averageValue; }
    public double       getEpsilon()            { return epsilon; }
    public double       getRestartSuccessRate() { return restartSuccessRate; }
    public List<String> getTopActions()         { return topActions; }

    public void setTableSize(int size)               { this.tableSize = size; }
    public void setDangerousPatterns(int count)      { this.dangerousPatterns = count; }
    public void setAverageValue(double value)        { this.averageValue = value; }
    public void setEpsilon(double epsilon)           { this.epsilon = epsilon; }
    public void setRestartSuccessRate(double rate)   { this.restartSuccessRate = rate; }
    public void setTopActions(List<String> actions)  { this.topActions = actions; }
}
