package autoexplore.learning;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Learned value of one {@code screenHash|actionKey} pair.
 *
 * <p>{@code feedback} is the pending human signal H(s,a), already clamped to
 * {@code [-3, 3]}; it is consumed by the next value update.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PolicyEntry {

    @JsonProperty("value")
    private double value;

    @JsonProperty("visits")
    private int visits;

    @JsonProperty("feedback")
    private int feedback;

    public PolicyEntry() {}

    public PolicyEntry(double value, int visits, int feedback) {
        this.value    = value;
        this.visits   = visits;
        this.feedback = feedback;
    }

    public PolicyEntry copy() {
        return new PolicyEntry(value, visits, feedback);
    }

    public double getValue()    { return value; }
    public int    getVisits()   { return visits; }
    public int    getFeedback() { return feedback; }

    public void setValue(double value)     { this.value = value; }
    public void setVisits(int visits)      { this.visits = visits; }
    public void setFeedback(int feedback)  { this.feedback = feedback; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PolicyEntry)) return false;
        PolicyEntry other = (PolicyEntry) o;
        return Double.compare(value, other.value) == 0 && visits == other.visits && feedback == other.feedback;
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Double.hashCode(value) + visits) + feedback;
    }

    @Override
    public String toString() {
        return String.format("PolicyEntry{q=%.3f, visits=%d, feedback=%d}", value, visits, feedback);
    }
}
