package autoexplore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Aggregate discovery metrics, derived on demand from the run state.
 * Ratios are in {@code [0, 1]}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class CoverageMetrics {

    public static final CoverageMetrics EMPTY =
            new CoverageMetrics(0, 0, 0, 0, 0, 0, 0, List.of(), 0.0);

    private final int totalScreens;
    private final int screensFullyExplored;
    private final int totalElements;
    private final int elementsVisited;
    private final int totalScrollable;
    private final int containersScrolled;
    private final int unexploredBranches;
    private final List<String> frontier;
    private final double overallCoverage;

    @JsonCreator
    public CoverageMetrics(@JsonProperty("totalScreens") int totalScreens,
                           @JsonProperty("screensFullyExplored") int screensFullyExplored,
                           @JsonProperty("totalElements") int totalElements,
                           @JsonProperty("elementsVisited") int elementsVisited,
                           @JsonProperty("totalScrollable") int totalScrollable,
                           @JsonProperty("containersScrolled") int containersScrolled,
                           @JsonProperty("unexploredBranches") int unexploredBranches,
                           @JsonProperty("frontier") List<String> frontier,
                           @JsonProperty("overallCoverage") double overallCoverage) {
        this.totalScreens         = totalScreens;
        this.screensFullyExplored = screensFullyExplored;
        this.totalElements        = totalElements;
        this.elementsVisited      = elementsVisited;
        this.totalScrollable      = totalScrollable;
        this.containersScrolled   = containersScrolled;
        this.unexploredBranches   = unexploredBranches;
        this.frontier             = frontier == null ? List.of() : List.copyOf(frontier);
        this.overallCoverage      = overallCoverage;
    }

    @JsonProperty("totalScreens")         public int          getTotalScreens()         { return totalScreens; }
    @JsonProperty("screensFullyExplored") public int          getScreensFullyExplored() { return screensFullyExplored; }
    @JsonProperty("totalElements")        public int          getTotalElements()        { return totalElements; }
    @JsonProperty("elementsVisited")      public int          getElementsVisited()      { return elementsVisited; }
    @JsonProperty("totalScrollable")      public int          getTotalScrollable()      { return totalScrollable; }
    @JsonProperty("containersScrolled")   public int          getContainersScrolled()   { return containersScrolled; }
    @JsonProperty("unexploredBranches")   public int          getUnexploredBranches()   { return unexploredBranches; }
    @JsonProperty("frontier")             public List<String> getFrontier()             { return frontier; }
    @JsonProperty("overallCoverage")      public double       getOverallCoverage()      { return overallCoverage; }

    public double getScreenCoverage() {
        return totalScreens > 0 ? (double) screensFullyExplored / totalScreens : 0.0;
    }

    public double getElementCoverage() {
        return totalElements > 0 ? (double) elementsVisited / totalElements : 0.0;
    }

    public double getScrollCoverage() {
        return totalScrollable > 0 ? (double) containersScrolled / totalScrollable : 0.0;
    }

    public boolean isComplete(double targetCoverage) {
        return overallCoverage >= targetCoverage;
    }

    public String summary() {
        return String.format("Coverage: %d%% (%d/%d elements, %d/%d screens, %d unexplored branches)",
                (int) (overallCoverage * 100), elementsVisited, totalElements,
                screensFullyExplored, totalScreens, unexploredBranches);
    }

    @Override
    public String toString() {
        return summary();
    }
}
