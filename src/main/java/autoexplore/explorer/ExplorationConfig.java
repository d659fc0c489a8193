package autoexplore.explorer;

import autoexplore.model.ExplorationGoal;
import autoexplore.model.ExplorationMode;
import autoexplore.model.ExplorationStrategy;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * Options for one exploration run. Immutable; obtain one from a preset or
 * from {@link #builder()}.
 *
 * <pre>{@code
 * ExplorationConfig cfg = ExplorationConfig.builder()
 *         .strategy(ExplorationStrategy.ADAPTIVE)
 *         .goal(ExplorationGoal.COMPLETE_COVERAGE)
 *         .targetCoverage(0.8)
 *         .build();
 * }</pre>
 */
@JsonPropertyOrder(alphabetic = true)
public final class ExplorationConfig {

    private final ExplorationMode mode;
    private final ExplorationStrategy strategy;
    private final ExplorationGoal goal;
    private final int maxDepth;
    private final int maxScreens;
    private final int maxElements;
    private final long maxDurationMs;
    private final int maxLaunchRetries;
    private final long actionDelayMs;
    private final long transitionWaitMs;
    private final long scrollDelayMs;
    private final int maxScrollsPerContainer;
    private final long stabilizationWaitMs;
    private final double targetCoverage;
    private final boolean stopAtTargetCoverage;
    private final long maxDurationForCoverageMs;
    private final int maxPasses;
    private final boolean backtrackAfterNewScreen;
    private final boolean nonDestructive;

    private ExplorationConfig(Builder b) {
        this.mode                     = Objects.requireNonNull(b.mode, "mode must not be null");
        this.strategy                 = Objects.requireNonNull(b.strategy, "strategy must not be null");
        this.goal                     = Objects.requireNonNull(b.goal, "goal must not be null");
        this.maxDepth                 = b.maxDepth;
        this.maxScreens               = b.maxScreens;
        this.maxElements              = b.maxElements;
        this.maxDurationMs            = b.maxDurationMs;
        this.maxLaunchRetries         = b.maxLaunchRetries;
        this.actionDelayMs            = b.actionDelayMs;
        this.transitionWaitMs         = b.transitionWaitMs;
        this.scrollDelayMs            = b.scrollDelayMs;
        this.maxScrollsPerContainer   = b.maxScrollsPerContainer;
        this.stabilizationWaitMs      = b.stabilizationWaitMs;
        this.targetCoverage           = b.targetCoverage;
        this.stopAtTargetCoverage     = b.stopAtTargetCoverage;
        this.maxDurationForCoverageMs = b.maxDurationForCoverageMs;
        this.maxPasses                = b.maxPasses;
        this.backtrackAfterNewScreen  = b.backtrackAfterNewScreen;
        this.nonDestructive           = b.nonDestructive;
        if (targetCoverage < 0.0 || targetCoverage > 1.0) {
            throw new IllegalArgumentException("targetCoverage must be in [0, 1]: " + targetCoverage);
        }
    }

    // ── Presets ───────────────────────────────────────────────────────────

    public static ExplorationConfig defaults() {
        return builder().build();
    }

    /** Navigation-only survey with tight limits. */
    public static ExplorationConfig quickScan() {
        return builder()
                .mode(ExplorationMode.QUICK)
                .goal(ExplorationGoal.QUICK_SCAN)
                .maxDepth(3)
                .maxScreens(20)
                .maxDurationMs(5 * 60_000L)
                .build();
    }

    /** Every element, every container, until coverage or the time cap. */
    public static ExplorationConfig deepMap() {
        return builder()
                .mode(ExplorationMode.DEEP)
                .goal(ExplorationGoal.COMPLETE_COVERAGE)
                .maxDepth(10)
                .maxScreens(100)
                .maxDurationMs(30 * 60_000L)
                .backtrackAfterNewScreen(false)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** A builder pre-filled with this configuration. */
    public Builder toBuilder() {
        return new Builder()
                .mode(mode).strategy(strategy).goal(goal)
                .maxDepth(maxDepth).maxScreens(maxScreens).maxElements(maxElements)
                .maxDurationMs(maxDurationMs).maxLaunchRetries(maxLaunchRetries)
                .actionDelayMs(actionDelayMs).transitionWaitMs(transitionWaitMs)
                .scrollDelayMs(scrollDelayMs).maxScrollsPerContainer(maxScrollsPerContainer)
                .stabilizationWaitMs(stabilizationWaitMs)
                .targetCoverage(targetCoverage).stopAtTargetCoverage(stopAtTargetCoverage)
                .maxDurationForCoverageMs(maxDurationForCoverageMs).maxPasses(maxPasses)
                .backtrackAfterNewScreen(backtrackAfterNewScreen).nonDestructive(nonDestructive);
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    public ExplorationMode     getMode()                     { return mode; }
    public ExplorationStrategy getStrategy()                 { return strategy; }
    public ExplorationGoal     getGoal()                     { return goal; }
    public int                 getMaxDepth()                 { return maxDepth; }
    public int                 getMaxScreens()               { return maxScreens; }
    public int                 getMaxElements()              { return maxElements; }
    public long                getMaxDurationMs()            { return maxDurationMs; }
    public int                 getMaxLaunchRetries()         { return maxLaunchRetries; }
    public long                getActionDelayMs()            { return actionDelayMs; }
    public long                getTransitionWaitMs()         { return transitionWaitMs; }
    public long                getScrollDelayMs()            { return scrollDelayMs; }
    public int                 getMaxScrollsPerContainer()   { return maxScrollsPerContainer; }
    public long                getStabilizationWaitMs()      { return stabilizationWaitMs; }
    public double              getTargetCoverage()           { return targetCoverage; }
    public boolean             isStopAtTargetCoverage()      { return stopAtTargetCoverage; }
    public long                getMaxDurationForCoverageMs() { return maxDurationForCoverageMs; }
    public int                 getMaxPasses()                { return maxPasses; }
    public boolean             isBacktrackAfterNewScreen()   { return backtrackAfterNewScreen; }
    public boolean             isNonDestructive()            { return nonDestructive; }

    /** Wall-clock budget for the run: the coverage cap for coverage goals, otherwise the plain duration. */
    public long effectiveDurationMs() {
        return goal == ExplorationGoal.COMPLETE_COVERAGE ? maxDurationForCoverageMs : maxDurationMs;
    }

    @Override
    public String toString() {
        return String.format("ExplorationConfig{mode=%s, strategy=%s, goal=%s, depth=%d, screens=%d, elements=%d, duration=%dms}",
                mode, strategy, goal, maxDepth, maxScreens, maxElements, effectiveDurationMs());
    }

    // ── Builder ───────────────────────────────────────────────────────────

    public static final class Builder {

        private ExplorationMode     mode                     = ExplorationMode.NORMAL;
        private ExplorationStrategy strategy                 = ExplorationStrategy.SCREEN_FIRST;
        private ExplorationGoal     goal                     = ExplorationGoal.QUICK_SCAN;
        private int                 maxDepth                 = 5;
        private int                 maxScreens               = 50;
        private int                 maxElements              = 500;
        private long                maxDurationMs            = 10 * 60_000L;
        private int                 maxLaunchRetries         = 3;
        private long                actionDelayMs            = 1_000L;
        private long                transitionWaitMs         = 2_500L;
        private long                scrollDelayMs            = 500L;
        private int                 maxScrollsPerContainer   = 5;
        private long                stabilizationWaitMs      = 3_000L;
        private double              targetCoverage           = 0.90;
        private boolean             stopAtTargetCoverage     = true;
        private long                maxDurationForCoverageMs = 30 * 60_000L;
        private int                 maxPasses                = 1;
        private boolean             backtrackAfterNewScreen  = true;
        private boolean             nonDestructive           = true;

        private Builder() {}

        public Builder mode(ExplorationMode mode)                  { this.mode = mode; return this; }
        public Builder strategy(ExplorationStrategy strategy)      { this.strategy = strategy; return this; }
        public Builder goal(ExplorationGoal goal)                  { this.goal = goal; return this; }
        public Builder maxDepth(int v)                             { this.maxDepth = v; return this; }
        public Builder maxScreens(int v)                           { this.maxScreens = v; return this; }
        public Builder maxElements(int v)                          { this.maxElements = v; return this; }
        public Builder maxDurationMs(long v)                       { this.maxDurationMs = v; return this; }
        public Builder maxLaunchRetries(int v)                     { this.maxLaunchRetries = v; return this; }
        public Builder actionDelayMs(long v)                       { this.actionDelayMs = v; return this; }
        public Builder transitionWaitMs(long v)                    { this.transitionWaitMs = v; return this; }
        public Builder scrollDelayMs(long v)                       { this.scrollDelayMs = v; return this; }
        public Builder maxScrollsPerContainer(int v)               { this.maxScrollsPerContainer = v; return this; }
        public Builder stabilizationWaitMs(long v)                 { this.stabilizationWaitMs = v; return this; }
        public Builder stopAtTargetCoverage(boolean v)             { this.stopAtTargetCoverage = v; return this; }
        public Builder maxDurationForCoverageMs(long v)            { this.maxDurationForCoverageMs = v; return this; }
        public Builder maxPasses(int v)                            { this.maxPasses = v; return this; }
        public Builder backtrackAfterNewScreen(boolean v)          { this.backtrackAfterNewScreen = v; return this; }
        public Builder nonDestructive(boolean v)                   { this.nonDestructive = v; return this; }

        /** Target coverage ratio in {@code [0, 1]} (default 0.90). */
        public Builder targetCoverage(double v) {
            this.targetCoverage = v;
            return this;
        }

        /** Same as {@link #targetCoverage(double)} with a percentage. */
        public Builder targetCoveragePct(int pct) {
            return targetCoverage(pct / 100.0);
        }

        public ExplorationConfig build() {
            return new ExplorationConfig(this);
        }
    }
}
