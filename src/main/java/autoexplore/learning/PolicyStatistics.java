package autoexplore.learning;

public record PolicyStatistics(int tableSize,
                               int totalVisits,
                               int dangerousPatterns,
                               double averageValue,
                               double maxValue,
                               double minValue,
                               double epsilon,
                               int totalActions,
                               int screensKnown,
                               int restartAttempts,
                               double restartSuccessRate) {

    public String summary() {
        return String.format("entries=%d visits=%d dangerous=%d avgQ=%.3f [%.3f..%.3f] eps=%.3f actions=%d screens=%d restarts=%d (%.0f%% ok)",
                tableSize, totalVisits, dangerousPatterns, averageValue, minValue, maxValue,
                epsilon, totalActions, screensKnown, restartAttempts, restartSuccessRate * 100);
    }
}
