package autoexplore.frontier;

/**
 * What one call to {@link ElementQueueManager#queueScreen} did with a screen.
 */
public record QueueResult(int elementsQueued,
                          int scrollContainersQueued,
                          int skippedVisited,
                          int skippedExcluded,
                          int skippedQuickMode,
                          int skippedDeadEnd,
                          boolean skippedAlreadyQueued,
                          int skippedLowPriority) {

    static QueueResult alreadyQueued() {
        return new QueueResult(0, 0, 0, 0, 0, 0, true, 0);
    }

    static QueueResult lowPriority(int clickables) {
        return new QueueResult(0, 0, 0, 0, 0, 0, false, clickables);
    }

    public int totalQueued() {
        return elementsQueued + scrollContainersQueued;
    }

    @Override
    public String toString() {
        if (skippedAlreadyQueued) return "QueueResult{already queued}";
        return String.format("QueueResult{queued=%d+%d scrolls, skipped visited=%d excluded=%d quick=%d deadEnd=%d lowPriority=%d}",
                elementsQueued, scrollContainersQueued, skippedVisited, skippedExcluded,
                skippedQuickMode, skippedDeadEnd, skippedLowPriority);
    }
}
