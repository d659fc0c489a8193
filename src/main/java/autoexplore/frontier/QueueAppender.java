package autoexplore.frontier;

import autoexplore.model.ExplorationTarget;

/**
 * Write-only side of the exploration queue, for components that produce
 * targets but must not consume or reorder them.
 */
public interface QueueAppender {

    void add(ExplorationTarget target);
}
