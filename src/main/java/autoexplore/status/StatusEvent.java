package autoexplore.status;

import autoexplore.explorer.ExplorationStateMachine.ExplorerEvent;
import autoexplore.explorer.ExplorationStateMachine.ExplorerState;
import autoexplore.model.ExplorationStatus;

import java.time.Instant;

/**
 * One notification to the status sink.
 *
 * <p>Either a lifecycle change (the three state fields are set) or a
 * progress tick (they are {@code null}). Progress counters are always
 * filled in.
 */
public record StatusEvent(Instant timestamp,
                          ExplorerState oldState,
                          ExplorerState newState,
                          ExplorerEvent trigger,
                          int screensExplored,
                          int elementsExplored,
                          int frontierSize,
                          ExplorationStatus status,
                          String message) {

    public static StatusEvent transition(Instant timestamp, ExplorerState from, ExplorerState to,
                                         ExplorerEvent trigger, Progress progress) {
        return new StatusEvent(timestamp, from, to, trigger, progress.screens(), progress.elements(),
                progress.frontier(), progress.status(), null);
    }

    public static StatusEvent progress(Instant timestamp, Progress progress, String message) {
        return new StatusEvent(timestamp, null, null, null, progress.screens(), progress.elements(),
                progress.frontier(), progress.status(), message);
    }

    public boolean isTransition() {
        return newState != null;
    }

    /** Counters shared by both kinds of event. */
    public record Progress(int screens, int elements, int frontier, ExplorationStatus status) {}

    @Override
    public String toString() {
        if (isTransition()) {
            return String.format("StatusEvent{%s -> %s on %s, screens=%d, elements=%d, frontier=%d}",
                    oldState, newState, trigger, screensExplored, elementsExplored, frontierSize);
        }
        return String.format("StatusEvent{%s screens=%d, elements=%d, frontier=%d%s}",
                status, screensExplored, elementsExplored, frontierSize,
                message == null ? "" : ", " + message);
    }
}
