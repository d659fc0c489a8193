package autoexplore.explorer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one exploration run.
 *
 * <pre>
 * IDLE -> INITIALIZING -> EXPLORING <-> PAUSED
 *                         EXPLORING -> STUCK -> EXPLORING | COMPLETING
 *                         EXPLORING -> COMPLETING -> COMPLETED
 * </pre>
 *
 * <p>Every event is accepted in every state; events that mean nothing in
 * the current state leave it unchanged. Each actual change is reported once
 * to the {@link TransitionListener} with the old state, the new state and
 * the triggering event.
 *
 * <p>The machine does not decide when the run is stuck; the engine sends
 * {@link ExplorerEvent#STUCK_THRESHOLD_REACHED} when its staleness signal
 * fires. The machine does count failed recovery episodes and gives up the
 * run after {@value #MAX_FAILED_RECOVERIES} in a row.
 */
public class ExplorationStateMachine {

    private static final Logger log = LoggerFactory.getLogger(ExplorationStateMachine.class);

    static final int MAX_FAILED_RECOVERIES = 3;

    public enum ExplorerState {
        IDLE,
        INITIALIZING,
        EXPLORING,
        PAUSED,
        /** Checkpoint that always routes to recovery. */
        STUCK,
        COMPLETING,
        COMPLETED
    }

    public enum ExplorerEvent {
        START_REQUESTED,
        INITIALIZATION_COMPLETE,
        STOP_REQUESTED,
        ELEMENT_TAPPED,
        NEW_SCREEN_DISCOVERED,
        NEW_ELEMENTS_FOUND,
        NO_PROGRESS_DETECTED,
        STUCK_THRESHOLD_REACHED,
        RECOVERY_SUCCEEDED,
        RECOVERY_FAILED,
        PAUSE_REQUESTED,
        RESUME_REQUESTED,
        USER_HELPED,
        BUDGET_EXHAUSTED,
        COVERAGE_REACHED,
        QUEUE_EXHAUSTED,
        RUN_FAILED
    }

    @FunctionalInterface
    public interface TransitionListener {
        void onTransition(ExplorerState from, ExplorerState to, ExplorerEvent event);
    }

    /** Counters for progress reporting. */
    public record Statistics(ExplorerState state, int elementsTapped, int screensDiscovered,
                             int noProgressEvents, int failedRecoveries) {}

    private static final Set<ExplorerState> ACTIVE =
            EnumSet.of(ExplorerState.INITIALIZING, ExplorerState.EXPLORING, ExplorerState.STUCK);

    private volatile ExplorerState state = ExplorerState.IDLE;
    private TransitionListener listener = (from, to, event) -> { };

    private int elementsTapped;
    private int screensDiscovered;
    private int noProgressEvents;
    private int failedRecoveries;

    public void setTransitionListener(TransitionListener listener) {
        this.listener = listener == null ? (from, to, event) -> { } : listener;
    }

    public ExplorerState getState() {
        return state;
    }

    /**
     * Applies {@code event} and returns the resulting state.
     */
    public synchronized ExplorerState processEvent(ExplorerEvent event) {
        ExplorerState current = state;
        ExplorerState next = switch (current) {
            case IDLE         -> onIdle(event);
            case INITIALIZING -> onInitializing(event);
            case EXPLORING    -> onExploring(event);
            case PAUSED       -> onPaused(event);
            case STUCK        -> onStuck(event);
            case COMPLETING   -> ExplorerState.COMPLETED;
            case COMPLETED    -> onCompleted(event);
        };

        if (next != current) {
            log.info("State transition: {} -> {} (event: {})", current, next, event);
            state = next;
            try {
                listener.onTransition(current, next, event);
            } catch (RuntimeException e) {
                log.warn("Transition listener failed: {}", e.getMessage());
            }
        }
        return next;
    }

    // ── State handlers ────────────────────────────────────────────────────

    private ExplorerState onIdle(ExplorerEvent event) {
        if (event == ExplorerEvent.START_REQUESTED) {
            resetCounters();
            return ExplorerState.INITIALIZING;
        }
        return ExplorerState.IDLE;
    }

    private ExplorerState onInitializing(ExplorerEvent event) {
        return switch (event) {
            case INITIALIZATION_COMPLETE -> ExplorerState.EXPLORING;
            case STOP_REQUESTED -> ExplorerState.IDLE;
            case RUN_FAILED -> ExplorerState.COMPLETING;
            default -> ExplorerState.INITIALIZING;
        };
    }

    private ExplorerState onExploring(ExplorerEvent event) {
        switch (event) {
            case NEW_SCREEN_DISCOVERED:
                screensDiscovered++;
                failedRecoveries = 0;
                return ExplorerState.EXPLORING;
            case NEW_ELEMENTS_FOUND:
                failedRecoveries = 0;
                return ExplorerState.EXPLORING;
            case ELEMENT_TAPPED:
                elementsTapped++;
                return ExplorerState.EXPLORING;
            case NO_PROGRESS_DETECTED:
                noProgressEvents++;
                return ExplorerState.EXPLORING;
            case STUCK_THRESHOLD_REACHED:
                return ExplorerState.STUCK;
            case PAUSE_REQUESTED:
                return ExplorerState.PAUSED;
            case STOP_REQUESTED:
            case BUDGET_EXHAUSTED:
            case COVERAGE_REACHED:
            case QUEUE_EXHAUSTED:
            case RUN_FAILED:
                return ExplorerState.COMPLETING;
            default:
                return ExplorerState.EXPLORING;
        }
    }

    private ExplorerState onPaused(ExplorerEvent event) {
        return switch (event) {
            case RESUME_REQUESTED -> ExplorerState.EXPLORING;
            case STOP_REQUESTED, RUN_FAILED -> ExplorerState.COMPLETING;
            default -> ExplorerState.PAUSED;
        };
    }

    private ExplorerState onStuck(ExplorerEvent event) {
        switch (event) {
            case RECOVERY_SUCCEEDED:
            case USER_HELPED:
                failedRecoveries = 0;
                return ExplorerState.EXPLORING;
            case NEW_SCREEN_DISCOVERED:
                screensDiscovered++;
                failedRecoveries = 0;
                return ExplorerState.EXPLORING;
            case RECOVERY_FAILED:
                failedRecoveries++;
                log.warn("Recovery failed: {} / {}", failedRecoveries, MAX_FAILED_RECOVERIES);
                // the failed branch is dropped; carry on with the rest unless this keeps happening
                return failedRecoveries >= MAX_FAILED_RECOVERIES ? ExplorerState.COMPLETING : ExplorerState.EXPLORING;
            case STOP_REQUESTED:
            case RUN_FAILED:
            case BUDGET_EXHAUSTED:
                return ExplorerState.COMPLETING;
            default:
                return ExplorerState.STUCK;
        }
    }

    private ExplorerState onCompleted(ExplorerEvent event) {
        if (event == ExplorerEvent.START_REQUESTED) {
            resetCounters();
            return ExplorerState.INITIALIZING;
        }
        return ExplorerState.COMPLETED;
    }

    // ── Queries ───────────────────────────────────────────────────────────

    /** Initializing, exploring or stuck. */
    public boolean isActive() {
        return ACTIVE.contains(state);
    }

    public boolean canStart() {
        ExplorerState s = state;
        return s == ExplorerState.IDLE || s == ExplorerState.COMPLETED;
    }

    public synchronized Statistics getStatistics() {
        return new Statistics(state, elementsTapped, screensDiscovered, noProgressEvents, failedRecoveries);
    }

    /** Back to {@link ExplorerState#IDLE} without notifying the listener. */
    public synchronized void reset() {
        log.info("Resetting state machine to IDLE");
        resetCounters();
        state = ExplorerState.IDLE;
    }

    private void resetCounters() {
        elementsTapped    = 0;
        screensDiscovered = 0;
        noProgressEvents  = 0;
        failedRecoveries  = 0;
    }
}
