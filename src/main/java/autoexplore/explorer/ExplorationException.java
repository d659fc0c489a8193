package autoexplore.explorer;

/**
 * Unchecked exception thrown at the engine's API boundary when a request
 * cannot be honoured: starting while a run is active, a configuration file
 * that cannot be loaded, a collaborator that is gone for good.
 *
 * <p>Problems met during a run are recorded as issues instead.
 */
public class ExplorationException extends RuntimeException {

    public ExplorationException(String msg) {
        super(msg);
    }

    public ExplorationException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
