package autoexplore.device;

import java.time.Duration;

/**
 * Asks a person to unblock the run (log in, dismiss a system dialog, ...)
 * and waits a bounded time for the answer.
 */
public interface HelpRequester {

    /** Never asks; every request times out immediately. */
    HelpRequester NONE = (screenId, reason, timeout) -> false;

    /**
     * @param screenId screen the run is stuck on
     * @param reason   short human-readable cause
     * @param timeout  upper bound on the wait
     * @return {@code true} if someone reported the screen as handled in time
     */
    boolean requestHelp(String screenId, String reason, Duration timeout);
}
