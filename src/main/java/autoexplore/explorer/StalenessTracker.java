package autoexplore.explorer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * The single "are we making progress" signal of a run.
 *
 * <p>Three counters feed one {@link Level}:
 * <ul>
 *   <li>a streak of consecutive no-effect actions on the same screen id;
 *       landing on a different screen, or any discovery, starts a new
 *       streak at 1,</li>
 *   <li>actions since the last discovery, across screens,</li>
 *   <li>time since the last discovery (plateau).</li>
 * </ul>
 * The streak or the plateau make the run {@link Level#STUCK}; the
 * cross-screen count makes it {@link Level#RESTART}, which skips the gentle
 * recovery rungs.
 */
public class StalenessTracker {

    private static final Logger log = LoggerFactory.getLogger(StalenessTracker.class);

    public enum Level { FRESH, STUCK, RESTART }

    private final int stuckThreshold;
    private final int restartThreshold;
    private final Duration plateau;
    private final Clock clock;

    private String streakScreen;
    private int streak;
    private int actionsSinceDiscovery;
    private Instant lastDiscovery;

    public StalenessTracker(int stuckThreshold, int restartThreshold, Duration plateau, Clock clock) {
        this.stuckThreshold   = stuckThreshold;
        this.restartThreshold = restartThreshold;
        this.plateau          = plateau;
        this.clock            = clock;
        this.lastDiscovery    = clock.instant();
    }

    /** Records a new screen or newly revealed elements; the streak restarts at 1 on {@code screenId}. */
    public void recordDiscovery(String screenId) {
        streakScreen          = screenId;
        streak                = 1;
        actionsSinceDiscovery = 0;
        lastDiscovery         = clock.instant();
    }

    /**
     * Records an action that revealed nothing on {@code screenId}.
     *
     * @return the streak length on that screen after this action
     */
    public int recordNoProgress(String screenId) {
        if (screenId != null && screenId.equals(streakScreen)) {
            streak++;
        } else {
            streakScreen = screenId;
            streak = 1;
        }
        actionsSinceDiscovery++;
        log.debug("No progress on {}: streak {}/{}, {} since last discovery",
                screenId, streak, stuckThreshold, actionsSinceDiscovery);
        return streak;
    }

    public Level level() {
        if (actionsSinceDiscovery >= restartThreshold) {
            return Level.RESTART;
        }
        if (streak >= stuckThreshold) {
            return Level.STUCK;
        }
        if (actionsSinceDiscovery > 0 && Duration.between(lastDiscovery, clock.instant()).compareTo(plateau) >= 0) {
            return Level.STUCK;
        }
        return Level.FRESH;
    }

    /** Clears the streak after a recovery attempt so the next episode starts from zero. */
    public void recoveryAttempted() {
        streak = 0;
        actionsSinceDiscovery = 0;
        lastDiscovery = clock.instant();
    }

    public int getStreak()                { return streak; }
    public String getStreakScreen()       { return streakScreen; }
    public int getActionsSinceDiscovery() { return actionsSinceDiscovery; }
    public Instant getLastDiscovery()     { return lastDiscovery; }
}
