package autoexplore.learning;

import java.time.Instant;

/**
 * One clean-restart recovery attempt and how much had been learned when it happened.
 *
 * @param reason what triggered the restart, e.g. {@code STUCK_THRESHOLD} or {@code COVERAGE_PLATEAU}
 */
public record RestartRecoveryOutcome(Instant timestamp,
                                     boolean success,
                                     String reason,
                                     int tableSizeAtRestart,
                                     int screensKnownAtRestart) {
}
