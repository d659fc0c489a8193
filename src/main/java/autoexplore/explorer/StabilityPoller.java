package autoexplore.explorer;

import autoexplore.device.CaptureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Objects;
import java.util.function.BiPredicate;
import java.util.function.BooleanSupplier;

/**
 * Bounded waits for the UI to settle.
 *
 * <p>All waiting goes through an injectable {@link Sleeper} and all time is
 * read from an injectable {@link Clock}, so tests run without wall-clock
 * delays. Every wait re-checks the cancellation flag between slices.
 */
public class StabilityPoller {

    private static final Logger log = LoggerFactory.getLogger(StabilityPoller.class);

    static final long SLICE_MS = 100L;

    @FunctionalInterface
    public interface Sleeper {
        Sleeper SYSTEM = Thread::sleep;

        void sleep(long millis) throws InterruptedException;
    }

    @FunctionalInterface
    public interface Sampler<T> {
        T sample() throws CaptureException;
    }

    /**
     * @param value   the last sample taken, {@code null} if none succeeded
     * @param stable  whether two consecutive samples agreed before the deadline
     * @param samples how many samples were taken
     */
    public record PollResult<T>(T value, boolean stable, int samples) {}

    private final Clock clock;
    private final Sleeper sleeper;
    private final BooleanSupplier cancelled;

    public StabilityPoller(Clock clock, Sleeper sleeper, BooleanSupplier cancelled) {
        this.clock     = Objects.requireNonNull(clock);
        this.sleeper   = Objects.requireNonNull(sleeper);
        this.cancelled = Objects.requireNonNull(cancelled);
    }

    /**
     * Sleeps up to {@code millis} in slices.
     *
     * @return {@code false} if cancelled or interrupted before the time was up
     */
    public boolean pause(long millis) {
        long deadline = clock.millis() + millis;
        while (true) {
            if (cancelled.getAsBoolean()) return false;
            long remaining = deadline - clock.millis();
            if (remaining <= 0) return true;
            try {
                sleeper.sleep(Math.min(SLICE_MS, remaining));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
    }

    /**
     * Samples until two consecutive samples are {@code same}, the timeout
     * passes, or the run is cancelled. A failed sample counts as a sample
     * that agrees with nothing.
     */
    public <T> PollResult<T> pollUntilStable(Sampler<T> sampler, BiPredicate<T, T> same,
                                             long timeoutMs, long intervalMs) {
        long deadline = clock.millis() + timeoutMs;
        T previous = null;
        T last = null;
        int samples = 0;
        while (!cancelled.getAsBoolean()) {
            T current;
            try {
                current = sampler.sample();
            } catch (CaptureException e) {
                log.debug("Sample failed while waiting for stability: {}", e.getMessage());
                current = null;
            }
            samples++;
            if (current != null) {
                if (previous != null && same.test(previous, current)) {
                    return new PollResult<>(current, true, samples);
                }
                last = current;
            }
            previous = current;
            long remaining = deadline - clock.millis();
            if (remaining <= 0 || !pause(Math.max(1, Math.min(intervalMs, remaining)))) {
                break;
            }
        }
        log.debug("UI did not settle within {} ms after {} samples", timeoutMs, samples);
        return new PollResult<>(last, false, samples);
    }
}
