package autoexplore.explorer;

import autoexplore.device.CaptureException;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;

public class StabilityPollerTest {

    private ManualClock clock;
    private AtomicBoolean cancelled;
    private StabilityPoller poller;
    private long slept;

    @BeforeMethod
    public void setUp() {
        clock = new ManualClock();
        cancelled = new AtomicBoolean();
        slept = 0;
        poller = new StabilityPoller(clock, millis -> {
            slept += millis;
            clock.advanceMillis(millis);
        }, cancelled::get);
    }

    private static StabilityPoller.Sampler<String> samples(String... values) {
        Deque<String> queue = new ArrayDeque<>(List.of(values));
        return () -> {
            String next = queue.isEmpty() ? values[values.length - 1] : queue.poll();
            if ("fail".equals(next)) throw new CaptureException("device busy");
            return next;
        };
    }

    @Test
    public void pause_sleepsWholeDurationInSlices() {
        assertThat(poller.pause(1_050)).isTrue();
        assertThat(slept).isEqualTo(1_050);
    }

    @Test
    public void pause_cancelled_returnsFalseImmediately() {
        cancelled.set(true);
        assertThat(poller.pause(1_000)).isFalse();
        assertThat(slept).isZero();
    }

    @Test
    public void pause_interrupted_restoresFlag() {
        StabilityPoller interrupting = new StabilityPoller(clock, millis -> {
            throw new InterruptedException();
        }, () -> false);
        try {
            assertThat(interrupting.pause(500)).isFalse();
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
    }

    @Test(description = "Returns as soon as two consecutive samples agree")
    public void pollUntilStable_settles() {
        StabilityPoller.PollResult<String> result = poller.pollUntilStable(
                samples("loading", "list", "list"), Objects::equals, 5_000, 200);

        assertThat(result.stable()).isTrue();
        assertThat(result.value()).isEqualTo("list");
        assertThat(result.samples()).isEqualTo(3);
        assertThat(slept).isEqualTo(400);
    }

    @Test
    public void pollUntilStable_neverSettles_returnsLastValueAtTimeout() {
        int[] n = {0};
        StabilityPoller.PollResult<String> result = poller.pollUntilStable(
                () -> "frame" + n[0]++, Objects::equals, 1_000, 250);

        assertThat(result.stable()).isFalse();
        assertThat(result.value()).startsWith("frame");
        assertThat(slept).isEqualTo(1_000);
    }

    @Test
    public void pollUntilStable_failedSampleBreaksAgreement() {
        StabilityPoller.PollResult<String> result = poller.pollUntilStable(
                samples("list", "fail", "list", "list"), Objects::equals, 5_000, 100);

        assertThat(result.stable()).isTrue();
        assertThat(result.samples()).isEqualTo(4);
    }

    @Test
    public void pollUntilStable_allSamplesFail_returnsNull() {
        StabilityPoller.PollResult<String> result = poller.pollUntilStable(
                samples("fail"), Objects::equals, 500, 100);

        assertThat(result.value()).isNull();
        assertThat(result.stable()).isFalse();
    }

    @Test
    public void pollUntilStable_cancelled_takesNoSample() {
        cancelled.set(true);
        StabilityPoller.PollResult<String> result = poller.pollUntilStable(
                samples("list"), Objects::equals, 5_000, 100);

        assertThat(result.samples()).isZero();
        assertThat(result.value()).isNull();
    }
}
