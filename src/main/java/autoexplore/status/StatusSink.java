package autoexplore.status;

/**
 * Receiver of lifecycle transitions and progress ticks. Fire-and-forget:
 * the engine never waits on, or reacts to, a sink.
 */
@FunctionalInterface
public interface StatusSink {

    StatusSink NOOP = event -> { };

    void publish(StatusEvent event);
}
