package autoexplore.status;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fans every event out to any number of subscribed sinks.
 *
 * <p>A sink that throws is logged and skipped; the remaining sinks still see
 * the event and the publisher never sees the failure.
 */
public class StatusBus implements StatusSink {

    private static final Logger log = LoggerFactory.getLogger(StatusBus.class);

    private final List<StatusSink> sinks = new CopyOnWriteArrayList<>();

    public StatusBus subscribe(StatusSink sink) {
        sinks.add(sink);
        return this;
    }

    public void unsubscribe(StatusSink sink) {
        sinks.remove(sink);
    }

    public int subscriberCount() {
        return sinks.size();
    }

    @Override
    public void publish(StatusEvent event) {
        for (StatusSink sink : sinks) {
            try {
                sink.publish(event);
            } catch (RuntimeException e) {
                log.warn("Status sink {} failed on {}: {}", sink, event, e.getMessage());
            }
        }
    }
}
