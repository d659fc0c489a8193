package autoexplore.device;

/**
 * Thrown by a {@link ScreenProvider} when the current screen could not be
 * captured. Treated as transient: the engine retries with backoff.
 */
public class CaptureException extends Exception {

    public CaptureException(String msg) {
        super(msg);
    }

    public CaptureException(String msg, Throwable cause) {
        super(msg, cause);
    }
}
