package autoexplore.device;

/**
 * Executes gestures on the device.
 *
 * <p>Every method reports whether the gesture was dispatched. Success says
 * nothing about the effect; the engine always re-observes through the
 * {@link ScreenProvider}.
 */
public interface Actuator {

    enum Direction { UP, DOWN, LEFT, RIGHT }

    boolean tap(int x, int y);

    /** Scrolls the content under {@code (x, y)} so that content further in {@code direction} comes into view. */
    boolean scroll(int x, int y, Direction direction);

    boolean pressBack();

    /**
     * Brings the target app to the front.
     *
     * @param forceRestart stop the app first so it starts from its launch screen
     */
    boolean launchApp(String packageName, boolean forceRestart);
}
