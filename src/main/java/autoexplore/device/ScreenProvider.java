package autoexplore.device;

import autoexplore.model.Screen;

/**
 * Source of structured snapshots of the live UI.
 *
 * <p>Implementations must be idempotent and free of side effects: capturing
 * twice in a row without acting must describe the same screen.
 */
public interface ScreenProvider {

    /**
     * Captures the screen currently shown on the device.
     *
     * @return a fresh snapshot; its {@link Screen#getPackageName()} tells the
     *         engine whether the target app is still in front
     * @throws CaptureException if the UI could not be read this time
     */
    Screen captureCurrentScreen() throws CaptureException;
}
