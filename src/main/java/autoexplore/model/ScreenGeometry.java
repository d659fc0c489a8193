package autoexplore.model;

/**
 * Device display size and the system bar bands that are never tapped.
 */
public record ScreenGeometry(int width, int height, int statusBarHeight, int navBarHeight) {

    public static final ScreenGeometry DEFAULT = new ScreenGeometry(1080, 2400, 80, 130);
}
