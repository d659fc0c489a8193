package autoexplore.model;

/** Axis along which a scrollable container moves. */
public enum ScrollDirection {
    VERTICAL,
    HORIZONTAL,
    BOTH
}
