package autoexplore.model;

/**
 * One queued unit of work.
 *
 * <p>Immutable. A transient failure is handled by re-queuing a copy from
 * {@link #requeued()}, which halves the priority and bumps the attempt count.
 *
 * @param type      what to do
 * @param screenId  screen on which the target lives
 * @param elementId clickable element or scroll container id, {@code null} for
 *                  {@link ExplorationTargetType#NAVIGATE_TO_SCREEN}
 * @param priority  higher is taken first
 * @param bounds    rectangle for the gesture, may be {@code null}
 * @param attempts  how many times this target was already tried
 */
public record ExplorationTarget(ExplorationTargetType type,
                                String screenId,
                                String elementId,
                                int priority,
                                ElementBounds bounds,
                                int attempts) {

    public static ExplorationTarget tap(String screenId, ClickableElement element, int priority) {
        return new ExplorationTarget(ExplorationTargetType.TAP_ELEMENT, screenId,
                element.getElementId(), priority, element.getBounds(), 0);
    }

    public static ExplorationTarget scroll(String screenId, ScrollableContainer container, int priority) {
        return new ExplorationTarget(ExplorationTargetType.SCROLL_CONTAINER, screenId,
                container.getElementId(), priority, container.getBounds(), 0);
    }

    public static ExplorationTarget navigate(String screenId, int priority) {
        return new ExplorationTarget(ExplorationTargetType.NAVIGATE_TO_SCREEN, screenId,
                null, priority, null, 0);
    }

    /** Composite key of the targeted element, or {@code null} for navigation targets. */
    public String compositeKey() {
        return elementId == null ? null : ScreenIdentity.compositeKey(screenId, elementId);
    }

    public ExplorationTarget requeued() {
        return new ExplorationTarget(type, screenId, elementId, priority / 2, bounds, attempts + 1);
    }
}
