package autoexplore.model;

import java.time.Instant;

/**
 * One observed screen change and the element that caused it.
 *
 * @param fromScreenId     screen the action was taken on
 * @param toScreenId       screen observed afterwards
 * @param triggerElementId element (or container) id that was activated
 * @param timestamp        when the destination was observed
 */
public record ScreenTransition(String fromScreenId, String toScreenId, String triggerElementId, Instant timestamp) {
}
