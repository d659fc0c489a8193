package autoexplore.model;

/**
 * Observed effect of activating a clickable element, recorded after the
 * engine re-observes the screen.
 */
public enum ClickableActionType {
    UNKNOWN,
    NAVIGATION,
    TOGGLE,
    EXPAND_COLLAPSE,
    DIALOG,
    MENU,
    BACK,
    EXTERNAL,
    CLOSES_APP,
    NO_EFFECT,
    TRIGGERS_DIALOG
}
