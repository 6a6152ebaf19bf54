package com.elime.service.correction;

/**
 * Keyboard commands understood by the correction sessions. Which physical key
 * produces which command is up to the display.
 */
public enum Key {
    UP,
    DOWN,
    LEFT,
    RIGHT,
    /** Cycle the selection in coarse mode, advance in fine mode. */
    NEXT,
    CREATE,
    DELETE,
    DESELECT,
    COMMIT,
    QUIT,
    SPEED,
    STYLE,
    ZOOM_IN,
    ZOOM_OUT,
    OTHER
}
